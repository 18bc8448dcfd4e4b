package github.sarthakdev143.photo_packager.service.impl;

import github.sarthakdev143.photo_packager.integration.image.DecodedImage;
import github.sarthakdev143.photo_packager.integration.image.ImageDecoder;
import github.sarthakdev143.photo_packager.integration.image.ImageEncoder;
import github.sarthakdev143.photo_packager.integration.image.ImageResizer;
import github.sarthakdev143.photo_packager.model.CategorySettings;
import github.sarthakdev143.photo_packager.model.FileOutcome;
import github.sarthakdev143.photo_packager.model.JobSpec;
import github.sarthakdev143.photo_packager.model.OutputCategory;
import github.sarthakdev143.photo_packager.model.OutputFormat;
import github.sarthakdev143.photo_packager.model.SourceEntry;
import github.sarthakdev143.photo_packager.service.FileSystemGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
public class DerivativeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(DerivativeGenerator.class);

    static final String RAW_SOURCE = "raw source";
    static final String NOT_ACCEPTED = "source format not accepted by category";

    private final ImageDecoder imageDecoder;
    private final ImageResizer imageResizer;
    private final ImageEncoder imageEncoder;
    private final AdaptiveQualitySearch qualitySearch;
    private final MetadataPolicyEngine metadataPolicyEngine;

    public DerivativeGenerator(
            ImageDecoder imageDecoder,
            ImageResizer imageResizer,
            ImageEncoder imageEncoder,
            AdaptiveQualitySearch qualitySearch,
            MetadataPolicyEngine metadataPolicyEngine) {
        this.imageDecoder = imageDecoder;
        this.imageResizer = imageResizer;
        this.imageEncoder = imageEncoder;
        this.qualitySearch = qualitySearch;
        this.metadataPolicyEngine = metadataPolicyEngine;
    }

    /**
     * Produces every enabled derivative for one source. The source is decoded once; each
     * category succeeds or fails on its own.
     */
    public List<FileOutcome> generate(SourceEntry entry, JobSpec jobSpec, FileSystemGateway gateway) {
        List<OutputCategory> categories = jobSpec.enabledDerivatives();
        List<FileOutcome> outcomes = new ArrayList<>(categories.size());
        if (categories.isEmpty()) {
            return outcomes;
        }
        if (entry.isRaw()) {
            categories.forEach(category -> outcomes.add(FileOutcome.skipped(entry, category, RAW_SOURCE)));
            return outcomes;
        }

        List<OutputCategory> accepted = new ArrayList<>();
        for (OutputCategory category : categories) {
            if (jobSpec.settingsFor(category).accepts(entry.extension())) {
                accepted.add(category);
            } else {
                outcomes.add(FileOutcome.skipped(entry, category, NOT_ACCEPTED));
            }
        }
        if (accepted.isEmpty()) {
            return outcomes;
        }

        long decodeStarted = System.nanoTime();
        DecodedImage decoded;
        try {
            decoded = imageDecoder.decode(entry.path());
        } catch (Exception e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - decodeStarted);
            String reason = "decode failed: " + describe(e);
            logger.warn("Could not decode {}: {}", entry.path(), describe(e));
            accepted.forEach(category -> outcomes.add(FileOutcome.failed(entry, category, reason, elapsed)));
            return outcomes;
        }

        MetadataDecision metadata = metadataPolicyEngine.apply(decoded.exif(), jobSpec.metadataPolicy());
        for (OutputCategory category : accepted) {
            outcomes.add(renderCategory(entry, category, jobSpec, gateway, decoded, metadata));
        }
        return outcomes;
    }

    FileOutcome renderCategory(
            SourceEntry entry,
            OutputCategory category,
            JobSpec jobSpec,
            FileSystemGateway gateway,
            DecodedImage decoded,
            MetadataDecision metadata) {
        long started = System.nanoTime();
        CategorySettings settings = jobSpec.settingsFor(category);
        OutputFormat format = category.format();
        List<String> warnings = new ArrayList<>(decoded.warnings());
        warnings.addAll(metadata.warnings());

        try {
            BufferedImage image = decoded.image();
            if (category.isCompressed()) {
                PixelBudget.Size size = PixelBudget.fit(decoded.width(), decoded.height(), settings.targetPixels());
                image = imageResizer.resize(image, size.width(), size.height());
            }

            EncodedDerivative encoded = qualitySearch.encode(image, format, settings, category.isCompressed());
            warnings.addAll(encoded.warnings());
            byte[] bytes = withMetadata(encoded.bytes(), format, metadata, warnings);

            Path target = jobSpec.categoryFolder(category)
                    .resolve(entry.outputFileName(jobSpec.shootBaseName(), format.extension()));
            gateway.writeBytes(target, bytes);

            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            logger.debug(
                    "Wrote {} {}x{} quality={} bytes={}",
                    target,
                    image.getWidth(),
                    image.getHeight(),
                    encoded.quality(),
                    bytes.length);
            return FileOutcome.success(entry, category, target, elapsed, warnings);
        } catch (Exception e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            logger.warn("Could not produce {} for {}: {}", category, entry.path(), describe(e));
            return FileOutcome.failed(entry, category, "encode failed: " + describe(e), elapsed, warnings);
        }
    }

    private byte[] withMetadata(byte[] encoded, OutputFormat format, MetadataDecision metadata, List<String> warnings) {
        if (!metadata.embedsMetadata()) {
            return encoded;
        }
        if (format != OutputFormat.JPEG) {
            warnings.add(format + " output is written without EXIF metadata.");
            return encoded;
        }
        try {
            return imageEncoder.embedExif(encoded, metadata.exif());
        } catch (IOException e) {
            warnings.add("EXIF metadata could not be embedded, output carries none: " + e.getMessage());
            logger.warn("EXIF embed failed", e);
            return encoded;
        }
    }

    private String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
