package github.sarthakdev143.photo_packager.service.impl;

import github.sarthakdev143.photo_packager.model.FileOutcome;
import github.sarthakdev143.photo_packager.model.JobSpec;
import github.sarthakdev143.photo_packager.model.OriginalsAction;
import github.sarthakdev143.photo_packager.model.OutputCategory;
import github.sarthakdev143.photo_packager.model.SourceEntry;
import github.sarthakdev143.photo_packager.service.FileSystemGateway;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Exports source files into {@code Export Originals} or {@code RAW Files}. A move is a verified copy
 * followed by deletion of the source; the source is deleted only after the copy matched it.
 */
@Component
public class OriginalsHandler {

    private static final Logger logger = LoggerFactory.getLogger(OriginalsHandler.class);
    private static final String PARTIAL_SUFFIX = ".partial";

    /**
     * Returns {@code null} when the action is {@link OriginalsAction#SKIP_EXPORT}: the category is
     * not attempted at all.
     */
    public FileOutcome handle(
            SourceEntry entry,
            OutputCategory category,
            OriginalsAction action,
            JobSpec jobSpec,
            FileSystemGateway gateway) {
        if (action == OriginalsAction.SKIP_EXPORT) {
            return null;
        }
        if (action == OriginalsAction.LEAVE) {
            return FileOutcome.success(entry, category, null, Duration.ZERO, List.of());
        }

        long started = System.nanoTime();
        Path target = jobSpec.categoryFolder(category)
                .resolve(entry.outputFileName(jobSpec.shootBaseName(), originalExtension(entry)));

        if (gateway.isDryRun()) {
            return simulate(entry, category, action, target, gateway, started);
        }

        Path partial = target.resolveSibling(target.getFileName() + PARTIAL_SUFFIX);
        try {
            gateway.copy(entry.path(), partial);
            verifyCopy(entry.path(), partial, jobSpec.verifyChecksum());
            gateway.rename(partial, target);
        } catch (Exception e) {
            discardPartial(partial, gateway);
            Duration elapsed = elapsedSince(started);
            if (action == OriginalsAction.MOVE) {
                logger.warn("Move of {} not verified, source kept: {}", entry.path(), e.getMessage());
                return FileOutcome.failed(
                        entry,
                        category,
                        FileOutcome.MOVE_VERIFICATION_FAILED,
                        elapsed,
                        List.of("Source kept after failed move: " + e.getMessage()));
            }
            logger.warn("Copy of {} failed: {}", entry.path(), e.getMessage());
            return FileOutcome.failed(entry, category, "copy failed: " + e.getMessage(), elapsed);
        }

        List<String> warnings = new ArrayList<>();
        if (action == OriginalsAction.MOVE) {
            try {
                gateway.delete(entry.path());
                logger.debug("Moved {} to {}", entry.path(), target);
            } catch (IOException e) {
                warnings.add("Copy verified but the source could not be removed: " + e.getMessage());
                logger.warn("Verified copy at {} but could not delete source {}", target, entry.path(), e);
            }
        }
        return FileOutcome.success(entry, category, target, elapsedSince(started), warnings);
    }

    void verifyCopy(Path source, Path copy, boolean checksum) throws IOException {
        long sourceSize = Files.size(source);
        long copySize = Files.size(copy);
        if (sourceSize != copySize) {
            throw new IOException("size mismatch: source " + sourceSize + " bytes, copy " + copySize + " bytes");
        }
        if (checksum && !sha256(source).equals(sha256(copy))) {
            throw new IOException("checksum mismatch between source and copy");
        }
    }

    private FileOutcome simulate(
            SourceEntry entry,
            OutputCategory category,
            OriginalsAction action,
            Path target,
            FileSystemGateway gateway,
            long started) {
        try {
            gateway.copy(entry.path(), target);
            if (action == OriginalsAction.MOVE) {
                gateway.delete(entry.path());
            }
        } catch (IOException e) {
            return FileOutcome.failed(entry, category, "copy failed: " + e.getMessage(), elapsedSince(started));
        }
        return FileOutcome.success(entry, category, target, elapsedSince(started), List.of());
    }

    private String originalExtension(SourceEntry entry) {
        String name = entry.fileName();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1);
    }

    private String sha256(Path file) throws IOException {
        try (InputStream inputStream = Files.newInputStream(file)) {
            return DigestUtils.sha256Hex(inputStream);
        }
    }

    private void discardPartial(Path partial, FileSystemGateway gateway) {
        try {
            gateway.delete(partial);
        } catch (IOException e) {
            logger.warn("Could not remove partial copy {}", partial, e);
        }
    }

    private Duration elapsedSince(long started) {
        return Duration.ofNanos(System.nanoTime() - started);
    }
}
