package github.sarthakdev143.photo_packager.config;

import github.sarthakdev143.photo_packager.model.CategorySettings;
import github.sarthakdev143.photo_packager.model.DeliveryBranding;
import github.sarthakdev143.photo_packager.model.FolderLayout;
import github.sarthakdev143.photo_packager.model.JobSpec;
import github.sarthakdev143.photo_packager.model.MetadataPolicy;
import github.sarthakdev143.photo_packager.model.OriginalsAction;
import github.sarthakdev143.photo_packager.model.OutputCategory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Host defaults for packaging jobs. Callers start from {@link #toJobSpecBuilder} and override per job.
 */
@ConfigurationProperties(prefix = "photo-packager")
public record PackagerProperties(
        @DefaultValue("5") int workerCount,
        @DefaultValue("copy") String originalsAction,
        @DefaultValue("false") boolean includeRaw,
        @DefaultValue("copy") String rawAction,
        @DefaultValue("false") boolean recursive,
        @DefaultValue("keep") String metadataPolicy,
        @DefaultValue("true") boolean createArchives,
        @DefaultValue("true") boolean verifyChecksum,
        @DefaultValue("true") boolean writeReadme,
        @DefaultValue({"OPTIMIZED_JPEG", "OPTIMIZED_WEBP", "COMPRESSED_JPEG", "COMPRESSED_WEBP"})
        List<String> enabledCategories,
        @DefaultValue Quality quality,
        @DefaultValue Folders folders,
        @DefaultValue Branding branding) {

    public record Quality(
            @DefaultValue("90") int optimized,
            @DefaultValue("60") int compressed,
            @DefaultValue("30") int minimum,
            @DefaultValue("2000000") long compressedTargetPixels,
            @DefaultValue("0") long compressedMaxBytes,
            @DefaultValue("true") boolean complexityAdjusted) {
    }

    public record Folders(
            @DefaultValue("Export Originals") String exportOriginals,
            @DefaultValue("RAW Files") String rawFiles,
            @DefaultValue("Optimized Files") String optimizedRoot,
            @DefaultValue("Optimized JPGs") String optimizedJpeg,
            @DefaultValue("Optimized WebPs") String optimizedWebp,
            @DefaultValue("Compressed Files") String compressedRoot,
            @DefaultValue("Compressed JPGs") String compressedJpeg,
            @DefaultValue("Compressed WebPs") String compressedWebp) {

        FolderLayout toLayout() {
            return new FolderLayout(
                    exportOriginals,
                    rawFiles,
                    optimizedRoot,
                    optimizedJpeg,
                    optimizedWebp,
                    compressedRoot,
                    compressedJpeg,
                    compressedWebp);
        }
    }

    public record Branding(
            @DefaultValue("") String companyName,
            @DefaultValue("") String website,
            @DefaultValue("") String supportEmail) {
    }

    public JobSpec.Builder toJobSpecBuilder(Path sourceDirectory, Path outputParent) {
        JobSpec.Builder builder = JobSpec.builder(sourceDirectory, outputParent)
                .workerCount(workerCount)
                .originalsAction(OriginalsAction.fromInput(originalsAction))
                .includeRaw(includeRaw)
                .rawAction(OriginalsAction.fromInput(rawAction))
                .recursive(recursive)
                .metadataPolicy(MetadataPolicy.fromInput(metadataPolicy))
                .createArchives(createArchives)
                .verifyChecksum(verifyChecksum)
                .writeReadme(writeReadme)
                .folders(folders.toLayout())
                .branding(new DeliveryBranding(branding.companyName(), branding.website(), branding.supportEmail()));

        for (String name : enabledCategories) {
            OutputCategory category = parseCategory(name);
            builder.category(category, settingsFor(category));
        }
        return builder;
    }

    CategorySettings settingsFor(OutputCategory category) {
        if (!category.isCompressed()) {
            return CategorySettings.optimized(quality.optimized());
        }
        return CategorySettings.compressed(quality.compressed(), quality.compressedTargetPixels())
                .withMaxBytes(quality.compressedMaxBytes(), quality.minimum())
                .withComplexityAdjusted(quality.complexityAdjusted());
    }

    private OutputCategory parseCategory(String name) {
        String normalized = name == null ? "" : name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            OutputCategory category = OutputCategory.valueOf(normalized);
            if (category.isDerivative()) {
                return category;
            }
        } catch (IllegalArgumentException ignored) {
            // reported below
        }
        throw new IllegalArgumentException(
                "photo-packager.enabledCategories entries must be one of OPTIMIZED_JPEG, OPTIMIZED_WEBP, "
                        + "COMPRESSED_JPEG, COMPRESSED_WEBP.");
    }
}
