package github.sarthakdev143.photo_packager.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable description of one packaging run. Built once by the caller and passed through the
 * whole pipeline unchanged.
 *
 * @param categories enabled derivative categories and their encode settings; {@link OutputCategory#ORIGINAL}
 *                   and {@link OutputCategory#RAW} are driven by the originals and RAW actions instead
 */
public record JobSpec(
        Path sourceDirectory,
        Path outputParent,
        String shootBaseName,
        boolean recursive,
        OriginalsAction originalsAction,
        boolean includeRaw,
        OriginalsAction rawAction,
        MetadataPolicy metadataPolicy,
        Map<OutputCategory, CategorySettings> categories,
        FolderLayout folders,
        boolean createArchives,
        boolean dryRun,
        int workerCount,
        boolean verifyChecksum,
        boolean writeReadme,
        DeliveryBranding branding) {

    public static final int DEFAULT_WORKER_COUNT = 5;

    public JobSpec {
        shootBaseName = shootBaseName == null ? "" : shootBaseName.trim();
        originalsAction = originalsAction == null ? OriginalsAction.COPY : originalsAction;
        rawAction = rawAction == null ? OriginalsAction.COPY : rawAction;
        metadataPolicy = metadataPolicy == null ? MetadataPolicy.KEEP : metadataPolicy;
        Map<OutputCategory, CategorySettings> enabled = new EnumMap<>(OutputCategory.class);
        if (categories != null) {
            categories.forEach((category, settings) -> {
                if (category != null && category.isDerivative() && settings != null) {
                    enabled.put(category, settings);
                }
            });
        }
        categories = Collections.unmodifiableMap(enabled);
        folders = folders == null ? FolderLayout.defaults() : folders;
        branding = branding == null ? DeliveryBranding.none() : branding;
    }

    public static Builder builder(Path sourceDirectory, Path outputParent) {
        return new Builder(sourceDirectory, outputParent);
    }

    public Path outputRoot() {
        return outputParent.resolve(shootBaseName);
    }

    public Path categoryFolder(OutputCategory category) {
        return outputRoot().resolve(folders.relativeFolder(category));
    }

    /**
     * Enabled derivative categories in declaration order.
     */
    public List<OutputCategory> enabledDerivatives() {
        return List.copyOf(categories.keySet());
    }

    public boolean isEnabled(OutputCategory category) {
        return categories.containsKey(category);
    }

    public CategorySettings settingsFor(OutputCategory category) {
        CategorySettings settings = categories.get(category);
        if (settings == null) {
            throw new IllegalArgumentException("Category " + category + " is not enabled for this job.");
        }
        return settings;
    }

    public Builder toBuilder() {
        Builder builder = new Builder(sourceDirectory, outputParent)
                .shootBaseName(shootBaseName)
                .recursive(recursive)
                .originalsAction(originalsAction)
                .includeRaw(includeRaw)
                .rawAction(rawAction)
                .metadataPolicy(metadataPolicy)
                .folders(folders)
                .createArchives(createArchives)
                .dryRun(dryRun)
                .workerCount(workerCount)
                .verifyChecksum(verifyChecksum)
                .writeReadme(writeReadme)
                .branding(branding);
        categories.forEach(builder::category);
        return builder;
    }

    public static final class Builder {

        private final Path sourceDirectory;
        private final Path outputParent;
        private final Map<OutputCategory, CategorySettings> categories = new EnumMap<>(OutputCategory.class);
        private String shootBaseName;
        private boolean recursive;
        private OriginalsAction originalsAction = OriginalsAction.COPY;
        private boolean includeRaw;
        private OriginalsAction rawAction = OriginalsAction.COPY;
        private MetadataPolicy metadataPolicy = MetadataPolicy.KEEP;
        private FolderLayout folders = FolderLayout.defaults();
        private boolean createArchives;
        private boolean dryRun;
        private int workerCount = DEFAULT_WORKER_COUNT;
        private boolean verifyChecksum = true;
        private boolean writeReadme = true;
        private DeliveryBranding branding = DeliveryBranding.none();

        private Builder(Path sourceDirectory, Path outputParent) {
            this.sourceDirectory = sourceDirectory;
            this.outputParent = outputParent;
        }

        public Builder shootBaseName(String shootBaseName) {
            this.shootBaseName = shootBaseName;
            return this;
        }

        public Builder recursive(boolean recursive) {
            this.recursive = recursive;
            return this;
        }

        public Builder originalsAction(OriginalsAction originalsAction) {
            this.originalsAction = originalsAction;
            return this;
        }

        public Builder includeRaw(boolean includeRaw) {
            this.includeRaw = includeRaw;
            return this;
        }

        public Builder rawAction(OriginalsAction rawAction) {
            this.rawAction = rawAction;
            return this;
        }

        public Builder metadataPolicy(MetadataPolicy metadataPolicy) {
            this.metadataPolicy = metadataPolicy;
            return this;
        }

        public Builder category(OutputCategory category, CategorySettings settings) {
            categories.put(category, settings);
            return this;
        }

        public Builder withDefaultCategory(OutputCategory category) {
            return category(category, CategorySettings.defaultsFor(category));
        }

        public Builder clearCategories() {
            categories.clear();
            return this;
        }

        public Builder folders(FolderLayout folders) {
            this.folders = folders;
            return this;
        }

        public Builder createArchives(boolean createArchives) {
            this.createArchives = createArchives;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder verifyChecksum(boolean verifyChecksum) {
            this.verifyChecksum = verifyChecksum;
            return this;
        }

        public Builder writeReadme(boolean writeReadme) {
            this.writeReadme = writeReadme;
            return this;
        }

        public Builder branding(DeliveryBranding branding) {
            this.branding = branding;
            return this;
        }

        public JobSpec build() {
            return new JobSpec(
                    sourceDirectory,
                    outputParent,
                    shootBaseName,
                    recursive,
                    originalsAction,
                    includeRaw,
                    rawAction,
                    metadataPolicy,
                    categories,
                    folders,
                    createArchives,
                    dryRun,
                    workerCount,
                    verifyChecksum,
                    writeReadme,
                    branding);
        }
    }
}
