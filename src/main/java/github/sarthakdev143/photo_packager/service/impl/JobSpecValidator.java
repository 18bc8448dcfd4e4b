package github.sarthakdev143.photo_packager.service.impl;

import github.sarthakdev143.photo_packager.model.CategorySettings;
import github.sarthakdev143.photo_packager.model.FolderLayout;
import github.sarthakdev143.photo_packager.model.JobSpec;
import github.sarthakdev143.photo_packager.model.OutputCategory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

@Component
public class JobSpecValidator {

    private static final int MAX_WORKERS = 64;
    private static final int MIN_QUALITY = 1;
    private static final int MAX_QUALITY = 100;
    private static final Pattern UNSAFE_NAME_CHARACTERS = Pattern.compile("[<>:\"/\\\\|?*\\x00-\\x1F]");

    /**
     * Checks a job description and returns it with a usable shoot base name. A blank base name
     * falls back to the source folder's name.
     */
    public JobSpec normalizeAndValidate(JobSpec jobSpec) {
        if (jobSpec == null) {
            throw new IllegalArgumentException("jobSpec is required.");
        }
        if (jobSpec.sourceDirectory() == null) {
            throw new IllegalArgumentException("jobSpec.sourceDirectory is required.");
        }
        if (jobSpec.outputParent() == null) {
            throw new IllegalArgumentException("jobSpec.outputParent is required.");
        }
        if (jobSpec.workerCount() < 0 || jobSpec.workerCount() > MAX_WORKERS) {
            throw new IllegalArgumentException("jobSpec.workerCount must be between 0 and " + MAX_WORKERS + ".");
        }

        String baseName = resolveBaseName(jobSpec.shootBaseName(), jobSpec.sourceDirectory());
        validateFolders(jobSpec.folders());
        for (Map.Entry<OutputCategory, CategorySettings> entry : jobSpec.categories().entrySet()) {
            validateCategory(entry.getKey(), entry.getValue());
        }

        JobSpec normalized = jobSpec.toBuilder().shootBaseName(baseName).build();
        Path source = normalized.sourceDirectory().toAbsolutePath().normalize();
        Path outputRoot = normalized.outputRoot().toAbsolutePath().normalize();
        if (source.equals(outputRoot) || source.startsWith(outputRoot)) {
            throw new IllegalArgumentException("jobSpec.outputParent must not place the output root over the source directory.");
        }
        return normalized;
    }

    String resolveBaseName(String requested, Path sourceDirectory) {
        String candidate = requested == null || requested.isBlank()
                ? fileNameOf(sourceDirectory)
                : requested;
        String sanitized = UNSAFE_NAME_CHARACTERS.matcher(candidate.trim()).replaceAll("_").trim();
        if (sanitized.isEmpty() || ".".equals(sanitized) || "..".equals(sanitized)) {
            throw new IllegalArgumentException("jobSpec.shootBaseName must contain at least one valid character.");
        }
        return sanitized;
    }

    private void validateFolders(FolderLayout folders) {
        List<String> names = folders.allNames();
        String[] fields = {
                "exportOriginals",
                "rawFiles",
                "optimizedRoot",
                "optimizedJpeg",
                "optimizedWebp",
                "compressedRoot",
                "compressedJpeg",
                "compressedWebp"};
        for (int index = 0; index < names.size(); index++) {
            String name = names.get(index);
            String path = "jobSpec.folders." + fields[index];
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException(path + " is required.");
            }
            if (UNSAFE_NAME_CHARACTERS.matcher(name).find() || ".".equals(name.trim()) || "..".equals(name.trim())) {
                throw new IllegalArgumentException(path + " must be a single folder name.");
            }
        }

        Set<String> topLevel = new HashSet<>();
        for (String name : List.of(folders.exportOriginals(), folders.rawFiles(), folders.optimizedRoot(), folders.compressedRoot())) {
            if (!topLevel.add(name.trim().toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("jobSpec.folders top-level names must be distinct.");
            }
        }
    }

    private void validateCategory(OutputCategory category, CategorySettings settings) {
        String path = "jobSpec.categories[" + category + "]";
        if (settings.quality() < MIN_QUALITY || settings.quality() > MAX_QUALITY) {
            throw new IllegalArgumentException(path + ".quality must be between 1 and 100.");
        }
        if (settings.minQuality() < MIN_QUALITY || settings.minQuality() > MAX_QUALITY) {
            throw new IllegalArgumentException(path + ".minQuality must be between 1 and 100.");
        }
        if (settings.maxBytes() < 0) {
            throw new IllegalArgumentException(path + ".maxBytes must be 0 or greater.");
        }
        if (category.isCompressed() && settings.targetPixels() <= 0) {
            throw new IllegalArgumentException(path + ".targetPixels must be greater than 0.");
        }
    }

    private String fileNameOf(Path directory) {
        Path name = directory.toAbsolutePath().normalize().getFileName();
        return name == null ? "" : name.toString();
    }
}
