package github.sarthakdev143.photo_packager.model;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Folder names inside the job output root. Derivative folders sit under their top-level group.
 */
public record FolderLayout(
        String exportOriginals,
        String rawFiles,
        String optimizedRoot,
        String optimizedJpeg,
        String optimizedWebp,
        String compressedRoot,
        String compressedJpeg,
        String compressedWebp) {

    public static FolderLayout defaults() {
        return new FolderLayout(
                "Export Originals",
                "RAW Files",
                "Optimized Files",
                "Optimized JPGs",
                "Optimized WebPs",
                "Compressed Files",
                "Compressed JPGs",
                "Compressed WebPs");
    }

    public Path relativeFolder(OutputCategory category) {
        return switch (category) {
            case ORIGINAL -> Path.of(exportOriginals);
            case RAW -> Path.of(rawFiles);
            case OPTIMIZED_JPEG -> Path.of(optimizedRoot, optimizedJpeg);
            case OPTIMIZED_WEBP -> Path.of(optimizedRoot, optimizedWebp);
            case COMPRESSED_JPEG -> Path.of(compressedRoot, compressedJpeg);
            case COMPRESSED_WEBP -> Path.of(compressedRoot, compressedWebp);
        };
    }

    public String topLevelFolder(OutputCategory category) {
        return relativeFolder(category).getName(0).toString();
    }

    /**
     * Top-level folders that get bundled into an archive when populated.
     */
    public List<String> archivedFolders() {
        return List.of(exportOriginals, optimizedRoot, compressedRoot);
    }

    public List<String> allNames() {
        return Arrays.asList(
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
