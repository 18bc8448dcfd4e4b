package github.sarthakdev143.photo_packager.model;

import java.nio.file.Path;
import java.util.Locale;

/**
 * One discovered source file. The sequence label is fixed at scan time and is the only
 * input to output naming, so every category derives the same file name for a photo.
 */
public record SourceEntry(
        Path path,
        int sequence,
        String sequenceLabel,
        SourceKind kind,
        boolean readable,
        String skipReason) {

    public SourceEntry {
        if (path == null) {
            throw new IllegalArgumentException("path is required.");
        }
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be 1 or greater.");
        }
        if (sequenceLabel == null || sequenceLabel.isBlank()) {
            sequenceLabel = String.format(Locale.ROOT, "%03d", sequence);
        }
        skipReason = readable ? null : skipReason;
    }

    public static SourceEntry readable(Path path, int sequence, String sequenceLabel, SourceKind kind) {
        return new SourceEntry(path, sequence, sequenceLabel, kind, true, null);
    }

    public static SourceEntry unreadable(Path path, int sequence, String sequenceLabel, SourceKind kind, String reason) {
        return new SourceEntry(path, sequence, sequenceLabel, kind, false, reason);
    }

    public String fileName() {
        return path.getFileName().toString();
    }

    /**
     * Lower-case extension without the dot, or an empty string when the file has none.
     */
    public String extension() {
        String name = fileName();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public String outputFileName(String shootBaseName, String outputExtension) {
        return sequenceLabel + "-" + shootBaseName + "." + outputExtension;
    }

    public boolean isRaw() {
        return kind == SourceKind.CAMERA_RAW;
    }
}
