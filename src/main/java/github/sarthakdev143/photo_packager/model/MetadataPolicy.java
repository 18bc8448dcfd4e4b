package github.sarthakdev143.photo_packager.model;

import java.util.Locale;

public enum MetadataPolicy {
    KEEP(false, false),
    STRIP_ALL(true, true),
    STRIP_DATE(true, false),
    STRIP_CAMERA(false, true),
    STRIP_DATE_AND_CAMERA(true, true);

    private final boolean stripsDates;
    private final boolean stripsCamera;

    MetadataPolicy(boolean stripsDates, boolean stripsCamera) {
        this.stripsDates = stripsDates;
        this.stripsCamera = stripsCamera;
    }

    public boolean stripsDates() {
        return stripsDates;
    }

    public boolean stripsCamera() {
        return stripsCamera;
    }

    /**
     * True for the policies that remove only some tag families and therefore need a tag editor.
     */
    public boolean isSelective() {
        return this == STRIP_DATE || this == STRIP_CAMERA || this == STRIP_DATE_AND_CAMERA;
    }

    /**
     * Accepts enum names as well as the short forms used by the desktop client
     * ({@code keep}, {@code date}, {@code camera}, {@code both}, {@code strip_all}).
     */
    public static MetadataPolicy fromInput(String input) {
        if (input == null || input.isBlank()) {
            return KEEP;
        }

        String normalized = input.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "DATE" -> STRIP_DATE;
            case "CAMERA" -> STRIP_CAMERA;
            case "BOTH" -> STRIP_DATE_AND_CAMERA;
            default -> {
                try {
                    yield MetadataPolicy.valueOf(normalized);
                } catch (IllegalArgumentException ex) {
                    throw new IllegalArgumentException(
                            "metadataPolicy must be one of KEEP, STRIP_ALL, STRIP_DATE, STRIP_CAMERA, STRIP_DATE_AND_CAMERA.");
                }
            }
        };
    }
}
