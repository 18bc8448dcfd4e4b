package github.sarthakdev143.photo_packager.model;

import java.util.Locale;

public enum OriginalsAction {
    COPY,
    MOVE,
    LEAVE,
    SKIP_EXPORT;

    public static OriginalsAction fromInput(String input) {
        if (input == null || input.isBlank()) {
            return COPY;
        }

        String normalized = input.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("NONE".equals(normalized) || "SKIP".equals(normalized)) {
            return SKIP_EXPORT;
        }
        try {
            return OriginalsAction.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("originalsAction must be one of COPY, MOVE, LEAVE, SKIP_EXPORT.");
        }
    }

    public boolean writesFiles() {
        return this == COPY || this == MOVE;
    }
}
