package github.sarthakdev143.photo_packager.model;

/**
 * Every folder a delivery can populate. {@link #ORIGINAL} and {@link #RAW} hold source files,
 * the other four hold re-encoded derivatives.
 */
public enum OutputCategory {
    ORIGINAL(null, false),
    RAW(null, false),
    OPTIMIZED_JPEG(OutputFormat.JPEG, false),
    OPTIMIZED_WEBP(OutputFormat.WEBP, false),
    COMPRESSED_JPEG(OutputFormat.JPEG, true),
    COMPRESSED_WEBP(OutputFormat.WEBP, true);

    private final OutputFormat format;
    private final boolean compressed;

    OutputCategory(OutputFormat format, boolean compressed) {
        this.format = format;
        this.compressed = compressed;
    }

    public OutputFormat format() {
        return format;
    }

    public boolean isCompressed() {
        return compressed;
    }

    public boolean isDerivative() {
        return format != null;
    }
}
