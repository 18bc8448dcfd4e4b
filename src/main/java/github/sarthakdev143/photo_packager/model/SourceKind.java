package github.sarthakdev143.photo_packager.model;

import java.util.Locale;
import java.util.Set;

public enum SourceKind {
    /** JPEG, PNG, GIF, BMP, TIFF or WebP: formats the decoder can render into derivatives. */
    RASTER,
    /** A recognised image format without a decoder on this runtime (PSD, HEIC, ...). */
    UNDECODABLE_IMAGE,
    /** Camera RAW container; exported as-is, never decoded. */
    CAMERA_RAW;

    private static final Set<String> RASTER_EXTENSIONS = Set.of(
            "jpg", "jpeg", "jpe", "jif", "jfif", "jfi", "png", "gif", "bmp", "dib", "tif", "tiff", "webp");

    private static final Set<String> OTHER_IMAGE_EXTENSIONS = Set.of(
            "avif", "psd", "heif", "heic", "apng", "jp2", "j2k", "jpf", "jpx", "jpm", "hdr", "exr",
            "ico", "cur", "pcx", "tga", "xcf", "svg");

    private static final Set<String> RAW_EXTENSIONS = Set.of(
            "raw", "arw", "srf", "sr2", "crw", "cr2", "cr3", "nef", "nrw", "orf", "rw2", "raf", "dng",
            "mos", "kdc", "dcr", "x3f", "pef", "3fr", "mef", "erf", "fff", "iiq", "rwl", "mrw", "srw");

    /**
     * Classifies a file by extension, or returns {@code null} when the file is not an image.
     */
    public static SourceKind fromExtension(String extension) {
        if (extension == null) {
            return null;
        }
        String ext = extension.toLowerCase(Locale.ROOT);
        if (RASTER_EXTENSIONS.contains(ext)) {
            return RASTER;
        }
        if (OTHER_IMAGE_EXTENSIONS.contains(ext)) {
            return UNDECODABLE_IMAGE;
        }
        if (RAW_EXTENSIONS.contains(ext)) {
            return CAMERA_RAW;
        }
        return null;
    }
}
