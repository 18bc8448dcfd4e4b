package github.sarthakdev143.photo_packager.integration.image;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Decoded pixels with orientation already applied.
 *
 * @param exif     EXIF block read from the source, or {@code null} when there is none
 * @param warnings non-fatal problems met while reading metadata
 */
public record DecodedImage(BufferedImage image, int sourceOrientation, ExifBlock exif, List<String> warnings) {

    public DecodedImage {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }

    public long pixelCount() {
        return (long) image.getWidth() * image.getHeight();
    }
}
