package github.sarthakdev143.photo_packager.integration.image;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Metadata;
import com.drew.metadata.MetadataException;
import com.drew.metadata.exif.ExifIFD0Directory;
import net.coobird.thumbnailator.util.exif.ExifFilterUtils;
import net.coobird.thumbnailator.util.exif.Orientation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
public class ImageDecoder {

    private static final Logger logger = LoggerFactory.getLogger(ImageDecoder.class);
    private static final int NORMAL_ORIENTATION = 1;

    /**
     * Decodes a source file and rotates or mirrors it according to its EXIF orientation so the
     * pixels display upright without relying on the tag.
     */
    public DecodedImage decode(Path source) throws IOException {
        byte[] bytes = Files.readAllBytes(source);
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
        if (image == null) {
            throw new IOException("No image decoder available for " + source.getFileName());
        }

        List<String> warnings = new ArrayList<>();
        int orientation = readOrientation(bytes, source, warnings);
        BufferedImage upright = applyOrientation(image, orientation);

        ExifBlock exif = null;
        try {
            exif = ExifBlock.read(bytes);
        } catch (IOException e) {
            warnings.add("EXIF metadata unreadable, derivatives carry none: " + e.getMessage());
            logger.warn("Could not read EXIF from {}", source, e);
        }

        logger.debug(
                "Decoded {} {}x{} orientation={} exif={}",
                source.getFileName(),
                upright.getWidth(),
                upright.getHeight(),
                orientation,
                exif != null);
        return new DecodedImage(upright, orientation, exif, warnings);
    }

    int readOrientation(byte[] bytes, Path source, List<String> warnings) {
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(new ByteArrayInputStream(bytes));
            ExifIFD0Directory directory = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
            if (directory == null || !directory.containsTag(ExifIFD0Directory.TAG_ORIENTATION)) {
                return NORMAL_ORIENTATION;
            }
            int orientation = directory.getInt(ExifIFD0Directory.TAG_ORIENTATION);
            return orientation >= 1 && orientation <= 8 ? orientation : NORMAL_ORIENTATION;
        } catch (ImageProcessingException | MetadataException | IOException e) {
            logger.debug("No orientation metadata for {}: {}", source.getFileName(), e.getMessage());
            return NORMAL_ORIENTATION;
        }
    }

    BufferedImage applyOrientation(BufferedImage image, int orientation) {
        if (orientation == NORMAL_ORIENTATION) {
            return image;
        }
        Orientation type = Orientation.typeOf(orientation);
        if (type == null) {
            return image;
        }
        return ExifFilterUtils.getFilterForOrientation(type).apply(image);
    }
}
