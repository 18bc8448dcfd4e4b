package github.sarthakdev143.photo_packager.integration.image;

import net.coobird.thumbnailator.Thumbnails;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;

@Component
public class ImageResizer {

    public BufferedImage resize(BufferedImage source, int width, int height) throws IOException {
        if (source.getWidth() == width && source.getHeight() == height) {
            return source;
        }
        return Thumbnails.of(source)
                .forceSize(width, height)
                .asBufferedImage();
    }
}
