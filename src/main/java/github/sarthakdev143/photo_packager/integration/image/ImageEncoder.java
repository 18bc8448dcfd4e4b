package github.sarthakdev143.photo_packager.integration.image;

import github.sarthakdev143.photo_packager.model.OutputFormat;
import org.apache.commons.imaging.formats.jpeg.exif.ExifRewriter;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

@Component
public class ImageEncoder {

    private static final Logger logger = LoggerFactory.getLogger(ImageEncoder.class);

    /**
     * Encodes the image at the given quality (1-100). Transparent areas are flattened onto white.
     */
    public byte[] encode(BufferedImage image, OutputFormat format, int quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.writerFormatName());
        if (!writers.hasNext()) {
            throw new IOException("No image writer registered for " + format);
        }

        BufferedImage rgbImage = toRgb(image);
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        ImageWriter writer = writers.next();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(outputStream)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            if (param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                String[] compressionTypes = param.getCompressionTypes();
                if (compressionTypes != null && compressionTypes.length > 0) {
                    param.setCompressionType(compressionTypes[0]);
                }
                param.setCompressionQuality(Math.max(1, Math.min(100, quality)) / 100.0f);
            }
            writer.write(null, new IIOImage(rgbImage, null, null), param);
        } catch (LinkageError e) {
            // native codecs fail to link on platforms they do not ship binaries for
            throw new IOException(format + " codec is unavailable on this platform: " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }

        logger.debug("Encoded {} at quality {}: {} bytes", format, quality, outputStream.size());
        return outputStream.toByteArray();
    }

    /**
     * Writes the EXIF block into an encoded JPEG. Tags marked as removed are left out.
     */
    public byte[] embedExif(byte[] jpegBytes, ExifBlock exif) throws IOException {
        TiffOutputSet outputSet = exif.toOutputSet();
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream(jpegBytes.length + 4096);
        try {
            new ExifRewriter().updateExifMetadataLossy(jpegBytes, outputStream, outputSet);
        } catch (Exception e) {
            throw new IOException("Unable to embed EXIF metadata: " + e.getMessage(), e);
        }
        return outputStream.toByteArray();
    }

    public boolean supports(OutputFormat format) {
        return ImageIO.getImageWritersByFormatName(format.writerFormatName()).hasNext();
    }

    private BufferedImage toRgb(BufferedImage source) {
        if (source.getType() == BufferedImage.TYPE_INT_RGB) {
            return source;
        }
        BufferedImage rgb = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = rgb.createGraphics();
        graphics.setColor(Color.WHITE);
        graphics.fillRect(0, 0, source.getWidth(), source.getHeight());
        graphics.drawImage(source, 0, 0, null);
        graphics.dispose();
        return rgb;
    }
}
