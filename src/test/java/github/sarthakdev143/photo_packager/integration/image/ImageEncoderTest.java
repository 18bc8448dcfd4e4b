package github.sarthakdev143.photo_packager.integration.image;

import github.sarthakdev143.photo_packager.model.OutputFormat;
import github.sarthakdev143.photo_packager.support.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ImageEncoderTest {

    @TempDir
    Path tempDir;

    private final ImageEncoder encoder = new ImageEncoder();

    @Test
    void lowerQualityProducesSmallerJpeg() throws Exception {
        BufferedImage image = TestImages.pattern(200, 150);

        byte[] high = encoder.encode(image, OutputFormat.JPEG, 95);
        byte[] low = encoder.encode(image, OutputFormat.JPEG, 20);

        assertThat(low.length).isLessThan(high.length);
        assertThat(ImageIO.read(new ByteArrayInputStream(low)).getWidth()).isEqualTo(200);
    }

    @Test
    void encodingIsDeterministic() throws Exception {
        BufferedImage image = TestImages.pattern(64, 64);

        assertThat(encoder.encode(image, OutputFormat.JPEG, 80)).isEqualTo(encoder.encode(image, OutputFormat.JPEG, 80));
    }

    @Test
    void transparentImageIsFlattenedForJpeg() throws Exception {
        BufferedImage argb = new BufferedImage(10, 10, BufferedImage.TYPE_INT_ARGB);

        byte[] bytes = encoder.encode(argb, OutputFormat.JPEG, 90);

        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(bytes));
        assertThat(decoded.getRGB(5, 5) & 0xFFFFFF).isGreaterThan(0xF0F0F0);
    }

    @Test
    void embedsExifWithoutRemovedTags() throws Exception {
        Path source = TestImages.writeJpegWithExif(tempDir.resolve("a.jpg"), 40, 30, (short) 6);
        ExifBlock exif = ExifBlock.read(Files.readAllBytes(source))
                .without(Set.of(TestImages.TAG_ORIENTATION, TestImages.TAG_MAKE));

        byte[] written = encoder.embedExif(encoder.encode(TestImages.pattern(40, 30), OutputFormat.JPEG, 85), exif);

        ExifBlock result = ExifBlock.read(written);
        assertThat(result.contains(TestImages.TAG_MODEL)).isTrue();
        assertThat(result.contains(TestImages.TAG_COPYRIGHT)).isTrue();
        assertThat(result.contains(TestImages.TAG_MAKE)).isFalse();
        assertThat(result.contains(TestImages.TAG_ORIENTATION)).isFalse();
    }

    @Test
    void encodesWebpWhenCodecIsAvailable() throws Exception {
        assumeTrue(webpAvailable(), "WebP codec not available on this platform");

        byte[] bytes = encoder.encode(TestImages.pattern(32, 32), OutputFormat.WEBP, 80);

        assertThat(new String(bytes, 0, 4, StandardCharsets.US_ASCII)).isEqualTo("RIFF");
        assertThat(new String(bytes, 8, 4, StandardCharsets.US_ASCII)).isEqualTo("WEBP");
    }

    private boolean webpAvailable() {
        try {
            return encoder.supports(OutputFormat.WEBP)
                    && encoder.encode(TestImages.pattern(2, 2), OutputFormat.WEBP, 50).length > 0;
        } catch (Exception | LinkageError e) {
            return false;
        }
    }
}
