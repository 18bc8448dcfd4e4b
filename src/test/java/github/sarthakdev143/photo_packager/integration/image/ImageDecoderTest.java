package github.sarthakdev143.photo_packager.integration.image;

import github.sarthakdev143.photo_packager.support.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageDecoderTest {

    @TempDir
    Path tempDir;

    private final ImageDecoder decoder = new ImageDecoder();

    @Test
    void rotatesPixelsUprightFromOrientationTag() throws Exception {
        Path source = TestImages.writeJpegWithExif(tempDir.resolve("portrait.jpg"), 60, 40, (short) 6);

        DecodedImage decoded = decoder.decode(source);

        assertThat(decoded.sourceOrientation()).isEqualTo(6);
        assertThat(decoded.width()).isEqualTo(40);
        assertThat(decoded.height()).isEqualTo(60);
        assertThat(decoded.exif()).isNotNull();
        assertThat(decoded.exif().contains(TestImages.TAG_MAKE)).isTrue();
        assertThat(decoded.warnings()).isEmpty();
    }

    @Test
    void normalOrientationKeepsDimensions() throws Exception {
        Path source = TestImages.writeJpegWithExif(tempDir.resolve("landscape.jpg"), 60, 40, (short) 1);

        DecodedImage decoded = decoder.decode(source);

        assertThat(decoded.width()).isEqualTo(60);
        assertThat(decoded.height()).isEqualTo(40);
        assertThat(decoded.pixelCount()).isEqualTo(2400L);
    }

    @Test
    void pngWithoutMetadataDecodesWithoutExif() throws Exception {
        Path source = TestImages.writePng(tempDir.resolve("plain.png"), 30, 20);

        DecodedImage decoded = decoder.decode(source);

        assertThat(decoded.sourceOrientation()).isEqualTo(1);
        assertThat(decoded.exif()).isNull();
    }

    @Test
    void unknownFormatIsReportedAsIoFailure() throws Exception {
        Path source = Files.write(tempDir.resolve("layers.psd"), new byte[]{'8', 'B', 'P', 'S', 0, 1});

        assertThatThrownBy(() -> decoder.decode(source))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("layers.psd");
    }
}
