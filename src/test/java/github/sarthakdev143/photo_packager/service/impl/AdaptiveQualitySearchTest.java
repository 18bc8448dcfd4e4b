package github.sarthakdev143.photo_packager.service.impl;

import github.sarthakdev143.photo_packager.integration.image.ImageEncoder;
import github.sarthakdev143.photo_packager.model.CategorySettings;
import github.sarthakdev143.photo_packager.model.OutputFormat;
import github.sarthakdev143.photo_packager.support.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.intThat;
import static org.mockito.Mockito.atMost;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AdaptiveQualitySearchTest {

    @Mock
    private ImageEncoder imageEncoder;

    private AdaptiveQualitySearch search;
    private BufferedImage image;

    @BeforeEach
    void setUp() throws Exception {
        search = new AdaptiveQualitySearch(imageEncoder);
        image = TestImages.pattern(64, 48);
        // one hundred bytes per quality point
        lenient().when(imageEncoder.encode(any(BufferedImage.class), eq(OutputFormat.JPEG), anyInt()))
                .thenAnswer(invocation -> new byte[invocation.getArgument(2, Integer.class) * 100]);
    }

    @Test
    void encodesOnceAtConfiguredQualityWithoutCeiling() throws Exception {
        CategorySettings settings = CategorySettings.compressed(80, 2_000_000L).withComplexityAdjusted(false);

        EncodedDerivative encoded = search.encode(image, OutputFormat.JPEG, settings, true);

        assertThat(encoded.quality()).isEqualTo(80);
        assertThat(encoded.probes()).isEqualTo(1);
        verify(imageEncoder, times(1)).encode(any(BufferedImage.class), eq(OutputFormat.JPEG), anyInt());
    }

    @Test
    void searchFindsHighestQualityUnderCeiling() throws Exception {
        CategorySettings settings = CategorySettings.compressed(80, 2_000_000L)
                .withComplexityAdjusted(false)
                .withMaxBytes(5_000L, 30);

        EncodedDerivative encoded = search.encode(image, OutputFormat.JPEG, settings, true);

        assertThat(encoded.quality()).isEqualTo(50);
        assertThat(encoded.bytes()).hasSize(5_000);
        assertThat(encoded.warnings()).isEmpty();
        verify(imageEncoder, atMost(AdaptiveQualitySearch.MAX_SEARCH_PROBES + 1))
                .encode(any(BufferedImage.class), eq(OutputFormat.JPEG), anyInt());
    }

    @Test
    void searchStopsAtMinimumQualityAndWarns() throws Exception {
        CategorySettings settings = CategorySettings.compressed(80, 2_000_000L)
                .withComplexityAdjusted(false)
                .withMaxBytes(1_000L, 30);

        EncodedDerivative encoded = search.encode(image, OutputFormat.JPEG, settings, true);

        assertThat(encoded.quality()).isEqualTo(30);
        assertThat(encoded.bytes()).hasSize(3_000);
        assertThat(encoded.warnings()).singleElement().asString().contains("minimum quality 30");
        verify(imageEncoder, times(0)).encode(any(BufferedImage.class), eq(OutputFormat.JPEG), eq(29));
    }

    @Test
    void nonAdaptiveCategoriesIgnoreCeilingAndComplexity() throws Exception {
        CategorySettings settings = CategorySettings.optimized(90).withMaxBytes(100L, 30).withComplexityAdjusted(true);

        EncodedDerivative encoded = search.encode(image, OutputFormat.JPEG, settings, false);

        assertThat(encoded.quality()).isEqualTo(90);
        assertThat(encoded.warnings()).isEmpty();
    }

    @Test
    void flatImagesStartLowerWhenComplexityAdjusted() throws Exception {
        BufferedImage flat = new BufferedImage(32, 32, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = flat.createGraphics();
        graphics.setColor(Color.GRAY);
        graphics.fillRect(0, 0, 32, 32);
        graphics.dispose();

        EncodedDerivative encoded = search.encode(
                flat,
                OutputFormat.JPEG,
                CategorySettings.compressed(60, 2_000_000L),
                true);

        assertThat(encoded.quality()).isEqualTo(50);
    }

    @Test
    void complexityAdjustmentNeverStartsBelowMinimumQuality() throws Exception {
        CategorySettings settings = new CategorySettings(55, 2_000_000L, 0L, 50, true, Set.of());

        EncodedDerivative encoded = search.encode(flatGray(32, 32), OutputFormat.JPEG, settings, true);

        assertThat(encoded.quality()).isEqualTo(50);
        assertThat(encoded.warnings()).isEmpty();
        verify(imageEncoder, never()).encode(any(BufferedImage.class), eq(OutputFormat.JPEG), intThat(q -> q < 50));
    }

    @Test
    void unreachableCeilingWarnsWithConfiguredMinimumAfterComplexityAdjustment() throws Exception {
        CategorySettings settings = new CategorySettings(55, 2_000_000L, 10L, 50, true, Set.of());

        EncodedDerivative encoded = search.encode(flatGray(32, 32), OutputFormat.JPEG, settings, true);

        assertThat(encoded.quality()).isEqualTo(50);
        assertThat(encoded.warnings()).singleElement().asString().contains("minimum quality 50");
        verify(imageEncoder, never()).encode(any(BufferedImage.class), eq(OutputFormat.JPEG), intThat(q -> q < 50));
    }

    @Test
    void floorEncodedAfterProbeBudgetIsAcceptedWhenItFits() throws Exception {
        // range 1..199 exhausts the probe budget at quality 3 before reaching the floor
        CategorySettings settings = new CategorySettings(200, 2_000_000L, 150L, 1, false, Set.of());

        EncodedDerivative encoded = search.encode(image, OutputFormat.JPEG, settings, true);

        assertThat(encoded.quality()).isEqualTo(1);
        assertThat(encoded.bytes()).hasSize(100);
        assertThat(encoded.warnings()).isEmpty();
        verify(imageEncoder, times(1)).encode(any(BufferedImage.class), eq(OutputFormat.JPEG), eq(1));
    }

    @Test
    void complexityAdjustmentIsClamped() {
        assertThat(AdaptiveQualitySearch.complexityAdjustedQuality(60, 10.0)).isEqualTo(50);
        assertThat(AdaptiveQualitySearch.complexityAdjustedQuality(60, 45.0)).isEqualTo(60);
        assertThat(AdaptiveQualitySearch.complexityAdjustedQuality(60, 80.0)).isEqualTo(65);
        assertThat(AdaptiveQualitySearch.complexityAdjustedQuality(35, 10.0)).isEqualTo(30);
        assertThat(AdaptiveQualitySearch.complexityAdjustedQuality(93, 80.0)).isEqualTo(95);
    }

    @Test
    void luminanceSpreadOfFlatImageIsZero() {
        BufferedImage flat = new BufferedImage(10, 10, BufferedImage.TYPE_INT_RGB);

        assertThat(AdaptiveQualitySearch.luminanceStdDev(flat)).isZero();
        assertThat(AdaptiveQualitySearch.luminanceStdDev(TestImages.pattern(60, 40))).isGreaterThan(30.0);
    }

    private static BufferedImage flatGray(int width, int height) {
        BufferedImage flat = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = flat.createGraphics();
        graphics.setColor(Color.GRAY);
        graphics.fillRect(0, 0, width, height);
        graphics.dispose();
        return flat;
    }
}
