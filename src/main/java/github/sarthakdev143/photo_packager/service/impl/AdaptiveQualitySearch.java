package github.sarthakdev143.photo_packager.service.impl;

import github.sarthakdev143.photo_packager.integration.image.ImageEncoder;
import github.sarthakdev143.photo_packager.model.CategorySettings;
import github.sarthakdev143.photo_packager.model.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class AdaptiveQualitySearch {

    private static final Logger logger = LoggerFactory.getLogger(AdaptiveQualitySearch.class);

    static final int MAX_SEARCH_PROBES = 6;
    static final double LOW_COMPLEXITY_STDDEV = 30.0;
    static final double HIGH_COMPLEXITY_STDDEV = 60.0;
    static final int LOW_COMPLEXITY_ADJUSTMENT = -10;
    static final int HIGH_COMPLEXITY_ADJUSTMENT = 5;
    static final int MIN_ADJUSTED_QUALITY = 30;
    static final int MAX_ADJUSTED_QUALITY = 95;
    private static final long MAX_SAMPLED_PIXELS = 1_000_000L;

    private final ImageEncoder imageEncoder;

    public AdaptiveQualitySearch(ImageEncoder imageEncoder) {
        this.imageEncoder = imageEncoder;
    }

    /**
     * Encodes at the configured quality. Adaptive categories first shift the start quality by
     * image complexity, then binary-search down towards {@code minQuality} while the result is
     * over the byte ceiling.
     */
    public EncodedDerivative encode(
            BufferedImage image,
            OutputFormat format,
            CategorySettings settings,
            boolean adaptive) throws IOException {
        int startQuality = settings.quality();
        if (adaptive && settings.complexityAdjusted()) {
            int adjusted = complexityAdjustedQuality(startQuality, luminanceStdDev(image));
            startQuality = Math.max(Math.min(settings.minQuality(), startQuality), adjusted);
        }

        byte[] initial = imageEncoder.encode(image, format, startQuality);
        if (!adaptive || !settings.hasSizeCeiling() || initial.length <= settings.maxBytes()) {
            return new EncodedDerivative(initial, startQuality, 1, List.of());
        }

        // minQuality above the configured quality caps the floor at the start quality
        int floor = Math.min(settings.minQuality(), startQuality);
        Map<Integer, byte[]> probes = new HashMap<>();
        probes.put(startQuality, initial);

        int low = floor;
        int high = startQuality - 1;
        int bestQuality = -1;
        int searchProbes = 0;
        while (low <= high && searchProbes < MAX_SEARCH_PROBES) {
            int mid = (low + high) >>> 1;
            byte[] candidate = imageEncoder.encode(image, format, mid);
            probes.put(mid, candidate);
            searchProbes++;
            if (candidate.length <= settings.maxBytes()) {
                bestQuality = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }

        if (bestQuality > 0) {
            logger.debug(
                    "Quality search settled on {} after {} probe(s) for ceiling {} bytes",
                    bestQuality,
                    searchProbes,
                    settings.maxBytes());
            return new EncodedDerivative(probes.get(bestQuality), bestQuality, searchProbes + 1, List.of());
        }

        byte[] atFloor = probes.get(floor);
        if (atFloor == null) {
            atFloor = imageEncoder.encode(image, format, floor);
            searchProbes++;
            if (atFloor.length <= settings.maxBytes()) {
                return new EncodedDerivative(atFloor, floor, searchProbes + 1, List.of());
            }
        }
        String warning = "Reached minimum quality " + floor + " (" + atFloor.length
                + " bytes) without meeting the " + settings.maxBytes() + "-byte ceiling.";
        return new EncodedDerivative(atFloor, floor, searchProbes + 1, List.of(warning));
    }

    static int complexityAdjustedQuality(int baseQuality, double luminanceStdDev) {
        int adjusted = baseQuality;
        if (luminanceStdDev < LOW_COMPLEXITY_STDDEV) {
            adjusted += LOW_COMPLEXITY_ADJUSTMENT;
        } else if (luminanceStdDev > HIGH_COMPLEXITY_STDDEV) {
            adjusted += HIGH_COMPLEXITY_ADJUSTMENT;
        }
        return Math.max(MIN_ADJUSTED_QUALITY, Math.min(MAX_ADJUSTED_QUALITY, adjusted));
    }

    static double luminanceStdDev(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        long pixels = (long) width * height;
        int step = (int) Math.max(1, Math.ceil(Math.sqrt((double) pixels / MAX_SAMPLED_PIXELS)));

        double sum = 0.0;
        double sumOfSquares = 0.0;
        long count = 0;
        for (int y = 0; y < height; y += step) {
            for (int x = 0; x < width; x += step) {
                int rgb = image.getRGB(x, y);
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                double luminance = (r * 299 + g * 587 + b * 114) / 1000.0;
                sum += luminance;
                sumOfSquares += luminance * luminance;
                count++;
            }
        }
        if (count == 0) {
            return 0.0;
        }
        double mean = sum / count;
        return Math.sqrt(Math.max(0.0, sumOfSquares / count - mean * mean));
    }
}
