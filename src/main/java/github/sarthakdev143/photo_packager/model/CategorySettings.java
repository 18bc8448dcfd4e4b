package github.sarthakdev143.photo_packager.model;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Encode parameters for one derivative category.
 *
 * @param quality            configured encoder quality, 1-100
 * @param targetPixels       pixel budget for compressed categories, ignored for optimized ones
 * @param maxBytes           optional size ceiling that triggers the quality search, 0 disables it
 * @param minQuality         lowest quality the search may reach
 * @param complexityAdjusted shift the start quality by image luminance spread before searching
 * @param acceptedExtensions source extensions this category renders, empty means every decodable source
 */
public record CategorySettings(
        int quality,
        long targetPixels,
        long maxBytes,
        int minQuality,
        boolean complexityAdjusted,
        Set<String> acceptedExtensions) {

    public static final int DEFAULT_OPTIMIZED_QUALITY = 90;
    public static final int DEFAULT_COMPRESSED_QUALITY = 60;
    public static final long DEFAULT_TARGET_PIXELS = 2_000_000L;
    public static final int DEFAULT_MIN_QUALITY = 30;

    public CategorySettings {
        acceptedExtensions = acceptedExtensions == null
                ? Set.of()
                : acceptedExtensions.stream()
                        .map(ext -> ext.trim().toLowerCase(Locale.ROOT).replace(".", ""))
                        .filter(ext -> !ext.isEmpty())
                        .collect(Collectors.toUnmodifiableSet());
    }

    public static CategorySettings optimized(int quality) {
        return new CategorySettings(quality, 0L, 0L, DEFAULT_MIN_QUALITY, false, Set.of());
    }

    public static CategorySettings compressed(int quality, long targetPixels) {
        return new CategorySettings(quality, targetPixels, 0L, DEFAULT_MIN_QUALITY, true, Set.of());
    }

    public static CategorySettings defaultsFor(OutputCategory category) {
        return category.isCompressed()
                ? compressed(DEFAULT_COMPRESSED_QUALITY, DEFAULT_TARGET_PIXELS)
                : optimized(DEFAULT_OPTIMIZED_QUALITY);
    }

    public CategorySettings withMaxBytes(long ceiling, int fallbackMinQuality) {
        return new CategorySettings(quality, targetPixels, ceiling, fallbackMinQuality, complexityAdjusted, acceptedExtensions);
    }

    public CategorySettings withComplexityAdjusted(boolean adjusted) {
        return new CategorySettings(quality, targetPixels, maxBytes, minQuality, adjusted, acceptedExtensions);
    }

    public CategorySettings withAcceptedExtensions(Set<String> extensions) {
        return new CategorySettings(quality, targetPixels, maxBytes, minQuality, complexityAdjusted, extensions);
    }

    public boolean hasSizeCeiling() {
        return maxBytes > 0;
    }

    public boolean accepts(String extension) {
        return acceptedExtensions.isEmpty()
                || (extension != null && acceptedExtensions.contains(extension.toLowerCase(Locale.ROOT)));
    }
}
