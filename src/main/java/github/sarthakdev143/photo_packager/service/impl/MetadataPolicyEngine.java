package github.sarthakdev143.photo_packager.service.impl;

import github.sarthakdev143.photo_packager.integration.image.ExifBlock;
import github.sarthakdev143.photo_packager.model.MetadataPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Component
public class MetadataPolicyEngine {

    private static final Logger logger = LoggerFactory.getLogger(MetadataPolicyEngine.class);
    private static final String EXIF_REWRITER_CLASS = "org.apache.commons.imaging.formats.jpeg.exif.ExifRewriter";

    static final int TAG_ORIENTATION = 0x0112;

    /** DateTime, DateTimeOriginal, DateTimeDigitized, OffsetTime*, SubSecTime*. */
    static final Set<Integer> TIMESTAMP_TAGS = Set.of(
            0x0132, 0x9003, 0x9004, 0x9010, 0x9011, 0x9012, 0x9290, 0x9291, 0x9292);

    /** Make, Model, Software, BodySerialNumber, LensSpecification, LensMake, LensModel, LensSerialNumber. */
    static final Set<Integer> DEVICE_TAGS = Set.of(
            0x010F, 0x0110, 0x0131, 0xA431, 0xA432, 0xA433, 0xA434, 0xA435);

    private final boolean selectiveStrippingSupported;

    public MetadataPolicyEngine() {
        this(ClassUtils.isPresent(EXIF_REWRITER_CLASS, MetadataPolicyEngine.class.getClassLoader()));
    }

    MetadataPolicyEngine(boolean selectiveStrippingSupported) {
        this.selectiveStrippingSupported = selectiveStrippingSupported;
        if (!selectiveStrippingSupported) {
            logger.warn("Selective EXIF editing is unavailable; partial metadata policies will strip everything");
        }
    }

    public boolean supportsSelectiveStripping() {
        return selectiveStrippingSupported;
    }

    /**
     * Decides which EXIF tags survive into a derivative. The orientation tag is always dropped
     * because the decoder has already rotated the pixels.
     */
    public MetadataDecision apply(ExifBlock exif, MetadataPolicy policy) {
        MetadataPolicy requested = policy == null ? MetadataPolicy.KEEP : policy;

        if (requested.isSelective() && !selectiveStrippingSupported) {
            String warning = "Metadata policy " + requested
                    + " needs selective tag removal, which is unavailable; stripped all metadata instead.";
            return new MetadataDecision(null, requested, MetadataPolicy.STRIP_ALL, List.of(warning));
        }
        if (requested == MetadataPolicy.STRIP_ALL || exif == null) {
            return new MetadataDecision(null, requested, requested, List.of());
        }

        Set<Integer> removed = new HashSet<>();
        removed.add(TAG_ORIENTATION);
        if (requested.stripsDates()) {
            removed.addAll(TIMESTAMP_TAGS);
        }
        if (requested.stripsCamera()) {
            removed.addAll(DEVICE_TAGS);
        }
        return new MetadataDecision(exif.without(removed), requested, requested, List.of());
    }
}
