package github.sarthakdev143.photo_packager.service.impl;

import github.sarthakdev143.photo_packager.integration.image.ExifBlock;
import github.sarthakdev143.photo_packager.model.MetadataPolicy;

import java.util.List;

/**
 * What a derivative carries: {@code exif == null} means it is written without EXIF.
 */
public record MetadataDecision(
        ExifBlock exif,
        MetadataPolicy requestedPolicy,
        MetadataPolicy appliedPolicy,
        List<String> warnings) {

    public MetadataDecision {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        exif = exif != null && exif.isEmpty() ? null : exif;
    }

    public boolean embedsMetadata() {
        return exif != null;
    }

    public boolean isFallback() {
        return requestedPolicy != appliedPolicy;
    }
}
