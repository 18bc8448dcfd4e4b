package github.sarthakdev143.photo_packager.integration.image;

import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.common.ImageMetadata;
import org.apache.commons.imaging.formats.jpeg.JpegImageMetadata;
import org.apache.commons.imaging.formats.tiff.TiffField;
import org.apache.commons.imaging.formats.tiff.TiffImageMetadata;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only view of a source image's EXIF directory plus the tags a policy asked to drop.
 * The source metadata is never changed; removals are applied to a fresh output set.
 */
public final class ExifBlock {

    private final TiffImageMetadata metadata;
    private final Set<Integer> tags;
    private final Set<Integer> removedTags;

    private ExifBlock(TiffImageMetadata metadata, Set<Integer> tags, Set<Integer> removedTags) {
        this.metadata = metadata;
        this.tags = Collections.unmodifiableSet(tags);
        this.removedTags = Collections.unmodifiableSet(removedTags);
    }

    /**
     * Returns the EXIF block of a JPEG or TIFF file, or {@code null} when the file carries none.
     */
    public static ExifBlock read(byte[] imageBytes) throws IOException {
        ImageMetadata metadata;
        try {
            metadata = Imaging.getMetadata(imageBytes);
        } catch (Exception e) {
            throw new IOException("Unable to read EXIF metadata: " + e.getMessage(), e);
        }

        TiffImageMetadata exif;
        if (metadata instanceof JpegImageMetadata jpegMetadata) {
            exif = jpegMetadata.getExif();
        } else if (metadata instanceof TiffImageMetadata tiffMetadata) {
            exif = tiffMetadata;
        } else {
            return null;
        }
        if (exif == null) {
            return null;
        }

        Set<Integer> tags = new TreeSet<>();
        try {
            List<TiffField> fields = exif.getAllFields();
            for (TiffField field : fields) {
                tags.add(field.getTag());
            }
        } catch (Exception e) {
            throw new IOException("Unable to list EXIF fields: " + e.getMessage(), e);
        }
        return new ExifBlock(exif, tags, Set.of());
    }

    /**
     * Tags present in the block after removals.
     */
    public Set<Integer> tags() {
        Set<Integer> remaining = new TreeSet<>(tags);
        remaining.removeAll(removedTags);
        return remaining;
    }

    public Set<Integer> removedTags() {
        return removedTags;
    }

    public boolean contains(int tag) {
        return tags.contains(tag) && !removedTags.contains(tag);
    }

    public boolean isEmpty() {
        return tags().isEmpty();
    }

    public ExifBlock without(Set<Integer> tagsToRemove) {
        Set<Integer> removed = new LinkedHashSet<>(removedTags);
        for (Integer tag : tagsToRemove) {
            if (tags.contains(tag)) {
                removed.add(tag);
            }
        }
        return new ExifBlock(metadata, new TreeSet<>(tags), removed);
    }

    TiffOutputSet toOutputSet() throws IOException {
        try {
            TiffOutputSet outputSet = metadata.getOutputSet();
            for (Integer tag : removedTags) {
                outputSet.removeField(tag);
            }
            return outputSet;
        } catch (Exception e) {
            throw new IOException("Unable to rebuild EXIF block: " + e.getMessage(), e);
        }
    }
}
