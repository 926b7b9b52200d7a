package org.cloudstorage.images.transform;

import org.cloudstorage.images.buffer.ImageBuffer;
import org.cloudstorage.images.metadata.MetadataTags;
import org.cloudstorage.images.util.ImageUtils;
import org.imgscalr.Scalr;

import java.awt.image.BufferedImage;
import java.util.OptionalInt;

public class OrientationCorrector {

    /**
     * Looks up the orientation tag, if any.
     * @return the orientation to correct for, {@link Orientation#Normal} when the image carries no tag
     * @throws IllegalStateException if the tag is outside 1..8
     */
    public Orientation orientationOf(MetadataTags tags) {
        OptionalInt tag = tags.getOrientation();
        return tag.isPresent() ? Orientation.fromExifOrientation(tag.getAsInt()) : Orientation.Normal;
    }

    /**
     * Applies the operations of {@code orientation} in order. Always returns a new buffer.
     */
    public ImageBuffer apply(ImageBuffer buffer, Orientation orientation) {
        if (orientation.getOperations().isEmpty()) {
            return buffer.withLayout(buffer.getLayout());
        }
        BufferedImage working = buffer.getImage();
        for (Scalr.Rotation rotation : orientation.getOperations()) {
            BufferedImage next = ImageUtils.rotate(working, rotation);
            if (working != buffer.getImage()) {
                working.flush();
            }
            working = next;
        }
        ImageBuffer result = ImageBuffer.copyOf(working, buffer.getLayout());
        working.flush();
        return result;
    }
}
