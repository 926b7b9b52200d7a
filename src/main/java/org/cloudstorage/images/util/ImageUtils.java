package org.cloudstorage.images.util;

import org.imgscalr.Scalr;

import java.awt.image.BufferedImage;

public class ImageUtils {

    /**
     * High quality resample to exactly {@code destWidth} x {@code destHeight}, aspect ratio not preserved.
     */
    public static BufferedImage scaleExact(BufferedImage src, int destWidth, int destHeight) {
        return Scalr.resize(src, Scalr.Method.QUALITY, Scalr.Mode.FIT_EXACT, destWidth, destHeight, Scalr.OP_ANTIALIAS);
    }

    /**
     * Like {@link #scaleExact} but without the post-resize antialias convolution, for masks that must stay
     * fully opaque or fully transparent away from their edges.
     */
    public static BufferedImage scaleMask(BufferedImage mask, int destWidth, int destHeight) {
        return Scalr.resize(mask, Scalr.Method.QUALITY, Scalr.Mode.FIT_EXACT, destWidth, destHeight);
    }

    public static BufferedImage rotate(BufferedImage src, Scalr.Rotation rotation) {
        return Scalr.rotate(src, rotation);
    }

}
