package org.cloudstorage.images.transform;

import org.cloudstorage.images.InvalidParameterException;
import org.cloudstorage.images.buffer.ImageBuffer;
import org.cloudstorage.images.buffer.Size;
import org.cloudstorage.images.util.ImageUtils;

import java.awt.image.BufferedImage;

/**
 * Exact resize and shrink-to-fit. A {@code null} width or height means "not specified".
 */
public class Resizer {

    /**
     * Resize to the given box, or scale proportionally when only one side is given.
     * The derived side is truncated: {@code height = floor(currentHeight * width / currentWidth)}.
     */
    public ImageBuffer resize(ImageBuffer buffer, Integer width, Integer height) {
        Size target = computeExactSize(buffer.getSize(), width, height);
        return scale(buffer, target);
    }

    /**
     * Aspect preserving shrink that never enlarges. With both sides given the image only shrinks when it exceeds
     * the box on both sides; with one side given, when it exceeds that side.
     * @return the shrunk buffer, or {@code buffer} itself when no shrinking is needed
     */
    public ImageBuffer shrinkToFit(ImageBuffer buffer, Integer width, Integer height) {
        Size target = computeShrinkSize(buffer.getSize(), width, height);
        if (target.equals(buffer.getSize())) {
            return buffer;
        }
        return scale(buffer, target);
    }

    public static Size computeExactSize(Size current, Integer width, Integer height) {
        checkRequested(width, height);
        if (width != null && height != null) {
            return new Size(width, height);
        }
        if (width != null) {
            return new Size(width, proportional(current.height, width, current.width, "height"));
        }
        return new Size(proportional(current.width, height, current.height, "width"), height);
    }

    public static Size computeShrinkSize(Size current, Integer width, Integer height) {
        checkRequested(width, height);
        if (width != null && height != null) {
            if (current.width <= width || current.height <= height) {
                return current;
            }
            // fit inside the box: the tighter side hits its bound exactly
            if ((long) current.width * height >= (long) current.height * width) {
                return new Size(width, Math.max(1, truncate(current.height, width, current.width)));
            }
            return new Size(Math.max(1, truncate(current.width, height, current.height)), height);
        }
        if (width != null) {
            if (current.width <= width) {
                return current;
            }
            return new Size(width, Math.max(1, truncate(current.height, width, current.width)));
        }
        if (current.height <= height) {
            return current;
        }
        return new Size(Math.max(1, truncate(current.width, height, current.height)), height);
    }

    private ImageBuffer scale(ImageBuffer buffer, Size target) {
        BufferedImage scaled = ImageUtils.scaleExact(buffer.getImage(), target.width, target.height);
        ImageBuffer result = ImageBuffer.copyOf(scaled, buffer.getLayout());
        scaled.flush();
        return result;
    }

    /**
     * @throws InvalidParameterException if neither side is given or a given side is not positive
     */
    public static void checkRequested(Integer width, Integer height) {
        if (width == null && height == null) {
            throw new InvalidParameterException("One of width or height must be specified");
        }
        if ((width != null && width <= 0) || (height != null && height <= 0)) {
            throw new InvalidParameterException("Width and height must be positive, got " + width + "x" + height);
        }
    }

    private static int proportional(int other, int given, int current, String side) {
        int result = truncate(other, given, current);
        if (result < 1) {
            throw new InvalidParameterException("Scaling to " + given + " would make the " + side + " zero");
        }
        return result;
    }

    private static int truncate(int other, int given, int current) {
        return (int) ((long) other * given / current);
    }
}
