package org.cloudstorage.images.transform;

import org.cloudstorage.images.InvalidParameterException;
import org.cloudstorage.images.ValidationException;
import org.cloudstorage.images.buffer.Box;
import org.cloudstorage.images.buffer.ImageBuffer;
import org.cloudstorage.images.buffer.Size;
import org.cloudstorage.images.util.ImageUtils;

import java.awt.image.BufferedImage;

public class Cropper {

    /**
     * Crops a box of exactly {@code width} x {@code height} from the middle of the image.
     * @throws InvalidParameterException if either side is missing or not positive
     * @throws ValidationException if either side is larger than the image
     */
    public ImageBuffer centerCrop(ImageBuffer buffer, Integer width, Integer height) {
        if (width == null || height == null) {
            throw new InvalidParameterException("Both width and height must be specified to crop");
        }
        if (width <= 0 || height <= 0) {
            throw new InvalidParameterException("Crop size must be positive, got " + width + "x" + height);
        }
        if (width > buffer.getWidth()) {
            throw new ValidationException("Crop width " + width + " is larger than image width " + buffer.getWidth());
        }
        if (height > buffer.getHeight()) {
            throw new ValidationException("Crop height " + height + " is larger than image height " + buffer.getHeight());
        }
        return crop(buffer, computeCenterBox(buffer.getSize(), new Size(width, height)));
    }

    /**
     * Offsets are {@code (current - target) / 2} truncated, so an odd leftover pixel is cut from the right or bottom edge.
     */
    public static Box computeCenterBox(Size current, Size target) {
        int left = (current.width - target.width) / 2;
        int top = (current.height - target.height) / 2;
        return new Box(left, top, left + target.width, top + target.height);
    }

    public ImageBuffer crop(ImageBuffer buffer, Box box) {
        BufferedImage region = buffer.getImage().getSubimage(box.left, box.top, box.getWidth(), box.getHeight());
        // the subimage shares the source raster, copy it out
        return ImageBuffer.copyOf(region, buffer.getLayout());
    }

    /**
     * Scales the image to cover {@code target} while keeping its aspect ratio, then crops the overflow evenly
     * from both sides.
     */
    public ImageBuffer fitCentered(ImageBuffer buffer, Size target) {
        Size current = buffer.getSize();
        if (current.equals(target)) {
            return buffer.withLayout(buffer.getLayout());
        }
        double scale = Math.max(target.width / (double) current.width, target.height / (double) current.height);
        int coverWidth = Math.max(target.width, (int) Math.ceil(current.width * scale));
        int coverHeight = Math.max(target.height, (int) Math.ceil(current.height * scale));

        ImageBuffer covering = buffer;
        if (coverWidth != current.width || coverHeight != current.height) {
            BufferedImage scaled = ImageUtils.scaleExact(buffer.getImage(), coverWidth, coverHeight);
            covering = ImageBuffer.copyOf(scaled, buffer.getLayout());
            scaled.flush();
        }
        return crop(covering, computeCenterBox(covering.getSize(), target));
    }
}
