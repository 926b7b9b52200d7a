package org.cloudstorage.images.transform;

import com.google.common.base.Preconditions;
import org.cloudstorage.images.buffer.ChannelLayout;
import org.cloudstorage.images.buffer.ImageBuffer;
import org.cloudstorage.images.buffer.Size;
import org.cloudstorage.images.util.ImageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * Cuts an image into an ellipse inscribed in its bounds (a circle for square images).
 * <p>
 * The ellipse is drawn without antialiasing into a single channel mask {@code supersampleFactor} times larger
 * than the image, then resampled down to the image size; the averaging during the downsample is what smooths the
 * edge. The resampled mask becomes the alpha channel of the result.
 */
public class RoundMasker {

    private static final Logger log = LoggerFactory.getLogger(RoundMasker.class);

    public static final int DEFAULT_SUPERSAMPLE_FACTOR = 10;
    public static final int DEFAULT_INSET = 2;

    // 16k x 16k single channel mask, 256MB
    static final long MAX_MASK_PIXELS = 1L << 28;

    private final int supersampleFactor;
    private final int inset;
    private final Cropper cropper = new Cropper();

    public RoundMasker() {
        this(DEFAULT_SUPERSAMPLE_FACTOR, DEFAULT_INSET);
    }

    /**
     * @param supersampleFactor mask resolution multiplier, at least 1
     * @param inset margin between the mask edge and the ellipse, in mask pixels
     */
    public RoundMasker(int supersampleFactor, int inset) {
        Preconditions.checkArgument(supersampleFactor >= 1, "supersampleFactor must be >= 1");
        Preconditions.checkArgument(inset >= 0, "inset must be >= 0");
        this.supersampleFactor = supersampleFactor;
        this.inset = inset;
    }

    public ImageBuffer apply(ImageBuffer buffer) {
        int width = buffer.getWidth();
        int height = buffer.getHeight();

        BufferedImage mask = createMask(width, height);
        ImageBuffer fitted = cropper.fitCentered(buffer, new Size(mask.getWidth(), mask.getHeight()));
        return applyMask(fitted, mask);
    }

    /**
     * Builds the downsampled mask for an image of the given size. Mask values are in the red channel.
     */
    BufferedImage createMask(int width, int height) {
        int factor = effectiveFactor(width, height);
        int maskWidth = width * factor;
        int maskHeight = height * factor;

        BufferedImage large = new BufferedImage(maskWidth, maskHeight, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = large.createGraphics();
        try {
            g.setColor(Color.BLACK);
            g.fillRect(0, 0, maskWidth, maskHeight);
            g.setColor(Color.WHITE);
            g.fillOval(inset, inset, Math.max(0, maskWidth - 2 * inset), Math.max(0, maskHeight - 2 * inset));
        } finally {
            g.dispose();
        }

        if (factor == 1) {
            return large;
        }
        BufferedImage small = ImageUtils.scaleMask(large, width, height);
        large.flush();
        return small;
    }

    private int effectiveFactor(int width, int height) {
        int factor = supersampleFactor;
        while (factor > 1 && (long) width * factor * (long) height * factor > MAX_MASK_PIXELS) {
            factor--;
        }
        if (factor != supersampleFactor) {
            log.debug("Reduced mask supersampling from {} to {} for a {}x{} image", supersampleFactor, factor, width, height);
        }
        return factor;
    }

    private ImageBuffer applyMask(ImageBuffer fitted, BufferedImage mask) {
        int width = fitted.getWidth();
        int height = fitted.getHeight();
        BufferedImage out = new BufferedImage(width, height, ChannelLayout.RGBA.getImageType());

        BufferedImage src = fitted.getImage();
        int[] row = new int[width];
        int[] maskRow = new int[width];
        for (int y = 0; y < height; y++) {
            src.getRGB(0, y, width, 1, row, 0, width);
            mask.getRGB(0, y, width, 1, maskRow, 0, width);
            for (int x = 0; x < width; x++) {
                int alpha = (maskRow[x] >> 16) & 0xFF;
                row[x] = (alpha << 24) | (row[x] & 0x00FFFFFF);
            }
            out.setRGB(0, y, width, 1, row, 0, width);
        }
        mask.flush();
        return ImageBuffer.takeOwnership(out, ChannelLayout.RGBA);
    }

    public int getSupersampleFactor() {
        return supersampleFactor;
    }

    public int getInset() {
        return inset;
    }
}
