package org.cloudstorage.images.buffer;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * Decoded 8-bit pixel data in either {@link ChannelLayout#RGB} or {@link ChannelLayout#RGBA} layout.
 * <p>
 * A buffer always owns its backing {@link BufferedImage}: the factory methods copy their input, and every
 * transform in the pipeline allocates a fresh buffer for its output, so two buffers never share pixel storage.
 * The backing image returned by {@link #getImage()} must be treated as read-only.
 */
public final class ImageBuffer {

    private final BufferedImage image;
    private final ChannelLayout layout;

    private ImageBuffer(BufferedImage image, ChannelLayout layout) {
        this.image = image;
        this.layout = layout;
    }

    /**
     * Copies any {@link BufferedImage} into a new buffer of the requested layout. Converting to
     * {@link ChannelLayout#RGB} drops the alpha channel without compositing.
     */
    public static ImageBuffer copyOf(BufferedImage src, ChannelLayout layout) {
        Preconditions.checkNotNull(src, "source image");
        Preconditions.checkNotNull(layout, "layout");
        int width = src.getWidth();
        int height = src.getHeight();
        BufferedImage dst = new BufferedImage(width, height, layout.getImageType());
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            src.getRGB(0, y, width, 1, row, 0, width);
            if (!layout.hasAlpha()) {
                for (int x = 0; x < width; x++) {
                    row[x] |= 0xFF000000;
                }
            }
            dst.setRGB(0, y, width, 1, row, 0, width);
        }
        return new ImageBuffer(dst, layout);
    }

    /**
     * Wraps a freshly allocated image without copying it. The caller hands the image over and must not keep
     * a reference to it.
     * @throws IllegalArgumentException if the image type is not the one backing {@code layout}
     */
    public static ImageBuffer takeOwnership(BufferedImage image, ChannelLayout layout) {
        Preconditions.checkNotNull(image, "image");
        Preconditions.checkArgument(image.getType() == layout.getImageType(),
                "Image type %s does not back layout %s", image.getType(), layout);
        return new ImageBuffer(image, layout);
    }

    /**
     * Creates a buffer from pixel bytes in R,G,B(,A) order, row-major.
     */
    public static ImageBuffer fromPixels(int width, int height, ChannelLayout layout, byte[] pixels) {
        Preconditions.checkArgument(width > 0 && height > 0, "Invalid dimensions %sx%s", width, height);
        int channels = layout.getChannels();
        Preconditions.checkArgument(pixels.length == width * height * channels,
                "Expected %s bytes for %sx%s %s but got %s", width * height * channels, width, height, layout, pixels.length);

        BufferedImage dst = new BufferedImage(width, height, layout.getImageType());
        byte[] data = ((DataBufferByte) dst.getRaster().getDataBuffer()).getData();
        for (int i = 0; i < pixels.length; i += channels) {
            // backing storage is reversed: B,G,R or A,B,G,R
            for (int c = 0; c < channels; c++) {
                data[i + channels - 1 - c] = pixels[i + c];
            }
        }
        return new ImageBuffer(dst, layout);
    }

    /**
     * A deep copy of the backing image, safe to modify.
     */
    public BufferedImage toBufferedImage() {
        return copyOf(image, layout).image;
    }

    public BufferedImage getImage() {
        return image;
    }

    public ChannelLayout getLayout() {
        return layout;
    }

    public int getWidth() {
        return image.getWidth();
    }

    public int getHeight() {
        return image.getHeight();
    }

    public int getChannels() {
        return layout.getChannels();
    }

    public Size getSize() {
        return new Size(getWidth(), getHeight());
    }

    /**
     * @return a copy of the pixels in R,G,B(,A) order, row-major, {@code width * height * channels} bytes long
     */
    public byte[] getPixels() {
        byte[] data = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        int channels = layout.getChannels();
        byte[] pixels = new byte[getWidth() * getHeight() * channels];
        for (int i = 0; i < pixels.length; i += channels) {
            for (int c = 0; c < channels; c++) {
                pixels[i + c] = data[i + channels - 1 - c];
            }
        }
        return pixels;
    }

    /**
     * @return the pixel at (x, y) as packed ARGB; alpha is 255 for RGB buffers
     */
    public int getARGB(int x, int y) {
        return image.getRGB(x, y);
    }

    public int getAlpha(int x, int y) {
        return (image.getRGB(x, y) >>> 24) & 0xFF;
    }

    public ImageBuffer withLayout(ChannelLayout target) {
        return copyOf(image, target);
    }

    /**
     * Pixel-for-pixel equality of the colour channels, and of alpha when both buffers carry it.
     */
    public boolean samePixels(ImageBuffer other) {
        if (other == null || other.getWidth() != getWidth() || other.getHeight() != getHeight()) {
            return false;
        }
        int mask = layout.hasAlpha() && other.layout.hasAlpha() ? 0xFFFFFFFF : 0x00FFFFFF;
        for (int y = 0; y < getHeight(); y++) {
            for (int x = 0; x < getWidth(); x++) {
                if ((getARGB(x, y) & mask) != (other.getARGB(x, y) & mask)) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("width", getWidth())
                .add("height", getHeight())
                .add("layout", layout)
                .toString();
    }
}
