package org.cloudstorage.images.codec;

import com.google.common.base.MoreObjects;
import org.cloudstorage.images.InvalidParameterException;

/**
 * Encoder settings. {@code quality} (0 to 100) and {@code progressive} only affect lossy output;
 * {@code optimize} asks the lossless encoder for maximum compression effort.
 */
public final class EncodeOptions {

    public static final int DEFAULT_QUALITY = 95;

    private final ImageFormat format;
    private final int quality;
    private final boolean progressive;
    private final boolean optimize;

    public EncodeOptions(ImageFormat format, int quality, boolean progressive, boolean optimize) {
        if (format == null) {
            throw new InvalidParameterException("No output format specified");
        }
        if (quality < 0 || quality > 100) {
            throw new InvalidParameterException("Quality must be between 0 and 100, got " + quality);
        }
        this.format = format;
        this.quality = quality;
        this.progressive = progressive;
        this.optimize = optimize;
    }

    public static EncodeOptions png() {
        return png(true);
    }

    public static EncodeOptions png(boolean optimize) {
        return new EncodeOptions(ImageFormat.PNG, DEFAULT_QUALITY, false, optimize);
    }

    public static EncodeOptions jpeg(int quality, boolean progressive) {
        return new EncodeOptions(ImageFormat.JPEG, quality, progressive, false);
    }

    public ImageFormat getFormat() {
        return format;
    }

    public int getQuality() {
        return quality;
    }

    public boolean isProgressive() {
        return progressive;
    }

    public boolean isOptimize() {
        return optimize;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("format", format)
                .add("quality", quality)
                .add("progressive", progressive)
                .add("optimize", optimize)
                .toString();
    }
}
