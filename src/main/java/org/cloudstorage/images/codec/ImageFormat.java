package org.cloudstorage.images.codec;

import org.apache.commons.lang3.StringUtils;
import org.cloudstorage.images.InvalidParameterException;
import org.cloudstorage.images.ValidationException;

import java.util.Locale;

/**
 * Output formats the encoder can produce.
 */
public enum ImageFormat {
    PNG("png", "image/png", true),
    JPEG("jpeg", "image/jpeg", false);

    private final String formatName;
    private final String mimeType;
    private final boolean lossless;

    ImageFormat(String formatName, String mimeType, boolean lossless) {
        this.formatName = formatName;
        this.mimeType = mimeType;
        this.lossless = lossless;
    }

    /**
     * @return the ImageIO format name
     */
    public String getFormatName() { return formatName; }

    public String getMimeType() { return mimeType; }

    /**
     * Lossless formats keep the alpha channel; lossy ones are written as 3 channel colour.
     */
    public boolean isLossless() { return lossless; }

    /**
     * Parse an output format token, case-insensitive: png, jpg or jpeg.
     * @throws InvalidParameterException if no format is given
     * @throws ValidationException if the format is not supported
     */
    public static ImageFormat parse(String s) {
        if (StringUtils.isBlank(s)) {
            throw new InvalidParameterException("No output format specified");
        }
        String in = s.trim().toLowerCase(Locale.ROOT);
        switch (in) {
            case "png":
                return PNG;
            case "jpg":
            case "jpeg":
                return JPEG;
            default:
                throw new ValidationException("Unsupported output format: " + s);
        }
    }
}
