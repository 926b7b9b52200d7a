package org.cloudstorage.images.buffer;

import java.awt.image.BufferedImage;

/**
 * Channel layouts an {@link ImageBuffer} can hold, 8 bits per channel.
 */
public enum ChannelLayout {
    RGB(3, BufferedImage.TYPE_3BYTE_BGR),
    RGBA(4, BufferedImage.TYPE_4BYTE_ABGR);

    private final int channels;
    private final int imageType;

    ChannelLayout(int channels, int imageType) {
        this.channels = channels;
        this.imageType = imageType;
    }

    public int getChannels() {
        return channels;
    }

    /**
     * @return the {@link BufferedImage} type used to back buffers of this layout
     */
    public int getImageType() {
        return imageType;
    }

    public boolean hasAlpha() {
        return this == RGBA;
    }
}
