package org.cloudstorage.images.codec;

import com.google.common.base.MoreObjects;
import com.google.common.io.ByteSource;

/**
 * Encoded output ready for the storage collaborator.
 */
public final class EncodedImage {

    private final byte[] bytes;
    private final ImageFormat format;
    private final int width;
    private final int height;

    public EncodedImage(byte[] bytes, ImageFormat format, int width, int height) {
        this.bytes = bytes;
        this.format = format;
        this.width = width;
        this.height = height;
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    public ByteSource asByteSource() {
        return ByteSource.wrap(bytes);
    }

    public int getLength() {
        return bytes.length;
    }

    public ImageFormat getFormat() {
        return format;
    }

    public String getContentType() {
        return format.getMimeType();
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("contentType", getContentType())
                .add("width", width)
                .add("height", height)
                .add("length", bytes.length)
                .toString();
    }
}
