package org.cloudstorage.images.buffer;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.util.Objects;

public final class Size {

    public final int width;
    public final int height;

    public Size(int width, int height) {
        Preconditions.checkArgument(width >= 0 && height >= 0, "Negative size %sx%s", width, height);
        this.width = width;
        this.height = height;
    }

    public static Size of(int width, int height) {
        return new Size(width, height);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Size)) return false;
        Size size = (Size) o;
        return width == size.width && height == size.height;
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, height);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("width", width)
                .add("height", height)
                .toString();
    }
}
