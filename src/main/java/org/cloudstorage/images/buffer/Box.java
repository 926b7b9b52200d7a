package org.cloudstorage.images.buffer;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * A pixel rectangle given by its edges. {@code right} and {@code bottom} are exclusive.
 */
public final class Box {

    public final int left;
    public final int top;
    public final int right;
    public final int bottom;

    public Box(int left, int top, int right, int bottom) {
        Preconditions.checkArgument(left >= 0 && top >= 0, "Negative box origin %s,%s", left, top);
        Preconditions.checkArgument(right >= left && bottom >= top, "Inverted box %s,%s,%s,%s", left, top, right, bottom);
        this.left = left;
        this.top = top;
        this.right = right;
        this.bottom = bottom;
    }

    public int getWidth() {
        return right - left;
    }

    public int getHeight() {
        return bottom - top;
    }

    public Size getSize() {
        return new Size(getWidth(), getHeight());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Box)) return false;
        Box box = (Box) o;
        return left == box.left && top == box.top && right == box.right && bottom == box.bottom;
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, top, right, bottom);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("left", left)
                .add("top", top)
                .add("right", right)
                .add("bottom", bottom)
                .toString();
    }
}
