package org.cloudstorage.images.transform;

import org.imgscalr.Scalr;

import java.util.List;

/**
 * The eight EXIF orientations and the ordered geometric operations that bring the stored pixels upright.
 * Rotations are clockwise.
 */
public enum Orientation {
    Normal(1, List.of()),
    FlipH(2, List.of(Scalr.Rotation.FLIP_HORZ)),
    Rotate180(3, List.of(Scalr.Rotation.CW_180)),
    FlipV(4, List.of(Scalr.Rotation.FLIP_VERT)),
    Transpose(5, List.of(Scalr.Rotation.CW_90, Scalr.Rotation.FLIP_HORZ)),
    Rotate90(6, List.of(Scalr.Rotation.CW_90)),
    Transverse(7, List.of(Scalr.Rotation.CW_90, Scalr.Rotation.FLIP_VERT)),
    Rotate270(8, List.of(Scalr.Rotation.CW_270));

    private final int value; // value as defined in TIFF spec
    private final List<Scalr.Rotation> operations;

    Orientation(int value, List<Scalr.Rotation> operations) {
        this.value = value;
        this.operations = operations;
    }

    public int value() {
        return value;
    }

    public List<Scalr.Rotation> getOperations() {
        return operations;
    }

    /**
     * @return true if correcting this orientation swaps width and height
     */
    public boolean isFlipDimensions() {
        return value >= 5;
    }

    /**
     * @return the orientation whose correction undoes this one
     */
    public Orientation inverse() {
        switch (this) {
            case Rotate90:
                return Rotate270;
            case Rotate270:
                return Rotate90;
            default:
                // mirrors, 180 degree turns and the diagonal flips are their own inverse
                return this;
        }
    }

    /**
     * @throws IllegalStateException for values outside 1..8, which only corrupt metadata or an extraction bug produce
     */
    public static Orientation fromExifOrientation(final int orientation) {
        for (Orientation o : values()) {
            if (o.value == orientation) {
                return o;
            }
        }
        throw new IllegalStateException("EXIF orientation must be between 1 and 8, got " + orientation);
    }
}
