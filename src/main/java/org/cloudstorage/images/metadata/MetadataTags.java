package org.cloudstorage.images.metadata;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Read-only view of the EXIF tags found in a source image, keyed by lower-cased tag name.
 * Values are the raw tag values as decoded by metadata-extractor and are passed through untouched,
 * except for {@value #ORIENTATION} which is read by the orientation corrector.
 */
public final class MetadataTags {

    public static final String ORIENTATION = "orientation";

    private static final MetadataTags EMPTY = new MetadataTags(ImmutableMap.of());

    private final ImmutableMap<String, Object> tags;

    private MetadataTags(ImmutableMap<String, Object> tags) {
        this.tags = tags;
    }

    public static MetadataTags empty() {
        return EMPTY;
    }

    public static MetadataTags of(Map<String, ?> tags) {
        if (tags == null || tags.isEmpty()) {
            return EMPTY;
        }
        ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
        tags.forEach((key, value) -> {
            if (key != null && value != null) {
                builder.put(key.toLowerCase(Locale.ROOT), value);
            }
        });
        return new MetadataTags(builder.buildKeepingLast());
    }

    public boolean isEmpty() {
        return tags.isEmpty();
    }

    public boolean contains(String name) {
        return tags.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public Object get(String name) {
        return tags.get(name.toLowerCase(Locale.ROOT));
    }

    /**
     * @return the EXIF orientation tag, or empty when the image has none
     * @throws IllegalStateException if the tag is present but not numeric
     */
    public OptionalInt getOrientation() {
        Object value = tags.get(ORIENTATION);
        if (value == null) {
            return OptionalInt.empty();
        }
        if (value instanceof Number) {
            return OptionalInt.of(((Number) value).intValue());
        }
        throw new IllegalStateException("Non numeric orientation tag: " + value);
    }

    public Map<String, Object> asMap() {
        return tags;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("tags", tags)
                .toString();
    }
}
