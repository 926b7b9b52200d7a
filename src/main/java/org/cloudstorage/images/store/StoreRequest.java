package org.cloudstorage.images.store;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import org.cloudstorage.images.ValidationException;
import org.cloudstorage.images.codec.ImageFormat;

import java.util.Map;

/**
 * Where and how to store an image. Bucket and key are opaque to the pipeline; they are checked for presence only.
 * Unset encoder settings fall back to the pipeline's configuration.
 */
public final class StoreRequest {

    private final String bucket;
    private final String key;
    private final ImmutableMap<String, String> metadata;
    private final ImageFormat format;
    private final Integer quality;
    private final Boolean progressive;
    private final boolean publicRead;

    private StoreRequest(Builder builder) {
        this.bucket = builder.bucket;
        this.key = builder.key;
        this.metadata = builder.metadata;
        this.format = builder.format;
        this.quality = builder.quality;
        this.progressive = builder.progressive;
        this.publicRead = builder.publicRead;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getBucket() {
        return bucket;
    }

    public String getKey() {
        return key;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public ImageFormat getFormat() {
        return format;
    }

    /**
     * @return the requested lossy quality, or null for the configured default
     */
    public Integer getQuality() {
        return quality;
    }

    /**
     * @return the requested progressive flag, or null for the configured default
     */
    public Boolean getProgressive() {
        return progressive;
    }

    public boolean isPublicRead() {
        return publicRead;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("bucket", bucket)
                .add("key", key)
                .add("metadata", metadata)
                .add("format", format)
                .add("quality", quality)
                .add("progressive", progressive)
                .add("publicRead", publicRead)
                .toString();
    }

    public static class Builder {
        private String bucket;
        private String key;
        private ImmutableMap<String, String> metadata = ImmutableMap.of();
        private ImageFormat format = ImageFormat.PNG;
        private Integer quality;
        private Boolean progressive;
        private boolean publicRead = true;

        public Builder bucket(String bucket) {
            this.bucket = bucket;
            return this;
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        /**
         * @throws ValidationException if a key or value is null
         */
        public Builder metadata(Map<String, String> metadata) {
            if (metadata == null) {
                this.metadata = ImmutableMap.of();
                return this;
            }
            ImmutableMap.Builder<String, String> copy = ImmutableMap.builder();
            for (Map.Entry<String, String> entry : metadata.entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    throw new ValidationException("metadata must map string keys to string values, got " + entry);
                }
                copy.put(entry.getKey(), entry.getValue());
            }
            this.metadata = copy.buildKeepingLast();
            return this;
        }

        public Builder format(ImageFormat format) {
            this.format = format;
            return this;
        }

        /**
         * @param format an output format name such as {@code png} or {@code jpeg}
         */
        public Builder format(String format) {
            return format(ImageFormat.parse(format));
        }

        public Builder quality(int quality) {
            this.quality = quality;
            return this;
        }

        public Builder progressive(boolean progressive) {
            this.progressive = progressive;
            return this;
        }

        public Builder publicRead(boolean publicRead) {
            this.publicRead = publicRead;
            return this;
        }

        public StoreRequest build() {
            return new StoreRequest(this);
        }
    }
}
