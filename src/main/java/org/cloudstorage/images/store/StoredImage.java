package org.cloudstorage.images.store;

import com.google.common.base.MoreObjects;

public final class StoredImage {

    private final String bucket;
    private final String key;
    private final String contentType;
    private final String publicUrl;
    private final long length;
    private final boolean publicRead;

    public StoredImage(String bucket, String key, String contentType, String publicUrl, long length, boolean publicRead) {
        this.bucket = bucket;
        this.key = key;
        this.contentType = contentType;
        this.publicUrl = publicUrl;
        this.length = length;
        this.publicRead = publicRead;
    }

    public String getBucket() {
        return bucket;
    }

    public String getKey() {
        return key;
    }

    public String getContentType() {
        return contentType;
    }

    public String getPublicUrl() {
        return publicUrl;
    }

    public long getLength() {
        return length;
    }

    public boolean isPublicRead() {
        return publicRead;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("bucket", bucket)
                .add("key", key)
                .add("contentType", contentType)
                .add("publicUrl", publicUrl)
                .add("length", length)
                .add("publicRead", publicRead)
                .toString();
    }
}
