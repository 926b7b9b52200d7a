package org.cloudstorage.images.store;

import com.google.common.io.ByteSource;

import java.io.IOException;
import java.util.Map;

public interface StorageBucket {

    String getName();

    /**
     * Writes {@code content} under {@code key}, replacing any existing object.
     */
    void upload(String key, ByteSource content, String contentType, Map<String, String> metadata) throws IOException;

    void makePublic(String key) throws IOException;

    String getPublicUrl(String key);

}
