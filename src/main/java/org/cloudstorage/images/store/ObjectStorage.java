package org.cloudstorage.images.store;

import java.io.IOException;

/**
 * The object store images are handed to. Implementations wrap a concrete storage client; the pipeline only
 * ever talks to this interface.
 */
public interface ObjectStorage {

    /**
     * @param name the bucket name, passed through unvalidated
     */
    StorageBucket getBucket(String name) throws IOException;

}
