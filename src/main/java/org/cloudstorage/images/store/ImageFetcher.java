package org.cloudstorage.images.store;

import com.google.common.io.ByteSource;
import org.cloudstorage.images.FetchException;

/**
 * Retrieves encoded image bytes from a location.
 */
@FunctionalInterface
public interface ImageFetcher {

    /**
     * @throws FetchException if the bytes cannot be retrieved
     */
    ByteSource fetch(String location);

}
