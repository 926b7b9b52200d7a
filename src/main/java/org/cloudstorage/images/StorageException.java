package org.cloudstorage.images;

/**
 * The storage collaborator failed to accept the encoded image. Raised unmodified from the handoff, never retried.
 */
public class StorageException extends ImageResizerException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
