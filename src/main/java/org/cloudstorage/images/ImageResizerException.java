package org.cloudstorage.images;

/**
 * Base class of every error raised by the resizing pipeline. None of them are retried internally;
 * recovery is left to the caller.
 */
public class ImageResizerException extends RuntimeException {

    public ImageResizerException(String message) {
        super(message);
    }

    public ImageResizerException(String message, Throwable cause) {
        super(message, cause);
    }
}
