package org.cloudstorage.images;

/**
 * Raised when the source bytes could not be retrieved. The underlying I/O failure is kept as the cause.
 */
public class FetchException extends ImageResizerException {

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
