package org.cloudstorage.images;

public class DecodeException extends ImageResizerException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
