package org.cloudstorage.images;

/**
 * A required argument was omitted or is out of its allowed range (no width or height for a resize,
 * no format for an encode, no bucket or key for a store).
 */
public class InvalidParameterException extends ImageResizerException {

    public InvalidParameterException(String message) {
        super(message);
    }
}
