package org.cloudstorage.images;

/**
 * A structurally wrong argument was supplied, e.g. a crop box larger than the image or an unknown output format.
 */
public class ValidationException extends ImageResizerException {

    public ValidationException(String message) {
        super(message);
    }
}
