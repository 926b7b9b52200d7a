package org.cloudstorage.images;

/**
 * An operation that needs a loaded image was called on a handle that has none, or a handle was loaded twice.
 */
public class SequencingException extends ImageResizerException {

    public SequencingException(String message) {
        super(message);
    }
}
