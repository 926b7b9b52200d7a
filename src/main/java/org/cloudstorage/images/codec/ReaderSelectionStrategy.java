package org.cloudstorage.images.codec;

import javax.imageio.ImageReader;
import java.util.Iterator;

/**
 * Picks one {@link ImageReader} among the candidates ImageIO offers for a source.
 */
public interface ReaderSelectionStrategy {

    /**
     * @return the chosen reader, or null if there are no candidates
     */
    ImageReader selectImageReader(Iterator<ImageReader> candidates);

}
