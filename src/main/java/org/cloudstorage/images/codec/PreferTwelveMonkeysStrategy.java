package org.cloudstorage.images.codec;

import javax.imageio.ImageReader;
import java.util.Iterator;

/**
 * Prefers TwelveMonkeys readers, which cope with CMYK and YCCK JPEGs the JDK reader rejects,
 * and otherwise takes the first candidate.
 */
public class PreferTwelveMonkeysStrategy implements ReaderSelectionStrategy {

    public static final PreferTwelveMonkeysStrategy INSTANCE = new PreferTwelveMonkeysStrategy();

    private static final String TWELVEMONKEYS_PACKAGE = "com.twelvemonkeys";

    @Override
    public ImageReader selectImageReader(Iterator<ImageReader> candidates) {
        if (candidates == null) {
            return null;
        }

        ImageReader first = null;
        while (candidates.hasNext()) {
            ImageReader reader = candidates.next();
            if (reader.getClass().getName().startsWith(TWELVEMONKEYS_PACKAGE)) {
                if (first != null && first != reader) {
                    first.dispose();
                }
                return reader;
            }
            if (first == null) {
                first = reader;
            } else {
                reader.dispose();
            }
        }
        return first;
    }
}
