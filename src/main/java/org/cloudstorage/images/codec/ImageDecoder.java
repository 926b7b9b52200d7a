package org.cloudstorage.images.codec;

import com.google.common.io.ByteSource;
import org.cloudstorage.images.DecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;

/**
 * Decodes the first image of an encoded byte source through ImageIO.
 */
public class ImageDecoder {

    private static final Logger log = LoggerFactory.getLogger(ImageDecoder.class);

    private final ReaderSelectionStrategy selectionStrategy;

    public ImageDecoder() {
        this(PreferTwelveMonkeysStrategy.INSTANCE);
    }

    public ImageDecoder(ReaderSelectionStrategy selectionStrategy) {
        this.selectionStrategy = selectionStrategy != null ? selectionStrategy : PreferTwelveMonkeysStrategy.INSTANCE;
    }

    /**
     * @param imageBytes the encoded image
     * @return the decoded image, in whatever colour model the reader produces
     * @throws DecodeException if no reader understands the bytes or the reader fails
     */
    public BufferedImage decode(ByteSource imageBytes) {
        try (InputStream is = imageBytes.openBufferedStream();
             ImageInputStream iis = ImageIO.createImageInputStream(is)) {
            if (iis == null) {
                throw new DecodeException("No ImageInputStream could be created for source image");
            }

            Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
            if (!readers.hasNext()) {
                throw new DecodeException("No compatible ImageReader for source image");
            }

            ImageReader reader = selectionStrategy.selectImageReader(readers);
            if (reader == null) {
                throw new DecodeException("No suitable ImageReader selected for source image");
            }

            try {
                // metadata is read separately by the MetadataExtractor
                reader.setInput(iis, true, true);
                log.debug("Decoding with {} ({}x{})", reader.getClass().getName(), reader.getWidth(0), reader.getHeight(0));
                BufferedImage image = reader.read(0);
                if (image == null) {
                    throw new DecodeException("Reader returned no image");
                }
                return image;
            } finally {
                reader.dispose();
            }
        } catch (DecodeException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new DecodeException("Failed to decode source image: " + e.getMessage(), e);
        }
    }
}
