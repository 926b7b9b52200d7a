package org.cloudstorage.images.codec;

import org.cloudstorage.images.ImageResizerException;
import org.cloudstorage.images.buffer.ChannelLayout;
import org.cloudstorage.images.buffer.ImageBuffer;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Serializes an {@link ImageBuffer} to PNG or JPEG bytes.
 */
public class ImageEncoder {

    public EncodedImage encode(ImageBuffer buffer, EncodeOptions options) {
        ImageFormat format = options.getFormat();
        // lossy output has no alpha channel
        ImageBuffer source = format.isLossless() ? buffer : buffer.withLayout(ChannelLayout.RGB);
        BufferedImage image = source.getImage();

        ImageWriter writer = findWriter(format);
        try {
            ImageWriteParam params = writer.getDefaultWriteParam();
            configure(params, options);

            ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            try (ImageOutputStream imageOutputStream = ImageIO.createImageOutputStream(outputStream)) {
                writer.setOutput(imageOutputStream);
                writer.write(null, new IIOImage(image, null, null), params);
            }
            return new EncodedImage(outputStream.toByteArray(), format, image.getWidth(), image.getHeight());
        } catch (IOException e) {
            throw new ImageResizerException("Failed to encode image as " + format.getFormatName(), e);
        } finally {
            writer.dispose();
        }
    }

    private void configure(ImageWriteParam params, EncodeOptions options) {
        if (options.getFormat().isLossless()) {
            if (options.isOptimize() && params.canWriteCompressed()) {
                params.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                // 0 selects the strongest deflate level
                params.setCompressionQuality(0.0f);
            }
            return;
        }

        if (params.canWriteCompressed()) {
            params.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            params.setCompressionQuality(options.getQuality() / 100.0f);
        }
        if (params.canWriteProgressive()) {
            params.setProgressiveMode(options.isProgressive() ? ImageWriteParam.MODE_DEFAULT : ImageWriteParam.MODE_DISABLED);
        }
    }

    private ImageWriter findWriter(ImageFormat format) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.getFormatName());
        if (!writers.hasNext()) {
            throw new ImageResizerException("No ImageIO writer for format: " + format.getFormatName());
        }
        return writers.next();
    }
}
