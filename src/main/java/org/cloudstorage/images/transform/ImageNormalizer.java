package org.cloudstorage.images.transform;

import org.cloudstorage.images.buffer.ChannelLayout;
import org.cloudstorage.images.buffer.ImageBuffer;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * Converts a decoded image of any colour model into an RGBA buffer composited over opaque white.
 * <p>
 * Partially transparent pixels are blended toward white instead of keeping whatever colour the encoder left
 * behind them, which otherwise shows up as dark fringes once alpha is dropped. Gray sources keep their sample
 * values.
 */
public class ImageNormalizer {

    public ImageBuffer normalize(BufferedImage decoded) {
        int width = decoded.getWidth();
        int height = decoded.getHeight();
        BufferedImage canvas = new BufferedImage(width, height, ChannelLayout.RGBA.getImageType());

        Graphics2D g = canvas.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
            g.setComposite(AlphaComposite.SrcOver);
            g.drawImage(decoded, 0, 0, null);
        } finally {
            g.dispose();
        }
        return ImageBuffer.takeOwnership(canvas, ChannelLayout.RGBA);
    }
}
