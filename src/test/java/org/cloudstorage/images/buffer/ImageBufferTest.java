package org.cloudstorage.images.buffer;

import org.cloudstorage.images.TestBase;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.awt.image.BufferedImage;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

@RunWith(JUnit4.class)
public class ImageBufferTest extends TestBase {

    @Test
    public void testFromPixelsKeepsChannelOrder() {
        byte[] pixels = new byte[] {
                (byte) 255, 0, 0, (byte) 255,   0, (byte) 255, 0, (byte) 128,
                0, 0, (byte) 255, 0,            10, 20, 30, 40
        };
        ImageBuffer buffer = ImageBuffer.fromPixels(2, 2, ChannelLayout.RGBA, pixels);

        assertEquals(2, buffer.getWidth());
        assertEquals(2, buffer.getHeight());
        assertEquals(4, buffer.getChannels());
        assertEquals(0xFFFF0000, buffer.getARGB(0, 0));
        assertEquals(128, buffer.getAlpha(1, 0));
        assertArrayEquals(pixels, buffer.getPixels());
    }

    @Test
    public void testRgbPixels() {
        byte[] pixels = new byte[] { 1, 2, 3, 4, 5, 6 };
        ImageBuffer buffer = ImageBuffer.fromPixels(2, 1, ChannelLayout.RGB, pixels);
        assertEquals(0xFF010203, buffer.getARGB(0, 0));
        assertEquals(255, buffer.getAlpha(1, 0));
        assertArrayEquals(pixels, buffer.getPixels());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFromPixelsWrongLength() {
        ImageBuffer.fromPixels(2, 2, ChannelLayout.RGB, new byte[5]);
    }

    @Test
    public void testCopyOfIsIndependent() {
        BufferedImage src = gradient(16, 8);
        ImageBuffer buffer = ImageBuffer.copyOf(src, ChannelLayout.RGBA);
        int before = buffer.getARGB(1, 1);
        src.setRGB(1, 1, 0xFF123456);
        assertEquals(before, buffer.getARGB(1, 1));

        BufferedImage exported = buffer.toBufferedImage();
        assertNotSame(buffer.getImage(), exported);
        exported.setRGB(1, 1, 0xFF123456);
        assertEquals(before, buffer.getARGB(1, 1));
    }

    @Test
    public void testDroppingAlphaKeepsColour() {
        ImageBuffer rgba = ImageBuffer.copyOf(solid(4, 4, 0x40336699), ChannelLayout.RGBA);
        ImageBuffer rgb = rgba.withLayout(ChannelLayout.RGB);

        assertEquals(ChannelLayout.RGB, rgb.getLayout());
        assertEquals(BufferedImage.TYPE_3BYTE_BGR, rgb.getImage().getType());
        assertEquals(0xFF336699, rgb.getARGB(2, 2));
        assertTrue(rgb.samePixels(rgba));
    }

    @Test
    public void testSamePixels() {
        ImageBuffer a = ImageBuffer.copyOf(gradient(10, 10), ChannelLayout.RGBA);
        ImageBuffer b = a.withLayout(ChannelLayout.RGBA);
        assertTrue(a.samePixels(b));
        assertFalse(a.samePixels(ImageBuffer.copyOf(gradient(10, 11), ChannelLayout.RGBA)));
        assertFalse(a.samePixels(ImageBuffer.copyOf(solid(10, 10, RED), ChannelLayout.RGBA)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTakeOwnershipChecksType() {
        ImageBuffer.takeOwnership(new BufferedImage(2, 2, BufferedImage.TYPE_INT_ARGB), ChannelLayout.RGBA);
    }
}
