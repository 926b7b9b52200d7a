package org.cloudstorage.images.transform;

import org.cloudstorage.images.InvalidParameterException;
import org.cloudstorage.images.TestBase;
import org.cloudstorage.images.buffer.ChannelLayout;
import org.cloudstorage.images.buffer.ImageBuffer;
import org.cloudstorage.images.buffer.Size;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

@RunWith(JUnit4.class)
public class ResizerTest extends TestBase {

    private final Resizer resizer = new Resizer();

    @Test
    public void testProportionalHeightTruncates() {
        Size current = Size.of(4000, 3000);
        for (int width = 1; width <= 5000; width += 37) {
            Size target = Resizer.computeExactSize(current, width, null);
            assertEquals(width, target.width);
            assertEquals((int) Math.floor(3000.0 * width / 4000.0), target.height);
        }
        assertEquals(Size.of(200, 266), Resizer.computeExactSize(Size.of(3000, 4000), 200, null));
        assertEquals(Size.of(150, 200), Resizer.computeExactSize(Size.of(3000, 4000), null, 200));
    }

    @Test
    public void testBothSidesIgnoreAspect() {
        assertEquals(Size.of(10, 500), Resizer.computeExactSize(Size.of(400, 300), 10, 500));
    }

    @Test
    public void testResize() {
        ImageBuffer source = ImageBuffer.copyOf(gradient(120, 80), ChannelLayout.RGBA);
        ImageBuffer resized = resizer.resize(source, 60, null);
        assertEquals(60, resized.getWidth());
        assertEquals(40, resized.getHeight());
        assertEquals(ChannelLayout.RGBA, resized.getLayout());
        assertEquals(120, source.getWidth());

        ImageBuffer enlarged = resizer.resize(source, 240, 100);
        assertEquals(Size.of(240, 100), enlarged.getSize());
    }

    @Test
    public void testResizeKeepsSolidColour() {
        ImageBuffer source = ImageBuffer.copyOf(solid(100, 100, 0xFF3366CC), ChannelLayout.RGBA);
        ImageBuffer resized = resizer.resize(source, 33, null);
        assertTrue(near(0xFF3366CC, resized.getARGB(16, 16), 2));
    }

    @Test
    public void testInvalidRequests() {
        Size current = Size.of(100, 100);
        assertInvalid(current, null, null);
        assertInvalid(current, 0, null);
        assertInvalid(current, null, -5);
        assertInvalid(current, 10, 0);
        // 1000 x 1 scaled to width 10 would be 0 high
        assertInvalid(Size.of(1000, 1), 10, null);
    }

    @Test
    public void testShrinkOnlyWhenBothExceed() {
        assertEquals(Size.of(100, 50), Resizer.computeShrinkSize(Size.of(100, 50), 80, 60));
        assertEquals(Size.of(100, 50), Resizer.computeShrinkSize(Size.of(100, 50), 200, 200));
        // wider than the box: width is the tight side
        assertEquals(Size.of(80, 20), Resizer.computeShrinkSize(Size.of(400, 100), 80, 60));
        // taller than the box: height is the tight side
        assertEquals(Size.of(15, 60), Resizer.computeShrinkSize(Size.of(100, 400), 80, 60));
    }

    @Test
    public void testShrinkSingleSide() {
        assertEquals(Size.of(50, 25), Resizer.computeShrinkSize(Size.of(100, 50), 50, null));
        assertEquals(Size.of(100, 50), Resizer.computeShrinkSize(Size.of(100, 50), 150, null));
        assertEquals(Size.of(20, 10), Resizer.computeShrinkSize(Size.of(100, 50), null, 10));
        // the derived side never drops below one pixel
        assertEquals(Size.of(10, 1), Resizer.computeShrinkSize(Size.of(1000, 1), 10, null));
    }

    @Test
    public void testShrinkToFitNeverEnlarges() {
        ImageBuffer source = ImageBuffer.copyOf(gradient(64, 32), ChannelLayout.RGBA);
        assertSame(source, resizer.shrinkToFit(source, 128, 128));

        // height fits, so nothing to do
        assertSame(source, resizer.shrinkToFit(source, 32, 32));

        ImageBuffer shrunk = resizer.shrinkToFit(source, 32, 20);
        assertNotSame(source, shrunk);
        assertEquals(Size.of(32, 16), shrunk.getSize());
    }

    private void assertInvalid(Size current, Integer width, Integer height) {
        try {
            Resizer.computeExactSize(current, width, height);
            fail("Expected InvalidParameterException for " + width + "x" + height);
        } catch (InvalidParameterException e) {
            println("%s", e.getMessage());
        }
    }
}
