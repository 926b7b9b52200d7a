package org.cloudstorage.images.buffer;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

@RunWith(JUnit4.class)
public class SizeTest {

    @Test
    public void testEquality() {
        assertEquals(Size.of(4000, 3000), new Size(4000, 3000));
        assertNotEquals(Size.of(4000, 3000), Size.of(3000, 4000));
        assertEquals(Size.of(1, 2).hashCode(), new Size(1, 2).hashCode());
    }

    @Test
    public void testBox() {
        Box box = new Box(2, 3, 12, 8);
        assertEquals(10, box.getWidth());
        assertEquals(5, box.getHeight());
        assertEquals(Size.of(10, 5), box.getSize());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegative() {
        Size.of(-1, 2);
    }
}
