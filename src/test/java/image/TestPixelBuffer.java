package image;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class TestPixelBuffer {

    @Test
    public void test_constructorCopiesSamples() {
        int[] s = { 1, 2, 3, 4, 5, 6 };
        PixelBuffer buf = new PixelBuffer(2, 1, 3, 8, s);
        s[0] = 99;
        assertEquals(1, buf.sample(0));

        int[] copy = buf.samples();
        copy[1] = 99;
        assertEquals(2, buf.sample(1));
    }

    @Test
    public void test_shapeAndAccess() {
        PixelBuffer buf = PixelBuffer.filled(3, 2, 16, 10, 20, 30, 40);
        assertEquals(3, buf.width());
        assertEquals(2, buf.height());
        assertEquals(4, buf.channels());
        assertTrue(buf.hasAlpha());
        assertEquals(65535, buf.maxValue());
        assertEquals(6, buf.pixelCount());
        assertEquals(24, buf.sampleCount());
        assertEquals(30, buf.sample(2, 1, 2));
        assertEquals(buf.index(2, 1), (1 * 3 + 2) * 4);
    }

    @Test
    public void test_lengthMismatch() {
        assertThrows(PreconditionViolationException.class, () -> new PixelBuffer(2, 2, 3, 8, new int[11]));
        assertThrows(PreconditionViolationException.class, () -> PixelBuffer.wrap(2, 2, 4, 8, new int[12]));
    }

    @Test
    public void test_wrapChecksRange() {
        assertThrows(PreconditionViolationException.class, () -> PixelBuffer.wrap(1, 1, 3, 8, new int[] { 300, 0, 0 }));
        assertThrows(PreconditionViolationException.class, () -> PixelBuffer.wrap(1, 1, 3, 16, new int[] { 0, -1, 0 }));
        PixelBuffer ok = PixelBuffer.filled(1, 1, 8, 1, 2, 3);
        assertThrows(PreconditionViolationException.class, () -> ok.withSamples(new int[] { 1, 2, 256 }));
        assertEquals(65535, PixelBuffer.wrap(1, 1, 3, 16, new int[] { 65535, 0, 0 }).sample(0));
    }

    @Test
    public void test_invalidShape() {
        assertThrows(PreconditionViolationException.class, () -> new PixelBuffer(0, 2, 3, 8, new int[0]));
        assertThrows(PreconditionViolationException.class, () -> new PixelBuffer(1, 1, 2, 8, new int[2]));
        assertThrows(PreconditionViolationException.class, () -> new PixelBuffer(1, 1, 3, 12, new int[3]));
        assertThrows(PreconditionViolationException.class, () -> new PixelBuffer(1, 1, 3, 8, null));
    }

    @Test
    public void test_sampleRange() {
        assertThrows(PreconditionViolationException.class, () -> new PixelBuffer(1, 1, 3, 8, new int[] { 0, 256, 0 }));
        assertThrows(PreconditionViolationException.class, () -> new PixelBuffer(1, 1, 3, 8, new int[] { -1, 0, 0 }));
        // fine at 16 bits
        new PixelBuffer(1, 1, 3, 16, new int[] { 0, 256, 65535 });
    }

    @Test
    public void test_preconditionIsIllegalArgument() {
        assertTrue(IllegalArgumentException.class.isAssignableFrom(PreconditionViolationException.class));
    }

    @Test
    public void test_equality() {
        PixelBuffer a = PixelBuffer.filled(2, 2, 8, 1, 2, 3);
        PixelBuffer b = PixelBuffer.filled(2, 2, 8, 1, 2, 3);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, PixelBuffer.filled(2, 2, 16, 1, 2, 3));
        assertNotEquals(a, PixelBuffer.filled(1, 4, 8, 1, 2, 3));
        assertFalse(a.equals(null));
    }

    @Test
    public void test_withSamplesKeepsShape() {
        PixelBuffer a = PixelBuffer.filled(2, 1, 8, 0, 0, 0, 255);
        PixelBuffer b = a.withSamples(new int[] { 1, 1, 1, 1, 2, 2, 2, 2 });
        assertEquals(2, b.width());
        assertEquals(4, b.channels());
        assertEquals(8, b.bitDepth());
        assertEquals(2, b.sample(1, 0, 3));
        assertEquals(0, a.sample(0));
    }
}
