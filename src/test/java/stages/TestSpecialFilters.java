package stages;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import java.util.TreeSet;

import org.junit.jupiter.api.Test;

import image.PixelBuffer;
import ops.Rect;
import ops.Rgba;

public class TestSpecialFilters {

    @Test
    public void test_negativeTwiceIsIdentity() {
        PixelBuffer src = TestArtisticFilters.noise(7, 5, 4, 21);
        for (String channel : new String[] { "rgb", "red", "green", "blue" })
            assertEquals(src, SpecialFilters.negative(SpecialFilters.negative(src, channel), channel), channel);

        PixelBuffer deep = PixelBuffer.filled(2, 2, 16, 1000, 30000, 65535);
        assertEquals(deep, SpecialFilters.negative(SpecialFilters.negative(deep, "rgb"), "rgb"));
    }

    @Test
    public void test_negativeChannel() {
        PixelBuffer out = SpecialFilters.negative(PixelBuffer.filled(1, 1, 8, 10, 20, 30, 40), "red");
        assertEquals(PixelBuffer.filled(1, 1, 8, 245, 20, 30, 40), out);
        out = SpecialFilters.negative(PixelBuffer.filled(1, 1, 8, 10, 20, 30), "rgb");
        assertEquals(PixelBuffer.filled(1, 1, 8, 245, 235, 225), out);
    }

    @Test
    public void test_posterizeTwoLevels() {
        int[] values = { 0, 64, 128, 192, 255 };
        int[] s = new int[values.length * 3];
        for (int i = 0; i < values.length; i++)
            s[i * 3] = s[i * 3 + 1] = s[i * 3 + 2] = values[i];
        PixelBuffer out = SpecialFilters.posterize(new PixelBuffer(values.length, 1, 3, 8, s), 2);
        Set<Integer> levels = new TreeSet<>();
        for (int i = 0; i < out.sampleCount(); i++)
            levels.add(out.sample(i));
        assertEquals(Set.of(0, 255), levels);
    }

    @Test
    public void test_posterizeFullRangeIsIdentity() {
        PixelBuffer src = TestArtisticFilters.noise(4, 4, 3, 8);
        assertEquals(src, SpecialFilters.posterize(src, 256));
        PixelBuffer four = SpecialFilters.posterize(src, 4);
        for (int i = 0; i < four.sampleCount(); i++)
            assertTrue(Set.of(0, 85, 170, 255).contains(four.sample(i)));
    }

    @Test
    public void test_solarize() {
        PixelBuffer src = new PixelBuffer(1, 1, 3, 8, new int[] { 100, 200, 128 });
        assertEquals(src, SpecialFilters.solarize(src, 1.0));
        PixelBuffer out = SpecialFilters.solarize(src, 0.5);
        assertEquals(100, out.sample(0));
        assertEquals(55, out.sample(1));
        assertEquals(127, out.sample(2));
        assertEquals(0, SpecialFilters.solarize(PixelBuffer.filled(1, 1, 8, 255, 255, 255), 0).sample(0));
    }

    @Test
    public void test_pixelate() throws Exception {
        PixelBuffer src = TestGeometryFilters.coordinates(4, 4);
        PixelBuffer out = SpecialFilters.pixelate(src, 2, null);
        // block (0,0): blue values 0, 1, 10, 11
        for (int y = 0; y < 2; y++) {
            for (int x = 0; x < 2; x++)
                assertEquals(6, out.sample(x, y, 2));
        }
        assertEquals(out.sample(2, 2, 0), out.sample(3, 3, 0));
    }

    @Test
    public void test_pixelateRegion() throws Exception {
        PixelBuffer src = TestGeometryFilters.coordinates(6, 6);
        PixelBuffer out = SpecialFilters.pixelate(src, 3, new Rect(3, 3, 3, 3));
        for (int y = 0; y < 6; y++) {
            for (int x = 0; x < 6; x++) {
                if (x < 3 || y < 3)
                    assertEquals(src.sample(x, y, 2), out.sample(x, y, 2));
                else
                    assertEquals(44, out.sample(x, y, 2));
            }
        }
        assertThrows(FilterException.class, () -> SpecialFilters.pixelate(src, 2, new Rect(4, 4, 3, 3)));
    }

    @Test
    public void test_crystallize() {
        PixelBuffer src = TestArtisticFilters.noise(20, 14, 4, 6);
        PixelBuffer a = SpecialFilters.crystallize(src, 5, 99);
        assertEquals(a, SpecialFilters.crystallize(src, 5, 99));
        assertNotEquals(a, SpecialFilters.crystallize(src, 5, 100));
        assertEquals(20, a.width());
        for (int i = 3; i < src.sampleCount(); i += 4)
            assertEquals(src.sample(i), a.sample(i));

        PixelBuffer flat = PixelBuffer.filled(10, 10, 8, 12, 34, 56);
        assertEquals(flat, SpecialFilters.crystallize(flat, 4, 1));
    }

    @Test
    public void test_edgeDetection() {
        PixelBuffer flat = PixelBuffer.filled(6, 6, 8, 80, 80, 80, 200);
        for (String kernel : new String[] { "sobel", "prewitt", "laplacian" })
            assertEquals(PixelBuffer.filled(6, 6, 8, 0, 0, 0, 200), SpecialFilters.edgeDetect(flat, kernel, Double.NaN));

        int[] s = new int[8 * 4 * 3];
        for (int y = 0; y < 4; y++) {
            for (int x = 4; x < 8; x++) {
                int i = (y * 8 + x) * 3;
                s[i] = s[i + 1] = s[i + 2] = 255;
            }
        }
        PixelBuffer step = new PixelBuffer(8, 4, 3, 8, s);
        PixelBuffer edges = SpecialFilters.edgeDetect(step, "sobel", 0.5);
        assertEquals(255, edges.sample(4, 1, 0));
        assertEquals(255, edges.sample(3, 1, 0));
        assertEquals(0, edges.sample(0, 1, 0));
        assertEquals(0, edges.sample(7, 1, 0));
        for (int i = 0; i < edges.sampleCount(); i++)
            assertTrue(edges.sample(i) == 0 || edges.sample(i) == 255);
    }

    @Test
    public void test_vignette() {
        PixelBuffer src = PixelBuffer.filled(21, 21, 8, 255, 255, 255);
        PixelBuffer out = SpecialFilters.vignette(src, 0.8, 0.5, Rgba.rgb(0, 0, 0));
        assertEquals(255, out.sample(10, 10, 0));
        assertEquals(0, out.sample(0, 0, 0));
        assertTrue(out.sample(10, 2, 0) > out.sample(1, 1, 0));

        PixelBuffer tinted = SpecialFilters.vignette(src, 0.8, 0.5, Rgba.rgb(255, 0, 0));
        assertEquals(255, tinted.sample(0, 0, 0));
        assertEquals(0, tinted.sample(0, 0, 1));
    }
}
