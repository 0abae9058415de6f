package stages;

import color.ColorSpaces;
import image.PixelBuffer;
import util.Tiles;

/**
 * Shared helpers: clamping, per-pixel RGB mapping and edge-clamped sampling.
 */
final class PixelOps {

    private PixelOps() {
    }

    /** Maps one RGB triple; {@code scratch} is a per-band 3-element work array. */
    @FunctionalInterface
    interface RgbMapper {
        void map(int r, int g, int b, int[] out, double[] scratch);
    }

    // ---------------- Core helpers ----------------

    static int clamp(int v, int lo, int hi) {
        return (v < lo) ? lo : (v > hi) ? hi : v;
    }

    static double clampd(double v, double lo, double hi) {
        return (v < lo) ? lo : (v > hi) ? hi : v;
    }

    /** Round and clamp to {@code [0..max]}. */
    static int toSample(double v, int max) {
        if (!(v > 0))
            return 0;
        long r = Math.round(v);
        return r > max ? max : (int) r;
    }

    static double smoothstep(double e0, double e1, double x) {
        if (e1 <= e0)
            return x < e0 ? 0 : 1;
        double t = clampd((x - e0) / (e1 - e0), 0, 1);
        return t * t * (3 - 2 * t);
    }

    // ---------------- Pixel loops ----------------

    /** Apply {@code mapper} to every pixel's RGB; alpha is copied. */
    static PixelBuffer mapRgb(PixelBuffer src, RgbMapper mapper) {
        int w = src.width(), c = src.channels();
        int[] out = src.newSamples();
        Tiles.forEachBand(w, src.height(), (y0, y1) -> {
            int[] rgb = new int[3];
            double[] scratch = new double[3];
            for (int i = y0 * w * c, end = y1 * w * c; i < end; i += c) {
                mapper.map(src.sample(i), src.sample(i + 1), src.sample(i + 2), rgb, scratch);
                out[i] = rgb[0];
                out[i + 1] = rgb[1];
                out[i + 2] = rgb[2];
                if (c == 4)
                    out[i + 3] = src.sample(i + 3);
            }
        });
        return src.withSamples(out);
    }

    /** Luma plane of {@code src} as doubles in sample units. */
    static double[] lumaPlane(PixelBuffer src) {
        int w = src.width(), h = src.height(), c = src.channels();
        double[] plane = new double[w * h];
        Tiles.forEachBand(w, h, (y0, y1) -> {
            for (int p = y0 * w; p < y1 * w; p++) {
                int i = p * c;
                plane[p] = ColorSpaces.luma((double) src.sample(i), (double) src.sample(i + 1), (double) src.sample(i + 2));
            }
        });
        return plane;
    }

    /** Gray RGB buffer from a plane of values in sample units; alpha copied from {@code shape}. */
    static PixelBuffer fromPlane(PixelBuffer shape, double[] plane) {
        int w = shape.width(), c = shape.channels(), max = shape.maxValue();
        int[] out = shape.newSamples();
        Tiles.forEachBand(w, shape.height(), (y0, y1) -> {
            for (int p = y0 * w; p < y1 * w; p++) {
                int i = p * c;
                int v = toSample(plane[p], max);
                out[i] = v;
                out[i + 1] = v;
                out[i + 2] = v;
                if (c == 4)
                    out[i + 3] = shape.sample(i + 3);
            }
        });
        return shape.withSamples(out);
    }

    // ---------------- Sampling ----------------

    /** Nearest sample at continuous position (pixel centers on integers), clamped to the edge. */
    static void sampleNearest(PixelBuffer src, double x, double y, int[] out, int off) {
        int xi = clamp((int) Math.floor(x + 0.5), 0, src.width() - 1);
        int yi = clamp((int) Math.floor(y + 0.5), 0, src.height() - 1);
        int i = src.index(xi, yi);
        for (int k = 0; k < src.channels(); k++)
            out[off + k] = src.sample(i + k);
    }

    /** Bilinear sample at continuous position, clamped to the edge. */
    static void sampleBilinear(PixelBuffer src, double x, double y, int[] out, int off) {
        int w = src.width(), h = src.height(), c = src.channels(), max = src.maxValue();
        double xc = clampd(x, 0, w - 1), yc = clampd(y, 0, h - 1);
        int x0 = (int) Math.floor(xc), y0 = (int) Math.floor(yc);
        int x1 = Math.min(x0 + 1, w - 1), y1 = Math.min(y0 + 1, h - 1);
        double fx = xc - x0, fy = yc - y0;
        int i00 = src.index(x0, y0), i10 = src.index(x1, y0);
        int i01 = src.index(x0, y1), i11 = src.index(x1, y1);
        for (int k = 0; k < c; k++) {
            double top = src.sample(i00 + k) * (1 - fx) + src.sample(i10 + k) * fx;
            double bot = src.sample(i01 + k) * (1 - fx) + src.sample(i11 + k) * fx;
            out[off + k] = toSample(top * (1 - fy) + bot * fy, max);
        }
    }

    static void sample(PixelBuffer src, double x, double y, boolean bilinear, int[] out, int off) {
        if (bilinear)
            sampleBilinear(src, x, y, out, off);
        else
            sampleNearest(src, x, y, out, off);
    }
}
