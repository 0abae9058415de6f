package stages;

import image.PixelBuffer;
import ops.Rect;
import ops.Rgba;
import util.Tiles;

/**
 * Crop, rotate, resize and flip. These change the buffer's dimensions; pixels
 * move together with their alpha.
 */
public final class GeometryFilters {

    /** Largest output a resize or rotation may allocate, in samples (8192 x 8192 RGBA). */
    public static final long MAX_OUTPUT_SAMPLES = 1L << 28;

    private GeometryFilters() {
    }

    private static int[] allocate(int w, int h, int c) throws FilterException {
        long n = (long) w * h * c;
        if (n > MAX_OUTPUT_SAMPLES)
            throw new FilterException("output " + w + "x" + h + "x" + c + " exceeds " + MAX_OUTPUT_SAMPLES + " samples");
        return new int[(int) n];
    }

    /**
     * Copy the rectangle {@code r}.
     *
     * @throws FilterException if the rectangle is not fully inside the buffer
     */
    public static PixelBuffer crop(PixelBuffer src, Rect r) throws FilterException {
        if (!r.fitsIn(src.width(), src.height()))
            throw new FilterException("crop rectangle " + r + " exceeds buffer bounds "
                    + src.width() + "x" + src.height());
        int c = src.channels();
        int[] out = new int[r.width() * r.height() * c];
        int rowLen = r.width() * c;
        int[] all = src.samples();
        for (int y = 0; y < r.height(); y++)
            System.arraycopy(all, src.index(r.x(), r.y() + y), out, y * rowLen, rowLen);
        return PixelBuffer.wrap(r.width(), r.height(), c, src.bitDepth(), out);
    }

    /**
     * Resize to {@code dw x dh}. Nearest picks the source pixel whose center is
     * closest; bilinear interpolates between the four nearest centers with
     * clamp-to-edge.
     *
     * @throws FilterException if a target dimension is not positive or the
     *                         output would exceed {@link #MAX_OUTPUT_SAMPLES}
     */
    public static PixelBuffer resize(PixelBuffer src, int dw, int dh, boolean bilinear) throws FilterException {
        if (dw <= 0 || dh <= 0)
            throw new FilterException("resize target " + dw + "x" + dh + " has a non-positive dimension");
        int sw = src.width(), sh = src.height(), c = src.channels();
        if (dw == sw && dh == sh)
            return src.withSamples(src.samples());
        double sx = sw / (double) dw, sy = sh / (double) dh;
        int[] out = allocate(dw, dh, c);
        Tiles.forEachBand(dw, dh, (y0, y1) -> {
            for (int y = y0; y < y1; y++) {
                double fy = (y + 0.5) * sy - 0.5;
                for (int x = 0; x < dw; x++) {
                    double fx = (x + 0.5) * sx - 0.5;
                    int o = (y * dw + x) * c;
                    if (bilinear) {
                        PixelOps.sampleBilinear(src, fx, fy, out, o);
                    } else {
                        int xi = Math.min(sw - 1, (int) ((x + 0.5) * sx));
                        int yi = Math.min(sh - 1, (int) ((y + 0.5) * sy));
                        int i = src.index(xi, yi);
                        for (int k = 0; k < c; k++)
                            out[o + k] = src.sample(i + k);
                    }
                }
            }
        });
        return PixelBuffer.wrap(dw, dh, c, src.bitDepth(), out);
    }

    /**
     * Resize by a uniform scale factor.
     *
     * @throws FilterException if the scaled size rounds to zero
     */
    public static PixelBuffer resizeScale(PixelBuffer src, double scale, boolean bilinear) throws FilterException {
        long dw = Math.round(src.width() * scale);
        long dh = Math.round(src.height() * scale);
        if (dw > Integer.MAX_VALUE || dh > Integer.MAX_VALUE)
            throw new FilterException("resize target too large: " + dw + "x" + dh);
        return resize(src, (int) dw, (int) dh, bilinear);
    }

    /** Mirror left-right ({@code horizontal}) or top-bottom. */
    public static PixelBuffer flip(PixelBuffer src, boolean horizontal) {
        int w = src.width(), h = src.height(), c = src.channels();
        int[] out = src.newSamples();
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int sx = horizontal ? w - 1 - x : x;
                int sy = horizontal ? y : h - 1 - y;
                int i = src.index(sx, sy), o = (y * w + x) * c;
                for (int k = 0; k < c; k++)
                    out[o + k] = src.sample(i + k);
            }
        }
        return src.withSamples(out);
    }

    // ---------------- Rotation ----------------

    /**
     * Rotate clockwise by {@code degrees}.
     * <p>
     * Multiples of 90 are exact pixel permutations (the canvas is swapped for
     * 90/270). Other angles map each output pixel back into the source; with
     * {@code expand} the canvas grows to the rotated bounding box, otherwise it
     * keeps the source size. Output pixels whose source position falls outside
     * the image take {@code fill} (including its alpha, for RGBA buffers).
     *
     * @throws FilterException if the expanded canvas exceeds {@link #MAX_OUTPUT_SAMPLES}
     */
    public static PixelBuffer rotate(PixelBuffer src, double degrees, boolean bilinear, Rgba fill, boolean expand)
            throws FilterException {
        double norm = degrees % 360.0;
        if (norm < 0)
            norm += 360.0;
        if (norm == 0)
            return src.withSamples(src.samples());
        if (norm == 90 || norm == 180 || norm == 270)
            return rotateQuarter(src, (int) (norm / 90));

        int sw = src.width(), sh = src.height(), c = src.channels(), max = src.maxValue();
        double rad = Math.toRadians(norm);
        double cos = Math.cos(rad), sin = Math.sin(rad);
        int dw = sw, dh = sh;
        if (expand) {
            dw = Math.max(1, (int) Math.ceil(Math.abs(sw * cos) + Math.abs(sh * sin) - 1e-9));
            dh = Math.max(1, (int) Math.ceil(Math.abs(sw * sin) + Math.abs(sh * cos) - 1e-9));
        }
        int[] fillPx = new int[c];
        for (int k = 0; k < c; k++)
            fillPx[k] = fill.scaled(k, max);

        double scx = sw / 2.0, scy = sh / 2.0, dcx = dw / 2.0, dcy = dh / 2.0;
        final int outW = dw, outH = dh;
        int[] out = allocate(outW, outH, c);
        Tiles.forEachBand(outW, outH, (y0, y1) -> {
            for (int y = y0; y < y1; y++) {
                double py = y + 0.5 - dcy;
                for (int x = 0; x < outW; x++) {
                    double px = x + 0.5 - dcx;
                    // inverse (counter-clockwise) rotation back into the source
                    double sx = cos * px + sin * py + scx;
                    double sy = -sin * px + cos * py + scy;
                    int o = (y * outW + x) * c;
                    if (sx < 0 || sy < 0 || sx >= sw || sy >= sh) {
                        System.arraycopy(fillPx, 0, out, o, c);
                    } else {
                        PixelOps.sample(src, sx - 0.5, sy - 0.5, bilinear, out, o);
                    }
                }
            }
        });
        return PixelBuffer.wrap(outW, outH, c, src.bitDepth(), out);
    }

    /** Exact clockwise rotation by {@code quarters * 90} degrees. */
    static PixelBuffer rotateQuarter(PixelBuffer src, int quarters) {
        int w = src.width(), h = src.height(), c = src.channels();
        int q = ((quarters % 4) + 4) % 4;
        if (q == 0)
            return src.withSamples(src.samples());
        int dw = (q == 2) ? w : h;
        int dh = (q == 2) ? h : w;
        int[] out = new int[w * h * c];
        for (int y = 0; y < dh; y++) {
            for (int x = 0; x < dw; x++) {
                int sx, sy;
                if (q == 1) {
                    sx = y;
                    sy = h - 1 - x;
                } else if (q == 2) {
                    sx = w - 1 - x;
                    sy = h - 1 - y;
                } else {
                    sx = w - 1 - y;
                    sy = x;
                }
                int i = src.index(sx, sy), o = (y * dw + x) * c;
                for (int k = 0; k < c; k++)
                    out[o + k] = src.sample(i + k);
            }
        }
        return PixelBuffer.wrap(dw, dh, c, src.bitDepth(), out);
    }
}
