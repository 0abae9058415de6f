package stages;

import java.util.Random;

import image.PixelBuffer;
import ops.Rect;
import ops.Rgba;
import util.Tiles;

/**
 * Special effects: point transforms (negative, posterize, solarize) and
 * block / cell / edge effects. All methods return a NEW buffer and keep
 * alpha.
 */
public final class SpecialFilters {

    private SpecialFilters() {
    }

    // ---------------- Point transforms ----------------

    /** {@code channel} is "rgb", "red", "green" or "blue". Applying it twice is the identity. */
    public static Lut negativeLut(int maxValue, String channel) {
        java.util.function.IntUnaryOperator inv = v -> maxValue - v;
        return switch (channel) {
            case "red" -> Lut.perChannel(maxValue, inv, null, null);
            case "green" -> Lut.perChannel(maxValue, null, inv, null);
            case "blue" -> Lut.perChannel(maxValue, null, null, inv);
            default -> Lut.of(maxValue, inv);
        };
    }

    /** Quantize every channel to {@code levels} evenly spaced values including 0 and max. */
    public static Lut posterizeLut(int maxValue, int levels) {
        double step = maxValue / (double) (levels - 1);
        return Lut.of(maxValue, v -> PixelOps.toSample(Math.round(v / step) * step, maxValue));
    }

    /** Invert values strictly above {@code threshold * max}. */
    public static Lut solarizeLut(int maxValue, double threshold) {
        double t = threshold * maxValue;
        return Lut.of(maxValue, v -> v > t ? maxValue - v : v);
    }

    public static PixelBuffer negative(PixelBuffer src, String channel) {
        return negativeLut(src.maxValue(), channel).apply(src);
    }

    public static PixelBuffer posterize(PixelBuffer src, int levels) {
        return posterizeLut(src.maxValue(), levels).apply(src);
    }

    public static PixelBuffer solarize(PixelBuffer src, double threshold) {
        return solarizeLut(src.maxValue(), threshold).apply(src);
    }

    // ---------------- Pixelate ----------------

    /**
     * Replace each {@code size x size} block (aligned to the region origin)
     * with its mean color. {@code region} limits the effect; null means the
     * whole image.
     *
     * @throws FilterException if the region does not fit the buffer
     */
    public static PixelBuffer pixelate(PixelBuffer src, int size, Rect region) throws FilterException {
        int w = src.width(), h = src.height(), c = src.channels(), max = src.maxValue();
        Rect r = region != null ? region : new Rect(0, 0, w, h);
        if (!r.fitsIn(w, h))
            throw new FilterException("pixelate region " + r + " exceeds buffer bounds " + w + "x" + h);
        int[] out = src.samples();
        for (int by = r.y(); by < r.y() + r.height(); by += size) {
            int ey = Math.min(by + size, r.y() + r.height());
            for (int bx = r.x(); bx < r.x() + r.width(); bx += size) {
                int ex = Math.min(bx + size, r.x() + r.width());
                long sr = 0, sg = 0, sb = 0;
                for (int y = by; y < ey; y++) {
                    for (int x = bx; x < ex; x++) {
                        int i = src.index(x, y);
                        sr += src.sample(i);
                        sg += src.sample(i + 1);
                        sb += src.sample(i + 2);
                    }
                }
                double n = (double) (ey - by) * (ex - bx);
                int ar = PixelOps.toSample(sr / n, max), ag = PixelOps.toSample(sg / n, max),
                        ab = PixelOps.toSample(sb / n, max);
                for (int y = by; y < ey; y++) {
                    for (int x = bx; x < ex; x++) {
                        int i = (y * w + x) * c;
                        out[i] = ar;
                        out[i + 1] = ag;
                        out[i + 2] = ab;
                    }
                }
            }
        }
        return src.withSamples(out);
    }

    // ---------------- Crystallize ----------------

    /**
     * Voronoi cells from a jittered grid: one seed point per {@code size x size}
     * grid cell, placed by a {@link Random} seeded with {@code seed}. Every
     * pixel joins its nearest seed (first in grid order on ties) and each cell
     * is flattened to its mean color.
     */
    public static PixelBuffer crystallize(PixelBuffer src, int size, long seed) {
        int w = src.width(), h = src.height(), c = src.channels(), max = src.maxValue();
        int gw = (w + size - 1) / size, gh = (h + size - 1) / size;
        double[] sx = new double[gw * gh], sy = new double[gw * gh];
        Random rnd = new Random(seed);
        for (int j = 0; j < gh; j++) {
            for (int i = 0; i < gw; i++) {
                int cell = j * gw + i;
                double cw = Math.min(size, w - i * size), ch = Math.min(size, h - j * size);
                sx[cell] = i * size + rnd.nextDouble() * cw;
                sy[cell] = j * size + rnd.nextDouble() * ch;
            }
        }

        int[] label = new int[w * h];
        Tiles.forEachBand(w, h, (y0, y1) -> {
            for (int y = y0; y < y1; y++) {
                int cj = y / size;
                for (int x = 0; x < w; x++) {
                    int ci = x / size;
                    double px = x + 0.5, py = y + 0.5;
                    int best = -1;
                    double bestD = Double.MAX_VALUE;
                    for (int j = Math.max(0, cj - 2); j <= Math.min(gh - 1, cj + 2); j++) {
                        for (int i = Math.max(0, ci - 2); i <= Math.min(gw - 1, ci + 2); i++) {
                            int cell = j * gw + i;
                            double dx = sx[cell] - px, dy = sy[cell] - py;
                            double d = dx * dx + dy * dy;
                            if (d < bestD) {
                                bestD = d;
                                best = cell;
                            }
                        }
                    }
                    label[y * w + x] = best;
                }
            }
        });

        int cells = gw * gh;
        long[] sum = new long[cells * 3];
        int[] count = new int[cells];
        for (int p = 0; p < label.length; p++) {
            int l = label[p], i = p * c;
            count[l]++;
            sum[l * 3] += src.sample(i);
            sum[l * 3 + 1] += src.sample(i + 1);
            sum[l * 3 + 2] += src.sample(i + 2);
        }
        int[] mean = new int[cells * 3];
        for (int l = 0; l < cells; l++) {
            if (count[l] == 0)
                continue;
            for (int k = 0; k < 3; k++)
                mean[l * 3 + k] = PixelOps.toSample(sum[l * 3 + k] / (double) count[l], max);
        }
        int[] out = src.newSamples();
        for (int p = 0; p < label.length; p++) {
            int l = label[p], o = p * c;
            out[o] = mean[l * 3];
            out[o + 1] = mean[l * 3 + 1];
            out[o + 2] = mean[l * 3 + 2];
            if (c == 4)
                out[o + 3] = src.sample(o + 3);
        }
        return src.withSamples(out);
    }

    // ---------------- Edges ----------------

    /**
     * Edge magnitude of the luma (gray output). {@code kernel} is "sobel",
     * "prewitt" or "laplacian". With a {@code threshold} (fraction of max) the
     * result is binarized to 0 / max; pass NaN for the raw magnitude.
     */
    public static PixelBuffer edgeDetect(PixelBuffer src, String kernel, double threshold) {
        int w = src.width(), h = src.height(), max = src.maxValue();
        double[] luma = PixelOps.lumaPlane(src);
        double[] mag = switch (kernel) {
            case "prewitt" -> Convolution.gradientMagnitude(luma, w, h, Convolution.PREWITT_X, Convolution.PREWITT_Y);
            case "laplacian" -> {
                double[] lap = Convolution.applyPlane(luma, w, h, Convolution.LAPLACIAN);
                for (int i = 0; i < lap.length; i++)
                    lap[i] = Math.abs(lap[i]);
                yield lap;
            }
            default -> Convolution.gradientMagnitude(luma, w, h, Convolution.SOBEL_X, Convolution.SOBEL_Y);
        };
        if (!Double.isNaN(threshold)) {
            double t = threshold * max;
            for (int i = 0; i < mag.length; i++)
                mag[i] = Math.min(mag[i], max) >= t ? max : 0;
        }
        return PixelOps.fromPlane(src, mag);
    }

    // ---------------- Vignette ----------------

    /**
     * Darken (or tint) toward the corners. Distance is measured from the center
     * relative to the half diagonal; the effect starts at
     * {@code radius - softness} and is full at {@code radius}.
     */
    public static PixelBuffer vignette(PixelBuffer src, double radius, double softness, Rgba color) {
        int w = src.width(), h = src.height(), c = src.channels(), max = src.maxValue();
        double cx = w / 2.0, cy = h / 2.0;
        double halfDiag = Math.sqrt(cx * cx + cy * cy);
        double[] col = { color.scaled(0, max), color.scaled(1, max), color.scaled(2, max) };
        int[] out = src.newSamples();
        Tiles.forEachBand(w, h, (y0, y1) -> {
            for (int y = y0; y < y1; y++) {
                double dy = y + 0.5 - cy;
                for (int x = 0; x < w; x++) {
                    double dx = x + 0.5 - cx;
                    double d = Math.sqrt(dx * dx + dy * dy) / halfDiag;
                    double a = PixelOps.smoothstep(radius - softness, radius, d);
                    int o = (y * w + x) * c;
                    for (int k = 0; k < 3; k++)
                        out[o + k] = PixelOps.toSample(src.sample(o + k) * (1 - a) + col[k] * a, max);
                    if (c == 4)
                        out[o + 3] = src.sample(o + 3);
                }
            }
        });
        return src.withSamples(out);
    }
}
