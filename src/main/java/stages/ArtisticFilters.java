package stages;

import java.util.Arrays;
import java.util.Random;

import color.ColorSpaces;
import image.PixelBuffer;
import ops.Point;
import util.Tiles;

/**
 * Creative filters. All methods return a NEW buffer and keep alpha.
 * Stochastic filters take an explicit seed and are reproducible.
 */
public final class ArtisticFilters {

    private ArtisticFilters() {
    }

    // ---------------- Oil painting ----------------

    /**
     * For every pixel, bin the luma of its {@code (2r+1)^2} neighborhood into
     * {@code levels} buckets and output the mean color of the most populated
     * bucket (lowest bucket wins ties).
     */
    public static PixelBuffer oilPainting(PixelBuffer src, int radius, int levels) {
        int w = src.width(), h = src.height(), c = src.channels(), max = src.maxValue();
        int[] bin = new int[w * h];
        for (int p = 0; p < bin.length; p++) {
            int i = p * c;
            int y = ColorSpaces.luma(src.sample(i), src.sample(i + 1), src.sample(i + 2));
            bin[p] = (int) ((long) PixelOps.clamp(y, 0, max) * (levels - 1) / max);
        }
        int[] out = src.newSamples();
        Tiles.forEachBand(w, h, (y0, y1) -> {
            int[] count = new int[levels];
            long[] sr = new long[levels], sg = new long[levels], sb = new long[levels];
            for (int y = y0; y < y1; y++) {
                for (int x = 0; x < w; x++) {
                    Arrays.fill(count, 0);
                    Arrays.fill(sr, 0);
                    Arrays.fill(sg, 0);
                    Arrays.fill(sb, 0);
                    for (int j = -radius; j <= radius; j++) {
                        int yy = PixelOps.clamp(y + j, 0, h - 1);
                        for (int i = -radius; i <= radius; i++) {
                            int p = yy * w + PixelOps.clamp(x + i, 0, w - 1);
                            int b = bin[p];
                            int s = p * c;
                            count[b]++;
                            sr[b] += src.sample(s);
                            sg[b] += src.sample(s + 1);
                            sb[b] += src.sample(s + 2);
                        }
                    }
                    int best = 0;
                    for (int b = 1; b < levels; b++) {
                        if (count[b] > count[best])
                            best = b;
                    }
                    int o = (y * w + x) * c;
                    double n = count[best];
                    out[o] = PixelOps.toSample(sr[best] / n, max);
                    out[o + 1] = PixelOps.toSample(sg[best] / n, max);
                    out[o + 2] = PixelOps.toSample(sb[best] / n, max);
                    if (c == 4)
                        out[o + 3] = src.sample(o + 3);
                }
            }
        });
        return src.withSamples(out);
    }

    // ---------------- Charcoal ----------------

    /**
     * Charcoal sketch: Sobel edges of the luma, blurred, inverted and
     * stretched to the full range. Output is gray.
     */
    public static PixelBuffer charcoal(PixelBuffer src, int radius, double sigma) {
        int w = src.width(), h = src.height(), max = src.maxValue();
        double[] edges = Convolution.gradientMagnitude(PixelOps.lumaPlane(src), w, h,
                Convolution.SOBEL_X, Convolution.SOBEL_Y);
        double[] soft = Convolution.gaussianBlur(edges, w, h, radius, sigma);
        double lo = Double.MAX_VALUE, hi = -Double.MAX_VALUE;
        for (int i = 0; i < soft.length; i++) {
            soft[i] = max - Math.min(max, soft[i]);
            lo = Math.min(lo, soft[i]);
            hi = Math.max(hi, soft[i]);
        }
        if (hi > lo) {
            double scale = max / (hi - lo);
            for (int i = 0; i < soft.length; i++)
                soft[i] = (soft[i] - lo) * scale;
        }
        return PixelOps.fromPlane(src, soft);
    }

    // ---------------- Sepia ----------------

    /** Sepia tone blended with the original by {@code intensity} (0 = unchanged). */
    public static PixelBuffer sepia(PixelBuffer src, double intensity) {
        int max = src.maxValue();
        double keep = 1 - intensity;
        return PixelOps.mapRgb(src, (r, g, b, out, s) -> {
            double tr = Math.min(max, 0.393 * r + 0.769 * g + 0.189 * b);
            double tg = Math.min(max, 0.349 * r + 0.686 * g + 0.168 * b);
            double tb = Math.min(max, 0.272 * r + 0.534 * g + 0.131 * b);
            out[0] = PixelOps.toSample(r * keep + tr * intensity, max);
            out[1] = PixelOps.toSample(g * keep + tg * intensity, max);
            out[2] = PixelOps.toSample(b * keep + tb * intensity, max);
        });
    }

    // ---------------- Grain ----------------

    /**
     * Film grain: Gaussian noise with standard deviation {@code amount * max},
     * constant over {@code size x size} blocks. The noise field is generated
     * from {@code seed} in row order before it is applied, so output is
     * identical for identical inputs.
     */
    public static PixelBuffer grain(PixelBuffer src, double amount, int size, long seed, boolean monochrome) {
        int w = src.width(), h = src.height(), c = src.channels(), max = src.maxValue();
        int bw = (w + size - 1) / size, bh = (h + size - 1) / size;
        int planes = monochrome ? 1 : 3;
        double sd = amount * max;
        double[] noise = new double[bw * bh * planes];
        Random rnd = new Random(seed);
        for (int i = 0; i < noise.length; i++)
            noise[i] = rnd.nextGaussian() * sd;
        int[] out = src.newSamples();
        Tiles.forEachBand(w, h, (y0, y1) -> {
            for (int y = y0; y < y1; y++) {
                int by = y / size;
                for (int x = 0; x < w; x++) {
                    int n = (by * bw + x / size) * planes;
                    int o = (y * w + x) * c;
                    for (int k = 0; k < 3; k++)
                        out[o + k] = PixelOps.toSample(src.sample(o + k) + noise[n + (monochrome ? 0 : k)], max);
                    if (c == 4)
                        out[o + 3] = src.sample(o + 3);
                }
            }
        });
        return src.withSamples(out);
    }

    // ---------------- Emboss ----------------

    /**
     * Bump-map emboss: the luma is treated as a height field and lit from
     * {@code azimuth} (degrees, counter-clockwise from +x) at
     * {@code elevation} above the plane. Flat areas come out at
     * {@code sin(elevation)}. Output is gray.
     */
    public static PixelBuffer emboss(PixelBuffer src, double azimuth, double elevation, double depth) {
        int w = src.width(), h = src.height(), max = src.maxValue();
        double[] height = PixelOps.lumaPlane(src);
        for (int i = 0; i < height.length; i++)
            height[i] /= max;
        double[] gx = Convolution.applyPlane(height, w, h, Convolution.SOBEL_X);
        double[] gy = Convolution.applyPlane(height, w, h, Convolution.SOBEL_Y);
        double az = Math.toRadians(azimuth), el = Math.toRadians(elevation);
        double lx = Math.cos(az) * Math.cos(el);
        double ly = -Math.sin(az) * Math.cos(el);
        double lz = Math.sin(el);
        double[] shade = new double[height.length];
        for (int i = 0; i < shade.length; i++) {
            double nx = -gx[i] * depth, ny = -gy[i] * depth, nz = 1;
            double len = Math.sqrt(nx * nx + ny * ny + nz * nz);
            double d = (nx * lx + ny * ly + nz * lz) / len;
            shade[i] = Math.max(0, d) * max;
        }
        return PixelOps.fromPlane(src, shade);
    }

    // ---------------- Distortions ----------------

    /**
     * Twist pixels around {@code center} by up to {@code degrees}, falling off
     * quadratically to zero at {@code radius} ({@code 0} = half the shorter
     * side). Bilinear sampling with clamp-to-edge.
     */
    public static PixelBuffer swirl(PixelBuffer src, double degrees, int radius, Point center) {
        int w = src.width(), h = src.height();
        double cx = center != null ? center.x() : (w - 1) / 2.0;
        double cy = center != null ? center.y() : (h - 1) / 2.0;
        double rad = radius > 0 ? radius : Math.min(w, h) / 2.0;
        double maxAngle = Math.toRadians(degrees);
        return remap(src, (x, y, pos) -> {
            double dx = x - cx, dy = y - cy;
            double d = Math.sqrt(dx * dx + dy * dy);
            if (d >= rad || rad == 0) {
                pos[0] = x;
                pos[1] = y;
                return;
            }
            double f = 1 - d / rad;
            double a = maxAngle * f * f;
            double cos = Math.cos(a), sin = Math.sin(a);
            pos[0] = cx + cos * dx - sin * dy;
            pos[1] = cy + sin * dx + cos * dy;
        });
    }

    /** Vertical sine displacement along x; the canvas size is kept. */
    public static PixelBuffer wave(PixelBuffer src, double amplitude, double length) {
        return remap(src, (x, y, pos) -> {
            pos[0] = x;
            pos[1] = y - amplitude * Math.sin(2 * Math.PI * x / length);
        });
    }

    /**
     * Pull pixels toward the center ({@code amount > 0}) or push them out
     * ({@code amount < 0}) inside the largest centered circle.
     */
    public static PixelBuffer implode(PixelBuffer src, double amount) {
        int w = src.width(), h = src.height();
        double cx = (w - 1) / 2.0, cy = (h - 1) / 2.0;
        double rad = Math.min(w, h) / 2.0;
        return remap(src, (x, y, pos) -> {
            double dx = x - cx, dy = y - cy;
            double d = Math.sqrt(dx * dx + dy * dy);
            if (d >= rad || d == 0) {
                pos[0] = x;
                pos[1] = y;
                return;
            }
            double f = Math.pow(Math.sin(Math.PI * d / rad / 2), -amount);
            pos[0] = cx + dx * f;
            pos[1] = cy + dy * f;
        });
    }

    @FunctionalInterface
    interface Mapping {
        /** Source position for output pixel (x, y), written into {@code pos}. */
        void source(int x, int y, double[] pos);
    }

    /** Same-size inverse mapping with bilinear clamp-to-edge sampling. */
    static PixelBuffer remap(PixelBuffer src, Mapping m) {
        int w = src.width(), h = src.height(), c = src.channels();
        int[] out = src.newSamples();
        Tiles.forEachBand(w, h, (y0, y1) -> {
            double[] pos = new double[2];
            for (int y = y0; y < y1; y++) {
                for (int x = 0; x < w; x++) {
                    m.source(x, y, pos);
                    int o = (y * w + x) * c;
                    if (pos[0] == x && pos[1] == y) {
                        for (int k = 0; k < c; k++)
                            out[o + k] = src.sample(o + k);
                    } else {
                        PixelOps.sampleBilinear(src, pos[0], pos[1], out, o);
                    }
                }
            }
        });
        return src.withSamples(out);
    }
}
