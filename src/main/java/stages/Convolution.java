package stages;

import image.PixelBuffer;
import util.Tiles;

/**
 * Neighborhood operators. Reads outside the image are clamped to the
 * nearest edge pixel; alpha is copied unchanged.
 */
public final class Convolution {

    static final int[] SOBEL_X = { -1, 0, 1, -2, 0, 2, -1, 0, 1 };
    static final int[] SOBEL_Y = { -1, -2, -1, 0, 0, 0, 1, 2, 1 };
    static final int[] PREWITT_X = { -1, 0, 1, -1, 0, 1, -1, 0, 1 };
    static final int[] PREWITT_Y = { -1, -1, -1, 0, 0, 0, 1, 1, 1 };
    static final int[] LAPLACIAN = { 0, 1, 0, 1, -4, 1, 0, 1, 0 };

    private Convolution() {
    }

    /** Normalized 1D Gaussian of half-width {@code radius}. */
    static double[] gaussianKernel(int radius, double sigma) {
        double[] k = new double[2 * radius + 1];
        double twoSigmaSq = 2 * sigma * sigma;
        double sum = 0;
        for (int i = -radius; i <= radius; i++) {
            k[i + radius] = Math.exp(-(i * i) / twoSigmaSq);
            sum += k[i + radius];
        }
        for (int i = 0; i < k.length; i++)
            k[i] /= sum;
        return k;
    }

    /** Separable Gaussian blur on RGB. */
    public static PixelBuffer gaussianBlur(PixelBuffer src, int radius, double sigma) {
        if (radius <= 0)
            return src.withSamples(src.samples());
        int w = src.width(), h = src.height(), c = src.channels(), max = src.maxValue();
        double[] k = gaussianKernel(radius, sigma);

        // horizontal pass into doubles, vertical pass back to samples
        double[] tmp = new double[w * h * 3];
        Tiles.forEachBand(w, h, (y0, y1) -> {
            for (int y = y0; y < y1; y++) {
                for (int x = 0; x < w; x++) {
                    double r = 0, g = 0, b = 0;
                    for (int j = -radius; j <= radius; j++) {
                        int i = src.index(PixelOps.clamp(x + j, 0, w - 1), y);
                        double kw = k[j + radius];
                        r += src.sample(i) * kw;
                        g += src.sample(i + 1) * kw;
                        b += src.sample(i + 2) * kw;
                    }
                    int t = (y * w + x) * 3;
                    tmp[t] = r;
                    tmp[t + 1] = g;
                    tmp[t + 2] = b;
                }
            }
        });
        int[] out = src.newSamples();
        Tiles.forEachBand(w, h, (y0, y1) -> {
            for (int y = y0; y < y1; y++) {
                for (int x = 0; x < w; x++) {
                    double r = 0, g = 0, b = 0;
                    for (int j = -radius; j <= radius; j++) {
                        int t = (PixelOps.clamp(y + j, 0, h - 1) * w + x) * 3;
                        double kw = k[j + radius];
                        r += tmp[t] * kw;
                        g += tmp[t + 1] * kw;
                        b += tmp[t + 2] * kw;
                    }
                    int o = (y * w + x) * c;
                    out[o] = PixelOps.toSample(r, max);
                    out[o + 1] = PixelOps.toSample(g, max);
                    out[o + 2] = PixelOps.toSample(b, max);
                    if (c == 4)
                        out[o + 3] = src.sample(o + 3);
                }
            }
        });
        return src.withSamples(out);
    }

    /** Separable Gaussian blur of a single plane. */
    static double[] gaussianBlur(double[] plane, int w, int h, int radius, double sigma) {
        if (radius <= 0)
            return plane.clone();
        double[] k = gaussianKernel(radius, sigma);
        double[] tmp = new double[plane.length];
        double[] out = new double[plane.length];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double s = 0;
                for (int j = -radius; j <= radius; j++)
                    s += plane[y * w + PixelOps.clamp(x + j, 0, w - 1)] * k[j + radius];
                tmp[y * w + x] = s;
            }
        }
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double s = 0;
                for (int j = -radius; j <= radius; j++)
                    s += tmp[PixelOps.clamp(y + j, 0, h - 1) * w + x] * k[j + radius];
                out[y * w + x] = s;
            }
        }
        return out;
    }

    /** 3×3 convolution (row-major kernel of length 9) on RGB; preserves alpha. */
    public static PixelBuffer convolve3x3(PixelBuffer src, double[] k) {
        if (k == null || k.length != 9)
            throw new IllegalArgumentException("kernel must be length 9");
        int w = src.width(), h = src.height(), c = src.channels(), max = src.maxValue();
        int[] out = src.newSamples();
        Tiles.forEachBand(w, h, (y0, y1) -> {
            for (int y = y0; y < y1; y++) {
                for (int x = 0; x < w; x++) {
                    double r = 0, g = 0, b = 0;
                    int t = 0;
                    for (int j = -1; j <= 1; j++) {
                        int yy = PixelOps.clamp(y + j, 0, h - 1);
                        for (int i = -1; i <= 1; i++) {
                            int p = src.index(PixelOps.clamp(x + i, 0, w - 1), yy);
                            r += src.sample(p) * k[t];
                            g += src.sample(p + 1) * k[t];
                            b += src.sample(p + 2) * k[t];
                            t++;
                        }
                    }
                    int o = (y * w + x) * c;
                    out[o] = PixelOps.toSample(r, max);
                    out[o + 1] = PixelOps.toSample(g, max);
                    out[o + 2] = PixelOps.toSample(b, max);
                    if (c == 4)
                        out[o + 3] = src.sample(o + 3);
                }
            }
        });
        return src.withSamples(out);
    }

    /** Sharpen via 3×3 kernel; strength in ~[0..4]. */
    public static PixelBuffer sharpen(PixelBuffer src, double strength) {
        double s = Math.max(0, strength);
        double[] k = {
                0, -s, 0,
                -s, 1 + 4 * s, -s,
                0, -s, 0
        };
        return convolve3x3(src, k);
    }

    /** Apply a 3×3 integer kernel to a plane with clamp-to-edge. */
    static double[] applyPlane(double[] plane, int w, int h, int[] k) {
        double[] out = new double[plane.length];
        Tiles.forEachBand(w, h, (y0, y1) -> {
            for (int y = y0; y < y1; y++) {
                for (int x = 0; x < w; x++) {
                    double s = 0;
                    int t = 0;
                    for (int j = -1; j <= 1; j++) {
                        int row = PixelOps.clamp(y + j, 0, h - 1) * w;
                        for (int i = -1; i <= 1; i++)
                            s += plane[row + PixelOps.clamp(x + i, 0, w - 1)] * k[t++];
                    }
                    out[y * w + x] = s;
                }
            }
        });
        return out;
    }

    /** Gradient magnitude {@code hypot(kx * p, ky * p)} of a plane. */
    static double[] gradientMagnitude(double[] plane, int w, int h, int[] kx, int[] ky) {
        double[] gx = applyPlane(plane, w, h, kx);
        double[] gy = applyPlane(plane, w, h, ky);
        double[] out = new double[plane.length];
        for (int i = 0; i < out.length; i++)
            out[i] = Math.hypot(gx[i], gy[i]);
        return out;
    }
}
