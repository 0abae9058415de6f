package stages;

import color.ColorSpaces;
import image.PixelBuffer;
import ops.Rgba;
import util.Tiles;

/**
 * Basic tonal and color adjustments. All methods return a NEW buffer and
 * keep alpha, except {@link #flatten}.
 */
public final class BasicFilters {

    private static final int REFERENCE_KELVIN = 6500;

    private BasicFilters() {
    }

    // ---------------- Lookup tables ----------------

    /** Add {@code amount} (in 8-bit units, scaled for 16-bit) to every channel. */
    public static Lut brightnessLut(int maxValue, int amount) {
        int add = (int) Math.round(amount * maxValue / 255.0);
        return Lut.of(maxValue, v -> v + add);
    }

    /** Scale around mid-gray by {@code 2^(amount/50)}; amount in [-100..100]. */
    public static Lut contrastLut(int maxValue, int amount) {
        double scale = Math.pow(2.0, amount / 50.0);
        double mid = maxValue / 2.0;
        return Lut.of(maxValue, v -> PixelOps.toSample((v - mid) * scale + mid, maxValue));
    }

    /** Multiply by {@code 2^stops}. */
    public static Lut exposureLut(int maxValue, double stops) {
        double gain = Math.pow(2.0, stops);
        return Lut.of(maxValue, v -> PixelOps.toSample(v * gain, maxValue));
    }

    // ---------------- Adjustments ----------------

    public static PixelBuffer brightness(PixelBuffer src, int amount) {
        return brightnessLut(src.maxValue(), amount).apply(src);
    }

    public static PixelBuffer contrast(PixelBuffer src, int amount) {
        return contrastLut(src.maxValue(), amount).apply(src);
    }

    public static PixelBuffer exposure(PixelBuffer src, double stops) {
        return exposureLut(src.maxValue(), stops).apply(src);
    }

    /** Multiply HSV saturation by {@code factor}. */
    public static PixelBuffer saturation(PixelBuffer src, double factor) {
        int max = src.maxValue();
        double m = max;
        return PixelOps.mapRgb(src, (r, g, b, out, hsv) -> {
            ColorSpaces.rgbToHsv(r / m, g / m, b / m, hsv);
            double s = PixelOps.clampd(hsv[1] * factor, 0, 1);
            ColorSpaces.hsvToRgb(hsv[0], s, hsv[2], hsv);
            out[0] = PixelOps.toSample(hsv[0] * m, max);
            out[1] = PixelOps.toSample(hsv[1] * m, max);
            out[2] = PixelOps.toSample(hsv[2] * m, max);
        });
    }

    /**
     * White-balance shift: each channel is scaled by the black-body color of
     * {@code kelvin} relative to the 6500 K reference. Lower is warmer.
     */
    public static PixelBuffer colorTemperature(PixelBuffer src, int kelvin) {
        double[] ref = kelvinToRgb(REFERENCE_KELVIN);
        double[] target = kelvinToRgb(kelvin);
        int max = src.maxValue();
        Lut lut = Lut.perChannel(max,
                v -> PixelOps.toSample(v * target[0] / ref[0], max),
                v -> PixelOps.toSample(v * target[1] / ref[1], max),
                v -> PixelOps.toSample(v * target[2] / ref[2], max));
        return lut.apply(src);
    }

    /** Approximate sRGB color (0..255) of a black body at {@code kelvin}. */
    static double[] kelvinToRgb(int kelvin) {
        double t = kelvin / 100.0;
        double r, g, b;
        if (t <= 66) {
            r = 255;
            g = 99.4708025861 * Math.log(t) - 161.1195681661;
        } else {
            r = 329.698727446 * Math.pow(t - 60, -0.1332047592);
            g = 288.1221695283 * Math.pow(t - 60, -0.0755148492);
        }
        if (t >= 66)
            b = 255;
        else if (t <= 19)
            b = 0;
        else
            b = 138.5177312231 * Math.log(t - 10) - 305.0447927307;
        return new double[] {
                PixelOps.clampd(r, 0, 255),
                PixelOps.clampd(g, 1, 255),
                PixelOps.clampd(b, 0, 255) };
    }

    /** Convert to grayscale using BT.709 luma. */
    public static PixelBuffer grayscale(PixelBuffer src) {
        int max = src.maxValue();
        return PixelOps.mapRgb(src, (r, g, b, out, s) -> {
            int y = PixelOps.clamp(ColorSpaces.luma(r, g, b), 0, max);
            out[0] = y;
            out[1] = y;
            out[2] = y;
        });
    }

    /**
     * Composite onto an opaque background and drop the alpha channel. A
     * buffer without alpha is returned unchanged (as a copy).
     */
    public static PixelBuffer flatten(PixelBuffer src, Rgba background) {
        if (!src.hasAlpha())
            return src.withSamples(src.samples());
        int w = src.width(), h = src.height(), max = src.maxValue();
        int br = background.scaled(0, max), bg = background.scaled(1, max), bb = background.scaled(2, max);
        int[] out = new int[w * h * 3];
        Tiles.forEachBand(w, h, (y0, y1) -> {
            for (int p = y0 * w; p < y1 * w; p++) {
                int i = p * 4, o = p * 3;
                double a = src.sample(i + 3) / (double) max;
                out[o] = PixelOps.toSample(src.sample(i) * a + br * (1 - a), max);
                out[o + 1] = PixelOps.toSample(src.sample(i + 1) * a + bg * (1 - a), max);
                out[o + 2] = PixelOps.toSample(src.sample(i + 2) * a + bb * (1 - a), max);
            }
        });
        return PixelBuffer.wrap(w, h, 3, src.bitDepth(), out);
    }
}
