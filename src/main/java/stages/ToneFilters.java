package stages;

import java.util.function.IntUnaryOperator;

import color.ColorSpaces;
import image.PixelBuffer;
import ops.Rgba;

/**
 * Luminance-driven tone mapping: duotone, split toning, levels and
 * three-range color balance. Outputs are clamped to the sample range.
 */
public final class ToneFilters {

    private ToneFilters() {
    }

    /** Gains per tonal range, each indexed red, green, blue. */
    public record Balance(double[] shadows, double[] midtones, double[] highlights) {
    }

    /** Map luma linearly from the {@code shadow} color (black) to the {@code highlight} color (white). */
    public static PixelBuffer duotone(PixelBuffer src, Rgba shadow, Rgba highlight) {
        int max = src.maxValue();
        double[] s = { shadow.scaled(0, max), shadow.scaled(1, max), shadow.scaled(2, max) };
        double[] d = { highlight.scaled(0, max) - s[0], highlight.scaled(1, max) - s[1], highlight.scaled(2, max) - s[2] };
        return PixelOps.mapRgb(src, (r, g, b, out, scratch) -> {
            double l = ColorSpaces.luma((double) r, (double) g, (double) b) / max;
            out[0] = PixelOps.toSample(s[0] + d[0] * l, max);
            out[1] = PixelOps.toSample(s[1] + d[1] * l, max);
            out[2] = PixelOps.toSample(s[2] + d[2] * l, max);
        });
    }

    /**
     * Tint shadows and highlights separately. Each tint shifts the channels by
     * the tint's deviation from its own luma, so brightness is roughly kept.
     * {@code balance > 0} moves the crossover down, giving the highlight tint
     * more of the range.
     */
    public static PixelBuffer splitToning(PixelBuffer src, Rgba shadow, Rgba highlight, double balance,
            double strength) {
        int max = src.maxValue();
        double[] st = tintOffsets(shadow, max);
        double[] ht = tintOffsets(highlight, max);
        double pivot = 0.5 - 0.45 * balance;
        return PixelOps.mapRgb(src, (r, g, b, out, scratch) -> {
            double l = ColorSpaces.luma((double) r, (double) g, (double) b) / max;
            double ws = PixelOps.clampd((pivot - l) / pivot, 0, 1) * strength;
            double wh = PixelOps.clampd((l - pivot) / (1 - pivot), 0, 1) * strength;
            out[0] = PixelOps.toSample(r + ws * st[0] + wh * ht[0], max);
            out[1] = PixelOps.toSample(g + ws * st[1] + wh * ht[1], max);
            out[2] = PixelOps.toSample(b + ws * st[2] + wh * ht[2], max);
        });
    }

    private static double[] tintOffsets(Rgba tint, int max) {
        double r = tint.scaled(0, max), g = tint.scaled(1, max), b = tint.scaled(2, max);
        double l = ColorSpaces.luma(r, g, b);
        return new double[] { r - l, g - l, b - l };
    }

    /**
     * Levels LUT: values below {@code black} map to 0, above {@code white} to
     * max, with a {@code 1/gamma} power curve between. {@code channel} is
     * "composite", "red", "green" or "blue".
     */
    public static Lut levelsLut(int maxValue, double black, double white, double gamma, String channel) {
        double range = white - black;
        double inv = 1.0 / gamma;
        IntUnaryOperator f = v -> {
            double t = PixelOps.clampd((v / (double) maxValue - black) / range, 0, 1);
            return PixelOps.toSample(Math.pow(t, inv) * maxValue, maxValue);
        };
        return switch (channel) {
            case "red" -> Lut.perChannel(maxValue, f, null, null);
            case "green" -> Lut.perChannel(maxValue, null, f, null);
            case "blue" -> Lut.perChannel(maxValue, null, null, f);
            default -> Lut.of(maxValue, f);
        };
    }

    public static PixelBuffer levels(PixelBuffer src, double black, double white, double gamma, String channel) {
        return levelsLut(src.maxValue(), black, white, gamma, channel).apply(src);
    }

    /**
     * Per-channel gain in three overlapping luma ranges. Shadow weight falls
     * from 1 at black to 0 at mid-gray, highlight weight rises from 0 at
     * mid-gray to 1 at white, midtones take the rest. A channel is multiplied
     * by {@code 1 + sum(weight * gain)}.
     */
    public static PixelBuffer colorBalance(PixelBuffer src, Balance balance) {
        int max = src.maxValue();
        double[] sh = balance.shadows(), mid = balance.midtones(), hi = balance.highlights();
        return PixelOps.mapRgb(src, (r, g, b, out, scratch) -> {
            double l = ColorSpaces.luma((double) r, (double) g, (double) b) / max;
            double ws = 1 - PixelOps.smoothstep(0, 0.5, l);
            double wh = PixelOps.smoothstep(0.5, 1, l);
            double wm = 1 - ws - wh;
            out[0] = PixelOps.toSample(r * (1 + ws * sh[0] + wm * mid[0] + wh * hi[0]), max);
            out[1] = PixelOps.toSample(g * (1 + ws * sh[1] + wm * mid[1] + wh * hi[1]), max);
            out[2] = PixelOps.toSample(b * (1 + ws * sh[2] + wm * mid[2] + wh * hi[2]), max);
        });
    }
}
