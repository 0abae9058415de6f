package color;

import image.ColorSample;
import image.PreconditionViolationException;

/**
 * RGB &lt;-&gt; HSV / HSL and luminance.
 * <p>
 * RGB components are in [0..1]. Hue is in degrees [0..360), saturation,
 * value and lightness in [0..1]. Gray uses BT.709 luma everywhere in the
 * project.
 */
public final class ColorSpaces {

    public static final double LUMA_R = 0.2126;
    public static final double LUMA_G = 0.7152;
    public static final double LUMA_B = 0.0722;

    private ColorSpaces() {
    }

    // ---------------- Sample API ----------------

    public static ColorSample toHSV(ColorSample rgb) {
        requireSize(rgb, 3, "RGB");
        double[] out = new double[3];
        rgbToHsv(rgb.get(0), rgb.get(1), rgb.get(2), out);
        return ColorSample.of(out);
    }

    public static ColorSample fromHSV(ColorSample hsv) {
        requireSize(hsv, 3, "HSV");
        double[] out = new double[3];
        hsvToRgb(hsv.get(0), hsv.get(1), hsv.get(2), out);
        return ColorSample.of(out);
    }

    public static ColorSample toHSL(ColorSample rgb) {
        requireSize(rgb, 3, "RGB");
        double[] out = new double[3];
        rgbToHsl(rgb.get(0), rgb.get(1), rgb.get(2), out);
        return ColorSample.of(out);
    }

    public static ColorSample fromHSL(ColorSample hsl) {
        requireSize(hsl, 3, "HSL");
        double[] out = new double[3];
        hslToRgb(hsl.get(0), hsl.get(1), hsl.get(2), out);
        return ColorSample.of(out);
    }

    /** BT.709 luma of an RGB sample, in [0..1]. */
    public static double toGray(ColorSample rgb) {
        requireSize(rgb, 3, "RGB");
        return luma(rgb.get(0), rgb.get(1), rgb.get(2));
    }

    private static void requireSize(ColorSample s, int n, String space) {
        if (s == null || s.size() != n)
            throw new PreconditionViolationException(
                    space + " sample must have " + n + " values, got " + (s == null ? "null" : s.size()));
    }

    // ---------------- Primitive API (hot loops) ----------------

    public static double luma(double r, double g, double b) {
        return LUMA_R * r + LUMA_G * g + LUMA_B * b;
    }

    /** Integer luma, rounded, same scale as the inputs. */
    public static int luma(int r, int g, int b) {
        return (int) Math.round(LUMA_R * r + LUMA_G * g + LUMA_B * b);
    }

    public static void rgbToHsv(double r, double g, double b, double[] hsv) {
        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        double delta = max - min;
        hsv[0] = hue(r, g, b, max, delta);
        hsv[1] = max == 0 ? 0 : delta / max;
        hsv[2] = max;
    }

    public static void hsvToRgb(double h, double s, double v, double[] rgb) {
        if (s <= 0) {
            rgb[0] = rgb[1] = rgb[2] = v;
            return;
        }
        double hh = normalizeHue(h) / 60.0;
        int sector = (int) Math.floor(hh);
        double f = hh - sector;
        double p = v * (1 - s);
        double q = v * (1 - s * f);
        double t = v * (1 - s * (1 - f));
        switch (sector) {
            case 0 -> set(rgb, v, t, p);
            case 1 -> set(rgb, q, v, p);
            case 2 -> set(rgb, p, v, t);
            case 3 -> set(rgb, p, q, v);
            case 4 -> set(rgb, t, p, v);
            default -> set(rgb, v, p, q);
        }
    }

    public static void rgbToHsl(double r, double g, double b, double[] hsl) {
        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        double delta = max - min;
        double l = (max + min) / 2.0;
        hsl[0] = hue(r, g, b, max, delta);
        if (delta == 0)
            hsl[1] = 0;
        else
            hsl[1] = delta / (1 - Math.abs(2 * l - 1));
        hsl[2] = l;
    }

    public static void hslToRgb(double h, double s, double l, double[] rgb) {
        double c = (1 - Math.abs(2 * l - 1)) * s;
        double hh = normalizeHue(h) / 60.0;
        double x = c * (1 - Math.abs(hh % 2 - 1));
        double m = l - c / 2;
        int sector = (int) Math.floor(hh);
        switch (sector) {
            case 0 -> set(rgb, c + m, x + m, m);
            case 1 -> set(rgb, x + m, c + m, m);
            case 2 -> set(rgb, m, c + m, x + m);
            case 3 -> set(rgb, m, x + m, c + m);
            case 4 -> set(rgb, x + m, m, c + m);
            default -> set(rgb, c + m, m, x + m);
        }
    }

    private static double hue(double r, double g, double b, double max, double delta) {
        if (delta == 0)
            return 0;
        double h;
        if (max == r)
            h = 60 * (((g - b) / delta) % 6);
        else if (max == g)
            h = 60 * ((b - r) / delta + 2);
        else
            h = 60 * ((r - g) / delta + 4);
        return normalizeHue(h);
    }

    private static double normalizeHue(double h) {
        double n = h % 360.0;
        if (n < 0)
            n += 360.0;
        return n >= 360.0 ? 0 : n;
    }

    private static void set(double[] out, double a, double b, double c) {
        out[0] = a;
        out[1] = b;
        out[2] = c;
    }
}
