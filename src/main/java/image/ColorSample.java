package image;

import java.util.Arrays;

/**
 * One pixel's channel values in some color space. RGB and gray use [0..1];
 * HSV/HSL use hue in [0..360) and the other two components in [0..1].
 */
public final class ColorSample {

    private final double[] values;

    private ColorSample(double[] values) {
        this.values = values;
    }

    public static ColorSample of(double... values) {
        if (values == null || values.length == 0)
            throw new PreconditionViolationException("color sample needs at least one value");
        return new ColorSample(values.clone());
    }

    /** RGB sample from integer channel values scaled by {@code maxValue}. */
    public static ColorSample rgb(int r, int g, int b, int maxValue) {
        double m = maxValue;
        return new ColorSample(new double[] { r / m, g / m, b / m });
    }

    public int size() {
        return values.length;
    }

    public double get(int i) {
        return values[i];
    }

    /** Channel {@code i} scaled to {@code [0..maxValue]} and rounded. */
    public int toInt(int i, int maxValue) {
        long v = Math.round(values[i] * maxValue);
        return (int) Math.max(0, Math.min(maxValue, v));
    }

    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ColorSample && Arrays.equals(values, ((ColorSample) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "ColorSample" + Arrays.toString(values);
    }
}
