package stages;

import java.util.function.IntUnaryOperator;

import image.PixelBuffer;
import util.Tiles;

/**
 * Per-channel lookup table over the full sample range (256 or 65536 entries
 * for R, G and B). Alpha is never mapped.
 */
public final class Lut {

    private final int maxValue;
    private final int[][] tables;

    private Lut(int maxValue, int[][] tables) {
        this.maxValue = maxValue;
        this.tables = tables;
    }

    /** Same mapping for R, G and B. Results are clamped to the sample range. */
    public static Lut of(int maxValue, IntUnaryOperator f) {
        int[] t = build(maxValue, f);
        return new Lut(maxValue, new int[][] { t, t, t });
    }

    /** Separate mapping per channel; a null operator leaves that channel as is. */
    public static Lut perChannel(int maxValue, IntUnaryOperator r, IntUnaryOperator g, IntUnaryOperator b) {
        return new Lut(maxValue, new int[][] {
                build(maxValue, r == null ? IntUnaryOperator.identity() : r),
                build(maxValue, g == null ? IntUnaryOperator.identity() : g),
                build(maxValue, b == null ? IntUnaryOperator.identity() : b) });
    }

    private static int[] build(int maxValue, IntUnaryOperator f) {
        int[] t = new int[maxValue + 1];
        for (int v = 0; v <= maxValue; v++)
            t[v] = PixelOps.clamp(f.applyAsInt(v), 0, maxValue);
        return t;
    }

    public int maxValue() {
        return maxValue;
    }

    public int map(int channel, int value) {
        return tables[channel][value];
    }

    /** Table of one channel (0..2), copied. */
    public int[] table(int channel) {
        return tables[channel].clone();
    }

    public PixelBuffer apply(PixelBuffer src) {
        if (src.maxValue() != maxValue)
            throw new IllegalArgumentException("LUT built for max " + maxValue + ", buffer max " + src.maxValue());
        int w = src.width(), c = src.channels();
        int[] out = src.newSamples();
        int[] tr = tables[0], tg = tables[1], tb = tables[2];
        Tiles.forEachBand(w, src.height(), (y0, y1) -> {
            for (int i = y0 * w * c, end = y1 * w * c; i < end; i += c) {
                out[i] = tr[src.sample(i)];
                out[i + 1] = tg[src.sample(i + 1)];
                out[i + 2] = tb[src.sample(i + 2)];
                if (c == 4)
                    out[i + 3] = src.sample(i + 3);
            }
        });
        return src.withSamples(out);
    }
}
