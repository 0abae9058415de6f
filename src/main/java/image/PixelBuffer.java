package image;

import java.util.Arrays;

/**
 * Immutable row-major raster: {@code width * height} pixels of 3 (RGB) or 4
 * (RGBA) interleaved samples, 8 or 16 bits per sample.
 * <p>
 * Every operation produces a new buffer; nothing in the core writes into a
 * buffer once it has been constructed.
 */
public final class PixelBuffer {

    private final int width;
    private final int height;
    private final int channels;
    private final int bitDepth;
    private final int[] samples;

    /**
     * Create a buffer from a copy of {@code samples}.
     *
     * @throws PreconditionViolationException if the shape is invalid, the
     *         array length does not match or a sample is out of range
     */
    public PixelBuffer(int width, int height, int channels, int bitDepth, int[] samples) {
        this(checkRange(samples, bitDepth).clone(), width, height, channels, bitDepth);
    }

    private PixelBuffer(int[] samples, int width, int height, int channels, int bitDepth) {
        if (width <= 0 || height <= 0)
            throw new PreconditionViolationException("dimensions must be positive: " + width + "x" + height);
        if (channels != 3 && channels != 4)
            throw new PreconditionViolationException("channels must be 3 or 4, got " + channels);
        if (bitDepth != 8 && bitDepth != 16)
            throw new PreconditionViolationException("bit depth must be 8 or 16, got " + bitDepth);
        if (samples == null)
            throw new PreconditionViolationException("samples must not be null");
        long expected = (long) width * height * channels;
        if (samples.length != expected)
            throw new PreconditionViolationException(
                    "sample array length " + samples.length + " does not match " + width + "x" + height + "x"
                            + channels + " = " + expected);
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.bitDepth = bitDepth;
        this.samples = samples;
    }

    /**
     * Wrap {@code samples} without copying. Ownership of the array passes to
     * the buffer: callers must not touch it afterwards.
     *
     * @throws PreconditionViolationException as for the constructor
     */
    public static PixelBuffer wrap(int width, int height, int channels, int bitDepth, int[] samples) {
        return new PixelBuffer(checkRange(samples, bitDepth), width, height, channels, bitDepth);
    }

    /** Buffer of the given shape filled with one value per channel. */
    public static PixelBuffer filled(int width, int height, int bitDepth, int... pixel) {
        int c = pixel.length;
        int[] s = new int[width * height * c];
        for (int i = 0; i < s.length; i += c)
            System.arraycopy(pixel, 0, s, i, c);
        return new PixelBuffer(width, height, c, bitDepth, s);
    }

    private static int[] checkRange(int[] samples, int bitDepth) {
        if (samples == null)
            throw new PreconditionViolationException("samples must not be null");
        int max = (1 << bitDepth) - 1;
        for (int i = 0; i < samples.length; i++) {
            int v = samples[i];
            if (v < 0 || v > max)
                throw new PreconditionViolationException(
                        "sample " + i + " = " + v + " outside [0.." + max + "]");
        }
        return samples;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int channels() {
        return channels;
    }

    public int bitDepth() {
        return bitDepth;
    }

    public boolean hasAlpha() {
        return channels == 4;
    }

    /** Largest sample value: 255 or 65535. */
    public int maxValue() {
        return (1 << bitDepth) - 1;
    }

    public int pixelCount() {
        return width * height;
    }

    public int sampleCount() {
        return samples.length;
    }

    /** Flat index of the first sample of pixel (x, y). */
    public int index(int x, int y) {
        return (y * width + x) * channels;
    }

    public int sample(int index) {
        return samples[index];
    }

    public int sample(int x, int y, int channel) {
        return samples[(y * width + x) * channels + channel];
    }

    /** Copy of the sample array. */
    public int[] samples() {
        return samples.clone();
    }

    /** New empty sample array with this buffer's shape. */
    public int[] newSamples() {
        return new int[samples.length];
    }

    /** Same shape, different samples (ownership passes to the new buffer). */
    public PixelBuffer withSamples(int[] newSamples) {
        return wrap(width, height, channels, bitDepth, newSamples);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PixelBuffer))
            return false;
        PixelBuffer other = (PixelBuffer) o;
        return width == other.width && height == other.height && channels == other.channels
                && bitDepth == other.bitDepth && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        int h = 31 * width + height;
        h = 31 * h + channels;
        h = 31 * h + bitDepth;
        return 31 * h + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + width + "x" + height + ", " + channels + "ch, " + bitDepth + "bit]";
    }
}
