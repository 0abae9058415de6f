package ops;

/** Axis-aligned pixel rectangle parameter; width and height are at least 1. */
public record Rect(int x, int y, int width, int height) {

    public Rect {
        if (width < 1 || height < 1)
            throw new IllegalArgumentException("rectangle width and height must be >= 1");
    }

    /** True if the rectangle lies fully inside a {@code w x h} image. */
    public boolean fitsIn(int w, int h) {
        return x >= 0 && y >= 0 && (long) x + width <= w && (long) y + height <= h;
    }

    @Override
    public String toString() {
        return x + "," + y + "," + width + "," + height;
    }
}
