package util;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an image into horizontal bands of rows so per-row work can run on
 * several cores. Each band writes only its own rows of the output.
 */
public final class Tiles {

    /** Images smaller than this many pixels are processed on the calling thread. */
    public static final int PARALLEL_MIN_PIXELS = 256 * 256;

    private static final int BAND_ROWS = 64;

    public record Band(int y0, int y1) {
    }

    @FunctionalInterface
    public interface BandTask {
        /** Process rows {@code [y0, y1)}. */
        void run(int y0, int y1);
    }

    private Tiles() {
    }

    public static List<Band> split(int height, int bandRows) {
        List<Band> bands = new ArrayList<>();
        for (int y = 0; y < height; y += bandRows)
            bands.add(new Band(y, Math.min(height, y + bandRows)));
        return bands;
    }

    /**
     * Run {@code task} over all rows, in parallel bands when the image is
     * large enough. Returns after every band has finished.
     */
    public static void forEachBand(int width, int height, BandTask task) {
        if ((long) width * height < PARALLEL_MIN_PIXELS) {
            task.run(0, height);
            return;
        }
        split(height, BAND_ROWS).parallelStream().forEach(b -> task.run(b.y0(), b.y1()));
    }
}
