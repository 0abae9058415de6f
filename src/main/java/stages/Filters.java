package stages;

import ops.OperationKind;
import ops.ParameterSet;

/**
 * Maps every {@link OperationKind} to its transform. The switches are
 * exhaustive so a new kind does not compile until it is wired here.
 */
public final class Filters {

    private Filters() {
    }

    public static Filter forKind(OperationKind kind) {
        return switch (kind) {
            // basic
            case BRIGHTNESS -> (src, p) -> BasicFilters.brightness(src, p.getInt("amount"));
            case CONTRAST -> (src, p) -> BasicFilters.contrast(src, p.getInt("amount"));
            case SATURATION -> (src, p) -> BasicFilters.saturation(src, p.getDouble("factor"));
            case EXPOSURE -> (src, p) -> BasicFilters.exposure(src, p.getDouble("stops"));
            case COLOR_TEMPERATURE -> (src, p) -> BasicFilters.colorTemperature(src, p.getInt("kelvin"));
            case CROP -> (src, p) -> GeometryFilters.crop(src,
                    new ops.Rect(p.getInt("x"), p.getInt("y"), p.getInt("w"), p.getInt("h")));
            case ROTATE -> (src, p) -> GeometryFilters.rotate(src, p.getDouble("angle"),
                    bilinear(p, "interpolation"), p.getColor("fill"), p.getBoolean("expand"));
            case RESIZE -> (src, p) -> p.has("scale")
                    ? GeometryFilters.resizeScale(src, p.getDouble("scale"), bilinear(p, "method"))
                    : GeometryFilters.resize(src, p.getInt("w"), p.getInt("h"), bilinear(p, "method"));
            case GRAYSCALE -> (src, p) -> BasicFilters.grayscale(src);
            case FLIP -> (src, p) -> GeometryFilters.flip(src, "horizontal".equals(p.getString("direction")));
            case FLATTEN -> (src, p) -> BasicFilters.flatten(src, p.getColor("background"));
            case BLUR -> (src, p) -> Convolution.gaussianBlur(src, p.getInt("radius"), p.getDouble("sigma"));
            case SHARPEN -> (src, p) -> Convolution.sharpen(src, p.getDouble("amount"));

            // artistic
            case OIL_PAINTING -> (src, p) -> ArtisticFilters.oilPainting(src, p.getInt("radius"), p.getInt("levels"));
            case CHARCOAL -> (src, p) -> ArtisticFilters.charcoal(src, p.getInt("radius"), p.getDouble("sigma"));
            case SEPIA -> (src, p) -> ArtisticFilters.sepia(src, p.getDouble("intensity"));
            case GRAIN -> (src, p) -> ArtisticFilters.grain(src, p.getDouble("amount"), p.getInt("size"),
                    p.getInt("seed"), p.getBoolean("monochrome"));
            case EMBOSS -> (src, p) -> ArtisticFilters.emboss(src, p.getDouble("azimuth"),
                    p.getDouble("elevation"), p.getDouble("depth"));
            case SWIRL -> (src, p) -> ArtisticFilters.swirl(src, p.getDouble("degrees"), p.getInt("radius"),
                    p.getPoint("center"));
            case WAVE -> (src, p) -> ArtisticFilters.wave(src, p.getDouble("amplitude"), p.getDouble("length"));
            case IMPLODE -> (src, p) -> ArtisticFilters.implode(src, p.getDouble("amount"));

            // tone
            case DUOTONE -> (src, p) -> ToneFilters.duotone(src, p.getColor("shadow"), p.getColor("highlight"));
            case SPLIT_TONING -> (src, p) -> ToneFilters.splitToning(src, p.getColor("shadow"),
                    p.getColor("highlight"), p.getDouble("balance"), p.getDouble("strength"));
            case LEVELS -> (src, p) -> ToneFilters.levels(src, p.getDouble("black"), p.getDouble("white"),
                    p.getDouble("gamma"), p.getString("channel"));
            case COLOR_BALANCE -> (src, p) -> ToneFilters.colorBalance(src, balance(p));

            // special
            case NEGATIVE -> (src, p) -> SpecialFilters.negative(src, p.getString("channel"));
            case POSTERIZE -> (src, p) -> SpecialFilters.posterize(src, p.getInt("levels"));
            case SOLARIZE -> (src, p) -> SpecialFilters.solarize(src, p.getDouble("threshold"));
            case PIXELATE -> (src, p) -> SpecialFilters.pixelate(src, p.getInt("size"), p.getRect("region"));
            case CRYSTALLIZE -> (src, p) -> SpecialFilters.crystallize(src, p.getInt("size"), p.getInt("seed"));
            case EDGE_DETECTION -> (src, p) -> SpecialFilters.edgeDetect(src, p.getString("kernel"),
                    p.has("threshold") ? p.getDouble("threshold") : Double.NaN);
            case VIGNETTE -> (src, p) -> SpecialFilters.vignette(src, p.getDouble("radius"),
                    p.getDouble("softness"), p.getColor("color"));
        };
    }

    /**
     * Lookup table equivalent of a pointwise kind, or null when the kind is
     * not a per-sample mapping. Applying the table gives the same result as
     * {@link #forKind}.
     */
    public static Lut lut(OperationKind kind, ParameterSet p, int maxValue) {
        return switch (kind) {
            case BRIGHTNESS -> BasicFilters.brightnessLut(maxValue, p.getInt("amount"));
            case CONTRAST -> BasicFilters.contrastLut(maxValue, p.getInt("amount"));
            case EXPOSURE -> BasicFilters.exposureLut(maxValue, p.getDouble("stops"));
            case LEVELS -> ToneFilters.levelsLut(maxValue, p.getDouble("black"), p.getDouble("white"),
                    p.getDouble("gamma"), p.getString("channel"));
            case NEGATIVE -> SpecialFilters.negativeLut(maxValue, p.getString("channel"));
            case POSTERIZE -> SpecialFilters.posterizeLut(maxValue, p.getInt("levels"));
            case SOLARIZE -> SpecialFilters.solarizeLut(maxValue, p.getDouble("threshold"));
            default -> null;
        };
    }

    private static boolean bilinear(ParameterSet p, String name) {
        return "bilinear".equals(p.getString(name));
    }

    private static ToneFilters.Balance balance(ParameterSet p) {
        return new ToneFilters.Balance(range(p, "shadows"), range(p, "midtones"), range(p, "highlights"));
    }

    private static double[] range(ParameterSet p, String range) {
        return new double[] {
                p.getDouble(range + "-red"), p.getDouble(range + "-green"), p.getDouble(range + "-blue") };
    }
}
