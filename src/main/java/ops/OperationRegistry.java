package ops;

import static ops.OperationKind.*;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Parameter schemas of every {@link OperationKind}: the single source of
 * truth for what each filter accepts.
 */
public final class OperationRegistry {

    private static final OperationRegistry STANDARD = new OperationRegistry(buildSchemas());

    private final Map<OperationKind, ParamSchema> schemas;

    private OperationRegistry(Map<OperationKind, ParamSchema> schemas) {
        this.schemas = Collections.unmodifiableMap(schemas);
    }

    public static OperationRegistry standard() {
        return STANDARD;
    }

    public ParamSchema schema(OperationKind kind) {
        return schemas.get(kind);
    }

    public ParamSchema schema(String kindId) throws ValidationException {
        return schema(kindOf(kindId));
    }

    public ParameterSet validate(OperationKind kind, Map<String, ?> raw) throws ValidationException {
        return schema(kind).validate(raw);
    }

    public ParameterSet validate(String kindId, Map<String, ?> raw) throws ValidationException {
        return validate(kindOf(kindId), raw);
    }

    public static OperationKind kindOf(String kindId) throws ValidationException {
        return OperationKind.fromId(kindId)
                .orElseThrow(() -> new ValidationException(kindId, "kind", "unknown operation kind '" + kindId + "'"));
    }

    // ---------------- Schemas ----------------

    private static Map<OperationKind, ParamSchema> buildSchemas() {
        Map<OperationKind, ParamSchema> m = new EnumMap<>(OperationKind.class);

        // basic
        put(m, ParamSchema.builder(BRIGHTNESS).integer("amount", -255, 255, 0));
        put(m, ParamSchema.builder(CONTRAST).integer("amount", -100, 100, 0));
        put(m, ParamSchema.builder(SATURATION).floating("factor", 0.0, 4.0, 1.0));
        put(m, ParamSchema.builder(EXPOSURE).floating("stops", -5.0, 5.0, 0.0));
        put(m, ParamSchema.builder(COLOR_TEMPERATURE).integer("kelvin", 1000, 40000, 6500));
        put(m, ParamSchema.builder(CROP)
                .requiredInteger("x", 0, Integer.MAX_VALUE)
                .requiredInteger("y", 0, Integer.MAX_VALUE)
                .requiredInteger("w", 1, Integer.MAX_VALUE)
                .requiredInteger("h", 1, Integer.MAX_VALUE));
        put(m, ParamSchema.builder(ROTATE)
                .floating("angle", -360.0, 360.0, 0.0)
                .choice("interpolation", "bilinear", "nearest", "bilinear")
                .color("fill", "#000000")
                .bool("expand", true));
        put(m, ParamSchema.builder(RESIZE)
                .optionalInteger("w", 1, 65535)
                .optionalInteger("h", 1, 65535)
                .optionalFloating("scale", 0.001, 100.0)
                .choice("method", "bilinear", "nearest", "bilinear")
                .rule(OperationRegistry::checkResizeTarget));
        put(m, ParamSchema.builder(GRAYSCALE));
        put(m, ParamSchema.builder(FLIP).choice("direction", "vertical", "horizontal", "vertical"));
        put(m, ParamSchema.builder(FLATTEN).color("background", "#ffffff"));
        put(m, ParamSchema.builder(BLUR)
                .integer("radius", 1, 25, 2)
                .floating("sigma", 0.1, 20.0, 1.0));
        put(m, ParamSchema.builder(SHARPEN).floating("amount", 0.0, 4.0, 0.6));

        // artistic
        put(m, ParamSchema.builder(OIL_PAINTING)
                .integer("radius", 1, 10, 3)
                .integer("levels", 2, 256, 20));
        put(m, ParamSchema.builder(CHARCOAL)
                .integer("radius", 0, 10, 1)
                .floating("sigma", 0.1, 10.0, 0.5));
        put(m, ParamSchema.builder(SEPIA).floating("intensity", 0.0, 1.0, 0.8));
        put(m, ParamSchema.builder(GRAIN)
                .floating("amount", 0.0, 1.0, 0.1)
                .integer("size", 1, 16, 1)
                .integer("seed", Integer.MIN_VALUE, Integer.MAX_VALUE, 0)
                .bool("monochrome", true));
        put(m, ParamSchema.builder(EMBOSS)
                .floating("azimuth", 0.0, 360.0, 135.0)
                .floating("elevation", 0.0, 90.0, 30.0)
                .floating("depth", 0.1, 20.0, 1.0));
        put(m, ParamSchema.builder(SWIRL)
                .floating("degrees", -3600.0, 3600.0, 90.0)
                .integer("radius", 0, 65535, 0)
                .optionalPoint("center"));
        put(m, ParamSchema.builder(WAVE)
                .floating("amplitude", 0.0, 500.0, 5.0)
                .floating("length", 1.0, 10000.0, 40.0));
        put(m, ParamSchema.builder(IMPLODE).floating("amount", -1.0, 1.0, 0.5));

        // tone
        put(m, ParamSchema.builder(DUOTONE)
                .color("shadow", "#1e3264")
                .color("highlight", "#ffd28c"));
        put(m, ParamSchema.builder(SPLIT_TONING)
                .color("shadow", "#0064c8")
                .color("highlight", "#ffb400")
                .floating("balance", -1.0, 1.0, 0.0)
                .floating("strength", 0.0, 1.0, 0.3));
        put(m, ParamSchema.builder(LEVELS)
                .floating("black", 0.0, 1.0, 0.0)
                .floating("white", 0.0, 1.0, 1.0)
                .floating("gamma", 0.1, 10.0, 1.0)
                .choice("channel", "composite", "composite", "red", "green", "blue")
                .rule(p -> {
                    if (p.getDouble("black") >= p.getDouble("white"))
                        throw new ValidationException(null, "white", "must be greater than black ("
                                + p.getDouble("white") + " <= " + p.getDouble("black") + ")");
                }));
        ParamSchema.Builder balance = ParamSchema.builder(COLOR_BALANCE);
        for (String range : new String[] { "shadows", "midtones", "highlights" }) {
            for (String channel : new String[] { "red", "green", "blue" })
                balance.floating(range + "-" + channel, -1.0, 1.0, 0.0);
        }
        put(m, balance);

        // special
        put(m, ParamSchema.builder(NEGATIVE).choice("channel", "rgb", "rgb", "red", "green", "blue"));
        put(m, ParamSchema.builder(POSTERIZE).integer("levels", 2, 256, 4));
        put(m, ParamSchema.builder(SOLARIZE).floating("threshold", 0.0, 1.0, 0.5));
        put(m, ParamSchema.builder(PIXELATE)
                .integer("size", 1, 512, 8)
                .optionalRect("region"));
        put(m, ParamSchema.builder(CRYSTALLIZE)
                .integer("size", 2, 512, 16)
                .integer("seed", Integer.MIN_VALUE, Integer.MAX_VALUE, 0));
        put(m, ParamSchema.builder(EDGE_DETECTION)
                .choice("kernel", "sobel", "sobel", "prewitt", "laplacian")
                .optionalFloating("threshold", 0.0, 1.0));
        put(m, ParamSchema.builder(VIGNETTE)
                .floating("radius", 0.1, 2.0, 0.8)
                .floating("softness", 0.01, 2.0, 0.5)
                .color("color", "#000000"));

        for (OperationKind k : OperationKind.values()) {
            if (!m.containsKey(k))
                throw new IllegalStateException("no schema for " + k);
        }
        return m;
    }

    private static void put(Map<OperationKind, ParamSchema> m, ParamSchema.Builder b) {
        ParamSchema s = b.build();
        m.put(s.kind(), s);
    }

    private static void checkResizeTarget(ParameterSet p) throws ValidationException {
        boolean w = p.has("w"), h = p.has("h"), scale = p.has("scale");
        if (scale && (w || h))
            throw new ValidationException(null, "scale", "cannot be combined with w/h");
        if (!scale) {
            if (!w)
                throw new ValidationException(null, "w", "is required unless scale is given");
            if (!h)
                throw new ValidationException(null, "h", "is required unless scale is given");
        }
    }
}
