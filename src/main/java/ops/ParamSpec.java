package ops;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Schema entry for one parameter: type, valid range or allowed values, and
 * default. A parameter with neither a default nor {@code required} is
 * optional and simply absent when not supplied.
 */
public final class ParamSpec {

    private static final Pattern LIST_SEPARATOR = Pattern.compile("\\s*,\\s*");

    private final String name;
    private final ParamType type;
    private final double min;
    private final double max;
    private final List<String> allowed;
    private final Object defaultValue;
    private final boolean required;

    ParamSpec(String name, ParamType type, double min, double max, List<String> allowed, Object defaultValue,
            boolean required) {
        this.name = name;
        this.type = type;
        this.min = min;
        this.max = max;
        this.allowed = allowed == null ? List.of() : List.copyOf(allowed);
        this.defaultValue = defaultValue;
        this.required = required;
    }

    public String name() {
        return name;
    }

    public ParamType type() {
        return type;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    /** Allowed values of an ENUM parameter, empty otherwise. */
    public List<String> allowed() {
        return allowed;
    }

    /** Canonical default value, or null. */
    public Object defaultValue() {
        return defaultValue;
    }

    public boolean required() {
        return required;
    }

    /** Human readable range / choices, used by {@code --list}. */
    public String describe() {
        StringBuilder sb = new StringBuilder(name).append(" (").append(type.name().toLowerCase(Locale.ROOT));
        switch (type) {
            case INTEGER -> sb.append(' ').append((long) min).append("..").append((long) max);
            case FLOAT -> sb.append(' ').append(min).append("..").append(max);
            case ENUM -> sb.append(' ').append(String.join("|", allowed));
            default -> {
            }
        }
        sb.append(')');
        if (required)
            sb.append(" required");
        else if (defaultValue != null)
            sb.append(" default=").append(defaultValue);
        else
            sb.append(" optional");
        return sb.toString();
    }

    // ---------------- Normalization ----------------

    /**
     * Convert a raw value to this parameter's canonical type and check it.
     * Canonical values pass through unchanged.
     */
    Object normalize(Object raw) throws ValidationException {
        if (raw == null)
            throw invalid("has no value");
        return switch (type) {
            case INTEGER -> normalizeInt(raw);
            case FLOAT -> normalizeFloat(raw);
            case ENUM -> normalizeEnum(raw);
            case BOOLEAN -> normalizeBoolean(raw);
            case COLOR -> normalizeColor(raw);
            case POINT -> normalizePoint(raw);
            case RECTANGLE -> normalizeRect(raw);
        };
    }

    private Integer normalizeInt(Object raw) throws ValidationException {
        long v = toLong(raw);
        if (v < min || v > max)
            throw invalid("must be between " + (long) min + " and " + (long) max + " (got " + v + ")");
        return (int) v;
    }

    private Double normalizeFloat(Object raw) throws ValidationException {
        double v;
        if (raw instanceof Number)
            v = ((Number) raw).doubleValue();
        else if (raw instanceof String) {
            try {
                v = Double.parseDouble(((String) raw).trim());
            } catch (NumberFormatException e) {
                throw invalid("expected a number (got '" + raw + "')");
            }
        } else
            throw invalid("expected a number (got " + raw.getClass().getSimpleName() + ")");
        if (!Double.isFinite(v))
            throw invalid("must be finite");
        if (v < min || v > max)
            throw invalid("must be between " + min + " and " + max + " (got " + v + ")");
        return v;
    }

    private String normalizeEnum(Object raw) throws ValidationException {
        if (!(raw instanceof String) && !(raw instanceof Enum))
            throw invalid("expected one of " + allowed + " (got " + raw.getClass().getSimpleName() + ")");
        String v = raw.toString().trim().toLowerCase(Locale.ROOT);
        if (!allowed.contains(v))
            throw invalid("must be one of " + allowed + " (got '" + raw + "')");
        return v;
    }

    private Boolean normalizeBoolean(Object raw) throws ValidationException {
        if (raw instanceof Boolean)
            return (Boolean) raw;
        if (raw instanceof String) {
            String s = ((String) raw).trim();
            if (s.equalsIgnoreCase("true"))
                return Boolean.TRUE;
            if (s.equalsIgnoreCase("false"))
                return Boolean.FALSE;
        }
        throw invalid("expected true or false (got '" + raw + "')");
    }

    private Rgba normalizeColor(Object raw) throws ValidationException {
        if (raw instanceof Rgba)
            return (Rgba) raw;
        if (raw instanceof String) {
            try {
                return Rgba.parse((String) raw);
            } catch (IllegalArgumentException e) {
                throw invalid("expected a color like #rrggbb (got '" + raw + "')");
            }
        }
        throw invalid("expected a color (got " + raw.getClass().getSimpleName() + ")");
    }

    private Point normalizePoint(Object raw) throws ValidationException {
        if (raw instanceof Point)
            return (Point) raw;
        long[] v = toLongs(raw, 2, "x,y");
        if (v[0] < 0 || v[1] < 0 || v[0] > Integer.MAX_VALUE || v[1] > Integer.MAX_VALUE)
            throw invalid("coordinates must be non-negative");
        return new Point((int) v[0], (int) v[1]);
    }

    private Rect normalizeRect(Object raw) throws ValidationException {
        Rect r;
        if (raw instanceof Rect)
            r = (Rect) raw;
        else {
            long[] v = toLongs(raw, 4, "x,y,w,h");
            for (long c : v) {
                if (c > Integer.MAX_VALUE)
                    throw invalid("component too large");
            }
            if (v[2] < 1 || v[3] < 1)
                throw invalid("width and height must be >= 1");
            r = new Rect((int) v[0], (int) v[1], (int) v[2], (int) v[3]);
        }
        if (r.x() < 0 || r.y() < 0)
            throw invalid("origin must be non-negative");
        return r;
    }

    private long toLong(Object raw) throws ValidationException {
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte)
            return ((Number) raw).longValue();
        if (raw instanceof Number)
            return integral(((Number) raw).doubleValue(), raw);
        if (raw instanceof String) {
            String s = ((String) raw).trim();
            try {
                return Long.parseLong(s);
            } catch (NumberFormatException e) {
                try {
                    return integral(Double.parseDouble(s), raw);
                } catch (NumberFormatException e2) {
                    throw invalid("expected an integer (got '" + raw + "')");
                }
            }
        }
        throw invalid("expected an integer (got " + raw.getClass().getSimpleName() + ")");
    }

    private long integral(double d, Object raw) throws ValidationException {
        if (!Double.isFinite(d) || d != Math.rint(d) || Math.abs(d) > Long.MAX_VALUE / 2.0)
            throw invalid("expected an integer (got '" + raw + "')");
        return (long) d;
    }

    private long[] toLongs(Object raw, int n, String shape) throws ValidationException {
        Object[] parts;
        if (raw instanceof String)
            parts = LIST_SEPARATOR.split(((String) raw).trim());
        else if (raw instanceof List)
            parts = ((List<?>) raw).toArray();
        else if (raw instanceof int[]) {
            int[] a = (int[]) raw;
            parts = new Object[a.length];
            for (int i = 0; i < a.length; i++)
                parts[i] = a[i];
        } else
            throw invalid("expected " + shape + " (got " + raw.getClass().getSimpleName() + ")");
        if (parts.length != n)
            throw invalid("expected " + n + " values " + shape + " (got " + parts.length + ")");
        long[] out = new long[n];
        for (int i = 0; i < n; i++) {
            if (parts[i] == null)
                throw invalid("expected " + shape);
            out[i] = toLong(parts[i]);
        }
        return out;
    }

    private ValidationException invalid(String reason) {
        return new ValidationException(null, name, reason);
    }

    @Override
    public String toString() {
        return describe();
    }
}
