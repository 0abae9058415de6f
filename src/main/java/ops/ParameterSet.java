package ops;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized, immutable parameter values of one operation, in schema order.
 * Values have their canonical types: Integer, Double, String (enum),
 * Boolean, {@link Rgba}, {@link Point}, {@link Rect}.
 */
public final class ParameterSet {

    private final Map<String, Object> values;

    ParameterSet(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public int getInt(String name) {
        return ((Number) require(name)).intValue();
    }

    public double getDouble(String name) {
        return ((Number) require(name)).doubleValue();
    }

    public String getString(String name) {
        return (String) require(name);
    }

    public boolean getBoolean(String name) {
        return (Boolean) require(name);
    }

    public Rgba getColor(String name) {
        return (Rgba) require(name);
    }

    /** Point value, or null when the optional parameter is absent. */
    public Point getPoint(String name) {
        return (Point) values.get(name);
    }

    /** Rectangle value, or null when the optional parameter is absent. */
    public Rect getRect(String name) {
        return (Rect) values.get(name);
    }

    private Object require(String name) {
        Object v = values.get(name);
        if (v == null)
            throw new IllegalArgumentException("no value for parameter '" + name + "'");
        return v;
    }

    /** Unmodifiable view; feeding it back to the registry yields an equal set. */
    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ParameterSet && values.equals(((ParameterSet) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
