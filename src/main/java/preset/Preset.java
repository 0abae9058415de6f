package preset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ops.OperationKind;
import ops.OperationRegistry;
import ops.ValidationException;
import pipeline.Operation;
import pipeline.Pipeline;

/**
 * A named pipeline template. Parameter values written {@code "$name"} refer
 * to a variable slot; a slot whose default is null must be supplied when
 * the preset is instantiated.
 */
public final class Preset {

    public static final String VARIABLE_PREFIX = "$";

    private final String name;
    private final String description;
    private final List<PresetStep> steps;
    private final Map<String, Object> variables;

    public Preset(String name, String description, List<PresetStep> steps, Map<String, Object> variables) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("preset needs a name");
        this.name = name;
        this.description = description == null ? "" : description;
        this.steps = List.copyOf(steps);
        // slot defaults may be null
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables == null ? Map.of() : variables));
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public List<PresetStep> steps() {
        return steps;
    }

    /** Slot name to default value (null = must be supplied). */
    public Map<String, Object> variables() {
        return variables;
    }

    public Pipeline instantiate() throws ValidationException {
        return instantiate(Map.of());
    }

    /**
     * Substitute {@code values} (falling back to slot defaults; null means
     * none supplied) into every step and validate each one through the
     * registry.
     *
     * @throws ValidationException for an unknown supplied variable, a required
     *                             slot left unsupplied, a reference to an
     *                             undeclared slot, an unknown kind or any
     *                             invalid parameter
     */
    public Pipeline instantiate(Map<String, ?> values) throws ValidationException {
        if (values == null)
            values = Map.of();
        for (String supplied : values.keySet()) {
            if (!variables.containsKey(supplied))
                throw new ValidationException(null, supplied, "is not a variable of preset '" + name + "'");
        }
        Map<String, Object> resolved = new LinkedHashMap<>(variables);
        resolved.putAll(values);
        for (Map.Entry<String, Object> e : resolved.entrySet()) {
            if (e.getValue() == null)
                throw new ValidationException(null, e.getKey(),
                        "variable of preset '" + name + "' has no default and was not supplied");
        }

        List<Operation> ops = new ArrayList<>(steps.size());
        for (PresetStep step : steps) {
            OperationKind kind = OperationRegistry.kindOf(step.kind());
            Map<String, Object> params = new LinkedHashMap<>();
            for (Map.Entry<String, Object> p : step.parameters().entrySet())
                params.put(p.getKey(), substitute(kind, p.getKey(), p.getValue(), resolved));
            ops.add(Operation.of(kind, params));
        }
        return Pipeline.of(ops);
    }

    private Object substitute(OperationKind kind, String param, Object value, Map<String, Object> resolved)
            throws ValidationException {
        if (!(value instanceof String) || !((String) value).startsWith(VARIABLE_PREFIX))
            return value;
        String slot = ((String) value).substring(VARIABLE_PREFIX.length());
        if (!resolved.containsKey(slot))
            throw new ValidationException(kind.id(), param, "references undeclared variable '" + value + "'");
        return resolved.get(slot);
    }

    @Override
    public String toString() {
        return name + " (" + steps.size() + " steps, variables " + variables.keySet() + ")";
    }
}
