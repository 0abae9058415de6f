package ops;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Ordered parameter specs of one operation kind plus cross-parameter rules. */
public final class ParamSchema {

    /** Check involving more than one parameter, run after per-parameter normalization. */
    @FunctionalInterface
    public interface Rule {
        void check(ParameterSet params) throws ValidationException;
    }

    private final OperationKind kind;
    private final Map<String, ParamSpec> specs;
    private final List<Rule> rules;

    private ParamSchema(OperationKind kind, Map<String, ParamSpec> specs, List<Rule> rules) {
        this.kind = kind;
        this.specs = Collections.unmodifiableMap(specs);
        this.rules = List.copyOf(rules);
    }

    public static Builder builder(OperationKind kind) {
        return new Builder(kind);
    }

    public OperationKind kind() {
        return kind;
    }

    public List<ParamSpec> params() {
        return List.copyOf(specs.values());
    }

    public ParamSpec param(String name) {
        return specs.get(name);
    }

    /**
     * Normalize {@code raw} against this schema.
     *
     * @throws ValidationException naming the first offending parameter
     */
    public ParameterSet validate(Map<String, ?> raw) throws ValidationException {
        Map<String, ?> input = raw == null ? Map.of() : raw;
        for (String name : input.keySet()) {
            if (!specs.containsKey(name))
                throw new ValidationException(kind.id(), name, "is not a parameter of " + kind.id());
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (ParamSpec spec : specs.values()) {
            Object v = input.get(spec.name());
            try {
                if (v != null)
                    out.put(spec.name(), spec.normalize(v));
                else if (spec.defaultValue() != null)
                    out.put(spec.name(), spec.defaultValue());
                else if (spec.required())
                    throw new ValidationException(null, spec.name(), "is required but missing");
            } catch (ValidationException e) {
                throw e.withKind(kind.id());
            }
        }
        ParameterSet set = new ParameterSet(out);
        for (Rule rule : rules) {
            try {
                rule.check(set);
            } catch (ValidationException e) {
                throw e.getKind() == null ? e.withKind(kind.id()) : e;
            }
        }
        return set;
    }

    public static final class Builder {
        private final OperationKind kind;
        private final Map<String, ParamSpec> specs = new LinkedHashMap<>();
        private final List<Rule> rules = new ArrayList<>();

        private Builder(OperationKind kind) {
            this.kind = kind;
        }

        public Builder integer(String name, int min, int max, int def) {
            return add(new ParamSpec(name, ParamType.INTEGER, min, max, null, def, false));
        }

        public Builder requiredInteger(String name, int min, int max) {
            return add(new ParamSpec(name, ParamType.INTEGER, min, max, null, null, true));
        }

        public Builder optionalInteger(String name, int min, int max) {
            return add(new ParamSpec(name, ParamType.INTEGER, min, max, null, null, false));
        }

        public Builder floating(String name, double min, double max, double def) {
            return add(new ParamSpec(name, ParamType.FLOAT, min, max, null, def, false));
        }

        public Builder optionalFloating(String name, double min, double max) {
            return add(new ParamSpec(name, ParamType.FLOAT, min, max, null, null, false));
        }

        public Builder choice(String name, String def, String... allowed) {
            return add(new ParamSpec(name, ParamType.ENUM, 0, 0, Arrays.asList(allowed), def, false));
        }

        public Builder bool(String name, boolean def) {
            return add(new ParamSpec(name, ParamType.BOOLEAN, 0, 0, null, def, false));
        }

        public Builder color(String name, String def) {
            return add(new ParamSpec(name, ParamType.COLOR, 0, 0, null, Rgba.parse(def), false));
        }

        public Builder optionalPoint(String name) {
            return add(new ParamSpec(name, ParamType.POINT, 0, 0, null, null, false));
        }

        public Builder optionalRect(String name) {
            return add(new ParamSpec(name, ParamType.RECTANGLE, 0, 0, null, null, false));
        }

        public Builder rule(Rule rule) {
            rules.add(rule);
            return this;
        }

        private Builder add(ParamSpec spec) {
            if (specs.put(spec.name(), spec) != null)
                throw new IllegalStateException("duplicate parameter " + spec.name() + " for " + kind);
            return this;
        }

        public ParamSchema build() {
            return new ParamSchema(kind, specs, rules);
        }
    }
}
