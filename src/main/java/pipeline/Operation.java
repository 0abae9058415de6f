package pipeline;

import java.util.Map;
import java.util.Objects;

import image.PixelBuffer;
import ops.OperationKind;
import ops.OperationRegistry;
import ops.ParameterSet;
import ops.ValidationException;
import stages.FilterException;
import stages.Filters;
import stages.Lut;

/**
 * One validated pipeline step: a kind plus its normalized parameters.
 * Construction goes through {@link OperationRegistry}, so an Operation that
 * exists is always valid.
 */
public final class Operation {

    private final OperationKind kind;
    private final ParameterSet params;

    private Operation(OperationKind kind, ParameterSet params) {
        this.kind = kind;
        this.params = params;
    }

    public static Operation of(OperationKind kind, Map<String, ?> raw) throws ValidationException {
        return new Operation(kind, OperationRegistry.standard().validate(kind, raw));
    }

    public static Operation of(String kindId, Map<String, ?> raw) throws ValidationException {
        return of(OperationRegistry.kindOf(kindId), raw);
    }

    /** All parameters at their defaults. */
    public static Operation of(OperationKind kind) throws ValidationException {
        return of(kind, Map.of());
    }

    public OperationKind kind() {
        return kind;
    }

    public ParameterSet params() {
        return params;
    }

    /** Apply to {@code src}; the input is never modified. */
    public PixelBuffer apply(PixelBuffer src) throws FilterException {
        return Filters.forKind(kind).apply(src, params);
    }

    /** Lookup table for pointwise kinds, null otherwise. */
    public Lut lut(int maxValue) {
        return Filters.lut(kind, params, maxValue);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Operation))
            return false;
        Operation other = (Operation) o;
        return kind == other.kind && params.equals(other.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, params);
    }

    @Override
    public String toString() {
        return kind.id() + params;
    }
}
