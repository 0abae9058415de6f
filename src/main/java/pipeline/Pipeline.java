package pipeline;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import ops.OperationKind;
import ops.ValidationException;

/** Ordered, immutable list of operations. The empty pipeline is the identity. */
public final class Pipeline {

    private static final Pipeline EMPTY = new Pipeline(List.of());

    private final List<Operation> operations;

    private Pipeline(List<Operation> operations) {
        this.operations = Collections.unmodifiableList(new ArrayList<>(operations));
    }

    public static Pipeline empty() {
        return EMPTY;
    }

    public static Pipeline of(Operation... operations) {
        return of(Arrays.asList(operations));
    }

    public static Pipeline of(List<Operation> operations) {
        for (Operation op : operations) {
            if (op == null)
                throw new IllegalArgumentException("pipeline operations must not be null");
        }
        return operations.isEmpty() ? EMPTY : new Pipeline(operations);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Operation> operations() {
        return operations;
    }

    public int size() {
        return operations.size();
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    /** New pipeline with {@code op} appended. */
    public Pipeline then(Operation op) {
        List<Operation> list = new ArrayList<>(operations);
        list.add(op);
        return of(list);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Pipeline && operations.equals(((Pipeline) o).operations);
    }

    @Override
    public int hashCode() {
        return operations.hashCode();
    }

    @Override
    public String toString() {
        return operations.stream().map(Operation::toString).collect(Collectors.joining(" -> ", "[", "]"));
    }

    public static final class Builder {
        private final List<Operation> operations = new ArrayList<>();

        private Builder() {
        }

        public Builder add(Operation op) {
            operations.add(op);
            return this;
        }

        public Builder add(OperationKind kind, Map<String, ?> params) throws ValidationException {
            return add(Operation.of(kind, params));
        }

        public Builder add(String kindId, Map<String, ?> params) throws ValidationException {
            return add(Operation.of(kindId, params));
        }

        public Pipeline build() {
            return of(operations);
        }
    }
}
