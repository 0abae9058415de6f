package ops;

/**
 * Bad input to an operation or preset: a parameter out of range, of the
 * wrong type, unknown, or a required value / variable slot that was not
 * supplied. Recoverable by fixing the inputs.
 */
public class ValidationException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String kind;
    private final String parameter;
    private final String reason;

    public ValidationException(String kind, String parameter, String reason) {
        super(format(kind, parameter, reason));
        this.kind = kind;
        this.parameter = parameter;
        this.reason = reason;
    }

    private static String format(String kind, String parameter, String reason) {
        StringBuilder sb = new StringBuilder();
        if (kind != null)
            sb.append(kind).append(": ");
        if (parameter != null)
            sb.append("parameter '").append(parameter).append("' ");
        return sb.append(reason).toString();
    }

    /** Same error attributed to {@code kind}, used when the kind was not known where it was raised. */
    public ValidationException withKind(String kind) {
        ValidationException e = new ValidationException(kind, parameter, reason);
        e.setStackTrace(getStackTrace());
        return e;
    }

    /** Operation kind identifier, may be null. */
    public String getKind() {
        return kind;
    }

    /** Offending parameter or variable name, may be null. */
    public String getParameter() {
        return parameter;
    }

    public String getReason() {
        return reason;
    }
}
