package image;

/**
 * A malformed buffer or sample handed to the core by the calling layer.
 * This is a programmer error, not a user-recoverable condition.
 */
public class PreconditionViolationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public PreconditionViolationException(String message) {
        super(message);
    }
}
