package wikigate.core.model.common;

/**
 * Base type for every failure surfaced by the content-access core.
 *
 * <p>Subclasses fix their {@link ErrorKind}; {@link #isRetryable()} is the
 * single place where retryability is decided.
 */
public abstract class WikiAccessException extends RuntimeException {

    private final ErrorKind kind;

    protected WikiAccessException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected WikiAccessException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Whether a retry of the same logical request may succeed.
     */
    public abstract boolean isRetryable();

    /**
     * Returns the kind of the given failure, or {@code null} for untyped failures.
     */
    public static ErrorKind kindOf(Throwable error) {
        return error instanceof WikiAccessException typed ? typed.kind() : null;
    }

    /**
     * Structural retryability check for arbitrary failures. Untyped failures are not retried.
     */
    public static boolean isRetryableFailure(Throwable error) {
        return error instanceof WikiAccessException typed && typed.isRetryable();
    }
}
