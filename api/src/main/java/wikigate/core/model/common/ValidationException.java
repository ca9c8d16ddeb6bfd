package wikigate.core.model.common;

/**
 * Caller supplied malformed input. Never retried.
 */
public class ValidationException extends WikiAccessException {

    private final String field;

    public ValidationException(String field, String message) {
        super(ErrorKind.VALIDATION, "Invalid parameter '" + field + "': " + message);
        this.field = field;
    }

    public String field() {
        return field;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
