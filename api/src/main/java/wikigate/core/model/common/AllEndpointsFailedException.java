package wikigate.core.model.common;

/**
 * Terminal failure after every mirror failed on every permitted pass.
 *
 * <p>Carries the kind of the last concrete failure (network, HTTP or timeout)
 * so callers and telemetry can tell why the upstream was unreachable.
 */
public class AllEndpointsFailedException extends WikiAccessException {

    private final ErrorKind lastFailureKind;

    public AllEndpointsFailedException(String path, Throwable lastFailure) {
        super(
                ErrorKind.ALL_ENDPOINTS_FAILED,
                "All endpoints failed for " + path + ": " + lastFailure.getMessage(),
                lastFailure);
        this.lastFailureKind = kindOf(lastFailure);
    }

    /**
     * Kind of the last concrete failure, or {@code null} if it was untyped.
     */
    public ErrorKind lastFailureKind() {
        return lastFailureKind;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
