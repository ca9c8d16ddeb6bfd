package wikigate.core.model.common;

import java.time.Duration;

/**
 * A mirror did not answer within the per-request timeout.
 */
public class UpstreamTimeoutException extends WikiAccessException {

    private final Duration timeout;

    public UpstreamTimeoutException(String url, Duration timeout) {
        super(ErrorKind.TIMEOUT, "No response from " + url + " within " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
