package wikigate.core.model.common;

/**
 * Connection, DNS or I/O failure talking to a mirror.
 */
public class UpstreamNetworkException extends WikiAccessException {

    public UpstreamNetworkException(String message, Throwable cause) {
        super(ErrorKind.NETWORK, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
