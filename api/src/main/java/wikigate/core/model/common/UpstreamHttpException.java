package wikigate.core.model.common;

/**
 * Upstream answered with a non-2xx status.
 */
public class UpstreamHttpException extends WikiAccessException {

    private final int statusCode;
    private final String url;

    public UpstreamHttpException(int statusCode, String url) {
        super(ErrorKind.UPSTREAM_HTTP, "HTTP " + statusCode + " from " + url);
        this.statusCode = statusCode;
        this.url = url;
    }

    public int statusCode() {
        return statusCode;
    }

    public String url() {
        return url;
    }

    /**
     * Only server errors are worth another attempt.
     */
    @Override
    public boolean isRetryable() {
        return statusCode >= 500 && statusCode < 600;
    }
}
