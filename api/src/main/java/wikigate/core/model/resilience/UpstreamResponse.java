package wikigate.core.model.resilience;

/**
 * Successful (2xx) response from a mirror.
 *
 * @param url        the absolute URL that answered
 * @param statusCode the HTTP status
 * @param body       the response body as text
 */
public record UpstreamResponse(String url, int statusCode, String body) {}
