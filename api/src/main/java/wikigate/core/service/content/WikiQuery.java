package wikigate.core.service.content;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the path and query string of an upstream request.
 *
 * <p>Parameters keep insertion order so the same request always yields the
 * same path. Values are URL-encoded; {@code |} separators are encoded too.
 */
final class WikiQuery {

    static final String ACTION_API = "/w/api.php";
    static final String SUMMARY_API = "/api/rest_v1/page/summary/";
    static final String PAGEVIEWS_TOP_API = "/api/rest_v1/metrics/pageviews/top/";

    private final Map<String, String> params = new LinkedHashMap<>();

    private WikiQuery(String action) {
        params.put("action", action);
        params.put("format", "json");
        params.put("formatversion", "2");
    }

    static WikiQuery action(String action) {
        return new WikiQuery(action);
    }

    WikiQuery param(String name, Object value) {
        params.put(name, String.valueOf(value));
        return this;
    }

    WikiQuery paramIf(boolean condition, String name, Object value) {
        return condition ? param(name, value) : this;
    }

    String toPath() {
        return ACTION_API + "?"
                + params.entrySet().stream()
                        .map(entry -> entry.getKey() + "=" + encode(entry.getValue()))
                        .collect(Collectors.joining("&"));
    }

    /**
     * REST path of a page summary. Spaces become underscores as in canonical titles.
     */
    static String summaryPath(String title) {
        return SUMMARY_API + encode(title.replace(' ', '_'));
    }

    /**
     * REST path of the most viewed articles of {@code lang}.wikipedia on {@code date} (yyyy/MM/dd).
     */
    static String pageviewsTopPath(String lang, String date) {
        return PAGEVIEWS_TOP_API + lang + ".wikipedia/all-access/" + date;
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
