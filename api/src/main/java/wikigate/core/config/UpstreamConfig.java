package wikigate.core.config;

import java.util.List;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the upstream content API.
 *
 * <p>Configuration prefix: {@code wikigate.upstream}
 *
 * <p>Mirror entries are base URL templates; {@code {lang}} is replaced with
 * the content language, e.g. {@code https://{lang}.wikipedia.org}.
 */
@ConfigMapping(prefix = "wikigate.upstream")
public interface UpstreamConfig {

    /**
     * Mirror base URL templates in preference order.
     *
     * @return Mirror templates (default: desktop and mobile Wikipedia hosts)
     */
    @WithDefault("https://{lang}.wikipedia.org,https://{lang}.m.wikipedia.org")
    List<String> mirrors();

    /**
     * Base URL of the Wikimedia REST API serving pageview statistics.
     *
     * @return Pageviews base URL
     */
    @WithDefault("https://wikimedia.org")
    String pageviewsBaseUrl();

    /**
     * Language used when a request names none.
     *
     * @return Default language code (default: en)
     */
    @WithDefault("en")
    String defaultLanguage();

    /**
     * Whether identical concurrent requests share a single upstream call.
     *
     * @return true to coalesce requests (default: true)
     */
    @WithDefault("true")
    boolean deduplicationEnabled();
}
