package wikigate.core.service.resilience;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.jboss.logging.Logger;

import wikigate.core.model.resilience.EndpointStatus;
import wikigate.core.model.resilience.ResilienceSettings;
import wikigate.core.port.out.UpstreamClient;

/**
 * Holds one {@link EndpointManager} per content language, plus one for the
 * pageviews API host.
 *
 * <p>Language managers are created on first use from the mirror templates,
 * replacing {@value #LANGUAGE_PLACEHOLDER} with the language code. They live as
 * long as the registry, so breaker state and mirror preference persist across
 * requests.
 */
public class EndpointRegistry {

    public static final String LANGUAGE_PLACEHOLDER = "{lang}";
    static final String PAGEVIEWS = "pageviews";

    private static final Logger LOG = Logger.getLogger(EndpointRegistry.class);

    private final List<String> mirrorTemplates;
    private final UpstreamClient client;
    private final RetryExecutor retryExecutor;
    private final ResilienceSettings settings;
    private final Clock clock;
    private final Map<String, EndpointManager> byLanguage = new ConcurrentHashMap<>();
    private final EndpointManager pageviews;

    /**
     * @param mirrorTemplates  mirror base URL templates in preference order
     * @param pageviewsBaseUrl base URL of the pageviews REST API
     * @param client           outbound HTTP client shared by all managers
     * @param retryExecutor    retry executor shared by all managers
     * @param settings         retry, breaker and timeout settings
     * @param clock            time source for breakers
     */
    public EndpointRegistry(
            List<String> mirrorTemplates,
            String pageviewsBaseUrl,
            UpstreamClient client,
            RetryExecutor retryExecutor,
            ResilienceSettings settings,
            Clock clock) {
        if (mirrorTemplates.isEmpty()) {
            throw new IllegalArgumentException("At least one mirror template is required");
        }
        this.mirrorTemplates = List.copyOf(mirrorTemplates);
        this.client = client;
        this.retryExecutor = retryExecutor;
        this.settings = settings;
        this.clock = clock;
        this.pageviews = create(PAGEVIEWS, List.of(pageviewsBaseUrl));
    }

    /**
     * Returns the manager for a language, creating it on first use.
     */
    public EndpointManager forLanguage(String language) {
        return byLanguage.computeIfAbsent(language, lang -> {
            final var urls = mirrorTemplates.stream()
                    .map(template -> template.replace(LANGUAGE_PLACEHOLDER, lang))
                    .toList();
            LOG.infov("Creating endpoint manager for {0} with mirrors {1}", lang, urls);
            return create(lang, urls);
        });
    }

    /**
     * Returns the manager for the pageviews API.
     */
    public EndpointManager pageviews() {
        return pageviews;
    }

    /**
     * Returns the mirror status of every manager created so far, keyed by manager name.
     */
    public Map<String, List<EndpointStatus>> getEndpointStatus() {
        final var status = new LinkedHashMap<String, List<EndpointStatus>>();
        byLanguage.values().stream()
                .sorted(Comparator.comparing(EndpointManager::name))
                .forEach(manager -> status.put(manager.name(), manager.getEndpointStatus()));
        status.put(pageviews.name(), pageviews.getEndpointStatus());
        return status;
    }

    private EndpointManager create(String name, List<String> urls) {
        return new EndpointManager(
                name,
                urls,
                client,
                retryExecutor,
                settings.retryPolicy(),
                settings.breakerPolicy(),
                settings.requestTimeout(),
                clock);
    }
}
