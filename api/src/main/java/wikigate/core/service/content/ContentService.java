package wikigate.core.service.content;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wikigate.core.model.common.HealthStatus;
import wikigate.core.model.common.WikiAccessException;
import wikigate.core.model.content.BatchItemResult;
import wikigate.core.model.content.CategoryMemberType;
import wikigate.core.model.content.ContentHealth;
import wikigate.core.model.content.GeoSearchHit;
import wikigate.core.model.content.LanguageLink;
import wikigate.core.model.content.LinkedTitles;
import wikigate.core.model.content.PageExtract;
import wikigate.core.model.content.PageImages;
import wikigate.core.model.content.PageOptions;
import wikigate.core.model.content.PageSummary;
import wikigate.core.model.content.ParsedPage;
import wikigate.core.model.content.RandomPage;
import wikigate.core.model.content.RelatedMethod;
import wikigate.core.model.content.SearchOptions;
import wikigate.core.model.content.SearchResults;
import wikigate.core.model.content.TrendingArticle;
import wikigate.core.model.resilience.CircuitBreakerStatus;
import wikigate.core.model.resilience.CircuitState;
import wikigate.core.model.resilience.EndpointStatus;
import wikigate.core.port.in.ContentUseCase;
import wikigate.core.service.ServiceContext;
import wikigate.core.service.resilience.EndpointManager;

/**
 * Reads Wikipedia content through cache, deduplication and the resilient endpoint layer.
 *
 * <p>Every read follows the same path: validate, derive the cache key from
 * every result-affecting parameter, serve a cache hit, otherwise coalesce
 * with an identical in-flight request, fetch through the language's
 * {@link EndpointManager}, decode and cache the typed result.
 */
public class ContentService implements ContentUseCase {

    private static final Logger LOG = Logger.getLogger(ContentService.class);
    private static final DateTimeFormatter TRENDING_DATE = DateTimeFormatter.ofPattern("yyyy/MM/dd");

    static final int CATEGORY_LIMIT = 500;
    static final int LANGUAGE_LINK_LIMIT = 500;
    static final int TRENDING_LIMIT = 20;

    private static final String SNIPPET_PROPS = "snippet|size|wordcount|timestamp";
    private static final String PLAIN_PROPS = "size|wordcount|timestamp";

    private final ServiceContext context;
    private final WikiResponseDecoder decoder;
    private final String defaultLanguage;
    private final boolean deduplicationEnabled;
    private final Clock clock;

    /**
     * @param context              shared cache, deduplicator, endpoints and monitoring
     * @param decoder              decodes upstream bodies
     * @param defaultLanguage      language used when an operation receives none
     * @param deduplicationEnabled whether identical in-flight requests are coalesced
     * @param clock                time source for the default trending date
     */
    public ContentService(
            ServiceContext context,
            WikiResponseDecoder decoder,
            String defaultLanguage,
            boolean deduplicationEnabled,
            Clock clock) {
        this.context = context;
        this.decoder = decoder;
        this.defaultLanguage = defaultLanguage;
        this.deduplicationEnabled = deduplicationEnabled;
        this.clock = clock;
    }

    @Override
    public Uni<SearchResults> search(String query, SearchOptions options) {
        return Uni.createFrom().deferred(() -> {
            final var text = ContentValidator.text("query", query);
            final var lang = language(options.lang());
            final var limit = ContentValidator.range("limit", options.limit(), 1, ContentValidator.MAX_LIMIT);
            final var offset = ContentValidator.nonNegative("offset", options.offset());
            final var key = key("search", lang, limit, offset, options.includeSnippets(), text);

            final var path = WikiQuery.action("query")
                    .param("list", "search")
                    .param("srsearch", text)
                    .param("srlimit", limit)
                    .param("sroffset", offset)
                    .param("srinfo", "totalhits")
                    .param("srprop", options.includeSnippets() ? SNIPPET_PROPS : PLAIN_PROPS)
                    .toPath();
            return cachedFetch("search", key, () -> fetch(lang, path, decoder::searchResults));
        });
    }

    @Override
    public Uni<ParsedPage> getPage(String title, PageOptions options) {
        return Uni.createFrom().deferred(() -> {
            final var name = ContentValidator.text("title", title);
            final var lang = language(options.lang());
            final var key = key("page", lang, flags(options), name);
            final var path = parseQuery(options).param("page", name).toPath();
            return cachedFetch("page", key, () -> fetch(lang, path, decoder::parsedPage));
        });
    }

    @Override
    public Uni<ParsedPage> getPageById(long id, PageOptions options) {
        return Uni.createFrom().deferred(() -> {
            final var pageId = ContentValidator.positive("id", id);
            final var lang = language(options.lang());
            final var key = key("pageById", lang, flags(options), pageId);
            final var path = parseQuery(options).param("pageid", pageId).toPath();
            return cachedFetch("pageById", key, () -> fetch(lang, path, decoder::parsedPage));
        });
    }

    @Override
    public Uni<Map<String, BatchItemResult<SearchResults>>> batchSearch(
            List<String> queries, String lang, int limit, int concurrency) {
        return Uni.createFrom().deferred(() -> {
            ContentValidator.batch("queries", queries);
            final var language = language(lang);
            ContentValidator.range("limit", limit, 1, ContentValidator.MAX_BATCH_LIMIT);
            ContentValidator.range("concurrency", concurrency, 1, ContentValidator.MAX_CONCURRENCY);
            final var options = new SearchOptions(language, limit, 0, true);
            return runBatch(queries, concurrency, query -> search(query, options));
        });
    }

    @Override
    public Uni<Map<String, BatchItemResult<ParsedPage>>> batchGetPages(
            List<String> titles, PageOptions options, int concurrency) {
        return Uni.createFrom().deferred(() -> {
            ContentValidator.batch("titles", titles);
            language(options.lang());
            ContentValidator.range("concurrency", concurrency, 1, ContentValidator.MAX_CONCURRENCY);
            return runBatch(titles, concurrency, title -> getPage(title, options));
        });
    }

    @Override
    public Uni<PageSummary> getPageSummary(String title, String lang) {
        return Uni.createFrom().deferred(() -> {
            final var name = ContentValidator.text("title", title);
            final var language = language(lang);
            final var key = key("summary", language, name);
            final var path = WikiQuery.summaryPath(name);
            return cachedFetch("summary", key, () -> fetch(language, path, decoder::pageSummary));
        });
    }

    @Override
    public Uni<RandomPage> getRandomPage(String lang) {
        return Uni.createFrom().deferred(() -> {
            final var language = language(lang);
            final var path = WikiQuery.action("query")
                    .param("list", "random")
                    .param("rnnamespace", 0)
                    .param("rnlimit", 1)
                    .toPath();
            return fetch(language, path, decoder::randomPage);
        });
    }

    @Override
    public Uni<LinkedTitles> getRelatedArticles(String title, String lang, int limit, RelatedMethod method) {
        return Uni.createFrom().deferred(() -> {
            final var name = ContentValidator.text("title", title);
            final var language = language(lang);
            ContentValidator.range("limit", limit, 1, ContentValidator.MAX_LIMIT);
            final var key = key("related", language, method, limit, name);

            final Function<String, LinkedTitles> decode;
            final String path;
            switch (method) {
                case LINKS -> {
                    path = WikiQuery.action("query")
                            .param("prop", "links")
                            .param("titles", name)
                            .param("pllimit", limit)
                            .param("plnamespace", 0)
                            .toPath();
                    decode = body -> decoder.pageProperty(name, body, "links");
                }
                case CATEGORIES -> {
                    path = WikiQuery.action("query")
                            .param("prop", "categories")
                            .param("titles", name)
                            .param("cllimit", limit)
                            .toPath();
                    decode = body -> decoder.pageProperty(name, body, "categories");
                }
                case BACKLINKS -> {
                    path = WikiQuery.action("query")
                            .param("list", "backlinks")
                            .param("bltitle", name)
                            .param("bllimit", limit)
                            .param("blnamespace", 0)
                            .toPath();
                    decode = body -> decoder.queryList(name, body, "backlinks");
                }
                default -> throw new IllegalArgumentException("Unsupported related method: " + method);
            }
            return cachedFetch("related", key, () -> fetch(language, path, decode));
        });
    }

    @Override
    public Uni<LinkedTitles> getPageCategories(String title, String lang) {
        return Uni.createFrom().deferred(() -> {
            final var name = ContentValidator.text("title", title);
            final var language = language(lang);
            final var key = key("categories", language, name);
            final var path = WikiQuery.action("query")
                    .param("prop", "categories")
                    .param("titles", name)
                    .param("cllimit", CATEGORY_LIMIT)
                    .toPath();
            return cachedFetch(
                    "categories",
                    key,
                    () -> fetch(language, path, body -> decoder.pageProperty(name, body, "categories")));
        });
    }

    @Override
    public Uni<LinkedTitles> getPagesInCategory(String category, String lang, int limit, CategoryMemberType type) {
        return Uni.createFrom().deferred(() -> {
            final var name = ContentValidator.text("category", category);
            final var title = name.startsWith("Category:") ? name : "Category:" + name;
            final var language = language(lang);
            ContentValidator.range("limit", limit, 1, ContentValidator.MAX_LIMIT);
            final var key = key("categoryMembers", language, type.apiValue(), limit, title);
            final var path = WikiQuery.action("query")
                    .param("list", "categorymembers")
                    .param("cmtitle", title)
                    .param("cmlimit", limit)
                    .param("cmtype", type.apiValue())
                    .toPath();
            return cachedFetch(
                    "categoryMembers",
                    key,
                    () -> fetch(language, path, body -> decoder.queryList(title, body, "categorymembers")));
        });
    }

    @Override
    public Uni<PageImages> getPageImages(String title, String lang, int limit, int imageWidth) {
        return Uni.createFrom().deferred(() -> {
            final var name = ContentValidator.text("title", title);
            final var language = language(lang);
            ContentValidator.range("limit", limit, 1, ContentValidator.MAX_LIMIT);
            ContentValidator.range("imageWidth", imageWidth, 1, 4000);
            final var key = key("images", language, limit, imageWidth, name);
            final var path = WikiQuery.action("query")
                    .param("titles", name)
                    .param("prop", "images|pageimages")
                    .param("imlimit", limit)
                    .param("piprop", "thumbnail")
                    .param("pithumbsize", imageWidth)
                    .toPath();
            return cachedFetch("images", key, () -> fetch(language, path, body -> decoder.pageImages(name, body)));
        });
    }

    @Override
    public Uni<List<GeoSearchHit>> searchNearby(double lat, double lon, int radius, String lang, int limit) {
        return Uni.createFrom().deferred(() -> {
            ContentValidator.range("lat", lat, -90, 90);
            ContentValidator.range("lon", lon, -180, 180);
            ContentValidator.range("radius", radius, 1, ContentValidator.MAX_RADIUS);
            final var language = language(lang);
            ContentValidator.range("limit", limit, 1, ContentValidator.MAX_LIMIT);
            final var key = key("nearby", language, lat, lon, radius, limit);
            final var path = WikiQuery.action("query")
                    .param("list", "geosearch")
                    .param("gscoord", lat + "|" + lon)
                    .param("gsradius", radius)
                    .param("gslimit", limit)
                    .param("gsnamespace", 0)
                    .toPath();
            return cachedFetch("nearby", key, () -> fetch(language, path, decoder::geoSearch));
        });
    }

    @Override
    public Uni<List<PageExtract>> getPageExtracts(
            List<String> titles, String lang, int sentences, int chars, boolean plaintext) {
        return Uni.createFrom().deferred(() -> {
            ContentValidator.batch("titles", titles);
            final var language = language(lang);
            ContentValidator.range("sentences", sentences, 1, 10);
            ContentValidator.range("chars", chars, 1, 1200);
            final var joined = String.join("|", titles.stream().map(String::trim).toList());
            final var key = key("extracts", language, sentences, chars, plaintext, joined);
            final var path = WikiQuery.action("query")
                    .param("prop", "extracts")
                    .param("titles", joined)
                    .param("exsentences", sentences)
                    .param("exchars", chars)
                    .paramIf(plaintext, "explaintext", 1)
                    .param("exsectionformat", "plain")
                    .toPath();
            return cachedFetch("extracts", key, () -> fetch(language, path, decoder::extracts));
        });
    }

    @Override
    public Uni<SearchResults> fullTextSearch(String query, String lang, int limit, int namespace, boolean snippet) {
        return Uni.createFrom().deferred(() -> {
            final var text = ContentValidator.text("query", query);
            final var language = language(lang);
            ContentValidator.range("limit", limit, 1, ContentValidator.MAX_LIMIT);
            ContentValidator.nonNegative("namespace", namespace);
            final var key = key("fulltext", language, limit, namespace, snippet, text);
            final var path = WikiQuery.action("query")
                    .param("list", "search")
                    .param("srsearch", text)
                    .param("srlimit", limit)
                    .param("srnamespace", namespace)
                    .param("srprop", snippet ? "snippet|size|timestamp" : "size|timestamp")
                    .param("srinfo", "totalhits")
                    .toPath();
            return cachedFetch("fulltext", key, () -> fetch(language, path, decoder::searchResults));
        });
    }

    @Override
    public Uni<List<LanguageLink>> getPageLanguages(String title, String lang) {
        return Uni.createFrom().deferred(() -> {
            final var name = ContentValidator.text("title", title);
            final var language = language(lang);
            final var key = key("languages", language, name);
            final var path = WikiQuery.action("query")
                    .param("prop", "langlinks")
                    .param("titles", name)
                    .param("lllimit", LANGUAGE_LINK_LIMIT)
                    .toPath();
            return cachedFetch("languages", key, () -> fetch(language, path, decoder::languageLinks));
        });
    }

    @Override
    public Uni<List<TrendingArticle>> getTrendingArticles(String lang, String date) {
        return Uni.createFrom().deferred(() -> {
            final var language = language(lang);
            final var day = date == null
                    ? LocalDate.now(clock).minusDays(1).format(TRENDING_DATE)
                    : ContentValidator.trendingDate(date);
            final var key = key("trending", language, day);
            final var path = WikiQuery.pageviewsTopPath(language, day);
            final var manager = context.endpointRegistry().pageviews();
            return cachedFetch(
                    "trending",
                    key,
                    () -> manager.fetch(path).map(response -> decoder.trending(response.body(), TRENDING_LIMIT)));
        });
    }

    @Override
    public String detectLanguage(String text) {
        return LanguageDetector.detect(text);
    }

    @Override
    public ContentHealth healthCheck() {
        final var endpoints = context.endpointRegistry().getEndpointStatus();
        final var states = endpoints.values().stream()
                .flatMap(List::stream)
                .map(EndpointStatus::status)
                .map(CircuitBreakerStatus::state)
                .toList();

        final HealthStatus status;
        if (states.stream().allMatch(state -> state == CircuitState.CLOSED)) {
            status = HealthStatus.HEALTHY;
        } else if (states.stream().allMatch(state -> state == CircuitState.OPEN)) {
            status = HealthStatus.UNHEALTHY;
        } else {
            status = HealthStatus.DEGRADED;
        }
        return new ContentHealth(
                status, endpoints, context.cache().estimatedSize(), context.deduplicator().pendingCount());
    }

    @SuppressWarnings("unchecked")
    private <T> Uni<T> cachedFetch(String operation, String key, Supplier<Uni<T>> loader) {
        final var tags = Map.of("operation", operation);
        final var cached = context.cache().get(key);
        if (cached.isPresent()) {
            LOG.debugv("Cache hit for {0}", key);
            context.monitoring().metrics().increment("cache_hit", tags);
            return Uni.createFrom().item((T) cached.get());
        }
        LOG.debugv("Cache miss for {0}", key);
        context.monitoring().metrics().increment("cache_miss", tags);

        final Supplier<Uni<T>> load = () -> loader.get().onItem().invoke(value -> {
            context.cache().put(key, value);
            context.monitoring().metrics().gauge("cache_size", context.cache().estimatedSize(), Map.of());
        });
        return deduplicationEnabled ? context.deduplicator().deduplicate(key, load) : load.get();
    }

    private <T> Uni<T> fetch(String lang, String path, Function<String, T> decode) {
        return context.endpointRegistry()
                .forLanguage(lang)
                .fetch(path)
                .map(response -> decode.apply(response.body()));
    }

    private <T> Uni<Map<String, BatchItemResult<T>>> runBatch(
            List<String> inputs, int concurrency, Function<String, Uni<T>> operation) {
        final var distinct = List.copyOf(new LinkedHashSet<>(inputs));
        final var settled = new ArrayList<Map.Entry<String, BatchItemResult<T>>>(distinct.size());

        Uni<Void> chain = Uni.createFrom().voidItem();
        for (int start = 0; start < distinct.size(); start += concurrency) {
            final var window = distinct.subList(start, Math.min(start + concurrency, distinct.size()));
            chain = chain.chain(() -> Uni.join()
                    .all(window.stream().map(input -> settle(input, operation)).toList())
                    .andFailFast()
                    .invoke(settled::addAll)
                    .replaceWithVoid());
        }

        return chain.map(ignored -> {
            final var results = new LinkedHashMap<String, BatchItemResult<T>>();
            settled.forEach(entry -> results.put(entry.getKey(), entry.getValue()));
            return results;
        });
    }

    private static <T> Uni<Map.Entry<String, BatchItemResult<T>>> settle(
            String input, Function<String, Uni<T>> operation) {
        return Uni.createFrom()
                .deferred(() -> operation.apply(input))
                .<Map.Entry<String, BatchItemResult<T>>>map(
                        value -> Map.entry(input, new BatchItemResult.Success<>(value)))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.debugv("Batch item {0} failed: {1}", input, error.getMessage());
                    return Map.entry(
                            input,
                            new BatchItemResult.Failure<>(
                                    String.valueOf(error.getMessage()), WikiAccessException.kindOf(error)));
                });
    }

    private String language(String lang) {
        return ContentValidator.language(lang == null ? defaultLanguage : lang);
    }

    private static WikiQuery parseQuery(PageOptions options) {
        final var prop = new StringBuilder("text");
        if (options.sections()) {
            prop.append("|sections");
        }
        if (options.images()) {
            prop.append("|images");
        }
        if (options.links()) {
            prop.append("|links");
        }
        if (options.categories()) {
            prop.append("|categories");
        }
        return WikiQuery.action("parse").param("prop", prop).param("redirects", 1);
    }

    private static String flags(PageOptions options) {
        return (options.sections() ? "s" : "-")
                + (options.images() ? "i" : "-")
                + (options.links() ? "l" : "-")
                + (options.categories() ? "c" : "-");
    }

    /**
     * Joins key parts with {@code :}. Free text goes last so keys stay unambiguous.
     */
    private static String key(String operation, Object... parts) {
        final var key = new StringBuilder(operation);
        for (var part : parts) {
            key.append(':').append(part);
        }
        return key.toString();
    }
}
