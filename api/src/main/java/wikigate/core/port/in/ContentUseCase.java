package wikigate.core.port.in;

import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Uni;

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

/**
 * Port for reading Wikipedia content through the resilient access layer.
 *
 * <p>Every operation validates its input and fails with
 * {@link wikigate.core.model.common.ValidationException} before any upstream
 * call when the input is malformed. Upstream failures surface as the typed
 * subclasses of {@link wikigate.core.model.common.WikiAccessException}.
 */
public interface ContentUseCase {

    /**
     * Searches page titles and content.
     *
     * @param query   search text, not blank
     * @param options language, paging and snippet options
     * @return Uni with one page of hits
     */
    Uni<SearchResults> search(String query, SearchOptions options);

    /**
     * Fetches a rendered page by title.
     *
     * @param title   page title, not blank
     * @param options language and the optional parts to include
     * @return Uni with the parsed page
     */
    Uni<ParsedPage> getPage(String title, PageOptions options);

    /**
     * Fetches a rendered page by its numeric id.
     *
     * @param id      page id, positive
     * @param options language and the optional parts to include
     * @return Uni with the parsed page
     */
    Uni<ParsedPage> getPageById(long id, PageOptions options);

    /**
     * Runs several searches, at most {@code concurrency} at a time.
     *
     * @return Uni with one result per distinct query, in input order
     */
    Uni<Map<String, BatchItemResult<SearchResults>>> batchSearch(
            List<String> queries, String lang, int limit, int concurrency);

    /**
     * Fetches several pages, at most {@code concurrency} at a time.
     *
     * @return Uni with one result per distinct title, in input order
     */
    Uni<Map<String, BatchItemResult<ParsedPage>>> batchGetPages(
            List<String> titles, PageOptions options, int concurrency);

    Uni<PageSummary> getPageSummary(String title, String lang);

    /**
     * Picks a random article. Results are never cached.
     */
    Uni<RandomPage> getRandomPage(String lang);

    Uni<LinkedTitles> getRelatedArticles(String title, String lang, int limit, RelatedMethod method);

    Uni<LinkedTitles> getPageCategories(String title, String lang);

    /**
     * Lists members of a category. The {@code Category:} prefix is added when missing.
     */
    Uni<LinkedTitles> getPagesInCategory(String category, String lang, int limit, CategoryMemberType type);

    Uni<PageImages> getPageImages(String title, String lang, int limit, int imageWidth);

    /**
     * Finds articles within {@code radius} meters of a coordinate.
     */
    Uni<List<GeoSearchHit>> searchNearby(double lat, double lon, int radius, String lang, int limit);

    Uni<List<PageExtract>> getPageExtracts(
            List<String> titles, String lang, int sentences, int chars, boolean plaintext);

    Uni<SearchResults> fullTextSearch(String query, String lang, int limit, int namespace, boolean snippet);

    Uni<List<LanguageLink>> getPageLanguages(String title, String lang);

    /**
     * Most viewed articles of a day.
     *
     * @param date day in {@code yyyy/MM/dd} form, or null for yesterday (UTC)
     */
    Uni<List<TrendingArticle>> getTrendingArticles(String lang, String date);

    /**
     * Guesses the language of {@code text} from its script, {@code en} when unsure.
     */
    String detectLanguage(String text);

    /**
     * Reports breaker, cache and deduplication state.
     */
    ContentHealth healthCheck();
}
