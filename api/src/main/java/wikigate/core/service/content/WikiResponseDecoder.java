package wikigate.core.service.content;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import wikigate.core.model.common.ResponseDecodingException;
import wikigate.core.model.content.GeoSearchHit;
import wikigate.core.model.content.LanguageLink;
import wikigate.core.model.content.LinkedTitles;
import wikigate.core.model.content.PageExtract;
import wikigate.core.model.content.PageImages;
import wikigate.core.model.content.PageSection;
import wikigate.core.model.content.PageSummary;
import wikigate.core.model.content.ParsedPage;
import wikigate.core.model.content.RandomPage;
import wikigate.core.model.content.SearchHit;
import wikigate.core.model.content.SearchResults;
import wikigate.core.model.content.TrendingArticle;

/**
 * Decodes upstream JSON bodies into result records.
 *
 * <p>Action API bodies are expected in {@code formatversion=2} shape. A body
 * carrying an {@code error} object, or missing the expected structure, fails
 * with {@link ResponseDecodingException}.
 */
public class WikiResponseDecoder {

    private final ObjectMapper objectMapper;

    public WikiResponseDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public SearchResults searchResults(String body) {
        final var query = query(body);
        final var hits = map(query.path("search"), hit -> new SearchHit(
                hit.path("pageid").asLong(),
                hit.path("title").asText(),
                hit.hasNonNull("snippet") ? hit.get("snippet").asText() : null,
                hit.path("size").asLong(),
                hit.path("wordcount").asLong(),
                hit.path("timestamp").asText(null)));
        final var totalHits = query.path("searchinfo").path("totalhits").asLong(hits.size());
        final var next = root(body).path("continue").path("sroffset");
        return new SearchResults(totalHits, hits, next.isInt() ? next.asInt() : null);
    }

    public ParsedPage parsedPage(String body) {
        final var parse = root(body).path("parse");
        if (parse.isMissingNode()) {
            throw new ResponseDecodingException("Missing 'parse' object in response");
        }
        final var sections = map(parse.path("sections"), section -> new PageSection(
                section.path("index").asText(),
                section.path("toclevel").asInt(),
                section.path("line").asText(),
                section.path("anchor").asText()));
        return new ParsedPage(
                parse.path("pageid").asLong(),
                parse.path("title").asText(),
                parse.path("text").asText(""),
                sections,
                map(parse.path("images"), JsonNode::asText),
                map(parse.path("links"), link -> link.path("title").asText()),
                map(parse.path("categories"), category -> category.path("category").asText()));
    }

    public PageSummary pageSummary(String body) {
        final var root = root(body);
        if (!root.hasNonNull("title")) {
            throw new ResponseDecodingException("Missing 'title' in page summary");
        }
        return new PageSummary(
                root.path("pageid").asLong(),
                root.path("title").asText(),
                root.path("description").asText(null),
                root.path("extract").asText(""),
                root.path("thumbnail").path("source").asText(null),
                root.path("content_urls").path("desktop").path("page").asText(null));
    }

    public RandomPage randomPage(String body) {
        final var random = query(body).path("random");
        if (!random.isArray() || random.isEmpty()) {
            throw new ResponseDecodingException("Empty 'random' list in response");
        }
        final var first = random.get(0);
        return new RandomPage(first.path("id").asLong(), first.path("title").asText(), first.path("ns").asInt());
    }

    /**
     * Titles listed under {@code prop} of the first page, e.g. {@code links} or {@code categories}.
     */
    public LinkedTitles pageProperty(String source, String body, String prop) {
        final var page = firstPage(query(body));
        return new LinkedTitles(source, map(page.path(prop), entry -> entry.path("title").asText()));
    }

    /**
     * Titles of a query list, e.g. {@code backlinks} or {@code categorymembers}.
     */
    public LinkedTitles queryList(String source, String body, String list) {
        return new LinkedTitles(source, map(query(body).path(list), entry -> entry.path("title").asText()));
    }

    public PageImages pageImages(String title, String body) {
        final var page = firstPage(query(body));
        return new PageImages(
                page.path("title").asText(title),
                page.path("thumbnail").path("source").asText(null),
                map(page.path("images"), image -> image.path("title").asText()));
    }

    public List<GeoSearchHit> geoSearch(String body) {
        return map(query(body).path("geosearch"), hit -> new GeoSearchHit(
                hit.path("pageid").asLong(),
                hit.path("title").asText(),
                hit.path("lat").asDouble(),
                hit.path("lon").asDouble(),
                hit.path("dist").asDouble()));
    }

    /**
     * Extracts of the requested pages. Missing pages are skipped.
     */
    public List<PageExtract> extracts(String body) {
        final var extracts = new ArrayList<PageExtract>();
        for (var page : query(body).path("pages")) {
            if (page.path("missing").asBoolean(false)) {
                continue;
            }
            extracts.add(new PageExtract(
                    page.path("pageid").asLong(), page.path("title").asText(), page.path("extract").asText("")));
        }
        return extracts;
    }

    public List<LanguageLink> languageLinks(String body) {
        final var page = firstPage(query(body));
        return map(page.path("langlinks"), link -> new LanguageLink(
                link.path("lang").asText(), link.path("title").asText()));
    }

    public List<TrendingArticle> trending(String body, int limit) {
        final var items = root(body).path("items");
        if (!items.isArray() || items.isEmpty()) {
            throw new ResponseDecodingException("Missing 'items' in pageviews response");
        }
        return map(items.get(0).path("articles"), article -> new TrendingArticle(
                        article.path("article").asText(),
                        article.path("views").asLong(),
                        article.path("rank").asInt()))
                .stream()
                .limit(limit)
                .toList();
    }

    private JsonNode root(String body) {
        final JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ResponseDecodingException("Response body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ResponseDecodingException("Response body is not a JSON object");
        }
        final var error = root.path("error");
        if (error.isObject()) {
            throw new ResponseDecodingException(
                    "Upstream API error " + error.path("code").asText("unknown") + ": "
                            + error.path("info").asText(""));
        }
        return root;
    }

    private JsonNode query(String body) {
        final var query = root(body).path("query");
        if (query.isMissingNode()) {
            throw new ResponseDecodingException("Missing 'query' object in response");
        }
        return query;
    }

    private static JsonNode firstPage(JsonNode query) {
        final var pages = query.path("pages");
        if (!pages.isArray() || pages.isEmpty()) {
            throw new ResponseDecodingException("Missing 'pages' in response");
        }
        final var page = pages.get(0);
        if (page.path("missing").asBoolean(false)) {
            throw new ResponseDecodingException("Page '" + page.path("title").asText() + "' does not exist");
        }
        return page;
    }

    private static <T> List<T> map(JsonNode array, Function<JsonNode, T> mapper) {
        final var result = new ArrayList<T>();
        if (array.isArray()) {
            array.forEach(node -> result.add(mapper.apply(node)));
        }
        return result;
    }
}
