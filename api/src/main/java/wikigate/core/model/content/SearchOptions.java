package wikigate.core.model.content;

/**
 * Parameters of a title/content search.
 *
 * @param lang            content language code
 * @param limit           maximum number of hits, 1 to 50
 * @param offset          number of hits to skip
 * @param includeSnippets whether hits carry a highlighted snippet
 */
public record SearchOptions(String lang, int limit, int offset, boolean includeSnippets) {

    public static final int DEFAULT_LIMIT = 10;

    public static SearchOptions defaults(String lang) {
        return new SearchOptions(lang, DEFAULT_LIMIT, 0, true);
    }
}
