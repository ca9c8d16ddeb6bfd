package wikigate.core.model.content;

import java.util.List;

/**
 * A page of search results.
 *
 * @param totalHits  total number of matches reported upstream
 * @param hits       the hits of this page
 * @param nextOffset offset of the next page, or null when there is none
 */
public record SearchResults(long totalHits, List<SearchHit> hits, Integer nextOffset) {

    public SearchResults {
        hits = List.copyOf(hits);
    }
}
