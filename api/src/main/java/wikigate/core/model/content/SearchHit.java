package wikigate.core.model.content;

/**
 * A single search result. {@code snippet} is null when snippets were not requested.
 */
public record SearchHit(long pageId, String title, String snippet, long size, long wordCount, String timestamp) {}
