package wikigate.core.model.content;

/**
 * Short lead summary of a page. {@code description} and {@code thumbnailUrl} may be null.
 */
public record PageSummary(
        long pageId, String title, String description, String extract, String thumbnailUrl, String pageUrl) {}
