package wikigate.core.model.content;

/**
 * How related articles are found.
 */
public enum RelatedMethod {
    /** Pages the article links to. */
    LINKS,
    /** Categories of the article. */
    CATEGORIES,
    /** Pages linking to the article. */
    BACKLINKS
}
