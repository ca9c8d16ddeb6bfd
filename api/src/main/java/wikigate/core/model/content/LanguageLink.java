package wikigate.core.model.content;

/**
 * The title of the same page in another language edition.
 */
public record LanguageLink(String lang, String title) {}
