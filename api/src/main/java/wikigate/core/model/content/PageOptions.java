package wikigate.core.model.content;

/**
 * Parts of a page to request besides its rendered text.
 */
public record PageOptions(String lang, boolean sections, boolean images, boolean links, boolean categories) {

    public static PageOptions defaults(String lang) {
        return new PageOptions(lang, true, false, false, false);
    }
}
