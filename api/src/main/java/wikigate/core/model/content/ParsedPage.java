package wikigate.core.model.content;

import java.util.List;

/**
 * A rendered page. Lists are empty when the matching {@link PageOptions} flag was off.
 */
public record ParsedPage(
        long pageId,
        String title,
        String html,
        List<PageSection> sections,
        List<String> images,
        List<String> links,
        List<String> categories) {

    public ParsedPage {
        sections = List.copyOf(sections);
        images = List.copyOf(images);
        links = List.copyOf(links);
        categories = List.copyOf(categories);
    }
}
