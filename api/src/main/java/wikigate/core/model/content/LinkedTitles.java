package wikigate.core.model.content;

import java.util.List;

/**
 * Titles reached from {@code source}: links, backlinks, categories or category members.
 */
public record LinkedTitles(String source, List<String> titles) {

    public LinkedTitles {
        titles = List.copyOf(titles);
    }
}
