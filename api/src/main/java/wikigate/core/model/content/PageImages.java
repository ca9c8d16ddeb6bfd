package wikigate.core.model.content;

import java.util.List;

/**
 * Image file names used on a page plus its lead thumbnail, which may be null.
 */
public record PageImages(String title, String thumbnailUrl, List<String> images) {

    public PageImages {
        images = List.copyOf(images);
    }
}
