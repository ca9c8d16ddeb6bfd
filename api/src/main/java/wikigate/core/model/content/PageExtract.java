package wikigate.core.model.content;

public record PageExtract(long pageId, String title, String extract) {}
