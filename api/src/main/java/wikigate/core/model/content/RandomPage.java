package wikigate.core.model.content;

public record RandomPage(long pageId, String title, int namespace) {}
