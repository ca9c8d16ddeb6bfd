package wikigate.core.model.content;

public record PageSection(String index, int level, String title, String anchor) {}
