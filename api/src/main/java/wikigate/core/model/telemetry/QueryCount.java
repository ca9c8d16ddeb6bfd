package wikigate.core.model.telemetry;

public record QueryCount(String query, long count) {}
