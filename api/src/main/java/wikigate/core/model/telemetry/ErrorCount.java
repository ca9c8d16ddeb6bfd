package wikigate.core.model.telemetry;

public record ErrorCount(String error, long count) {}
