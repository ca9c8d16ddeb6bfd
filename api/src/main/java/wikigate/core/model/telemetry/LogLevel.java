package wikigate.core.model.telemetry;

public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
