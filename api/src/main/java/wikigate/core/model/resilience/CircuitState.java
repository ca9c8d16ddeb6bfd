package wikigate.core.model.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
