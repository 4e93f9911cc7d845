package io.calcport.engine.model;

/**
 * Lifecycle of one calculation within a translation request.
 *
 * <pre>
 * UNPARSED -> PARSED -> TRANSLATED | TRANSLATE_FAILED
 *          -> PARSE_FAILED
 * any      -> EXCLUDED_BY_CYCLE
 * </pre>
 */
public enum CalculationState {
    UNPARSED(false),
    PARSED(false),
    PARSE_FAILED(true),
    TRANSLATED(true),
    TRANSLATE_FAILED(true),
    EXCLUDED_BY_CYCLE(true);

    private final boolean terminal;

    CalculationState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public String wireName() {
        return name().toLowerCase().replace('_', '-');
    }
}
