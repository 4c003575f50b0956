package dev.larder.validation;

/**
 * Phases of an {@link ImportWorkflow}. {@link #COMPLETE} and {@link #ERROR} are terminal.
 */
public enum ImportPhase {
    INITIALIZING,
    TAGS,
    INGREDIENTS,
    IMPORTING,
    COMPLETE,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }
}
