package com.fsmgen.core.parser;

/**
 * Kinds of diagram errors. Every kind is fatal for the diagram it occurs in.
 */
public enum ErrorKind {
    DUPLICATE_INITIAL_TRANSITION("Duplicate initial transition"),
    MALFORMED_INITIAL_TRANSITION("Additional text after initial transition"),
    UNMATCHED_CLOSE_BRACE("Closing brace does not match any opening brace"),
    UNCLOSED_BLOCK("Opening brace is never closed"),
    UNDEFINED_STATE("State has not been defined"),
    NO_INITIAL_STATE("No initial state specified"),
    MULTIPLE_INITIAL_STATES("Multiple initial states specified"),
    MISSING_TRANSITION_EVENT("Missing event in transition"),
    INVALID_TRANSITION_CLAUSE("Invalid transition format"),
    UNPARSABLE_LINE("No idea how to parse line"),
    CONFLICTING_PARENT("State is declared under more than one parent");

    private final String description;

    ErrorKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
