package com.fsmgen.core.model;

/**
 * Role of a transition, fixed when the transition text is parsed.
 */
public enum TransitionRole {
    /** {@code From --> To : clause} declared outside any state block; may change the active state. */
    OUTGOING,
    /** {@code State : clause} with an ordinary event name; runs actions without leaving the state. */
    INTERNAL,
    /** {@code State : entry ...}; runs whenever the state is entered. */
    ENTRY,
    /** {@code State : exit ...}; runs whenever the state is exited. */
    EXIT;

    /** Reserved inline event name for entry hooks. */
    public static final String ENTRY_EVENT = "entry";

    /** Reserved inline event name for exit hooks. */
    public static final String EXIT_EVENT = "exit";

    /**
     * Classifies an inline clause declared inside a state by its event name.
     *
     * @param eventName parsed event name
     * @return ENTRY, EXIT or INTERNAL
     */
    public static TransitionRole ofInlineEvent(String eventName) {
        if (ENTRY_EVENT.equals(eventName)) {
            return ENTRY;
        }
        if (EXIT_EVENT.equals(eventName)) {
            return EXIT;
        }
        return INTERNAL;
    }

    /**
     * Returns whether transitions of this role are dispatched on posted events.
     *
     * @return true for OUTGOING and INTERNAL
     */
    public boolean isEventDriven() {
        return this == OUTGOING || this == INTERNAL;
    }
}
