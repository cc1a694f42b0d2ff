package com.fsmgen.core.resolver;

/**
 * Effect of posting an event while a state is active.
 */
public enum ResolutionKind {
    /** Neither the state nor any ancestor handles the event. */
    NONE,
    /** An internal transition handles the event; no state is exited or entered. */
    INTERNAL,
    /** An outgoing transition handles the event and changes the active state. */
    EXTERNAL
}
