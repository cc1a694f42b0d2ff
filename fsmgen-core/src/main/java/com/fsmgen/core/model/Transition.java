package com.fsmgen.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A parsed transition clause.
 *
 * <p>Guards and actions are opaque text in the target language and are never interpreted.
 * Source and target are state handles; for inline clauses (internal, entry, exit) both refer to
 * the declaring state.
 *
 * @param role role the transition was declared with
 * @param event event name ({@code entry}/{@code exit} for hooks)
 * @param guard guard expression, or null when unguarded
 * @param source handle of the declaring state
 * @param target handle of the destination state
 * @param actions action statements in declaration order
 * @param declaredAt line the transition was read from
 */
public record Transition(
    TransitionRole role,
    String event,
    String guard,
    int source,
    int target,
    List<String> actions,
    SourceLine declaredAt
) {
    /**
     * Compact constructor with validation.
     */
    public Transition {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(declaredAt, "declaredAt must not be null");
        if (event.isEmpty()) {
            throw new IllegalArgumentException("event must not be empty");
        }
        if (role != TransitionRole.OUTGOING && source != target) {
            throw new IllegalArgumentException(role + " transition must not change state");
        }
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    /**
     * Returns whether this transition has a guard.
     *
     * @return true when a guard expression is present
     */
    public boolean isGuarded() {
        return guard != null;
    }
}
