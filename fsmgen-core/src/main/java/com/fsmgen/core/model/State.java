package com.fsmgen.core.model;

import java.util.Objects;

/**
 * A declared state.
 *
 * <p>States live in a {@link StateChart} arena and are referenced by {@code handle}. Hierarchy
 * (parent, children) is kept by the chart, not by the state itself.
 *
 * @param handle index of this state in its chart, in first-seen order
 * @param name state name, unique across the diagram
 * @param initial whether the name is the target of an {@code [*] -->} declaration
 * @param declaredAt line of the first declaration
 */
public record State(
    int handle,
    String name,
    boolean initial,
    SourceLine declaredAt
) {
    /**
     * Compact constructor with validation.
     */
    public State {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(declaredAt, "declaredAt must not be null");
        if (handle < 0) {
            throw new IllegalArgumentException("handle must not be negative: " + handle);
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
