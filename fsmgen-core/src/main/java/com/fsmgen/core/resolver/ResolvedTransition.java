package com.fsmgen.core.resolver;

import com.fsmgen.core.model.State;
import com.fsmgen.core.model.Transition;

import java.util.List;
import java.util.Objects;

/**
 * An outgoing transition as it fires from one particular active state.
 *
 * <p>Firing runs the exit hooks of {@code exitChain} (leaf first), then the transition's own
 * actions, then the entry hooks of {@code entryChain} (ancestor first). The machine ends up in
 * {@code target}, the last state of the entry chain.
 *
 * @param transition the firing transition
 * @param exitChain states exited, active leaf first
 * @param entryChain states entered, outermost first
 * @param target resulting active leaf state
 */
public record ResolvedTransition(
    Transition transition,
    List<State> exitChain,
    List<State> entryChain,
    State target
) {
    public ResolvedTransition {
        Objects.requireNonNull(transition, "transition must not be null");
        Objects.requireNonNull(target, "target must not be null");
        exitChain = List.copyOf(exitChain);
        entryChain = List.copyOf(entryChain);
        if (entryChain.isEmpty() || !entryChain.get(entryChain.size() - 1).equals(target)) {
            throw new IllegalArgumentException("target must be the last state of the entry chain");
        }
    }
}
