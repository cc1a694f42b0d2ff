package com.fsmgen.core.resolver;

import com.fsmgen.core.model.State;
import com.fsmgen.core.model.Transition;

import java.util.List;
import java.util.Objects;

/**
 * What happens when {@code event} is posted while {@code state} is active.
 *
 * <p>For {@link ResolutionKind#INTERNAL} the candidates are in {@code internalTransitions}; for
 * {@link ResolutionKind#EXTERNAL} they are in {@code transitions}. In both cases candidates are
 * tried in order and the first whose guard holds fires. Candidates that could never be tried
 * (those after an unguarded one) are not included.
 *
 * @param state active state
 * @param event posted event
 * @param kind kind of effect
 * @param handler state that declares the handling transitions (the state itself or an ancestor), null for NONE
 * @param internalTransitions internal candidates, empty unless INTERNAL
 * @param transitions outgoing candidates, empty unless EXTERNAL
 */
public record Resolution(
    State state,
    String event,
    ResolutionKind kind,
    State handler,
    List<Transition> internalTransitions,
    List<ResolvedTransition> transitions
) {
    public Resolution {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        internalTransitions = internalTransitions == null ? List.of() : List.copyOf(internalTransitions);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
        if (kind != ResolutionKind.NONE) {
            Objects.requireNonNull(handler, "handler must not be null for " + kind);
        }
    }

    static Resolution none(State state, String event) {
        return new Resolution(state, event, ResolutionKind.NONE, null, List.of(), List.of());
    }

    static Resolution internal(State state, String event, State handler, List<Transition> candidates) {
        return new Resolution(state, event, ResolutionKind.INTERNAL, handler, candidates, List.of());
    }

    static Resolution external(State state, String event, State handler, List<ResolvedTransition> candidates) {
        return new Resolution(state, event, ResolutionKind.EXTERNAL, handler, List.of(), candidates);
    }

    public boolean hasEffect() {
        return kind != ResolutionKind.NONE;
    }
}
