package com.fsmgen.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Validated hierarchical state model of one diagram.
 *
 * <p>States are stored in an arena indexed by their handle. The hierarchy is kept as two
 * relations over handles: {@code parents} (child to parent, absent for top-level states) and
 * {@code children} (parent to children in first-seen order). All transitions are kept in one
 * list in declaration order, tagged with their {@link TransitionRole}.
 *
 * <p>A chart is immutable; it is produced once per diagram by the parser and consumed by the
 * resolver.
 *
 * @param sourceId identity of the diagram the chart was built from
 * @param states states indexed by handle
 * @param handlesByName state name to handle
 * @param parents child handle to parent handle
 * @param children parent handle to ordered child handles
 * @param transitions all transitions in declaration order
 */
public record StateChart(
    String sourceId,
    List<State> states,
    Map<String, Integer> handlesByName,
    Map<Integer, Integer> parents,
    Map<Integer, List<Integer>> children,
    List<Transition> transitions
) {
    /**
     * Compact constructor with validation.
     */
    public StateChart {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        states = List.copyOf(states);
        handlesByName = Map.copyOf(handlesByName);
        parents = Map.copyOf(parents);
        children = children.entrySet().stream()
            .collect(Collectors.toUnmodifiableMap(
                Map.Entry::getKey, e -> List.copyOf(e.getValue())));
        transitions = List.copyOf(transitions);
        for (int i = 0; i < states.size(); i++) {
            if (states.get(i).handle() != i) {
                throw new IllegalArgumentException("State " + states.get(i).name() + " stored at index " + i
                    + " but has handle " + states.get(i).handle());
            }
        }
    }

    /**
     * Returns the state with the given handle.
     *
     * @param handle state handle
     * @return the state
     * @throws IndexOutOfBoundsException if no such state exists
     */
    public State state(int handle) {
        return states.get(handle);
    }

    /**
     * Looks up a state by name.
     *
     * @param name state name
     * @return the state, or empty if undeclared
     */
    public Optional<State> find(String name) {
        Integer handle = handlesByName.get(name);
        return handle == null ? Optional.empty() : Optional.of(states.get(handle));
    }

    public Optional<State> parent(State state) {
        Integer parent = parents.get(state.handle());
        return parent == null ? Optional.empty() : Optional.of(states.get(parent));
    }

    public List<State> children(State state) {
        return children.getOrDefault(state.handle(), List.of()).stream()
            .map(this::state)
            .toList();
    }

    public boolean isComposite(State state) {
        return !children.getOrDefault(state.handle(), List.of()).isEmpty();
    }

    public List<State> topLevelStates() {
        return states.stream()
            .filter(s -> !parents.containsKey(s.handle()))
            .toList();
    }

    /**
     * Returns the designated initial child of a composite state.
     *
     * @param state composite state
     * @return the first child marked initial, or empty for leaf states
     */
    public Optional<State> initialChild(State state) {
        return children(state).stream().filter(State::initial).findFirst();
    }

    /**
     * Returns the top-level state marked initial.
     *
     * @return the first top-level initial state, or empty if none is marked
     */
    public Optional<State> initialTopLevelState() {
        return topLevelStates().stream().filter(State::initial).findFirst();
    }

    /**
     * Returns the chain of states entered when the machine starts: the top-level initial state
     * followed by initial children down to a leaf.
     *
     * @return initialisation chain, ancestor first
     * @throws IllegalStateException if the chart lacks an initial state at some level
     */
    public List<State> initialChain() {
        List<State> chain = new ArrayList<>();
        State current = initialTopLevelState()
            .orElseThrow(() -> new IllegalStateException("No initial top level state in " + sourceId));
        chain.add(current);
        while (isComposite(current)) {
            State composite = current;
            current = initialChild(composite)
                .orElseThrow(() -> new IllegalStateException("No initial state in composite state " + composite.name()));
            chain.add(current);
        }
        return chain;
    }

    /**
     * Returns the transitions of a given role declared by a state, in declaration order.
     *
     * @param state declaring state
     * @param role transition role
     * @return matching transitions
     */
    public List<Transition> transitions(State state, TransitionRole role) {
        return transitions.stream()
            .filter(t -> t.role() == role && t.source() == state.handle())
            .toList();
    }

    /**
     * Returns the transitions of a given role declared by a state for one event.
     *
     * @param state declaring state
     * @param role transition role
     * @param event event name
     * @return matching transitions in declaration order
     */
    public List<Transition> transitions(State state, TransitionRole role, String event) {
        return transitions.stream()
            .filter(t -> t.role() == role && t.source() == state.handle() && t.event().equals(event))
            .toList();
    }

    /**
     * Returns the distinct names of all events that internal or outgoing transitions react to,
     * sorted alphabetically. Entry and exit hooks are not events.
     *
     * @return sorted event names
     */
    public List<String> events() {
        TreeSet<String> names = new TreeSet<>();
        for (Transition transition : transitions) {
            if (transition.role().isEventDriven()) {
                names.add(transition.event());
            }
        }
        return List.copyOf(names);
    }

    /**
     * Returns a transition's readable form, e.g. {@code Idle --- start [ready] --> Working}.
     *
     * @param transition transition of this chart
     * @return description used in comments and log messages
     */
    public String describe(Transition transition) {
        String guard = transition.isGuarded() ? " [" + transition.guard() + "]" : "";
        return state(transition.source()).name() + " --- " + transition.event() + guard
            + " --> " + state(transition.target()).name();
    }
}
