package com.fsmgen.core.parser;

import com.fsmgen.core.model.SourceLine;
import com.fsmgen.core.model.State;
import com.fsmgen.core.model.StateChart;
import com.fsmgen.core.model.Transition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable accumulator used while a diagram is being parsed.
 *
 * <p>Owns the name to handle registry; later stages look states up once by name and work with
 * handles afterwards. {@link #build()} takes an immutable snapshot.
 */
public class StateChartBuilder {

    private final String sourceId;
    private final List<State> states = new ArrayList<>();
    private final Map<String, Integer> handlesByName = new HashMap<>();
    private final Map<Integer, Integer> parents = new HashMap<>();
    private final Map<Integer, List<Integer>> children = new LinkedHashMap<>();
    private final List<Transition> transitions = new ArrayList<>();

    public StateChartBuilder(String sourceId) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId must not be null");
    }

    public Optional<State> find(String name) {
        Integer handle = handlesByName.get(name);
        return handle == null ? Optional.empty() : Optional.of(states.get(handle));
    }

    /**
     * Registers a new state.
     *
     * @param name state name, must not be registered yet
     * @param initial whether the state is an initial-transition target
     * @param parent parent state, or null for a top-level state
     * @param declaredAt first declaring line
     * @return the new state
     */
    public State declare(String name, boolean initial, State parent, SourceLine declaredAt) {
        if (handlesByName.containsKey(name)) {
            throw new IllegalArgumentException("State already declared: " + name);
        }
        State state = new State(states.size(), name, initial, declaredAt);
        states.add(state);
        handlesByName.put(name, state.handle());
        if (parent != null) {
            parents.put(state.handle(), parent.handle());
            children.computeIfAbsent(parent.handle(), h -> new ArrayList<>()).add(state.handle());
        }
        return state;
    }

    /**
     * Lists a known state among a parent's children without changing its own parent link.
     *
     * @param parent parent whose block reopened the state
     * @param child already declared state
     * @return true if the child was added, false if the parent already listed it
     */
    public boolean addChild(State parent, State child) {
        List<Integer> siblings = children.computeIfAbsent(parent.handle(), h -> new ArrayList<>());
        if (siblings.contains(child.handle())) {
            return false;
        }
        siblings.add(child.handle());
        return true;
    }

    public Optional<State> parent(State state) {
        Integer parent = parents.get(state.handle());
        return parent == null ? Optional.empty() : Optional.of(states.get(parent));
    }

    public void addTransition(Transition transition) {
        transitions.add(Objects.requireNonNull(transition, "transition must not be null"));
    }

    public int stateCount() {
        return states.size();
    }

    public int transitionCount() {
        return transitions.size();
    }

    /**
     * Takes an immutable snapshot of everything registered so far.
     *
     * @return the state chart
     */
    public StateChart build() {
        return new StateChart(sourceId, states, handlesByName, parents, children, transitions);
    }
}
