package com.fsmgen.core.resolver;

import com.fsmgen.core.model.State;
import com.fsmgen.core.model.StateChart;
import com.fsmgen.core.model.Transition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolved behaviour of a whole chart: for every event, the states in which posting it has an
 * effect and what that effect is. This is everything a code generator needs.
 *
 * @param chart the resolved chart
 * @param events event names, sorted alphabetically
 * @param resolutions per event, the effectful resolutions in state declaration order
 * @param initialChain states entered on start-up, outermost first
 * @param unreachable transitions that can never fire, in declaration order
 */
public record DispatchTable(
    StateChart chart,
    List<String> events,
    Map<String, List<Resolution>> resolutions,
    List<State> initialChain,
    List<Transition> unreachable
) {
    public DispatchTable {
        Objects.requireNonNull(chart, "chart must not be null");
        events = List.copyOf(events);
        Map<String, List<Resolution>> copy = new LinkedHashMap<>();
        resolutions.forEach((event, list) -> copy.put(event, List.copyOf(list)));
        resolutions = Collections.unmodifiableMap(copy);
        initialChain = List.copyOf(initialChain);
        unreachable = List.copyOf(unreachable);
    }

    /**
     * Returns the effectful resolutions for an event.
     *
     * @param event event name
     * @return resolutions in state declaration order, empty for unknown events
     */
    public List<Resolution> resolutions(String event) {
        return resolutions.getOrDefault(event, List.of());
    }

    /**
     * Returns the resolution for one (event, state) pair.
     *
     * @param event event name
     * @param state active state
     * @return the resolution, or empty when the event has no effect in that state
     */
    public Optional<Resolution> resolution(String event, State state) {
        return resolutions(event).stream()
            .filter(r -> r.state().equals(state))
            .findFirst();
    }

    public State initialState() {
        return initialChain.get(initialChain.size() - 1);
    }

    public int size() {
        return resolutions.values().stream().mapToInt(List::size).sum();
    }
}
