package com.fsmgen.core.resolver;

import com.fsmgen.core.model.State;
import com.fsmgen.core.model.StateChart;
import com.fsmgen.core.model.Transition;
import com.fsmgen.core.model.TransitionRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Computes, for every (active state, event) pair, which transition handles the event and which
 * states are exited and entered when it fires.
 *
 * <h2>Event bubbling</h2>
 * The search starts at the active state and walks up through its ancestors. At each level,
 * internal transitions on the event win over outgoing ones; the first level with a match ends the
 * search.
 *
 * <h2>Exit and entry chains</h2>
 * For an outgoing transition declared by state {@code L} and fired while {@code S} is active:
 * <ul>
 *   <li>exit chain: {@code S} up to and including {@code L}, plus the parent of {@code L} if it
 *       has one</li>
 *   <li>entry chain: the ancestors of the destination below {@code L} (or all of them if
 *       {@code L} is not an ancestor), the destination itself, then initial children down to a
 *       leaf</li>
 * </ul>
 * The exit chain reaches one level above {@code L} while the entry chain never re-enters
 * {@code L}. Generated code relies on this exact ordering, so it is kept as is.
 */
public class HierarchicalResolver {

    private static final Logger log = LoggerFactory.getLogger(HierarchicalResolver.class);

    /**
     * Resolves every event against every state of the chart.
     *
     * @param chart validated chart
     * @return the dispatch table
     */
    public DispatchTable resolveAll(StateChart chart) {
        Objects.requireNonNull(chart, "chart must not be null");

        Map<String, List<Resolution>> byEvent = new LinkedHashMap<>();
        for (String event : chart.events()) {
            List<Resolution> effective = new ArrayList<>();
            for (State state : chart.states()) {
                Resolution resolution = resolve(chart, state, event);
                if (resolution.hasEffect()) {
                    effective.add(resolution);
                }
            }
            byEvent.put(event, effective);
        }

        List<Transition> unreachable = findUnreachable(chart);
        for (Transition transition : unreachable) {
            log.warn("{}: transition {} can never fire", transition.declaredAt().location(), chart.describe(transition));
        }

        DispatchTable table = new DispatchTable(chart, chart.events(), byEvent, chart.initialChain(), unreachable);
        log.debug("{}: resolved {} dispatch entries for {} events", chart.sourceId(), table.size(), table.events().size());
        return table;
    }

    /**
     * Resolves one event posted while a state is active.
     *
     * @param chart validated chart
     * @param active active state
     * @param event event name
     * @return the resolution, of kind NONE when nothing handles the event
     */
    public Resolution resolve(StateChart chart, State active, String event) {
        Optional<State> level = Optional.of(active);
        while (level.isPresent()) {
            State handler = level.get();

            List<Transition> internal = chart.transitions(handler, TransitionRole.INTERNAL, event);
            if (!internal.isEmpty()) {
                return Resolution.internal(active, event, handler, reachable(internal));
            }

            List<Transition> outgoing = chart.transitions(handler, TransitionRole.OUTGOING, event);
            if (!outgoing.isEmpty()) {
                List<ResolvedTransition> candidates = reachable(outgoing).stream()
                    .map(t -> fire(chart, active, handler, t))
                    .toList();
                return Resolution.external(active, event, handler, candidates);
            }

            level = chart.parent(handler);
        }
        return Resolution.none(active, event);
    }

    /**
     * Builds the exit chain, transition and entry chain for one firing transition.
     */
    ResolvedTransition fire(StateChart chart, State active, State handler, Transition transition) {
        List<State> exits = exitChain(chart, active, handler);
        List<State> entries = entryChain(chart, handler, chart.state(transition.target()));
        return new ResolvedTransition(transition, exits, entries, entries.get(entries.size() - 1));
    }

    List<State> exitChain(StateChart chart, State active, State handler) {
        List<State> exits = new ArrayList<>();
        State current = active;
        exits.add(current);
        while (!current.equals(handler)) {
            State child = current;
            current = chart.parent(child)
                .orElseThrow(() -> new IllegalArgumentException(handler.name() + " is not an ancestor of " + child.name()));
            exits.add(current);
        }
        chart.parent(handler).ifPresent(exits::add);
        return exits;
    }

    List<State> entryChain(StateChart chart, State handler, State destination) {
        Deque<State> entries = new ArrayDeque<>();
        entries.addFirst(destination);

        Optional<State> ancestor = chart.parent(destination);
        while (ancestor.isPresent() && !ancestor.get().equals(handler)) {
            entries.addFirst(ancestor.get());
            ancestor = chart.parent(ancestor.get());
        }

        while (chart.isComposite(entries.peekLast())) {
            State composite = entries.peekLast();
            entries.addLast(chart.initialChild(composite)
                .orElseThrow(() -> new IllegalStateException("No initial state in composite state " + composite.name())));
        }
        return new ArrayList<>(entries);
    }

    /**
     * Drops every candidate after the first unguarded one.
     */
    private static List<Transition> reachable(List<Transition> candidates) {
        for (int i = 0; i < candidates.size(); i++) {
            if (!candidates.get(i).isGuarded()) {
                return candidates.subList(0, i + 1);
            }
        }
        return candidates;
    }

    /**
     * Finds transitions shadowed at their own level: candidates after an unguarded one, and
     * outgoing transitions on an event the same state also handles internally.
     */
    private static List<Transition> findUnreachable(StateChart chart) {
        Set<Transition> unreachable = new LinkedHashSet<>();
        for (State state : chart.states()) {
            for (String event : chart.events()) {
                List<Transition> internal = chart.transitions(state, TransitionRole.INTERNAL, event);
                List<Transition> outgoing = chart.transitions(state, TransitionRole.OUTGOING, event);

                internal.subList(reachable(internal).size(), internal.size()).forEach(unreachable::add);
                if (internal.isEmpty()) {
                    outgoing.subList(reachable(outgoing).size(), outgoing.size()).forEach(unreachable::add);
                } else {
                    unreachable.addAll(outgoing);
                }
            }
        }
        return chart.transitions().stream().filter(unreachable::contains).toList();
    }
}
