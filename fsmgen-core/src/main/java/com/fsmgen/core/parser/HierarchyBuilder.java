package com.fsmgen.core.parser;

import com.fsmgen.core.model.SourceLine;
import com.fsmgen.core.model.State;
import com.fsmgen.core.model.Transition;
import com.fsmgen.core.model.TransitionRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Builds the state tree from state declarations and nested blocks.
 *
 * <p>Keeps a stack of open blocks. {@code }} closes the innermost block; a state declaration
 * registers the state under the innermost open block and, when it carries a clause, files that
 * clause as an entry hook, exit hook or internal transition of the state. A trailing {@code {}
 * opens a block for the state. Lines that are not declarations or closing braces are handed on
 * unchanged.
 *
 * <p>State names are global. Re-declaring a known state reuses it. A block that reopens a state
 * lists it among its children (once), while the state's own parent link keeps its first value.
 * A reopening under a different parent is logged; with {@link ParserOptions#strictNesting()} it
 * raises {@link ErrorKind#CONFLICTING_PARENT} instead.
 */
public class HierarchyBuilder {

    private static final Logger log = LoggerFactory.getLogger(HierarchyBuilder.class);

    private final TransitionClauseParser clauseParser;
    private final ParserOptions options;

    public HierarchyBuilder(TransitionClauseParser clauseParser, ParserOptions options) {
        this.clauseParser = Objects.requireNonNull(clauseParser, "clauseParser must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Result of building the hierarchy.
     *
     * @param chart builder holding the declared states and inline transitions
     * @param remaining lines that were not consumed, in source order
     */
    public record Result(StateChartBuilder chart, List<SourceLine> remaining) {
        public Result {
            remaining = List.copyOf(remaining);
        }
    }

    /**
     * Consumes state declarations and block braces.
     *
     * @param sourceId identity of the diagram
     * @param lines lines left after initial transitions were extracted
     * @param initialTargets names of initial-transition targets
     * @return the partially built chart and the unconsumed lines
     * @throws ModelException on unbalanced braces, invalid clauses or (strict mode) conflicting parents
     */
    public Result build(String sourceId, List<SourceLine> lines, Map<String, SourceLine> initialTargets) {
        StateChartBuilder chart = new StateChartBuilder(sourceId);
        List<SourceLine> remaining = new ArrayList<>();

        // Open blocks, innermost first. The sentinel block has no state.
        Deque<Optional<State>> openStates = new ArrayDeque<>();
        Deque<SourceLine> openedAt = new ArrayDeque<>();
        openStates.push(Optional.empty());

        for (SourceLine line : lines) {
            if (DiagramPatterns.CLOSE_BRACE.equals(line.text())) {
                openStates.pop();
                if (openStates.isEmpty()) {
                    throw new ModelException(ErrorKind.UNMATCHED_CLOSE_BRACE, line);
                }
                openedAt.pop();
                continue;
            }

            Matcher matcher = DiagramPatterns.STATE_DECLARATION.matcher(line.text());
            if (!matcher.matches()) {
                remaining.add(line);
                continue;
            }

            String name = matcher.group(2);
            String clause = matcher.group(4);
            boolean opensBlock = !matcher.group(5).isEmpty();
            State parent = openStates.peek().orElse(null);

            State state = resolveState(chart, name, parent, line, initialTargets.containsKey(name));

            if (clause != null && !clause.isEmpty()) {
                TransitionClauseParser.Clause parsed = clauseParser.parse(line, clause);
                chart.addTransition(new Transition(
                    TransitionRole.ofInlineEvent(parsed.event()),
                    parsed.event(),
                    parsed.guard(),
                    state.handle(),
                    state.handle(),
                    parsed.actions(),
                    line));
            }

            if (opensBlock) {
                openStates.push(Optional.of(state));
                openedAt.push(line);
            }
        }

        if (openStates.size() != 1) {
            throw new ModelException(ErrorKind.UNCLOSED_BLOCK, openedAt.peek());
        }

        log.debug("Built hierarchy of {} states with {} inline transitions, {} lines left",
            chart.stateCount(), chart.transitionCount(), remaining.size());
        return new Result(chart, remaining);
    }

    private State resolveState(StateChartBuilder chart, String name, State parent, SourceLine line, boolean initial) {
        Optional<State> existing = chart.find(name);
        if (existing.isEmpty()) {
            return chart.declare(name, initial, parent, line);
        }

        State state = existing.get();
        Optional<State> knownParent = chart.parent(state);
        if (!knownParent.equals(Optional.ofNullable(parent))) {
            String detail = "state " + name + " first declared under "
                + knownParent.map(State::name).orElse("top level") + " at " + state.declaredAt().location()
                + ", reopened under " + (parent == null ? "top level" : parent.name());
            if (options.strictNesting()) {
                throw new ModelException(ErrorKind.CONFLICTING_PARENT, line, detail);
            }
            log.warn("{}: {}; keeping the first parent", line.location(), detail);
        }
        if (parent != null && !isSelfOrAncestor(chart, state, parent)) {
            chart.addChild(parent, state);
        }
        return state;
    }

    private static boolean isSelfOrAncestor(StateChartBuilder chart, State candidate, State state) {
        Optional<State> current = Optional.of(state);
        while (current.isPresent()) {
            if (current.get().equals(candidate)) {
                return true;
            }
            current = chart.parent(current.get());
        }
        return false;
    }
}
