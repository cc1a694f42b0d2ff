package com.fsmgen.core.parser;

import com.fsmgen.core.model.SourceLine;
import com.fsmgen.core.model.State;
import com.fsmgen.core.model.StateChart;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Checks the state hierarchy before transitions are linked.
 *
 * <p>Checks run in a fixed order and the first violation fails the diagram:
 * <ol>
 *   <li>every initial-transition target is a declared state</li>
 *   <li>exactly one top-level state is initial</li>
 *   <li>every composite state has exactly one initial child</li>
 * </ol>
 */
public class StructureValidator {

    /**
     * Validates the hierarchy.
     *
     * @param chart snapshot of the declared states
     * @param initialTargets initial-transition targets with their declaring lines
     * @throws ModelException on the first violation
     */
    public void validate(StateChart chart, Map<String, SourceLine> initialTargets) {
        checkInitialTargetsExist(chart, initialTargets);
        checkSingleInitial(chart, chart.topLevelStates(), initialTargets,
            SourceLine.wholeSource(chart.sourceId()), "top level");

        for (State state : chart.states()) {
            if (chart.isComposite(state)) {
                checkSingleInitial(chart, chart.children(state), initialTargets,
                    state.declaredAt(), "composite state " + state.name());
            }
        }
    }

    private void checkInitialTargetsExist(StateChart chart, Map<String, SourceLine> initialTargets) {
        for (Map.Entry<String, SourceLine> target : initialTargets.entrySet()) {
            if (chart.find(target.getKey()).isEmpty()) {
                throw new ModelException(ErrorKind.UNDEFINED_STATE, target.getValue(),
                    "target " + target.getKey() + " of the initial transition");
            }
        }
    }

    private void checkSingleInitial(StateChart chart, List<State> scope, Map<String, SourceLine> initialTargets,
                                    SourceLine scopeLine, String scopeName) {
        List<State> initials = scope.stream().filter(State::initial).toList();
        if (initials.isEmpty()) {
            throw new ModelException(ErrorKind.NO_INITIAL_STATE, scopeLine, "in " + scopeName);
        }
        if (initials.size() > 1) {
            String names = initials.stream().map(State::name).collect(Collectors.joining(", "));
            throw new ModelException(ErrorKind.MULTIPLE_INITIAL_STATES,
                initialTargets.get(initials.get(1).name()), "in " + scopeName + ": " + names);
        }
    }
}
