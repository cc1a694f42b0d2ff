package com.fsmgen.core.parser;

import com.fsmgen.core.model.SourceLine;
import com.fsmgen.core.model.State;
import com.fsmgen.core.model.Transition;
import com.fsmgen.core.model.TransitionRole;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;

/**
 * Links {@code From --> To : clause} lines to their declaring state.
 *
 * <p>Runs last, so every line it sees must be a transition: anything else is reported as
 * {@link ErrorKind#UNPARSABLE_LINE}. Transitions keep their source order, which decides the
 * priority between candidates on the same event.
 */
public class TransitionLinker {

    private final TransitionClauseParser clauseParser;

    public TransitionLinker(TransitionClauseParser clauseParser) {
        this.clauseParser = Objects.requireNonNull(clauseParser, "clauseParser must not be null");
    }

    /**
     * Parses the remaining lines as outgoing transitions.
     *
     * @param chart chart holding the declared states; transitions are added to it
     * @param lines lines left over by the hierarchy builder
     * @throws ModelException on a missing event, an undefined state, an invalid clause or an
     *                        unrecognized line
     */
    public void link(StateChartBuilder chart, List<SourceLine> lines) {
        for (SourceLine line : lines) {
            Matcher matcher = DiagramPatterns.TRANSITION.matcher(line.text());
            if (!matcher.matches()) {
                throw new ModelException(ErrorKind.UNPARSABLE_LINE, line);
            }

            String fromName = matcher.group(1);
            String toName = matcher.group(2);
            String clause = matcher.group(4);

            if (clause == null || clause.isEmpty()) {
                throw new ModelException(ErrorKind.MISSING_TRANSITION_EVENT, line);
            }
            State from = chart.find(fromName)
                .orElseThrow(() -> new ModelException(ErrorKind.UNDEFINED_STATE, line, "state " + fromName));
            State to = chart.find(toName)
                .orElseThrow(() -> new ModelException(ErrorKind.UNDEFINED_STATE, line, "state " + toName));

            TransitionClauseParser.Clause parsed = clauseParser.parse(line, clause);
            chart.addTransition(new Transition(
                TransitionRole.OUTGOING,
                parsed.event(),
                parsed.guard(),
                from.handle(),
                to.handle(),
                parsed.actions(),
                line));
        }
    }
}
