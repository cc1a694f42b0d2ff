package com.fsmgen.core.parser;

import com.fsmgen.core.model.SourceLine;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Parses the text after the colon of a state or transition line:
 * {@code event [ "[" guard "]" ] [ "/" action ( "/" action )* ]}.
 *
 * <p>Escaped newlines ({@code \n}) are removed first. Guard and actions are kept as opaque text;
 * an empty guard means "unguarded" and empty action segments are discarded.
 */
public class TransitionClauseParser {

    /**
     * A parsed clause.
     *
     * @param event event name
     * @param guard guard expression, or null
     * @param actions trimmed, non-empty action statements
     */
    public record Clause(String event, String guard, List<String> actions) {
        public Clause {
            actions = List.copyOf(actions);
        }
    }

    /**
     * Parses a clause.
     *
     * @param line line the clause was taken from, used for error reporting
     * @param clauseText clause text
     * @return the parsed clause
     * @throws ModelException with {@link ErrorKind#INVALID_TRANSITION_CLAUSE} if the text does not
     *                        follow the clause grammar
     */
    public Clause parse(SourceLine line, String clauseText) {
        String text = clauseText.replace(DiagramPatterns.ESCAPED_NEWLINE, "");
        Matcher matcher = DiagramPatterns.TRANSITION_CLAUSE.matcher(text);
        if (!matcher.matches()) {
            throw new ModelException(ErrorKind.INVALID_TRANSITION_CLAUSE, line);
        }

        String guard = matcher.group(3);
        if (guard != null && guard.isEmpty()) {
            guard = null;
        }

        List<String> actions = new ArrayList<>();
        String actionsText = matcher.group(5);
        if (actionsText != null) {
            for (String segment : actionsText.split(DiagramPatterns.ACTION_SEPARATOR, -1)) {
                String action = segment.strip();
                if (!action.isEmpty()) {
                    actions.add(action);
                }
            }
        }

        return new Clause(matcher.group(1), guard, actions);
    }
}
