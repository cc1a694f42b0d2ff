package com.fsmgen.core.parser;

import com.fsmgen.core.model.SourceLine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Pulls {@code [*] --> Name} declarations out of the line stream.
 *
 * <p>The declarations are independent of nesting: a state is initial (within its parent, or at
 * top level) exactly when its name is the target of one of these lines.
 */
public class InitialTransitionExtractor {

    /**
     * Result of the extraction.
     *
     * @param targets initial state names mapped to their declaring line, in source order
     * @param remaining lines that are not initial transitions, in source order
     */
    public record Result(Map<String, SourceLine> targets, List<SourceLine> remaining) {
        public Result {
            targets = Collections.unmodifiableMap(new LinkedHashMap<>(targets));
            remaining = List.copyOf(remaining);
        }
    }

    /**
     * Extracts initial transitions.
     *
     * @param lines normalized lines
     * @return initial targets and the remaining lines
     * @throws ModelException with {@link ErrorKind#DUPLICATE_INITIAL_TRANSITION} or
     *                        {@link ErrorKind#MALFORMED_INITIAL_TRANSITION}
     */
    public Result extract(List<SourceLine> lines) {
        Map<String, SourceLine> targets = new LinkedHashMap<>();
        List<SourceLine> remaining = new ArrayList<>();

        for (SourceLine line : lines) {
            Matcher matcher = DiagramPatterns.INITIAL_TRANSITION.matcher(line.text());
            if (!matcher.matches()) {
                remaining.add(line);
                continue;
            }

            String name = matcher.group(1);
            if (targets.containsKey(name)) {
                throw new ModelException(ErrorKind.DUPLICATE_INITIAL_TRANSITION, line,
                    "state " + name + " already declared initial at " + targets.get(name).location());
            }
            if (!matcher.group(2).isEmpty()) {
                throw new ModelException(ErrorKind.MALFORMED_INITIAL_TRANSITION, line);
            }
            targets.put(name, line);
        }

        return new Result(targets, remaining);
    }
}
