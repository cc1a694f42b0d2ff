package com.fsmgen.core.generator.impl;

import com.fsmgen.core.generator.CodeGenerator;
import com.fsmgen.core.generator.GeneratedCode;
import com.fsmgen.core.generator.GeneratorConfig;
import com.fsmgen.core.model.State;
import com.fsmgen.core.model.StateChart;
import com.fsmgen.core.model.Transition;
import com.fsmgen.core.model.TransitionRole;
import com.fsmgen.core.resolver.DispatchTable;
import com.fsmgen.core.resolver.Resolution;
import com.fsmgen.core.resolver.ResolutionKind;
import com.fsmgen.core.resolver.ResolvedTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Generates a C include file implementing the state machine.
 *
 * <p>The file is meant to be {@code #include}d after the action functions and guard variables it
 * refers to are declared. It defines:
 * <ul>
 *   <li>{@code State} and {@code Event} enums ({@code k<Name>State}, {@code k<Name>Event}) with
 *       {@code state_to_string} / {@code event_to_string}</li>
 *   <li>{@code call_state_entry_actions} / {@code call_state_exit_actions}</li>
 *   <li>{@code State init()}, entering the initial states and returning the initial leaf</li>
 *   <li>{@code State post_event(State cur_state, Event event)}, returning the new state</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * State state = init();
 * state = post_event(state, kTimeoutEvent);
 * }</pre>
 */
public class CGenerator implements CodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CGenerator.class);

    private static final String GENERATOR_ID = "c";
    private static final String GENERATOR_DISPLAY_NAME = "C Dispatch Code Generator";
    private static final String FILE_EXTENSION = "inc";

    private static final String UNKNOWN_NAME = "???";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public GeneratedCode generate(DispatchTable table, GeneratorConfig config) {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(config, "config must not be null");

        Writer out = new Writer(" ".repeat(config.indentWidth()), config.emitComments());
        StateChart chart = table.chart();

        out.line(0, "// Generated by fsmgen from " + chart.sourceId() + " (" + config.namespace() + "). Do not edit.");
        out.blank();
        generateStates(out, chart);
        generateEvents(out, table.events());
        generateHooks(out, chart, TransitionRole.ENTRY, "call_state_entry_actions");
        generateHooks(out, chart, TransitionRole.EXIT, "call_state_exit_actions");
        generateInit(out, table);
        generatePostEvent(out, table);

        log.debug("Generated {} characters of C code for {}", out.length(), chart.sourceId());
        return new GeneratedCode(config.namespace(), out.toString(), FILE_EXTENSION);
    }

    private void generateStates(Writer out, StateChart chart) {
        out.line(0, "// ===== States =====");
        out.line(0, "typedef enum {");
        for (State state : chart.states()) {
            out.line(1, stateTag(state) + ",");
        }
        out.line(0, "} State;");
        out.blank();
        out.line(0, "const char* state_to_string(State state) {");
        out.line(1, "switch (state) {");
        for (State state : chart.states()) {
            out.line(2, "case " + stateTag(state) + ": return \"" + state.name() + "\";");
        }
        out.line(2, "default: return \"" + UNKNOWN_NAME + "\";");
        out.line(1, "}");
        out.line(0, "}");
        out.blank();
    }

    private void generateEvents(Writer out, List<String> events) {
        out.line(0, "// ===== Events =====");
        out.line(0, "typedef enum {");
        for (String event : events) {
            out.line(1, eventTag(event) + ",");
        }
        out.line(0, "} Event;");
        out.blank();
        out.line(0, "const char* event_to_string(Event event) {");
        out.line(1, "switch (event) {");
        for (String event : events) {
            out.line(2, "case " + eventTag(event) + ": return \"" + event + "\";");
        }
        out.line(2, "default: return \"" + UNKNOWN_NAME + "\";");
        out.line(1, "}");
        out.line(0, "}");
        out.blank();
    }

    private void generateHooks(Writer out, StateChart chart, TransitionRole role, String functionName) {
        if (role == TransitionRole.ENTRY) {
            out.line(0, "// ===== State entry/exit actions =====");
        }
        out.line(0, "void " + functionName + "(State state) {");
        out.line(1, "switch (state) {");
        for (State state : chart.states()) {
            List<Transition> hooks = chart.transitions(state, role).stream()
                .filter(t -> !t.actions().isEmpty())
                .toList();
            if (hooks.isEmpty()) {
                continue;
            }
            out.line(2, "case " + stateTag(state) + ":");
            for (Transition hook : hooks) {
                if (hook.isGuarded()) {
                    out.line(3, "if (" + hook.guard() + ") {");
                    actions(out, 4, hook.actions());
                    out.line(3, "}");
                } else {
                    actions(out, 3, hook.actions());
                }
            }
            out.line(3, "break;");
        }
        out.line(2, "default:");
        out.line(3, "break;");
        out.line(1, "}");
        out.line(0, "}");
        out.blank();
    }

    private void generateInit(Writer out, DispatchTable table) {
        out.line(0, "// ===== FSM initialization =====");
        out.line(0, "State init() {");
        for (State state : table.initialChain()) {
            out.line(1, "call_state_entry_actions(" + stateTag(state) + ");");
        }
        out.line(1, "return " + stateTag(table.initialState()) + ";");
        out.line(0, "}");
        out.blank();
    }

    private void generatePostEvent(Writer out, DispatchTable table) {
        out.line(0, "// ===== FSM event handling =====");
        out.line(0, "State post_event(State cur_state, Event event) {");
        out.line(1, "State new_state = cur_state;");
        out.blank();
        out.line(1, "switch (event) {");
        for (String event : table.events()) {
            out.line(2, "case " + eventTag(event) + ":");
            out.line(3, "switch (cur_state) {");
            for (Resolution resolution : table.resolutions(event)) {
                out.line(4, "case " + stateTag(resolution.state()) + ":");
                if (resolution.kind() == ResolutionKind.INTERNAL) {
                    internalCase(out, 5, resolution);
                } else {
                    externalCase(out, 5, table.chart(), resolution);
                }
            }
            out.line(4, "default:");
            out.line(5, "break;");
            out.line(3, "}");
            out.line(3, "break;");
        }
        out.line(2, "default:");
        out.line(3, "break;");
        out.line(1, "}");
        out.blank();
        out.line(1, "return new_state;");
        out.line(0, "}");
    }

    /**
     * First satisfied internal transition runs its actions; the state does not change.
     */
    private void internalCase(Writer out, int depth, Resolution resolution) {
        out.comment(depth, "Internal transition(s) on event " + resolution.event()
            + " declared by " + resolution.handler().name());
        List<Transition> candidates = resolution.internalTransitions();
        for (int i = 0; i < candidates.size(); i++) {
            Transition candidate = candidates.get(i);
            String keyword = i == 0 ? "if" : "} else if";
            if (candidate.isGuarded()) {
                out.line(depth, keyword + " (" + candidate.guard() + ") {");
                actions(out, depth + 1, candidate.actions());
            } else if (i == 0) {
                actions(out, depth, candidate.actions());
            } else {
                out.line(depth, "} else {");
                actions(out, depth + 1, candidate.actions());
            }
        }
        if (candidates.size() > 1 || candidates.get(0).isGuarded()) {
            out.line(depth, "}");
        }
        out.line(depth, "break;");
    }

    /**
     * Outgoing candidates are tried in order; the first whose guard holds fires and leaves the case.
     */
    private void externalCase(Writer out, int depth, StateChart chart, Resolution resolution) {
        boolean fallsThrough = true;
        for (ResolvedTransition candidate : resolution.transitions()) {
            Transition transition = candidate.transition();
            out.comment(depth, chart.describe(transition));
            if (transition.isGuarded()) {
                out.line(depth, "if (" + transition.guard() + ") {");
                firing(out, depth + 1, candidate);
                out.line(depth, "}");
            } else {
                firing(out, depth, candidate);
                fallsThrough = false;
            }
        }
        if (fallsThrough) {
            out.line(depth, "break;");
        }
    }

    private void firing(Writer out, int depth, ResolvedTransition candidate) {
        for (State state : candidate.exitChain()) {
            out.line(depth, "call_state_exit_actions(" + stateTag(state) + ");");
        }
        actions(out, depth, candidate.transition().actions());
        for (State state : candidate.entryChain()) {
            out.line(depth, "call_state_entry_actions(" + stateTag(state) + ");");
        }
        out.line(depth, "new_state = " + stateTag(candidate.target()) + ";");
        out.line(depth, "break;");
    }

    /**
     * Emits each action verbatim followed by {@code ;}, even if it already ends in one.
     */
    private void actions(Writer out, int depth, List<String> actions) {
        for (String action : actions) {
            out.line(depth, action + ";");
        }
    }

    static String stateTag(State state) {
        return "k" + state.name() + "State";
    }

    static String eventTag(String event) {
        return "k" + event + "Event";
    }

    /**
     * Indenting line writer.
     */
    private static final class Writer {
        private final StringBuilder sb = new StringBuilder();
        private final String indent;
        private final boolean comments;

        Writer(String indent, boolean comments) {
            this.indent = indent;
            this.comments = comments;
        }

        void line(int depth, String text) {
            sb.append(indent.repeat(depth)).append(text).append('\n');
        }

        void comment(int depth, String text) {
            if (comments) {
                line(depth, "// " + text);
            }
        }

        void blank() {
            sb.append('\n');
        }

        int length() {
            return sb.length();
        }

        @Override
        public String toString() {
            return sb.toString();
        }
    }
}
