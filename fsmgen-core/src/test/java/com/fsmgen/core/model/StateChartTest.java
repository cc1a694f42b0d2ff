package com.fsmgen.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link StateChart}.
 */
class StateChartTest {

    private static final SourceLine LINE = new SourceLine("m.puml", 1, "x", "x");

    @Test
    void initialChain_descendsThroughInitialChildren() {
        StateChart chart = chart();

        assertThat(chart.initialChain()).extracting(State::name).containsExactly("Root", "Leaf");
        assertThat(chart.isComposite(chart.state(0))).isTrue();
        assertThat(chart.isComposite(chart.state(1))).isFalse();
    }

    @Test
    void events_excludeHooksAndAreSortedAndDistinct() {
        StateChart chart = chart();

        assertThat(chart.events()).containsExactly("alpha", "zulu");
    }

    @Test
    void describe_includesGuard() {
        StateChart chart = chart();

        assertThat(chart.describe(chart.transitions().get(1))).isEqualTo("Leaf --- zulu [ready] --> Other");
    }

    @Test
    void constructor_misplacedHandle_throwsException() {
        assertThatThrownBy(() -> new StateChart("m.puml",
            List.of(new State(1, "A", true, LINE)), Map.of("A", 1), Map.of(), Map.of(), List.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("handle 1");
    }

    @Test
    void transition_inlineRoleChangingState_throwsException() {
        assertThatThrownBy(() -> new Transition(TransitionRole.INTERNAL, "tick", null, 0, 1, List.of(), LINE))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void wholeSource_locationIsSourceIdOnly() {
        assertThat(SourceLine.wholeSource("m.puml").location()).isEqualTo("m.puml");
        assertThat(LINE.location()).isEqualTo("m.puml:1");
    }

    private static StateChart chart() {
        List<State> states = List.of(
            new State(0, "Root", true, LINE),
            new State(1, "Leaf", true, LINE),
            new State(2, "Other", false, LINE));
        List<Transition> transitions = List.of(
            new Transition(TransitionRole.ENTRY, "entry", null, 1, 1, List.of("hello()"), LINE),
            new Transition(TransitionRole.OUTGOING, "zulu", "ready", 1, 2, List.of(), LINE),
            new Transition(TransitionRole.INTERNAL, "alpha", null, 2, 2, List.of("a()"), LINE),
            new Transition(TransitionRole.OUTGOING, "zulu", null, 2, 0, List.of(), LINE));
        return new StateChart("m.puml", states,
            Map.of("Root", 0, "Leaf", 1, "Other", 2),
            Map.of(1, 0),
            Map.of(0, List.of(1)),
            transitions);
    }
}
