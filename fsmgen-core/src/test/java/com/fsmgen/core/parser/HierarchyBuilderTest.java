package com.fsmgen.core.parser;

import com.fsmgen.core.model.SourceLine;
import com.fsmgen.core.model.State;
import com.fsmgen.core.model.StateChart;
import com.fsmgen.core.model.Transition;
import com.fsmgen.core.model.TransitionRole;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link HierarchyBuilder}.
 */
class HierarchyBuilderTest {

    private final LineNormalizer normalizer = new LineNormalizer();
    private final InitialTransitionExtractor extractor = new InitialTransitionExtractor();

    @Test
    void build_nestedBlocks_recordsParentsInFirstSeenOrder() {
        HierarchyBuilder.Result result = build(ParserOptions.defaults(), """
            [*] --> Idle
            state Idle {
              [*] --> Off
              Off
              On
              state Inner {
                [*] --> Deep
                Deep
              }
            }
            state Working
            """);

        StateChart chart = result.chart().build();

        State idle = chart.find("Idle").orElseThrow();
        assertThat(chart.topLevelStates()).extracting(State::name).containsExactly("Idle", "Working");
        assertThat(chart.children(idle)).extracting(State::name).containsExactly("Off", "On", "Inner");
        assertThat(chart.parent(chart.find("Deep").orElseThrow())).map(State::name).contains("Inner");
        assertThat(idle.initial()).isTrue();
        assertThat(chart.find("Off").orElseThrow().initial()).isTrue();
        assertThat(chart.find("On").orElseThrow().initial()).isFalse();
    }

    @Test
    void build_inlineClauses_areFiledByRole() {
        HierarchyBuilder.Result result = build(ParserOptions.defaults(), """
            [*] --> A
            state A : entry / on_enter()
            A : exit / on_leave()
            A : tick [armed] / count++
            """);

        StateChart chart = result.chart().build();
        State a = chart.find("A").orElseThrow();

        assertThat(chart.transitions()).extracting(Transition::role)
            .containsExactly(TransitionRole.ENTRY, TransitionRole.EXIT, TransitionRole.INTERNAL);
        Transition tick = chart.transitions(a, TransitionRole.INTERNAL, "tick").get(0);
        assertThat(tick.guard()).isEqualTo("armed");
        assertThat(tick.actions()).containsExactly("count++");
        assertThat(tick.source()).isEqualTo(tick.target()).isEqualTo(a.handle());
    }

    @Test
    void build_transitionLines_arePassedOnUnchanged() {
        HierarchyBuilder.Result result = build(ParserOptions.defaults(), """
            [*] --> A
            A
            B
            A --> B : go
            """);

        assertThat(result.remaining()).extracting(SourceLine::text).containsExactly("A --> B : go");
    }

    @Test
    void build_extraCloseBrace_throwsUnmatchedCloseBrace() {
        assertThatThrownBy(() -> build(ParserOptions.defaults(), """
            [*] --> A
            state A {
            }
            }
            """))
            .isInstanceOf(ModelException.class)
            .satisfies(e -> {
                ModelException error = (ModelException) e;
                assertThat(error.getKind()).isEqualTo(ErrorKind.UNMATCHED_CLOSE_BRACE);
                assertThat(error.getLine().lineNumber()).isEqualTo(4);
            });
    }

    @Test
    void build_unclosedBlock_pointsAtInnermostOpeningLine() {
        assertThatThrownBy(() -> build(ParserOptions.defaults(), """
            [*] --> A
            state A {
              [*] --> B
              state B {
                C
            """))
            .isInstanceOf(ModelException.class)
            .satisfies(e -> {
                ModelException error = (ModelException) e;
                assertThat(error.getKind()).isEqualTo(ErrorKind.UNCLOSED_BLOCK);
                assertThat(error.getLine().lineNumber()).isEqualTo(4);
            });
    }

    @Test
    void build_reopenedUnderOtherParent_keepsFirstParentAndJoinsReopeningBlock() {
        HierarchyBuilder.Result result = build(ParserOptions.defaults(), """
            state P {
              X
            }
            state Q {
              X : tick / a()
            }
            """);

        StateChart chart = result.chart().build();
        State x = chart.find("X").orElseThrow();

        assertThat(chart.parent(x)).map(State::name).contains("P");
        assertThat(chart.children(chart.find("P").orElseThrow())).extracting(State::name).containsExactly("X");
        assertThat(chart.children(chart.find("Q").orElseThrow())).extracting(State::name).containsExactly("X");
        assertThat(chart.isComposite(chart.find("Q").orElseThrow())).isTrue();
        assertThat(chart.transitions(x, TransitionRole.INTERNAL)).hasSize(1);
    }

    @Test
    void build_reopenedTwiceInSameBlock_isListedOnce() {
        HierarchyBuilder.Result result = build(ParserOptions.defaults(), """
            state P {
              X
            }
            state Q {
              X
              X : tick / a()
            }
            """);

        StateChart chart = result.chart().build();

        assertThat(chart.children(chart.find("Q").orElseThrow())).extracting(State::name).containsExactly("X");
    }

    @Test
    void build_stateReopenedInsideItsOwnBlock_isNotItsOwnChild() {
        HierarchyBuilder.Result result = build(ParserOptions.defaults(), """
            state P {
              Q
              P : tick / a()
            }
            """);

        StateChart chart = result.chart().build();

        assertThat(chart.children(chart.find("P").orElseThrow())).extracting(State::name).containsExactly("Q");
    }

    @Test
    void build_topLevelStateReopenedInBlock_staysTopLevel() {
        HierarchyBuilder.Result result = build(ParserOptions.defaults(), """
            X
            state P {
              X
            }
            """);

        StateChart chart = result.chart().build();
        State x = chart.find("X").orElseThrow();

        assertThat(chart.parent(x)).isEmpty();
        assertThat(chart.topLevelStates()).extracting(State::name).containsExactly("X", "P");
        assertThat(chart.children(chart.find("P").orElseThrow())).containsExactly(x);
    }

    @Test
    void build_reopenedUnderOtherParentInStrictMode_throwsConflictingParent() {
        assertThatThrownBy(() -> build(new ParserOptions(true), """
            state P {
              X
            }
            X
            """))
            .isInstanceOf(ModelException.class)
            .hasMessageContaining("first declared under P")
            .extracting(e -> ((ModelException) e).getKind())
            .isEqualTo(ErrorKind.CONFLICTING_PARENT);
    }

    @Test
    void build_reopenedUnderSameParent_isAccepted() {
        HierarchyBuilder.Result result = build(new ParserOptions(true), """
            state P {
              X
            }
            state P {
              X : entry / hello()
            }
            """);

        assertThat(result.chart().stateCount()).isEqualTo(2);
    }

    private HierarchyBuilder.Result build(ParserOptions options, String content) {
        List<SourceLine> lines = normalizer.normalize("test.puml", content);
        InitialTransitionExtractor.Result initials = extractor.extract(lines);
        return new HierarchyBuilder(new TransitionClauseParser(), options)
            .build("test.puml", initials.remaining(), initials.targets());
    }
}
