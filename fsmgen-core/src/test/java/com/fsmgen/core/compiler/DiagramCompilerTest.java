package com.fsmgen.core.compiler;

import com.fsmgen.core.generator.GeneratedCode;
import com.fsmgen.core.generator.impl.CGenerator;
import com.fsmgen.core.parser.ErrorKind;
import com.fsmgen.core.parser.ModelException;
import com.fsmgen.core.parser.ParserOptions;
import com.fsmgen.core.resolver.DispatchTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for {@link DiagramCompiler}.
 */
class DiagramCompilerTest {

    private DiagramCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new DiagramCompiler(ParserOptions.defaults(), new CGenerator());
    }

    @Test
    void compile_trafficLights_generatesDispatchCode() throws IOException {
        GeneratedCode code = compiler.compile(trafficLights());

        assertThat(code.name()).isEqualTo("traffic_lights");
        assertThat(code.fileExtension()).isEqualTo("inc");
        assertThat(code.content())
            .contains("kLightsBrokenEvent,", "kLightsRepairedEvent,", "kTimeoutEvent,")
            .contains("start_timer(3000);")
            .contains("return kRedState;")
            .contains("State post_event(State cur_state, Event event) {");
    }

    @Test
    void compile_trafficLights_brokenLightsLeaveFromAnyPhase() throws IOException {
        DispatchTable table = compiler.resolve(trafficLights());

        assertThat(table.resolutions("LightsBroken"))
            .extracting(r -> r.state().name())
            .containsExactly("Operational", "Red", "RedYellow", "Green", "Yellow");
        assertThat(table.resolutions("LightsBroken")).allSatisfy(r -> {
            assertThat(r.handler().name()).isEqualTo("Operational");
            assertThat(r.transitions().get(0).target().name()).isEqualTo("BlinkOn");
        });
        assertThat(table.unreachable()).isEmpty();
    }

    @Test
    void compile_sameSourceTwice_isByteIdentical() throws IOException {
        DiagramSource source = trafficLights();

        assertThat(compiler.compile(source).content()).isEqualTo(compiler.compile(source).content());
    }

    @Test
    void compile_invalidDiagram_producesNoCode() {
        DiagramSource source = new DiagramSource("broken.puml", """
            [*] --> A
            A
            B
            A --> B
            """, "broken");

        assertThatThrownBy(() -> compiler.compile(source))
            .isInstanceOf(ModelException.class)
            .hasMessageStartingWith("broken.puml:4")
            .extracting(e -> ((ModelException) e).getKind())
            .isEqualTo(ErrorKind.MISSING_TRANSITION_EVENT);
    }

    @Test
    void compile_twoRootInitials_throwsMultipleInitialStates() {
        DiagramSource source = new DiagramSource("two.puml", """
            [*] --> A
            [*] --> B
            A
            B
            """, "two");

        assertThatThrownBy(() -> compiler.compile(source))
            .isInstanceOf(ModelException.class)
            .extracting(e -> ((ModelException) e).getKind())
            .isEqualTo(ErrorKind.MULTIPLE_INITIAL_STATES);
    }

    @Test
    void withGenerator_registeredId_usesServiceLoader() {
        DiagramCompiler viaSpi = DiagramCompiler.withGenerator(ParserOptions.defaults(), "c");

        assertThat(viaSpi.getGenerator()).isInstanceOf(CGenerator.class);
    }

    @Test
    void withGenerator_unknownId_listsAvailableGenerators() {
        assertThatThrownBy(() -> DiagramCompiler.withGenerator(ParserOptions.defaults(), "cobol"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cobol")
            .hasMessageContaining("[c]");
    }

    private DiagramSource trafficLights() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/diagrams/traffic_lights.puml")) {
            assertThat(in).isNotNull();
            return new DiagramSource("traffic_lights.puml", new String(in.readAllBytes(), StandardCharsets.UTF_8),
                "traffic_lights");
        }
    }
}
