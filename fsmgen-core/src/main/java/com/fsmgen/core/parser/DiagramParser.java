package com.fsmgen.core.parser;

import com.fsmgen.core.model.SourceLine;
import com.fsmgen.core.model.StateChart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Front end of the compiler: turns diagram text into a validated {@link StateChart}.
 *
 * <p>Stages run strictly in order, each consuming the lines the previous one left:
 * <ol>
 *   <li>{@link LineNormalizer}</li>
 *   <li>{@link InitialTransitionExtractor}</li>
 *   <li>{@link HierarchyBuilder}</li>
 *   <li>{@link StructureValidator}</li>
 *   <li>{@link TransitionLinker}</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DiagramParser parser = new DiagramParser(ParserOptions.defaults());
 * StateChart chart = parser.parse("traffic_lights.puml", content);
 * }</pre>
 */
public class DiagramParser {

    private static final Logger log = LoggerFactory.getLogger(DiagramParser.class);

    private final LineNormalizer normalizer = new LineNormalizer();
    private final InitialTransitionExtractor initialExtractor = new InitialTransitionExtractor();
    private final StructureValidator validator = new StructureValidator();
    private final HierarchyBuilder hierarchyBuilder;
    private final TransitionLinker linker;

    public DiagramParser(ParserOptions options) {
        TransitionClauseParser clauseParser = new TransitionClauseParser();
        this.hierarchyBuilder = new HierarchyBuilder(clauseParser, options);
        this.linker = new TransitionLinker(clauseParser);
    }

    public DiagramParser() {
        this(ParserOptions.defaults());
    }

    /**
     * Parses and validates a diagram.
     *
     * @param sourceId identity of the diagram, used in diagnostics
     * @param content diagram text
     * @return the validated state chart
     * @throws ModelException if the diagram is invalid
     */
    public StateChart parse(String sourceId, String content) {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(content, "content must not be null");

        List<SourceLine> lines = normalizer.normalize(sourceId, content);
        log.debug("{}: {} significant lines", sourceId, lines.size());

        InitialTransitionExtractor.Result initials = initialExtractor.extract(lines);
        log.debug("{}: initial states {}", sourceId, initials.targets().keySet());

        HierarchyBuilder.Result hierarchy = hierarchyBuilder.build(sourceId, initials.remaining(), initials.targets());
        validator.validate(hierarchy.chart().build(), initials.targets());

        linker.link(hierarchy.chart(), hierarchy.remaining());

        StateChart chart = hierarchy.chart().build();
        log.debug("{}: parsed {} states, {} transitions, {} events",
            sourceId, chart.states().size(), chart.transitions().size(), chart.events().size());
        return chart;
    }
}
