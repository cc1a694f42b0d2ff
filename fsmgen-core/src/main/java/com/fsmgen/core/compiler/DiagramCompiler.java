package com.fsmgen.core.compiler;

import com.fsmgen.core.generator.CodeGenerator;
import com.fsmgen.core.generator.GeneratedCode;
import com.fsmgen.core.generator.GeneratorConfig;
import com.fsmgen.core.model.StateChart;
import com.fsmgen.core.parser.DiagramParser;
import com.fsmgen.core.parser.ModelException;
import com.fsmgen.core.parser.ParserOptions;
import com.fsmgen.core.resolver.DispatchTable;
import com.fsmgen.core.resolver.HierarchicalResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Compiles one diagram at a time: parse, validate, resolve, generate.
 *
 * <p>The compiler only sees diagram text and returns code text. Reading and writing files is the
 * caller's business. Each call builds its own model, so compilations never share state.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DiagramCompiler compiler = new DiagramCompiler(ParserOptions.defaults(), new CGenerator());
 * GeneratedCode code = compiler.compile(new DiagramSource("fsm.puml", text, "fsm"));
 * }</pre>
 */
public class DiagramCompiler {

    private static final Logger log = LoggerFactory.getLogger(DiagramCompiler.class);

    private final DiagramParser parser;
    private final HierarchicalResolver resolver = new HierarchicalResolver();
    private final CodeGenerator generator;

    public DiagramCompiler(ParserOptions options, CodeGenerator generator) {
        this.parser = new DiagramParser(Objects.requireNonNull(options, "options must not be null"));
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
    }

    /**
     * Creates a compiler using the generator registered under the given id.
     *
     * @param options parser options
     * @param generatorId generator id, e.g. "c"
     * @return the compiler
     * @throws IllegalArgumentException if no generator has that id
     */
    public static DiagramCompiler withGenerator(ParserOptions options, String generatorId) {
        return new DiagramCompiler(options, findGenerator(generatorId));
    }

    /**
     * Looks up a generator via SPI.
     *
     * @param generatorId generator id
     * @return the generator
     * @throws IllegalArgumentException if no generator has that id
     */
    public static CodeGenerator findGenerator(String generatorId) {
        List<String> available = new ArrayList<>();
        for (CodeGenerator candidate : ServiceLoader.load(CodeGenerator.class)) {
            if (candidate.getId().equals(generatorId)) {
                return candidate;
            }
            available.add(candidate.getId());
        }
        throw new IllegalArgumentException("Unknown generator: " + generatorId + ". Available: " + available);
    }

    public CodeGenerator getGenerator() {
        return generator;
    }

    /**
     * Parses, validates and resolves a diagram without generating code.
     *
     * @param source diagram to check
     * @return the resolved dispatch table
     * @throws ModelException if the diagram is invalid
     */
    public DispatchTable resolve(DiagramSource source) {
        Objects.requireNonNull(source, "source must not be null");
        StateChart chart = parser.parse(source.sourceId(), source.content());
        return resolver.resolveAll(chart);
    }

    /**
     * Compiles a diagram with default generator settings.
     *
     * @param source diagram to compile
     * @return generated code
     * @throws ModelException if the diagram is invalid; no code is produced in that case
     */
    public GeneratedCode compile(DiagramSource source) {
        return compile(source, GeneratorConfig.defaults(source.name()));
    }

    /**
     * Compiles a diagram.
     *
     * @param source diagram to compile
     * @param config generator settings
     * @return generated code
     * @throws ModelException if the diagram is invalid; no code is produced in that case
     */
    public GeneratedCode compile(DiagramSource source, GeneratorConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        DispatchTable table = resolve(source);
        GeneratedCode code = generator.generate(table, config);
        log.debug("Compiled {} with generator {}", source.sourceId(), generator.getId());
        return code;
    }
}
