package com.fsmgen.cli;

import com.fsmgen.core.compiler.DiagramCompiler;
import com.fsmgen.core.compiler.DiagramSource;
import com.fsmgen.core.config.ConfigLoader;
import com.fsmgen.core.config.ProjectConfig;
import com.fsmgen.core.generator.GeneratedCode;
import com.fsmgen.core.generator.GeneratorConfig;
import com.fsmgen.core.parser.ModelException;
import com.fsmgen.core.parser.ParserOptions;
import com.fsmgen.core.renderer.GeneratedFile;
import com.fsmgen.core.renderer.OutputRenderer;
import com.fsmgen.core.renderer.RenderContext;
import com.fsmgen.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to compile state diagrams into code.
 *
 * <p>For each diagram:
 * <ol>
 *   <li>Read the diagram text</li>
 *   <li>Parse, validate and resolve it</li>
 *   <li>Generate code with the configured generator</li>
 *   <li>Render the code (next to the diagram, under the output directory, or to stdout)</li>
 * </ol>
 *
 * <p>A diagram that fails to compile produces no output; the error is reported and the remaining
 * diagrams are still compiled unless {@code --fail-fast} is given.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Compile every diagram below the current directory
 * fsmgen compile
 *
 * # Compile one diagram to stdout
 * fsmgen compile --stdout lights.puml
 * }</pre>
 */
@Command(
    name = "compile",
    description = "Compile state diagrams into state machine code",
    mixinStandardHelpOptions = true
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @Parameters(
        index = "0",
        description = "Project directory or single diagram file (default: current directory)",
        defaultValue = "."
    )
    private Path inputPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: fsmgen.yaml in the project directory)"
    )
    private Path configPath;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config; default: next to each diagram)"
    )
    private Path outputDir;

    @Option(
        names = {"-g", "--generator"},
        description = "Generator id (overrides config)"
    )
    private String generatorId;

    @Option(
        names = {"--strict"},
        description = "Reject states reopened under a different parent"
    )
    private boolean strict;

    @Option(
        names = {"--dry-run"},
        description = "Compile but don't write any output"
    )
    private boolean dryRun;

    @Option(
        names = {"--stdout"},
        description = "Print generated code instead of writing files"
    )
    private boolean stdout;

    @Option(
        names = {"--fail-fast"},
        description = "Stop at the first diagram that fails to compile"
    )
    private boolean failFast;

    @Override
    public Integer call() {
        Path root = (Files.isDirectory(inputPath) ? inputPath : inputPath.toAbsolutePath().getParent())
            .toAbsolutePath()
            .normalize();
        ProjectConfig config = loadConfiguration(root);

        DiagramCompiler compiler;
        List<Path> diagrams;
        try {
            compiler = createCompiler(config);
            diagrams = discoverDiagrams(root, config);
        } catch (IllegalArgumentException | IOException e) {
            log.error("Compilation setup failed: {}", e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return 1;
        }

        if (diagrams.isEmpty()) {
            System.err.println("⚠ WARNING: no diagrams matching '" + config.sources().include() + "' in " + root);
            return 0;
        }

        OutputRenderer renderer = findRenderer(stdout ? "console" : "filesystem");
        RenderContext context = new RenderContext(resolveOutputDirectory(root, config), config.output().settings());
        String extension = config.generator().extension() != null
            ? config.generator().extension()
            : compiler.getGenerator().getFileExtension();

        int compiled = 0;
        int failed = 0;
        for (Path diagram : diagrams) {
            try {
                GeneratedFile file = compileDiagram(compiler, root, diagram, extension, config);
                if (!dryRun) {
                    renderer.render(file, context);
                }
                compiled++;
                if (!stdout) {
                    System.out.println("✓ " + file.sourceId() + " → " + file.relativePath());
                }
            } catch (ModelException e) {
                failed++;
                log.error("Failed to compile {}: {}", diagram, e.getMessage());
                System.err.println("✗ " + e.getMessage());
            } catch (IOException | IllegalStateException | IllegalArgumentException e) {
                failed++;
                log.error("Failed to process {}", diagram, e);
                System.err.println("✗ " + diagram + ": " + e.getMessage());
            }
            if (failed > 0 && failFast) {
                break;
            }
        }

        log.info("Compiled {} of {} diagrams in {} ({} failed)", compiled, diagrams.size(), config.project().name(), failed);
        return failed == 0 ? 0 : 1;
    }

    private ProjectConfig loadConfiguration(Path root) {
        Path path = configPath != null ? configPath : root.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        return ConfigLoader.load(path);
    }

    private DiagramCompiler createCompiler(ProjectConfig config) {
        String id = generatorId != null ? generatorId : config.generator().id();
        ParserOptions options = strict ? new ParserOptions(true) : config.parser().toOptions();
        log.debug("Using generator {} (strictNesting={})", id, options.strictNesting());
        return DiagramCompiler.withGenerator(options, id);
    }

    private List<Path> discoverDiagrams(Path root, ProjectConfig config) throws IOException {
        if (Files.isRegularFile(inputPath)) {
            return List.of(inputPath.toAbsolutePath());
        }
        List<Path> diagrams = FileUtils.findFiles(root, config.sources().include());
        log.info("Discovered {} diagrams in {}", diagrams.size(), root);
        return diagrams;
    }

    private GeneratedFile compileDiagram(DiagramCompiler compiler, Path root, Path diagram, String extension,
                                         ProjectConfig config) throws IOException {
        Path relative = root.relativize(diagram.toAbsolutePath().normalize());
        String content = Files.readString(diagram, StandardCharsets.UTF_8);
        String name = FileUtils.getStem(diagram);

        DiagramSource source = new DiagramSource(relative.toString(), content, name);
        GeneratorConfig generatorConfig = new GeneratorConfig(name, config.generator().indent(), config.generator().comments());
        GeneratedCode code = compiler.compile(source, generatorConfig);

        Path target = FileUtils.withExtension(relative, extension);
        return new GeneratedFile(target.toString(), code.content(), source.sourceId());
    }

    private Path resolveOutputDirectory(Path root, ProjectConfig config) {
        if (outputDir != null) {
            return outputDir.toAbsolutePath().normalize();
        }
        if (config.output().directory() != null) {
            return root.resolve(config.output().directory()).normalize();
        }
        return root;
    }

    private static OutputRenderer findRenderer(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equals(id)) {
                return renderer;
            }
        }
        throw new IllegalStateException("Renderer not found: " + id);
    }
}
