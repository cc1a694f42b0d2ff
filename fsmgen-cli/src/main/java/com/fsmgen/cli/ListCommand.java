package com.fsmgen.cli;

import com.fsmgen.core.generator.CodeGenerator;
import com.fsmgen.core.renderer.OutputRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available generators or renderers.
 *
 * <p>Discovers plugins via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * fsmgen list generators
 * fsmgen list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available generators or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: generators or renderers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase()) {
            case "generators", "generator" -> listGenerators();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: generators or renderers", type);
                yield 1;
            }
        };
    }

    private int listGenerators() {
        System.out.println("Available Generators:");
        System.out.println();

        for (CodeGenerator generator : ServiceLoader.load(CodeGenerator.class)) {
            System.out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            System.out.printf("    File Extension: .%s%n", generator.getFileExtension());
            System.out.println();
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            System.out.printf("  • %s%n", renderer.getId());
        }
        return 0;
    }
}
