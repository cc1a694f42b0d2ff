package com.fsmgen.cli;

import com.fsmgen.core.model.State;
import com.fsmgen.core.model.StateChart;
import com.fsmgen.core.model.Transition;
import com.fsmgen.core.parser.DiagramParser;
import com.fsmgen.core.parser.ModelException;
import com.fsmgen.core.parser.ParserOptions;
import com.fsmgen.core.resolver.DispatchTable;
import com.fsmgen.core.resolver.HierarchicalResolver;
import com.fsmgen.core.resolver.Resolution;
import com.fsmgen.core.resolver.ResolutionKind;
import com.fsmgen.core.resolver.ResolvedTransition;
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
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command to validate diagrams without generating code.
 *
 * <p>Prints a summary per diagram and, with {@code --table}, every (event, state) pair that has
 * an effect together with its exit chain, actions and entry chain. Only the parser and resolver
 * run, so no code generator has to be installed.
 */
@Command(
    name = "check",
    description = "Validate state diagrams and show their dispatch table",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Parameters(arity = "1..*", description = "Diagram files to check")
    private List<Path> diagrams;

    @Option(names = {"-t", "--table"}, description = "Print the resolved dispatch table")
    private boolean printTable;

    @Option(names = {"--strict"}, description = "Reject states reopened under a different parent")
    private boolean strict;

    @Override
    public Integer call() {
        DiagramParser parser = new DiagramParser(new ParserOptions(strict));
        HierarchicalResolver resolver = new HierarchicalResolver();
        int failed = 0;

        for (Path diagram : diagrams) {
            try {
                String content = Files.readString(diagram, StandardCharsets.UTF_8);
                DispatchTable table = resolver.resolveAll(parser.parse(diagram.toString(), content));
                printSummary(diagram, table);
                if (printTable) {
                    printTable(table);
                }
            } catch (ModelException e) {
                failed++;
                log.debug("Check failed for {}", diagram, e);
                System.err.println("✗ " + e.getMessage());
            } catch (IOException e) {
                failed++;
                log.error("Failed to read {}: {}", diagram, e.getMessage());
                System.err.println("✗ " + diagram + ": " + e.getMessage());
            }
        }

        return failed == 0 ? 0 : 1;
    }

    private void printSummary(Path diagram, DispatchTable table) {
        StateChart chart = table.chart();
        System.out.println("✓ " + diagram + ": "
            + chart.states().size() + " states, "
            + table.events().size() + " events, "
            + table.size() + " dispatch entries, initial state " + table.initialState().name());
        for (Transition transition : table.unreachable()) {
            System.out.println("  ⚠ " + transition.declaredAt().location() + ": "
                + chart.describe(transition) + " can never fire");
        }
    }

    private void printTable(DispatchTable table) {
        for (String event : table.events()) {
            for (Resolution resolution : table.resolutions(event)) {
                String prefix = "  " + event + " @ " + resolution.state().name() + ": ";
                if (resolution.kind() == ResolutionKind.INTERNAL) {
                    System.out.println(prefix + "internal, handled by " + resolution.handler().name());
                    continue;
                }
                for (ResolvedTransition candidate : resolution.transitions()) {
                    Transition transition = candidate.transition();
                    String guard = transition.isGuarded() ? "[" + transition.guard() + "] " : "";
                    System.out.println(prefix + guard
                        + "exit " + names(candidate.exitChain())
                        + ", do " + transition.actions()
                        + ", enter " + names(candidate.entryChain())
                        + " -> " + candidate.target().name());
                }
            }
        }
    }

    private static String names(List<State> states) {
        return states.stream().map(State::name).collect(Collectors.joining(", ", "[", "]"));
    }
}
