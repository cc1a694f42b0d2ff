package com.fsmgen;

import ch.qos.logback.classic.Level;
import com.fsmgen.cli.CheckCommand;
import com.fsmgen.cli.CompileCommand;
import com.fsmgen.cli.ListCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for fsmgen.
 *
 * <p>fsmgen compiles PlantUML hierarchical state diagrams into state machine dispatch code.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code compile} - Compile all diagrams of a project (or single diagram files)</li>
 *   <li>{@code check} - Validate diagrams and show how events are dispatched</li>
 *   <li>{@code list} - List available generators or renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Compile every diagram below the current directory
 * fsmgen compile
 *
 * # Check one diagram and print its dispatch table
 * fsmgen check --table lights.puml
 * }</pre>
 */
@Command(
    name = "fsmgen",
    mixinStandardHelpOptions = true,
    version = "fsmgen 1.0.0-SNAPSHOT",
    description = "Compiles PlantUML state diagrams into state machine code",
    subcommands = {
        CompileCommand.class,
        CheckCommand.class,
        ListCommand.class
    }
)
public class FsmGenCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(FsmGenCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)", scope = CommandLine.ScopeType.INHERIT)
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors", scope = CommandLine.ScopeType.INHERIT)
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("fsmgen - PlantUML state machine compiler");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'fsmgen --help' to see available commands");
        System.out.println("Use 'fsmgen <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line, applying the global logging options before any command runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        FsmGenCLI cli = new FsmGenCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
