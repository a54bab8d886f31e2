package com.archebuild;

import com.archebuild.cli.GenerateCommand;
import com.archebuild.cli.ListCommand;
import com.archebuild.cli.ValidateCommand;
import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for ArcheBuild.
 *
 * <p>ArcheBuild generates residential archetype buildings from a handful of statistical
 * inputs and a type-element database, and reports their envelope.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Generate buildings and render their envelope reports</li>
 *   <li>{@code list} - List type-element records of the database</li>
 *   <li>{@code validate} - Check the database for inconsistencies</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all log output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # One building from flags, Markdown report on the console
 * archebuild generate --year 1965 --floors 2 --height 2.7 --area 140
 *
 * # All buildings of a configuration file, reports written to disk
 * archebuild -v generate -c archebuild.yaml --output build/reports
 *
 * # Outer wall records valid in 1965
 * archebuild list --category OuterWall --year 1965
 * }</pre>
 */
@Command(
    name = "archebuild",
    mixinStandardHelpOptions = true,
    version = "ArcheBuild 1.0.0-SNAPSHOT",
    description = "Residential archetype generator for building energy models",
    subcommands = {
        GenerateCommand.class,
        ListCommand.class,
        ValidateCommand.class
    }
)
public class ArcheBuildCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ArcheBuildCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all log output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("ArcheBuild - Residential Archetype Generator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'archebuild --help' to see available commands");
        System.out.println("Use 'archebuild <command> --help' for command-specific help");
    }

    /**
     * Sets the Logback root level from the global options. Runs before any subcommand.
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
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before the selected command runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        ArcheBuildCLI cli = new ArcheBuildCLI();
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
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
