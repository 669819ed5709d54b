package com.hashhunt.cli;

import ch.qos.logback.classic.Level;
import com.hashhunt.cli.commands.DigestCommand;
import com.hashhunt.cli.commands.SearchCommand;
import com.hashhunt.cli.commands.VersionCommand;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * Hashhunt CLI - main entry point and command dispatcher.
 *
 * Root command with global options and subcommands for running searches
 * and computing digests.
 */
@Command(
    name = "hashhunt",
    description = "Hashhunt - parallel brute-force pre-image search",
    version = "Hashhunt v1.0-SNAPSHOT",
    mixinStandardHelpOptions = true,
    subcommands = {
        SearchCommand.class,
        DigestCommand.class,
        VersionCommand.class
    }
)
public class HashhuntCli implements Callable<Integer> { // Callable<Integer> to return an exit code

    /** Search ran (whether or not every target was found). */
    public static final int EXIT_OK = 0;
    /** Worker failure or I/O error (same as picocli's ExitCode.SOFTWARE). */
    public static final int EXIT_FAILURE = 1;
    /** Invalid options, target file or algorithm (same as picocli's ExitCode.USAGE). */
    public static final int EXIT_CONFIG_ERROR = 2;

    // Global, so it can be given before any subcommand
    @Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output (DEBUG logging)"
    )
    private boolean verbose;

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    /**
     * Creates the configured command line. Applies the verbosity flag before
     * the selected subcommand runs.
     */
    public static CommandLine newCommandLine() {
        HashhuntCli cli = new HashhuntCli();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.applyVerbosity();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    @Override
    public Integer call() {
        // No subcommand: show usage
        new CommandLine(this).usage(System.out);
        return EXIT_OK;
    }

    private void applyVerbosity() {
        if (verbose && LoggerFactory.getLogger("com.hashhunt") instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.hashhunt")).setLevel(Level.DEBUG);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }
}
