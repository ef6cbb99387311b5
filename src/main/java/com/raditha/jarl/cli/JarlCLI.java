package com.raditha.jarl.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * Command-line interface for jarl.
 * <p>
 * Usage:
 * java -jar jarl.jar check [options] [paths...]
 * <p>
 * Configuration priority: CLI arguments > jarl.toml > defaults
 */
@Command(name = "jarl", mixinStandardHelpOptions = true, version = "jarl " + JarlCLI.VERSION,
        description = "A linter for R code", subcommands = {CheckCommand.class, CommandLine.HelpCommand.class})
@SuppressWarnings("java:S106")
public class JarlCLI implements Callable<Integer> {

    static final String VERSION = "0.1.0";

    static final int EXIT_OK = 0;
    static final int EXIT_DIAGNOSTICS = 1;
    static final int EXIT_CONFIG = 2;
    static final int EXIT_IO = 3;
    static final int EXIT_INTERRUPTED = 4;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    /**
     * Without a subcommand, show the usage.
     */
    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return EXIT_CONFIG;
    }

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /**
     * Run the CLI and return its exit code.
     */
    static int execute(String... args) {
        return createCommandLine().execute(args);
    }

    static CommandLine createCommandLine() {
        return createCommandLine(CommandLine.defaultFactory());
    }

    /**
     * Build the command line, creating subcommands through {@code factory}.
     */
    static CommandLine createCommandLine(CommandLine.IFactory factory) {
        CommandLine cmd = new CommandLine(new JarlCLI(), factory);

        // Configure error handling
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            // Handle execution exceptions with appropriate exit codes
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIG;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO;
            } else if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return EXIT_INTERRUPTED;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return EXIT_DIAGNOSTICS;
            }
        });

        // Configure parameter exception handler for better error messages
        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine failed = ex.getCommandLine();
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            failed.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, failed.getErr());
            failed.getErr().print(failed.getUsageMessage(colorScheme));
            return EXIT_CONFIG; // Invalid command line arguments
        });
        return cmd;
    }
}
