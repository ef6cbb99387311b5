package com.raditha.jarl.cli;

import ch.qos.logback.classic.Level;
import com.raditha.jarl.analyzer.BatchLinter;
import com.raditha.jarl.analyzer.FileReport;
import com.raditha.jarl.analyzer.LintAnalyzer;
import com.raditha.jarl.analyzer.SourceFileFinder;
import com.raditha.jarl.config.JarlConfig;
import com.raditha.jarl.config.JarlSettings;
import com.raditha.jarl.fix.DiffGenerator;
import com.raditha.jarl.fix.FixPolicy;
import com.raditha.jarl.metrics.LintStatistics;
import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.model.FixSafety;
import com.raditha.jarl.rules.RuleTable;
import com.raditha.jarl.vcs.VersionControlGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * {@code jarl check}: lint, and optionally fix, R files.
 */
@Command(name = "check", mixinStandardHelpOptions = true, description = "Check R files for lints")
@SuppressWarnings("java:S106")
public class CheckCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(CheckCommand.class);

    @Parameters(arity = "0..*", paramLabel = "<path>", description = "Files or directories to check (default: .)")
    private List<Path> paths = new ArrayList<>();

    @Option(names = "--fix", description = "Apply safe fixes")
    private boolean fix = false;

    @Option(names = "--unsafe-fixes", description = "Include fixes that may change behaviour")
    private boolean unsafeFixes = false;

    @Option(names = "--fix-only", description = "Apply fixes without reporting the remaining diagnostics")
    private boolean fixOnly = false;

    @Option(names = "--allow-dirty", description = "Apply fixes even if the git working tree has uncommitted changes")
    private boolean allowDirty = false;

    @Option(names = "--allow-no-vcs", description = "Apply fixes even outside a git repository")
    private boolean allowNoVcs = false;

    @Option(names = "--select", split = ",", paramLabel = "<rule>", description = "Rules or categories to enable")
    private List<String> select;

    @Option(names = "--extend-select", split = ",", paramLabel = "<rule>",
            description = "Rules or categories to enable in addition to the selection")
    private List<String> extendSelect;

    @Option(names = "--ignore", split = ",", paramLabel = "<rule>", description = "Rules or categories to disable")
    private List<String> ignore;

    @Option(names = "--min-r-version", paramLabel = "<version>",
            description = "Oldest R version the code must run on, e.g. 4.1")
    private String minRVersion;

    @Option(names = "--output-format", paramLabel = "<format>", converter = OutputFormatConverter.class,
            description = "Output format: concise, full, json or github (default: full)")
    private OutputFormat outputFormat = OutputFormat.FULL;

    @Option(names = "--statistics", description = "Show counts per rule instead of each diagnostic")
    private boolean statistics = false;

    @Option(names = "--diff", description = "Show the fixes as a unified diff without writing them")
    private boolean diff = false;

    @Option(names = "--no-default-exclude", description = "Also check files excluded by default")
    private boolean noDefaultExclude = false;

    @Option(names = "--config-file", paramLabel = "<path>", description = "Use custom configuration file")
    private Path configFile;

    @Option(names = "--log-level", paramLabel = "<level>", description = "Log level: error, warn, info, debug, trace")
    private String logLevel;

    private PrintStream out = System.out;
    private PrintStream err = System.err;
    private Path workingDirectory = Path.of("").toAbsolutePath();

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code
     */
    @Override
    public Integer call() throws IOException, InterruptedException {
        validateConfiguration();
        if (logLevel != null) {
            setLogLevel(logLevel);
        }

        RuleTable table = RuleTable.defaults();
        JarlConfig config = new JarlSettings(table).loadConfig(workingDirectory, configFile,
                new JarlSettings.Overrides(select, extendSelect, ignore, minRVersion,
                        noDefaultExclude ? Boolean.FALSE : null));

        List<Path> roots = paths.isEmpty() ? List.of(workingDirectory) : resolve(paths);
        List<Path> files = new SourceFileFinder(config, workingDirectory).find(roots);
        logger.info("Checking {} file(s)", files.size());

        FixPolicy policy = FixPolicy.from(fix || fixOnly || diff, unsafeFixes);
        if (policy != FixPolicy.NONE && !diff) {
            VersionControlGuard.GuardResult guard = new VersionControlGuard(allowDirty, allowNoVcs)
                    .check(workingDirectory);
            if (!guard.allowed()) {
                err.println("Error: " + guard.message());
                return JarlCLI.EXIT_CONFIG;
            }
        }

        LintAnalyzer analyzer = new LintAnalyzer(table, config, policy);
        List<FileReport> reports = new BatchLinter(analyzer).lint(files);

        for (FileReport report : reports) {
            if (report.isFailure()) {
                err.println("Error: Failed to parse " + displayName(report.path()) + " due to syntax errors.");
            }
        }

        if (diff) {
            return printDiffs(reports);
        }
        int fixed = writeFixes(reports);

        List<FileReport> analyzed = reports.stream().filter(r -> !r.isFailure()).toList();
        int remaining = analyzed.stream().mapToInt(r -> r.diagnostics().size()).sum();

        if (fixOnly) {
            if (fixed > 0) {
                out.printf("Fixed %d error(s).%n", fixed);
            }
            return JarlCLI.EXIT_OK;
        }

        if (statistics) {
            LintStatistics stats = new LintStatistics();
            LintStatistics.RunMetrics metrics = stats.buildMetrics(reports);
            if (outputFormat == OutputFormat.JSON) {
                out.println(stats.toJson(metrics));
            } else {
                out.print(stats.formatTable(metrics));
            }
        } else {
            new ReportPrinter(outputFormat, workingDirectory).print(analyzed, out);
            if (outputFormat == OutputFormat.CONCISE || outputFormat == OutputFormat.FULL) {
                printSummary(analyzed, remaining, fixed);
            }
        }
        return remaining > 0 ? JarlCLI.EXIT_DIAGNOSTICS : JarlCLI.EXIT_OK;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (configFile != null && !Files.isRegularFile(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        if (diff && fixOnly) {
            throw new IllegalArgumentException("Cannot use both --diff and --fix-only");
        }
        if (logLevel != null && Level.toLevel(logLevel, null) == null) {
            throw new IllegalArgumentException("Invalid log level: " + logLevel);
        }
    }

    private static void setLogLevel(String level) {
        ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger) LoggerFactory
                .getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.toLevel(level));
    }

    private List<Path> resolve(List<Path> given) {
        List<Path> resolved = new ArrayList<>();
        for (Path path : given) {
            resolved.add(workingDirectory.resolve(path));
        }
        return resolved;
    }

    private int printDiffs(List<FileReport> reports) {
        DiffGenerator generator = new DiffGenerator();
        int changed = 0;
        for (FileReport report : reports) {
            if (report.isFixed()) {
                out.println(generator.generateUnifiedDiff(displayName(report.path()), report.originalSource(),
                        report.source()));
                out.println();
                changed++;
            }
        }
        if (changed == 0) {
            out.println("No fixes available.");
        }
        return changed > 0 ? JarlCLI.EXIT_DIAGNOSTICS : JarlCLI.EXIT_OK;
    }

    private int writeFixes(List<FileReport> reports) throws IOException {
        int fixed = 0;
        for (FileReport report : reports) {
            if (report.isFixed()) {
                Files.writeString(report.path(), report.source(), StandardCharsets.UTF_8);
                logger.debug("Wrote {} fix(es) to {}", report.fixesApplied(), report.path());
                fixed += report.fixesApplied();
            }
        }
        return fixed;
    }

    private void printSummary(List<FileReport> reports, int remaining, int fixed) {
        if (remaining == 0) {
            if (fixed > 0) {
                out.printf("Found %d error%s (%d fixed, 0 remaining).%n", fixed, plural(fixed), fixed);
            } else {
                out.println("All checks passed!");
            }
            return;
        }
        if (fixed > 0) {
            out.printf("Found %d error%s (%d fixed, %d remaining).%n", remaining + fixed, plural(remaining + fixed),
                    fixed, remaining);
        } else {
            out.printf("Found %d error%s.%n", remaining, plural(remaining));
        }

        int safe = 0;
        int unsafe = 0;
        for (FileReport report : reports) {
            for (Diagnostic d : report.diagnostics()) {
                if (d.fixSafety() == FixSafety.SAFE) {
                    safe++;
                } else if (d.fixSafety() == FixSafety.UNSAFE) {
                    unsafe++;
                }
            }
        }
        int fixable = unsafeFixes ? safe + unsafe : safe;
        if (!unsafeFixes && unsafe > 0) {
            out.printf("%d fixable with the `--fix` option (%d hidden fix%s can be enabled with the "
                    + "`--unsafe-fixes` option).%n", fixable, unsafe, unsafe == 1 ? "" : "es");
        } else if (fixable > 0) {
            out.printf("%d fixable with the `--fix` option.%n", fixable);
        }
    }

    private static String plural(int n) {
        return n == 1 ? "" : "s";
    }

    private String displayName(Path path) {
        return new ReportPrinter(outputFormat, workingDirectory).displayName(path);
    }

    /**
     * Redirect output, used by tests.
     */
    void setStreams(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    void setWorkingDirectory(Path directory) {
        this.workingDirectory = directory.toAbsolutePath().normalize();
    }

    static class OutputFormatConverter implements CommandLine.ITypeConverter<OutputFormat> {
        @Override
        public OutputFormat convert(String value) {
            return OutputFormat.fromString(value);
        }
    }
}
