package com.raditha.jarl.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.jarl.analyzer.FileReport;
import com.raditha.jarl.model.Diagnostic;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregates per-rule counts of a lint run and exports them to CSV and JSON
 * for dashboard integration and historical tracking.
 */
public class LintStatistics {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .registerModule(new Jdk8Module())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Run-level statistics aggregated from all linted files.
     */
    public record RunMetrics(
            LocalDateTime timestamp,
            int totalFiles,
            int failedFiles,
            int totalDiagnostics,
            int fixable,
            int fixesApplied,
            int suppressed,
            List<RuleCount> rules) {
    }

    /**
     * Number of remaining diagnostics of one rule.
     *
     * @param fixable how many of them carry a fix
     */
    public record RuleCount(String rule, int count, int fixable) {
    }

    /**
     * Build aggregated metrics from lint reports.
     */
    public RunMetrics buildMetrics(List<FileReport> reports) {
        Map<String, int[]> counts = new TreeMap<>();
        int total = 0;
        int fixable = 0;
        int failed = 0;
        int applied = 0;
        int suppressed = 0;
        for (FileReport report : reports) {
            if (report.isFailure()) {
                failed++;
            }
            applied += report.fixesApplied();
            suppressed += report.suppressed();
            for (Diagnostic diagnostic : report.diagnostics()) {
                int[] entry = counts.computeIfAbsent(diagnostic.rule(), k -> new int[2]);
                entry[0]++;
                total++;
                if (diagnostic.hasFix()) {
                    entry[1]++;
                    fixable++;
                }
            }
        }

        List<RuleCount> rules = new ArrayList<>();
        counts.forEach((rule, entry) -> rules.add(new RuleCount(rule, entry[0], entry[1])));
        // most frequent first, then by name
        rules.sort(Comparator.comparingInt(RuleCount::count).reversed().thenComparing(RuleCount::rule));

        return new RunMetrics(
                LocalDateTime.now(),
                reports.size(),
                failed,
                total,
                fixable,
                applied,
                suppressed,
                rules);
    }

    /**
     * Human readable table of the per-rule counts.
     */
    public String formatTable(RunMetrics metrics) {
        StringBuilder sb = new StringBuilder();
        int width = metrics.rules().stream().mapToInt(r -> r.rule().length()).max().orElse(4);
        for (RuleCount count : metrics.rules()) {
            sb.append(String.format("%5d  %-" + width + "s%s%n",
                    count.count(),
                    count.rule(),
                    count.fixable() > 0 ? "  [*] " + count.fixable() + " fixable" : ""));
        }
        sb.append(String.format("Found %d error(s) in %d file(s).%n", metrics.totalDiagnostics(),
                metrics.totalFiles()));
        return sb.toString();
    }

    /**
     * Export metrics to CSV format.
     */
    public void exportToCsv(RunMetrics metrics, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();

        csv.append("# Run Summary\n");
        csv.append("timestamp,total_files,failed_files,total_diagnostics,fixable,fixes_applied,suppressed\n");
        csv.append(String.format("%s,%d,%d,%d,%d,%d,%d\n",
                metrics.timestamp().format(TIMESTAMP_FORMAT),
                metrics.totalFiles(),
                metrics.failedFiles(),
                metrics.totalDiagnostics(),
                metrics.fixable(),
                metrics.fixesApplied(),
                metrics.suppressed()));

        csv.append("\n");

        csv.append("# Per-Rule Counts\n");
        csv.append("rule,count,fixable\n");
        for (RuleCount count : metrics.rules()) {
            csv.append(String.format("%s,%d,%d\n", count.rule(), count.count(), count.fixable()));
        }

        Files.writeString(outputPath, csv.toString());
    }

    /**
     * Export metrics to JSON format.
     */
    public void exportToJson(RunMetrics metrics, Path outputPath) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), metrics);
    }

    public String toJson(RunMetrics metrics) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(metrics);
    }
}
