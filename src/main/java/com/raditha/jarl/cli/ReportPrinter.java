package com.raditha.jarl.cli;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.raditha.jarl.analyzer.FileReport;
import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.model.TextEdit;
import com.raditha.jarl.syntax.LineIndex;
import com.raditha.jarl.syntax.LineIndex.SourceLocation;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the diagnostics of a run in one of the {@link OutputFormat}s.
 */
public class ReportPrinter {

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private final OutputFormat format;
    private final Path base;

    /**
     * @param format output format
     * @param base   directory file names are shown relative to
     */
    public ReportPrinter(OutputFormat format, Path base) {
        this.format = format;
        this.base = base.toAbsolutePath().normalize();
    }

    /**
     * DTOs of the JSON output.
     */
    public record JsonReport(List<JsonDiagnostic> diagnostics, List<JsonError> errors) {
    }

    public record JsonDiagnostic(
            JsonMessage message,
            String filename,
            int[] range,
            JsonLocation location,
            JsonLocation endLocation,
            JsonFix fix) {
    }

    public record JsonMessage(String name, String body, String suggestion) {
    }

    public record JsonLocation(int row, int column) {
    }

    public record JsonFix(String safety, List<JsonEdit> edits) {
    }

    public record JsonEdit(String content, int start, int end) {
    }

    public record JsonError(String filename, String message) {
    }

    public void print(List<FileReport> reports, PrintStream out) {
        switch (format) {
            case CONCISE -> printConcise(reports, out);
            case FULL -> printFull(reports, out);
            case JSON -> printJson(reports, out);
            case GITHUB -> printGithub(reports, out);
        }
    }

    private void printConcise(List<FileReport> reports, PrintStream out) {
        for (FileReport report : reports) {
            LineIndex index = report.lineIndex();
            for (Diagnostic d : report.diagnostics()) {
                SourceLocation loc = index.location(d.start());
                out.printf("%s [%d:%d] %s %s%n", displayName(report.path()), loc.line(), loc.column(), d.rule(),
                        messageWithSuggestion(d));
            }
        }
    }

    private void printFull(List<FileReport> reports, PrintStream out) {
        for (FileReport report : reports) {
            LineIndex index = report.lineIndex();
            String source = report.source();
            for (Diagnostic d : report.diagnostics()) {
                SourceLocation loc = index.location(d.start());
                String lineNumber = String.valueOf(loc.line());
                String gutter = " ".repeat(lineNumber.length());

                int lineStart = index.lineStart(loc.line());
                int lineEnd = source.indexOf('\n', lineStart);
                if (lineEnd < 0) {
                    lineEnd = source.length();
                }
                String line = source.substring(lineStart, lineEnd).stripTrailing();
                int underlineEnd = Math.min(d.range().end(), lineStart + line.length());
                int width = Math.max(1, underlineEnd - d.start());

                out.println("warning: " + d.rule());
                out.printf("%s--> %s:%d:%d%n", gutter, displayName(report.path()), loc.line(), loc.column());
                out.println(gutter + " |");
                out.println(lineNumber + " | " + line);
                out.println(gutter + " | " + " ".repeat(loc.column() - 1) + "-".repeat(width) + " " + d.message());
                out.println(gutter + " |");
                if (d.suggestion() != null) {
                    out.println(gutter + " = help: " + d.suggestion());
                }
                out.println();
            }
        }
    }

    private void printGithub(List<FileReport> reports, PrintStream out) {
        for (FileReport report : reports) {
            LineIndex index = report.lineIndex();
            String name = displayName(report.path());
            for (Diagnostic d : report.diagnostics()) {
                SourceLocation loc = index.location(d.start());
                out.printf("::warning title=Jarl (%s),file=%s,line=%d,col=%d::%s:%d:%d [%s] %s%n",
                        d.rule(), name, loc.line(), loc.column(), name, loc.line(), loc.column(), d.rule(),
                        messageWithSuggestion(d));
            }
        }
    }

    private void printJson(List<FileReport> reports, PrintStream out) {
        try {
            out.println(toJson(reports));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize diagnostics", e);
        }
    }

    public String toJson(List<FileReport> reports) throws JsonProcessingException {
        List<JsonDiagnostic> diagnostics = new ArrayList<>();
        List<JsonError> errors = new ArrayList<>();
        for (FileReport report : reports) {
            String name = displayName(report.path());
            if (report.failure() != null) {
                errors.add(new JsonError(name, report.failure().message()));
                continue;
            }
            LineIndex index = report.lineIndex();
            for (Diagnostic d : report.diagnostics()) {
                SourceLocation start = index.location(d.start());
                SourceLocation end = index.location(d.range().end());
                diagnostics.add(new JsonDiagnostic(
                        new JsonMessage(d.rule(), d.message(), d.suggestion()),
                        name,
                        new int[] {d.start(), d.range().end()},
                        new JsonLocation(start.line(), start.column()),
                        new JsonLocation(end.line(), end.column()),
                        toJsonFix(d)));
            }
        }
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(new JsonReport(diagnostics, errors));
    }

    private static JsonFix toJsonFix(Diagnostic d) {
        if (!d.hasFix()) {
            return null;
        }
        List<JsonEdit> edits = new ArrayList<>();
        for (TextEdit edit : d.fix().edits()) {
            edits.add(new JsonEdit(edit.replacement(), edit.range().start(), edit.range().end()));
        }
        return new JsonFix(d.fixSafety().name().toLowerCase(), edits);
    }

    private static String messageWithSuggestion(Diagnostic d) {
        return d.suggestion() == null ? d.message() : d.message() + " " + d.suggestion();
    }

    String displayName(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        Path shown = absolute.startsWith(base) ? base.relativize(absolute) : absolute;
        return shown.toString().replace('\\', '/');
    }
}
