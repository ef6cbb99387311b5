package com.raditha.jarl.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.jarl.analyzer.FileReport;
import com.raditha.jarl.analyzer.LintAnalyzer;
import com.raditha.jarl.config.JarlConfig;
import com.raditha.jarl.rules.RuleTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ReportPrinter - one test per output format.
 */
class ReportPrinterTest {

    @TempDir
    Path dir;

    private List<FileReport> reports;

    @BeforeEach
    void setUp() {
        RuleTable table = RuleTable.defaults();
        LintAnalyzer analyzer = new LintAnalyzer(table, JarlConfig.defaults(table));
        reports = List.of(
                analyzer.analyze(dir.resolve("R/a.R"), "x <- 1\ny <- any(is.na(x))\n"),
                analyzer.analyze(dir.resolve("R/bad.R"), "x <- (\n"));
    }

    private String print(OutputFormat format) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        new ReportPrinter(format, dir).print(reports, out);
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testConcise() {
        assertEquals("R/a.R [2:6] any_is_na `any(is.na(...))` is inefficient. Use `anyNA(...)` instead."
                + System.lineSeparator(), print(OutputFormat.CONCISE));
    }

    @Test
    void testFull() {
        String output = print(OutputFormat.FULL);
        assertTrue(output.contains("warning: any_is_na"));
        assertTrue(output.contains(" --> R/a.R:2:6"));
        assertTrue(output.contains("2 | y <- any(is.na(x))"));
        assertTrue(output.contains("  |      ------------- `any(is.na(...))` is inefficient."));
        assertTrue(output.contains("= help: Use `anyNA(...)` instead."));
    }

    @Test
    void testGithub() {
        String output = print(OutputFormat.GITHUB).trim();
        assertEquals("::warning title=Jarl (any_is_na),file=R/a.R,line=2,col=6::R/a.R:2:6 [any_is_na] "
                + "`any(is.na(...))` is inefficient. Use `anyNA(...)` instead.", output);
    }

    @Test
    void testJson() throws IOException {
        JsonNode root = new ObjectMapper().readTree(new ReportPrinter(OutputFormat.JSON, dir).toJson(reports));

        JsonNode diagnostic = root.get("diagnostics").get(0);
        assertEquals("any_is_na", diagnostic.get("message").get("name").asText());
        assertEquals("R/a.R", diagnostic.get("filename").asText());
        assertEquals(12, diagnostic.get("range").get(0).asInt());
        assertEquals(2, diagnostic.get("location").get("row").asInt());
        assertEquals(6, diagnostic.get("location").get("column").asInt());
        assertEquals("safe", diagnostic.get("fix").get("safety").asText());
        assertEquals("anyNA(x)", diagnostic.get("fix").get("edits").get(0).get("content").asText());

        JsonNode error = root.get("errors").get(0);
        assertEquals("R/bad.R", error.get("filename").asText());
        assertTrue(error.get("message").asText().startsWith("Failed to parse: "));
    }

    @Test
    void testDisplayNameOutsideBase() {
        ReportPrinter printer = new ReportPrinter(OutputFormat.CONCISE, dir.resolve("sub"));
        Path outside = dir.resolve("other.R").toAbsolutePath().normalize();
        assertEquals(outside.toString().replace('\\', '/'), printer.displayName(outside));
    }
}
