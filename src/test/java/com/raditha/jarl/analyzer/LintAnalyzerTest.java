package com.raditha.jarl.analyzer;

import com.raditha.jarl.config.JarlConfig;
import com.raditha.jarl.fix.FixPolicy;
import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.model.FixSafety;
import com.raditha.jarl.rules.RuleNames;
import com.raditha.jarl.rules.RuleTable;
import com.raditha.jarl.syntax.ParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LintAnalyzer - the parse, check, suppress and fix pipeline.
 */
class LintAnalyzerTest {

    private static final Path R_FILE = Path.of("R/code.R");

    @TempDir
    Path dir;

    private RuleTable table;
    private JarlConfig config;

    @BeforeEach
    void setUp() {
        table = RuleTable.defaults();
        config = JarlConfig.defaults(table);
    }

    @Test
    void testReportsWithoutFixing() {
        String source = "x <- any(is.na(y))\n";
        FileReport report = new LintAnalyzer(table, config).analyze(R_FILE, source);

        assertFalse(report.isFailure());
        assertEquals(1, report.diagnostics().size());
        assertEquals(RuleNames.ANY_IS_NA, report.diagnostics().get(0).rule());
        assertEquals(source, report.source());
        assertFalse(report.isFixed());
        assertEquals(0, report.fixesApplied());
    }

    @Test
    void testSafeFixes() {
        String source = "x <- any(is.na(y))\nz <- .5\n";
        FileReport report = new LintAnalyzer(table, config, FixPolicy.SAFE).analyze(R_FILE, source);

        assertEquals("x <- anyNA(y)\nz <- 0.5\n", report.source());
        assertEquals(source, report.originalSource());
        assertEquals(2, report.fixesApplied());
        assertTrue(report.diagnostics().isEmpty());
        assertTrue(report.isFixed());
    }

    @Test
    void testConflictingFixesResolvedOverPasses() {
        FileReport report = new LintAnalyzer(table, config, FixPolicy.SAFE).analyze(R_FILE, "any(is.na(x == NA))\n");

        assertEquals("anyNA(is.na(x))\n", report.source());
        assertEquals(2, report.fixesApplied());
        assertTrue(report.diagnostics().isEmpty());
    }

    @Test
    void testUnsafeFixesNeedPolicy() {
        String source = "if (class(x) == \"foo\") 1\n";

        FileReport safe = new LintAnalyzer(table, config, FixPolicy.SAFE).analyze(R_FILE, source);
        assertEquals(source, safe.source());
        assertEquals(FixSafety.UNSAFE, safe.diagnostics().get(0).fixSafety());

        FileReport all = new LintAnalyzer(table, config, FixPolicy.ALL).analyze(R_FILE, source);
        assertEquals("if (inherits(x, \"foo\")) 1\n", all.source());
    }

    @Test
    void testUnfixableRule() {
        JarlConfig restricted = new JarlConfig(config.enabledRules(), Set.of(RuleNames.NUMERIC_LEADING_ZERO), null,
                List.of(), true, config.ruleOptions());
        FileReport report = new LintAnalyzer(table, restricted, FixPolicy.SAFE)
                .analyze(R_FILE, "any(is.na(x)) + .5\n");

        assertEquals("any(is.na(x)) + 0.5\n", report.source());
        assertEquals(List.of(RuleNames.ANY_IS_NA), report.diagnostics().stream().map(Diagnostic::rule).toList());
    }

    @Test
    void testSuppressedCount() {
        FileReport report = new LintAnalyzer(table, config)
                .analyze(R_FILE, "# jarl-ignore browser: interactive helper\nbrowser()\n");
        assertTrue(report.diagnostics().isEmpty());
        assertEquals(1, report.suppressed());
    }

    @Test
    void testParseError() {
        FileReport report = new LintAnalyzer(table, config, FixPolicy.SAFE).analyze(R_FILE, "x <- (\n");

        assertTrue(report.isFailure());
        assertEquals(RuleNames.PARSE_ERROR, report.failure().rule());
        assertTrue(report.failure().message().startsWith("Failed to parse: "));
        assertTrue(report.diagnostics().isEmpty());
        assertFalse(report.isFixed());
    }

    @Test
    void testUnreadableFile() {
        FileReport report = new LintAnalyzer(table, config).analyzeFile(dir.resolve("missing.R"));
        assertTrue(report.isFailure());
        assertEquals(RuleNames.IO_ERROR, report.failure().rule());
    }

    @Test
    void testAnalyzeFile() throws IOException {
        Path file = dir.resolve("a.R");
        Files.writeString(file, "browser()\n");
        FileReport report = new LintAnalyzer(table, config).analyzeFile(file);
        assertEquals(file, report.path());
        assertEquals(List.of(RuleNames.BROWSER), report.diagnostics().stream().map(Diagnostic::rule).toList());
    }

    @Test
    void testRmdOffsetsAndFixes() {
        String doc = """
                # Analysis

                ```{r}
                any(is.na(x))
                ```

                ```r
                any(is.na(y))
                ```
                """;
        Path path = Path.of("report.Rmd");

        FileReport report = new LintAnalyzer(table, config).analyze(path, doc);
        assertEquals(1, report.diagnostics().size());
        assertEquals(doc.indexOf("any(is.na(x))"), report.diagnostics().get(0).start());

        FileReport fixed = new LintAnalyzer(table, config, FixPolicy.SAFE).analyze(path, doc);
        assertEquals(doc.replace("any(is.na(x))", "anyNA(x)"), fixed.source());
    }

    @Test
    void testRmdParseErrorOffset() {
        String doc = "Intro\n\n```{r}\nx <- (\n```\n";
        FileReport report = new LintAnalyzer(table, config).analyze(Path.of("a.qmd"), doc);
        assertTrue(report.isFailure());
        assertTrue(report.failure().start() >= doc.indexOf("x <- ("));
    }

    @Test
    void testChunkSuppression() throws ParseException {
        String doc = "```{r}\n#| jarl-ignore-chunk:\n#|   - browser: demo of the debugger\nbrowser()\n```\n";
        assertTrue(new LintAnalyzer(table, config).lintText(doc, true).isEmpty());
    }

    @Test
    void testLintText() throws ParseException {
        LintAnalyzer analyzer = new LintAnalyzer(table, config);
        assertEquals(1, analyzer.lintText("x == NA", false).size());
        assertThrows(ParseException.class, () -> analyzer.lintText("f(", false));
    }
}
