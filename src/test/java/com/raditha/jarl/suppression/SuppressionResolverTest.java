package com.raditha.jarl.suppression;

import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.rules.RuleEngine;
import com.raditha.jarl.rules.RuleNames;
import com.raditha.jarl.rules.RuleOptions;
import com.raditha.jarl.rules.RuleRegistry;
import com.raditha.jarl.rules.RuleTable;
import com.raditha.jarl.syntax.ParseException;
import com.raditha.jarl.syntax.RParser;
import com.raditha.jarl.syntax.SyntaxNode;
import com.raditha.jarl.syntax.SyntaxTree;
import com.raditha.jarl.syntax.TextRange;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SuppressionResolver - placement, pairing and meta diagnostics.
 */
class SuppressionResolverTest {

    private static final RuleTable TABLE = RuleTable.defaults();

    private static SuppressionResult resolve(String source, Set<String> enabled, boolean inChunk)
            throws ParseException {
        SyntaxTree tree = RParser.parse(source);
        List<Diagnostic> raw = new RuleEngine(RuleRegistry.defaults(TABLE), enabled, null, RuleOptions.defaults())
                .run(tree);
        return new SuppressionResolver(TABLE, enabled).resolve(tree, raw, inChunk);
    }

    private static SuppressionResult resolve(String source) throws ParseException {
        return resolve(source, TABLE.names(), false);
    }

    private static List<String> rules(SuppressionResult result) {
        return result.diagnostics().stream().map(Diagnostic::rule).toList();
    }

    @Test
    void testNoDirectives() throws ParseException {
        SuppressionResult result = resolve("any(is.na(x))");
        assertEquals(List.of(RuleNames.ANY_IS_NA), rules(result));
        assertEquals(0, result.suppressed());
        assertTrue(result.directives().isEmpty());
    }

    @Test
    void testStandardSuppressesNextNodeOnly() throws ParseException {
        String source = """
                # jarl-ignore any_is_na: legacy code
                any(is.na(x))
                any(is.na(y))
                """;
        SuppressionResult result = resolve(source);
        assertEquals(1, result.suppressed());
        assertEquals(1, result.diagnostics().size());
        assertEquals(source.indexOf("any(is.na(y))"), result.diagnostics().get(0).start());
    }

    @Test
    void testStandardOnlyMatchingRule() throws ParseException {
        SuppressionResult result = resolve("# jarl-ignore browser: wrong rule\nany(is.na(x))");
        assertEquals(List.of(RuleNames.ANY_IS_NA, RuleNames.OUTDATED_SUPPRESSION), rules(result));
    }

    @Test
    void testStandardInsideFunction() throws ParseException {
        String source = """
                f <- function(x) {
                  # jarl-ignore any_is_na: checked upstream
                  any(is.na(x))
                  any(is.na(x))
                }
                """;
        SuppressionResult result = resolve(source);
        assertEquals(1, result.suppressed());
        assertEquals(List.of(RuleNames.ANY_IS_NA), rules(result));
    }

    @Test
    void testStandardCoversWholeNode() throws ParseException {
        String source = """
                # jarl-ignore equals_na: kept for compatibility
                f <- function(x) {
                  if (x == NA) 1
                  y == NA
                }
                """;
        SuppressionResult result = resolve(source);
        assertEquals(2, result.suppressed());
        assertTrue(result.diagnostics().isEmpty());
    }

    @Test
    void testRangeSuppression() throws ParseException {
        String source = """
                # jarl-ignore-start any_is_na: generated
                any(is.na(x))
                any(is.na(y))
                # jarl-ignore-end any_is_na
                any(is.na(z))
                """;
        SuppressionResult result = resolve(source);
        assertEquals(2, result.suppressed());
        assertEquals(1, result.diagnostics().size());
        assertEquals(source.indexOf("any(is.na(z))"), result.diagnostics().get(0).start());
    }

    @Test
    void testRangeEndsMustShareDepth() throws ParseException {
        String source = """
                # jarl-ignore-start browser: debugging
                f <- function() {
                  browser()
                  # jarl-ignore-end browser
                }
                """;
        SuppressionResult result = resolve(source);
        assertEquals(List.of(RuleNames.BROWSER, RuleNames.UNMATCHED_RANGE_SUPPRESSION,
                RuleNames.UNMATCHED_RANGE_SUPPRESSION), rules(result));
        assertEquals(MetaDiagnostics.UNMATCHED_START, result.diagnostics().get(1).message());
        assertEquals(MetaDiagnostics.UNMATCHED_END, result.diagnostics().get(2).message());
    }

    @Test
    void testNestedRanges() throws ParseException {
        String source = """
                # jarl-ignore-start browser: outer
                f <- function() {
                  # jarl-ignore-start browser: inner
                  browser()
                  # jarl-ignore-end browser
                }
                # jarl-ignore-end browser
                """;
        SuppressionResult result = resolve(source);
        assertTrue(result.diagnostics().isEmpty(), () -> "unexpected: " + rules(result));
        assertEquals(1, result.suppressed());
        assertTrue(result.directives().stream().allMatch(SuppressionDirective::isValid));
    }

    @Test
    void testUnexplainedStartDoesNotSuppressThroughValidEnd() throws ParseException {
        String source = """
                # jarl-ignore-start any_is_na
                any(is.na(x))
                # jarl-ignore-end any_is_na
                """;
        SuppressionResult result = resolve(source);
        assertEquals(0, result.suppressed());
        assertEquals(List.of(RuleNames.ANY_IS_NA, RuleNames.UNEXPLAINED_SUPPRESSION), rules(result));
    }

    @Test
    void testFileSuppression() throws ParseException {
        String source = """
                # jarl-ignore-file any_is_na: data checks
                x <- 1
                f <- function() any(is.na(x))
                any(is.na(x))
                """;
        SuppressionResult result = resolve(source);
        assertEquals(2, result.suppressed());
        assertTrue(result.diagnostics().isEmpty());
    }

    @Test
    void testMisplacedFileSuppression() throws ParseException {
        String source = """
                x <- 1
                # jarl-ignore-file any_is_na: too late
                any(is.na(x))
                """;
        SuppressionResult result = resolve(source);
        assertEquals(0, result.suppressed());
        assertEquals(List.of(RuleNames.ANY_IS_NA, RuleNames.MISPLACED_FILE_SUPPRESSION), rules(result));
        assertEquals(MetaDiagnostics.MISPLACED_FILE, result.diagnostics().get(1).message());
    }

    @Test
    void testInvalidDirectivesDoNotSuppress() throws ParseException {
        assertEquals(List.of(RuleNames.ANY_IS_NA, RuleNames.BLANKET_SUPPRESSION),
                rules(resolve("# jarl-ignore\nany(is.na(x))")));
        assertEquals(List.of(RuleNames.ANY_IS_NA, RuleNames.MISNAMED_SUPPRESSION),
                rules(resolve("# jarl-ignore any_isna: typo\nany(is.na(x))")));
        assertEquals(List.of(RuleNames.ANY_IS_NA, RuleNames.UNEXPLAINED_SUPPRESSION),
                rules(resolve("# jarl-ignore any_is_na\nany(is.na(x))")));
    }

    @Test
    void testBlanketWithReasonDoesNotSuppress() throws ParseException {
        SuppressionResult result = resolve("# jarl-ignore: legacy\nany(is.na(x))");
        assertEquals(List.of(RuleNames.ANY_IS_NA, RuleNames.BLANKET_SUPPRESSION), rules(result));
        assertEquals(0, result.suppressed());
        assertEquals(0, result.diagnostics().get(1).start());
    }

    @Test
    void testBlanketRangeStartIsReported() throws ParseException {
        String source = "# jarl-ignore-start: legacy\nany(is.na(x))\n# jarl-ignore-end any_is_na\n";
        SuppressionResult result = resolve(source);
        assertEquals(List.of(RuleNames.ANY_IS_NA, RuleNames.BLANKET_SUPPRESSION,
                RuleNames.UNMATCHED_RANGE_SUPPRESSION), rules(result));
    }

    @Test
    void testStandardSuppressesUnreachableRegionStartingAtTarget() throws ParseException {
        String source = """
                f <- function() {
                  return(1)
                  # jarl-ignore unreachable_code: kept on purpose
                  x <- 2
                  y <- 3
                }
                """;
        SuppressionResult result = resolve(source);
        assertTrue(result.diagnostics().isEmpty(), () -> "diagnostics: " + result.diagnostics());
        assertEquals(1, result.suppressed());
    }

    @Test
    void testStandardDoesNotReachIntoLaterRegion() throws ParseException {
        String source = """
                f <- function() {
                  # jarl-ignore unreachable_code: wrong place
                  a <- 1
                  return(a)
                  b <- 2
                }
                """;
        SuppressionResult result = resolve(source);
        assertEquals(List.of(RuleNames.UNREACHABLE_CODE, RuleNames.OUTDATED_SUPPRESSION), rules(result));
    }

    @Test
    void testMisplacedTrailingDirective() throws ParseException {
        SuppressionResult result = resolve("any(is.na(x)) # jarl-ignore any_is_na: inline");
        assertEquals(List.of(RuleNames.ANY_IS_NA, RuleNames.MISPLACED_SUPPRESSION), rules(result));
        Diagnostic meta = result.diagnostics().get(1);
        assertEquals(MetaDiagnostics.MISPLACED, meta.message());
        assertNotNull(meta.suggestion());
    }

    @Test
    void testOutdated() throws ParseException {
        SuppressionResult result = resolve("# jarl-ignore browser: old debugging\nx <- 1");
        assertEquals(List.of(RuleNames.OUTDATED_SUPPRESSION), rules(result));
        assertEquals(MetaDiagnostics.OUTDATED, result.diagnostics().get(0).message());
    }

    @Test
    void testNotOutdatedWhenRuleDisabled() throws ParseException {
        Set<String> enabled = new HashSet<>(TABLE.names());
        enabled.remove(RuleNames.BROWSER);
        assertTrue(resolve("# jarl-ignore browser: old debugging\nbrowser()", enabled, false)
                .diagnostics().isEmpty());
    }

    @Test
    void testMetaRulesCanBeDisabled() throws ParseException {
        Set<String> enabled = Set.of(RuleNames.ANY_IS_NA);
        SuppressionResult result = resolve("# jarl-ignore\nany(is.na(x))\n# jarl-ignore browser: x\ny", enabled,
                false);
        assertEquals(List.of(RuleNames.ANY_IS_NA), rules(result));
    }

    @Test
    void testChunkSuppression() throws ParseException {
        String source = """
                #| jarl-ignore-chunk:
                #|   - any_is_na: exploratory analysis
                any(is.na(x))
                f <- function() any(is.na(y))
                """;
        SuppressionResult inChunk = resolve(source, TABLE.names(), true);
        assertEquals(2, inChunk.suppressed());
        assertTrue(inChunk.diagnostics().isEmpty());

        SuppressionResult plain = resolve(source, TABLE.names(), false);
        assertEquals(0, plain.suppressed());
        assertEquals(List.of(RuleNames.ANY_IS_NA, RuleNames.ANY_IS_NA, RuleNames.INVALID_CHUNK_SUPPRESSION),
                rules(plain));
    }

    @Test
    void testMetaDiagnosticsAfterKept() throws ParseException {
        String source = """
                # jarl-ignore
                x <- 1
                browser()
                """;
        assertEquals(List.of(RuleNames.BROWSER, RuleNames.BLANKET_SUPPRESSION), rules(resolve(source)));
    }

    @Test
    void testDepthOf() throws ParseException {
        String source = "f <- function() {\n  if (x) {\n    # deep\n    y\n  }\n  # shallow\n}\n# top";
        SyntaxNode root = RParser.parse(source).root();
        assertEquals(2, SuppressionResolver.depthOf(root, comment(source, "# deep")));
        assertEquals(1, SuppressionResolver.depthOf(root, comment(source, "# shallow")));
        assertEquals(0, SuppressionResolver.depthOf(root, comment(source, "# top")));
    }

    @Test
    void testTargetOf() throws ParseException {
        String source = "a\n# here\nb + c\n# nothing after";
        SyntaxNode root = RParser.parse(source).root();
        assertEquals("b + c", SuppressionResolver.targetOf(root, comment(source, "# here")).text());
        assertNull(SuppressionResolver.targetOf(root, comment(source, "# nothing after")));
    }

    private static TextRange comment(String source, String text) {
        int start = source.indexOf(text);
        return new TextRange(start, start + text.length());
    }
}
