package com.raditha.jarl.rules.checks;

import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.model.FixSafety;
import com.raditha.jarl.rules.RuleNames;
import com.raditha.jarl.syntax.ParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AnyIsNaCheck - any(is.na(x)) and NA %in% x.
 */
class AnyIsNaCheckTest {

    private static List<Diagnostic> lint(String source) throws ParseException {
        return CheckRunner.lint(source, RuleNames.ANY_IS_NA);
    }

    @Test
    void testAnyIsNa() throws ParseException {
        String source = "if (any(is.na(x))) stop()";
        List<Diagnostic> diagnostics = lint(source);
        assertEquals(1, diagnostics.size());
        Diagnostic d = diagnostics.get(0);
        assertEquals(RuleNames.ANY_IS_NA, d.rule());
        assertEquals(AnyIsNaCheck.MESSAGE, d.message());
        assertEquals(AnyIsNaCheck.SUGGESTION, d.suggestion());
        assertEquals(FixSafety.SAFE, d.fixSafety());
        assertEquals("if (anyNA(x)) stop()", CheckRunner.fixed(source, diagnostics));
    }

    @Test
    void testNaInVector() throws ParseException {
        String source = "NA %in% df$col";
        assertEquals("anyNA(df$col)", CheckRunner.fixed(source, lint(source)));
    }

    @Test
    void testNamespacedCall() throws ParseException {
        String source = "base::any(is.na(x))";
        assertEquals("anyNA(x)", CheckRunner.fixed(source, lint(source)));
    }

    @Test
    void testComplexArgumentKeptVerbatim() throws ParseException {
        String source = "any(is.na(x[y > 1]))";
        assertEquals("anyNA(x[y > 1])", CheckRunner.fixed(source, lint(source)));
    }

    @Test
    void testExtraArgumentsAreNotFlagged() throws ParseException {
        assertTrue(lint("any(is.na(x), na.rm = TRUE)").isEmpty());
        assertTrue(lint("any(is.na(x, y))").isEmpty());
        assertTrue(lint("any(!is.na(x))").isEmpty());
    }

    @Test
    void testTypedNaIsNotFlagged() throws ParseException {
        assertTrue(lint("NA_integer_ %in% x").isEmpty());
        assertTrue(lint("x %in% NA").isEmpty());
    }

    @Test
    void testCommentInsideSuppressesFix() throws ParseException {
        List<Diagnostic> diagnostics = lint("any(is.na(\n  x # the values\n))");
        assertEquals(1, diagnostics.size());
        assertFalse(diagnostics.get(0).hasFix());
    }
}
