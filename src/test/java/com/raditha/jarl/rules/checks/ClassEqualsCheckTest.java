package com.raditha.jarl.rules.checks;

import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.model.FixSafety;
import com.raditha.jarl.rules.RuleNames;
import com.raditha.jarl.syntax.ParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ClassEqualsCheck - comparisons against class(x).
 */
class ClassEqualsCheckTest {

    private static List<Diagnostic> lint(String source) throws ParseException {
        return CheckRunner.lint(source, RuleNames.CLASS_EQUALS);
    }

    @Test
    void testEquality() throws ParseException {
        String source = "if (class(x) == \"data.frame\") y";
        List<Diagnostic> diagnostics = lint(source);
        assertEquals(1, diagnostics.size());
        assertEquals(FixSafety.UNSAFE, diagnostics.get(0).fixSafety());
        assertEquals("if (inherits(x, \"data.frame\")) y", CheckRunner.fixed(source, diagnostics));
    }

    @Test
    void testReversedInequality() throws ParseException {
        String source = "if ('foo' != class(obj)) y";
        assertEquals("if (!inherits(obj, 'foo')) y", CheckRunner.fixed(source, lint(source)));
    }

    @Test
    void testInOperator() throws ParseException {
        assertEquals(1, lint("class(x) %in% \"foo\"").size());
    }

    @Test
    void testAssignedComparisonIsNotFlagged() throws ParseException {
        assertTrue(lint("is_df <- class(x) == \"data.frame\"").isEmpty());
    }

    @Test
    void testNonLiteralIsNotFlagged() throws ParseException {
        assertTrue(lint("class(x) == cls").isEmpty());
        assertTrue(lint("class(x, y) == \"a\"").isEmpty());
        assertTrue(lint("typeof(x) == \"a\"").isEmpty());
    }
}
