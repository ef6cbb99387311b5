package com.raditha.jarl.rules.checks;

import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.model.FixSafety;
import com.raditha.jarl.rules.RuleNames;
import com.raditha.jarl.syntax.ParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TrueFalseSymbolCheck - which uses of T and F count as values.
 */
class TrueFalseSymbolCheckTest {

    private static List<Diagnostic> lint(String source) throws ParseException {
        return CheckRunner.lint(source, RuleNames.TRUE_FALSE_SYMBOL);
    }

    @Test
    void testValueUses() throws ParseException {
        String source = "x <- T\nf(na.rm = F)\nfunction(a = T) a";
        List<Diagnostic> diagnostics = lint(source);
        assertEquals(3, diagnostics.size());
        assertEquals(FixSafety.SAFE, diagnostics.get(0).fixSafety());
        assertEquals("x <- TRUE\nf(na.rm = FALSE)\nfunction(a = TRUE) a", CheckRunner.fixed(source, diagnostics));
    }

    @Test
    void testAssignmentTargetsAreSkipped() throws ParseException {
        assertTrue(lint("T <- 1").isEmpty());
        assertTrue(lint("1 -> F").isEmpty());
        assertTrue(lint("T = 5").isEmpty());
    }

    @Test
    void testOtherNonValueUses() throws ParseException {
        assertTrue(lint("df$T").isEmpty());
        assertTrue(lint("obj@F").isEmpty());
        assertTrue(lint("pkg::T").isEmpty());
        assertTrue(lint("T(1)").isEmpty());
        assertTrue(lint("for (T in 1:3) print(T)").size() == 1, "only the loop body use is a value");
    }

    @Test
    void testBacktickedNameIsDeliberate() throws ParseException {
        assertTrue(lint("x <- `T`").isEmpty());
    }

    @Test
    void testOtherIdentifiersIgnored() throws ParseException {
        assertTrue(lint("x <- TRUE & Tx & t").isEmpty());
    }

    @Test
    void testMessage() throws ParseException {
        Diagnostic d = lint("T").get(0);
        assertEquals("`T` and `F` can be confused with variables.", d.message());
        assertEquals("Use `TRUE` and `FALSE` instead.", d.suggestion());
    }
}
