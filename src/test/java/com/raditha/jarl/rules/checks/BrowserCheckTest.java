package com.raditha.jarl.rules.checks;

import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.rules.RuleNames;
import com.raditha.jarl.syntax.ParseException;
import com.raditha.jarl.syntax.TextRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BrowserCheckTest {

    private static List<Diagnostic> lint(String source) throws ParseException {
        return CheckRunner.lint(source, RuleNames.BROWSER);
    }

    @Test
    void testBrowserCall() throws ParseException {
        List<Diagnostic> diagnostics = lint("f <- function() {\n  browser()\n}");
        assertEquals(1, diagnostics.size());
        assertEquals("Calls to `browser()` should be removed.", diagnostics.get(0).message());
        assertEquals(new TextRange(20, 29), diagnostics.get(0).range());
        assertFalse(diagnostics.get(0).hasFix());
    }

    @Test
    void testBrowserAsValueIsNotFlagged() throws ParseException {
        assertTrue(lint("options(error = browser)").isEmpty());
        assertTrue(lint("x$browser()").isEmpty());
    }
}
