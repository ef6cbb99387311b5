package com.raditha.jarl.syntax;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RParser - tree shapes, precedence and newline handling.
 */
class RParserTest {

    private static SyntaxNode first(String source) throws ParseException {
        SyntaxTree tree = RParser.parse(source);
        assertFalse(tree.root().children().isEmpty(), "expected at least one statement");
        return tree.root().child(0);
    }

    @Test
    void testEmptySource() throws ParseException {
        SyntaxTree tree = RParser.parse("");
        assertEquals(SyntaxKind.PROGRAM, tree.root().kind());
        assertTrue(tree.root().children().isEmpty());
    }

    @Test
    void testStatementsSeparatedByNewlinesAndSemicolons() throws ParseException {
        SyntaxTree tree = RParser.parse("a <- 1\nb <- 2; c <- 3\n\n");
        assertEquals(3, tree.root().children().size());
    }

    @Test
    void testAssignment() throws ParseException {
        SyntaxNode node = first("x <- 1 + 2");
        assertEquals(SyntaxKind.BINARY_EXPRESSION, node.kind());
        assertEquals("<-", node.operator());
        assertEquals("x", node.left().text());
        assertEquals("+", node.right().operator());
    }

    @Test
    void testMultiplicationBindsTighterThanAddition() throws ParseException {
        SyntaxNode node = first("1 + 2 * 3");
        assertEquals("+", node.operator());
        assertEquals("*", node.right().operator());
    }

    @Test
    void testPowerIsRightAssociative() throws ParseException {
        SyntaxNode node = first("2 ^ 3 ^ 4");
        assertEquals("^", node.operator());
        assertEquals(SyntaxKind.NUMBER, node.left().kind());
        assertEquals("^", node.right().operator());
    }

    @Test
    void testUnaryMinusBindsLooserThanPower() throws ParseException {
        SyntaxNode node = first("-2^2");
        assertEquals(SyntaxKind.UNARY_EXPRESSION, node.kind());
        assertEquals("^", node.operand().operator());
    }

    @Test
    void testNotBindsLooserThanComparison() throws ParseException {
        SyntaxNode node = first("!x == y");
        assertEquals(SyntaxKind.UNARY_EXPRESSION, node.kind());
        assertEquals("==", node.operand().operator());
    }

    @Test
    void testSpecialOperatorPrecedence() throws ParseException {
        SyntaxNode node = first("a %in% b == c");
        assertEquals("==", node.operator());
        assertEquals("%in%", node.left().operator());
    }

    @Test
    void testPipe() throws ParseException {
        SyntaxNode node = first("x |> f()");
        assertEquals("|>", node.operator());
        assertEquals(SyntaxKind.CALL, node.right().kind());
    }

    @Test
    void testCallWithNamedArguments() throws ParseException {
        SyntaxNode call = first("grep(\"a\", x, value = TRUE)");
        assertEquals(SyntaxKind.CALL, call.kind());
        assertTrue(call.isCallTo("grep"));
        List<SyntaxNode> arguments = call.arguments();
        assertEquals(3, arguments.size());
        assertTrue(arguments.get(0).name().isEmpty());
        assertEquals("value", arguments.get(2).name().orElseThrow());
        assertEquals(SyntaxKind.TRUE, arguments.get(2).value().orElseThrow().kind());
    }

    @Test
    void testEmptyArguments() throws ParseException {
        SyntaxNode subset = first("m[, 1]");
        assertEquals(SyntaxKind.SUBSET, subset.kind());
        assertEquals(2, subset.arguments().size());
        assertTrue(subset.arguments().get(0).value().isEmpty());
    }

    @Test
    void testNamedArgumentWithoutValue() throws ParseException {
        SyntaxNode call = first("alist(x = )");
        SyntaxNode argument = call.arguments().get(0);
        assertEquals("x", argument.name().orElseThrow());
        assertTrue(argument.value().isEmpty());
    }

    @Test
    void testStringArgumentName() throws ParseException {
        SyntaxNode call = first("list(\"a b\" = 1)");
        assertEquals("a b", call.arguments().get(0).name().orElseThrow());
    }

    @Test
    void testDoubleBracketSubset() throws ParseException {
        SyntaxNode node = first("x[[\"a\"]]");
        assertEquals(SyntaxKind.SUBSET2, node.kind());
        assertEquals(1, node.arguments().size());
        assertEquals(8, node.end());
    }

    @Test
    void testNamespaceCall() throws ParseException {
        SyntaxNode call = first("base::any(x)");
        assertEquals(SyntaxKind.NAMESPACE_EXPRESSION, call.function().kind());
        assertEquals("any", call.calleeName().orElseThrow());
        assertTrue(call.isCallTo("any"));
    }

    @Test
    void testDollarAccess() throws ParseException {
        SyntaxNode node = first("df$col");
        assertEquals("$", node.operator());
        assertEquals("col", node.right().text());
    }

    @Test
    void testIfElseOnSameLineAtTopLevel() throws ParseException {
        SyntaxNode node = first("if (a) b else c");
        assertEquals(SyntaxKind.IF_STATEMENT, node.kind());
        assertTrue(node.alternative().isPresent());
    }

    @Test
    void testElseOnNewLineAtTopLevelIsAnError() {
        assertThrows(ParseException.class, () -> RParser.parse("if (a) b\nelse c"));
    }

    @Test
    void testElseOnNewLineInsideBraces() throws ParseException {
        SyntaxNode braces = first("{\n  if (a) {\n    b\n  }\n  else {\n    c\n  }\n}");
        SyntaxNode ifNode = braces.child(0);
        assertEquals(SyntaxKind.IF_STATEMENT, ifNode.kind());
        assertTrue(ifNode.alternative().isPresent());
        assertEquals(1, braces.children().size());
    }

    @Test
    void testNewlinesIgnoredInsideParentheses() throws ParseException {
        SyntaxTree tree = RParser.parse("f(a,\n  b\n)\n(1 +\n 2)");
        assertEquals(2, tree.root().children().size());
        assertEquals(2, tree.root().child(0).arguments().size());
    }

    @Test
    void testTrailingBinaryOperatorContinuesLine() throws ParseException {
        SyntaxTree tree = RParser.parse("x <- 1 +\n  2");
        assertEquals(1, tree.root().children().size());
    }

    @Test
    void testForLoop() throws ParseException {
        SyntaxNode node = first("for (i in 1:10) print(i)");
        assertEquals(SyntaxKind.FOR_STATEMENT, node.kind());
        assertEquals("i", node.variable().text());
        assertEquals(":", node.sequence().operator());
        assertTrue(node.body().isCallTo("print"));
    }

    @Test
    void testWhileAndRepeat() throws ParseException {
        SyntaxTree tree = RParser.parse("while (TRUE) break\nrepeat {\n  next\n}");
        SyntaxNode loop = tree.root().child(0);
        assertEquals(SyntaxKind.WHILE_STATEMENT, loop.kind());
        assertEquals(SyntaxKind.TRUE, loop.condition().kind());
        assertEquals(SyntaxKind.BREAK, loop.body().kind());
        SyntaxNode repeat = tree.root().child(1);
        assertEquals(SyntaxKind.REPEAT_STATEMENT, repeat.kind());
        assertEquals(SyntaxKind.NEXT, repeat.body().child(0).kind());
    }

    @Test
    void testFunctionDefinition() throws ParseException {
        SyntaxNode assignment = first("f <- function(x, y = 2, ...) {\n  x + y\n}");
        SyntaxNode function = assignment.right();
        assertEquals(SyntaxKind.FUNCTION_DEFINITION, function.kind());
        assertEquals("function", function.text());
        List<SyntaxNode> parameters = function.parameters().children();
        assertEquals(3, parameters.size());
        assertEquals("x", parameters.get(0).text());
        assertEquals("y", parameters.get(1).name().orElseThrow());
        assertEquals("2", parameters.get(1).value().orElseThrow().text());
        assertEquals("...", parameters.get(2).text());
        assertEquals(SyntaxKind.BRACED_EXPRESSIONS, function.body().kind());
    }

    @Test
    void testLambdaShorthand() throws ParseException {
        SyntaxNode function = first("\\(x) x + 1");
        assertEquals(SyntaxKind.FUNCTION_DEFINITION, function.kind());
        assertEquals("\\", function.text());
        assertEquals("+", function.body().operator());
    }

    @Test
    void testFunctionBodyExtendsOverLowerPrecedenceOperators() throws ParseException {
        SyntaxNode node = first("f <- function(x) x <- 1");
        assertEquals("<-", node.operator());
        assertEquals(SyntaxKind.FUNCTION_DEFINITION, node.right().kind());
    }

    @Test
    void testParenthesized() throws ParseException {
        SyntaxNode node = first("(a + b) * c");
        assertEquals("*", node.operator());
        assertEquals(SyntaxKind.PARENTHESIZED, node.left().kind());
        assertEquals("+", node.left().inner().operator());
    }

    @Test
    void testFormula() throws ParseException {
        SyntaxNode node = first("y ~ x + z");
        assertEquals("~", node.operator());
        SyntaxNode oneSided = first("~ x");
        assertEquals(SyntaxKind.UNARY_EXPRESSION, oneSided.kind());
    }

    @Test
    void testRangesCoverWholeExpression() throws ParseException {
        String source = "  any(is.na(x))";
        SyntaxNode call = first(source);
        assertEquals(2, call.start());
        assertEquals(source.length(), call.end());
        assertEquals("any(is.na(x))", RParser.parse(source).text(call));
    }

    @Test
    void testParentLinks() throws ParseException {
        SyntaxNode call = first("any(is.na(x))");
        SyntaxNode inner = call.arguments().get(0).value().orElseThrow();
        assertTrue(inner.isCallTo("is.na"));
        assertSame(call, inner.parent().parent().parent());
        assertEquals(SyntaxKind.PROGRAM, inner.ancestors().get(inner.ancestors().size() - 1).kind());
    }

    @Test
    void testSiblings() throws ParseException {
        SyntaxTree tree = RParser.parse("a\nb\nc");
        SyntaxNode b = tree.root().child(1);
        assertEquals("a", b.previousSibling().orElseThrow().text());
        assertEquals("c", b.nextSibling().orElseThrow().text());
        assertTrue(tree.root().child(2).nextSibling().isEmpty());
    }

    @Test
    void testCommentsKeptOnTree() throws ParseException {
        SyntaxTree tree = RParser.parse("# header\nx <- 1 # note\n");
        assertEquals(2, tree.comments().size());
        assertTrue(tree.hasCommentsIn(tree.root().range()));
        assertFalse(tree.hasCommentsIn(tree.root().child(0).range()));
    }

    @Test
    void testAccessorOnWrongKindFails() throws ParseException {
        SyntaxNode number = first("1");
        assertThrows(IllegalStateException.class, number::condition);
    }

    @Test
    void testUnbalancedParenthesis() {
        ParseException e = assertThrows(ParseException.class, () -> RParser.parse("f(1, 2"));
        assertTrue(e.getMessage().contains("end of input"));
    }

    @Test
    void testUnclosedBrace() {
        assertThrows(ParseException.class, () -> RParser.parse("function() {\n  x"));
    }

    @Test
    void testTwoExpressionsOnOneLine() {
        assertThrows(ParseException.class, () -> RParser.parse("x y"));
    }

    @Test
    void testStrayClosingBrace() {
        assertThrows(ParseException.class, () -> RParser.parse("x }"));
    }
}
