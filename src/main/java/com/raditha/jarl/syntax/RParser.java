package com.raditha.jarl.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Precedence-climbing parser for R source.
 * <p>
 * Newlines end a statement at top level and inside braces, and are ignored
 * inside parentheses and brackets. An {@code else} on a new line is only
 * accepted inside braces or parentheses, as in R itself.
 */
public class RParser {

    private enum Context {
        TOP, BRACE, PAREN
    }

    /**
     * Left and right binding power of an infix operator.
     */
    private record BindingPower(int left, int right) {
    }

    private static final Map<String, BindingPower> INFIX = Map.ofEntries(
            Map.entry("?", new BindingPower(1, 2)),
            Map.entry("=", new BindingPower(4, 3)),
            Map.entry(":=", new BindingPower(4, 3)),
            Map.entry("<-", new BindingPower(6, 5)),
            Map.entry("<<-", new BindingPower(6, 5)),
            Map.entry("->", new BindingPower(6, 7)),
            Map.entry("->>", new BindingPower(6, 7)),
            Map.entry("~", new BindingPower(8, 9)),
            Map.entry("||", new BindingPower(10, 11)),
            Map.entry("|", new BindingPower(10, 11)),
            Map.entry("&&", new BindingPower(12, 13)),
            Map.entry("&", new BindingPower(12, 13)),
            Map.entry("==", new BindingPower(16, 17)),
            Map.entry("!=", new BindingPower(16, 17)),
            Map.entry("<", new BindingPower(16, 17)),
            Map.entry(">", new BindingPower(16, 17)),
            Map.entry("<=", new BindingPower(16, 17)),
            Map.entry(">=", new BindingPower(16, 17)),
            Map.entry("+", new BindingPower(18, 19)),
            Map.entry("-", new BindingPower(18, 19)),
            Map.entry("*", new BindingPower(20, 21)),
            Map.entry("/", new BindingPower(20, 21)),
            Map.entry("|>", new BindingPower(22, 23)),
            Map.entry(":", new BindingPower(24, 25)),
            Map.entry("^", new BindingPower(29, 28)),
            Map.entry("**", new BindingPower(29, 28)),
            Map.entry("$", new BindingPower(31, 32)),
            Map.entry("@", new BindingPower(31, 32)));

    private static final BindingPower SPECIAL_OPERATOR = new BindingPower(22, 23);
    private static final int POSTFIX = 30;

    private static final Map<String, Integer> PREFIX = Map.of(
            "?", 2,
            "~", 9,
            "!", 14,
            "-", 26,
            "+", 26);

    private final List<Token> tokens;
    private final Deque<Context> contexts = new ArrayDeque<>();
    private int index;

    private RParser(List<Token> tokens) {
        this.tokens = tokens;
        contexts.push(Context.TOP);
    }

    /**
     * Parse a complete R source unit.
     *
     * @throws ParseException when the source is not valid R
     */
    public static SyntaxTree parse(String source) throws ParseException {
        RLexer lexer = new RLexer(source).tokenize();
        RParser parser = new RParser(lexer.tokens());
        List<SyntaxNode> statements = parser.parseStatements(TokenType.EOF);
        SyntaxNode root = new SyntaxNode(SyntaxKind.PROGRAM, new TextRange(0, source.length()), null, statements);
        return new SyntaxTree(source, root, lexer.comments());
    }

    // Token access

    private Token peek() {
        if (contexts.peek() == Context.PAREN) {
            skipNewlines();
        }
        return tokens.get(index);
    }

    private Token advance() {
        Token token = peek();
        if (token.type() != TokenType.EOF) {
            index++;
        }
        return token;
    }

    private void skipNewlines() {
        while (tokens.get(index).type() == TokenType.NEWLINE) {
            index++;
        }
    }

    private Token expect(TokenType type, String description) throws ParseException {
        Token token = peek();
        if (token.type() != type) {
            throw unexpected(token, "expected " + description);
        }
        return advance();
    }

    private static ParseException unexpected(Token token, String detail) {
        String what = token.type() == TokenType.EOF ? "end of input"
                : token.type() == TokenType.NEWLINE ? "newline" : "'" + token.text() + "'";
        return new ParseException("unexpected " + what + (detail == null ? "" : ", " + detail), token.start());
    }

    // Statements

    private List<SyntaxNode> parseStatements(TokenType terminator) throws ParseException {
        List<SyntaxNode> statements = new ArrayList<>();
        while (true) {
            while (tokens.get(index).type() == TokenType.NEWLINE || tokens.get(index).type() == TokenType.SEMICOLON) {
                index++;
            }
            Token next = tokens.get(index);
            if (next.type() == terminator) {
                return statements;
            }
            if (next.type() == TokenType.EOF) {
                throw unexpected(next, null);
            }
            statements.add(parseExpression(0));
            Token after = tokens.get(index);
            if (after.type() != TokenType.NEWLINE && after.type() != TokenType.SEMICOLON && after.type() != terminator) {
                throw unexpected(after, null);
            }
        }
    }

    // Expressions

    private SyntaxNode parseExpression(int minPower) throws ParseException {
        SyntaxNode left = parsePrefix();
        while (true) {
            Token token = peek();
            if (token.type() == TokenType.OPERATOR) {
                BindingPower power = infixPower(token.text());
                if (power == null || power.left() < minPower) {
                    break;
                }
                advance();
                skipNewlines();
                SyntaxNode right = parseExpression(power.right());
                left = new SyntaxNode(SyntaxKind.BINARY_EXPRESSION, left.range().cover(right.range()), token.text(),
                        List.of(left, right));
            } else if (isPostfixOpener(token.type())) {
                if (POSTFIX < minPower) {
                    break;
                }
                left = parsePostfix(left);
            } else {
                break;
            }
        }
        return left;
    }

    private static BindingPower infixPower(String operator) {
        if (operator.length() > 1 && operator.startsWith("%") && operator.endsWith("%")) {
            return SPECIAL_OPERATOR;
        }
        return INFIX.get(operator);
    }

    private static boolean isPostfixOpener(TokenType type) {
        return type == TokenType.LPAREN || type == TokenType.LBRACKET || type == TokenType.DOUBLE_LBRACKET;
    }

    private SyntaxNode parsePrefix() throws ParseException {
        Token token = advance();
        return switch (token.type()) {
            case NUMBER -> SyntaxNode.leaf(SyntaxKind.NUMBER, token.range(), token.text());
            case STRING -> namespaceOrLeaf(token, SyntaxKind.STRING);
            case IDENTIFIER -> namespaceOrLeaf(token, SyntaxKind.IDENTIFIER);
            case DOTS -> SyntaxNode.leaf(SyntaxKind.DOTS, token.range(), token.text());
            case TRUE -> SyntaxNode.leaf(SyntaxKind.TRUE, token.range(), token.text());
            case FALSE -> SyntaxNode.leaf(SyntaxKind.FALSE, token.range(), token.text());
            case NULL -> SyntaxNode.leaf(SyntaxKind.NULL, token.range(), token.text());
            case NA -> SyntaxNode.leaf(SyntaxKind.NA, token.range(), token.text());
            case BREAK -> SyntaxNode.leaf(SyntaxKind.BREAK, token.range(), token.text());
            case NEXT -> SyntaxNode.leaf(SyntaxKind.NEXT, token.range(), token.text());
            case LPAREN -> parseParenthesized(token);
            case LBRACE -> parseBraces(token);
            case IF -> parseIf(token);
            case FOR -> parseFor(token);
            case WHILE -> parseWhile(token);
            case REPEAT -> parseRepeat(token);
            case FUNCTION, LAMBDA -> parseFunction(token);
            case OPERATOR -> parseUnary(token);
            default -> throw unexpected(token, null);
        };
    }

    private SyntaxNode namespaceOrLeaf(Token token, SyntaxKind kind) throws ParseException {
        SyntaxNode leaf = SyntaxNode.leaf(kind, token.range(), token.text());
        Token next = peek();
        if (next.isOperator("::") || next.isOperator(":::")) {
            advance();
            Token name = advance();
            if (name.type() != TokenType.IDENTIFIER && name.type() != TokenType.STRING) {
                throw unexpected(name, "expected a name after " + next.text());
            }
            SyntaxNode member = SyntaxNode.leaf(SyntaxKind.IDENTIFIER, name.range(), name.text());
            return new SyntaxNode(SyntaxKind.NAMESPACE_EXPRESSION, new TextRange(token.start(), name.end()),
                    next.text(), List.of(leaf, member));
        }
        return leaf;
    }

    private SyntaxNode parseUnary(Token operator) throws ParseException {
        Integer power = PREFIX.get(operator.text());
        if (power == null) {
            throw unexpected(operator, null);
        }
        skipNewlines();
        SyntaxNode operand = parseExpression(power);
        return new SyntaxNode(SyntaxKind.UNARY_EXPRESSION, new TextRange(operator.start(), operand.end()),
                operator.text(), List.of(operand));
    }

    private SyntaxNode parseParenthesized(Token open) throws ParseException {
        contexts.push(Context.PAREN);
        SyntaxNode inner = parseExpression(0);
        Token close = expect(TokenType.RPAREN, "')'");
        contexts.pop();
        return new SyntaxNode(SyntaxKind.PARENTHESIZED, new TextRange(open.start(), close.end()), null, List.of(inner));
    }

    private SyntaxNode parseBraces(Token open) throws ParseException {
        contexts.push(Context.BRACE);
        List<SyntaxNode> statements = parseStatements(TokenType.RBRACE);
        Token close = tokens.get(index++);
        contexts.pop();
        return new SyntaxNode(SyntaxKind.BRACED_EXPRESSIONS, new TextRange(open.start(), close.end()), null,
                statements);
    }

    private SyntaxNode parseCondition() throws ParseException {
        contexts.push(Context.PAREN);
        expect(TokenType.LPAREN, "'('");
        SyntaxNode condition = parseExpression(0);
        expect(TokenType.RPAREN, "')'");
        contexts.pop();
        return condition;
    }

    private SyntaxNode parseIf(Token keyword) throws ParseException {
        SyntaxNode condition = parseCondition();
        skipNewlines();
        SyntaxNode consequence = parseExpression(0);
        List<SyntaxNode> children = new ArrayList<>(List.of(condition, consequence));
        if (consumeElse()) {
            skipNewlines();
            children.add(parseExpression(0));
        }
        SyntaxNode last = children.get(children.size() - 1);
        return new SyntaxNode(SyntaxKind.IF_STATEMENT, new TextRange(keyword.start(), last.end()), null, children);
    }

    private boolean consumeElse() {
        if (contexts.peek() == Context.TOP) {
            if (tokens.get(index).type() == TokenType.ELSE) {
                index++;
                return true;
            }
            return false;
        }
        int lookahead = index;
        while (tokens.get(lookahead).type() == TokenType.NEWLINE) {
            lookahead++;
        }
        if (tokens.get(lookahead).type() == TokenType.ELSE) {
            index = lookahead + 1;
            return true;
        }
        return false;
    }

    private SyntaxNode parseFor(Token keyword) throws ParseException {
        contexts.push(Context.PAREN);
        expect(TokenType.LPAREN, "'('");
        Token name = expect(TokenType.IDENTIFIER, "loop variable");
        expect(TokenType.IN, "'in'");
        SyntaxNode sequence = parseExpression(0);
        expect(TokenType.RPAREN, "')'");
        contexts.pop();
        skipNewlines();
        SyntaxNode body = parseExpression(0);
        SyntaxNode variable = SyntaxNode.leaf(SyntaxKind.IDENTIFIER, name.range(), name.text());
        return new SyntaxNode(SyntaxKind.FOR_STATEMENT, new TextRange(keyword.start(), body.end()), null,
                List.of(variable, sequence, body));
    }

    private SyntaxNode parseWhile(Token keyword) throws ParseException {
        SyntaxNode condition = parseCondition();
        skipNewlines();
        SyntaxNode body = parseExpression(0);
        return new SyntaxNode(SyntaxKind.WHILE_STATEMENT, new TextRange(keyword.start(), body.end()), null,
                List.of(condition, body));
    }

    private SyntaxNode parseRepeat(Token keyword) throws ParseException {
        skipNewlines();
        SyntaxNode body = parseExpression(0);
        return new SyntaxNode(SyntaxKind.REPEAT_STATEMENT, new TextRange(keyword.start(), body.end()), null,
                List.of(body));
    }

    private SyntaxNode parseFunction(Token keyword) throws ParseException {
        contexts.push(Context.PAREN);
        Token open = expect(TokenType.LPAREN, "'('");
        List<SyntaxNode> parameters = new ArrayList<>();
        if (peek().type() != TokenType.RPAREN) {
            while (true) {
                parameters.add(parseParameter());
                if (peek().type() != TokenType.COMMA) {
                    break;
                }
                advance();
            }
        }
        Token close = expect(TokenType.RPAREN, "')'");
        contexts.pop();
        skipNewlines();
        SyntaxNode body = parseExpression(0);
        SyntaxNode parameterList = new SyntaxNode(SyntaxKind.PARAMETERS, new TextRange(open.start(), close.end()),
                null, parameters);
        return new SyntaxNode(SyntaxKind.FUNCTION_DEFINITION, new TextRange(keyword.start(), body.end()),
                keyword.text(), List.of(parameterList, body));
    }

    private SyntaxNode parseParameter() throws ParseException {
        Token name = advance();
        if (name.type() != TokenType.IDENTIFIER && name.type() != TokenType.DOTS) {
            throw unexpected(name, "expected a parameter name");
        }
        if (peek().isOperator("=")) {
            advance();
            SyntaxNode defaultValue = parseExpression(0);
            return new SyntaxNode(SyntaxKind.PARAMETER, new TextRange(name.start(), defaultValue.end()),
                    name.text(), List.of(defaultValue));
        }
        return SyntaxNode.leaf(SyntaxKind.PARAMETER, name.range(), name.text());
    }

    private SyntaxNode parsePostfix(SyntaxNode target) throws ParseException {
        Token open = advance();
        contexts.push(Context.PAREN);
        SyntaxKind kind;
        TokenType closing;
        switch (open.type()) {
            case LPAREN -> {
                kind = SyntaxKind.CALL;
                closing = TokenType.RPAREN;
            }
            case LBRACKET -> {
                kind = SyntaxKind.SUBSET;
                closing = TokenType.RBRACKET;
            }
            default -> {
                kind = SyntaxKind.SUBSET2;
                closing = TokenType.RBRACKET;
            }
        }
        List<SyntaxNode> arguments = parseArguments(closing);
        Token close = expect(closing, closing == TokenType.RPAREN ? "')'" : "']'");
        if (kind == SyntaxKind.SUBSET2) {
            close = expect(TokenType.RBRACKET, "']]'");
        }
        contexts.pop();
        SyntaxNode argumentList = new SyntaxNode(SyntaxKind.ARGUMENTS, new TextRange(open.start(), close.end()), null,
                arguments);
        return new SyntaxNode(kind, new TextRange(target.start(), close.end()), null, List.of(target, argumentList));
    }

    private List<SyntaxNode> parseArguments(TokenType closing) throws ParseException {
        List<SyntaxNode> arguments = new ArrayList<>();
        if (peek().type() == closing) {
            return arguments;
        }
        while (true) {
            Token next = peek();
            if (next.type() == TokenType.COMMA || next.type() == closing) {
                arguments.add(SyntaxNode.leaf(SyntaxKind.ARGUMENT, TextRange.empty(next.start()), null));
            } else {
                arguments.add(parseArgument());
            }
            if (peek().type() != TokenType.COMMA) {
                return arguments;
            }
            advance();
        }
    }

    private SyntaxNode parseArgument() throws ParseException {
        Token first = peek();
        if (isArgumentName(first.type()) && followedByEquals()) {
            advance();
            advance();
            String name = first.type() == TokenType.STRING ? unquote(first.text()) : first.text();
            Token next = peek();
            if (next.type() == TokenType.COMMA || next.type() == TokenType.RPAREN || next.type() == TokenType.RBRACKET) {
                return SyntaxNode.leaf(SyntaxKind.ARGUMENT, first.range(), name);
            }
            SyntaxNode value = parseExpression(0);
            return new SyntaxNode(SyntaxKind.ARGUMENT, new TextRange(first.start(), value.end()), name, List.of(value));
        }
        SyntaxNode value = parseExpression(0);
        return new SyntaxNode(SyntaxKind.ARGUMENT, value.range(), null, List.of(value));
    }

    private static boolean isArgumentName(TokenType type) {
        return type == TokenType.IDENTIFIER || type == TokenType.STRING || type == TokenType.NULL
                || type == TokenType.DOTS;
    }

    private boolean followedByEquals() {
        int lookahead = index + 1;
        while (tokens.get(lookahead).type() == TokenType.NEWLINE) {
            lookahead++;
        }
        return tokens.get(lookahead).isOperator("=");
    }

    private static String unquote(String literal) {
        return literal.length() >= 2 ? literal.substring(1, literal.length() - 1) : literal;
    }
}
