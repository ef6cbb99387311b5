package com.raditha.jarl.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Splits R source into tokens. Comments are collected on the side and never
 * reach the parser as tokens.
 */
public class RLexer {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("if", TokenType.IF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("for", TokenType.FOR),
            Map.entry("in", TokenType.IN),
            Map.entry("while", TokenType.WHILE),
            Map.entry("repeat", TokenType.REPEAT),
            Map.entry("function", TokenType.FUNCTION),
            Map.entry("break", TokenType.BREAK),
            Map.entry("next", TokenType.NEXT),
            Map.entry("TRUE", TokenType.TRUE),
            Map.entry("FALSE", TokenType.FALSE),
            Map.entry("NULL", TokenType.NULL),
            Map.entry("NA", TokenType.NA),
            Map.entry("NA_integer_", TokenType.NA),
            Map.entry("NA_real_", TokenType.NA),
            Map.entry("NA_character_", TokenType.NA),
            Map.entry("NA_complex_", TokenType.NA),
            Map.entry("Inf", TokenType.NUMBER),
            Map.entry("NaN", TokenType.NUMBER));

    // Longest spellings first so that prefixes never win.
    private static final String[] OPERATORS = {
            "<<-", "->>", ":::",
            "::", "<-", "->", "<=", ">=", "==", "!=", "&&", "||", "|>", ":=", "**",
            "<", ">", "!", "&", "|", "~", "?", "+", "-", "*", "/", "^", ":", "$", "@", "="
    };

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Comment> comments = new ArrayList<>();
    private int pos;

    public RLexer(String source) {
        this.source = source;
    }

    public List<Token> tokens() {
        return tokens;
    }

    public List<Comment> comments() {
        return comments;
    }

    /**
     * Tokenize the whole source. The token list always ends with EOF.
     */
    public RLexer tokenize() throws ParseException {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\n') {
                add(TokenType.NEWLINE, "\n", pos, pos + 1);
                pos++;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '#') {
                lexComment();
            } else if (isRawStringStart()) {
                lexRawString();
            } else if (c == '"' || c == '\'') {
                lexString(c);
            } else if (c == '`') {
                lexBacktick();
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
                lexNumber();
            } else if (Character.isLetter(c) || c == '.') {
                lexIdentifier();
            } else {
                lexPunctuation(c);
            }
        }
        add(TokenType.EOF, "", source.length(), source.length());
        return this;
    }

    private void add(TokenType type, String text, int start, int end) {
        tokens.add(new Token(type, text, start, end));
    }

    private void lexComment() {
        int start = pos;
        while (pos < source.length() && source.charAt(pos) != '\n') {
            pos++;
        }
        int end = pos;
        // Keep a trailing carriage return out of the comment.
        if (end > start && source.charAt(end - 1) == '\r') {
            end--;
        }
        comments.add(new Comment(source.substring(start, end), new TextRange(start, end)));
    }

    private boolean isRawStringStart() {
        char c = source.charAt(pos);
        if ((c != 'r' && c != 'R') || pos + 1 >= source.length()) {
            return false;
        }
        char quote = source.charAt(pos + 1);
        if (quote != '"' && quote != '\'') {
            return false;
        }
        int i = pos + 2;
        while (i < source.length() && source.charAt(i) == '-') {
            i++;
        }
        return i < source.length() && "([{".indexOf(source.charAt(i)) >= 0;
    }

    private void lexRawString() throws ParseException {
        int start = pos;
        char quote = source.charAt(pos + 1);
        int i = pos + 2;
        int dashes = 0;
        while (source.charAt(i) == '-') {
            dashes++;
            i++;
        }
        char open = source.charAt(i);
        char close = switch (open) {
            case '(' -> ')';
            case '[' -> ']';
            default -> '}';
        };
        String terminator = close + "-".repeat(dashes) + quote;
        int endIndex = source.indexOf(terminator, i + 1);
        if (endIndex < 0) {
            throw new ParseException("unterminated raw string", start);
        }
        pos = endIndex + terminator.length();
        add(TokenType.STRING, source.substring(start, pos), start, pos);
    }

    private void lexString(char quote) throws ParseException {
        int start = pos;
        pos++;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\') {
                pos += 2;
            } else if (c == quote) {
                pos++;
                add(TokenType.STRING, source.substring(start, pos), start, pos);
                return;
            } else {
                pos++;
            }
        }
        throw new ParseException("unterminated string", start);
    }

    private void lexBacktick() throws ParseException {
        int start = pos;
        int close = source.indexOf('`', pos + 1);
        if (close < 0) {
            throw new ParseException("unterminated backtick name", start);
        }
        pos = close + 1;
        add(TokenType.IDENTIFIER, source.substring(start + 1, close), start, pos);
    }

    private void lexNumber() {
        int start = pos;
        if (source.startsWith("0x", pos) || source.startsWith("0X", pos)) {
            pos += 2;
            while (pos < source.length() && isHexDigit(source.charAt(pos))) {
                pos++;
            }
        } else {
            skipDigits();
            if (pos < source.length() && source.charAt(pos) == '.') {
                pos++;
                skipDigits();
            }
            if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
                int save = pos;
                pos++;
                if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    skipDigits();
                } else {
                    pos = save;
                }
            }
        }
        if (pos < source.length() && (source.charAt(pos) == 'L' || source.charAt(pos) == 'i')) {
            pos++;
        }
        add(TokenType.NUMBER, source.substring(start, pos), start, pos);
    }

    private void skipDigits() {
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isHexDigit(char c) {
        return Character.isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private void lexIdentifier() {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '.' || c == '_') {
                pos++;
            } else {
                break;
            }
        }
        String text = source.substring(start, pos);
        if (text.equals("...")) {
            add(TokenType.DOTS, text, start, pos);
            return;
        }
        add(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER), text, start, pos);
    }

    private void lexPunctuation(char c) throws ParseException {
        int start = pos;
        switch (c) {
            case '(' -> single(TokenType.LPAREN);
            case ')' -> single(TokenType.RPAREN);
            case '{' -> single(TokenType.LBRACE);
            case '}' -> single(TokenType.RBRACE);
            case ']' -> single(TokenType.RBRACKET);
            case ',' -> single(TokenType.COMMA);
            case ';' -> single(TokenType.SEMICOLON);
            case '\\' -> single(TokenType.LAMBDA);
            case '[' -> {
                if (source.startsWith("[[", pos)) {
                    pos += 2;
                    add(TokenType.DOUBLE_LBRACKET, "[[", start, pos);
                } else {
                    single(TokenType.LBRACKET);
                }
            }
            case '%' -> {
                int close = source.indexOf('%', pos + 1);
                int newline = source.indexOf('\n', pos + 1);
                if (close < 0 || (newline >= 0 && newline < close)) {
                    throw new ParseException("unterminated %operator%", start);
                }
                pos = close + 1;
                add(TokenType.OPERATOR, source.substring(start, pos), start, pos);
            }
            default -> {
                for (String op : OPERATORS) {
                    if (source.startsWith(op, pos)) {
                        pos += op.length();
                        add(TokenType.OPERATOR, op, start, pos);
                        return;
                    }
                }
                throw new ParseException("unexpected character '" + c + "'", start);
            }
        }
    }

    private void single(TokenType type) {
        add(type, String.valueOf(source.charAt(pos)), pos, pos + 1);
        pos++;
    }
}
