package com.raditha.jarl.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A node of the R syntax tree.
 * <p>
 * Children sit at fixed positions per kind so the typed accessors below can
 * pick them out without searching:
 * <ul>
 * <li>IF_STATEMENT: condition, consequence [, alternative]</li>
 * <li>FOR_STATEMENT: variable, sequence, body</li>
 * <li>WHILE_STATEMENT: condition, body</li>
 * <li>REPEAT_STATEMENT: body</li>
 * <li>FUNCTION_DEFINITION: PARAMETERS, body</li>
 * <li>CALL / SUBSET / SUBSET2: function, ARGUMENTS</li>
 * <li>ARGUMENT: [value] (the optional name is kept as {@link #text()})</li>
 * <li>PARAMETER: [default] (the name is kept as {@link #text()})</li>
 * <li>BINARY_EXPRESSION: left, right (the operator is kept as {@link #text()})</li>
 * <li>UNARY_EXPRESSION: operand</li>
 * <li>NAMESPACE_EXPRESSION: package, name</li>
 * <li>PARENTHESIZED: inner expression</li>
 * </ul>
 * The tree is immutable once the parser returns it.
 */
public final class SyntaxNode {

    private final SyntaxKind kind;
    private final TextRange range;
    private final String text;
    private final List<SyntaxNode> children;
    private SyntaxNode parent;

    public SyntaxNode(SyntaxKind kind, TextRange range, String text, List<SyntaxNode> children) {
        this.kind = kind;
        this.range = range;
        this.text = text;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        for (SyntaxNode child : this.children) {
            child.parent = this;
        }
    }

    public static SyntaxNode leaf(SyntaxKind kind, TextRange range, String text) {
        return new SyntaxNode(kind, range, text, List.of());
    }

    public SyntaxKind kind() {
        return kind;
    }

    public boolean is(SyntaxKind other) {
        return kind == other;
    }

    public TextRange range() {
        return range;
    }

    public int start() {
        return range.start();
    }

    public int end() {
        return range.end();
    }

    /**
     * Token text: identifier name, literal spelling, operator or argument name.
     * {@code null} for purely structural nodes.
     */
    public String text() {
        return text;
    }

    public List<SyntaxNode> children() {
        return children;
    }

    public SyntaxNode child(int index) {
        return children.get(index);
    }

    public SyntaxNode parent() {
        return parent;
    }

    /**
     * Ancestors from the direct parent up to the root.
     */
    public List<SyntaxNode> ancestors() {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode p = parent; p != null; p = p.parent) {
            result.add(p);
        }
        return result;
    }

    public Optional<SyntaxNode> previousSibling() {
        if (parent == null) {
            return Optional.empty();
        }
        int index = indexInParent();
        return index > 0 ? Optional.of(parent.children.get(index - 1)) : Optional.empty();
    }

    public Optional<SyntaxNode> nextSibling() {
        if (parent == null) {
            return Optional.empty();
        }
        int index = indexInParent();
        return index + 1 < parent.children.size() ? Optional.of(parent.children.get(index + 1)) : Optional.empty();
    }

    private int indexInParent() {
        List<SyntaxNode> siblings = parent.children;
        for (int i = 0; i < siblings.size(); i++) {
            if (siblings.get(i) == this) {
                return i;
            }
        }
        throw new IllegalStateException("Node is not a child of its parent");
    }

    /**
     * Visit this node and all descendants in source order (pre-order).
     */
    public void walk(Consumer<SyntaxNode> visitor) {
        visitor.accept(this);
        for (SyntaxNode child : children) {
            child.walk(visitor);
        }
    }

    // Typed accessors

    public SyntaxNode condition() {
        expect(SyntaxKind.IF_STATEMENT, SyntaxKind.WHILE_STATEMENT);
        return children.get(0);
    }

    public SyntaxNode consequence() {
        expect(SyntaxKind.IF_STATEMENT);
        return children.get(1);
    }

    public Optional<SyntaxNode> alternative() {
        expect(SyntaxKind.IF_STATEMENT);
        return children.size() > 2 ? Optional.of(children.get(2)) : Optional.empty();
    }

    public SyntaxNode variable() {
        expect(SyntaxKind.FOR_STATEMENT);
        return children.get(0);
    }

    public SyntaxNode sequence() {
        expect(SyntaxKind.FOR_STATEMENT);
        return children.get(1);
    }

    /**
     * Body of a loop or function definition.
     */
    public SyntaxNode body() {
        return switch (kind) {
            case FOR_STATEMENT -> children.get(2);
            case WHILE_STATEMENT, FUNCTION_DEFINITION -> children.get(1);
            case REPEAT_STATEMENT -> children.get(0);
            default -> throw new IllegalStateException("Node of kind " + kind + " has no body");
        };
    }

    public SyntaxNode parameters() {
        expect(SyntaxKind.FUNCTION_DEFINITION);
        return children.get(0);
    }

    /**
     * Callee of a call or the object of a subset expression.
     */
    public SyntaxNode function() {
        expect(SyntaxKind.CALL, SyntaxKind.SUBSET, SyntaxKind.SUBSET2);
        return children.get(0);
    }

    public List<SyntaxNode> arguments() {
        expect(SyntaxKind.CALL, SyntaxKind.SUBSET, SyntaxKind.SUBSET2);
        return children.get(1).children;
    }

    public SyntaxNode argumentList() {
        expect(SyntaxKind.CALL, SyntaxKind.SUBSET, SyntaxKind.SUBSET2);
        return children.get(1);
    }

    /**
     * Value of an argument or default value of a parameter.
     */
    public Optional<SyntaxNode> value() {
        expect(SyntaxKind.ARGUMENT, SyntaxKind.PARAMETER);
        return children.isEmpty() ? Optional.empty() : Optional.of(children.get(0));
    }

    /**
     * Name of an argument; empty for positional arguments.
     */
    public Optional<String> name() {
        expect(SyntaxKind.ARGUMENT, SyntaxKind.PARAMETER);
        return Optional.ofNullable(text);
    }

    public SyntaxNode left() {
        expect(SyntaxKind.BINARY_EXPRESSION, SyntaxKind.NAMESPACE_EXPRESSION);
        return children.get(0);
    }

    public SyntaxNode right() {
        expect(SyntaxKind.BINARY_EXPRESSION, SyntaxKind.NAMESPACE_EXPRESSION);
        return children.get(1);
    }

    public SyntaxNode operand() {
        expect(SyntaxKind.UNARY_EXPRESSION);
        return children.get(0);
    }

    public SyntaxNode inner() {
        expect(SyntaxKind.PARENTHESIZED);
        return children.get(0);
    }

    public String operator() {
        expect(SyntaxKind.BINARY_EXPRESSION, SyntaxKind.UNARY_EXPRESSION, SyntaxKind.NAMESPACE_EXPRESSION);
        return text;
    }

    /**
     * True for a call whose callee is the plain identifier {@code name}.
     */
    public boolean isCallTo(String name) {
        if (kind != SyntaxKind.CALL) {
            return false;
        }
        SyntaxNode callee = children.get(0);
        if (callee.kind == SyntaxKind.NAMESPACE_EXPRESSION) {
            callee = callee.children.get(1);
        }
        return callee.kind == SyntaxKind.IDENTIFIER && name.equals(callee.text);
    }

    /**
     * Name of the called function for calls like {@code f(x)} and {@code pkg::f(x)}.
     */
    public Optional<String> calleeName() {
        if (kind != SyntaxKind.CALL) {
            return Optional.empty();
        }
        SyntaxNode callee = children.get(0);
        if (callee.kind == SyntaxKind.NAMESPACE_EXPRESSION) {
            callee = callee.children.get(1);
        }
        return callee.kind == SyntaxKind.IDENTIFIER ? Optional.of(callee.text) : Optional.empty();
    }

    private void expect(SyntaxKind... kinds) {
        for (SyntaxKind k : kinds) {
            if (k == kind) {
                return;
            }
        }
        throw new IllegalStateException("Accessor not available for node of kind " + kind);
    }

    @Override
    public String toString() {
        return text == null ? kind + "@" + range : kind + "(" + text + ")@" + range;
    }
}
