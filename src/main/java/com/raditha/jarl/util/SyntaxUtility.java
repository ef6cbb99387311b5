package com.raditha.jarl.util;

import com.raditha.jarl.syntax.SyntaxKind;
import com.raditha.jarl.syntax.SyntaxNode;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Utility class for common syntax tree queries.
 */
public class SyntaxUtility {

    private static final Set<String> LEFT_ASSIGNMENTS = Set.of("<-", "<<-", "=", ":=");
    private static final Set<String> RIGHT_ASSIGNMENTS = Set.of("->", "->>");

    private SyntaxUtility() {
        /* this is only a utility class */
    }

    /**
     * The value of the only argument of a call when that argument is
     * positional.
     */
    public static Optional<SyntaxNode> singlePositionalArgument(SyntaxNode call) {
        List<SyntaxNode> arguments = call.arguments();
        if (arguments.size() != 1 || arguments.get(0).name().isPresent()) {
            return Optional.empty();
        }
        return arguments.get(0).value();
    }

    /**
     * Strip any number of enclosing parentheses.
     */
    public static SyntaxNode unwrapParentheses(SyntaxNode node) {
        SyntaxNode current = node;
        while (current.is(SyntaxKind.PARENTHESIZED)) {
            current = current.inner();
        }
        return current;
    }

    public static boolean isAssignment(SyntaxNode node) {
        return node.is(SyntaxKind.BINARY_EXPRESSION)
                && (LEFT_ASSIGNMENTS.contains(node.operator()) || RIGHT_ASSIGNMENTS.contains(node.operator()));
    }

    /**
     * True when {@code node} is the target of an enclosing assignment, e.g.
     * {@code x} in {@code x <- 1} or {@code 1 -> x}.
     */
    public static boolean isAssignmentTarget(SyntaxNode node) {
        SyntaxNode parent = node.parent();
        if (parent == null || !isAssignment(parent)) {
            return false;
        }
        return RIGHT_ASSIGNMENTS.contains(parent.operator()) ? parent.right() == node : parent.left() == node;
    }

    /**
     * True when {@code node} is the value assigned by an enclosing assignment.
     */
    public static boolean isAssignedValue(SyntaxNode node) {
        SyntaxNode parent = node.parent();
        if (parent == null || !isAssignment(parent)) {
            return false;
        }
        return RIGHT_ASSIGNMENTS.contains(parent.operator()) ? parent.left() == node : parent.right() == node;
    }

    public static boolean isComparison(SyntaxNode node, String... operators) {
        if (!node.is(SyntaxKind.BINARY_EXPRESSION)) {
            return false;
        }
        for (String operator : operators) {
            if (operator.equals(node.operator())) {
                return true;
            }
        }
        return false;
    }
}
