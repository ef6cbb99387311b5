package com.raditha.jarl.cfg;

import com.raditha.jarl.syntax.SyntaxNode;
import com.raditha.jarl.syntax.TextRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A straight-line run of statements. Blocks refer to each other by index into
 * their {@link ControlFlowGraph}.
 * <p>
 * {@code successors} holds live edges only. A predecessor without a matching
 * successor entry is a predecessor-only link: it records where the block
 * structurally sits without making it reachable.
 */
public final class BasicBlock {

    private final int id;
    private final List<SyntaxNode> statements = new ArrayList<>();
    private final List<Integer> successors = new ArrayList<>();
    private final List<Integer> predecessors = new ArrayList<>();
    private Terminator terminator = Terminator.unset();

    BasicBlock(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    public List<SyntaxNode> statements() {
        return Collections.unmodifiableList(statements);
    }

    public List<Integer> successors() {
        return Collections.unmodifiableList(successors);
    }

    public List<Integer> predecessors() {
        return Collections.unmodifiableList(predecessors);
    }

    public Terminator terminator() {
        return terminator;
    }

    /**
     * Source range from the first to the last statement, if any.
     */
    public Optional<TextRange> range() {
        if (statements.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(statements.get(0).range().cover(statements.get(statements.size() - 1).range()));
    }

    void addStatement(SyntaxNode statement) {
        statements.add(statement);
    }

    void setTerminator(Terminator terminator) {
        this.terminator = terminator;
    }

    void addSuccessor(int block) {
        successors.add(block);
    }

    void addPredecessor(int block) {
        if (!predecessors.contains(block)) {
            predecessors.add(block);
        }
    }

    @Override
    public String toString() {
        return "BasicBlock{" + id + ", " + statements.size() + " stmts, " + terminator.kind()
                + ", succ=" + successors + ", pred=" + predecessors + "}";
    }
}
