package com.raditha.jarl.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Arena of basic blocks for one function body (or one file's top level).
 * Block 0 is the entry and block 1 the exit.
 */
public final class ControlFlowGraph {

    public static final int ENTRY = 0;
    public static final int EXIT = 1;

    private final List<BasicBlock> blocks = new ArrayList<>();

    ControlFlowGraph() {
        newBlock();
        newBlock();
    }

    public BasicBlock block(int id) {
        return blocks.get(id);
    }

    public List<BasicBlock> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    public int size() {
        return blocks.size();
    }

    /**
     * True when some block has a live edge into {@code id}.
     */
    public boolean hasIncomingEdges(int id) {
        for (int pred : blocks.get(id).predecessors()) {
            if (blocks.get(pred).successors().contains(id)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when {@code from} has a live edge to {@code to}.
     */
    public boolean hasEdge(int from, int to) {
        return blocks.get(from).successors().contains(to);
    }

    int newBlock() {
        BasicBlock block = new BasicBlock(blocks.size());
        blocks.add(block);
        return block.id();
    }

    void addEdge(int from, int to) {
        BasicBlock source = blocks.get(from);
        if (!source.successors().contains(to)) {
            source.addSuccessor(to);
        }
        blocks.get(to).addPredecessor(from);
    }

    void addPredecessorOnly(int block, int predecessor) {
        blocks.get(block).addPredecessor(predecessor);
    }
}
