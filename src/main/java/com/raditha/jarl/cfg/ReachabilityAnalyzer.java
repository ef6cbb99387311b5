package com.raditha.jarl.cfg;

import com.raditha.jarl.syntax.TextRange;
import com.raditha.jarl.syntax.SyntaxNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds unreachable blocks of a {@link ControlFlowGraph} and explains why each
 * one is unreachable.
 */
public class ReachabilityAnalyzer {

    private final ControlFlowGraph graph;
    private final Map<Integer, Boolean> terminatesMemo = new HashMap<>();
    private final Set<Integer> inProgress = new HashSet<>();

    private ReachabilityAnalyzer(ControlFlowGraph graph) {
        this.graph = graph;
    }

    public static ReachabilityResult analyze(ControlFlowGraph graph) {
        return new ReachabilityAnalyzer(graph).run();
    }

    private ReachabilityResult run() {
        Set<Integer> reachable = traverse();

        Map<Integer, UnreachabilityReason> reasons = new HashMap<>();
        for (BasicBlock block : graph.blocks()) {
            if (!reachable.contains(block.id())) {
                reasons.put(block.id(), classify(block));
            }
        }
        return new ReachabilityResult(reachable, reasons, mergeRegions(reachable, reasons));
    }

    private Set<Integer> traverse() {
        Set<Integer> visited = new HashSet<>();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(ControlFlowGraph.ENTRY);
        visited.add(ControlFlowGraph.ENTRY);
        while (!queue.isEmpty()) {
            int id = queue.poll();
            for (int successor : graph.block(id).successors()) {
                if (visited.add(successor)) {
                    queue.add(successor);
                }
            }
        }
        return visited;
    }

    private UnreachabilityReason classify(BasicBlock block) {
        List<Integer> predecessors = block.predecessors();

        for (Terminator.Kind kind : List.of(Terminator.Kind.RETURN, Terminator.Kind.STOP,
                Terminator.Kind.BREAK, Terminator.Kind.NEXT)) {
            for (int pred : predecessors) {
                if (graph.block(pred).terminator().kind() == kind) {
                    return switch (kind) {
                        case RETURN -> UnreachabilityReason.AFTER_RETURN;
                        case STOP -> UnreachabilityReason.AFTER_STOP;
                        case BREAK -> UnreachabilityReason.AFTER_BREAK;
                        default -> UnreachabilityReason.AFTER_NEXT;
                    };
                }
            }
        }

        for (int pred : predecessors) {
            Terminator terminator = graph.block(pred).terminator();
            if (terminator.kind() == Terminator.Kind.BRANCH && !isBranchTarget(terminator, block.id())
                    && allPathsTerminate(pred)) {
                return UnreachabilityReason.AFTER_BRANCH_TERMINATING;
            }
        }

        for (int pred : predecessors) {
            if (graph.hasEdge(pred, block.id())) {
                continue;
            }
            Terminator terminator = graph.block(pred).terminator();
            boolean deadTarget = switch (terminator.kind()) {
                case BRANCH -> isBranchTarget(terminator, block.id());
                case LOOP -> terminator.first() == block.id();
                default -> false;
            };
            if (deadTarget) {
                return UnreachabilityReason.DEAD_BRANCH;
            }
        }

        return UnreachabilityReason.NO_PATH_FROM_ENTRY;
    }

    private static boolean isBranchTarget(Terminator terminator, int block) {
        return terminator.first() == block || terminator.second() == block;
    }

    /**
     * True when every live continuation of {@code block} ends in a
     * return, stop, break or next.
     */
    private boolean allPathsTerminate(int block) {
        Boolean cached = terminatesMemo.get(block);
        if (cached != null) {
            return cached;
        }
        if (!inProgress.add(block)) {
            // A cycle means the path keeps looping instead of terminating.
            return false;
        }
        Terminator terminator = graph.block(block).terminator();
        boolean result = switch (terminator.kind()) {
            case RETURN, STOP, BREAK, NEXT -> true;
            case GOTO -> allPathsTerminate(terminator.first());
            case LOOP -> allPathsTerminate(terminator.second());
            case BRANCH -> {
                List<Integer> successors = graph.block(block).successors();
                boolean all = !successors.isEmpty();
                for (int successor : successors) {
                    all = all && allPathsTerminate(successor);
                }
                yield all;
            }
            case UNSET -> false;
        };
        inProgress.remove(block);
        terminatesMemo.put(block, result);
        return result;
    }

    private List<UnreachableRegion> mergeRegions(Set<Integer> reachable, Map<Integer, UnreachabilityReason> reasons) {
        List<BasicBlock> ordered = new ArrayList<>();
        for (BasicBlock block : graph.blocks()) {
            if (!block.statements().isEmpty()) {
                ordered.add(block);
            }
        }
        ordered.sort(Comparator.comparingInt(b -> b.statements().get(0).start()));

        List<UnreachableRegion> regions = new ArrayList<>();
        TextRange range = null;
        UnreachabilityReason reason = null;
        SyntaxNode anchor = null;
        for (BasicBlock block : ordered) {
            if (reachable.contains(block.id())) {
                if (range != null) {
                    regions.add(new UnreachableRegion(range, reason, anchor));
                    range = null;
                }
                continue;
            }
            UnreachabilityReason blockReason = reasons.get(block.id());
            TextRange blockRange = block.range().orElseThrow();
            if (range != null && blockReason == reason) {
                range = range.cover(blockRange);
            } else {
                if (range != null) {
                    regions.add(new UnreachableRegion(range, reason, anchor));
                }
                range = blockRange;
                reason = blockReason;
                anchor = block.statements().get(0);
            }
        }
        if (range != null) {
            regions.add(new UnreachableRegion(range, reason, anchor));
        }
        return regions;
    }
}
