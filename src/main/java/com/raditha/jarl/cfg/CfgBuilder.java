package com.raditha.jarl.cfg;

import com.raditha.jarl.syntax.SyntaxKind;
import com.raditha.jarl.syntax.SyntaxNode;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a {@link ControlFlowGraph} from a function body or a file's
 * top-level statements.
 * <p>
 * Function definitions met along the way are opaque statements; each gets its
 * own graph when it is analyzed. A builder instance is single-use per call
 * and not thread-safe.
 */
public class CfgBuilder {

    /**
     * Calls that never return normally.
     */
    public static final List<String> DEFAULT_STOPPING_FUNCTIONS = List.of(
            "stop", ".Defunct", "abort", "cli_abort", "q", "quit");

    private final Set<String> stoppingFunctions;
    private ControlFlowGraph graph;
    private Deque<LoopTargets> loops;
    private int current;

    /**
     * Jump targets of the innermost enclosing loop.
     */
    private record LoopTargets(int header, int after) {
    }

    public CfgBuilder() {
        this(DEFAULT_STOPPING_FUNCTIONS);
    }

    public CfgBuilder(Collection<String> stoppingFunctions) {
        this.stoppingFunctions = Set.copyOf(stoppingFunctions);
    }

    /**
     * Build the graph of a FUNCTION_DEFINITION node's body.
     */
    public ControlFlowGraph buildFunction(SyntaxNode function) {
        if (!function.is(SyntaxKind.FUNCTION_DEFINITION)) {
            throw new IllegalArgumentException("Expected a function definition, got " + function.kind());
        }
        SyntaxNode body = function.body();
        List<SyntaxNode> statements = body.is(SyntaxKind.BRACED_EXPRESSIONS) ? body.children() : List.of(body);
        return build(statements);
    }

    /**
     * Build the graph of a PROGRAM node's top-level statements.
     */
    public ControlFlowGraph buildProgram(SyntaxNode program) {
        return build(program.children());
    }

    private ControlFlowGraph build(List<SyntaxNode> statements) {
        graph = new ControlFlowGraph();
        loops = new ArrayDeque<>();
        current = ControlFlowGraph.ENTRY;

        for (SyntaxNode statement : statements) {
            processStatement(statement);
        }

        // Every terminator opens a fresh block, so the cursor is never terminated here.
        if (isLive(current)) {
            terminate(Terminator.jump(ControlFlowGraph.EXIT));
            graph.addEdge(current, ControlFlowGraph.EXIT);
        } else {
            graph.addPredecessorOnly(ControlFlowGraph.EXIT, current);
        }
        return graph;
    }

    private boolean isLive(int block) {
        return block == ControlFlowGraph.ENTRY || graph.hasIncomingEdges(block);
    }

    private void processStatement(SyntaxNode statement) {
        // Inside dead code nothing is decomposed so the region stays in one piece.
        if (!isLive(current)) {
            graph.block(current).addStatement(statement);
            return;
        }

        switch (statement.kind()) {
            case BRACED_EXPRESSIONS -> statement.children().forEach(this::processStatement);
            case IF_STATEMENT -> buildIf(statement);
            case FOR_STATEMENT, WHILE_STATEMENT, REPEAT_STATEMENT -> buildLoop(statement);
            case BREAK -> buildJump(statement, true);
            case NEXT -> buildJump(statement, false);
            case CALL -> buildCall(statement);
            default -> graph.block(current).addStatement(statement);
        }
    }

    private void buildCall(SyntaxNode call) {
        graph.block(current).addStatement(call);
        if (isReturn(call)) {
            terminate(Terminator.returns());
            graph.addEdge(current, ControlFlowGraph.EXIT);
            startUnreachableBlock();
        } else if (isStoppingCall(call)) {
            terminate(Terminator.stop());
            graph.addEdge(current, ControlFlowGraph.EXIT);
            startUnreachableBlock();
        }
    }

    private static boolean isReturn(SyntaxNode call) {
        SyntaxNode callee = call.function();
        return callee.is(SyntaxKind.IDENTIFIER) && "return".equals(callee.text());
    }

    private boolean isStoppingCall(SyntaxNode call) {
        return call.calleeName().map(stoppingFunctions::contains).orElse(false);
    }

    private void buildJump(SyntaxNode statement, boolean isBreak) {
        graph.block(current).addStatement(statement);
        LoopTargets loop = loops.peek();
        if (loop == null) {
            // break/next outside a loop is an R error at run time; leave it opaque.
            return;
        }
        int target = isBreak ? loop.after() : loop.header();
        terminate(isBreak ? Terminator.breakTo(target) : Terminator.nextTo(target));
        graph.addEdge(current, target);
        startUnreachableBlock();
    }

    private void terminate(Terminator terminator) {
        graph.block(current).setTerminator(terminator);
    }

    private void startUnreachableBlock() {
        int next = graph.newBlock();
        graph.addPredecessorOnly(next, current);
        current = next;
    }

    private void buildIf(SyntaxNode node) {
        int branch = current;
        Optional<Boolean> constant = constantCondition(node.condition());

        int thenBlock = graph.newBlock();
        int elseBlock = graph.newBlock();
        int afterIf = graph.newBlock();
        graph.block(branch).setTerminator(Terminator.branch(thenBlock, elseBlock));

        boolean thenLive = constant.orElse(true);
        boolean elseLive = !constant.orElse(false);
        link(branch, thenBlock, thenLive);
        link(branch, elseBlock, elseLive);

        current = thenBlock;
        if (thenLive) {
            processStatement(node.consequence());
        } else {
            addDeadBody(thenBlock, node.consequence());
        }
        closeBranch(afterIf);

        current = elseBlock;
        Optional<SyntaxNode> alternative = node.alternative();
        if (alternative.isPresent()) {
            if (elseLive) {
                processStatement(alternative.get());
            } else {
                addDeadBody(elseBlock, alternative.get());
            }
        }
        closeBranch(afterIf);

        if (!graph.hasIncomingEdges(afterIf)) {
            graph.addPredecessorOnly(afterIf, branch);
        }
        current = afterIf;
    }

    private void closeBranch(int afterIf) {
        if (!graph.block(current).terminator().isSet() && isLive(current)) {
            terminate(Terminator.jump(afterIf));
            graph.addEdge(current, afterIf);
        }
    }

    private void buildLoop(SyntaxNode node) {
        int header = graph.newBlock();
        terminate(Terminator.jump(header));
        graph.addEdge(current, header);

        int body = graph.newBlock();
        int after = graph.newBlock();
        graph.block(header).setTerminator(Terminator.loop(body, after));

        boolean runsForever = node.is(SyntaxKind.REPEAT_STATEMENT)
                || (node.is(SyntaxKind.WHILE_STATEMENT) && constantCondition(node.condition()).orElse(false));
        boolean neverRuns = node.is(SyntaxKind.WHILE_STATEMENT)
                && !constantCondition(node.condition()).orElse(true);

        link(header, body, !neverRuns);
        link(header, after, !runsForever);

        loops.push(new LoopTargets(header, after));
        current = body;
        if (neverRuns) {
            addDeadBody(body, node.body());
        } else {
            processStatement(node.body());
        }
        if (!graph.block(current).terminator().isSet() && isLive(current)) {
            terminate(Terminator.jump(header));
            graph.addEdge(current, header);
        }
        loops.pop();
        current = after;
    }

    /**
     * Stores a branch that never runs. The statements inside braces are
     * stored rather than the braces, so the region covers only the code.
     */
    private void addDeadBody(int block, SyntaxNode body) {
        if (body.is(SyntaxKind.BRACED_EXPRESSIONS)) {
            for (SyntaxNode statement : body.children()) {
                graph.block(block).addStatement(statement);
            }
        } else {
            graph.block(block).addStatement(body);
        }
    }

    private void link(int from, int to, boolean live) {
        if (live) {
            graph.addEdge(from, to);
        } else {
            graph.addPredecessorOnly(to, from);
        }
    }

    /**
     * Value of a literal TRUE/FALSE condition, optionally parenthesized.
     * Anything else, including {@code T} and {@code F}, is not constant.
     */
    static Optional<Boolean> constantCondition(SyntaxNode condition) {
        SyntaxNode node = condition;
        while (node.is(SyntaxKind.PARENTHESIZED)) {
            node = node.inner();
        }
        if (node.is(SyntaxKind.TRUE)) {
            return Optional.of(true);
        }
        if (node.is(SyntaxKind.FALSE)) {
            return Optional.of(false);
        }
        return Optional.empty();
    }
}
