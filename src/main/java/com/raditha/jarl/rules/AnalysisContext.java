package com.raditha.jarl.rules;

import com.raditha.jarl.cfg.CfgBuilder;
import com.raditha.jarl.cfg.ControlFlowGraph;
import com.raditha.jarl.cfg.ReachabilityAnalyzer;
import com.raditha.jarl.cfg.UnreachabilityReason;
import com.raditha.jarl.cfg.UnreachableRegion;
import com.raditha.jarl.syntax.SyntaxKind;
import com.raditha.jarl.syntax.SyntaxNode;
import com.raditha.jarl.syntax.SyntaxTree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view handed to rule checks during one traversal.
 * <p>
 * Keeps a stack of function scopes so that control-flow results are computed
 * at most once per function, on first request, and dropped when the traversal
 * leaves the function.
 */
public class AnalysisContext {

    private final SyntaxTree tree;
    private final RuleOptions options;
    private final Deque<Scope> scopes = new ArrayDeque<>();

    /**
     * A function body (or the file's top level) being traversed.
     */
    private final class Scope {
        private final SyntaxNode owner;
        private Map<SyntaxNode, UnreachableRegion> regionsByAnchor;

        Scope(SyntaxNode owner) {
            this.owner = owner;
        }

        Map<SyntaxNode, UnreachableRegion> regions() {
            if (regionsByAnchor == null) {
                regionsByAnchor = computeRegions(owner);
            }
            return regionsByAnchor;
        }
    }

    public AnalysisContext(SyntaxTree tree, RuleOptions options) {
        this.tree = tree;
        this.options = options;
        scopes.push(new Scope(tree.root()));
    }

    public SyntaxTree tree() {
        return tree;
    }

    public String source() {
        return tree.source();
    }

    public String text(SyntaxNode node) {
        return tree.text(node);
    }

    public List<SyntaxNode> ancestors(SyntaxNode node) {
        return node.ancestors();
    }

    /**
     * True when a comment sits inside the node; fixes that would drop it are
     * withheld.
     */
    public boolean hasComments(SyntaxNode node) {
        return tree.hasCommentsIn(node.range());
    }

    /**
     * Innermost function definition being traversed, empty at top level.
     */
    public Optional<SyntaxNode> enclosingFunction() {
        SyntaxNode owner = scopes.peek().owner;
        return owner.is(SyntaxKind.FUNCTION_DEFINITION) ? Optional.of(owner) : Optional.empty();
    }

    /**
     * The unreachable region that starts at {@code node}, if any, within the
     * current scope.
     */
    public Optional<UnreachableRegion> unreachableRegionAt(SyntaxNode node) {
        return Optional.ofNullable(scopes.peek().regions().get(node));
    }

    void enterFunction(SyntaxNode function) {
        scopes.push(new Scope(function));
    }

    void exitFunction() {
        if (scopes.size() == 1) {
            throw new IllegalStateException("Cannot leave the top-level scope");
        }
        scopes.pop();
    }

    private Map<SyntaxNode, UnreachableRegion> computeRegions(SyntaxNode owner) {
        CfgBuilder builder = new CfgBuilder(options.stoppingFunctions());
        boolean topLevel = owner.is(SyntaxKind.PROGRAM);
        ControlFlowGraph graph = topLevel ? builder.buildProgram(owner) : builder.buildFunction(owner);

        Map<SyntaxNode, UnreachableRegion> result = new IdentityHashMap<>();
        for (UnreachableRegion region : ReachabilityAnalyzer.analyze(graph).regions()) {
            // return() at top level is an error of its own, and "no path from
            // entry" has no meaning outside a function.
            if (topLevel && (region.reason() == UnreachabilityReason.AFTER_RETURN
                    || region.reason() == UnreachabilityReason.NO_PATH_FROM_ENTRY)) {
                continue;
            }
            result.put(region.anchor(), region);
        }
        return result;
    }
}
