package com.raditha.jarl.suppression;

import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.rules.RuleNames;
import com.raditha.jarl.rules.RuleTable;
import com.raditha.jarl.syntax.SyntaxKind;
import com.raditha.jarl.syntax.SyntaxNode;
import com.raditha.jarl.syntax.SyntaxTree;
import com.raditha.jarl.syntax.TextRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies {@code jarl-ignore} comments to the raw diagnostics of one source
 * unit and validates the comments themselves.
 * <p>
 * The surviving diagnostics keep their order; meta-diagnostics about the
 * comments are appended after them and are never suppressed.
 */
public class SuppressionResolver {

    private static final Logger logger = LoggerFactory.getLogger(SuppressionResolver.class);

    private final DirectiveParser parser;
    private final Set<String> enabledRules;

    public SuppressionResolver(RuleTable table, Set<String> enabledRules) {
        this.parser = new DirectiveParser(table);
        this.enabledRules = Set.copyOf(enabledRules);
    }

    /**
     * A directive together with the source it covers once placed.
     */
    private static final class Placed {
        SuppressionDirective directive;
        TextRange coverage;
        boolean used;

        Placed(SuppressionDirective directive) {
            this.directive = directive;
        }
    }

    private record RangeKey(String rule, int depth) {
    }

    /**
     * Filters {@code raw} through the directives found in {@code tree}.
     *
     * @param tree    the parsed source the diagnostics belong to
     * @param raw     diagnostics from the rule engine, in source order
     * @param inChunk true when {@code tree} is one R Markdown or Quarto chunk
     */
    public SuppressionResult resolve(SyntaxTree tree, List<Diagnostic> raw, boolean inChunk) {
        List<Placed> placed = new ArrayList<>();
        for (SuppressionDirective directive : parser.parse(tree, inChunk)) {
            placed.add(new Placed(directive.withDepth(depthOf(tree.root(), directive.range()))));
        }
        if (placed.isEmpty()) {
            return new SuppressionResult(raw, List.of(), 0);
        }

        placeFileDirectives(tree.root(), placed);
        placeStandardDirectives(tree, placed);
        pairRanges(placed);

        List<Diagnostic> kept = new ArrayList<>();
        int suppressed = 0;
        for (Diagnostic diagnostic : raw) {
            if (markCovering(diagnostic, placed)) {
                suppressed++;
            } else {
                kept.add(diagnostic);
            }
        }
        logger.debug("{} directive(s), {} diagnostic(s) suppressed", placed.size(), suppressed);

        List<Diagnostic> meta = new ArrayList<>();
        for (Placed p : placed) {
            SuppressionDirective directive = p.directive;
            if (!directive.isValid()) {
                String metaRule = MetaDiagnostics.ruleFor(directive.status());
                if (enabledRules.contains(metaRule)) {
                    meta.add(MetaDiagnostics.forDirective(directive));
                }
            } else if (isOutdated(p)) {
                meta.add(MetaDiagnostics.outdated(directive));
            }
        }
        meta.sort(Diagnostic.SOURCE_ORDER);
        kept.addAll(meta);

        return new SuppressionResult(kept, placed.stream().map(p -> p.directive).toList(), suppressed);
    }

    private boolean isOutdated(Placed p) {
        SuppressionDirective directive = p.directive;
        return !p.used
                && directive.kind() != DirectiveKind.RANGE_END
                && enabledRules.contains(directive.rule())
                && enabledRules.contains(RuleNames.OUTDATED_SUPPRESSION);
    }

    /**
     * Removes nothing itself: marks every directive covering the diagnostic
     * as used and reports whether there was one.
     */
    private static boolean markCovering(Diagnostic diagnostic, List<Placed> placed) {
        boolean covered = false;
        for (Placed p : placed) {
            SuppressionDirective directive = p.directive;
            if (!directive.isValid() || p.coverage == null || !diagnostic.rule().equals(directive.rule())) {
                continue;
            }
            if (p.coverage.contains(diagnostic.range()) || anchoredAt(diagnostic, p)) {
                p.used = true;
                covered = true;
            }
        }
        return covered;
    }

    /**
     * Diagnostics spanning several statements (unreachable regions) start at
     * the statement a standard directive targets.
     */
    private static boolean anchoredAt(Diagnostic diagnostic, Placed p) {
        return p.directive.kind() == DirectiveKind.STANDARD && diagnostic.range().start() == p.coverage.start();
    }

    private static void placeFileDirectives(SyntaxNode root, List<Placed> placed) {
        int firstCode = root.children().isEmpty() ? Integer.MAX_VALUE : root.child(0).start();
        TextRange everything = new TextRange(0, Math.max(root.end(), maxEnd(placed)));
        for (Placed p : placed) {
            DirectiveKind kind = p.directive.kind();
            if (kind == DirectiveKind.CHUNK) {
                p.coverage = everything;
            } else if (kind == DirectiveKind.FILE) {
                if (p.directive.range().start() < firstCode) {
                    p.coverage = everything;
                } else if (p.directive.isValid()) {
                    p.directive = p.directive.withStatus(DirectiveStatus.MISPLACED_FILE);
                }
            }
        }
    }

    private static int maxEnd(List<Placed> placed) {
        int end = 0;
        for (Placed p : placed) {
            end = Math.max(end, p.directive.range().end());
        }
        return end;
    }

    private static void placeStandardDirectives(SyntaxTree tree, List<Placed> placed) {
        for (Placed p : placed) {
            if (p.directive.kind() == DirectiveKind.STANDARD) {
                SyntaxNode target = targetOf(tree.root(), p.directive.range());
                if (target != null) {
                    p.coverage = target.range();
                }
            }
        }
    }

    /**
     * Pairs starts and ends by rule and nesting depth. Starts that are only
     * unexplained still pair, so that their end is not reported twice.
     */
    private static void pairRanges(List<Placed> placed) {
        Map<RangeKey, Deque<Placed>> open = new HashMap<>();
        for (Placed p : placed) {
            SuppressionDirective directive = p.directive;
            if (!pairable(directive)) {
                continue;
            }
            RangeKey key = new RangeKey(directive.rule(), directive.depth());
            if (directive.kind() == DirectiveKind.RANGE_START) {
                open.computeIfAbsent(key, k -> new ArrayDeque<>()).push(p);
                continue;
            }
            Deque<Placed> starts = open.get(key);
            if (starts == null || starts.isEmpty()) {
                p.directive = directive.withStatus(DirectiveStatus.UNMATCHED);
                continue;
            }
            Placed start = starts.pop();
            if (start.directive.isValid() && directive.isValid()) {
                // the start alone carries the coverage, the end is never reported as outdated
                start.coverage = new TextRange(start.directive.range().start(), directive.range().end());
            }
        }
        for (Deque<Placed> leftovers : open.values()) {
            for (Placed p : leftovers) {
                p.directive = p.directive.withStatus(DirectiveStatus.UNMATCHED);
            }
        }
    }

    private static boolean pairable(SuppressionDirective directive) {
        DirectiveKind kind = directive.kind();
        if (kind != DirectiveKind.RANGE_START && kind != DirectiveKind.RANGE_END) {
            return false;
        }
        return directive.status() == DirectiveStatus.VALID || directive.status() == DirectiveStatus.UNEXPLAINED;
    }

    /**
     * Number of braced blocks enclosing the comment.
     */
    static int depthOf(SyntaxNode root, TextRange comment) {
        int depth = 0;
        SyntaxNode current = root;
        SyntaxNode next;
        while ((next = enclosingChild(current, comment)) != null) {
            if (next.is(SyntaxKind.BRACED_EXPRESSIONS)) {
                depth++;
            }
            current = next;
        }
        return depth;
    }

    /**
     * The node a standard directive applies to: inside the deepest node
     * enclosing the comment, the first child starting after it.
     */
    static SyntaxNode targetOf(SyntaxNode root, TextRange comment) {
        SyntaxNode current = root;
        SyntaxNode next;
        while ((next = enclosingChild(current, comment)) != null) {
            current = next;
        }
        for (SyntaxNode child : current.children()) {
            if (child.start() >= comment.end()) {
                return child;
            }
        }
        return null;
    }

    private static SyntaxNode enclosingChild(SyntaxNode node, TextRange comment) {
        for (SyntaxNode child : node.children()) {
            if (child.start() < comment.start() && comment.end() <= child.end()) {
                return child;
            }
        }
        return null;
    }
}
