package com.raditha.jarl.rules;

import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.model.RVersion;
import com.raditha.jarl.syntax.SyntaxKind;
import com.raditha.jarl.syntax.SyntaxNode;
import com.raditha.jarl.syntax.SyntaxTree;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs the enabled rules over a syntax tree in a single pre-order traversal.
 * <p>
 * The engine holds no per-file state, so one instance can serve many files
 * and threads.
 */
public class RuleEngine {

    private final Map<SyntaxKind, List<RuleRegistry.RegisteredCheck>> active = new EnumMap<>(SyntaxKind.class);
    private final RuleOptions options;

    /**
     * @param registry       all registered checks
     * @param enabledRules   names of the rules to run
     * @param projectVersion minimum R version the project supports, or null
     *                       when unknown
     * @param options        per-rule settings
     */
    public RuleEngine(RuleRegistry registry, Set<String> enabledRules, @Nullable RVersion projectVersion,
            RuleOptions options) {
        this.options = options;
        for (SyntaxKind kind : SyntaxKind.values()) {
            List<RuleRegistry.RegisteredCheck> checks = new ArrayList<>();
            for (RuleRegistry.RegisteredCheck registered : registry.checksFor(kind)) {
                RuleDefinition rule = registered.rule();
                if (enabledRules.contains(rule.name()) && rule.supports(projectVersion)) {
                    checks.add(registered);
                }
            }
            if (!checks.isEmpty()) {
                active.put(kind, List.copyOf(checks));
            }
        }
    }

    /**
     * Collect the diagnostics of every active rule, sorted by start offset and
     * then by rule name.
     */
    public List<Diagnostic> run(SyntaxTree tree) {
        AnalysisContext context = new AnalysisContext(tree, options);
        List<Diagnostic> diagnostics = new ArrayList<>();
        visit(tree.root(), context, diagnostics);
        diagnostics.sort(Diagnostic.SOURCE_ORDER);
        return diagnostics;
    }

    public boolean isActive() {
        return !active.isEmpty();
    }

    private void visit(SyntaxNode node, AnalysisContext context, List<Diagnostic> sink) {
        for (RuleRegistry.RegisteredCheck registered : active.getOrDefault(node.kind(), List.of())) {
            Optional<Diagnostic> diagnostic = registered.check().check(node, context);
            diagnostic.map(d -> applyFixSafety(d, registered.rule())).ifPresent(sink::add);
        }

        boolean function = node.is(SyntaxKind.FUNCTION_DEFINITION);
        if (function) {
            context.enterFunction(node);
        }
        for (SyntaxNode child : node.children()) {
            visit(child, context, sink);
        }
        if (function) {
            context.exitFunction();
        }
    }

    /**
     * The rule table, not the check, decides how safe a fix is.
     */
    private static Diagnostic applyFixSafety(Diagnostic diagnostic, RuleDefinition rule) {
        if (!diagnostic.hasFix()) {
            return diagnostic;
        }
        if (!rule.hasFix()) {
            return diagnostic.withoutFix();
        }
        return diagnostic.withFix(diagnostic.fix(), rule.fixSafety());
    }
}
