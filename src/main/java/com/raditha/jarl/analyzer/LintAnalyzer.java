package com.raditha.jarl.analyzer;

import com.raditha.jarl.config.JarlConfig;
import com.raditha.jarl.document.CodeChunk;
import com.raditha.jarl.document.RmdChunkExtractor;
import com.raditha.jarl.fix.FixEngine;
import com.raditha.jarl.fix.FixPolicy;
import com.raditha.jarl.fix.FixResult;
import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.rules.RuleEngine;
import com.raditha.jarl.rules.RuleNames;
import com.raditha.jarl.rules.RuleRegistry;
import com.raditha.jarl.rules.RuleTable;
import com.raditha.jarl.suppression.SuppressionResolver;
import com.raditha.jarl.suppression.SuppressionResult;
import com.raditha.jarl.syntax.ParseException;
import com.raditha.jarl.syntax.RParser;
import com.raditha.jarl.syntax.SyntaxTree;
import com.raditha.jarl.syntax.TextRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Main orchestrator for linting one source unit.
 * Coordinates parsing, rule checks, suppression and fixing.
 * <p>
 * Instances hold no per-file state and may be shared between threads.
 */
public class LintAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(LintAnalyzer.class);

    private final JarlConfig config;
    private final RuleEngine engine;
    private final SuppressionResolver resolver;
    private final FixEngine fixEngine;
    private final RmdChunkExtractor chunkExtractor = new RmdChunkExtractor();

    /**
     * Create analyzer that reports without fixing.
     */
    public LintAnalyzer(RuleTable table, JarlConfig config) {
        this(table, config, FixPolicy.NONE);
    }

    public LintAnalyzer(RuleTable table, JarlConfig config, FixPolicy policy) {
        this.config = config;
        this.engine = new RuleEngine(RuleRegistry.defaults(table), config.enabledRules(), config.minimumRVersion(),
                config.ruleOptions());
        this.resolver = new SuppressionResolver(table, config.enabledRules());
        this.fixEngine = new FixEngine(policy);
    }

    /**
     * Outcome of one lint pass over a text.
     */
    record Pass(List<Diagnostic> diagnostics, int suppressed) {
    }

    /**
     * Read, lint and, depending on the policy, fix a file. Never throws for
     * problems with the file itself; those become the report's failure.
     */
    public FileReport analyzeFile(Path path) {
        String source;
        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warn("Could not read {}: {}", path, e.getMessage());
            return FileReport.failed(path, "",
                    Diagnostic.of(RuleNames.IO_ERROR, "Failed to read file: " + e.getMessage(), TextRange.empty(0)));
        }
        return analyze(path, source);
    }

    /**
     * Lint and fix already loaded text.
     */
    public FileReport analyze(Path path, String source) {
        boolean document = RmdChunkExtractor.isDocument(path);
        Pass pass;
        try {
            pass = lint(source, document);
        } catch (ParseException e) {
            logger.debug("Failed to parse {}: {}", path, e.getMessage());
            return FileReport.failed(path, source, parseError(e, source));
        }

        String text = source;
        int applied = 0;
        int passes = 1;
        boolean pending = false;
        while (fixEngine.policy() != FixPolicy.NONE && passes < FixEngine.MAX_PASSES) {
            FixResult result = fixEngine.apply(text, fixable(pass.diagnostics()));
            if (!result.hasChanges()) {
                pending = false;
                break;
            }
            Pass next;
            try {
                next = lint(result.text(), document);
            } catch (ParseException e) {
                logger.warn("Fixes in {} produced unparsable code, keeping the previous version: {}", path,
                        e.getMessage());
                break;
            }
            text = result.text();
            applied += result.applied().size();
            pass = next;
            passes++;
            pending = result.hasDeferred();
            if (!pending) {
                break;
            }
        }
        if (pending) {
            logger.warn("Stopped fixing {} after {} passes", path, passes);
        }
        FileReport report = new FileReport(path, source, text, pass.diagnostics(), null, applied, pass.suppressed());
        logger.debug(report.getSummary());
        return report;
    }

    /**
     * Lint without fixing, for callers that only publish diagnostics.
     */
    public List<Diagnostic> lintText(String text, boolean document) throws ParseException {
        return lint(text, document).diagnostics();
    }

    Pass lint(String text, boolean document) throws ParseException {
        if (!document) {
            return lintUnit(text, false);
        }
        List<Diagnostic> diagnostics = new ArrayList<>();
        int suppressed = 0;
        for (CodeChunk chunk : chunkExtractor.extract(text)) {
            Pass pass;
            try {
                pass = lintUnit(chunk.code(), true);
            } catch (ParseException e) {
                throw new ParseException(e.getMessage(), e.offset() + chunk.startOffset());
            }
            for (Diagnostic diagnostic : pass.diagnostics()) {
                diagnostics.add(diagnostic.shift(chunk.startOffset()));
            }
            suppressed += pass.suppressed();
        }
        return new Pass(diagnostics, suppressed);
    }

    private Pass lintUnit(String text, boolean chunk) throws ParseException {
        SyntaxTree tree = RParser.parse(text);
        List<Diagnostic> raw = engine.run(tree);
        SuppressionResult result = resolver.resolve(tree, raw, chunk);
        return new Pass(result.diagnostics(), result.suppressed());
    }

    private List<Diagnostic> fixable(List<Diagnostic> diagnostics) {
        return diagnostics.stream()
                .filter(d -> config.fixableRules().contains(d.rule()))
                .toList();
    }

    static Diagnostic parseError(ParseException e, String source) {
        int offset = Math.max(0, Math.min(e.offset(), source.length()));
        return Diagnostic.of(RuleNames.PARSE_ERROR, "Failed to parse: " + e.getMessage(), TextRange.empty(offset));
    }
}
