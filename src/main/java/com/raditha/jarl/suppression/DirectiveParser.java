package com.raditha.jarl.suppression;

import com.raditha.jarl.rules.RuleTable;
import com.raditha.jarl.syntax.Comment;
import com.raditha.jarl.syntax.SyntaxTree;
import com.raditha.jarl.syntax.TextRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises {@code jarl-ignore} comments and classifies their syntax.
 * <p>
 * Placement problems that depend on the tree (misplaced file directives,
 * unmatched ranges) are left to {@link SuppressionResolver}; every directive
 * produced here has depth 0.
 */
public class DirectiveParser {

    private static final String KEYWORD = "jarl-ignore";
    private static final String CHUNK_KEYWORD = "jarl-ignore-chunk";
    private static final Pattern CHUNK_ITEM = Pattern.compile("^#\\|\\s*-\\s*([^:]*)(?::(.*))?$");

    private final RuleTable table;

    public DirectiveParser(RuleTable table) {
        this.table = table;
    }

    /**
     * Parses every directive in the tree's comments.
     *
     * @param tree    the parsed source
     * @param inChunk true when the source is an R Markdown or Quarto code chunk
     * @return directives in source order
     */
    public List<SuppressionDirective> parse(SyntaxTree tree, boolean inChunk) {
        List<SuppressionDirective> result = new ArrayList<>();
        List<Comment> comments = tree.comments();
        String source = tree.source();

        int i = 0;
        while (i < comments.size()) {
            Comment comment = comments.get(i);
            String text = comment.text().strip();
            boolean trailing = followsCode(source, comment.start());

            if (text.startsWith("#|")) {
                String rest = text.substring(2).stripLeading();
                if (!rest.startsWith(CHUNK_KEYWORD)) {
                    i++;
                    continue;
                }
                String after = rest.substring(CHUNK_KEYWORD.length()).strip();
                if (after.equals(":")) {
                    i = parseChunkItems(comments, i, source, inChunk, result);
                    continue;
                }
                DirectiveStatus status = after.isEmpty() ? DirectiveStatus.BLANKET : DirectiveStatus.INVALID_CHUNK;
                result.add(new SuppressionDirective(DirectiveKind.CHUNK, null, null, comment.range(), 0,
                        trailing ? DirectiveStatus.MISPLACED : status));
                i++;
                continue;
            }

            parseHashDirective(text, comment.range(), trailing).ifPresent(result::add);
            i++;
        }
        return result;
    }

    private Optional<SuppressionDirective> parseHashDirective(String text, TextRange range,
            boolean trailing) {
        String body;
        if (text.startsWith("# ")) {
            body = text.substring(2);
        } else if (text.startsWith("#")) {
            body = text.substring(1);
        } else {
            return Optional.empty();
        }
        if (!body.startsWith(KEYWORD)) {
            return Optional.empty();
        }
        if (body.startsWith(CHUNK_KEYWORD)) {
            return Optional.of(new SuppressionDirective(DirectiveKind.CHUNK, null, null, range, 0,
                    trailing ? DirectiveStatus.MISPLACED : DirectiveStatus.INVALID_CHUNK));
        }

        String rest = body.substring(KEYWORD.length());
        DirectiveKind kind;
        String arguments;
        if (rest.isEmpty()) {
            kind = DirectiveKind.STANDARD;
            arguments = "";
        } else if (rest.startsWith("-file")) {
            kind = DirectiveKind.FILE;
            arguments = rest.substring("-file".length());
        } else if (rest.startsWith("-start")) {
            kind = DirectiveKind.RANGE_START;
            arguments = rest.substring("-start".length());
        } else if (rest.startsWith("-end")) {
            kind = DirectiveKind.RANGE_END;
            arguments = rest.substring("-end".length());
        } else if (rest.startsWith(" ") || rest.startsWith(":")) {
            kind = DirectiveKind.STANDARD;
            arguments = rest;
        } else {
            // jarl-ignorefoo and the like
            return Optional.empty();
        }
        // a colon straight after the keyword means no rule was named
        if (!arguments.isEmpty() && !Character.isWhitespace(arguments.charAt(0)) && arguments.charAt(0) != ':') {
            return Optional.empty();
        }
        return Optional.of(classify(kind, arguments.strip(), range, trailing));
    }

    private SuppressionDirective classify(DirectiveKind kind, String arguments, TextRange range, boolean trailing) {
        String rule;
        String reason;
        int colon = arguments.indexOf(':');
        if (colon >= 0) {
            rule = arguments.substring(0, colon).strip();
            reason = arguments.substring(colon + 1).strip();
        } else {
            rule = arguments;
            reason = null;
        }
        if (kind == DirectiveKind.RANGE_END) {
            // the end marker carries no explanation
            reason = null;
        }

        DirectiveStatus status;
        if (rule.isEmpty()) {
            status = DirectiveStatus.BLANKET;
            rule = null;
        } else if (!isTargetable(rule)) {
            status = DirectiveStatus.MISNAMED;
        } else if (kind != DirectiveKind.RANGE_END && (reason == null || reason.isEmpty())) {
            status = DirectiveStatus.UNEXPLAINED;
        } else {
            status = DirectiveStatus.VALID;
        }
        if (trailing) {
            status = DirectiveStatus.MISPLACED;
        }
        return new SuppressionDirective(kind, rule, reason == null || reason.isEmpty() ? null : reason, range, 0,
                status);
    }

    /**
     * Reads the {@code #|   - rule: reason} lines following a chunk header.
     *
     * @return index of the first comment after the items
     */
    private int parseChunkItems(List<Comment> comments, int headerIndex, String source, boolean inChunk,
            List<SuppressionDirective> out) {
        Comment header = comments.get(headerIndex);
        int next = headerIndex + 1;
        Comment previous = header;
        int items = 0;
        while (next < comments.size()) {
            Comment candidate = comments.get(next);
            if (!onNextLine(source, previous, candidate)) {
                break;
            }
            Matcher m = CHUNK_ITEM.matcher(candidate.text().strip());
            if (!m.matches()) {
                break;
            }
            String rule = m.group(1).strip();
            String reason = m.group(2) == null ? null : m.group(2).strip();
            DirectiveStatus status;
            if (!inChunk) {
                status = DirectiveStatus.INVALID_CHUNK;
            } else if (rule.isEmpty()) {
                status = DirectiveStatus.BLANKET;
            } else if (!isTargetable(rule)) {
                status = DirectiveStatus.MISNAMED;
            } else if (reason == null || reason.isEmpty()) {
                status = DirectiveStatus.UNEXPLAINED;
            } else {
                status = DirectiveStatus.VALID;
            }
            out.add(new SuppressionDirective(DirectiveKind.CHUNK, rule.isEmpty() ? null : rule,
                    reason == null || reason.isEmpty() ? null : reason, candidate.range(), 0, status));
            previous = candidate;
            items++;
            next++;
        }
        if (items == 0) {
            out.add(new SuppressionDirective(DirectiveKind.CHUNK, null, null, header.range(), 0,
                    inChunk ? DirectiveStatus.BLANKET : DirectiveStatus.INVALID_CHUNK));
        }
        return next;
    }

    /**
     * Suppression meta rules cannot themselves be suppressed.
     */
    private boolean isTargetable(String rule) {
        return table.contains(rule) && !table.require(rule).isInCategory(RuleTable.SUPPRESSION_CATEGORY);
    }

    /**
     * True when non-blank text precedes {@code offset} on its line.
     */
    static boolean followsCode(String source, int offset) {
        for (int i = offset - 1; i >= 0; i--) {
            char c = source.charAt(i);
            if (c == '\n') {
                return false;
            }
            if (!Character.isWhitespace(c)) {
                return true;
            }
        }
        return false;
    }

    private static boolean onNextLine(String source, Comment previous, Comment candidate) {
        int newlines = 0;
        for (int i = previous.end(); i < candidate.start(); i++) {
            char c = source.charAt(i);
            if (c == '\n') {
                newlines++;
            } else if (!Character.isWhitespace(c)) {
                return false;
            }
        }
        return newlines == 1;
    }
}
