package com.raditha.jarl.suppression;

import com.raditha.jarl.syntax.TextRange;
import org.jspecify.annotations.Nullable;

/**
 * A parsed and placed {@code jarl-ignore} comment.
 *
 * @param kind    directive form
 * @param rule    rule name, null for blanket directives
 * @param reason  explanation after the colon, null when missing
 * @param range   range of the comment (for chunk items, of the item line)
 * @param depth   number of enclosing braced blocks
 * @param status  validation outcome
 */
public record SuppressionDirective(
        DirectiveKind kind,
        @Nullable String rule,
        @Nullable String reason,
        TextRange range,
        int depth,
        DirectiveStatus status) {

    public boolean isValid() {
        return status.isValid();
    }

    public SuppressionDirective withStatus(DirectiveStatus newStatus) {
        return new SuppressionDirective(kind, rule, reason, range, depth, newStatus);
    }

    public SuppressionDirective withDepth(int newDepth) {
        return new SuppressionDirective(kind, rule, reason, range, newDepth, status);
    }
}
