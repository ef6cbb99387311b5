package com.raditha.jarl.cfg;

import com.raditha.jarl.syntax.SyntaxNode;
import com.raditha.jarl.syntax.TextRange;

/**
 * A maximal run of unreachable statements sharing one reason.
 *
 * @param range  span from the first to the last statement of the run
 * @param reason why the run is unreachable
 * @param anchor first statement of the run; the diagnostic is emitted when
 *               traversal reaches this node
 */
public record UnreachableRegion(TextRange range, UnreachabilityReason reason, SyntaxNode anchor) {
}
