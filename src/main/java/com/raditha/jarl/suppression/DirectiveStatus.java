package com.raditha.jarl.suppression;

/**
 * Validation outcome of a suppression directive. Only VALID directives
 * suppress anything.
 */
public enum DirectiveStatus {
    VALID,
    /** No rule name given. */
    BLANKET,
    /** Rule name not in the rule table. */
    MISNAMED,
    /** Missing colon or empty explanation. */
    UNEXPLAINED,
    /** Written at the end of a line of code. */
    MISPLACED,
    /** A file directive after the first expression. */
    MISPLACED_FILE,
    /** A start or end without its partner at the same nesting depth. */
    UNMATCHED,
    /** A chunk directive not written in the YAML array form, or outside a chunk. */
    INVALID_CHUNK;

    public boolean isValid() {
        return this == VALID;
    }
}
