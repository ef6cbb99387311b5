package com.raditha.jarl.suppression;

/**
 * The forms a {@code jarl-ignore} comment can take.
 */
public enum DirectiveKind {
    /** {@code # jarl-ignore rule: reason} applies to the node that follows. */
    STANDARD,

    /** {@code # jarl-ignore-start rule: reason} opens a region. */
    RANGE_START,

    /** {@code # jarl-ignore-end rule} closes a region. */
    RANGE_END,

    /** {@code # jarl-ignore-file rule: reason} applies to the whole file. */
    FILE,

    /** {@code #|   - rule: reason} under {@code #| jarl-ignore-chunk:} applies to a whole code chunk. */
    CHUNK
}
