package com.raditha.jarl.model;

/**
 * Whether a rule's automatic fix preserves behavior.
 */
public enum FixSafety {
    /** The rule never offers a fix. */
    NONE,

    /** Applied by {@code --fix}. */
    SAFE,

    /** Only applied with {@code --unsafe-fixes}: may change behavior in edge cases. */
    UNSAFE
}
