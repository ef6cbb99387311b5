package com.raditha.jarl.cfg;

/**
 * Why a block cannot be reached from the function entry.
 */
public enum UnreachabilityReason {
    AFTER_RETURN("This code is unreachable because it appears after a return statement."),
    AFTER_STOP("This code is unreachable because it appears after a `stop()` statement (or equivalent)."),
    AFTER_BREAK("This code is unreachable because it appears after a `break` statement."),
    AFTER_NEXT("This code is unreachable because it appears after a `next` statement."),
    AFTER_BRANCH_TERMINATING("This code is unreachable because the preceding if/else terminates in all branches."),
    DEAD_BRANCH("This code is in a branch that can never be executed."),
    NO_PATH_FROM_ENTRY("This code has no execution path from the function entry.");

    private final String message;

    UnreachabilityReason(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
