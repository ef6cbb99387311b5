package com.raditha.jarl.cfg;

/**
 * How control leaves a basic block.
 *
 * @param kind   terminator kind
 * @param first  primary target block: goto/break/next target, then-block of a
 *               branch, body of a loop; {@code -1} when unused
 * @param second secondary target: else-block of a branch, after-block of a
 *               loop; {@code -1} when unused
 */
public record Terminator(Kind kind, int first, int second) {

    public enum Kind {
        UNSET,
        GOTO,
        RETURN,
        STOP,
        BREAK,
        NEXT,
        BRANCH,
        LOOP
    }

    private static final Terminator UNSET = new Terminator(Kind.UNSET, -1, -1);
    private static final Terminator RETURN = new Terminator(Kind.RETURN, -1, -1);
    private static final Terminator STOP = new Terminator(Kind.STOP, -1, -1);

    public static Terminator unset() {
        return UNSET;
    }

    public static Terminator jump(int target) {
        return new Terminator(Kind.GOTO, target, -1);
    }

    public static Terminator returns() {
        return RETURN;
    }

    public static Terminator stop() {
        return STOP;
    }

    public static Terminator breakTo(int target) {
        return new Terminator(Kind.BREAK, target, -1);
    }

    public static Terminator nextTo(int target) {
        return new Terminator(Kind.NEXT, target, -1);
    }

    public static Terminator branch(int thenBlock, int elseBlock) {
        return new Terminator(Kind.BRANCH, thenBlock, elseBlock);
    }

    public static Terminator loop(int body, int after) {
        return new Terminator(Kind.LOOP, body, after);
    }

    public boolean isSet() {
        return kind != Kind.UNSET;
    }
}
