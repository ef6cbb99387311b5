package com.raditha.jarl.syntax;

/**
 * Raised when R source cannot be parsed.
 */
public class ParseException extends Exception {

    private final int offset;

    public ParseException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    /**
     * Offset of the offending character or token.
     */
    public int offset() {
        return offset;
    }
}
