package com.lexdfa;

/**
 * Malformed pattern text: dangling escape, unterminated class, malformed range
 * or unbalanced grouping.
 */
public class PatternSyntaxError extends AutomatonException {
    private final String pattern;
    private final int index;

    public PatternSyntaxError(String description, String pattern, int index) {
        super(Kind.SYNTAX, description + " at index " + index + " in " + PatternParser.wrapInQuotes(pattern));
        this.pattern = pattern;
        this.index = index;
    }

    public PatternSyntaxError(String description, String pattern) {
        super(Kind.SYNTAX, description + " in " + PatternParser.wrapInQuotes(pattern));
        this.pattern = pattern;
        this.index = -1;
    }

    public String getPattern() {
        return pattern;
    }

    /**
     * Position in the pattern, or -1 when the error concerns the pattern as a
     * whole (unbalanced grouping).
     */
    public int getIndex() {
        return index;
    }
}
