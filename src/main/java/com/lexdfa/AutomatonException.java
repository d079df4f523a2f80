package com.lexdfa;

/**
 * Base class of the failures raised while turning a pattern or a set of token
 * automata into a DFA. Compilation is deterministic, so a failing input fails
 * the same way every time.
 */
public abstract class AutomatonException extends IllegalArgumentException {

    public enum Kind {
        SYNTAX, STRUCTURE
    }

    private final Kind kind;

    protected AutomatonException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
