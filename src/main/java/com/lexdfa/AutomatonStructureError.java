package com.lexdfa;

/**
 * A postfix sequence with the wrong operand arity, an invalid token automaton,
 * or a violated construction invariant.
 */
public class AutomatonStructureError extends AutomatonException {

    public AutomatonStructureError(String message) {
        super(Kind.STRUCTURE, message);
    }
}
