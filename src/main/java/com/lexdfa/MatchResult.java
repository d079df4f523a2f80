package com.lexdfa;

/**
 * Outcome of running a whole candidate string through a compiled DFA.
 */
public final class MatchResult {
    static final MatchResult REJECTED = new MatchResult(false, null, null);

    private final boolean accepted;
    private final String token;
    private final String state;

    MatchResult(boolean accepted, String token, String state) {
        this.accepted = accepted;
        this.token = token;
        this.state = state;
    }

    public boolean isAccepted() {
        return accepted;
    }

    /**
     * The winner token of the final state; null when rejected or when the
     * automaton was compiled without token names.
     */
    public String getToken() {
        return token;
    }

    /**
     * Label of the state the input ended in, null when the run fell off the
     * transition function.
     */
    public String getState() {
        return state;
    }

    @Override
    public String toString() {
        return accepted ? "MatchResult[accepted, token=" + token + ", state=" + state + "]"
                : "MatchResult[rejected]";
    }
}
