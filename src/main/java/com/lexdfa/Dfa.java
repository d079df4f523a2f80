package com.lexdfa;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;

/**
 * A deterministic automaton with a partial transition function: a missing
 * transition rejects. Accepting states may carry contenders and a winner
 * token.
 */
public class Dfa {
    private final SortedSet<Character> alphabet;
    private final DfaState start;
    private final SortedMap<String, DfaState> states;

    Dfa(SortedSet<Character> alphabet, DfaState start, SortedMap<String, DfaState> states) {
        this.alphabet = alphabet;
        this.start = start;
        this.states = Collections.unmodifiableSortedMap(new TreeMap<>(states));
    }

    public SortedSet<Character> getAlphabet() {
        return alphabet;
    }

    public DfaState getStart() {
        return start;
    }

    /**
     * States in label order.
     */
    public Collection<DfaState> getStates() {
        return states.values();
    }

    public DfaState getState(String label) {
        return states.get(label);
    }

    public int size() {
        return states.size();
    }

    public int transitionCount() {
        int n = 0;
        for (DfaState s : states.values()) {
            n += s.getTransitions().size();
        }
        return n;
    }

    public MatchResult match(CharSequence input) {
        DfaState current = start;
        for (int i = 0; i < input.length(); i++) {
            current = current.next(input.charAt(i));
            if (current == null) {
                return MatchResult.REJECTED;
            }
        }
        if (!current.isAccepting()) {
            return new MatchResult(false, null, current.getLabel());
        }
        return new MatchResult(true, current.getWinner(), current.getLabel());
    }

    public boolean accepts(CharSequence input) {
        return match(input).isAccepted();
    }

    /**
     * The token {@code input} resolves to, or null if it is rejected.
     */
    public String winner(CharSequence input) {
        return match(input).getToken();
    }

    @Override
    public String toString() {
        return "Dfa[states=" + states.size() + ", start=" + start.getLabel() + "]";
    }
}
