package com.lexdfa;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A DFA state. States are created and wired only by the pass that builds
 * their automaton; afterwards every view is read-only.
 */
public final class DfaState {
    private final String label;
    private final StateSet subset;
    private final SortedMap<Character, DfaState> transitions = new TreeMap<>();
    private final SortedMap<String, Integer> contenders = new TreeMap<>();
    private boolean accepting;
    private String winner;

    DfaState(String label, StateSet subset) {
        this.label = label;
        this.subset = subset;
    }

    public String getLabel() {
        return label;
    }

    /**
     * The NFA states this state stands for; null for states produced by
     * minimization.
     */
    public StateSet getSubset() {
        return subset;
    }

    public boolean isAccepting() {
        return accepting;
    }

    public SortedMap<String, Integer> getContenders() {
        return Collections.unmodifiableSortedMap(contenders);
    }

    public String getWinner() {
        return winner;
    }

    public DfaState next(char symbol) {
        return transitions.get(symbol);
    }

    public SortedMap<Character, DfaState> getTransitions() {
        return Collections.unmodifiableSortedMap(transitions);
    }

    void setTransition(char symbol, DfaState target) {
        DfaState previous = transitions.put(symbol, target);
        if (previous != null && previous != target) {
            throw new AutomatonStructureError("second transition from " + label + " on "
                    + Alphabet.display(symbol));
        }
    }

    void accept(Map<String, Integer> tokens) {
        accepting = true;
        Contenders.mergeInto(contenders, tokens);
        winner = Contenders.winner(contenders);
    }

    @Override
    public String toString() {
        return label;
    }
}
