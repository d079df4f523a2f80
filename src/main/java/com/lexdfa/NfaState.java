package com.lexdfa;

import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A node of an {@link Nfa} arena. Successors are ids of states in the same
 * arena, so equality is the inherited identity equality.
 */
public final class NfaState {
    private final int id;
    private final String label;
    private final BitSet epsilon = new BitSet();
    private final Map<Set<Character>, BitSet> transitions = new LinkedHashMap<>();
    private final SortedMap<String, Integer> contenders = new TreeMap<>();
    private boolean accepting;

    NfaState(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Ids of the states reachable through one epsilon edge. Callers must not
     * modify the returned set.
     */
    public BitSet getEpsilon() {
        return epsilon;
    }

    public Map<Set<Character>, BitSet> getTransitions() {
        return Collections.unmodifiableMap(transitions);
    }

    public boolean isAccepting() {
        return accepting;
    }

    public SortedMap<String, Integer> getContenders() {
        return Collections.unmodifiableSortedMap(contenders);
    }

    boolean hasOutgoingEdges() {
        return !epsilon.isEmpty() || !transitions.isEmpty();
    }

    void addEpsilon(int target) {
        epsilon.set(target);
    }

    void addTransition(Set<Character> symbols, int target) {
        transitions.computeIfAbsent(symbols, k -> new BitSet()).set(target);
    }

    void setAccepting(boolean accepting) {
        this.accepting = accepting;
    }

    void addContender(String token, int priority) {
        accepting = true;
        Contenders.mergeInto(contenders, token, priority);
    }

    @Override
    public String toString() {
        return "NfaState[" + label + "]";
    }
}
