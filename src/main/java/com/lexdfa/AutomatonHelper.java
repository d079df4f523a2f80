package com.lexdfa;

import java.util.HashMap;
import java.util.Map;

import dk.brics.automaton.Automaton;
import dk.brics.automaton.State;
import dk.brics.automaton.Transition;

/**
 * Bridges compiled automata to dk.brics.automaton for DOT rendering and
 * example strings.
 */
public final class AutomatonHelper {

    private AutomatonHelper() {
    }

    /**
     * Copies {@code dfa} into a brics automaton accepting the same language.
     * Token information is not carried over.
     */
    public static Automaton toAutomaton(Dfa dfa) {
        Map<DfaState, State> oldToNewStates = new HashMap<>();
        for (DfaState s : dfa.getStates()) {
            State newState = new State();
            newState.setAccept(s.isAccepting());
            oldToNewStates.put(s, newState);
        }
        for (DfaState s : dfa.getStates()) {
            State from = oldToNewStates.get(s);
            for (Map.Entry<Character, DfaState> t : s.getTransitions().entrySet()) {
                from.addTransition(new Transition(t.getKey(), oldToNewStates.get(t.getValue())));
            }
        }
        Automaton a = new Automaton();
        a.setInitialState(oldToNewStates.get(dfa.getStart()));
        a.setDeterministic(true);
        a.restoreInvariant();
        return a;
    }

    public static String toDot(Dfa dfa) {
        return toAutomaton(dfa).toDot();
    }

    /**
     * A shortest accepted string (the lexicographically first among them), or
     * null if the language is empty.
     */
    public static String shortestExample(Dfa dfa) {
        return toAutomaton(dfa).getShortestExample(true);
    }
}
