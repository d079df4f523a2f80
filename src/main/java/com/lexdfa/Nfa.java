package com.lexdfa;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Arena of NFA states addressed by small integer ids. The arena assigns ids in
 * creation order starting at 0, so every compilation owns its own id sequence
 * and labels are reproducible.
 *
 * <p>A regex NFA has a single accepting state (the exit of its Thompson
 * fragment); a union NFA has one accepting state per accept state of each
 * token automaton, each carrying its token and priority.
 */
public class Nfa {
    private final List<NfaState> states = new ArrayList<>();
    private final SortedSet<Character> alphabet;
    private int start = -1;

    public Nfa() {
        this(Alphabet.symbols());
    }

    public Nfa(Set<Character> alphabet) {
        this.alphabet = Collections.unmodifiableSortedSet(new TreeSet<>(alphabet));
    }

    public NfaState newState() {
        return newState(null);
    }

    /**
     * Allocates a state. A null label defaults to the decimal id.
     */
    public NfaState newState(String label) {
        int id = states.size();
        NfaState state = new NfaState(id, label == null ? Integer.toString(id) : label);
        states.add(state);
        return state;
    }

    public NfaState state(int id) {
        return states.get(id);
    }

    public int size() {
        return states.size();
    }

    public List<NfaState> getStates() {
        return Collections.unmodifiableList(states);
    }

    public SortedSet<Character> getAlphabet() {
        return alphabet;
    }

    public NfaState getStart() {
        if (start < 0) {
            throw new AutomatonStructureError("NFA has no start state");
        }
        return states.get(start);
    }

    public void setStart(int id) {
        checkId(id);
        this.start = id;
    }

    public void addEpsilon(int from, int to) {
        checkId(from);
        checkId(to);
        states.get(from).addEpsilon(to);
    }

    public void addTransition(int from, Set<Character> symbols, int to) {
        checkId(from);
        checkId(to);
        states.get(from).addTransition(Collections.unmodifiableSet(new TreeSet<>(symbols)), to);
    }

    public void setAccepting(int id) {
        checkId(id);
        states.get(id).setAccepting(true);
    }

    public void addContender(int id, String token, int priority) {
        checkId(id);
        states.get(id).addContender(token, priority);
    }

    /**
     * Checks the Thompson shape of a fragment: distinct entry and exit, no
     * edge into the entry and no edge out of the exit.
     *
     * @throws AutomatonStructureError if the shape is violated
     */
    public void checkFragment(NfaFragment fragment) {
        checkId(fragment.entry);
        checkId(fragment.exit);
        if (fragment.entry == fragment.exit) {
            throw new AutomatonStructureError("fragment entry and exit coincide: " + fragment);
        }
        if (states.get(fragment.exit).hasOutgoingEdges()) {
            throw new AutomatonStructureError("fragment exit has outgoing edges: " + fragment);
        }
        for (NfaState s : states) {
            if (s.getEpsilon().get(fragment.entry)) {
                throw new AutomatonStructureError("fragment entry has an incoming epsilon edge from "
                        + s.getLabel() + ": " + fragment);
            }
            for (BitSet targets : s.getTransitions().values()) {
                if (targets.get(fragment.entry)) {
                    throw new AutomatonStructureError("fragment entry has an incoming transition from "
                            + s.getLabel() + ": " + fragment);
                }
            }
        }
    }

    private void checkId(int id) {
        if (id < 0 || id >= states.size()) {
            throw new AutomatonStructureError("no state " + id + " in this NFA");
        }
    }

    @Override
    public String toString() {
        return "Nfa[states=" + states.size() + ", start=" + start + "]";
    }
}
