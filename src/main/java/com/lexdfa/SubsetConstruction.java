package com.lexdfa;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Subset construction over the NFA's alphabet. Each DFA state is the epsilon
 * closure of a set of NFA states; two closures with the same members always
 * map to the same {@link DfaState}.
 */
public final class SubsetConstruction {

    private SubsetConstruction() {
    }

    public static Dfa determinize(Nfa nfa) {
        Map<StateSet, DfaState> dfaStates = new HashMap<>();
        SortedMap<String, DfaState> byLabel = new TreeMap<>();
        Deque<StateSet> worklist = new ArrayDeque<>();

        BitSet initial = new BitSet();
        initial.set(nfa.getStart().getId());
        StateSet startSet = StateSet.of(epsilonClosure(nfa, initial));
        DfaState start = register(nfa, startSet, dfaStates, byLabel);
        worklist.add(startSet);

        while (!worklist.isEmpty()) {
            StateSet current = worklist.poll();
            DfaState from = dfaStates.get(current);
            BitSet members = current.toBitSet();

            for (char symbol : nfa.getAlphabet()) {
                BitSet moved = move(nfa, members, symbol);
                if (moved.isEmpty()) {
                    continue;
                }
                StateSet target = StateSet.of(epsilonClosure(nfa, moved));
                DfaState to = dfaStates.get(target);
                if (to == null) {
                    to = register(nfa, target, dfaStates, byLabel);
                    worklist.add(target);
                }
                from.setTransition(symbol, to);
            }
        }
        return new Dfa(nfa.getAlphabet(), start, byLabel);
    }

    /**
     * All states reachable from {@code states} through epsilon edges alone,
     * including the states themselves.
     */
    public static BitSet epsilonClosure(Nfa nfa, BitSet states) {
        BitSet closure = (BitSet) states.clone();
        Deque<Integer> stack = new ArrayDeque<>();
        states.stream().forEach(stack::push);
        while (!stack.isEmpty()) {
            BitSet eps = nfa.state(stack.pop()).getEpsilon();
            for (int next = eps.nextSetBit(0); next >= 0; next = eps.nextSetBit(next + 1)) {
                if (!closure.get(next)) {
                    closure.set(next);
                    stack.push(next);
                }
            }
        }
        return closure;
    }

    /**
     * Targets of the {@code symbol} transitions leaving any state in
     * {@code states}.
     */
    public static BitSet move(Nfa nfa, BitSet states, char symbol) {
        BitSet result = new BitSet();
        for (int id = states.nextSetBit(0); id >= 0; id = states.nextSetBit(id + 1)) {
            for (Map.Entry<Set<Character>, BitSet> t : nfa.state(id).getTransitions().entrySet()) {
                if (t.getKey().contains(symbol)) {
                    result.or(t.getValue());
                }
            }
        }
        return result;
    }

    /**
     * Canonical label of a subset: member labels sorted as strings, in braces.
     */
    public static String label(Nfa nfa, StateSet set) {
        List<String> labels = new ArrayList<>(set.size());
        for (int id : set.toArray()) {
            labels.add(nfa.state(id).getLabel());
        }
        Collections.sort(labels);
        return "{" + String.join(",", labels) + "}";
    }

    private static DfaState register(Nfa nfa, StateSet set, Map<StateSet, DfaState> dfaStates,
                                     SortedMap<String, DfaState> byLabel) {
        String label = label(nfa, set);
        if (byLabel.containsKey(label)) {
            throw new AutomatonStructureError("NFA state labels are ambiguous, two subsets share label " + label);
        }
        DfaState state = new DfaState(label, set);
        boolean accepting = false;
        Map<String, Integer> contenders = new TreeMap<>();
        for (int id : set.toArray()) {
            NfaState member = nfa.state(id);
            if (member.isAccepting()) {
                accepting = true;
                Contenders.mergeInto(contenders, member.getContenders());
            }
        }
        if (accepting) {
            state.accept(contenders);
        }
        dfaStates.put(set, state);
        byLabel.put(label, state);
        return state;
    }
}
