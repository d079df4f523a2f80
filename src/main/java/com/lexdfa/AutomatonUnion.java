package com.lexdfa;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeSet;

/**
 * Joins independently built token automata into one NFA: a synthetic start
 * state with an epsilon edge to the start of every token automaton. Each
 * token's states are relabelled {@code NAME.state} so that equal labels in
 * different automata never collide (token names never contain the
 * separator), and each accept state is tagged with
 * (name, priority).
 *
 * <p>The result feeds {@link SubsetConstruction} and
 * {@link HopcroftMinimizer} like any regex NFA.
 */
public final class AutomatonUnion {
    public static final String START_LABEL = "S";
    public static final char SEPARATOR = '.';

    private AutomatonUnion() {
    }

    public static Nfa union(Collection<TokenDfa> tokens) {
        Set<Character> alphabet = new TreeSet<>();
        Set<String> names = new HashSet<>();
        for (TokenDfa token : tokens) {
            if (!names.add(token.getName())) {
                throw new AutomatonStructureError("duplicate token name in union: " + token.getName());
            }
            alphabet.addAll(token.getAlphabet());
        }

        Nfa nfa = new Nfa(alphabet);
        int start = nfa.newState(START_LABEL).getId();
        nfa.setStart(start);

        for (TokenDfa token : tokens) {
            String prefix = token.getName() + SEPARATOR;
            Map<String, Integer> ids = new HashMap<>();
            for (String label : token.getStates()) {
                ids.put(label, nfa.newState(prefix + label).getId());
            }

            nfa.addEpsilon(start, ids.get(token.getStart()));

            for (Map.Entry<String, SortedMap<Character, String>> row : token.getTransitions().entrySet()) {
                int from = ids.get(row.getKey());
                for (Map.Entry<Character, String> t : row.getValue().entrySet()) {
                    nfa.addTransition(from, Collections.singleton(t.getKey()), ids.get(t.getValue()));
                }
            }

            for (String label : token.getAccept()) {
                nfa.addContender(ids.get(label), token.getName(), token.getPriority());
            }
        }
        return nfa;
    }
}
