package com.lexdfa;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Hopcroft partition refinement. The result is a new automaton; the input is
 * left untouched.
 *
 * <p>States that cannot reach an accepting state are dropped first (the start
 * state always survives). Accepting states start out grouped by winner token,
 * so merging never changes the token a string resolves to. Each final block
 * is represented by its smallest label.
 */
public final class HopcroftMinimizer {

    private HopcroftMinimizer() {
    }

    public static Dfa minimize(Dfa dfa) {
        SortedMap<String, DfaState> live = liveStates(dfa);
        Map<Character, Map<String, Set<String>>> predecessors = predecessors(dfa, live);

        List<SortedSet<String>> partition = initialPartition(live);
        Deque<SortedSet<String>> worklist = new ArrayDeque<>(partition);

        while (!worklist.isEmpty()) {
            SortedSet<String> splitter = worklist.poll();
            for (char symbol : dfa.getAlphabet()) {
                Set<String> x = sourcesInto(predecessors.get(symbol), splitter);
                if (x.isEmpty()) {
                    continue;
                }
                List<SortedSet<String>> refined = new ArrayList<>(partition.size() + 1);
                for (SortedSet<String> y : partition) {
                    SortedSet<String> inside = new TreeSet<>();
                    SortedSet<String> outside = new TreeSet<>();
                    for (String label : y) {
                        (x.contains(label) ? inside : outside).add(label);
                    }
                    if (inside.isEmpty() || outside.isEmpty()) {
                        refined.add(y);
                        continue;
                    }
                    refined.add(inside);
                    refined.add(outside);
                    if (worklist.remove(y)) {
                        worklist.add(inside);
                        worklist.add(outside);
                    } else {
                        worklist.add(inside.size() <= outside.size() ? inside : outside);
                    }
                }
                partition = refined;
            }
        }
        return rebuild(dfa, live, partition);
    }

    // states from which an accepting state is reachable, plus the start state
    private static SortedMap<String, DfaState> liveStates(Dfa dfa) {
        Map<DfaState, List<DfaState>> reverse = new HashMap<>();
        Deque<DfaState> pending = new ArrayDeque<>();
        SortedMap<String, DfaState> live = new TreeMap<>();
        for (DfaState s : dfa.getStates()) {
            for (DfaState t : s.getTransitions().values()) {
                reverse.computeIfAbsent(t, k -> new ArrayList<>()).add(s);
            }
            if (s.isAccepting()) {
                live.put(s.getLabel(), s);
                pending.push(s);
            }
        }
        while (!pending.isEmpty()) {
            for (DfaState p : reverse.getOrDefault(pending.pop(), new ArrayList<>())) {
                if (live.putIfAbsent(p.getLabel(), p) == null) {
                    pending.push(p);
                }
            }
        }
        live.put(dfa.getStart().getLabel(), dfa.getStart());
        return live;
    }

    // symbol -> target label -> labels of live states moving to it on symbol
    private static Map<Character, Map<String, Set<String>>> predecessors(Dfa dfa,
                                                                         SortedMap<String, DfaState> live) {
        Map<Character, Map<String, Set<String>>> result = new HashMap<>();
        for (char symbol : dfa.getAlphabet()) {
            result.put(symbol, new HashMap<>());
        }
        for (DfaState s : live.values()) {
            for (Map.Entry<Character, DfaState> t : s.getTransitions().entrySet()) {
                String target = t.getValue().getLabel();
                if (live.containsKey(target)) {
                    result.computeIfAbsent(t.getKey(), k -> new HashMap<>())
                            .computeIfAbsent(target, k -> new TreeSet<>())
                            .add(s.getLabel());
                }
            }
        }
        return result;
    }

    private static Set<String> sourcesInto(Map<String, Set<String>> bySymbol, Set<String> block) {
        Set<String> sources = new TreeSet<>();
        if (bySymbol == null) {
            return sources;
        }
        for (String target : block) {
            Set<String> s = bySymbol.get(target);
            if (s != null) {
                sources.addAll(s);
            }
        }
        return sources;
    }

    /**
     * Non-accepting states in one block (omitted when empty), then one block
     * per winner token. Accepting states without a winner share a block.
     */
    private static List<SortedSet<String>> initialPartition(SortedMap<String, DfaState> live) {
        SortedSet<String> rejecting = new TreeSet<>();
        SortedMap<String, SortedSet<String>> byWinner = new TreeMap<>();
        for (DfaState s : live.values()) {
            if (s.isAccepting()) {
                byWinner.computeIfAbsent(Objects.toString(s.getWinner(), ""), k -> new TreeSet<>())
                        .add(s.getLabel());
            } else {
                rejecting.add(s.getLabel());
            }
        }
        List<SortedSet<String>> partition = new ArrayList<>();
        if (!rejecting.isEmpty()) {
            partition.add(rejecting);
        }
        partition.addAll(byWinner.values());
        return partition;
    }

    private static Dfa rebuild(Dfa dfa, SortedMap<String, DfaState> live, List<SortedSet<String>> partition) {
        Map<String, DfaState> representative = new HashMap<>();
        SortedMap<String, DfaState> states = new TreeMap<>();
        for (SortedSet<String> block : partition) {
            DfaState rep = new DfaState(block.first(), null);
            states.put(rep.getLabel(), rep);
            for (String label : block) {
                representative.put(label, rep);
            }
        }

        for (DfaState old : live.values()) {
            DfaState from = representative.get(old.getLabel());
            if (old.isAccepting()) {
                from.accept(old.getContenders());
            }
            for (Map.Entry<Character, DfaState> t : old.getTransitions().entrySet()) {
                DfaState to = representative.get(t.getValue().getLabel());
                if (to != null) {
                    from.setTransition(t.getKey(), to);
                }
            }
        }
        return new Dfa(dfa.getAlphabet(), representative.get(dfa.getStart().getLabel()), states);
    }
}
