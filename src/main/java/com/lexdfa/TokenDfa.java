package com.lexdfa;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.apache.commons.lang3.StringUtils;

/**
 * An already deterministic automaton recognising one token, as supplied to
 * {@link AutomatonUnion}. Lower priority values take precedence.
 */
public final class TokenDfa {
    public static final int DEFAULT_PRIORITY = 100;

    private final String name;
    private final int priority;
    private final SortedSet<String> states;
    private final SortedSet<Character> alphabet;
    private final String start;
    private final SortedSet<String> accept;
    private final SortedMap<String, SortedMap<Character, String>> transitions;

    private TokenDfa(Builder b) {
        this.name = b.name;
        this.priority = b.priority;
        this.states = Collections.unmodifiableSortedSet(new TreeSet<>(b.states));
        this.alphabet = Collections.unmodifiableSortedSet(new TreeSet<>(b.alphabet));
        this.start = b.start;
        this.accept = Collections.unmodifiableSortedSet(new TreeSet<>(b.accept));
        SortedMap<String, SortedMap<Character, String>> delta = new TreeMap<>();
        for (Map.Entry<String, SortedMap<Character, String>> e : b.transitions.entrySet()) {
            delta.put(e.getKey(), Collections.unmodifiableSortedMap(new TreeMap<>(e.getValue())));
        }
        this.transitions = Collections.unmodifiableSortedMap(delta);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Token automaton over the states of a compiled DFA; its accepting states
     * become the token's accept states.
     */
    public static TokenDfa fromDfa(String name, int priority, Dfa dfa) {
        Builder b = builder(name).priority(priority).start(dfa.getStart().getLabel());
        for (char c : dfa.getAlphabet()) {
            b.symbol(c);
        }
        for (DfaState s : dfa.getStates()) {
            b.state(s.getLabel());
            if (s.isAccepting()) {
                b.accept(s.getLabel());
            }
            for (Map.Entry<Character, DfaState> t : s.getTransitions().entrySet()) {
                b.transition(s.getLabel(), t.getKey(), t.getValue().getLabel());
            }
        }
        return b.build();
    }

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    public SortedSet<String> getStates() {
        return states;
    }

    public SortedSet<Character> getAlphabet() {
        return alphabet;
    }

    public String getStart() {
        return start;
    }

    public SortedSet<String> getAccept() {
        return accept;
    }

    /**
     * state -> symbol -> target state.
     */
    public SortedMap<String, SortedMap<Character, String>> getTransitions() {
        return transitions;
    }

    @Override
    public String toString() {
        return "TokenDfa[" + name + ", priority=" + priority + ", states=" + states.size() + "]";
    }

    public static final class Builder {
        private final String name;
        private int priority = DEFAULT_PRIORITY;
        private final SortedSet<String> states = new TreeSet<>();
        private final SortedSet<Character> alphabet = new TreeSet<>();
        private String start;
        private final SortedSet<String> accept = new TreeSet<>();
        private final SortedMap<String, SortedMap<Character, String>> transitions = new TreeMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder state(String... labels) {
            Collections.addAll(states, labels);
            return this;
        }

        public Builder symbol(char c) {
            alphabet.add(c);
            return this;
        }

        public Builder alphabet(String symbols) {
            for (int i = 0; i < symbols.length(); i++) {
                alphabet.add(symbols.charAt(i));
            }
            return this;
        }

        public Builder start(String label) {
            this.start = label;
            return this;
        }

        public Builder accept(String... labels) {
            Collections.addAll(accept, labels);
            return this;
        }

        public Builder transition(String from, char symbol, String to) {
            String previous = transitions.computeIfAbsent(from, k -> new TreeMap<>()).put(symbol, to);
            if (previous != null && !previous.equals(to)) {
                throw new AutomatonStructureError("token " + name + " is not deterministic: state " + from
                        + " has two transitions on " + Alphabet.display(symbol));
            }
            return this;
        }

        /**
         * Validates and freezes the automaton. When no states were declared
         * they are collected from start, accept and transitions; when no
         * alphabet was declared it is collected from the transitions. Names
         * may not contain {@link AutomatonUnion#SEPARATOR}, which joins token
         * and state in union labels.
         *
         * @throws AutomatonStructureError if the automaton is inconsistent
         */
        public TokenDfa build() {
            if (StringUtils.isBlank(name)) {
                throw new AutomatonStructureError("token name must not be blank");
            }
            if (StringUtils.contains(name, AutomatonUnion.SEPARATOR)) {
                throw new AutomatonStructureError("token name must not contain '" + AutomatonUnion.SEPARATOR
                        + "': " + name);
            }
            if (start == null) {
                throw new AutomatonStructureError("token " + name + " has no start state");
            }
            boolean declaredStates = !states.isEmpty();
            boolean declaredAlphabet = !alphabet.isEmpty();
            requireState(start, declaredStates);
            for (String a : accept) {
                requireState(a, declaredStates);
            }
            for (Map.Entry<String, SortedMap<Character, String>> e : transitions.entrySet()) {
                requireState(e.getKey(), declaredStates);
                for (Map.Entry<Character, String> t : e.getValue().entrySet()) {
                    requireState(t.getValue(), declaredStates);
                    if (!alphabet.contains(t.getKey())) {
                        if (declaredAlphabet) {
                            throw new AutomatonStructureError("token " + name + ": symbol "
                                    + Alphabet.display(t.getKey()) + " is not in its alphabet");
                        }
                        alphabet.add(t.getKey());
                    }
                }
            }
            return new TokenDfa(this);
        }

        private void requireState(String label, boolean declared) {
            if (states.contains(label)) {
                return;
            }
            if (declared) {
                throw new AutomatonStructureError("token " + name + ": unknown state " + label);
            }
            states.add(label);
        }
    }
}
