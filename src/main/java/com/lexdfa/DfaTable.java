package com.lexdfa;

import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Inspection table of a DFA. Layout:
 *
 * <pre>
 * { "states":   [labels, sorted],
 *   "alphabet": [Java-escaped symbols, sorted as strings],
 *   "start":    label,
 *   "finals":   { label: { "winner": token or null, "contenders": { token: priority } } },
 *   "delta":    { "label|symbol": target, keys sorted } }
 * </pre>
 */
public final class DfaTable {
    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeNulls()
            .create();

    private DfaTable() {
    }

    public static JsonObject export(Dfa dfa) {
        JsonObject table = new JsonObject();

        JsonArray states = new JsonArray();
        for (DfaState s : dfa.getStates()) {
            states.add(s.getLabel());
        }
        table.add("states", states);

        SortedSet<String> symbols = new TreeSet<>();
        for (char c : dfa.getAlphabet()) {
            symbols.add(Alphabet.display(c));
        }
        JsonArray alphabet = new JsonArray();
        for (String symbol : symbols) {
            alphabet.add(symbol);
        }
        table.add("alphabet", alphabet);

        table.addProperty("start", dfa.getStart().getLabel());

        JsonObject finals = new JsonObject();
        SortedMap<String, String> delta = new TreeMap<>();
        for (DfaState s : dfa.getStates()) {
            if (s.isAccepting()) {
                JsonObject entry = new JsonObject();
                entry.addProperty("winner", s.getWinner());
                JsonObject contenders = new JsonObject();
                for (Map.Entry<String, Integer> c : s.getContenders().entrySet()) {
                    contenders.addProperty(c.getKey(), c.getValue());
                }
                entry.add("contenders", contenders);
                finals.add(s.getLabel(), entry);
            }
            for (Map.Entry<Character, DfaState> t : s.getTransitions().entrySet()) {
                delta.put(s.getLabel() + "|" + Alphabet.display(t.getKey()), t.getValue().getLabel());
            }
        }
        table.add("finals", finals);

        JsonObject transitions = new JsonObject();
        for (Map.Entry<String, String> t : delta.entrySet()) {
            transitions.addProperty(t.getKey(), t.getValue());
        }
        table.add("delta", transitions);
        return table;
    }

    public static String toJson(Dfa dfa) {
        return GSON.toJson(export(dfa));
    }
}
