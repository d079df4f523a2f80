package com.lexdfa;

import java.util.Comparator;
import java.util.Map;

/**
 * Rules for contender maps (token name to priority, lower wins).
 */
public final class Contenders {

    /**
     * Total order over (token, priority) entries: smaller priority first, then
     * the lexicographically smaller token name.
     */
    public static final Comparator<Map.Entry<String, Integer>> ORDER =
            Comparator.<Map.Entry<String, Integer>>comparingInt(Map.Entry::getValue)
                    .thenComparing(Map.Entry::getKey);

    private Contenders() {
    }

    /**
     * Adds one contender, keeping the smaller priority if the token is
     * already present.
     */
    public static void mergeInto(Map<String, Integer> target, String token, int priority) {
        target.merge(token, priority, Math::min);
    }

    public static void mergeInto(Map<String, Integer> target, Map<String, Integer> source) {
        for (Map.Entry<String, Integer> e : source.entrySet()) {
            mergeInto(target, e.getKey(), e.getValue());
        }
    }

    /**
     * The winning token, or null for an empty map.
     */
    public static String winner(Map<String, Integer> contenders) {
        Map.Entry<String, Integer> best = null;
        for (Map.Entry<String, Integer> e : contenders.entrySet()) {
            if (best == null || ORDER.compare(e, best) < 0) {
                best = e;
            }
        }
        return best == null ? null : best.getKey();
    }
}
