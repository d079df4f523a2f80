package com.lexdfa;

import java.util.Arrays;
import java.util.BitSet;

/**
 * An immutable set of NFA state ids with value equality, used as the identity
 * of a subset-construction state.
 */
public final class StateSet {
    private final int[] ids;
    private final int hash;

    private StateSet(int[] ids) {
        this.ids = ids;
        this.hash = Arrays.hashCode(ids);
    }

    public static StateSet of(BitSet members) {
        return new StateSet(members.stream().toArray());
    }

    public static StateSet of(int... members) {
        int[] ids = members.clone();
        Arrays.sort(ids);
        return new StateSet(Arrays.stream(ids).distinct().toArray());
    }

    public int size() {
        return ids.length;
    }

    public boolean isEmpty() {
        return ids.length == 0;
    }

    public boolean contains(int id) {
        return Arrays.binarySearch(ids, id) >= 0;
    }

    /**
     * Member ids in ascending order.
     */
    public int[] toArray() {
        return ids.clone();
    }

    public BitSet toBitSet() {
        BitSet bits = new BitSet();
        for (int id : ids) {
            bits.set(id);
        }
        return bits;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof StateSet && Arrays.equals(ids, ((StateSet) o).ids);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return Arrays.toString(ids);
    }
}
