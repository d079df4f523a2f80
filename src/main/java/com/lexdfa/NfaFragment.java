package com.lexdfa;

/**
 * A Thompson fragment: one entry state and one exit state of the arena that
 * built it. Fragments compose through epsilon edges only.
 */
public final class NfaFragment {
    public final int entry;
    public final int exit;

    public NfaFragment(int entry, int exit) {
        this.entry = entry;
        this.exit = exit;
    }

    @Override
    public String toString() {
        return "NfaFragment[" + entry + " -> " + exit + "]";
    }
}
