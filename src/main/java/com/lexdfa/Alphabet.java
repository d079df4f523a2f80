package com.lexdfa;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.apache.commons.text.StringEscapeUtils;

/**
 * The fixed input alphabet: printable ASCII (space through '~') plus tab,
 * newline and carriage return.
 */
public final class Alphabet {

    private static final SortedSet<Character> SYMBOLS;
    private static final Set<Character> DIGITS;
    private static final Set<Character> WORD;
    private static final Set<Character> WHITESPACE;

    static {
        SortedSet<Character> symbols = new TreeSet<>();
        for (char c = 32; c < 127; c++) {
            symbols.add(c);
        }
        symbols.add('\t');
        symbols.add('\n');
        symbols.add('\r');
        SYMBOLS = Collections.unmodifiableSortedSet(symbols);

        SortedSet<Character> digits = range('0', '9');
        DIGITS = Collections.unmodifiableSortedSet(digits);

        SortedSet<Character> word = range('a', 'z');
        word.addAll(range('A', 'Z'));
        word.addAll(digits);
        word.add('_');
        WORD = Collections.unmodifiableSortedSet(word);

        SortedSet<Character> whitespace = new TreeSet<>();
        whitespace.add(' ');
        whitespace.add('\t');
        whitespace.add('\n');
        whitespace.add('\r');
        WHITESPACE = Collections.unmodifiableSortedSet(whitespace);
    }

    private Alphabet() {
    }

    public static SortedSet<Character> symbols() {
        return SYMBOLS;
    }

    public static boolean contains(char c) {
        return SYMBOLS.contains(c);
    }

    public static Set<Character> digits() {
        return DIGITS;
    }

    public static Set<Character> word() {
        return WORD;
    }

    public static Set<Character> whitespace() {
        return WHITESPACE;
    }

    /**
     * Every alphabet symbol that is not in {@code excluded}.
     */
    public static SortedSet<Character> complement(Set<Character> excluded) {
        SortedSet<Character> result = new TreeSet<>(SYMBOLS);
        result.removeAll(excluded);
        return result;
    }

    /**
     * Symbols named by an escape letter: {@code d}, {@code w}, {@code s} are
     * classes, {@code n}, {@code t}, {@code r} control characters, anything
     * else stands for itself.
     */
    public static Set<Character> escape(char c) {
        switch (c) {
            case 'd':
                return DIGITS;
            case 'w':
                return WORD;
            case 's':
                return WHITESPACE;
            case 'n':
                return Collections.singleton('\n');
            case 't':
                return Collections.singleton('\t');
            case 'r':
                return Collections.singleton('\r');
            default:
                return Collections.singleton(c);
        }
    }

    /**
     * Printable form of a symbol, used for tables and DOT labels.
     */
    public static String display(char c) {
        return StringEscapeUtils.escapeJava(String.valueOf(c));
    }

    private static SortedSet<Character> range(char from, char to) {
        SortedSet<Character> result = new TreeSet<>();
        for (char c = from; c <= to; c++) {
            result.add(c);
        }
        return result;
    }
}
