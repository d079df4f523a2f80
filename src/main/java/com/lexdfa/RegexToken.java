package com.lexdfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One lexical unit of a pattern. Atoms (literal, escape, class, any) become
 * Thompson fragments; the remaining kinds are operators and grouping.
 */
public final class RegexToken {

    public enum Kind {
        LITERAL(true, 0),
        ESCAPE(true, 0),
        CLASS(true, 0),
        ANY(true, 0),
        LPAREN(false, 0),
        RPAREN(false, 0),
        UNION(false, 3),
        CONCAT(false, 4),
        STAR(false, 5),
        PLUS(false, 5),
        OPTIONAL(false, 5);

        private final boolean atom;
        private final int precedence;

        Kind(boolean atom, int precedence) {
            this.atom = atom;
            this.precedence = precedence;
        }

        public boolean isAtom() {
            return atom;
        }

        public boolean isOperator() {
            return precedence > 0;
        }

        public int precedence() {
            return precedence;
        }
    }

    public static final RegexToken CONCAT = new RegexToken(Kind.CONCAT, "\u00b7", false, null);
    public static final RegexToken UNION = new RegexToken(Kind.UNION, "|", false, null);
    public static final RegexToken STAR = new RegexToken(Kind.STAR, "*", false, null);
    public static final RegexToken PLUS = new RegexToken(Kind.PLUS, "+", false, null);
    public static final RegexToken OPTIONAL = new RegexToken(Kind.OPTIONAL, "?", false, null);
    public static final RegexToken LPAREN = new RegexToken(Kind.LPAREN, "(", false, null);
    public static final RegexToken RPAREN = new RegexToken(Kind.RPAREN, ")", false, null);
    public static final RegexToken ANY = new RegexToken(Kind.ANY, ".", false, null);

    private final Kind kind;
    private final String text;
    private final boolean negated;
    private final List<String> members;

    private RegexToken(Kind kind, String text, boolean negated, List<String> members) {
        this.kind = kind;
        this.text = text;
        this.negated = negated;
        this.members = members;
    }

    public static RegexToken literal(char c) {
        return new RegexToken(Kind.LITERAL, String.valueOf(c), false, null);
    }

    public static RegexToken escape(char c) {
        return new RegexToken(Kind.ESCAPE, "\\" + c, false, null);
    }

    /**
     * A bracket class. Each member is either a single symbol (ranges are
     * already expanded) or a two character escape such as {@code \d}.
     */
    public static RegexToken charClass(boolean negated, List<String> members) {
        List<String> copy = Collections.unmodifiableList(new ArrayList<>(members));
        StringBuilder sb = new StringBuilder(negated ? "[^" : "[");
        for (String m : copy) {
            sb.append(m);
        }
        sb.append(']');
        return new RegexToken(Kind.CLASS, sb.toString(), negated, copy);
    }

    public Kind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public boolean isNegated() {
        return negated;
    }

    public List<String> getMembers() {
        return members == null ? Collections.emptyList() : members;
    }

    /**
     * The escaped character of an {@link Kind#ESCAPE} token, or the symbol of
     * a {@link Kind#LITERAL}.
     */
    public char symbol() {
        return kind == Kind.ESCAPE ? text.charAt(1) : text.charAt(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RegexToken)) {
            return false;
        }
        RegexToken other = (RegexToken) o;
        return kind == other.kind && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text);
    }

    @Override
    public String toString() {
        return text;
    }
}
