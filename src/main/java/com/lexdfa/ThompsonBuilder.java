package com.lexdfa;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Thompson construction: a postfix token sequence becomes one NFA fragment.
 * Every combinator allocates fresh entry/exit states (except concatenation,
 * which reuses the operands' outer states) and joins fragments with epsilon
 * edges only.
 *
 * <p>A builder owns one {@link Nfa} arena and is used for a single
 * compilation.
 */
public class ThompsonBuilder {
    private final Nfa nfa;
    private final boolean verifyFragments;

    public ThompsonBuilder() {
        this(false);
    }

    /**
     * @param verifyFragments check the single-entry/single-exit shape of every
     *                        intermediate fragment, not only the final one
     */
    public ThompsonBuilder(boolean verifyFragments) {
        this.nfa = new Nfa();
        this.verifyFragments = verifyFragments;
    }

    public Nfa getNfa() {
        return nfa;
    }

    /**
     * Builds the NFA of a postfix sequence: the fragment entry becomes the
     * start state and the exit the only accepting state.
     */
    public Nfa build(List<RegexToken> postfix) {
        NfaFragment fragment = postfixToNfa(postfix);
        nfa.setStart(fragment.entry);
        nfa.setAccepting(fragment.exit);
        return nfa;
    }

    /**
     * Like {@link #build(List)}, with the accepting state tagged as
     * {@code token} at {@code priority}.
     */
    public Nfa build(List<RegexToken> postfix, String token, int priority) {
        NfaFragment fragment = postfixToNfa(postfix);
        nfa.setStart(fragment.entry);
        nfa.addContender(fragment.exit, token, priority);
        return nfa;
    }

    public Set<Character> symbolsOf(RegexToken atom) {
        switch (atom.getKind()) {
            case LITERAL:
                return Collections.singleton(atom.symbol());
            case ESCAPE:
                return Alphabet.escape(atom.symbol());
            case ANY:
                return Alphabet.symbols();
            case CLASS:
                Set<Character> members = new TreeSet<>();
                for (String m : atom.getMembers()) {
                    if (m.length() == 2 && m.charAt(0) == '\\') {
                        members.addAll(Alphabet.escape(m.charAt(1)));
                    } else {
                        members.add(m.charAt(0));
                    }
                }
                return atom.isNegated() ? Alphabet.complement(members) : members;
            default:
                throw new AutomatonStructureError("not an atom: " + atom);
        }
    }

    public NfaFragment atomToFragment(RegexToken atom) {
        Set<Character> symbols = symbolsOf(atom);
        NfaState s = nfa.newState();
        NfaState e = nfa.newState();
        nfa.addTransition(s.getId(), symbols, e.getId());
        return new NfaFragment(s.getId(), e.getId());
    }

    public NfaFragment postfixToNfa(List<RegexToken> postfix) {
        Deque<NfaFragment> stack = new ArrayDeque<>();

        for (RegexToken tok : postfix) {
            NfaFragment result;
            switch (tok.getKind()) {
                case CONCAT: {
                    NfaFragment right = pop(stack, tok, 2);
                    NfaFragment left = stack.pop();
                    nfa.addEpsilon(left.exit, right.entry);
                    result = new NfaFragment(left.entry, right.exit);
                    break;
                }
                case UNION: {
                    NfaFragment right = pop(stack, tok, 2);
                    NfaFragment left = stack.pop();
                    int s = nfa.newState().getId();
                    int e = nfa.newState().getId();
                    nfa.addEpsilon(s, left.entry);
                    nfa.addEpsilon(s, right.entry);
                    nfa.addEpsilon(left.exit, e);
                    nfa.addEpsilon(right.exit, e);
                    result = new NfaFragment(s, e);
                    break;
                }
                case STAR: {
                    NfaFragment inner = pop(stack, tok, 1);
                    int s = nfa.newState().getId();
                    int e = nfa.newState().getId();
                    nfa.addEpsilon(s, inner.entry);
                    nfa.addEpsilon(s, e);
                    nfa.addEpsilon(inner.exit, inner.entry);
                    nfa.addEpsilon(inner.exit, e);
                    result = new NfaFragment(s, e);
                    break;
                }
                case PLUS: {
                    NfaFragment inner = pop(stack, tok, 1);
                    int s = nfa.newState().getId();
                    int e = nfa.newState().getId();
                    nfa.addEpsilon(s, inner.entry);
                    nfa.addEpsilon(inner.exit, inner.entry);
                    nfa.addEpsilon(inner.exit, e);
                    result = new NfaFragment(s, e);
                    break;
                }
                case OPTIONAL: {
                    NfaFragment inner = pop(stack, tok, 1);
                    int s = nfa.newState().getId();
                    int e = nfa.newState().getId();
                    nfa.addEpsilon(s, inner.entry);
                    nfa.addEpsilon(s, e);
                    nfa.addEpsilon(inner.exit, e);
                    result = new NfaFragment(s, e);
                    break;
                }
                case LPAREN:
                case RPAREN:
                    throw new AutomatonStructureError("grouping token in postfix sequence: " + tok);
                default:
                    result = atomToFragment(tok);
                    break;
            }
            if (verifyFragments) {
                nfa.checkFragment(result);
            }
            stack.push(result);
        }

        if (stack.size() != 1) {
            throw new AutomatonStructureError("postfix sequence left " + stack.size()
                    + " fragments on the stack, expected exactly 1");
        }
        NfaFragment fragment = stack.pop();
        nfa.checkFragment(fragment);
        return fragment;
    }

    // pops the top operand after checking that the operator has enough of them
    private static NfaFragment pop(Deque<NfaFragment> stack, RegexToken operator, int arity) {
        if (stack.size() < arity) {
            throw new AutomatonStructureError("operator '" + operator + "' needs " + arity
                    + " operand(s), found " + stack.size());
        }
        return stack.pop();
    }
}
