package com.lexdfa;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.junit.Test;

import static org.junit.Assert.*;

public class ThompsonBuilderTest {

    private static BitSet bits(int... ids) {
        BitSet b = new BitSet();
        for (int id : ids) {
            b.set(id);
        }
        return b;
    }

    private static List<RegexToken> postfix(String pattern) {
        return new PatternParser().parse(pattern);
    }

    @Test
    public void atomIsTwoStatesAndOneTransition() {
        ThompsonBuilder builder = new ThompsonBuilder();
        NfaFragment f = builder.atomToFragment(RegexToken.literal('a'));
        Nfa nfa = builder.getNfa();
        assertEquals(2, nfa.size());
        assertEquals(Collections.singletonMap(Collections.singleton('a'), bits(f.exit)),
                nfa.state(f.entry).getTransitions());
        assertTrue(nfa.state(f.exit).getTransitions().isEmpty());
    }

    @Test
    public void expandsAtomSymbolSets() {
        ThompsonBuilder builder = new ThompsonBuilder();
        assertEquals(10, builder.symbolsOf(RegexToken.escape('d')).size());
        assertEquals(63, builder.symbolsOf(RegexToken.escape('w')).size());
        assertEquals(Collections.singleton('\n'), builder.symbolsOf(RegexToken.escape('n')));
        assertEquals(Collections.singleton('.'), builder.symbolsOf(RegexToken.escape('.')));
        assertEquals(Alphabet.symbols().size(), builder.symbolsOf(RegexToken.ANY).size());

        Set<Character> notA = builder.symbolsOf(new PatternParser().tokenize("[^a]").get(0));
        assertEquals(Alphabet.symbols().size() - 1, notA.size());
        assertFalse(notA.contains('a'));

        Set<Character> mixed = builder.symbolsOf(new PatternParser().tokenize("[x\\d]").get(0));
        assertEquals(11, mixed.size());
    }

    @Test
    public void concatenationJoinsExitToEntry() {
        ThompsonBuilder builder = new ThompsonBuilder();
        NfaFragment f = builder.postfixToNfa(postfix("ab"));
        Nfa nfa = builder.getNfa();
        assertEquals(4, nfa.size());
        assertEquals(0, f.entry);
        assertEquals(3, f.exit);
        assertEquals(bits(2), nfa.state(1).getEpsilon());
    }

    @Test
    public void alternationBranchesAndJoins() {
        ThompsonBuilder builder = new ThompsonBuilder();
        NfaFragment f = builder.postfixToNfa(postfix("a|b"));
        Nfa nfa = builder.getNfa();
        assertEquals(4, f.entry);
        assertEquals(5, f.exit);
        assertEquals(bits(0, 2), nfa.state(4).getEpsilon());
        assertEquals(bits(5), nfa.state(1).getEpsilon());
        assertEquals(bits(5), nfa.state(3).getEpsilon());
    }

    @Test
    public void starLoopsAndSkips() {
        ThompsonBuilder builder = new ThompsonBuilder();
        NfaFragment f = builder.postfixToNfa(postfix("a*"));
        Nfa nfa = builder.getNfa();
        assertEquals(2, f.entry);
        assertEquals(3, f.exit);
        assertEquals(bits(0, 3), nfa.state(2).getEpsilon());
        assertEquals(bits(0, 3), nfa.state(1).getEpsilon());
    }

    @Test
    public void plusMustEnterInnerFragment() {
        ThompsonBuilder builder = new ThompsonBuilder();
        builder.postfixToNfa(postfix("a+"));
        Nfa nfa = builder.getNfa();
        assertEquals(bits(0), nfa.state(2).getEpsilon());
        assertEquals(bits(0, 3), nfa.state(1).getEpsilon());
    }

    @Test
    public void optionalSkipsWithoutLooping() {
        ThompsonBuilder builder = new ThompsonBuilder();
        builder.postfixToNfa(postfix("a?"));
        Nfa nfa = builder.getNfa();
        assertEquals(bits(0, 3), nfa.state(2).getEpsilon());
        assertEquals(bits(3), nfa.state(1).getEpsilon());
    }

    @Test
    public void everyIntermediateFragmentHasOneEntryAndOneExit() {
        ThompsonBuilder builder = new ThompsonBuilder(true);
        NfaFragment f = builder.postfixToNfa(postfix("((a|b)*c+d?|[x-z]\\d)*(e|f)+"));
        builder.getNfa().checkFragment(f);
    }

    @Test
    public void buildMarksStartAndAcceptingExit() {
        ThompsonBuilder builder = new ThompsonBuilder();
        Nfa nfa = builder.build(postfix("ab"));
        assertEquals(0, nfa.getStart().getId());
        assertTrue(nfa.state(3).isAccepting());
        assertTrue(nfa.state(3).getContenders().isEmpty());
        assertFalse(nfa.state(1).isAccepting());
    }

    @Test
    public void namedBuildTagsExitWithToken() {
        Nfa nfa = new ThompsonBuilder().build(postfix("a"), "A", 4);
        assertEquals(Collections.singletonMap("A", 4), nfa.state(1).getContenders());
    }

    @Test(expected = AutomatonStructureError.class)
    public void unaryOperatorWithoutOperandFails() {
        new ThompsonBuilder().postfixToNfa(Arrays.asList(RegexToken.STAR));
    }

    @Test
    public void binaryOperatorWithOneOperandFails() {
        try {
            new ThompsonBuilder().postfixToNfa(Arrays.asList(RegexToken.literal('a'), RegexToken.CONCAT));
            fail();
        } catch (AutomatonStructureError e) {
            assertEquals(AutomatonException.Kind.STRUCTURE, e.getKind());
        }
    }

    @Test(expected = AutomatonStructureError.class)
    public void leftoverFragmentsFail() {
        new ThompsonBuilder().postfixToNfa(Arrays.asList(RegexToken.literal('a'), RegexToken.literal('b')));
    }

    @Test(expected = AutomatonStructureError.class)
    public void emptyPostfixFails() {
        new ThompsonBuilder().postfixToNfa(Collections.<RegexToken>emptyList());
    }

    @Test(expected = AutomatonStructureError.class)
    public void edgeIntoEntryViolatesShape() {
        Nfa nfa = new Nfa();
        nfa.newState();
        nfa.newState();
        nfa.addTransition(0, Collections.singleton('a'), 1);
        nfa.addEpsilon(1, 0);
        nfa.checkFragment(new NfaFragment(0, 1));
    }
}
