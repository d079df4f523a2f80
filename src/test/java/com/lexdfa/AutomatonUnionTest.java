package com.lexdfa;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import static org.junit.Assert.*;

public class AutomatonUnionTest {

    static List<TokenDfa> toyTokens() {
        TokenDfa plus = TokenDfa.builder("PLUS").priority(10)
                .start("q0").accept("q1")
                .transition("q0", '+', "q1")
                .build();
        TokenDfa digit = TokenDfa.builder("DIGIT1").priority(15)
                .start("a").accept("b")
                .transition("a", '1', "b")
                .build();
        TokenDfa ident = TokenDfa.builder("IDENT").priority(20)
                .start("s").accept("t")
                .transition("s", 'g', "t")
                .transition("t", 'g', "t")
                .build();
        return Arrays.asList(plus, digit, ident);
    }

    @Test
    public void buildsSyntheticStart() {
        Nfa nfa = AutomatonUnion.union(toyTokens());

        assertEquals(1 + 2 + 2 + 2, nfa.size());
        assertEquals(AutomatonUnion.START_LABEL, nfa.getStart().getLabel());
        assertEquals(3, nfa.getStart().getEpsilon().cardinality());
        assertEquals("[+, 1, g]", nfa.getAlphabet().toString());
    }

    @Test
    public void resolvesPriorities() {
        Dfa dfa = SubsetConstruction.determinize(AutomatonUnion.union(toyTokens()));
        assertEquals(4, dfa.size());
        assertEquals("{DIGIT1.a,IDENT.s,PLUS.q0,S}", dfa.getStart().getLabel());

        Dfa minimal = HopcroftMinimizer.minimize(dfa);
        assertEquals(4, minimal.size());
        assertEquals("PLUS", minimal.winner("+"));
        assertEquals("DIGIT1", minimal.winner("1"));
        assertEquals("IDENT", minimal.winner("g"));
        assertEquals("IDENT", minimal.winner("ggg"));
        assertNull(minimal.winner(""));
        assertNull(minimal.winner("+1"));
        assertNull(minimal.winner("x"));
    }

    @Test
    public void keepsEqualLabelsOfDifferentTokensApart() {
        TokenDfa a = TokenDfa.builder("A").start("0").accept("1").transition("0", 'x', "1").build();
        TokenDfa b = TokenDfa.builder("B").start("0").accept("1").transition("0", 'y', "1").build();
        Nfa nfa = AutomatonUnion.union(Arrays.asList(a, b));
        assertEquals(5, nfa.size());

        Dfa dfa = SubsetConstruction.determinize(nfa);
        assertNotNull(dfa.getState("{A.1}"));
        assertNotNull(dfa.getState("{B.1}"));
        assertEquals("A", dfa.winner("x"));
        assertEquals("B", dfa.winner("y"));
    }

    @Test
    public void mergesSharedAcceptingSubsets() {
        TokenDfa low = TokenDfa.builder("KEYWORD").priority(1)
                .start("0").accept("2")
                .transition("0", 'i', "1").transition("1", 'f', "2")
                .build();
        TokenDfa high = TokenDfa.builder("NAME").priority(9)
                .start("0").accept("1")
                .transition("0", 'i', "1").transition("0", 'f', "1")
                .transition("1", 'i', "1").transition("1", 'f', "1")
                .build();
        Dfa dfa = HopcroftMinimizer.minimize(SubsetConstruction.determinize(
                AutomatonUnion.union(Arrays.asList(high, low))));

        assertEquals("KEYWORD", dfa.winner("if"));
        assertEquals("NAME", dfa.winner("i"));
        assertEquals("NAME", dfa.winner("iff"));
        assertEquals("NAME", dfa.winner("fi"));

        DfaState ifState = dfa.getStart().next('i').next('f');
        assertEquals(Integer.valueOf(1), ifState.getContenders().get("KEYWORD"));
        assertEquals(Integer.valueOf(9), ifState.getContenders().get("NAME"));
    }

    @Test
    public void breaksPriorityTiesByName() {
        TokenDfa b = TokenDfa.builder("B").priority(3).start("0").accept("1").transition("0", 'z', "1").build();
        TokenDfa a = TokenDfa.builder("A").priority(3).start("0").accept("1").transition("0", 'z', "1").build();
        Dfa dfa = SubsetConstruction.determinize(AutomatonUnion.union(Arrays.asList(b, a)));
        assertEquals("A", dfa.winner("z"));
        assertEquals(2, HopcroftMinimizer.minimize(dfa).size());
    }

    @Test
    public void dottedStateLabelsStayDistinct() {
        TokenDfa a = TokenDfa.builder("A").start("q0").accept("x.y").transition("q0", 'a', "x.y").build();
        TokenDfa ax = TokenDfa.builder("AX").start("q0").accept("y").transition("q0", 'b', "y").build();
        Dfa dfa = SubsetConstruction.determinize(AutomatonUnion.union(Arrays.asList(a, ax)));
        assertNotNull(dfa.getState("{A.x.y}"));
        assertNotNull(dfa.getState("{AX.y}"));
        assertEquals("A", dfa.winner("a"));
        assertEquals("AX", dfa.winner("b"));

        try {
            TokenDfa.builder("A.x").start("q0").accept("y").transition("q0", 'b', "y").build();
            fail("a dotted token name could collide with another token's labels");
        } catch (AutomatonStructureError e) {
            assertTrue(e.getMessage().contains("A.x"));
        }
    }

    @Test(expected = AutomatonStructureError.class)
    public void rejectsDuplicateNames() {
        TokenDfa one = TokenDfa.builder("T").start("0").accept("1").transition("0", 'a', "1").build();
        TokenDfa two = TokenDfa.builder("T").start("0").accept("1").transition("0", 'b', "1").build();
        AutomatonUnion.union(Arrays.asList(one, two));
    }

    @Test
    public void acceptingStartAcceptsEmptyInput() {
        TokenDfa opt = TokenDfa.builder("OPT").priority(2).start("0").accept("0", "1")
                .transition("0", 'a', "1").build();
        Dfa dfa = SubsetConstruction.determinize(AutomatonUnion.union(Arrays.asList(opt)));
        assertEquals("OPT", dfa.winner(""));
        assertEquals("OPT", dfa.winner("a"));
    }
}
