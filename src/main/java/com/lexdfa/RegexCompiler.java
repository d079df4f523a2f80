package com.lexdfa;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Front door of the compiler. Runs either pipeline:
 * <ul>
 *   <li>pattern: parse, Thompson, subset construction, minimization</li>
 *   <li>token automata: union, subset construction, minimization</li>
 * </ul>
 * Every call allocates its own NFA arena, so one compiler may be shared by
 * several threads.
 */
public class RegexCompiler {
    private final Logger logger;
    private final boolean minimize;

    public RegexCompiler() {
        this(null, true);
    }

    public RegexCompiler(Logger logger) {
        this(logger, true);
    }

    /**
     * @param minimize when false the determinized automaton is returned as is
     */
    public RegexCompiler(Logger logger, boolean minimize) {
        this.logger = logger;
        this.minimize = minimize;
    }

    public Dfa compile(String pattern) {
        Nfa nfa = new ThompsonBuilder().build(new PatternParser(logger).parse(pattern));
        return finish(PatternParser.wrapInQuotes(pattern), nfa);
    }

    /**
     * Compiles a pattern whose accepting states resolve to {@code name}.
     */
    public Dfa compile(String name, int priority, String pattern) {
        Nfa nfa = new ThompsonBuilder().build(new PatternParser(logger).parse(pattern), name, priority);
        return finish(name + " " + PatternParser.wrapInQuotes(pattern), nfa);
    }

    public Dfa compileTokens(Collection<TokenDfa> tokens) {
        Nfa nfa = AutomatonUnion.union(tokens);
        return finish("union of " + tokens.size() + " token automata", nfa);
    }

    /**
     * Compiles each definition to a minimal DFA, then unions the resulting
     * token automata.
     */
    public Dfa compileDefinitions(Collection<TokenDefinition> definitions) {
        List<TokenDfa> tokens = new ArrayList<>(definitions.size());
        for (TokenDefinition d : definitions) {
            tokens.add(toTokenDfa(d));
        }
        return compileTokens(tokens);
    }

    public TokenDfa toTokenDfa(TokenDefinition definition) {
        Nfa nfa = new ThompsonBuilder().build(new PatternParser(logger).parse(definition.getPattern()));
        Dfa dfa = HopcroftMinimizer.minimize(SubsetConstruction.determinize(nfa));
        return TokenDfa.fromDfa(definition.getName(), definition.getPriority(), dfa);
    }

    private Dfa finish(String what, Nfa nfa) {
        log(Logger.DEBUG, "NFA for " + what + ": " + nfa.size() + " states");
        Dfa dfa = SubsetConstruction.determinize(nfa);
        log(Logger.DEBUG, "DFA for " + what + ": " + dfa.size() + " states, "
                + dfa.transitionCount() + " transitions");
        if (!minimize) {
            return dfa;
        }
        Dfa minimal = HopcroftMinimizer.minimize(dfa);
        log(Logger.INFO, "Compiled " + what + ": " + nfa.size() + " NFA states, " + dfa.size()
                + " DFA states, " + minimal.size() + " after minimization");
        return minimal;
    }

    private void log(int level, String message) {
        if (logger != null) {
            logger.log(level, message);
        }
    }
}
