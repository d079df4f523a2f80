package com.lexdfa;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/**
 * Unions hand-written token automata. Reads a JSON array of automaton
 * definitions and writes {@code <output>_union.json} (determinized) and
 * {@code <output>_union_min.json} (minimized).
 */
public class TokenUnionMain {
    private static Logger logger = new Logger(Logger.INFO);

    /**
     * JSON form of a {@link TokenDfa}. Symbols are one character strings;
     * transitions map state to symbol to target state.
     */
    static class Definition {
        String name;
        Integer priority;
        List<String> states;
        List<String> alphabet;
        String start;
        List<String> accept;
        Map<String, Map<String, String>> transitions;

        TokenDfa toTokenDfa() {
            TokenDfa.Builder b = TokenDfa.builder(name)
                    .priority(priority == null ? TokenDfa.DEFAULT_PRIORITY : priority)
                    .start(start);
            if (states != null) {
                b.state(states.toArray(new String[0]));
            }
            if (alphabet != null) {
                for (String symbol : alphabet) {
                    b.symbol(single(symbol));
                }
            }
            if (accept != null) {
                b.accept(accept.toArray(new String[0]));
            }
            if (transitions != null) {
                for (Map.Entry<String, Map<String, String>> row : transitions.entrySet()) {
                    for (Map.Entry<String, String> t : row.getValue().entrySet()) {
                        b.transition(row.getKey(), single(t.getKey()), t.getValue());
                    }
                }
            }
            return b.build();
        }

        private char single(String symbol) {
            if (symbol == null || symbol.length() != 1) {
                throw new AutomatonStructureError("token " + name + ": symbol must be a single character: "
                        + symbol);
            }
            return symbol.charAt(0);
        }
    }

    public static void main(String[] args) {
        ArgumentParser parser = ArgumentParsers.newFor("TokenUnionMain").build()
                .defaultHelp(true)
                .description("Unions token automata into one minimal DFA");

        parser.addArgument("-i", "--input")
                .help("input file .json (array of token automata)")
                .required(true)
                .type(String.class);

        parser.addArgument("-o", "--output")
                .help("output prefix")
                .required(true)
                .type(String.class);

        parser.addArgument("-l", "--log")
                .help("log level 0-3")
                .setDefault(Logger.INFO)
                .type(Integer.class);

        Namespace ns = null;
        try {
            ns = parser.parseArgs(args);
        } catch (ArgumentParserException e) {
            parser.handleError(e);
            System.exit(1);
        }

        logger = new Logger(ns.getInt("log"));
        try {
            run(new File(ns.getString("input")), ns.getString("output"));
        } catch (IOException | AutomatonException e) {
            logger.log(Logger.ERROR, e.getMessage());
            System.exit(1);
        }
    }

    /**
     * @return the minimized union
     */
    public static Dfa run(File input, String outputPrefix) throws IOException {
        List<TokenDfa> tokens = readTokens(input);
        Dfa dfa = SubsetConstruction.determinize(AutomatonUnion.union(tokens));
        Dfa minimal = HopcroftMinimizer.minimize(dfa);
        logger.log(Logger.INFO, "Union of " + tokens.size() + " tokens: " + dfa.size() + " DFA states, "
                + minimal.size() + " after minimization");
        for (DfaState s : minimal.getStates()) {
            if (s.isAccepting()) {
                logger.log(Logger.DEBUG, s.getLabel() + " -> " + s.getWinner() + " " + s.getContenders());
            }
        }

        write(new File(outputPrefix + "_union.json"), DfaTable.toJson(dfa));
        write(new File(outputPrefix + "_union_min.json"), DfaTable.toJson(minimal));
        logger.log(Logger.INFO, "Wrote " + outputPrefix + "_union.json and " + outputPrefix + "_union_min.json");
        return minimal;
    }

    static List<TokenDfa> readTokens(File input) throws IOException {
        Gson gson = new GsonBuilder().create();
        List<Definition> definitions;
        try (Reader reader = Files.newBufferedReader(input.toPath(), StandardCharsets.UTF_8)) {
            definitions = gson.fromJson(reader, new TypeToken<List<Definition>>() { }.getType());
        } catch (JsonParseException e) {
            throw new IOException("malformed token automata in " + input + ": " + e.getMessage(), e);
        }
        if (definitions == null) {
            throw new IOException("no token automata in " + input);
        }
        List<TokenDfa> tokens = new ArrayList<>(definitions.size());
        for (Definition d : definitions) {
            tokens.add(d.toTokenDfa());
        }
        return tokens;
    }

    private static void write(File file, String json) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
            writer.write(json);
        }
    }
}
