package com.lexdfa;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/**
 * Batch compiler: reads patterns (one per line, or JSON lines with name,
 * priority and pattern) and writes one JSON record per pattern with its
 * inspection table, DOT rendering and a shortest accepted example.
 */
public class Main implements Runnable {
    private static Logger logger = new Logger(Logger.INFO);

    private final List<PatternEntry> entries;
    private final BufferedWriter writer;
    private final AtomicInteger counter;
    private final RegexCompiler compiler;
    private final AtomicReference<IOException> failure;

    public Main(List<PatternEntry> entries, BufferedWriter writer, AtomicInteger counter, RegexCompiler compiler,
                AtomicReference<IOException> failure) {
        this.entries = entries;
        this.writer = writer;
        this.counter = counter;
        this.compiler = compiler;
        this.failure = failure;
    }

    public static void main(String[] args) {
        ArgumentParser parser = ArgumentParsers.newFor("lexdfa").build()
                .defaultHelp(true)
                .description("Compiles regular expressions into minimal DFAs");

        parser.addArgument("-t", "--threads")
                .help("number of threads")
                .setDefault(1).type(Integer.class);

        parser.addArgument("-i", "--input")
                .help("input file .txt or .json")
                .required(true)
                .type(String.class);

        parser.addArgument("-o", "--output")
                .help("output file .json")
                .required(true)
                .type(String.class);

        parser.addArgument("-l", "--log")
                .help("log level 0-3")
                .setDefault(Logger.INFO)
                .type(Integer.class);

        parser.addArgument("--no-minimize")
                .help("emit the determinized automaton without minimizing it")
                .dest("no_minimize")
                .action(Arguments.storeTrue());

        parser.addArgument("--union")
                .help("compile all patterns as one token set (entries need a name)")
                .action(Arguments.storeTrue());

        Namespace ns = null;
        try {
            ns = parser.parseArgs(args);
        } catch (ArgumentParserException e) {
            parser.handleError(e);
            System.exit(1);
        }

        logger = new Logger(ns.getInt("log"));
        try {
            process(new File(ns.getString("input")), new File(ns.getString("output")), ns.getInt("threads"),
                    !ns.getBoolean("no_minimize"), ns.getBoolean("union"));
        } catch (IOException e) {
            logger.log(Logger.ERROR, e.toString());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.log(Logger.ERROR, "interrupted");
            System.exit(1);
        }
    }

    public static void process(File input, File output, int numThreads, boolean minimize, boolean union)
            throws IOException, InterruptedException {
        List<PatternEntry> entries = readEntries(input);
        logger.log(Logger.INFO, "Read " + entries.size() + " patterns from " + input);
        RegexCompiler compiler = new RegexCompiler(logger, minimize);
        Gson gson = new GsonBuilder().disableHtmlEscaping().serializeNulls().create();

        try (BufferedWriter writer = Files.newBufferedWriter(output.toPath(), StandardCharsets.UTF_8)) {
            if (union) {
                writer.write(gson.toJson(compileUnion(compiler, entries)));
                writer.newLine();
                return;
            }
            runWorkers(entries, writer, numThreads, compiler);
        }
    }

    /**
     * Compiles {@code entries} on {@code numThreads} workers, one record per
     * line of {@code writer}.
     *
     * @throws IOException the first write failure of any worker
     */
    static void runWorkers(List<PatternEntry> entries, BufferedWriter writer, int numThreads, RegexCompiler compiler)
            throws IOException, InterruptedException {
        AtomicInteger counter = new AtomicInteger(0); // shared cursor into entries
        AtomicReference<IOException> failure = new AtomicReference<>();
        Thread[] threads = new Thread[Math.max(1, numThreads)];
        for (int i = 0; i < threads.length; i++) {
            threads[i] = new Thread(new Main(entries, writer, counter, compiler, failure), "lexdfa-worker-" + i);
            threads[i].start();
        }
        for (Thread thread : threads) {
            thread.join();
        }
        if (failure.get() != null) {
            throw failure.get();
        }
    }

    static List<PatternEntry> readEntries(File file) throws IOException {
        Gson gson = new Gson();
        boolean json = file.getName().endsWith(".json");
        List<PatternEntry> entries = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            String line = reader.readLine();
            while (line != null) {
                if (!line.isEmpty()) {
                    if (json) {
                        PatternEntry entry;
                        try {
                            entry = gson.fromJson(line, PatternEntry.class);
                        } catch (JsonParseException e) {
                            throw new IOException("malformed entry in " + file + ": " + line, e);
                        }
                        if (entry == null || entry.pattern == null) {
                            throw new IOException("entry without a pattern in " + file + ": " + line);
                        }
                        entries.add(entry);
                    } else {
                        entries.add(new PatternEntry(null, null, line));
                    }
                }
                line = reader.readLine();
            }
        }
        return entries;
    }

    public static JsonObject compileEntry(RegexCompiler compiler, int count, PatternEntry p) {
        JsonObject entry = new JsonObject();
        entry.addProperty("count", count);
        entry.addProperty("pattern", p.pattern);
        entry.addProperty("name", p.name);
        try {
            Dfa dfa = p.name == null
                    ? compiler.compile(p.pattern)
                    : compiler.compile(p.name, p.priorityOrDefault(), p.pattern);
            entry.addProperty("states", dfa.size());
            entry.addProperty("example", AutomatonHelper.shortestExample(dfa));
            entry.add("table", DfaTable.export(dfa));
            entry.addProperty("dot_notation", AutomatonHelper.toDot(dfa));
        } catch (AutomatonException e) {
            logger.log(Logger.WARN, "Pattern " + count + " failed: " + e.getMessage());
            entry.addProperty("error", e.getMessage());
        }
        return entry;
    }

    /**
     * One record holding the determinized ({@code dfa_union}) and minimized
     * ({@code dfa_union_min}) tables of the whole token set.
     */
    public static JsonObject compileUnion(RegexCompiler compiler, List<PatternEntry> entries) {
        JsonObject entry = new JsonObject();
        JsonArray names = new JsonArray();
        entry.add("tokens", names);
        try {
            List<TokenDfa> tokens = new ArrayList<>();
            for (PatternEntry p : entries) {
                names.add(p.name);
                tokens.add(compiler.toTokenDfa(p.toDefinition()));
            }
            Dfa dfa = SubsetConstruction.determinize(AutomatonUnion.union(tokens));
            Dfa minimal = HopcroftMinimizer.minimize(dfa);
            logger.log(Logger.INFO, "Token union: " + dfa.size() + " DFA states, " + minimal.size()
                    + " after minimization");
            entry.add("dfa_union", DfaTable.export(dfa));
            entry.add("dfa_union_min", DfaTable.export(minimal));
        } catch (AutomatonException e) {
            logger.log(Logger.ERROR, "Token union failed: " + e.getMessage());
            entry.addProperty("error", e.getMessage());
        }
        return entry;
    }

    @Override
    public void run() {
        Gson gson = new GsonBuilder().disableHtmlEscaping().serializeNulls().create();
        int line = counter.getAndIncrement();
        while (line < entries.size() && failure.get() == null) {
            JsonObject entry = compileEntry(compiler, line, entries.get(line));
            try {
                synchronized (writer) {
                    writer.write(gson.toJson(entry));
                    writer.newLine();
                }
            } catch (IOException e) {
                logger.log(Logger.ERROR, "Cannot write result " + line + ": " + e);
                failure.compareAndSet(null, e);
                return;
            }
            line = counter.getAndIncrement();
        }
    }
}
