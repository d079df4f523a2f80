package com.lexdfa;

import java.io.PrintStream;

public class Logger {
    public static final int ERROR = 0;
    public static final int WARN = 1;
    public static final int INFO = 2;
    public static final int DEBUG = 3;

    private static final String[] NAMES = { "ERROR", "WARN", "INFO", "DEBUG" };

    private final int verbosity;
    private final PrintStream out;

    public Logger(int verbosity) {
        this(verbosity, System.out);
    }

    public Logger(int verbosity, PrintStream out) {
        if (verbosity < 0) {
            throw new IllegalArgumentException("verbosity must be >= 0: " + verbosity);
        }
        this.verbosity = verbosity;
        this.out = out;
    }

    public boolean isEnabled(int level) {
        return level <= verbosity;
    }

    public void log(int level, String s) {
        if (isEnabled(level)) {
            synchronized (out) {
                out.println("[" + NAMES[Math.min(level, DEBUG)] + "] " + s);
            }
        }
    }
}
