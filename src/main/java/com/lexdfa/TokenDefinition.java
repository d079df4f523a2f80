package com.lexdfa;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A named token pattern with its priority (lower wins).
 */
public final class TokenDefinition {

    /**
     * A small token set for C-like languages.
     */
    public static final List<TokenDefinition> COMMON = Collections.unmodifiableList(Arrays.asList(
            new TokenDefinition("IDENT", 10, "[A-Za-z_][A-Za-z0-9_]*"),
            new TokenDefinition("INT", 20, "\\d+"),
            new TokenDefinition("FLOAT", 30, "\\d+\\.\\d+"),
            new TokenDefinition("STRING", 40, "\\\"(\\\\.|[^\"])*\\\""),
            new TokenDefinition("OP", 50, "==|!=|<=|>=|\\+|-|\\*|/|=|<|>|\\(|\\)|\\{|\\}|;|,"),
            new TokenDefinition("WS", 60, "[ \\t\\n\\r]+")));

    private final String name;
    private final int priority;
    private final String pattern;

    public TokenDefinition(String name, int priority, String pattern) {
        this.name = name;
        this.priority = priority;
        this.pattern = pattern;
    }

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    public String getPattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return name + "(" + priority + ")=" + PatternParser.wrapInQuotes(pattern);
    }
}
