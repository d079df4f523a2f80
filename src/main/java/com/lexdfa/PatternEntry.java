package com.lexdfa;

/**
 * One line of a JSON-lines pattern file. Name and priority are optional for
 * single pattern compilation and required for {@code --union}.
 */
public class PatternEntry {
    public String name;
    public Integer priority;
    public String pattern;

    public PatternEntry() {
    }

    public PatternEntry(String name, Integer priority, String pattern) {
        this.name = name;
        this.priority = priority;
        this.pattern = pattern;
    }

    public int priorityOrDefault() {
        return priority == null ? TokenDfa.DEFAULT_PRIORITY : priority;
    }

    public TokenDefinition toDefinition() {
        return new TokenDefinition(name, priorityOrDefault(), pattern);
    }
}
