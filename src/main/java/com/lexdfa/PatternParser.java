package com.lexdfa;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Turns pattern text into a postfix token sequence in three stages:
 * tokenizing, explicit concatenation, and shunting-yard conversion.
 *
 * <p>Grammar: literals, {@code .}, escapes ({@code \d \w \s \n \t \r} or
 * {@code \X} for a literal X), bracket classes {@code [..]} and {@code [^..]}
 * with {@code a-z} ranges and nested escapes, grouping and the operators
 * {@code * + ? |}.
 */
public class PatternParser {

    private final Logger logger;

    public PatternParser() {
        this(null);
    }

    public PatternParser(Logger logger) {
        this.logger = logger;
    }

    public List<RegexToken> parse(String pattern) {
        log("Pattern: " + wrapInQuotes(pattern));
        List<RegexToken> tokens = tokenize(pattern);
        log("Pattern (tokens): " + tokens);
        tokens = insertConcatenation(tokens);
        log("Pattern (explicit concatenation): " + tokens);
        List<RegexToken> postfix = toPostfix(tokens);
        log("Pattern (postfix): " + postfix);
        return postfix;
    }

    public static String wrapInQuotes(String s) {
        if (s == null) {
            throw new IllegalArgumentException();
        } else {
            return "\"" + s + "\"";
        }
    }

    public List<RegexToken> tokenize(String pattern) {
        List<RegexToken> tokens = new ArrayList<>();
        int length = pattern.length();
        int i = 0;
        while (i < length) {
            char c = pattern.charAt(i);
            switch (c) {
                case '\\':
                    if (i + 1 >= length) {
                        throw new PatternSyntaxError("dangling escape", pattern, i);
                    }
                    tokens.add(RegexToken.escape(pattern.charAt(i + 1)));
                    i += 2;
                    break;
                case '[':
                    i = readClass(pattern, i, tokens);
                    break;
                case '(':
                    tokens.add(RegexToken.LPAREN);
                    i++;
                    break;
                case ')':
                    tokens.add(RegexToken.RPAREN);
                    i++;
                    break;
                case '|':
                    tokens.add(RegexToken.UNION);
                    i++;
                    break;
                case '*':
                    tokens.add(RegexToken.STAR);
                    i++;
                    break;
                case '+':
                    tokens.add(RegexToken.PLUS);
                    i++;
                    break;
                case '?':
                    tokens.add(RegexToken.OPTIONAL);
                    i++;
                    break;
                case '.':
                    tokens.add(RegexToken.ANY);
                    i++;
                    break;
                default:
                    tokens.add(RegexToken.literal(c));
                    i++;
                    break;
            }
        }
        return tokens;
    }

    // returns the index just past the closing bracket
    private int readClass(String pattern, int open, List<RegexToken> tokens) {
        int length = pattern.length();
        int j = open + 1;
        boolean negated = false;
        if (j < length && pattern.charAt(j) == '^') {
            negated = true;
            j++;
        }

        List<String> members = new ArrayList<>();
        while (j < length && pattern.charAt(j) != ']') {
            char c = pattern.charAt(j);
            if (c == '\\') {
                if (j + 1 >= length) {
                    throw new PatternSyntaxError("malformed escape in character class", pattern, j);
                }
                members.add("\\" + pattern.charAt(j + 1));
                j += 2;
            } else if (j + 2 < length && pattern.charAt(j + 1) == '-' && pattern.charAt(j + 2) != ']') {
                char end = pattern.charAt(j + 2);
                if (end == '\\') {
                    throw new PatternSyntaxError("malformed range escape in character class", pattern, j + 2);
                }
                // a reversed range such as z-a contributes nothing
                for (int r = c; r <= end; r++) {
                    members.add(String.valueOf((char) r));
                }
                j += 3;
            } else {
                members.add(String.valueOf(c));
                j++;
            }
        }

        if (j >= length) {
            throw new PatternSyntaxError("unterminated character class", pattern, open);
        }
        tokens.add(RegexToken.charClass(negated, members));
        return j + 1;
    }

    public List<RegexToken> insertConcatenation(List<RegexToken> tokens) {
        List<RegexToken> result = new ArrayList<>(tokens.size() * 2);
        for (int i = 0; i < tokens.size(); i++) {
            RegexToken left = tokens.get(i);
            result.add(left);
            if (i + 1 < tokens.size() && canEnd(left) && canStart(tokens.get(i + 1))) {
                result.add(RegexToken.CONCAT);
            }
        }
        return result;
    }

    private static boolean canEnd(RegexToken left) {
        RegexToken.Kind k = left.getKind();
        return k != RegexToken.Kind.UNION && k != RegexToken.Kind.LPAREN;
    }

    private static boolean canStart(RegexToken right) {
        switch (right.getKind()) {
            case UNION:
            case RPAREN:
            case STAR:
            case PLUS:
            case OPTIONAL:
                return false;
            default:
                return true;
        }
    }

    /**
     * Shunting-yard conversion. All operators are left associative; an
     * incoming operator pops every stacked operator of greater or equal
     * precedence.
     */
    public List<RegexToken> toPostfix(List<RegexToken> tokens) {
        List<RegexToken> output = new ArrayList<>(tokens.size());
        Deque<RegexToken> stack = new ArrayDeque<>();

        for (RegexToken tok : tokens) {
            RegexToken.Kind kind = tok.getKind();
            if (kind == RegexToken.Kind.LPAREN) {
                stack.push(tok);
            } else if (kind == RegexToken.Kind.RPAREN) {
                while (!stack.isEmpty() && stack.peek().getKind() != RegexToken.Kind.LPAREN) {
                    output.add(stack.pop());
                }
                if (stack.isEmpty()) {
                    throw new PatternSyntaxError("unbalanced parentheses: ')' without matching '('", render(tokens));
                }
                stack.pop();
            } else if (kind.isOperator()) {
                while (!stack.isEmpty()
                        && stack.peek().getKind() != RegexToken.Kind.LPAREN
                        && stack.peek().getKind().precedence() >= kind.precedence()) {
                    output.add(stack.pop());
                }
                stack.push(tok);
            } else {
                output.add(tok);
            }
        }

        while (!stack.isEmpty()) {
            RegexToken top = stack.pop();
            if (top.getKind() == RegexToken.Kind.LPAREN || top.getKind() == RegexToken.Kind.RPAREN) {
                throw new PatternSyntaxError("unbalanced parentheses", render(tokens));
            }
            output.add(top);
        }
        return output;
    }

    private static String render(List<RegexToken> tokens) {
        StringBuilder sb = new StringBuilder();
        for (RegexToken t : tokens) {
            if (t.getKind() != RegexToken.Kind.CONCAT) {
                sb.append(t.getText());
            }
        }
        return sb.toString();
    }

    private void log(String message) {
        if (logger != null) {
            logger.log(Logger.DEBUG, message);
        }
    }
}
