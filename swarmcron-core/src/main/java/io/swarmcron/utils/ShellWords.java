package io.swarmcron.utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits command strings into argv tokens using POSIX shell quoting rules:
 * single quotes are literal, double quotes honour {@code \" \\ \$ \`}, a backslash outside
 * quotes escapes the next character. No expansion of any kind is performed.
 */
public final class ShellWords {

    /**
     * A token and its position in the source string; {@code end} is exclusive.
     */
    public record Token(String value, int start, int end) {
    }

    private ShellWords() {
    }

    public static List<String> split(String input) {
        List<Token> tokens = tokenize(input);
        List<String> values = new ArrayList<>(tokens.size());
        for (Token t : tokens) {
            values.add(t.value());
        }
        return values;
    }

    /**
     * @throws IllegalArgumentException on an unterminated quote
     */
    public static List<Token> tokenize(String input) {
        List<Token> tokens = new ArrayList<>();
        if (input == null) {
            return tokens;
        }

        int n = input.length();
        int i = 0;
        while (i < n) {
            while (i < n && Character.isWhitespace(input.charAt(i))) {
                i++;
            }
            if (i >= n) {
                break;
            }

            int start = i;
            StringBuilder sb = new StringBuilder();
            while (i < n && !Character.isWhitespace(input.charAt(i))) {
                char c = input.charAt(i);
                if (c == '\'') {
                    int close = input.indexOf('\'', i + 1);
                    if (close < 0) {
                        throw new IllegalArgumentException("Unterminated single quote at " + i + ": " + input);
                    }
                    sb.append(input, i + 1, close);
                    i = close + 1;
                } else if (c == '"') {
                    i = readDoubleQuoted(input, i, sb);
                } else if (c == '\\' && i + 1 < n) {
                    sb.append(input.charAt(i + 1));
                    i += 2;
                } else {
                    sb.append(c);
                    i++;
                }
            }
            tokens.add(new Token(sb.toString(), start, i));
        }
        return tokens;
    }

    private static int readDoubleQuoted(String input, int open, StringBuilder sb) {
        int n = input.length();
        int i = open + 1;
        while (i < n) {
            char c = input.charAt(i);
            if (c == '"') {
                return i + 1;
            }
            if (c == '\\' && i + 1 < n && "\"\\$`".indexOf(input.charAt(i + 1)) >= 0) {
                sb.append(input.charAt(i + 1));
                i += 2;
                continue;
            }
            sb.append(c);
            i++;
        }
        throw new IllegalArgumentException("Unterminated double quote at " + open + ": " + input);
    }
}
