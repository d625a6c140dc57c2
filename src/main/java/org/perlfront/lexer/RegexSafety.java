package org.perlfront.lexer;

/**
 * Structural checks applied to pattern bodies before they are accepted as tokens.
 */
public final class RegexSafety {

    public static final int MAX_LOOKBEHIND_DEPTH = 10;

    private RegexSafety() {
    }

    /**
     * Returns the deepest nesting of lookbehind groups ({@code (?<=} and {@code (?<!})
     * in the pattern. Escaped parentheses and bracketed character classes are skipped.
     */
    public static int lookbehindDepth(String pattern) {
        // one entry per open group: true when that group is a lookbehind
        boolean[] stack = new boolean[pattern.length() + 1];
        int open = 0;
        int depth = 0;
        int deepest = 0;
        boolean inClass = false;

        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\\') {
                i++;
                continue;
            }
            if (inClass) {
                if (c == ']') {
                    inClass = false;
                }
                continue;
            }
            switch (c) {
                case '[' -> {
                    inClass = true;
                    // a leading ] is literal inside a class
                    if (i + 1 < pattern.length() && pattern.charAt(i + 1) == ']') {
                        i++;
                    }
                }
                case '(' -> {
                    boolean lookbehind = pattern.startsWith("(?<=", i) || pattern.startsWith("(?<!", i);
                    stack[open++] = lookbehind;
                    if (lookbehind) {
                        depth++;
                        deepest = Math.max(deepest, depth);
                    }
                }
                case ')' -> {
                    if (open > 0 && stack[--open]) {
                        depth--;
                    }
                }
                default -> {
                }
            }
        }
        return deepest;
    }
}
