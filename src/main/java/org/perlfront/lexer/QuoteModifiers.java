package org.perlfront.lexer;

import java.util.Map;

/**
 * Validation and canonical ordering of the modifier letters that follow a
 * quote-like operator.
 *
 * <p>Each operator has a whitelist of run flags and may also accept one character-set
 * modifier ({@code a}, {@code aa}, {@code d}, {@code l} or {@code u}). The canonical form
 * lists the run flags present in whitelist order, followed by the character set.
 * Repeated flags collapse to one, except that {@code xx} is kept as a distinct flag.</p>
 */
public final class QuoteModifiers {

    /**
     * Modifier rules for one operator family.
     *
     * @param runFlags       allowed flags, in canonical order
     * @param allowsCharset  whether a character-set modifier may follow
     */
    public record ModifierSpec(String runFlags, boolean allowsCharset) {
    }

    public static final ModifierSpec MATCH = new ModifierSpec("msixpngco", true);
    public static final ModifierSpec QUOTE_REGEX = new ModifierSpec("msixpno", true);
    public static final ModifierSpec SUBSTITUTION = new ModifierSpec("msixpngcoer", true);
    public static final ModifierSpec TRANSLITERATION = new ModifierSpec("cdsr", false);
    public static final ModifierSpec NONE = new ModifierSpec("", false);

    private static final Map<String, ModifierSpec> BY_OPERATOR = Map.of(
            "m", MATCH,
            "/", MATCH,
            "qr", QUOTE_REGEX,
            "s", SUBSTITUTION,
            "tr", TRANSLITERATION,
            "y", TRANSLITERATION);

    private QuoteModifiers() {
    }

    public static ModifierSpec forOperator(String operator) {
        return BY_OPERATOR.getOrDefault(operator, NONE);
    }

    /**
     * Validates {@code raw} against {@code spec} and returns its canonical form.
     *
     * @throws IllegalArgumentException naming the first offending modifier
     */
    public static String canonicalize(String raw, ModifierSpec spec) {
        String runFlags = spec.runFlags();
        boolean[] seen = new boolean[runFlags.length()];
        boolean doubleX = false;
        String charset = null;

        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            int flag = runFlags.indexOf(c);
            if (flag >= 0) {
                if (c == 'x' && i + 1 < raw.length() && raw.charAt(i + 1) == 'x') {
                    doubleX = true;
                    i += 2;
                } else {
                    i++;
                }
                seen[flag] = true;
                continue;
            }
            if (spec.allowsCharset() && "adlu".indexOf(c) >= 0) {
                String found = c == 'a' && i + 1 < raw.length() && raw.charAt(i + 1) == 'a' ? "aa" : String.valueOf(c);
                if (charset != null && !charset.equals(found)) {
                    throw new IllegalArgumentException(
                            "Regexp modifiers \"/" + charset + "\" and \"/" + found + "\" are mutually exclusive");
                }
                charset = found;
                i += found.length();
                continue;
            }
            throw new IllegalArgumentException("Unknown modifier \"/" + c + "\"");
        }

        StringBuilder canonical = new StringBuilder(raw.length());
        for (int f = 0; f < runFlags.length(); f++) {
            if (seen[f]) {
                canonical.append(runFlags.charAt(f));
                if (runFlags.charAt(f) == 'x' && doubleX) {
                    canonical.append('x');
                }
            }
        }
        if (charset != null) {
            canonical.append(charset);
        }
        return canonical.toString();
    }
}
