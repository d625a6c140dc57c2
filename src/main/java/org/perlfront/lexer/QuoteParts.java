package org.perlfront.lexer;

/**
 * Decoded pieces of a quote-like token.
 *
 * @param operator       the quote operator ({@code q}, {@code s}, {@code tr}, ...), or the
 *                       delimiter itself for bare {@code '...'}, {@code "..."}, {@code `...`} and {@code /.../}
 * @param openDelimiter  delimiter that opened the first body
 * @param closeDelimiter delimiter that closed the first body
 * @param body           raw text of the first body, escapes untouched
 * @param replacement    raw text of the second body for {@code s} and {@code tr}, otherwise null
 * @param modifiers      canonical modifier string, empty when none were given
 */
public record QuoteParts(String operator,
                         char openDelimiter,
                         char closeDelimiter,
                         String body,
                         String replacement,
                         String modifiers) {
}
