package org.perlfront.lexer;

/**
 * What the lexer expects next. Decides whether {@code /} starts a pattern or divides,
 * and whether {@code %}, {@code &}, {@code *} and {@code <<} are sigils or operators.
 */
public enum SlashContext {
    EXPECT_OPERAND,
    EXPECT_OPERATOR
}
