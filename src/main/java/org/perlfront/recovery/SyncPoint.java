package org.perlfront.recovery;

import org.perlfront.lexer.LexerToken;
import org.perlfront.lexer.LexerTokenType;

import java.util.Set;

/**
 * Token positions where parsing can resume after an error.
 */
public enum SyncPoint {
    SEMICOLON,
    CLOSE_BRACE,
    /** A keyword that starts a new statement. */
    KEYWORD,
    EOF;

    public static final Set<String> STATEMENT_KEYWORDS = Set.of(
            "my", "our", "local", "state", "sub", "if", "unless", "while", "until", "for", "foreach",
            "return", "last", "next", "redo", "goto", "die", "eval", "do");

    public boolean matches(LexerToken token) {
        return switch (this) {
            case SEMICOLON -> token.isOperator(";");
            case CLOSE_BRACE -> token.isOperator("}");
            case KEYWORD -> token.type == LexerTokenType.KEYWORD && STATEMENT_KEYWORDS.contains(token.text);
            case EOF -> token.type == LexerTokenType.EOF;
        };
    }
}
