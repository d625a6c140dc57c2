package org.perlfront.parser;

import org.perlfront.lexer.LexerToken;
import org.perlfront.lexer.LexerTokenType;
import org.perlfront.recovery.ParseError;
import org.perlfront.recovery.PerlSyntaxException;

import java.util.List;

/**
 * Token access helpers shared by the grammar classes.
 */
public class TokenUtils {

    /**
     * Returns the next token without consuming it.
     */
    public static LexerToken peek(Parser parser) {
        return parser.peekToken(0);
    }

    /**
     * Returns the token {@code offset} positions ahead without consuming anything.
     */
    public static LexerToken peek(Parser parser, int offset) {
        return parser.peekToken(offset);
    }

    public static LexerToken consume(Parser parser) {
        return parser.nextToken();
    }

    public static LexerToken consume(Parser parser, LexerTokenType type) {
        LexerToken token = peek(parser);
        if (token.type != type) {
            throw new PerlSyntaxException(new ParseError(
                    "syntax error: expected " + describe(type) + ", found " + describe(token), token.span)
                    .withExpected(List.of(describe(type)))
                    .withFound(describe(token)));
        }
        return consume(parser);
    }

    /**
     * Consumes a token of the given type and text. A missing closing bracket is
     * reported as an unmatched delimiter.
     */
    public static LexerToken consume(Parser parser, LexerTokenType type, String expectedText) {
        LexerToken token = peek(parser);
        if (token.type != type || !token.text.equals(expectedText)) {
            ParseError error;
            if (isClosingDelimiter(expectedText)) {
                error = ParseError.unmatchedDelimiter(expectedText,
                        token.type == LexerTokenType.EOF ? null : token.text, token.span);
            } else {
                error = new ParseError("syntax error: expected '" + expectedText + "', found " + describe(token), token.span)
                        .withExpected(List.of(expectedText))
                        .withFound(describe(token));
            }
            throw new PerlSyntaxException(error);
        }
        return consume(parser);
    }

    /**
     * Consumes the token if it is the given operator.
     *
     * @return true if the operator was present
     */
    public static boolean consumeIf(Parser parser, String operator) {
        if (peek(parser).isOperator(operator)) {
            consume(parser);
            return true;
        }
        return false;
    }

    public static boolean isClosingDelimiter(String text) {
        return text.equals(")") || text.equals("]") || text.equals("}");
    }

    public static String describe(LexerToken token) {
        return token.type == LexerTokenType.EOF ? "end of file" : "'" + token.text + "'";
    }

    static String describe(LexerTokenType type) {
        return switch (type) {
            case IDENTIFIER -> "identifier";
            case SCALAR -> "scalar variable";
            case FORMAT_BODY -> "format lines";
            default -> type.name().toLowerCase();
        };
    }

    /**
     * Builds a syntax error located at the next token.
     */
    public static PerlSyntaxException syntaxError(Parser parser, String message) {
        LexerToken token = peek(parser);
        return new PerlSyntaxException(new ParseError(message, token.span).withFound(describe(token)));
    }
}
