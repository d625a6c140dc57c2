package org.perlfront.parser;

import org.perlfront.astnode.FormatNode;
import org.perlfront.lexer.LexerToken;
import org.perlfront.lexer.LexerTokenType;
import org.perlfront.recovery.ParseError;

import java.util.ArrayList;
import java.util.List;

import static org.perlfront.parser.TokenUtils.consume;
import static org.perlfront.parser.TokenUtils.peek;

/**
 * Parser for format declarations.
 * <p>
 * The lexer hands over the picture and argument lines as one token, up to and
 * including the line holding a single dot. The lines are kept as text.
 */
public class FormatParser {

    /**
     * Parses {@code format NAME =} and its body. The name defaults to STDOUT.
     */
    public static FormatNode parseFormat(Parser parser) {
        LexerToken keyword = consume(parser); // "format"
        int start = keyword.span.start();

        String name = "STDOUT";
        if (peek(parser).type == LexerTokenType.IDENTIFIER) {
            name = consume(parser).text;
        }
        consume(parser, LexerTokenType.OPERATOR, "=");

        LexerToken body = peek(parser);
        if (body.type != LexerTokenType.FORMAT_BODY) {
            throw TokenUtils.syntaxError(parser, "syntax error: expected format lines after '=', found "
                    + TokenUtils.describe(body));
        }
        consume(parser);
        boolean terminated = body.errorMessage == null;
        if (!terminated) {
            parser.recovery.recordError(new ParseError(body.errorMessage, body.span)
                    .withExpected(List.of("."))
                    .withHint("End the format with a line holding a single '.'"));
        }
        parser.options.logDebug("format " + name + " terminated=" + terminated);
        return new FormatNode(name, splitLines(body.text, terminated), parser.spanFrom(start));
    }

    static List<String> splitLines(String text, boolean terminated) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        }
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty() && text.endsWith("\n")) {
            lines.remove(lines.size() - 1);
        }
        if (terminated && !lines.isEmpty() && lines.get(lines.size() - 1).equals(".")) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }
}
