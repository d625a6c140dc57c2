package org.perlfront.parser;

import org.perlfront.astnode.Node;
import org.perlfront.astnode.NodeKind;
import org.perlfront.astnode.ParameterNode;
import org.perlfront.astnode.SignatureNode;
import org.perlfront.lexer.LexerToken;
import org.perlfront.lexer.LexerTokenType;
import org.perlfront.recovery.ParseError;
import org.perlfront.recovery.PerlSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.perlfront.parser.TokenUtils.consume;
import static org.perlfront.parser.TokenUtils.peek;

/**
 * Parser for subroutine signatures.
 * <p>
 * Supports:
 * <ul>
 *   <li>Mandatory parameters: {@code $x}</li>
 *   <li>Optional parameters: {@code $x = 10}, {@code $x //= 5}, {@code $x ||= 0}</li>
 *   <li>Slurpy parameters: {@code @arr}, {@code %hash}</li>
 *   <li>Named parameters: {@code :$name}</li>
 *   <li>Placeholders: {@code $}, {@code @}, {@code %}</li>
 * </ul>
 */
public class SignatureParser {

    private static final Set<String> DEFAULT_OPERATORS = Set.of("=", "//=", "||=");

    private final Parser parser;
    private final List<ParameterNode> parameters = new ArrayList<>();
    private boolean hasSlurpy;
    private boolean hasOptional;

    private SignatureParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * Parses {@code ( PARAMETERS )}, consuming both parentheses.
     */
    public static SignatureNode parseSignature(Parser parser) {
        return new SignatureParser(parser).parse();
    }

    private SignatureNode parse() {
        int start = parser.nextStart();
        consume(parser, LexerTokenType.OPERATOR, "(");

        while (!peek(parser).isOperator(")")) {
            parseParameter();

            LexerToken next = peek(parser);
            if (next.isOperator(",")) {
                while (peek(parser).isOperator(",")) {
                    consume(parser);
                }
            } else if (!next.isOperator(")")) {
                throw new PerlSyntaxException(new ParseError(
                        "Expected ',' or ')' in signature, found " + TokenUtils.describe(next), next.span)
                        .withExpected(List.of(",", ")"))
                        .withFound(TokenUtils.describe(next)));
            }
        }
        consume(parser, LexerTokenType.OPERATOR, ")");
        return new SignatureNode(parameters, parser.spanFrom(start));
    }

    private void parseParameter() {
        int start = parser.nextStart();
        boolean named = false;
        if (peek(parser).isOperator(":")) {
            consume(parser);
            named = true;
        }

        LexerToken token = peek(parser);
        char sigil;
        String name = null;
        switch (token.type) {
            case SCALAR, ARRAY, HASH -> {
                consume(parser);
                sigil = token.text.charAt(0);
                name = token.text.substring(1);
            }
            case SIGIL -> {
                consume(parser);
                sigil = token.text.charAt(0);
            }
            default -> throw new PerlSyntaxException(new ParseError(
                    "A signature parameter must start with '$', '@' or '%'", token.span)
                    .withExpected(List.of("$", "@", "%"))
                    .withFound(TokenUtils.describe(token)));
        }

        if (hasSlurpy) {
            throw new PerlSyntaxException(new ParseError("Slurpy parameter not last", token.span));
        }
        boolean slurpy = sigil == '@' || sigil == '%';
        if (named && (slurpy || name == null)) {
            throw new PerlSyntaxException(new ParseError(
                    slurpy ? "Named parameters cannot be slurpy" : "Named parameter must have a name", token.span));
        }

        String defaultOperator = null;
        Node defaultValue = null;
        LexerToken next = peek(parser);
        if (next.type == LexerTokenType.OPERATOR && DEFAULT_OPERATORS.contains(next.text)) {
            if (slurpy) {
                throw new PerlSyntaxException(new ParseError("A slurpy parameter may not have a default value",
                        next.span));
            }
            defaultOperator = consume(parser).text;
            // "$x =" with nothing after it is an optional parameter without a default
            if (!peek(parser).isOperator(",") && !peek(parser).isOperator(")")) {
                defaultValue = parser.parseExpression(ParserTables.COMMA_PRECEDENCE);
            }
        }

        NodeKind kind;
        if (named) {
            kind = NodeKind.NAMED_PARAMETER;
        } else if (slurpy) {
            kind = NodeKind.SLURPY_PARAMETER;
            hasSlurpy = true;
        } else if (defaultOperator != null) {
            kind = NodeKind.OPTIONAL_PARAMETER;
            hasOptional = true;
        } else {
            if (hasOptional) {
                throw new PerlSyntaxException(new ParseError("Mandatory parameter follows optional parameter",
                        token.span));
            }
            kind = NodeKind.MANDATORY_PARAMETER;
        }
        parser.options.logDebug("signature parameter " + kind + " " + sigil + (name == null ? "" : name));
        parameters.add(new ParameterNode(kind, sigil, name, defaultOperator, defaultValue, parser.spanFrom(start)));
    }
}
