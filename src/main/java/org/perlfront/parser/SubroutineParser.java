package org.perlfront.parser;

import org.perlfront.astnode.Node;
import org.perlfront.astnode.SignatureNode;
import org.perlfront.astnode.SubroutineNode;
import org.perlfront.lexer.LexerToken;
import org.perlfront.lexer.LexerTokenType;
import org.perlfront.recovery.ParseError;
import org.perlfront.recovery.PerlSyntaxException;

import java.util.ArrayList;
import java.util.List;

import static org.perlfront.parser.TokenUtils.consume;
import static org.perlfront.parser.TokenUtils.peek;

/**
 * Parses {@code sub} and {@code method} definitions, named or anonymous, and the
 * attribute lists shared with {@code field} and {@code class}.
 */
public class SubroutineParser {

    /**
     * Parses a subroutine starting at the {@code sub} or {@code method} keyword.
     * <p>
     * The header is {@code NAME? PROTOTYPE? ATTRIBUTES? SIGNATURE?}, in any of the orders
     * Perl accepts, followed by a block. A named sub without a block is a forward
     * declaration, and its block is null.
     *
     * @param parser     The parser instance
     * @param declarator "my", "our" or "state" for a lexical sub, or null
     * @param method     true for {@code method}
     * @return a SubroutineNode
     */
    public static Node parseSubroutine(Parser parser, String declarator, boolean method) {
        // a lexical sub starts at its declarator, which the caller has consumed
        int start = declarator != null ? parser.getLastConsumed().span.start() : parser.nextStart();
        consume(parser); // "sub" "method"

        String name = null;
        if (peek(parser).type == LexerTokenType.IDENTIFIER) {
            name = consume(parser).text;
        }
        parser.options.logDebug("parseSubroutine " + (name == null ? "(anon)" : name));

        String prototype = null;
        SignatureNode signature = null;
        List<String> attributes = new ArrayList<>();

        if (peek(parser).type == LexerTokenType.PROTOTYPE) {
            prototype = stripParens(consume(parser).text);
        }
        if (isAttributeStart(peek(parser))) {
            String fromAttribute = collectAttributes(parser, attributes);
            if (fromAttribute != null) {
                prototype = fromAttribute;
            }
        }
        if (peek(parser).isOperator("(")) {
            signature = SignatureParser.parseSignature(parser);
            if (isAttributeStart(peek(parser))) {
                // sub f ($x) :lvalue is accepted for old code
                collectAttributes(parser, attributes);
            }
        }

        Node block;
        LexerToken next = peek(parser);
        if (next.isOperator("{")) {
            block = ParseBlock.parseBlock(parser);
        } else if (name != null && (next.isOperator(";") || next.type == LexerTokenType.EOF || next.isOperator("}"))) {
            // forward declaration
            TokenUtils.consumeIf(parser, ";");
            block = null;
        } else {
            block = ParseBlock.parseRequiredBlock(parser);
        }
        return new SubroutineNode(name, declarator, prototype, signature, attributes, block, method,
                parser.spanFrom(start));
    }

    /**
     * Parses {@code :attr :attr(args) attr}. Attributes after the first may omit their colon.
     *
     * @return the attribute texts, without colons, arguments included
     */
    public static List<String> parseAttributes(Parser parser) {
        List<String> attributes = new ArrayList<>();
        collectAttributes(parser, attributes);
        return attributes;
    }

    /**
     * Collects attributes into {@code attributes} and returns the prototype given by
     * {@code :prototype(...)}, or null.
     */
    private static String collectAttributes(Parser parser, List<String> attributes) {
        String prototype = null;
        while (true) {
            LexerToken token = peek(parser);
            if (token.isOperator(":")) {
                consume(parser);
                if (peek(parser).isOperator("=")) {
                    throw new PerlSyntaxException(new ParseError(
                            "Use of := for an empty attribute list is not allowed", token.span));
                }
                continue;
            }
            if (token.type == LexerTokenType.ERROR) {
                throw new PerlSyntaxException(new ParseError(token.errorMessage, token.span));
            }
            boolean afterColon = parser.getLastConsumed() != null && parser.getLastConsumed().isOperator(":");
            if (token.type != LexerTokenType.ATTRIBUTE
                    && !(token.type == LexerTokenType.IDENTIFIER && afterColon)) {
                return prototype;
            }
            consume(parser);
            String attribute = token.text;
            if (attribute.startsWith("prototype(")) {
                //  :prototype($)
                prototype = stripParens(attribute.substring("prototype".length()));
            }
            attributes.add(attribute);
        }
    }

    private static boolean isAttributeStart(LexerToken token) {
        return token.isOperator(":") || token.type == LexerTokenType.ATTRIBUTE;
    }

    private static String stripParens(String text) {
        return text.substring(1, text.length() - 1);
    }
}
