package org.perlfront.parser;

import org.perlfront.astnode.HeredocNode;
import org.perlfront.heredoc.HeredocContent;
import org.perlfront.lexer.LexerToken;
import org.perlfront.recovery.ParseError;

import java.util.List;

import static org.perlfront.parser.TokenUtils.consume;

/**
 * Heredoc operands. The lexer reads the bodies once it passes the end of the declaring
 * line; the parser only creates the nodes and reports heredocs whose terminator never
 * showed up.
 */
public class ParseHeredoc {

    static HeredocNode parseHeredoc(Parser parser) {
        LexerToken token = consume(parser);
        HeredocNode node = new HeredocNode(token.heredoc, token.span);
        parser.registerHeredoc(node);
        parser.options.logDebug("heredoc <<" + token.heredoc.getLabel() + " declared at " + token.span);
        return node;
    }

    /**
     * Reports every heredoc that reached the end of input without its terminator line.
     * Their content so far stays attached to the node.
     */
    static void reportUnterminated(Parser parser) {
        for (HeredocNode node : parser.getHeredocNodes()) {
            HeredocContent content = node.getContent();
            if (content == null || !content.terminated()) {
                parser.options.logDebug("unterminated heredoc " + node.getLabel());
                parser.recovery.recordError(new ParseError(
                        "Can't find string terminator \"" + node.getLabel() + "\" anywhere before EOF",
                        node.location)
                        .withExpected(List.of(node.getLabel()))
                        .withFound("end of file"));
            }
        }
    }
}
