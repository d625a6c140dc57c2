package org.perlfront.parser;

import org.perlfront.astnode.BlockNode;
import org.perlfront.astnode.SpecialBlockNode;
import org.perlfront.lexer.LexerToken;

import static org.perlfront.parser.TokenUtils.consume;

/**
 * Parses the phase blocks BEGIN, END, INIT, CHECK and UNITCHECK. They are kept in the
 * tree in source order; nothing is run.
 */
public class SpecialBlockParser {

    public static SpecialBlockNode parseSpecialBlock(Parser parser) {
        LexerToken phase = consume(parser);
        parser.options.logDebug("special block " + phase.text);
        BlockNode block = ParseBlock.parseBlock(parser);
        TokenUtils.consumeIf(parser, ";");
        return new SpecialBlockNode(phase.text, block, parser.spanFrom(phase.span.start()));
    }
}
