package org.perlfront.heredoc;

import org.perlfront.lexer.SourceText;
import org.perlfront.lexer.Span;

import java.util.List;

/**
 * The collected body of one heredoc.
 *
 * @param segments   one span per content line, after indentation stripping and without
 *                   the line ending
 * @param fullSpan   from the start of the first segment to the end of the last one;
 *                   zero-width when the heredoc is empty
 * @param terminated false when the input ended before the terminator line
 */
public record HeredocContent(List<Span> segments, Span fullSpan, boolean terminated) {

    public HeredocContent {
        segments = List.copyOf(segments);
    }

    /**
     * Rebuilds the body text, each line followed by a newline.
     */
    public String text(SourceText source) {
        StringBuilder sb = new StringBuilder();
        for (Span segment : segments) {
            sb.append(source.slice(segment)).append('\n');
        }
        return sb.toString();
    }
}
