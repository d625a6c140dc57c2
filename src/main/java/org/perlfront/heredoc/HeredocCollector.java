package org.perlfront.heredoc;

import org.perlfront.lexer.SourceText;
import org.perlfront.lexer.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads heredoc bodies from the lines that follow their declarations.
 * <p>
 * Bodies are consumed in declaration order: the first heredoc starts on the line after
 * the declarations, each following one starts right after the previous terminator.
 * A line terminates a heredoc when, with leading spaces and tabs and a trailing
 * {@code \r} removed, it equals the label. For {@code <<~} heredocs the terminator's own
 * indentation is then removed from every content line, as far as each line shares it.
 */
public final class HeredocCollector {

    /**
     * @param contents   one entry per pending heredoc, in the same order
     * @param nextOffset byte offset where ordinary lexing resumes
     */
    public record Result(List<HeredocContent> contents, int nextOffset) {
    }

    private HeredocCollector() {
    }

    public static Result collectAll(SourceText source, int offset, List<PendingHeredoc> pending) {
        List<HeredocContent> contents = new ArrayList<>(pending.size());
        int cursor = source.charIndex(offset);
        for (PendingHeredoc heredoc : pending) {
            Collected collected = collect(source, cursor, heredoc);
            contents.add(collected.content);
            cursor = collected.next;
        }
        return new Result(contents, source.byteOffset(cursor));
    }

    private record Collected(HeredocContent content, int next) {
    }

    private static Collected collect(SourceText source, int cursor, PendingHeredoc heredoc) {
        String text = source.text();
        int length = text.length();
        // char ranges of the content lines, line endings excluded
        List<int[]> lines = new ArrayList<>();
        int contentStart = cursor;
        int lineStart = cursor;

        while (lineStart < length) {
            int newline = text.indexOf('\n', lineStart);
            int lineEnd = newline < 0 ? length : newline;
            int next = newline < 0 ? length : newline + 1;
            int contentEnd = lineEnd > lineStart && text.charAt(lineEnd - 1) == '\r' ? lineEnd - 1 : lineEnd;

            int indentEnd = lineStart;
            while (indentEnd < contentEnd && (text.charAt(indentEnd) == ' ' || text.charAt(indentEnd) == '\t')) {
                indentEnd++;
            }
            // only <<~ allows whitespace before the terminator
            if ((heredoc.isAllowIndent() || indentEnd == lineStart) && text.regionMatches(indentEnd, heredoc.getLabel(), 0, heredoc.getLabel().length())
                    && indentEnd + heredoc.getLabel().length() == contentEnd) {
                String indent = heredoc.isAllowIndent() ? text.substring(lineStart, indentEnd) : "";
                List<Span> segments = new ArrayList<>(lines.size());
                for (int[] line : lines) {
                    int start = line[0] + commonPrefix(text, line[0], line[1], indent);
                    segments.add(source.span(start, line[1]));
                }
                return new Collected(new HeredocContent(segments, fullSpan(source, contentStart, segments), true), next);
            }

            lines.add(new int[]{lineStart, contentEnd});
            lineStart = next;
        }

        List<Span> segments = new ArrayList<>(lines.size());
        for (int[] line : lines) {
            segments.add(source.span(line[0], line[1]));
        }
        return new Collected(new HeredocContent(segments, fullSpan(source, contentStart, segments), false), length);
    }

    private static Span fullSpan(SourceText source, int contentStart, List<Span> segments) {
        if (segments.isEmpty()) {
            return Span.at(source.byteOffset(contentStart));
        }
        return new Span(segments.get(0).start(), segments.get(segments.size() - 1).end());
    }

    private static int commonPrefix(String text, int start, int end, String indent) {
        int n = 0;
        while (n < indent.length() && start + n < end && text.charAt(start + n) == indent.charAt(n)) {
            n++;
        }
        return n;
    }
}
