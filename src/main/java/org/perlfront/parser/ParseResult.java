package org.perlfront.parser;

import org.perlfront.astnode.BlockNode;
import org.perlfront.lexer.SourceText;
import org.perlfront.recovery.BudgetTracker;
import org.perlfront.recovery.ParseError;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of {@link Parser#parse()}: the program tree, the errors found on the way
 * and the budget usage.
 * <p>
 * A non-empty error list does not make the tree unusable, and an empty one does not
 * promise the tree is free of synthetic nodes.
 */
public record ParseResult(BlockNode program, List<ParseError> errors, BudgetTracker budgetUsage,
                          SourceText source, String fileName) {

    public ParseResult {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * The errors rendered as perl-style messages, one per entry.
     */
    public List<String> formattedErrors() {
        List<String> messages = new ArrayList<>();
        for (ParseError error : errors) {
            messages.add(error.format(source, fileName));
        }
        return messages;
    }
}
