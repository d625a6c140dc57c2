package org.perlfront.parser;

import org.perlfront.lexer.LexerStatistics;
import org.perlfront.recovery.ParseBudget;

/**
 * Settings for one parse. Plain mutable fields, read once when the parser is created.
 */
public class ParserOptions {
    public String fileName = "-";
    public boolean debugEnabled = false;
    public ParseBudget budget = ParseBudget.defaults();
    public LexerStatistics statistics = LexerStatistics.NONE;

    public void logDebug(String message) {
        if (debugEnabled) {
            System.out.println(message);
        }
    }

    @Override
    public String toString() {
        return "ParserOptions{\n" +
                "    fileName=" + fileName + ",\n" +
                "    debugEnabled=" + debugEnabled + ",\n" +
                "    budget=" + budget + "\n" +
                "}";
    }
}
