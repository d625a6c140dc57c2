package org.perlfront.recovery;

/**
 * Limits that keep parsing of hostile or broken input bounded.
 *
 * @param maxErrors        errors stored before further ones are only counted
 * @param maxDepth         deepest nesting of blocks and expressions, at most {@link #DEPTH_CEILING}
 * @param maxTokensSkipped tokens error recovery may skip over the whole parse
 * @param maxRecoveries    number of recovery attempts over the whole parse
 */
public record ParseBudget(int maxErrors, int maxDepth, int maxTokensSkipped, int maxRecoveries) {

    /**
     * Deepest nesting any budget allows. Deeper input is reported as an error instead
     * of exhausting the thread's stack.
     */
    public static final int DEPTH_CEILING = 1000;

    public ParseBudget {
        maxDepth = Math.min(maxDepth, DEPTH_CEILING);
    }

    public static ParseBudget defaults() {
        return new ParseBudget(100, 256, 1000, 500);
    }

    /**
     * Tight limits for untrusted input.
     */
    public static ParseBudget strict() {
        return new ParseBudget(10, 64, 100, 50);
    }

    public static ParseBudget forIde() {
        return defaults();
    }

    /**
     * No limits on errors, skipping or recoveries. Nesting stays capped at
     * {@link #DEPTH_CEILING}.
     */
    public static ParseBudget unlimited() {
        return new ParseBudget(Integer.MAX_VALUE, DEPTH_CEILING, Integer.MAX_VALUE, Integer.MAX_VALUE);
    }

    public ParseBudget withMaxErrors(int maxErrors) {
        return new ParseBudget(maxErrors, maxDepth, maxTokensSkipped, maxRecoveries);
    }

    public ParseBudget withMaxDepth(int maxDepth) {
        return new ParseBudget(maxErrors, maxDepth, maxTokensSkipped, maxRecoveries);
    }

    public ParseBudget withMaxTokensSkipped(int maxTokensSkipped) {
        return new ParseBudget(maxErrors, maxDepth, maxTokensSkipped, maxRecoveries);
    }

    public ParseBudget withMaxRecoveries(int maxRecoveries) {
        return new ParseBudget(maxErrors, maxDepth, maxTokensSkipped, maxRecoveries);
    }
}
