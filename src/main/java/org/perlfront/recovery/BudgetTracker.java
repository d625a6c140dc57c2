package org.perlfront.recovery;

/**
 * Running totals checked against a {@link ParseBudget}. One instance per parse.
 */
public class BudgetTracker {
    private int errorsEmitted;
    private int currentDepth;
    private int maxDepthReached;
    private int tokensSkipped;
    private int recoveriesAttempted;

    public boolean errorsExhausted(ParseBudget budget) {
        return errorsEmitted >= budget.maxErrors();
    }

    public boolean depthWouldExceed(ParseBudget budget) {
        return currentDepth >= budget.maxDepth();
    }

    /**
     * Starts a recovery attempt. Returns false, recording nothing, when the
     * recovery budget is used up.
     */
    public boolean beginRecovery(ParseBudget budget) {
        if (recoveriesAttempted >= budget.maxRecoveries()) {
            return false;
        }
        recoveriesAttempted++;
        return true;
    }

    public boolean canSkipMore(ParseBudget budget, int additional) {
        return (long) tokensSkipped + additional <= budget.maxTokensSkipped();
    }

    public void recordError() {
        if (errorsEmitted < Integer.MAX_VALUE) {
            errorsEmitted++;
        }
    }

    public void enterDepth() {
        currentDepth++;
        if (currentDepth > maxDepthReached) {
            maxDepthReached = currentDepth;
        }
    }

    public void exitDepth() {
        if (currentDepth > 0) {
            currentDepth--;
        }
    }

    public void recordSkip(int count) {
        tokensSkipped = (int) Math.min(Integer.MAX_VALUE, (long) tokensSkipped + count);
    }

    public int getErrorsEmitted() {
        return errorsEmitted;
    }

    public int getCurrentDepth() {
        return currentDepth;
    }

    public int getMaxDepthReached() {
        return maxDepthReached;
    }

    public int getTokensSkipped() {
        return tokensSkipped;
    }

    public int getRecoveriesAttempted() {
        return recoveriesAttempted;
    }

    @Override
    public String toString() {
        return "BudgetTracker{errors=" + errorsEmitted + ", skipped=" + tokensSkipped
                + ", recoveries=" + recoveriesAttempted + ", maxDepth=" + maxDepthReached + '}';
    }
}
