package org.perlfront.recovery;

/**
 * Outcome of one synchronization attempt.
 *
 * @param status  how the attempt ended
 * @param skipped number of tokens consumed
 */
public record RecoveryResult(Status status, int skipped) {

    public enum Status {
        /** Skipped at least one token and stopped on a sync point. */
        RECOVERED,
        /** Was already on a sync point; nothing consumed. */
        AT_SYNC_POINT,
        /** Ran out of skip or recovery budget before reaching a sync point. */
        BUDGET_EXHAUSTED,
        /** Hit the end of input. */
        REACHED_EOF
    }

    public static final RecoveryResult AT_SYNC_POINT = new RecoveryResult(Status.AT_SYNC_POINT, 0);

    public static RecoveryResult recovered(int skipped) {
        return new RecoveryResult(Status.RECOVERED, skipped);
    }

    public static RecoveryResult budgetExhausted(int skipped) {
        return new RecoveryResult(Status.BUDGET_EXHAUSTED, skipped);
    }

    public static RecoveryResult reachedEof(int skipped) {
        return new RecoveryResult(Status.REACHED_EOF, skipped);
    }

    public boolean isBudgetExhausted() {
        return status == Status.BUDGET_EXHAUSTED;
    }
}
