package io.github.koszti.flinksqlgateway.query;

/**
 * States of a {@link QueryRunner}.
 * <p>
 * {@code IDLE -> SUBMITTING -> RUNNING -> FINISHED | FAILED | CANCELLED}, with
 * {@code SUBMITTING | RUNNING -> CANCELLING -> CANCELLED} on cancellation.
 * A run halted by session expiry rests in {@code IDLE} until the caller recovers.
 */
public enum RunState {
    IDLE,
    SUBMITTING,
    RUNNING,
    CANCELLING,
    FINISHED,
    FAILED,
    CANCELLED;

    public boolean isActive() {
        return this == SUBMITTING || this == RUNNING || this == CANCELLING;
    }

    public boolean isTerminal() {
        return this == FINISHED || this == FAILED || this == CANCELLED;
    }
}
