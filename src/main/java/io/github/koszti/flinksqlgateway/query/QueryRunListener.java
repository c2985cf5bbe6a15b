package io.github.koszti.flinksqlgateway.query;

import io.github.koszti.flinksqlgateway.gateway.dto.ColumnInfo;
import io.github.koszti.flinksqlgateway.gateway.dto.RowData;

import java.util.List;

/**
 * Progress callbacks of a {@link QueryRunner}. All methods default to no-ops.
 * <p>
 * Callbacks run on whichever thread completed the underlying request; implementations
 * must not block.
 */
public interface QueryRunListener {

    default void onStateChange(RunState state) {
    }

    /**
     * Result schema of the current statement, delivered once per statement.
     */
    default void onColumns(List<ColumnInfo> columns) {
    }

    /**
     * A batch of new rows; {@code totalRowCount} counts every row buffered for the statement so far.
     */
    default void onRows(List<RowData> batch, int totalRowCount) {
    }

    default void onError(String message) {
    }

    /**
     * Non-fatal condition: results truncated, or partial results after a failed poll.
     */
    default void onWarning(String message) {
    }

    default void onJobId(String jobId) {
    }

    /**
     * Whether the current statement produces a table ({@code true}) or is DDL/DML. Once per statement.
     */
    default void onQueryResultKind(boolean queryResult) {
    }

    /**
     * Fired before each statement is submitted; {@code current} is 1-based.
     */
    default void onStatementProgress(int current, int total) {
    }

    /**
     * The session is gone. The run has halted in {@link RunState#IDLE}, reported just before this call;
     * recovering is up to the caller.
     */
    default void onSessionExpired() {
    }
}
