package io.github.koszti.flinksqlgateway.query;

import io.github.koszti.flinksqlgateway.gateway.dto.ColumnInfo;
import io.github.koszti.flinksqlgateway.gateway.dto.RowData;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-statement accumulator: schema, rows up to a hard cap, job id and result kind.
 * A fresh buffer is created for every statement.
 */
final class ResultBuffer {

    private final int maxRows;
    private final List<RowData> rows = new ArrayList<>();
    private List<ColumnInfo> columns = List.of();
    private String jobId;
    private boolean kindReported;

    ResultBuffer(int maxRows) {
        this.maxRows = maxRows;
    }

    synchronized boolean hasColumns() {
        return !columns.isEmpty();
    }

    synchronized void setColumns(List<ColumnInfo> columns) {
        this.columns = List.copyOf(columns);
    }

    synchronized List<ColumnInfo> getColumns() {
        return columns;
    }

    /**
     * Records the job id unless one is already known. Returns whether it was new.
     */
    synchronized boolean recordJobId(String id) {
        if (jobId != null || id == null || id.isBlank()) {
            return false;
        }
        jobId = id;
        return true;
    }

    synchronized String getJobId() {
        return jobId;
    }

    synchronized boolean markKindReported() {
        if (kindReported) {
            return false;
        }
        kindReported = true;
        return true;
    }

    synchronized int remaining() {
        return maxRows - rows.size();
    }

    /**
     * Appends as many rows as fit and returns the ones that were kept.
     */
    synchronized List<RowData> append(List<RowData> batch) {
        int space = maxRows - rows.size();
        List<RowData> kept = batch.size() > space ? batch.subList(0, Math.max(0, space)) : batch;
        List<RowData> copy = List.copyOf(kept);
        rows.addAll(copy);
        return copy;
    }

    synchronized int size() {
        return rows.size();
    }

    synchronized boolean isEmpty() {
        return rows.isEmpty();
    }

    synchronized List<RowData> getRows() {
        return List.copyOf(rows);
    }

    int maxRows() {
        return maxRows;
    }
}
