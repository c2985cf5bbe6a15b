package io.github.koszti.flinksqlgateway.query;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle of one {@link QueryExecutionService#execute} call, spanning every retry attempt.
 */
public class QueryExecution {

    private final String tabId;
    private final CompletableFuture<RunState> completion = new CompletableFuture<>();
    private final AtomicReference<QueryRunner> runner = new AtomicReference<>();
    private volatile boolean cancelRequested;

    QueryExecution(String tabId) {
        this.tabId = tabId;
    }

    public String getTabId() {
        return tabId;
    }

    /**
     * Completes with the final state once no further attempt will be made.
     */
    public CompletableFuture<RunState> completion() {
        return completion;
    }

    public boolean isDone() {
        return completion.isDone();
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public Optional<QueryRunner> currentRunner() {
        return Optional.ofNullable(runner.get());
    }

    public CompletableFuture<RunState> cancel() {
        cancelRequested = true;
        QueryRunner current = runner.get();
        if (current != null) {
            current.cancel();
        }
        return completion;
    }

    void attach(QueryRunner next) {
        runner.set(next);
    }

    void complete(RunState state) {
        completion.complete(state);
    }
}
