package io.github.koszti.flinksqlgateway.query;

import io.github.koszti.flinksqlgateway.config.GatewayClientProperties;
import io.github.koszti.flinksqlgateway.gateway.GatewayClient;
import io.github.koszti.flinksqlgateway.gateway.GatewayErrors;
import io.github.koszti.flinksqlgateway.gateway.ResultTokens;
import io.github.koszti.flinksqlgateway.gateway.dto.ColumnInfo;
import io.github.koszti.flinksqlgateway.gateway.dto.ExecuteStatementRequest;
import io.github.koszti.flinksqlgateway.gateway.dto.FetchResultsResponse;
import io.github.koszti.flinksqlgateway.gateway.dto.RowData;
import io.github.koszti.flinksqlgateway.gateway.exception.GatewayRequestFailedException;
import io.github.koszti.flinksqlgateway.gateway.exception.SessionExpiredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongFunction;

/**
 * Drives one or more statements through submit, poll, collect and terminate against one session:
 * <ol>
 *   <li>submit the statement and obtain an operation handle</li>
 *   <li>poll result pages with linear backoff while the gateway reports NOT_READY</li>
 *   <li>buffer rows up to a hard cap and stream them to listeners</li>
 *   <li>stop on EOS, on truncation, on failure or on cancellation</li>
 * </ol>
 * Statements of a chain run strictly in order; the first failure or cancellation ends the run.
 * <p>
 * The runner never throws out of {@link #execute}/{@link #cancel}: failures, cancellation and
 * session expiry are reported through {@link QueryRunListener} and the returned futures.
 * A run ends in exactly one terminal state, or in {@link RunState#IDLE} when the session expired.
 */
public class QueryRunner {

    private static final Logger log = LoggerFactory.getLogger(QueryRunner.class);

    private final GatewayClient client;
    private final String sessionHandle;
    private final int maxRows;
    private final long backoffStepMillis;
    private final long backoffMaxMillis;
    private final List<QueryRunListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private volatile RunState state = RunState.IDLE;
    private volatile Run run; // written under lock
    private volatile LongFunction<Executor> pauses =
            millis -> CompletableFuture.delayedExecutor(millis, TimeUnit.MILLISECONDS);

    public QueryRunner(GatewayClient client, String sessionHandle, GatewayClientProperties props) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.sessionHandle = Objects.requireNonNull(sessionHandle, "sessionHandle must not be null");
        this.maxRows = props.getMaxRows();
        this.backoffStepMillis = Math.max(0, props.getPollBackoffStep().toMillis());
        this.backoffMaxMillis = Math.max(backoffStepMillis, props.getPollBackoffMax().toMillis());
    }

    public QueryRunner addListener(QueryRunListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
        return this;
    }

    public void removeListener(QueryRunListener listener) {
        listeners.remove(listener);
    }

    public RunState getState() {
        return state;
    }

    public boolean isRunning() {
        Run current = run;
        return current != null && !current.settled;
    }

    public String getSessionHandle() {
        return sessionHandle;
    }

    /**
     * Schema of the statement that ran last.
     */
    public List<ColumnInfo> getColumns() {
        Run current = run;
        return current == null || current.buffer == null ? List.of() : current.buffer.getColumns();
    }

    /**
     * Rows buffered for the statement that ran last.
     */
    public List<RowData> getRows() {
        Run current = run;
        return current == null || current.buffer == null ? List.of() : current.buffer.getRows();
    }

    public String getJobId() {
        Run current = run;
        return current == null || current.buffer == null ? null : current.buffer.getJobId();
    }

    /**
     * Replaces the source of poll pauses; the function receives the pause length in milliseconds.
     */
    QueryRunner withPauses(LongFunction<Executor> pauses) {
        this.pauses = Objects.requireNonNull(pauses, "pauses must not be null");
        return this;
    }

    public CompletableFuture<RunState> execute(String statement) {
        return execute(List.of(statement), ExecutionOptions.defaults());
    }

    /**
     * Runs the statements in order. Ignored while a run is in progress or when the list is empty.
     *
     * @return a future completing with the state the run came to rest in
     */
    public CompletableFuture<RunState> execute(List<String> statements, ExecutionOptions options) {
        Run started;
        synchronized (lock) {
            if (isRunning() || statements == null || statements.isEmpty()) {
                log.debug("Ignoring execute request (running={}, statements={})",
                        isRunning(), statements == null ? 0 : statements.size());
                return CompletableFuture.completedFuture(state);
            }
            started = new Run(List.copyOf(statements), options == null ? ExecutionOptions.defaults() : options);
            run = started;
            state = RunState.IDLE;
        }

        log.info("Executing {} statement(s) on session {}", started.statements.size(), sessionHandle);
        runFrom(started, StatementContext.first(started.statements.get(0), started.statements.size()));
        return started.completion;
    }

    /**
     * Requests cancellation of the current run: aborts any in-flight request and, once an
     * operation exists, cancels it, stops its job and closes it. No-op unless running.
     *
     * @return a future completing with the state the run came to rest in
     */
    public CompletableFuture<RunState> cancel() {
        Run current;
        CompletableFuture<?> toAbort;
        StatementContext ctx;
        synchronized (lock) {
            current = run;
            if (current == null || current.settled) {
                return CompletableFuture.completedFuture(state);
            }
            if (current.cancelRequested) {
                return current.completion;
            }
            current.cancelRequested = true;
            toAbort = current.inFlight;
            ctx = current.statement;
            transition(current, RunState.CANCELLING);
        }

        log.info("Cancelling run on session {}", sessionHandle);
        if (toAbort != null) {
            toAbort.cancel(true);
        }
        if (ctx != null && ctx.operationHandle() != null) {
            cancelProtocol(current, ctx);
        }
        return current.completion;
    }

    // ---- statement sequencing ----

    private void runFrom(Run run, StatementContext ctx) {
        runStatement(run, ctx).whenComplete((outcome, error) -> {
            if (error != null) {
                log.error("Unexpected error while running statement {}/{}", ctx.position(), ctx.total(), error);
                run.failure = ctx.annotate(GatewayErrors.messageOf(error));
                conclude(run, StatementOutcome.FAILED);
            } else if (outcome == StatementOutcome.FINISHED && !ctx.isLast() && !run.cancelRequested) {
                runFrom(run, ctx.next(run.statements.get(ctx.index() + 1)));
            } else {
                conclude(run, outcome);
            }
        });
    }

    private CompletableFuture<StatementOutcome> runStatement(Run run, StatementContext ctx) {
        CompletableFuture<StatementOutcome> done = new CompletableFuture<>();
        if (run.cancelRequested) {
            done.complete(StatementOutcome.CANCELLED);
            return done;
        }

        ResultBuffer buffer = new ResultBuffer(maxRows);
        synchronized (lock) {
            run.statement = ctx;
            run.buffer = buffer;
            run.remoteStop = null;
        }
        emit(run, l -> l.onStatementProgress(ctx.position(), ctx.total()));
        transition(run, RunState.SUBMITTING);

        CompletableFuture<String> submit = client.submitStatement(sessionHandle, run.options.toRequest(ctx.statement()));
        track(run, submit);
        submit.whenComplete((operationHandle, error) -> {
            untrack(run, submit);
            try {
                if (error != null) {
                    done.complete(onSubmitFailure(run, ctx, error));
                    return;
                }
                StatementContext submitted = ctx.withOperation(operationHandle);
                synchronized (lock) {
                    run.statement = submitted;
                }
                log.debug("Statement {}/{} submitted, operation={}", ctx.position(), ctx.total(), operationHandle);
                if (run.cancelRequested) {
                    cancelProtocol(run, submitted).whenComplete((v, e) -> done.complete(StatementOutcome.CANCELLED));
                    return;
                }
                transition(run, RunState.RUNNING);
                poll(run, submitted, buffer, ResultTokens.FIRST, 0L, done);
            } catch (RuntimeException e) {
                done.completeExceptionally(e);
            }
        });
        return done;
    }

    private StatementOutcome onSubmitFailure(Run run, StatementContext ctx, Throwable error) {
        if (run.cancelRequested || GatewayErrors.isCancellation(error)) {
            return StatementOutcome.CANCELLED;
        }
        if (GatewayErrors.isSessionExpired(error)) {
            log.info("Session {} expired while submitting statement {}/{}", sessionHandle, ctx.position(), ctx.total());
            return StatementOutcome.SESSION_EXPIRED;
        }
        run.failure = ctx.annotate(GatewayErrors.messageOf(error));
        log.warn("Statement {}/{} failed to submit: {}", ctx.position(), ctx.total(), GatewayErrors.messageOf(error));
        return StatementOutcome.FAILED;
    }

    // ---- result polling ----

    private void poll(Run run, StatementContext ctx, ResultBuffer buffer, long token, long backoff,
            CompletableFuture<StatementOutcome> done) {
        if (run.cancelRequested) {
            cancelProtocol(run, ctx).whenComplete((v, e) -> done.complete(StatementOutcome.CANCELLED));
            return;
        }

        CompletableFuture<FetchResultsResponse> page = client.fetchResults(sessionHandle, ctx.operationHandle(), token);
        track(run, page);
        page.whenComplete((response, error) -> {
            untrack(run, page);
            try {
                if (error != null) {
                    onPollFailure(run, ctx, buffer, error, done);
                } else {
                    onPage(run, ctx, buffer, token, backoff, response, done);
                }
            } catch (RuntimeException e) {
                done.completeExceptionally(e);
            }
        });
    }

    private void onPage(Run run, StatementContext ctx, ResultBuffer buffer, long token, long backoff,
            FetchResultsResponse response, CompletableFuture<StatementOutcome> done) {
        FetchResultsResponse.ResultType type = response == null ? null : response.getResultType();
        FetchResultsResponse.Results results = response == null ? null : response.getResults();

        if (results != null && results.getColumns() != null && !results.getColumns().isEmpty() && !buffer.hasColumns()) {
            buffer.setColumns(results.getColumns());
            List<ColumnInfo> columns = buffer.getColumns();
            emit(run, l -> l.onColumns(columns));
        }

        if (response != null && buffer.recordJobId(response.getJobId())) {
            String jobId = response.getJobId();
            log.info("Statement {}/{} started job {}", ctx.position(), ctx.total(), jobId);
            emit(run, l -> l.onJobId(jobId));
        }

        if (type == FetchResultsResponse.ResultType.PAYLOAD && results != null && buffer.markKindReported()) {
            boolean queryResult = response.isQueryResult();
            emit(run, l -> l.onQueryResultKind(queryResult));
        }

        if (type == FetchResultsResponse.ResultType.EOS) {
            log.info("Statement {}/{} finished with {} row(s)", ctx.position(), ctx.total(), buffer.size());
            done.complete(StatementOutcome.FINISHED);
            return;
        }

        if (type != FetchResultsResponse.ResultType.PAYLOAD || results == null) {
            // NOT_READY, or a page without results: same token again after a longer pause
            pollLater(run, ctx, buffer, token, nextBackoff(backoff), done);
            return;
        }

        List<RowData> data = results.getData() == null ? List.of() : results.getData();
        long nextToken = ResultTokens.next(response.getNextResultUri(), token);
        if (data.isEmpty()) {
            pollLater(run, ctx, buffer, nextToken, nextBackoff(backoff), done);
            return;
        }

        boolean truncated = data.size() > buffer.remaining();
        List<RowData> kept = buffer.append(data);
        int total = buffer.size();
        if (!kept.isEmpty()) {
            emit(run, l -> l.onRows(kept, total));
        }

        if (truncated) {
            String warning = String.format(Locale.ROOT, "Results trimmed to %,d rows", buffer.maxRows());
            log.info("Statement {}/{}: {}", ctx.position(), ctx.total(), warning);
            emit(run, l -> l.onWarning(warning));
            stopRemote(run, ctx).whenComplete((v, e) -> done.complete(StatementOutcome.FINISHED));
            return;
        }

        poll(run, ctx, buffer, nextToken, 0L, done);
    }

    private void onPollFailure(Run run, StatementContext ctx, ResultBuffer buffer, Throwable error,
            CompletableFuture<StatementOutcome> done) {
        if (run.cancelRequested || GatewayErrors.isCancellation(error)) {
            cancelProtocol(run, ctx).whenComplete((v, e) -> done.complete(StatementOutcome.CANCELLED));
            return;
        }
        if (GatewayErrors.isSessionExpired(error)) {
            log.info("Session {} expired while polling statement {}/{}", sessionHandle, ctx.position(), ctx.total());
            done.complete(StatementOutcome.SESSION_EXPIRED);
            return;
        }

        String message = ctx.annotate(GatewayErrors.messageOf(error));
        if (!buffer.isEmpty()) {
            // partial results are kept; the failure becomes a warning
            log.warn("Fetching results failed after {} row(s), keeping partial results: {}", buffer.size(), message);
            emit(run, l -> l.onWarning(message));
            done.complete(StatementOutcome.FINISHED);
            return;
        }
        log.warn("Fetching results failed: {}", message);
        run.failure = message;
        done.complete(StatementOutcome.FAILED);
    }

    private void pollLater(Run run, StatementContext ctx, ResultBuffer buffer, long token, long backoff,
            CompletableFuture<StatementOutcome> done) {
        if (backoff <= 0) {
            poll(run, ctx, buffer, token, backoff, done);
            return;
        }
        CompletableFuture<Void> pause = new CompletableFuture<>();
        track(run, pause);
        pauses.apply(backoff).execute(() -> pause.complete(null));
        pause.whenComplete((v, e) -> {
            untrack(run, pause);
            try {
                poll(run, ctx, buffer, token, backoff, done);
            } catch (RuntimeException ex) {
                done.completeExceptionally(ex);
            }
        });
    }

    private long nextBackoff(long backoff) {
        return Math.min(backoff + backoffStepMillis, backoffMaxMillis);
    }

    // ---- cancellation ----

    /**
     * Cancelling, then cancel the operation, stop its job, close it, then Cancelled.
     * Runs at most once per run; later callers get the same future.
     */
    private CompletableFuture<Void> cancelProtocol(Run run, StatementContext ctx) {
        CompletableFuture<Void> cancellation;
        synchronized (lock) {
            if (run.cancellation != null) {
                return run.cancellation;
            }
            cancellation = new CompletableFuture<>();
            run.cancellation = cancellation;
            transition(run, RunState.CANCELLING);
        }
        stopRemote(run, ctx).whenComplete((v, e) -> {
            settle(run, RunState.CANCELLED);
            cancellation.complete(null);
        });
        return cancellation;
    }

    /**
     * Best-effort remote shutdown of the statement's operation. Each step's failure is swallowed.
     */
    private CompletableFuture<Void> stopRemote(Run run, StatementContext ctx) {
        String operationHandle = ctx.operationHandle();
        CompletableFuture<Void> stop;
        synchronized (lock) {
            if (operationHandle == null) {
                return CompletableFuture.completedFuture(null);
            }
            if (run.remoteStop != null) {
                return run.remoteStop;
            }
            stop = new CompletableFuture<>();
            run.remoteStop = stop;
        }
        ResultBuffer buffer = run.buffer;

        client.cancelOperation(sessionHandle, operationHandle)
                .handle((status, error) -> ignoreStopFailure("cancel operation " + operationHandle, error))
                .thenCompose(v -> {
                    String jobId = buffer == null ? null : buffer.getJobId();
                    return jobId == null ? CompletableFuture.completedFuture(null) : stopJob(jobId);
                })
                .thenCompose(v -> client.closeOperation(sessionHandle, operationHandle)
                        .handle((status, error) -> ignoreStopFailure("close operation " + operationHandle, error)))
                .whenComplete((v, e) -> stop.complete(null));
        return stop;
    }

    private CompletableFuture<Void> stopJob(String jobId) {
        log.info("Stopping job {}", jobId);
        return client.submitStatement(sessionHandle, ExecuteStatementRequest.of(stopJobStatement(jobId)))
                .thenCompose(stopOperation -> client.closeOperation(sessionHandle, stopOperation))
                .handle((status, error) -> ignoreStopFailure("stop job " + jobId, error));
    }

    static String stopJobStatement(String jobId) {
        return "STOP JOB '" + jobId.replace("'", "''") + "'";
    }

    private Void ignoreStopFailure(String step, Throwable error) {
        if (error == null) {
            return null;
        }
        Throwable cause = GatewayErrors.unwrap(error);
        if (cause instanceof GatewayRequestFailedException
                || cause instanceof SessionExpiredException
                || GatewayErrors.isCancellation(cause)) {
            // operation already finished, job already stopped, ...
            log.debug("Ignoring failure to {}: {}", step, GatewayErrors.messageOf(cause));
        } else {
            log.warn("Failed to {}: {}", step, GatewayErrors.messageOf(cause));
        }
        return null;
    }

    // ---- state ----

    private void conclude(Run run, StatementOutcome outcome) {
        if (outcome == StatementOutcome.SESSION_EXPIRED && !run.cancelRequested) {
            boolean halted;
            synchronized (lock) {
                halted = !run.settled;
                if (halted) {
                    run.settled = true;
                    state = RunState.IDLE;
                    emitUnchecked(l -> l.onStateChange(RunState.IDLE));
                }
            }
            if (halted) {
                emitUnchecked(l -> l.onSessionExpired());
                run.completion.complete(RunState.IDLE);
            }
            return;
        }

        if (run.cancelRequested) {
            CompletableFuture<Void> cancellation;
            synchronized (lock) {
                cancellation = run.cancellation;
            }
            if (cancellation == null) {
                settle(run, RunState.CANCELLED);
            } else {
                cancellation.whenComplete((v, e) -> settle(run, RunState.CANCELLED));
            }
            return;
        }

        switch (outcome) {
            case FINISHED -> settle(run, RunState.FINISHED);
            case FAILED -> settle(run, RunState.FAILED);
            default -> settle(run, RunState.CANCELLED);
        }
    }

    private void transition(Run run, RunState next) {
        synchronized (lock) {
            if (run != this.run || run.settled || state == next) {
                return;
            }
            if (run.cancelRequested && next != RunState.CANCELLING) {
                return;
            }
            state = next;
            emitUnchecked(l -> l.onStateChange(next));
        }
    }

    /**
     * Moves the run into its terminal state. Only the first caller wins.
     */
    private void settle(Run run, RunState terminal) {
        synchronized (lock) {
            if (run.settled) {
                return;
            }
            run.settled = true;
            if (terminal == RunState.FAILED && run.failure != null) {
                String message = run.failure;
                emitUnchecked(l -> l.onError(message));
            }
            state = terminal;
            emitUnchecked(l -> l.onStateChange(terminal));
        }
        log.info("Run on session {} ended {}", sessionHandle, terminal);
        run.completion.complete(terminal);
    }

    private void track(Run run, CompletableFuture<?> request) {
        boolean abort;
        synchronized (lock) {
            abort = run.cancelRequested;
            if (!abort) {
                run.inFlight = request;
            }
        }
        if (abort) {
            request.cancel(true);
        }
    }

    private void untrack(Run run, CompletableFuture<?> request) {
        synchronized (lock) {
            if (run.inFlight == request) {
                run.inFlight = null;
            }
        }
    }

    private void emit(Run run, Consumer<QueryRunListener> event) {
        if (run.settled) {
            return;
        }
        emitUnchecked(event);
    }

    private void emitUnchecked(Consumer<QueryRunListener> event) {
        for (QueryRunListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Query listener {} failed", listener, e);
            }
        }
    }

    /**
     * Mutable bookkeeping of one execute call. Per-statement identity lives in {@link StatementContext}.
     */
    private static final class Run {
        final List<String> statements;
        final ExecutionOptions options;
        final CompletableFuture<RunState> completion = new CompletableFuture<>();

        volatile boolean cancelRequested;
        volatile boolean settled;
        volatile String failure;

        // guarded by QueryRunner.lock
        CompletableFuture<?> inFlight;
        StatementContext statement;
        volatile ResultBuffer buffer;
        CompletableFuture<Void> cancellation;
        CompletableFuture<Void> remoteStop;

        Run(List<String> statements, ExecutionOptions options) {
            this.statements = statements;
            this.options = options;
        }
    }
}
