package io.github.koszti.flinksqlgateway.query;

import io.github.koszti.flinksqlgateway.config.GatewayClientProperties;
import io.github.koszti.flinksqlgateway.gateway.GatewayErrors;
import io.github.koszti.flinksqlgateway.gateway.dto.ColumnInfo;
import io.github.koszti.flinksqlgateway.gateway.dto.RowData;
import io.github.koszti.flinksqlgateway.session.ConnectionRegistry;
import io.github.koszti.flinksqlgateway.session.GatewayConnection;
import io.github.koszti.flinksqlgateway.sql.StatementSplitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Runs SQL text for a tab on the active endpoint and owns session-expiry recovery:
 * when a run halts because its session expired, the tab's session is recreated and
 * the statements are run again with the fresh handle, up to
 * {@link GatewayClientProperties#getMaxSessionRetries()} times.
 * <p>
 * Problems are reported to the listener; nothing is thrown to the caller.
 */
@Service
public class QueryExecutionService {

    private static final Logger log = LoggerFactory.getLogger(QueryExecutionService.class);

    static final String SESSION_EXPIRED_MESSAGE = "Session expired. Please try again.";

    private final ConnectionRegistry registry;
    private final GatewayClientProperties props;
    private final ConcurrentMap<String, QueryExecution> executionsByTab = new ConcurrentHashMap<>();

    public QueryExecutionService(ConnectionRegistry registry, GatewayClientProperties props) {
        this.registry = registry;
        this.props = props;
    }

    public Optional<QueryExecution> getExecution(String tabId) {
        return Optional.ofNullable(executionsByTab.get(tabId));
    }

    /**
     * Splits {@code sqlText} into statements and runs them on the tab's session.
     * A still-running execution of the same tab is cancelled first.
     */
    public QueryExecution execute(String tabId, String sqlText, ExecutionOptions options, QueryRunListener listener) {
        Objects.requireNonNull(tabId, "tabId must not be null");
        Objects.requireNonNull(listener, "listener must not be null");

        QueryExecution execution = new QueryExecution(tabId);
        QueryExecution previous = executionsByTab.put(tabId, execution);
        execution.completion().whenComplete((state, error) -> executionsByTab.remove(tabId, execution));

        Optional<GatewayConnection> active = registry.getActiveConnection();
        if (active.isEmpty()) {
            fail(execution, listener, "No gateway connection selected");
            return execution;
        }
        List<String> statements = sqlText == null ? List.of() : StatementSplitter.split(sqlText);
        if (statements.isEmpty()) {
            fail(execution, listener, "No SQL statement to execute");
            return execution;
        }

        GatewayConnection connection = active.get();
        CompletableFuture<?> previousDone = previous == null || previous.isDone()
                ? CompletableFuture.completedFuture(null)
                : previous.cancel().handle((state, error) -> null);

        previousDone
                .thenCompose(v -> connection.getSessions().openSession(tabId))
                .whenComplete((sessionHandle, error) -> {
                    if (error != null) {
                        log.warn("Unable to open session for tab {}: {}", tabId, GatewayErrors.messageOf(error));
                        fail(execution, listener, GatewayErrors.messageOf(error));
                        return;
                    }
                    attempt(connection, statements, options, listener, execution, sessionHandle, 0);
                });
        return execution;
    }

    private void attempt(GatewayConnection connection,
            List<String> statements,
            ExecutionOptions options,
            QueryRunListener listener,
            QueryExecution execution,
            String sessionHandle,
            int retries) {
        if (execution.isCancelRequested()) {
            listener.onStateChange(RunState.CANCELLED);
            execution.complete(RunState.CANCELLED);
            return;
        }

        QueryRunner runner = new QueryRunner(connection.getClient(), sessionHandle, props)
                .addListener(new RecoveringListener(listener));
        execution.attach(runner);
        CompletableFuture<RunState> run = runner.execute(statements, options);
        if (execution.isCancelRequested()) {
            runner.cancel();
        }

        run.whenComplete((state, error) -> {
            if (error != null) {
                fail(execution, listener, GatewayErrors.messageOf(error));
                return;
            }
            if (state != RunState.IDLE) {
                execution.complete(state);
                return;
            }
            if (execution.isCancelRequested()) {
                listener.onStateChange(RunState.CANCELLED);
                execution.complete(RunState.CANCELLED);
                return;
            }
            if (retries >= props.getMaxSessionRetries()) {
                log.warn("Session for tab {} expired again after {} retr{}, giving up",
                        execution.getTabId(), retries, retries == 1 ? "y" : "ies");
                fail(execution, listener, SESSION_EXPIRED_MESSAGE);
                return;
            }

            log.info("Session for tab {} expired, recreating (attempt {}/{})",
                    execution.getTabId(), retries + 1, props.getMaxSessionRetries());
            connection.getSessions().recreateSession(execution.getTabId()).whenComplete((freshHandle, recreateError) -> {
                if (recreateError != null) {
                    log.warn("Failed to recreate session for tab {}: {}",
                            execution.getTabId(), GatewayErrors.messageOf(recreateError));
                    fail(execution, listener, GatewayErrors.messageOf(recreateError));
                    return;
                }
                attempt(connection, statements, options, listener, execution, freshHandle, retries + 1);
            });
        });
    }

    private static void fail(QueryExecution execution, QueryRunListener listener, String message) {
        listener.onError(message);
        listener.onStateChange(RunState.FAILED);
        execution.complete(RunState.FAILED);
    }

    /**
     * Forwards every callback except the expiry hook, which this service handles itself.
     */
    private static final class RecoveringListener implements QueryRunListener {
        private final QueryRunListener delegate;

        RecoveringListener(QueryRunListener delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onStateChange(RunState state) {
            delegate.onStateChange(state);
        }

        @Override
        public void onColumns(List<ColumnInfo> columns) {
            delegate.onColumns(columns);
        }

        @Override
        public void onRows(List<RowData> batch, int totalRowCount) {
            delegate.onRows(batch, totalRowCount);
        }

        @Override
        public void onError(String message) {
            delegate.onError(message);
        }

        @Override
        public void onWarning(String message) {
            delegate.onWarning(message);
        }

        @Override
        public void onJobId(String jobId) {
            delegate.onJobId(jobId);
        }

        @Override
        public void onQueryResultKind(boolean queryResult) {
            delegate.onQueryResultKind(queryResult);
        }

        @Override
        public void onStatementProgress(int current, int total) {
            delegate.onStatementProgress(current, total);
        }

        @Override
        public void onSessionExpired() {
            log.debug("Session expiry reported by runner, recovering");
        }
    }
}
