package io.github.koszti.flinksqlgateway.query;

import io.github.koszti.flinksqlgateway.gateway.dto.ColumnInfo;
import io.github.koszti.flinksqlgateway.gateway.dto.RowData;
import io.github.koszti.flinksqlgateway.session.ConnectionRegistry;
import io.github.koszti.flinksqlgateway.session.GatewayConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runs {@code --sql=...} against {@code --gateway-url=...} (or the active stored endpoint) and logs the results.
 * <p>
 * A gateway URL that matches a stored endpoint reuses it; any other URL is added for the run only.
 * The stored active endpoint is restored afterwards.
 */
@Profile("sql-runner")
@Component
public class SqlScriptRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SqlScriptRunner.class);

    private static final String TAB_ID = "cli";

    private final ConnectionRegistry registry;
    private final QueryExecutionService executionService;

    public SqlScriptRunner(ConnectionRegistry registry, QueryExecutionService executionService) {
        this.registry = registry;
        this.executionService = executionService;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> sql = args.getOptionValues("sql");
        if (sql == null || sql.isEmpty()) {
            log.warn("Nothing to run, pass --sql=<statements>");
            return;
        }

        Optional<String> previousActive = registry.getActiveEndpointId();
        String temporaryEndpoint = null;
        List<String> urls = args.getOptionValues("gateway-url");
        if (urls != null && !urls.isEmpty()) {
            String url = urls.get(0);
            GatewayConnection target = findByUrl(url).orElse(null);
            if (target == null) {
                target = registry.addEndpoint("cli", url);
                temporaryEndpoint = target.getId();
            }
            registry.setActiveEndpoint(target.getId());
        }
        Optional<GatewayConnection> used = registry.getActiveConnection();

        QueryExecution execution = executionService.execute(TAB_ID, String.join(";\n", sql), ExecutionOptions.defaults(),
                new QueryRunListener() {
                    @Override
                    public void onStateChange(RunState state) {
                        log.info("State: {}", state);
                    }

                    @Override
                    public void onStatementProgress(int current, int total) {
                        log.info("Statement {}/{}", current, total);
                    }

                    @Override
                    public void onColumns(List<ColumnInfo> columns) {
                        log.info("Columns: {}", columns.stream().map(ColumnInfo::getName).collect(Collectors.joining(", ")));
                    }

                    @Override
                    public void onRows(List<RowData> batch, int totalRowCount) {
                        batch.forEach(row -> log.info("  {}", row));
                    }

                    @Override
                    public void onJobId(String jobId) {
                        log.info("Job id: {}", jobId);
                    }

                    @Override
                    public void onWarning(String message) {
                        log.warn("{}", message);
                    }

                    @Override
                    public void onError(String message) {
                        log.error("{}", message);
                    }
                });

        try {
            RunState state = execution.completion().join();
            log.info("Finished in state {}", state);
        } finally {
            used.ifPresent(c -> c.getSessions().closeSession(TAB_ID).join());
            if (temporaryEndpoint != null) {
                registry.removeEndpoint(temporaryEndpoint).join();
            }
            previousActive.ifPresent(registry::setActiveEndpoint);
        }
    }

    private Optional<GatewayConnection> findByUrl(String url) {
        String wanted = normalize(url);
        return registry.getConnections().stream()
                .filter(c -> normalize(c.getEndpoint().url()).equals(wanted))
                .findFirst();
    }

    private static String normalize(String url) {
        return url.trim().replaceAll("/+$", "");
    }
}
