package io.github.koszti.flinksqlgateway.query;

import io.github.koszti.flinksqlgateway.config.GatewayClientProperties;
import io.github.koszti.flinksqlgateway.gateway.FakeGatewayClient;
import io.github.koszti.flinksqlgateway.session.ConnectionRegistry;
import io.github.koszti.flinksqlgateway.session.InMemoryEndpointRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryExecutionServiceTest {

    private ScheduledExecutorService scheduler;
    private FakeGatewayClient client;
    private GatewayClientProperties props;
    private ConnectionRegistry registry;
    private QueryExecutionService service;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        client = new FakeGatewayClient();
        props = new GatewayClientProperties();
        props.setHeartbeatInterval(Duration.ofHours(1));
        props.setPollBackoffStep(Duration.ofMillis(1));
        props.setPollBackoffMax(Duration.ofMillis(5));
        registry = new ConnectionRegistry(new InMemoryEndpointRepository(), url -> client, scheduler, props);
        service = new QueryExecutionService(registry, props);
    }

    @AfterEach
    void tearDown() {
        registry.close();
        scheduler.shutdownNow();
    }

    private static RunState await(QueryExecution execution) throws Exception {
        return execution.completion().get(5, TimeUnit.SECONDS);
    }

    @Test
    void runsSplitStatementsOnTabSession() throws Exception {
        registry.addEndpoint("local", "http://localhost:8083");
        RecordingListener listener = new RecordingListener();

        QueryExecution execution = service.execute("tab-1", "SELECT 1; -- one\nSELECT ';' AS x;", ExecutionOptions.defaults(), listener);

        assertEquals(RunState.FINISHED, await(execution));
        assertEquals(List.of("SELECT 1", "-- one\nSELECT ';' AS x"), client.submittedStatements);
        assertEquals(List.of("session-1", "session-1"), client.submittedSessions);
        assertEquals("tab-tab-1", client.openRequests.get(0).sessionName());
        assertTrue(service.getExecution("tab-1").isEmpty());
    }

    @Test
    void recreatesSessionOnceAfterExpiry() throws Exception {
        registry.addEndpoint("local", "http://localhost:8083");
        client.expire("session-1");
        RecordingListener listener = new RecordingListener();

        QueryExecution execution = service.execute("tab-1", "SELECT 1", ExecutionOptions.defaults(), listener);

        assertEquals(RunState.FINISHED, await(execution));
        assertEquals(2, client.openCalls.get());
        assertEquals(List.of("session-1", "session-2"), client.submittedSessions);
        assertEquals(0, listener.sessionExpired.get());
        assertTrue(listener.errors.isEmpty());
        assertEquals(RunState.FINISHED, listener.states.get(listener.states.size() - 1));
    }

    @Test
    void secondExpiryFailsWithExpiryMessage() throws Exception {
        registry.addEndpoint("local", "http://localhost:8083");
        client.expire("session-1");
        client.expire("session-2");
        RecordingListener listener = new RecordingListener();

        QueryExecution execution = service.execute("tab-1", "SELECT 1", ExecutionOptions.defaults(), listener);

        assertEquals(RunState.FAILED, await(execution));
        assertEquals(2, client.openCalls.get());
        assertEquals(List.of(QueryExecutionService.SESSION_EXPIRED_MESSAGE), listener.errors);
        assertEquals(RunState.FAILED, listener.states.get(listener.states.size() - 1));
    }

    @Test
    void failsWithoutActiveEndpoint() throws Exception {
        RecordingListener listener = new RecordingListener();

        QueryExecution execution = service.execute("tab-1", "SELECT 1", ExecutionOptions.defaults(), listener);

        assertEquals(RunState.FAILED, await(execution));
        assertEquals(List.of("No gateway connection selected"), listener.errors);
        assertEquals(0, client.openCalls.get());
    }

    @Test
    void failsOnBlankSql() throws Exception {
        registry.addEndpoint("local", "http://localhost:8083");
        RecordingListener listener = new RecordingListener();

        QueryExecution execution = service.execute("tab-1", "  ;  ", ExecutionOptions.defaults(), listener);

        assertEquals(RunState.FAILED, await(execution));
        assertEquals(List.of("No SQL statement to execute"), listener.errors);
        assertTrue(client.submittedStatements.isEmpty());
    }

    @Test
    void newExecutionCancelsPreviousOneOnSameTab() throws Exception {
        registry.addEndpoint("local", "http://localhost:8083");
        client.onFetch("op-1", new CompletableFuture<>());
        RecordingListener firstListener = new RecordingListener();
        RecordingListener secondListener = new RecordingListener();

        QueryExecution first = service.execute("tab-1", "SELECT * FROM clicks", ExecutionOptions.defaults(), firstListener);
        assertFalse(first.isDone());
        QueryExecution second = service.execute("tab-1", "SELECT 1", ExecutionOptions.defaults(), secondListener);

        assertEquals(RunState.CANCELLED, await(first));
        assertEquals(RunState.FINISHED, await(second));
        assertEquals(List.of("op-1"), client.cancelledOperations);
        assertEquals(1, client.openCalls.get());
    }

    @Test
    void cancelStopsExecution() throws Exception {
        registry.addEndpoint("local", "http://localhost:8083");
        client.onFetch("op-1", new CompletableFuture<>());
        RecordingListener listener = new RecordingListener();

        QueryExecution execution = service.execute("tab-1", "SELECT * FROM clicks", ExecutionOptions.defaults(), listener);
        assertTrue(service.getExecution("tab-1").isPresent());

        assertEquals(RunState.CANCELLED, execution.cancel().get(5, TimeUnit.SECONDS));
        assertTrue(execution.isCancelRequested());
        assertEquals(RunState.CANCELLED, listener.states.get(listener.states.size() - 1));
    }
}
