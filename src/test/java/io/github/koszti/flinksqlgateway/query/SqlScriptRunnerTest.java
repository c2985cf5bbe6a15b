package io.github.koszti.flinksqlgateway.query;

import io.github.koszti.flinksqlgateway.config.GatewayClientProperties;
import io.github.koszti.flinksqlgateway.gateway.FakeGatewayClient;
import io.github.koszti.flinksqlgateway.session.ConnectionEvent;
import io.github.koszti.flinksqlgateway.session.ConnectionRegistry;
import io.github.koszti.flinksqlgateway.session.GatewayConnection;
import io.github.koszti.flinksqlgateway.session.InMemoryEndpointRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqlScriptRunnerTest {

    private ScheduledExecutorService scheduler;
    private FakeGatewayClient client;
    private InMemoryEndpointRepository repository;
    private ConnectionRegistry registry;
    private SqlScriptRunner runner;
    private final List<ConnectionEvent> events = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        client = new FakeGatewayClient();
        GatewayClientProperties props = new GatewayClientProperties();
        props.setHeartbeatInterval(Duration.ofHours(1));
        repository = new InMemoryEndpointRepository();
        registry = new ConnectionRegistry(repository, url -> client, scheduler, props);
        runner = new SqlScriptRunner(registry, new QueryExecutionService(registry, props));
    }

    @AfterEach
    void tearDown() {
        registry.close();
        scheduler.shutdownNow();
    }

    @Test
    void unknownGatewayUrlIsUsedForTheRunOnly() {
        GatewayConnection prod = registry.addEndpoint("prod", "http://prod:8083");
        registry.addChangeListener(events::add);

        runner.run(new DefaultApplicationArguments("--sql=SELECT 1", "--gateway-url=http://adhoc:8083"));

        assertEquals(List.of("SELECT 1"), client.submittedStatements);
        assertEquals(List.of(prod.getId()), registry.getConnections().stream().map(GatewayConnection::getId).toList());
        assertEquals(prod.getId(), registry.getActiveEndpointId().orElseThrow());
        assertEquals(1, repository.load().endpoints().size());
        assertEquals(prod.getId(), repository.load().activeEndpointId());
        assertTrue(events.stream().anyMatch(e -> e.type() == ConnectionEvent.Type.ENDPOINT_REMOVED));
    }

    @Test
    void repeatedRunsDoNotAccumulateEndpoints() {
        runner.run(new DefaultApplicationArguments("--sql=SELECT 1", "--gateway-url=http://adhoc:8083"));
        runner.run(new DefaultApplicationArguments("--sql=SELECT 2", "--gateway-url=http://adhoc:8083"));

        assertEquals(List.of("SELECT 1", "SELECT 2"), client.submittedStatements);
        assertTrue(registry.getConnections().isEmpty());
        assertTrue(repository.load().endpoints().isEmpty());
    }

    @Test
    void knownGatewayUrlReusesStoredEndpoint() {
        GatewayConnection prod = registry.addEndpoint("prod", "http://prod:8083");
        GatewayConnection staging = registry.addEndpoint("staging", "http://staging:8083");
        registry.addChangeListener(events::add);

        runner.run(new DefaultApplicationArguments("--sql=SELECT 1", "--gateway-url=http://staging:8083/"));

        assertEquals(List.of("SELECT 1"), client.submittedStatements);
        assertEquals(2, registry.getConnections().size());
        assertFalse(events.stream().anyMatch(e -> e.type() == ConnectionEvent.Type.ENDPOINT_ADDED));
        assertEquals(prod.getId(), registry.getActiveEndpointId().orElseThrow());
        assertEquals(0, staging.getSessions().sessionCount());
    }

    @Test
    void withoutGatewayUrlRunsOnActiveEndpoint() {
        GatewayConnection prod = registry.addEndpoint("prod", "http://prod:8083");

        runner.run(new DefaultApplicationArguments("--sql=SELECT 1"));

        assertEquals(List.of("SELECT 1"), client.submittedStatements);
        assertEquals(0, prod.getSessions().sessionCount());
    }

    @Test
    void missingSqlDoesNothing() {
        registry.addEndpoint("prod", "http://prod:8083");

        runner.run(new DefaultApplicationArguments("--gateway-url=http://adhoc:8083"));

        assertTrue(client.submittedStatements.isEmpty());
        assertEquals(1, registry.getConnections().size());
    }
}
