package io.github.koszti.flinksqlgateway.session;

import io.github.koszti.flinksqlgateway.gateway.FakeGatewayClient;
import io.github.koszti.flinksqlgateway.gateway.exception.GatewayUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionStoreTest {

    private ScheduledExecutorService scheduler;
    private FakeGatewayClient client;
    private SessionStore store;
    private final List<ConnectionEvent> events = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        client = new FakeGatewayClient();
        store = new SessionStore("endpoint-1", client, scheduler, Duration.ofHours(1));
        store.addListener(events::add);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    @Test
    void openIsIdempotentPerTab() throws Exception {
        String first = await(store.openSession("a"));
        String second = await(store.openSession("a"));

        assertEquals("session-1", first);
        assertEquals(first, second);
        assertEquals(1, client.openCalls.get());
        assertEquals(Map.of(), client.openRequests.get(0).properties());
        assertEquals("tab-a", client.openRequests.get(0).sessionName());
        assertTrue(store.isHeartbeatRunning());
        assertEquals(ConnectionEvent.Type.SESSION_OPENED, events.get(0).type());
    }

    @Test
    void openForwardsSessionProperties() throws Exception {
        await(store.openSession("a", Map.of("table.local-time-zone", "UTC")));

        assertEquals("UTC", client.openRequests.get(0).properties().get("table.local-time-zone"));
    }

    @Test
    void concurrentOpensShareOneRequest() throws Exception {
        client.holdOpens = true;

        CompletableFuture<String> first = store.openSession("a");
        CompletableFuture<String> second = store.openSession("a");
        assertEquals(1, client.openCalls.get());

        client.heldOpens.get(0).complete("h1");

        assertEquals("h1", await(first));
        assertEquals("h1", await(second));
        assertEquals(1, store.sessionCount());
    }

    @Test
    void tabsGetIndependentSessions() throws Exception {
        assertEquals("session-1", await(store.openSession("a")));
        assertEquals("session-2", await(store.openSession("b")));
        assertEquals(2, store.sessionCount());
    }

    @Test
    void closingLastSessionStopsHeartbeat() throws Exception {
        await(store.openSession("a"));
        await(store.openSession("b"));

        await(store.closeSession("a"));
        assertTrue(store.isHeartbeatRunning());

        await(store.closeSession("b"));
        assertFalse(store.isHeartbeatRunning());
        assertEquals(List.of("session-1", "session-2"), client.closedSessions);
        assertEquals(0, store.sessionCount());
    }

    @Test
    void closingUnknownTabIsNoOp() throws Exception {
        await(store.closeSession("missing"));
        assertTrue(client.closedSessions.isEmpty());
    }

    @Test
    void heartbeatRecreatesExpiredSession() throws Exception {
        await(store.openSession("a"));
        long generation = store.getRecord("a").orElseThrow().generation();
        client.expire("session-1");

        store.pingAllSessions();

        assertEquals("session-2", store.getSessionHandle("a").orElseThrow());
        assertTrue(store.getRecord("a").orElseThrow().generation() > generation);
        assertTrue(events.stream().anyMatch(e -> e.type() == ConnectionEvent.Type.SESSION_RECREATED));
    }

    @Test
    void heartbeatKeepsLiveSession() throws Exception {
        await(store.openSession("a"));

        store.pingAllSessions();

        assertEquals(List.of("session-1"), client.heartbeats);
        assertEquals("session-1", store.getSessionHandle("a").orElseThrow());
    }

    @Test
    void laterGenerationWinsWhenOlderOpenCompletesLast() throws Exception {
        await(store.openSession("a"));
        client.holdOpens = true;

        CompletableFuture<String> older = store.recreateSession("a");
        CompletableFuture<String> newer = store.recreateSession("a");
        client.heldOpens.get(1).complete("h-new");
        client.heldOpens.get(0).complete("h-old");

        assertEquals("h-new", await(newer));
        assertEquals("h-new", await(older));
        assertEquals("h-new", store.getSessionHandle("a").orElseThrow());
        assertTrue(client.closedSessions.contains("h-old"));
    }

    @Test
    void laterGenerationReplacesEarlierInstalledOne() throws Exception {
        await(store.openSession("a"));
        client.holdOpens = true;

        CompletableFuture<String> older = store.recreateSession("a");
        CompletableFuture<String> newer = store.recreateSession("a");
        client.heldOpens.get(0).complete("h-old");
        client.heldOpens.get(1).complete("h-new");

        assertEquals("h-old", await(older));
        assertEquals("h-new", await(newer));
        assertEquals("h-new", store.getSessionHandle("a").orElseThrow());
        assertTrue(client.closedSessions.contains("h-old"));
    }

    @Test
    void closeDuringOpenDiscardsNewHandle() throws Exception {
        client.holdOpens = true;
        CompletableFuture<String> opening = store.openSession("a");

        await(store.closeSession("a"));
        client.heldOpens.get(0).complete("h1");

        ExecutionException e = assertThrows(ExecutionException.class, () -> await(opening));
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertFalse(store.hasSession("a"));
        assertTrue(client.closedSessions.contains("h1"));
    }

    @Test
    void foregroundReopensMissingSessions() throws Exception {
        await(store.openSession("a"));
        client.expire("session-1");
        client.failNextOpen(new GatewayUnavailableException(client.getBaseUrl(), new ConnectException("refused")));

        store.pingAllSessions();
        assertFalse(store.hasSession("a"));

        await(store.onForeground());

        assertTrue(store.hasSession("a"));
        assertEquals(3, client.openCalls.get());
    }

    @Test
    void failedRecreateOfLastSessionStopsHeartbeat() throws Exception {
        await(store.openSession("a"));
        client.expire("session-1");
        client.failNextOpen(new GatewayUnavailableException(client.getBaseUrl(), new ConnectException("refused")));

        store.pingAllSessions();

        assertEquals(0, store.sessionCount());
        assertFalse(store.isHeartbeatRunning());

        await(store.onForeground());

        assertTrue(store.hasSession("a"));
        assertTrue(store.isHeartbeatRunning());
    }

    @Test
    void failedRecreateKeepsHeartbeatForOtherTabs() throws Exception {
        await(store.openSession("a"));
        await(store.openSession("b"));
        client.failNextOpen(new GatewayUnavailableException(client.getBaseUrl(), new ConnectException("refused")));

        assertThrows(ExecutionException.class, () -> await(store.recreateSession("a")));

        assertEquals(1, store.sessionCount());
        assertTrue(store.isHeartbeatRunning());
    }

    @Test
    void disconnectAllClosesEverySession() throws Exception {
        await(store.openSession("a"));
        await(store.openSession("b"));

        await(store.disconnectAll());

        assertEquals(0, store.sessionCount());
        assertFalse(store.isHeartbeatRunning());
        assertEquals(2, client.closedSessions.size());
        assertEquals(2, events.stream().filter(e -> e.type() == ConnectionEvent.Type.SESSION_CLOSED).count());

        // forgotten tabs are not reopened
        await(store.onForeground());
        assertEquals(0, store.sessionCount());
    }
}
