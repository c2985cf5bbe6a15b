package io.github.koszti.flinksqlgateway.session;

import io.github.koszti.flinksqlgateway.gateway.GatewayClient;
import io.github.koszti.flinksqlgateway.gateway.GatewayErrors;
import io.github.koszti.flinksqlgateway.gateway.dto.OpenSessionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-endpoint store of session handles, keyed by logical tab id.
 * <p>
 * Every open stamps the resulting record with a generation number; a record is only
 * replaced by one of a newer generation, so when a heartbeat-driven recreate races a
 * caller-driven recreate the later one wins and the loser's handle is closed.
 * Concurrent {@link #openSession} calls for the same tab share one in-flight request.
 * <p>
 * A heartbeat pings every live session on a fixed interval while at least one session exists.
 */
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final String endpointId;
    private final GatewayClient client;
    private final ScheduledExecutorService scheduler;
    private final Duration heartbeatInterval;

    private final ConcurrentMap<String, SessionRecord> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CompletableFuture<String>> pendingOpens = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Map<String, String>> tabProperties = new ConcurrentHashMap<>();
    private final Set<String> knownTabs = ConcurrentHashMap.newKeySet();
    private final AtomicLong generations = new AtomicLong();
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();

    private ScheduledFuture<?> heartbeat; // guarded by this

    public SessionStore(String endpointId,
            GatewayClient client,
            ScheduledExecutorService scheduler,
            Duration heartbeatInterval) {
        this.endpointId = Objects.requireNonNull(endpointId, "endpointId must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.heartbeatInterval = Objects.requireNonNull(heartbeatInterval, "heartbeatInterval must not be null");
    }

    /**
     * Current handle and its generation for one tab.
     */
    public record SessionRecord(String tabId, String handle, long generation) {}

    public Optional<String> getSessionHandle(String tabId) {
        SessionRecord record = sessions.get(tabId);
        return record == null ? Optional.empty() : Optional.of(record.handle());
    }

    public Optional<SessionRecord> getRecord(String tabId) {
        return Optional.ofNullable(sessions.get(tabId));
    }

    public boolean hasSession(String tabId) {
        return sessions.containsKey(tabId);
    }

    public int sessionCount() {
        return sessions.size();
    }

    public synchronized boolean isHeartbeatRunning() {
        return heartbeat != null && !heartbeat.isDone();
    }

    public void addListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConnectionListener listener) {
        listeners.remove(listener);
    }

    public CompletableFuture<String> openSession(String tabId) {
        return openSession(tabId, null);
    }

    /**
     * Returns the tab's live handle, or opens one. Idempotent: an existing record is returned
     * without a network call, and concurrent opens for the same tab share one request.
     */
    public CompletableFuture<String> openSession(String tabId, Map<String, String> properties) {
        Objects.requireNonNull(tabId, "tabId must not be null");
        SessionRecord existing = sessions.get(tabId);
        if (existing != null) {
            return CompletableFuture.completedFuture(existing.handle());
        }

        knownTabs.add(tabId);
        if (properties != null) {
            tabProperties.put(tabId, Map.copyOf(properties));
        }

        CompletableFuture<String> promise = new CompletableFuture<>();
        CompletableFuture<String> inFlight = pendingOpens.putIfAbsent(tabId, promise);
        if (inFlight != null) {
            return inFlight;
        }

        SessionRecord raced = sessions.get(tabId);
        if (raced != null) {
            pendingOpens.remove(tabId, promise);
            promise.complete(raced.handle());
            return promise;
        }

        openFresh(tabId, ConnectionEvent.Type.SESSION_OPENED).whenComplete((handle, error) -> {
            pendingOpens.remove(tabId, promise);
            if (error != null) {
                promise.completeExceptionally(GatewayErrors.unwrap(error));
            } else {
                promise.complete(handle);
            }
        });
        return promise;
    }

    /**
     * Drops the tab's record and opens a new session unconditionally.
     * Callers must use the returned handle, never one captured before the call.
     */
    public CompletableFuture<String> recreateSession(String tabId) {
        Objects.requireNonNull(tabId, "tabId must not be null");
        knownTabs.add(tabId);
        SessionRecord dropped = sessions.remove(tabId);
        if (dropped != null) {
            log.info("Recreating session for tab {} on endpoint {} (dropping generation {})",
                    tabId, endpointId, dropped.generation());
        }
        return openFresh(tabId, ConnectionEvent.Type.SESSION_RECREATED).whenComplete((handle, error) -> {
            if (error != null) {
                // the tab stays known, so onForeground() can still reopen it
                stopHeartbeatIfIdle();
            }
        });
    }

    /**
     * Removes the local record and closes the session remotely, best-effort.
     * Stops the heartbeat once no session is left.
     */
    public CompletableFuture<Void> closeSession(String tabId) {
        knownTabs.remove(tabId);
        tabProperties.remove(tabId);
        SessionRecord record = sessions.remove(tabId);
        stopHeartbeatIfIdle();
        if (record == null) {
            return CompletableFuture.completedFuture(null);
        }
        fire(ConnectionEvent.Type.SESSION_CLOSED, tabId);
        return closeQuietly(record.handle());
    }

    /**
     * Stops the heartbeat and closes every session of this endpoint, best-effort.
     */
    public CompletableFuture<Void> disconnectAll() {
        stopHeartbeat();
        List<SessionRecord> records = new ArrayList<>(sessions.values());
        sessions.clear();
        knownTabs.clear();
        tabProperties.clear();

        List<CompletableFuture<Void>> closes = new ArrayList<>();
        for (SessionRecord record : records) {
            fire(ConnectionEvent.Type.SESSION_CLOSED, record.tabId());
            closes.add(closeQuietly(record.handle()));
        }
        return CompletableFuture.allOf(closes.toArray(new CompletableFuture<?>[0]));
    }

    /**
     * Host application came back to the foreground: ping every live session and reopen
     * every known tab whose record went missing while heartbeats were starved.
     */
    public CompletableFuture<Void> onForeground() {
        if (!sessions.isEmpty()) {
            pingAllSessions();
        }
        List<CompletableFuture<?>> reopened = new ArrayList<>();
        for (String tabId : knownTabs) {
            if (!sessions.containsKey(tabId) && !pendingOpens.containsKey(tabId)) {
                log.info("Session for tab {} on endpoint {} is missing, reopening", tabId, endpointId);
                reopened.add(openSession(tabId).exceptionally(e -> {
                    log.warn("Failed to reopen session for tab {}: {}", tabId, GatewayErrors.messageOf(e));
                    return null;
                }));
            }
        }
        return CompletableFuture.allOf(reopened.toArray(new CompletableFuture<?>[0]));
    }

    /**
     * One heartbeat tick. An expired session is recreated in place; other failures are logged.
     */
    void pingAllSessions() {
        for (SessionRecord record : new ArrayList<>(sessions.values())) {
            client.heartbeat(record.handle()).whenComplete((ignored, error) -> {
                if (error == null) {
                    return;
                }
                if (GatewayErrors.isSessionExpired(error)) {
                    SessionRecord current = sessions.get(record.tabId());
                    if (current == null || current.generation() != record.generation()) {
                        // already replaced or closed by someone else
                        return;
                    }
                    log.warn("Session expired for tab {} on endpoint {}, recreating", record.tabId(), endpointId);
                    recreateSession(record.tabId()).whenComplete((handle, recreateError) -> {
                        if (recreateError != null) {
                            log.error("Failed to recreate session for tab {}: {}",
                                    record.tabId(), GatewayErrors.messageOf(recreateError));
                        }
                    });
                } else {
                    log.warn("Heartbeat failed for tab {} on endpoint {}: {}",
                            record.tabId(), endpointId, GatewayErrors.messageOf(error));
                }
            });
        }
    }

    private CompletableFuture<String> openFresh(String tabId, ConnectionEvent.Type eventType) {
        long generation = generations.incrementAndGet();
        OpenSessionRequest request = new OpenSessionRequest("tab-" + tabId, tabProperties.get(tabId));
        return client.openSession(request).thenApply(handle -> install(tabId, handle, generation, eventType));
    }

    private String install(String tabId, String handle, long generation, ConnectionEvent.Type eventType) {
        if (!knownTabs.contains(tabId)) {
            closeQuietly(handle);
            throw new IllegalStateException("Session for tab " + tabId + " was closed while it was being opened");
        }

        SessionRecord[] replaced = new SessionRecord[1];
        SessionRecord winner = sessions.compute(tabId, (key, current) -> {
            if (current == null || current.generation() < generation) {
                replaced[0] = current;
                return new SessionRecord(key, handle, generation);
            }
            return current;
        });

        if (winner.generation() != generation) {
            log.debug("Discarding stale session generation {} for tab {} (current {})",
                    generation, tabId, winner.generation());
            closeQuietly(handle);
            return winner.handle();
        }
        if (replaced[0] != null) {
            closeQuietly(replaced[0].handle());
        }

        ensureHeartbeat();
        log.debug("Session {} installed for tab {} on endpoint {} (generation {})", handle, tabId, endpointId, generation);
        fire(eventType, tabId);
        return handle;
    }

    private CompletableFuture<Void> closeQuietly(String handle) {
        return client.closeSession(handle).handle((ignored, error) -> {
            if (error != null) {
                log.warn("Error closing session {}: {}", handle, GatewayErrors.messageOf(error));
            }
            return null;
        });
    }

    private synchronized void ensureHeartbeat() {
        if (heartbeat == null || heartbeat.isDone()) {
            long millis = heartbeatInterval.toMillis();
            heartbeat = scheduler.scheduleAtFixedRate(this::heartbeatTick, millis, millis, TimeUnit.MILLISECONDS);
            log.debug("Heartbeat started for endpoint {} every {}", endpointId, heartbeatInterval);
        }
    }

    private void heartbeatTick() {
        try {
            pingAllSessions();
        } catch (RuntimeException e) {
            // an escaping exception would cancel the periodic task
            log.error("Heartbeat tick failed for endpoint {}", endpointId, e);
        }
    }

    private synchronized void stopHeartbeatIfIdle() {
        if (sessions.isEmpty()) {
            stopHeartbeat();
        }
    }

    private synchronized void stopHeartbeat() {
        if (heartbeat != null) {
            heartbeat.cancel(false);
            heartbeat = null;
            log.debug("Heartbeat stopped for endpoint {}", endpointId);
        }
    }

    private void fire(ConnectionEvent.Type type, String tabId) {
        ConnectionEvent event = new ConnectionEvent(type, endpointId, tabId);
        for (ConnectionListener listener : listeners) {
            try {
                listener.onConnectionEvent(event);
            } catch (RuntimeException e) {
                log.warn("Connection listener failed on {}", event, e);
            }
        }
    }
}
