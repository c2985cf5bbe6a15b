package io.github.koszti.flinksqlgateway.session;

import io.github.koszti.flinksqlgateway.config.GatewayClientProperties;
import io.github.koszti.flinksqlgateway.gateway.GatewayClient;
import io.github.koszti.flinksqlgateway.gateway.GatewayClientFactory;
import io.github.koszti.flinksqlgateway.gateway.GatewayErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Owns the configured endpoints, the active-endpoint pointer and their persistence,
 * and fans out lifecycle events to subscribers.
 * <p>
 * Removing an endpoint always disconnects all of its sessions first, so no heartbeat
 * outlives its endpoint.
 */
public class ConnectionRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    public static final String DEFAULT_TAB = "default";

    private final EndpointRepository repository;
    private final GatewayClientFactory clientFactory;
    private final ScheduledExecutorService scheduler;
    private final GatewayClientProperties props;

    private final Map<String, GatewayConnection> connections = new LinkedHashMap<>(); // guarded by this
    private String activeEndpointId; // guarded by this
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final ConnectionListener sessionForwarder = this::fire;

    public ConnectionRegistry(EndpointRepository repository,
            GatewayClientFactory clientFactory,
            ScheduledExecutorService scheduler,
            GatewayClientProperties props) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        loadFromRepository();
    }

    public synchronized List<GatewayConnection> getConnections() {
        return List.copyOf(connections.values());
    }

    public synchronized Optional<GatewayConnection> getConnection(String id) {
        return Optional.ofNullable(connections.get(id));
    }

    public synchronized Optional<GatewayConnection> getActiveConnection() {
        return activeEndpointId == null ? Optional.empty() : Optional.ofNullable(connections.get(activeEndpointId));
    }

    public synchronized Optional<String> getActiveEndpointId() {
        return Optional.ofNullable(activeEndpointId);
    }

    /**
     * Adds an endpoint. The first endpoint added becomes the active one.
     * If the definitions cannot be saved the endpoint is not added and the save failure is rethrown.
     */
    public GatewayConnection addEndpoint(String name, String url) {
        GatewayConnection connection = connect(GatewayEndpoint.create(name, url));
        synchronized (this) {
            connections.put(connection.getId(), connection);
            boolean becameActive = connections.size() == 1;
            if (becameActive) {
                activeEndpointId = connection.getId();
            }
            try {
                persist();
            } catch (RuntimeException e) {
                connections.remove(connection.getId());
                if (becameActive) {
                    activeEndpointId = null;
                }
                connection.getSessions().removeListener(sessionForwarder);
                throw e;
            }
        }
        log.info("Added gateway endpoint {} ({}) at {}", connection.getEndpoint().name(), connection.getId(), url);
        fire(ConnectionEvent.endpoint(ConnectionEvent.Type.ENDPOINT_ADDED, connection.getId()));
        return connection;
    }

    /**
     * Disconnects every session of the endpoint, then forgets it. If it was active, the first
     * remaining endpoint becomes active.
     */
    public CompletableFuture<Void> removeEndpoint(String id) {
        GatewayConnection connection;
        boolean activeChanged = false;
        synchronized (this) {
            connection = connections.get(id);
            if (connection == null) {
                return CompletableFuture.completedFuture(null);
            }
            connections.remove(id);
            if (id.equals(activeEndpointId)) {
                activeEndpointId = connections.isEmpty() ? null : connections.keySet().iterator().next();
                activeChanged = true;
            }
            persist();
        }

        CompletableFuture<Void> disconnected = connection.getSessions().disconnectAll();
        connection.getSessions().removeListener(sessionForwarder);
        log.info("Removed gateway endpoint {} ({})", connection.getEndpoint().name(), id);
        fire(ConnectionEvent.endpoint(ConnectionEvent.Type.ENDPOINT_REMOVED, id));
        if (activeChanged) {
            fire(ConnectionEvent.endpoint(ConnectionEvent.Type.ACTIVE_CHANGED, getActiveEndpointId().orElse(null)));
        }
        return disconnected;
    }

    /**
     * Points the registry at another endpoint. Sessions on the previous endpoint stay open
     * and keep their heartbeat until they are closed or the endpoint is removed.
     */
    public boolean setActiveEndpoint(String id) {
        synchronized (this) {
            if (!connections.containsKey(id)) {
                return false;
            }
            if (id.equals(activeEndpointId)) {
                return true;
            }
            String previous = activeEndpointId;
            activeEndpointId = id;
            try {
                persist();
            } catch (RuntimeException e) {
                activeEndpointId = previous;
                throw e;
            }
        }
        fire(ConnectionEvent.endpoint(ConnectionEvent.Type.ACTIVE_CHANGED, id));
        return true;
    }

    /**
     * Opens the {@value #DEFAULT_TAB} tab's session on the active endpoint.
     */
    public CompletableFuture<String> connectActive(Map<String, String> properties) {
        Optional<GatewayConnection> active = getActiveConnection();
        if (active.isEmpty()) {
            return CompletableFuture.failedFuture(new IllegalStateException("No active connection selected"));
        }
        GatewayConnection connection = active.get();
        return connection.getSessions().openSession(DEFAULT_TAB, properties).thenApply(handle -> {
            fire(ConnectionEvent.endpoint(ConnectionEvent.Type.CONNECTED, connection.getId()));
            return handle;
        });
    }

    public CompletableFuture<Void> disconnectActive() {
        Optional<GatewayConnection> active = getActiveConnection();
        if (active.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        GatewayConnection connection = active.get();
        return connection.getSessions().disconnectAll().thenRun(() ->
                fire(ConnectionEvent.endpoint(ConnectionEvent.Type.DISCONNECTED, connection.getId())));
    }

    /**
     * Host application regained focus: re-validate the sessions of every endpoint.
     */
    public CompletableFuture<Void> onForeground() {
        List<CompletableFuture<Void>> checks = new ArrayList<>();
        for (GatewayConnection connection : getConnections()) {
            checks.add(connection.getSessions().onForeground());
        }
        return CompletableFuture.allOf(checks.toArray(new CompletableFuture<?>[0]));
    }

    public void addChangeListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    public void removeChangeListener(ConnectionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Disconnects every endpoint. Endpoint definitions stay persisted.
     */
    @Override
    public void close() {
        for (GatewayConnection connection : getConnections()) {
            try {
                connection.getSessions().disconnectAll().join();
            } catch (RuntimeException e) {
                log.warn("Error disconnecting endpoint {}: {}", connection.getId(), GatewayErrors.messageOf(e));
            }
        }
    }

    private GatewayConnection connect(GatewayEndpoint endpoint) {
        GatewayClient client = clientFactory.create(endpoint.url());
        SessionStore sessions = new SessionStore(endpoint.id(), client, scheduler, props.getHeartbeatInterval());
        sessions.addListener(sessionForwarder);
        return new GatewayConnection(endpoint, client, sessions);
    }

    private void loadFromRepository() {
        EndpointRepository.StoredEndpoints stored;
        try {
            stored = repository.load();
        } catch (RuntimeException e) {
            log.error("Error loading gateway endpoints", e);
            stored = EndpointRepository.StoredEndpoints.empty();
        }

        synchronized (this) {
            for (GatewayEndpoint endpoint : stored.endpoints()) {
                connections.put(endpoint.id(), connect(endpoint));
            }
            String activeId = stored.activeEndpointId();
            if (activeId != null && connections.containsKey(activeId)) {
                activeEndpointId = activeId;
            } else if (!connections.isEmpty()) {
                activeEndpointId = connections.keySet().iterator().next();
            }
        }
        log.info("Loaded {} gateway endpoint(s), active={}", stored.endpoints().size(), activeEndpointId);
    }

    private void persist() {
        List<GatewayEndpoint> endpoints = connections.values().stream()
                .map(GatewayConnection::getEndpoint)
                .toList();
        repository.save(new EndpointRepository.StoredEndpoints(endpoints, activeEndpointId));
    }

    private void fire(ConnectionEvent event) {
        for (ConnectionListener listener : listeners) {
            try {
                listener.onConnectionEvent(event);
            } catch (RuntimeException e) {
                log.warn("Connection listener failed on {}", event, e);
            }
        }
    }
}
