package io.github.koszti.flinksqlgateway.session;

/**
 * Lifecycle change of an endpoint or of one of its sessions. {@code tabId} is null for endpoint-level events.
 */
public record ConnectionEvent(Type type, String endpointId, String tabId) {

    public enum Type {
        ENDPOINT_ADDED,
        ENDPOINT_REMOVED,
        ACTIVE_CHANGED,
        CONNECTED,
        DISCONNECTED,
        SESSION_OPENED,
        SESSION_RECREATED,
        SESSION_CLOSED
    }

    public static ConnectionEvent endpoint(Type type, String endpointId) {
        return new ConnectionEvent(type, endpointId, null);
    }
}
