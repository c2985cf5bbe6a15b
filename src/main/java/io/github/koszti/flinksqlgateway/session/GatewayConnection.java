package io.github.koszti.flinksqlgateway.session;

import io.github.koszti.flinksqlgateway.gateway.GatewayClient;

import java.util.Objects;

/**
 * One endpoint together with its client and its per-tab sessions.
 */
public class GatewayConnection {

    private final GatewayEndpoint endpoint;
    private final GatewayClient client;
    private final SessionStore sessions;

    public GatewayConnection(GatewayEndpoint endpoint, GatewayClient client, SessionStore sessions) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
    }

    public GatewayEndpoint getEndpoint() {
        return endpoint;
    }

    public String getId() {
        return endpoint.id();
    }

    public GatewayClient getClient() {
        return client;
    }

    public SessionStore getSessions() {
        return sessions;
    }
}
