package io.github.koszti.flinksqlgateway.session;

import java.util.Objects;
import java.util.UUID;

/**
 * A configured gateway instance. Immutable once created.
 */
public record GatewayEndpoint(String id, String name, String url) {

    public GatewayEndpoint {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(url, "url must not be null");
    }

    public static GatewayEndpoint create(String name, String url) {
        return new GatewayEndpoint(UUID.randomUUID().toString(), name, url);
    }
}
