package io.github.koszti.flinksqlgateway.session;

import java.util.List;

/**
 * Persists endpoint definitions and the active endpoint id. Sessions are never persisted.
 */
public interface EndpointRepository {

    StoredEndpoints load();

    void save(StoredEndpoints endpoints);

    record StoredEndpoints(List<GatewayEndpoint> endpoints, String activeEndpointId) {

        public StoredEndpoints {
            endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
        }

        public static StoredEndpoints empty() {
            return new StoredEndpoints(List.of(), null);
        }
    }
}
