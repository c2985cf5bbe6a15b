package io.github.koszti.flinksqlgateway.gateway.exception;

import java.util.Objects;

public class GatewayUnavailableException extends GatewayException {

    private final String baseUrl;

    public GatewayUnavailableException(String baseUrl, Throwable cause) {
        super("Failed to connect to Flink SQL Gateway at " + baseUrl
                + " - the server may be down or unreachable", cause);
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null");
    }

    public String getBaseUrl() {
        return baseUrl;
    }
}
