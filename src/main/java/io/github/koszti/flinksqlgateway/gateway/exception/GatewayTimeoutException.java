package io.github.koszti.flinksqlgateway.gateway.exception;

public class GatewayTimeoutException extends GatewayException {

    public GatewayTimeoutException(Throwable cause) {
        super("Request timed out - Flink SQL Gateway took too long to respond", cause);
    }
}
