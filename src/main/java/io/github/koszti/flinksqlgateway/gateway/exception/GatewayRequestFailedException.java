package io.github.koszti.flinksqlgateway.gateway.exception;

/**
 * Server-reported failure: an HTTP error status, or a 200 response carrying an {@code errors} array.
 */
public class GatewayRequestFailedException extends GatewayException {
    private final int statusCode;

    public GatewayRequestFailedException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the response, or -1 when the gateway answered 200 with an error body.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
