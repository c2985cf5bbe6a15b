package io.github.koszti.flinksqlgateway.gateway.exception;

/**
 * The gateway no longer knows the session handle the request was made with.
 */
public class SessionExpiredException extends GatewayException {

    public SessionExpiredException(String message) {
        super(message);
    }
}
