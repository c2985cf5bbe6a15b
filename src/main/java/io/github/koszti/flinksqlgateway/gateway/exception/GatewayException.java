package io.github.koszti.flinksqlgateway.gateway.exception;

/**
 * Base type of every classified failure raised by the gateway transport.
 */
public abstract class GatewayException extends RuntimeException {

    protected GatewayException(String message) {
        super(message);
    }

    protected GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
