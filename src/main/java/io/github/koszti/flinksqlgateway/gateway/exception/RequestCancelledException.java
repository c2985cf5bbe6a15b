package io.github.koszti.flinksqlgateway.gateway.exception;

public class RequestCancelledException extends GatewayException {

    public RequestCancelledException() {
        super("Request was cancelled");
    }
}
