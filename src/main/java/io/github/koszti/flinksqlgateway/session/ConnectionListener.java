package io.github.koszti.flinksqlgateway.session;

@FunctionalInterface
public interface ConnectionListener {

    void onConnectionEvent(ConnectionEvent event);
}
