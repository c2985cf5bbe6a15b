package io.github.koszti.flinksqlgateway.session;

import java.util.concurrent.atomic.AtomicReference;

public class InMemoryEndpointRepository implements EndpointRepository {

    private final AtomicReference<StoredEndpoints> stored = new AtomicReference<>(StoredEndpoints.empty());

    @Override
    public StoredEndpoints load() {
        return stored.get();
    }

    @Override
    public void save(StoredEndpoints endpoints) {
        stored.set(endpoints);
    }
}
