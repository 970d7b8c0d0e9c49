package com.phillippitts.trackembed.service.health;

import com.phillippitts.trackembed.exception.VectorIndexConnectionException;
import com.phillippitts.trackembed.service.index.VectorIndexClient;
import com.phillippitts.trackembed.service.index.VectorIndexClientProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the vector index.
 *
 * <ul>
 *   <li>UP: liveness round-trip succeeded</li>
 *   <li>DOWN: the client could not be created or the round-trip failed</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health. The client is resolved lazily, so the first probe may
 * perform the initial connect.
 */
@Component
public class VectorIndexHealthIndicator implements HealthIndicator {

    private final VectorIndexClientProvider clientProvider;

    public VectorIndexHealthIndicator(VectorIndexClientProvider clientProvider) {
        this.clientProvider = clientProvider;
    }

    @Override
    public Health health() {
        VectorIndexClient client;
        try {
            client = clientProvider.get();
        } catch (VectorIndexConnectionException e) {
            return Health.down()
                    .withDetail("status", "Vector index unreachable")
                    .withDetail("attempts", e.getAttempts())
                    .build();
        }
        Health.Builder builder = client.isHealthy() ? Health.up().withDetail("status", "Vector index operational")
                : Health.down().withDetail("status", "Vector index not responding");
        return builder
                .withDetail("collection", client.getCollection())
                .withDetail("dimension", client.getDimension())
                .build();
    }
}
