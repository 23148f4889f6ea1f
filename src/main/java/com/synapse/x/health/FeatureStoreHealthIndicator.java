package com.synapse.x.health;

import com.synapse.x.dto.HealthStatus;
import com.synapse.x.dto.enums.HealthState;
import com.synapse.x.service.HealthReporter;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class FeatureStoreHealthIndicator implements HealthIndicator {

    private final HealthReporter healthReporter;

    @Override
    public Health health() {
        HealthStatus status = healthReporter.check();
        Health.Builder builder = status.getStatus() == HealthState.DOWN ? Health.down() : Health.up();
        builder.withDetail("status", status.getStatus().wireValue())
                .withDetails(status.getDetails());
        if (status.getActiveModelVersion() != null) {
            builder.withDetail("active_model_version", status.getActiveModelVersion());
        }
        if (status.getLastWriteAgeSeconds() != null) {
            builder.withDetail("last_write_age_seconds", status.getLastWriteAgeSeconds());
        }
        return builder.build();
    }
}
