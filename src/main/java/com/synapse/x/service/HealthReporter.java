package com.synapse.x.service;

import com.synapse.x.dto.HealthStatus;
import com.synapse.x.dto.ModelVersion;
import com.synapse.x.dto.enums.HealthState;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Service health:
 * <ul>
 *     <li>{@code down} when the store cannot serve a read</li>
 *     <li>{@code degraded} without an active model, with the lookup circuit open, or when the
 *     last write is older than the staleness bound</li>
 *     <li>{@code ok} otherwise</li>
 * </ul>
 */
@Slf4j
@Service
public class HealthReporter {

    private final FeatureStore featureStore;
    private final ModelRegistry modelRegistry;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final Clock clock;
    private final Duration stalenessBound;

    public HealthReporter(FeatureStore featureStore,
                          ModelRegistry modelRegistry,
                          CircuitBreakerRegistry circuitBreakerRegistry,
                          Clock clock,
                          @Value("${synapse.store.staleness-bound:24h}") Duration stalenessBound) {
        this.featureStore = featureStore;
        this.modelRegistry = modelRegistry;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.clock = clock;
        this.stalenessBound = stalenessBound;
    }

    public HealthStatus check() {
        Instant now = clock.instant();
        boolean readable = featureStore.isReadable();
        Optional<ModelVersion> active = modelRegistry.getActive();
        Long lastWriteAge = featureStore.lastWriteTime()
                .map(t -> Math.max(0L, Duration.between(t, now).getSeconds()))
                .orElse(null);
        CircuitBreaker.State breaker = circuitBreakerRegistry.find(FeatureLookupService.RESILIENCE_INSTANCE)
                .map(CircuitBreaker::getState)
                .orElse(CircuitBreaker.State.CLOSED);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("store_readable", readable);
        details.put("lookup_circuit", breaker.name());
        details.put("staleness_bound_seconds", stalenessBound.getSeconds());

        HealthState state;
        if (!readable) {
            state = HealthState.DOWN;
        } else if (active.isEmpty()
                || breaker == CircuitBreaker.State.OPEN
                || (lastWriteAge != null && lastWriteAge > stalenessBound.getSeconds())) {
            state = HealthState.DEGRADED;
        } else {
            state = HealthState.OK;
        }
        if (state != HealthState.OK) {
            log.debug("Health {}: details={} active_model={}", state, details, active.map(ModelVersion::getVersionId).orElse(null));
        }

        return HealthStatus.builder()
                .status(state)
                .activeModelVersion(active.map(ModelVersion::getVersionId).orElse(null))
                .lastWriteAgeSeconds(lastWriteAge)
                .timestamp(now)
                .details(details)
                .build();
    }
}
