package com.synapse.x.metrics;

import com.synapse.x.dto.enums.ActivationError;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class ModelRegistryMetrics {
    private final MeterRegistry meterRegistry;

    public ModelRegistryMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordActivation(String versionId) {
        meterRegistry.counter("model_registry_activations", "version", versionId).increment();
    }

    public void recordActivationRejected(ActivationError error) {
        meterRegistry.counter("model_registry_activation_rejected", "error", error.name()).increment();
    }

    public void recordRegistration() {
        meterRegistry.counter("model_registry_registrations").increment();
    }
}
