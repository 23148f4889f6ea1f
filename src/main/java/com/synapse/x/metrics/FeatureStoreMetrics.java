package com.synapse.x.metrics;

import com.synapse.x.dto.enums.RejectionReason;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class FeatureStoreMetrics {
    private final MeterRegistry meterRegistry;
    private final DistributionSummary writeBatchSummary;

    public FeatureStoreMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.writeBatchSummary = DistributionSummary.builder("feature_store_write_batch_size")
                .description("Records per WriteFeatures call")
                .register(meterRegistry);
    }

    public void recordWriteBatch(int size) {
        writeBatchSummary.record(size);
    }

    public void recordAccepted(String view, int count) {
        meterRegistry.counter("feature_store_write_accepted", "view", view).increment(count);
    }

    public void recordRejected(RejectionReason reason) {
        meterRegistry.counter("feature_store_write_rejected", "reason", reason.name()).increment();
    }

    public void recordStoreFailure(String operation) {
        meterRegistry.counter("feature_store_failures", "operation", operation).increment();
    }

    public void recordDuration(String operation, long nanos) {
        meterRegistry.timer("feature_store_operation_duration", "operation", operation)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    public void recordCacheHits(int count) {
        meterRegistry.counter("feature_cache_hits").increment(count);
    }

    public void recordCacheMisses(int count) {
        meterRegistry.counter("feature_cache_misses").increment(count);
    }

    public void recordStale(int count) {
        meterRegistry.counter("feature_store_stale_records").increment(count);
    }

    public void recordFallbackServed(int count) {
        meterRegistry.counter("feature_cache_fallback_served").increment(count);
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void stopTimer(Timer.Sample sample, String operation) {
        sample.stop(meterRegistry.timer("feature_store_operation_duration", "operation", operation));
    }
}
