package com.synapse.x.scheduler;

import com.synapse.x.exceptions.StoreUnavailableException;
import com.synapse.x.processors.LmdbEnvironment;
import com.synapse.x.service.FeatureStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
public class StoreMaintenanceJob {

    private final FeatureStore featureStore;
    private final LmdbEnvironment lmdb;
    private final Clock clock;
    private final Duration stalenessBound;

    private final AtomicLong lastWriteAgeSeconds = new AtomicLong(-1);
    private final AtomicLong viewCount = new AtomicLong();
    private final AtomicLong storeSizeBytes = new AtomicLong();

    public StoreMaintenanceJob(FeatureStore featureStore,
                               LmdbEnvironment lmdb,
                               Clock clock,
                               MeterRegistry meterRegistry,
                               @Value("${synapse.store.staleness-bound:24h}") Duration stalenessBound) {
        this.featureStore = featureStore;
        this.lmdb = lmdb;
        this.clock = clock;
        this.stalenessBound = stalenessBound;

        Gauge.builder("feature_store_last_write_age_seconds", lastWriteAgeSeconds, AtomicLong::get)
                .description("Seconds since the last committed feature write, -1 before the first")
                .register(meterRegistry);
        Gauge.builder("feature_store_views", viewCount, AtomicLong::get).register(meterRegistry);
        Gauge.builder("feature_store_size_bytes", storeSizeBytes, AtomicLong::get)
                .baseUnit("bytes")
                .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${synapse.store.maintenance-interval-ms:60000}", initialDelay = 10_000)
    public void refresh() {
        if (!lmdb.isOpen()) {
            log.warn("Store maintenance skipped: LMDB environment is closed");
            return;
        }
        try {
            viewCount.set(featureStore.listViews().size());
        } catch (StoreUnavailableException e) {
            log.warn("Store maintenance could not list feature views: {}", e.getMessage());
        }
        storeSizeBytes.set(lmdb.dataFileSize());

        Optional<Instant> lastWrite = featureStore.lastWriteTime();
        if (lastWrite.isEmpty()) {
            lastWriteAgeSeconds.set(-1);
            return;
        }
        long age = Math.max(0L, Duration.between(lastWrite.get(), clock.instant()).getSeconds());
        lastWriteAgeSeconds.set(age);
        if (age > stalenessBound.getSeconds()) {
            log.warn("No feature writes for {}s (staleness bound {}s), served features are going stale",
                    age, stalenessBound.getSeconds());
        }
    }

    long lastWriteAgeSeconds() {
        return lastWriteAgeSeconds.get();
    }

    long viewCount() {
        return viewCount.get();
    }
}
