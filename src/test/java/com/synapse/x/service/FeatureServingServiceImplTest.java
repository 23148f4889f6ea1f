package com.synapse.x.service;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.synapse.x.cache.FeatureCacheImpl;
import com.synapse.x.dto.FeatureRecord;
import com.synapse.x.dto.ModelVersion;
import com.synapse.x.dto.OnlineFeatures;
import com.synapse.x.dto.enums.ModelStatus;
import com.synapse.x.exceptions.TooLargeException;
import com.synapse.x.metrics.FeatureStoreMetrics;
import com.synapse.x.processors.LmdbEnvironment;
import com.synapse.x.processors.LmdbFeatureStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import static com.synapse.x.support.TestRecords.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("FeatureServingServiceImpl")
class FeatureServingServiceImplTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path dir;

    private LmdbEnvironment lmdb;
    private LmdbFeatureStore store;
    private FeatureServingServiceImpl service;

    @BeforeEach
    void setUp() throws Exception {
        lmdb = new LmdbEnvironment(dir.toString(), 16L * 1024 * 1024, 0);
        lmdb.init();
        ModelRegistry registry = mock(ModelRegistry.class);
        when(registry.getActive()).thenReturn(Optional.of(ModelVersion.builder()
                .versionId("v1.0.0").embeddingDim(2).status(ModelStatus.ACTIVE).build()));

        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        FeatureStoreMetrics metrics = new FeatureStoreMetrics(new SimpleMeterRegistry());
        store = spy(new LmdbFeatureStore(lmdb, registry, metrics, clock, 0));
        FeatureCacheImpl cache = new FeatureCacheImpl(
                Caffeine.newBuilder().maximumSize(1000).build(),
                Caffeine.newBuilder().maximumSize(1000).build(),
                Caffeine.newBuilder().maximumSize(1000).build(),
                clock);
        service = new FeatureServingServiceImpl(store, cache, metrics, clock, 5, Duration.ofHours(24));
    }

    @AfterEach
    void tearDown() {
        lmdb.close();
    }

    @Test
    @DisplayName("a read right after a write never returns the pre-write value")
    void writeInvalidatesCache() {
        service.writeFeatures("v1", List.of(record("X", NOW.minusSeconds(60), 1, 0)));
        assertThat(service.getOnlineFeatures("v1", List.of("X")).getFound())
                .singleElement()
                .satisfies(r -> assertThat(r.getCultureVector()).containsExactly(1.0, 0.0));

        service.writeFeatures("v1", List.of(record("X", NOW.minusSeconds(30), 0, 1)));

        assertThat(service.getOnlineFeatures("v1", List.of("X")).getFound())
                .singleElement()
                .satisfies(r -> assertThat(r.getCultureVector()).containsExactly(0.0, 1.0));
    }

    @Test
    @DisplayName("repeated reads are served from the cache")
    void cachedReads() {
        service.writeFeatures("v1", List.of(record("X", NOW, 1, 0)));

        service.getOnlineFeatures("v1", List.of("X"));
        service.getOnlineFeatures("v1", List.of("X"));
        service.getOnlineFeatures("v1", List.of("X"));

        verify(store, times(1)).readLatest(eq("v1"), anyCollection());
    }

    @Test
    @DisplayName("duplicates are answered once, unknown ids reported missing, old records flagged stale")
    void missingAndStale() {
        service.writeFeatures("v1", List.of(
                record("FRESH", NOW.minusSeconds(10), 1, 0),
                record("OLD", NOW.minus(Duration.ofDays(3)), 0, 1)));

        OnlineFeatures result = service.getOnlineFeatures("v1", List.of("FRESH", "OLD", "FRESH", "GONE"));

        assertThat(result.getFound()).extracting(FeatureRecord::getCompanyId).containsExactly("FRESH", "OLD");
        assertThat(result.getMissing()).containsExactly("GONE");
        assertThat(result.getStale()).containsExactly("OLD");
    }

    @Test
    @DisplayName("batches above the online limit are refused")
    void tooLarge() {
        List<String> ids = IntStream.range(0, 6).mapToObj(i -> "c" + i).toList();

        assertThatThrownBy(() -> service.getOnlineFeatures("v1", ids)).isInstanceOf(TooLargeException.class);
    }

    @Test
    @DisplayName("rejected records do not touch the cache")
    void rejectedWriteKeepsCache() {
        service.writeFeatures("v1", List.of(record("X", NOW.minusSeconds(10), 1, 0)));
        service.getOnlineFeatures("v1", List.of("X"));

        service.writeFeatures("v1", List.of(record("X", NOW.minusSeconds(20), 0, 1)));
        service.getOnlineFeatures("v1", List.of("X"));

        verify(store, times(1)).readLatest(any(), anyCollection());
    }
}
