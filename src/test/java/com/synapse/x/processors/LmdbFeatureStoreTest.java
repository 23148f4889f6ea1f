package com.synapse.x.processors;

import com.synapse.x.dto.CompanyPointer;
import com.synapse.x.dto.FeatureRecord;
import com.synapse.x.dto.FeatureStats;
import com.synapse.x.dto.FeatureView;
import com.synapse.x.dto.ModelVersion;
import com.synapse.x.dto.RejectedRecord;
import com.synapse.x.dto.WriteResult;
import com.synapse.x.dto.enums.ModelStatus;
import com.synapse.x.dto.enums.RejectionReason;
import com.synapse.x.exceptions.BadRequestException;
import com.synapse.x.exceptions.ConflictException;
import com.synapse.x.metrics.FeatureStoreMetrics;
import com.synapse.x.service.ModelRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static com.synapse.x.support.TestRecords.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("LmdbFeatureStore")
class LmdbFeatureStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path dir;

    private LmdbEnvironment lmdb;
    private ModelRegistry modelRegistry;
    private LmdbFeatureStore store;

    @BeforeEach
    void setUp() throws Exception {
        lmdb = new LmdbEnvironment(dir.toString(), 16L * 1024 * 1024, 0);
        lmdb.init();
        modelRegistry = mock(ModelRegistry.class);
        when(modelRegistry.getActive()).thenReturn(Optional.of(ModelVersion.builder()
                .versionId("v1.0.0").embeddingDim(4).status(ModelStatus.ACTIVE).build()));
        store = new LmdbFeatureStore(lmdb, modelRegistry,
                new FeatureStoreMetrics(new SimpleMeterRegistry()), Clock.fixed(NOW, ZoneOffset.UTC), 0);
        store.loadLastWrite();
    }

    @AfterEach
    void tearDown() {
        lmdb.close();
    }

    @Test
    @DisplayName("write creates the view implicitly and the latest record is readable")
    void writeThenReadLatest() {
        WriteResult result = store.write("v1", List.of(
                record("A", NOW.minusSeconds(60), 1, 0, 0, 0),
                record("B", NOW.minusSeconds(30), 0, 1, 0, 0)));

        assertThat(result.getAcceptedCount()).isEqualTo(2);
        assertThat(result.getRejected()).isEmpty();

        Map<String, FeatureRecord> latest = store.readLatest("v1", List.of("A", "B", "Z"));
        assertThat(latest).containsOnlyKeys("A", "B");
        assertThat(latest.get("A").getCultureVector()).containsExactly(1.0, 0.0, 0.0, 0.0);
        assertThat(latest.get("B").getTractionMetrics().getFundingAmount()).isEqualTo(1_000_000.0);
        assertThat(store.findView("v1")).map(FeatureView::getEmbeddingDim).contains(4);
        assertThat(store.lastWriteTime()).contains(NOW);
    }

    @Test
    @DisplayName("older and equal timestamps are rejected as out of order")
    void rejectsOutOfOrder() {
        store.write("v1", List.of(record("A", NOW.minusSeconds(10), 1, 0, 0, 0)));

        WriteResult result = store.write("v1", List.of(
                record("A", NOW.minusSeconds(20), 0, 1, 0, 0),
                record("A", NOW.minusSeconds(10), 0, 0, 1, 0)));

        assertThat(result.getAcceptedCount()).isZero();
        assertThat(result.getRejected())
                .extracting(RejectedRecord::getReason)
                .containsExactly(RejectionReason.OUT_OF_ORDER, RejectionReason.OUT_OF_ORDER);
        assertThat(store.readLatest("v1", List.of("A")).get("A").getCultureVector())
                .containsExactly(1.0, 0.0, 0.0, 0.0);
    }

    @Test
    @DisplayName("records of one company inside a batch must be strictly increasing")
    void inBatchOrdering() {
        WriteResult result = store.write("v1", List.of(
                record("A", NOW.minusSeconds(30), 1, 0, 0, 0),
                record("A", NOW.minusSeconds(40), 0, 1, 0, 0),
                record("A", NOW.minusSeconds(20), 0, 0, 1, 0)));

        assertThat(result.getAcceptedCount()).isEqualTo(2);
        assertThat(result.getRejected()).singleElement()
                .satisfies(r -> assertThat(r.getReason()).isEqualTo(RejectionReason.OUT_OF_ORDER));
        assertThat(store.readLatest("v1", List.of("A")).get("A").getTimestamp()).isEqualTo(NOW.minusSeconds(20));
    }

    @Test
    @DisplayName("invalid records are rejected individually while the rest commit")
    void perRecordValidation() {
        FeatureRecord badOverlap = record("C", NOW, 1, 0, 0, 0).toBuilder().userOverlapScore(1.5).build();

        WriteResult result = store.write("v1", List.of(
                record("A", NOW, 1, 0, 0, 0),
                record("B", NOW, 1, 0, 0),
                badOverlap,
                record(" ", NOW, 1, 0, 0, 0)));

        assertThat(result.getAcceptedCount()).isEqualTo(1);
        assertThat(result.getRejected())
                .extracting(RejectedRecord::getReason)
                .containsExactly(RejectionReason.DIMENSION_MISMATCH, RejectionReason.OUT_OF_RANGE,
                        RejectionReason.INVALID_COMPANY_ID);
    }

    @Test
    @DisplayName("a missing timestamp defaults to the current time")
    void defaultsTimestamp() {
        store.write("v1", List.of(record("A", null, 1, 0, 0, 0)));

        assertThat(store.readLatest("v1", List.of("A")).get("A").getTimestamp()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("an empty batch writes nothing and does not create the view")
    void emptyBatch() {
        WriteResult result = store.write("v1", List.of());

        assertThat(result.getAcceptedCount()).isZero();
        assertThat(store.findView("v1")).isEmpty();
    }

    @Test
    @DisplayName("writes to an unknown view fail without an active model or override")
    void unknownViewWithoutModel() {
        when(modelRegistry.getActive()).thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.write("v2", List.of(record("A", NOW, 1, 0, 0, 0))))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("unknown feature_view");
    }

    @Test
    @DisplayName("reads against an unknown view are client errors")
    void readUnknownView() {
        assertThatThrownBy(() -> store.readLatest("nope", List.of("A")))
                .isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> store.readLatest("bad name!", List.of("A")))
                .isInstanceOf(BadRequestException.class);
    }

    @Test
    @DisplayName("historical reads return versions in range ordered by company then time")
    void historicalRange() {
        store.write("v1", List.of(record("B", NOW.minusSeconds(300), 0, 1, 0, 0)));
        store.write("v1", List.of(record("A", NOW.minusSeconds(200), 1, 0, 0, 0)));
        store.write("v1", List.of(record("A", NOW.minusSeconds(100), 0, 0, 1, 0)));
        store.write("v1", List.of(record("B", NOW.minusSeconds(50), 0, 0, 0, 1)));
        store.write("v1", List.of(record("AB", NOW.minusSeconds(150), 1, 1, 0, 0)));

        List<FeatureRecord> records = store.readHistorical("v1", List.of("B", "A", "A"),
                NOW.minusSeconds(250), NOW.minusSeconds(50));

        assertThat(records)
                .extracting(FeatureRecord::getCompanyId, FeatureRecord::getTimestamp)
                .containsExactly(
                        tuple("A", NOW.minusSeconds(200)),
                        tuple("A", NOW.minusSeconds(100)),
                        tuple("B", NOW.minusSeconds(50)));
    }

    @Test
    @DisplayName("historical reads reject an inverted range")
    void historicalInvertedRange() {
        store.write("v1", List.of(record("A", NOW, 1, 0, 0, 0)));

        assertThatThrownBy(() -> store.readHistorical("v1", List.of("A"), NOW, NOW.minusSeconds(1)))
                .isInstanceOf(BadRequestException.class);
    }

    @Test
    @DisplayName("stats count companies and record versions")
    void stats() {
        store.write("v1", List.of(
                record("A", NOW.minusSeconds(20), 1, 0, 0, 0),
                record("A", NOW.minusSeconds(10), 1, 0, 0, 0),
                record("B", NOW.minusSeconds(10), 0, 1, 0, 0)));

        FeatureStats stats = store.stats("v1");

        assertThat(stats.getTotalCompanies()).isEqualTo(2);
        assertThat(stats.getFeatureCount()).isEqualTo(3);
        assertThat(stats.getEmbeddingDim()).isEqualTo(4);
        assertThat(stats.getLastUpdated()).isEqualTo(NOW);
        assertThat(stats.getStorageSizeBytes()).isPositive();
    }

    @Test
    @DisplayName("listCompanies returns each company of the view once with its latest timestamp")
    void listCompanies() {
        store.write("v1", List.of(
                record("A", NOW.minusSeconds(20), 1, 0, 0, 0),
                record("A", NOW.minusSeconds(10), 1, 0, 0, 0),
                record("B", NOW.minusSeconds(5), 0, 1, 0, 0)));
        store.registerView("v1.1", 4);
        store.write("v1.1", List.of(record("C", NOW, 0, 1, 0, 0)));

        assertThat(store.listCompanies("v1"))
                .extracting(CompanyPointer::getCompanyId, CompanyPointer::getLatestTimestamp)
                .containsExactly(
                        tuple("A", NOW.minusSeconds(10)),
                        tuple("B", NOW.minusSeconds(5)));
    }

    @Test
    @DisplayName("registerView is idempotent for the same dimensionality only")
    void registerView() {
        FeatureView created = store.registerView("v2", 4);

        assertThat(store.registerView("v2", 4).getCreatedAt()).isEqualTo(created.getCreatedAt());
        assertThatThrownBy(() -> store.registerView("v2", 16)).isInstanceOf(ConflictException.class);

        WriteResult result = store.write("v2", List.of(record("A", NOW, 1, 0, 0)));
        assertThat(result.getRejected()).singleElement()
                .satisfies(r -> assertThat(r.getReason()).isEqualTo(RejectionReason.DIMENSION_MISMATCH));
    }

    @Test
    @DisplayName("a view cannot be registered with a dimensionality the active model does not use")
    void registerViewFollowsActiveModel() {
        assertThatThrownBy(() -> store.registerView("v2", 8))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("active model v1.0.0");
        assertThat(store.findView("v2")).isEmpty();
    }

    @Test
    @DisplayName("writes are checked against the active model even when the view says otherwise")
    void writeFollowsActiveModel() {
        store.registerView("v1", 4);
        when(modelRegistry.getActive()).thenReturn(Optional.of(ModelVersion.builder()
                .versionId("v2.0.0").embeddingDim(8).status(ModelStatus.ACTIVE).build()));

        WriteResult result = store.write("v1", List.of(
                record("A", NOW, 1, 0, 0, 0),
                record("B", NOW, 1, 0, 0, 0, 0, 0, 0, 0)));

        assertThat(result.getAcceptedCount()).isZero();
        assertThat(result.getRejected())
                .extracting(RejectedRecord::getReason)
                .containsExactly(RejectionReason.DIMENSION_MISMATCH, RejectionReason.DIMENSION_MISMATCH);
        assertThat(result.getRejected().get(0).getMessage()).contains("active model v2.0.0 expects 8");
        assertThat(store.readLatest("v1", List.of("A", "B"))).isEmpty();
    }

    @Test
    @DisplayName("an explicit embedding dimension override takes the place of the model check")
    void overrideSkipsModelCheck() {
        LmdbFeatureStore overridden = new LmdbFeatureStore(lmdb, modelRegistry,
                new FeatureStoreMetrics(new SimpleMeterRegistry()), Clock.fixed(NOW, ZoneOffset.UTC), 2);

        WriteResult result = overridden.write("v2", List.of(record("A", NOW, 1, 0)));

        assertThat(result.getAcceptedCount()).isEqualTo(1);
        assertThat(overridden.findView("v2")).map(FeatureView::getEmbeddingDim).contains(2);
        assertThat(overridden.registerView("v3", 8).getEmbeddingDim()).isEqualTo(8);
    }

    @Test
    @DisplayName("records survive a reopen of the environment")
    void durableAcrossReopen() throws Exception {
        store.write("v1", List.of(record("A", NOW.minusSeconds(10), 1, 0, 0, 0)));
        lmdb.close();

        lmdb = new LmdbEnvironment(dir.toString(), 16L * 1024 * 1024, 0);
        lmdb.init();
        store = new LmdbFeatureStore(lmdb, modelRegistry,
                new FeatureStoreMetrics(new SimpleMeterRegistry()), Clock.fixed(NOW, ZoneOffset.UTC), 0);
        store.loadLastWrite();

        assertThat(store.readLatest("v1", List.of("A"))).containsKey("A");
        assertThat(store.lastWriteTime()).contains(NOW);
        WriteResult replay = store.write("v1", List.of(record("A", NOW.minusSeconds(10), 1, 0, 0, 0)));
        assertThat(replay.getRejected()).hasSize(1);
    }

    @Test
    @DisplayName("a closed environment is reported as unreadable")
    void closedEnvironment() {
        assertThat(store.isReadable()).isTrue();
        lmdb.close();
        assertThat(store.isReadable()).isFalse();
    }

    @Test
    @DisplayName("readers see each concurrent batch entirely or not at all")
    void concurrentBatchesAreAtomic() throws Exception {
        List<String> companies = List.of("A", "B", "C");
        Instant base = NOW.minusSeconds(10_000);
        int batches = 200;
        store.write("v1", companies.stream().map(id -> record(id, base, 1, 0, 0, 0)).toList());

        ExecutorService pool = Executors.newFixedThreadPool(4);
        AtomicBoolean writing = new AtomicBoolean(true);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        CountDownLatch start = new CountDownLatch(1);
        try {
            pool.submit(() -> {
                try {
                    start.await();
                    for (int i = 1; i <= batches; i++) {
                        Instant ts = base.plusSeconds(i);
                        WriteResult result = store.write("v1",
                                companies.stream().map(id -> record(id, ts, 1, 0, 0, 0)).toList());
                        assertThat(result.getAcceptedCount()).isEqualTo(companies.size());
                    }
                } catch (Throwable t) {
                    failure.compareAndSet(null, t);
                } finally {
                    writing.set(false);
                }
                return null;
            });
            for (int r = 0; r < 3; r++) {
                int seed = r;
                pool.submit(() -> {
                    try {
                        start.await();
                        int round = seed;
                        while (writing.get() && failure.get() == null) {
                            Map<String, FeatureRecord> latest = store.readLatest("v1", companies);
                            assertThat(latest).containsOnlyKeys(companies);
                            assertThat(latest.values()).extracting(FeatureRecord::getTimestamp)
                                    .containsOnly(latest.get("A").getTimestamp());

                            Instant end = base.plusSeconds(round++ % batches);
                            Map<String, List<Instant>> history = store.readHistorical("v1", companies, base, end)
                                    .stream()
                                    .collect(Collectors.groupingBy(FeatureRecord::getCompanyId,
                                            Collectors.mapping(FeatureRecord::getTimestamp, Collectors.toList())));
                            assertThat(history).containsOnlyKeys(companies);
                            assertThat(history.values()).allSatisfy(ts -> {
                                assertThat(ts).allSatisfy(t -> assertThat(t).isBeforeOrEqualTo(end));
                                assertThat(ts).isEqualTo(history.get("A"));
                            });
                        }
                    } catch (Throwable t) {
                        failure.compareAndSet(null, t);
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(failure.get()).isNull();
        assertThat(store.readLatest("v1", companies).values()).extracting(FeatureRecord::getTimestamp)
                .containsOnly(base.plusSeconds(batches));
    }
}
