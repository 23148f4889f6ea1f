package com.synapse.x.processors;

import com.synapse.x.dto.CompanyPointer;
import com.synapse.x.dto.FeatureRecord;
import com.synapse.x.dto.FeatureStats;
import com.synapse.x.dto.FeatureView;
import com.synapse.x.dto.ModelVersion;
import com.synapse.x.dto.RejectedRecord;
import com.synapse.x.dto.WriteResult;
import com.synapse.x.dto.enums.RejectionReason;
import com.synapse.x.exceptions.BadRequestException;
import com.synapse.x.exceptions.ConflictException;
import com.synapse.x.exceptions.StoreUnavailableException;
import com.synapse.x.metrics.FeatureStoreMetrics;
import com.synapse.x.service.FeatureStore;
import com.synapse.x.service.ModelRegistry;
import com.synapse.x.utils.store.StoreCodec;
import com.synapse.x.validation.FeatureRecordValidator;
import com.synapse.x.validation.FeatureViewValidator;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.lmdbjava.CursorIterable;
import org.lmdbjava.KeyRange;
import org.lmdbjava.LmdbException;
import org.lmdbjava.Txn;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * {@link FeatureStore} on top of LMDB.
 * <p>
 * Each write call runs in one write transaction, so its accepted records become visible
 * together. The timestamp comparison against the {@code latest} entry happens inside that
 * transaction, which makes it the per-key compare-and-set. Reads run in read transactions and
 * therefore always see one committed snapshot, also while a writer is active.
 * </p>
 */
@Slf4j
@Component
public class LmdbFeatureStore implements FeatureStore {

    private final LmdbEnvironment lmdb;
    private final ModelRegistry modelRegistry;
    private final FeatureStoreMetrics metrics;
    private final Clock clock;
    private final int embeddingDimOverride;
    private final AtomicReference<Instant> lastWrite = new AtomicReference<>();

    public LmdbFeatureStore(LmdbEnvironment lmdb,
                            ModelRegistry modelRegistry,
                            FeatureStoreMetrics metrics,
                            Clock clock,
                            @Value("${synapse.store.embedding-dim-override:0}") int embeddingDimOverride) {
        this.lmdb = lmdb;
        this.modelRegistry = modelRegistry;
        this.metrics = metrics;
        this.clock = clock;
        this.embeddingDimOverride = embeddingDimOverride;
    }

    @PostConstruct
    public void loadLastWrite() {
        listViews().stream()
                .map(FeatureView::getLastUpdated)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .ifPresent(lastWrite::set);
        log.info("Feature store ready: lastWrite={}", lastWrite.get());
    }

    @Override
    public WriteResult write(String view, List<FeatureRecord> records) {
        FeatureViewValidator.requireValid(view);
        WriteResult.WriteResultBuilder result = WriteResult.builder().featureView(view);
        if (records == null || records.isEmpty()) {
            return result.acceptedCount(0).build();
        }

        metrics.recordWriteBatch(records.size());
        Timer.Sample sample = metrics.startTimer();
        Instant now = clock.instant();
        int accepted = 0;

        try (Txn<ByteBuffer> txn = lmdb.txnWrite()) {
            Optional<FeatureView> existing = loadView(txn, view);
            FeatureView catalog = existing.orElseGet(() -> implicitView(view, now));
            Optional<ModelVersion> governing = governingModel();
            Map<String, Instant> batchLatest = new HashMap<>();
            long companies = catalog.getCompanyCount();
            long bytes = catalog.getStorageBytes();

            for (FeatureRecord raw : records) {
                if (raw == null) continue;
                FeatureRecord rec = raw.getTimestamp() == null ? raw.toBuilder().timestamp(now).build() : raw;

                Optional<RejectedRecord> invalid = FeatureRecordValidator.validate(rec, catalog.getEmbeddingDim());
                if (invalid.isPresent()) {
                    reject(result, invalid.get(), view);
                    continue;
                }
                if (governing.isPresent() && rec.hasCultureVector()
                        && rec.getCultureVector().size() != governing.get().getEmbeddingDim()) {
                    reject(result, new RejectedRecord(rec, RejectionReason.DIMENSION_MISMATCH,
                            "culture_vector has %d dimensions, active model %s expects %d".formatted(
                                    rec.getCultureVector().size(), governing.get().getVersionId(),
                                    governing.get().getEmbeddingDim())), view);
                    continue;
                }

                String companyId = rec.getCompanyId();
                Instant previous = batchLatest.containsKey(companyId)
                        ? batchLatest.get(companyId)
                        : latestTimestamp(txn, view, companyId);
                if (previous != null && !rec.getTimestamp().isAfter(previous)) {
                    reject(result, new RejectedRecord(rec, RejectionReason.OUT_OF_ORDER,
                            "timestamp %s is not after stored %s".formatted(rec.getTimestamp(), previous)), view);
                    continue;
                }
                if (previous == null) companies++;

                ByteBuffer key = StoreCodec.recordKey(view, companyId, rec.getTimestamp());
                ByteBuffer val = StoreCodec.encodeRecord(rec);
                bytes += key.remaining() + val.remaining();
                lmdb.recordsDbi().put(txn, key, val);
                lmdb.latestDbi().put(txn, StoreCodec.latestKey(view, companyId), StoreCodec.encodeLatest(rec));

                batchLatest.put(companyId, rec.getTimestamp());
                result.acceptedCompanyId(companyId);
                accepted++;
            }

            if (accepted > 0 || existing.isEmpty()) {
                FeatureView updated = catalog.toBuilder()
                        .companyCount(companies)
                        .recordCount(catalog.getRecordCount() + accepted)
                        .storageBytes(bytes)
                        .lastUpdated(accepted > 0 ? now : catalog.getLastUpdated())
                        .build();
                lmdb.viewsDbi().put(txn, StoreCodec.nameKey(view), StoreCodec.encodeView(updated));
                txn.commit();
            }
        } catch (LmdbException e) {
            metrics.recordStoreFailure("write");
            log.error("Feature write failed for view={}", view, e);
            throw new StoreUnavailableException("Feature write failed: " + e.getMessage(), e);
        } finally {
            metrics.stopTimer(sample, "write");
        }

        if (accepted > 0) {
            lastWrite.accumulateAndGet(now, (a, b) -> a == null || b.isAfter(a) ? b : a);
            metrics.recordAccepted(view, accepted);
        }
        WriteResult written = result.acceptedCount(accepted).build();
        log.debug("Write to view={} accepted={} rejected={}", view, accepted, written.getRejected().size());
        return written;
    }

    private void reject(WriteResult.WriteResultBuilder result, RejectedRecord rejected, String view) {
        log.warn("Rejected record company_id={} view={} reason={}: {}",
                rejected.getRecord().getCompanyId(), view, rejected.getReason(), rejected.getMessage());
        metrics.recordRejected(rejected.getReason());
        result.rejected(rejected);
    }

    /**
     * Catalog entry for a view created by its first write. Runs inside the write transaction, so
     * the active model read here cannot change until commit.
     */
    private FeatureView implicitView(String view, Instant now) {
        int dim = embeddingDimOverride > 0
                ? embeddingDimOverride
                : modelRegistry.getActive()
                        .map(ModelVersion::getEmbeddingDim)
                        .orElseThrow(() -> new BadRequestException("unknown feature_view: " + view));
        log.info("Creating feature view={} with embedding_dim={}", view, dim);
        return FeatureView.builder().name(view).embeddingDim(dim).createdAt(now).build();
    }

    /**
     * The active model whose dimensionality every stored culture vector must match. Empty when
     * no model is active or when an explicit embedding dimension override is configured.
     * Called inside write transactions, which serialize with activation.
     */
    private Optional<ModelVersion> governingModel() {
        return embeddingDimOverride > 0 ? Optional.empty() : modelRegistry.getActive();
    }

    private Instant latestTimestamp(Txn<ByteBuffer> txn, String view, String companyId) {
        ByteBuffer v = lmdb.latestDbi().get(txn, StoreCodec.latestKey(view, companyId));
        return v == null ? null : StoreCodec.latestTimestamp(v);
    }

    @Override
    public Map<String, FeatureRecord> readLatest(String view, Collection<String> companyIds) {
        FeatureViewValidator.requireValid(view);
        return withRead("read_latest", txn -> {
            requireView(txn, view);
            Map<String, FeatureRecord> out = new LinkedHashMap<>();
            for (String id : companyIds) {
                if (!FeatureRecordValidator.isValidCompanyId(id) || out.containsKey(id)) continue;
                ByteBuffer v = lmdb.latestDbi().get(txn, StoreCodec.latestKey(view, id));
                if (v != null) {
                    out.put(id, StoreCodec.decodeLatest(v));
                }
            }
            return out;
        });
    }

    @Override
    public List<FeatureRecord> readHistorical(String view, Collection<String> companyIds, Instant start, Instant end) {
        FeatureViewValidator.requireValid(view);
        if (start == null || end == null) {
            throw new BadRequestException("start_time and end_time are required");
        }
        if (start.isAfter(end)) {
            throw new BadRequestException("start_time must not be after end_time");
        }
        List<String> ids = companyIds.stream()
                .filter(FeatureRecordValidator::isValidCompanyId)
                .distinct()
                .sorted()
                .toList();
        Instant from = start.isBefore(Instant.EPOCH) ? Instant.EPOCH : start;

        return withRead("read_historical", txn -> {
            requireView(txn, view);
            List<FeatureRecord> out = new ArrayList<>();
            if (end.isBefore(Instant.EPOCH)) return out;

            for (String id : ids) {
                byte[] prefix = StoreCodec.companyPrefix(view, id);
                try (CursorIterable<ByteBuffer> it = lmdb.recordsDbi()
                        .iterate(txn, KeyRange.atLeast(StoreCodec.scanStartKey(view, id, from)))) {
                    for (CursorIterable.KeyVal<ByteBuffer> kv : it) {
                        ByteBuffer key = kv.key();
                        if (!StoreCodec.startsWith(key, prefix)
                                || key.remaining() != prefix.length + StoreCodec.TIMESTAMP_BYTES) {
                            break;
                        }
                        if (StoreCodec.keyTimestamp(key).isAfter(end)) break;
                        out.add(StoreCodec.decodeRecord(kv.val()));
                    }
                }
            }
            return out;
        });
    }

    @Override
    public FeatureStats stats(String view) {
        FeatureViewValidator.requireValid(view);
        FeatureView v = withRead("stats", txn -> requireView(txn, view));
        return FeatureStats.builder()
                .featureView(view)
                .totalCompanies(v.getCompanyCount())
                .featureCount(v.getRecordCount())
                .lastUpdated(v.getLastUpdated())
                .storageSizeBytes(v.getStorageBytes())
                .embeddingDim(v.getEmbeddingDim())
                .build();
    }

    @Override
    public List<CompanyPointer> listCompanies(String view) {
        FeatureViewValidator.requireValid(view);
        byte[] prefix = (view + '\0').getBytes(StandardCharsets.UTF_8);
        return withRead("list_companies", txn -> {
            requireView(txn, view);
            List<CompanyPointer> out = new ArrayList<>();
            try (CursorIterable<ByteBuffer> it = lmdb.latestDbi()
                    .iterate(txn, KeyRange.atLeast(StoreCodec.viewPrefix(view)))) {
                for (CursorIterable.KeyVal<ByteBuffer> kv : it) {
                    ByteBuffer key = kv.key();
                    if (!StoreCodec.startsWith(key, prefix)) break;
                    out.add(new CompanyPointer(StoreCodec.keySuffix(key, prefix.length),
                            StoreCodec.latestTimestamp(kv.val())));
                }
            }
            return out;
        });
    }

    @Override
    public FeatureView registerView(String view, int embeddingDim) {
        FeatureViewValidator.requireValid(view);
        if (embeddingDim <= 0) {
            throw new BadRequestException("embedding_dim must be positive");
        }
        try (Txn<ByteBuffer> txn = lmdb.txnWrite()) {
            Optional<FeatureView> existing = loadView(txn, view);
            if (existing.isPresent()) {
                if (existing.get().getEmbeddingDim() != embeddingDim) {
                    throw new ConflictException("feature_view %s already registered with embedding_dim %d"
                            .formatted(view, existing.get().getEmbeddingDim()));
                }
                return existing.get();
            }
            Optional<ModelVersion> governing = governingModel();
            if (governing.isPresent() && governing.get().getEmbeddingDim() != embeddingDim) {
                throw new BadRequestException("feature_view %s embedding_dim %d disagrees with active model %s (%d)"
                        .formatted(view, embeddingDim, governing.get().getVersionId(), governing.get().getEmbeddingDim()));
            }
            FeatureView created = FeatureView.builder()
                    .name(view)
                    .embeddingDim(embeddingDim)
                    .createdAt(clock.instant())
                    .build();
            lmdb.viewsDbi().put(txn, StoreCodec.nameKey(view), StoreCodec.encodeView(created));
            txn.commit();
            log.info("Registered feature view={} embedding_dim={}", view, embeddingDim);
            return created;
        } catch (LmdbException e) {
            metrics.recordStoreFailure("register_view");
            throw new StoreUnavailableException("Feature view registration failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<FeatureView> findView(String view) {
        if (!FeatureViewValidator.isValidName(view)) return Optional.empty();
        return withRead("find_view", txn -> loadView(txn, view));
    }

    @Override
    public List<FeatureView> listViews() {
        return withRead("list_views", txn -> {
            List<FeatureView> out = new ArrayList<>();
            try (CursorIterable<ByteBuffer> it = lmdb.viewsDbi().iterate(txn, KeyRange.all())) {
                for (CursorIterable.KeyVal<ByteBuffer> kv : it) {
                    out.add(StoreCodec.decodeView(StoreCodec.decodeName(kv.key()), kv.val()));
                }
            }
            return out;
        });
    }

    @Override
    public Optional<Instant> lastWriteTime() {
        return Optional.ofNullable(lastWrite.get());
    }

    @Override
    public boolean isReadable() {
        try (Txn<ByteBuffer> txn = lmdb.txnRead()) {
            lmdb.viewsDbi().stat(txn);
            return true;
        } catch (RuntimeException e) {
            log.warn("Store readability check failed: {}", e.getMessage());
            return false;
        }
    }

    private Optional<FeatureView> loadView(Txn<ByteBuffer> txn, String view) {
        ByteBuffer v = lmdb.viewsDbi().get(txn, StoreCodec.nameKey(view));
        return v == null ? Optional.empty() : Optional.of(StoreCodec.decodeView(view, v));
    }

    private FeatureView requireView(Txn<ByteBuffer> txn, String view) {
        return loadView(txn, view).orElseThrow(() -> new BadRequestException("unknown feature_view: " + view));
    }

    private <T> T withRead(String operation, Function<Txn<ByteBuffer>, T> body) {
        long start = System.nanoTime();
        try (Txn<ByteBuffer> txn = lmdb.txnRead()) {
            return body.apply(txn);
        } catch (LmdbException e) {
            metrics.recordStoreFailure(operation);
            log.error("Store read {} failed", operation, e);
            throw new StoreUnavailableException("Store read failed: " + e.getMessage(), e);
        } finally {
            metrics.recordDuration(operation, System.nanoTime() - start);
        }
    }
}
