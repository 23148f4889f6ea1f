package com.synapse.x.service;

import com.synapse.x.dto.FeatureView;
import com.synapse.x.dto.ModelVersion;
import com.synapse.x.dto.enums.ActivationError;
import com.synapse.x.dto.enums.ModelStatus;
import com.synapse.x.exceptions.BadRequestException;
import com.synapse.x.exceptions.ConflictException;
import com.synapse.x.exceptions.ModelActivationException;
import com.synapse.x.exceptions.StoreUnavailableException;
import com.synapse.x.metrics.ModelRegistryMetrics;
import com.synapse.x.processors.LmdbEnvironment;
import com.synapse.x.utils.store.StoreCodec;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.lmdbjava.CursorIterable;
import org.lmdbjava.KeyRange;
import org.lmdbjava.LmdbException;
import org.lmdbjava.Txn;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Model registry persisted in the {@code models} database.
 * <p>
 * The active version lives in an {@link AtomicReference} so the ranking path reads it without
 * locking. Activation checks every populated feature view inside the LMDB write transaction,
 * which serializes it with feature writes: a write that creates a view either commits before
 * the activation check sees it, or starts after the new version is visible.
 * </p>
 */
@Slf4j
@Service
public class ModelRegistryImpl implements ModelRegistry {

    private final LmdbEnvironment lmdb;
    private final ModelRegistryMetrics metrics;
    private final Clock clock;
    private final String bootstrapVersion;
    private final int bootstrapEmbeddingDim;
    private final AtomicReference<ModelVersion> active = new AtomicReference<>();

    public ModelRegistryImpl(LmdbEnvironment lmdb,
                             ModelRegistryMetrics metrics,
                             Clock clock,
                             @Value("${synapse.model.bootstrap-version:v1.0.0}") String bootstrapVersion,
                             @Value("${synapse.model.bootstrap-embedding-dim:128}") int bootstrapEmbeddingDim) {
        this.lmdb = lmdb;
        this.metrics = metrics;
        this.clock = clock;
        this.bootstrapVersion = bootstrapVersion;
        this.bootstrapEmbeddingDim = bootstrapEmbeddingDim;
    }

    @PostConstruct
    public void init() {
        List<ModelVersion> versions = list();
        versions.stream()
                .filter(v -> v.getStatus() == ModelStatus.ACTIVE)
                .findFirst()
                .ifPresent(active::set);

        if (versions.isEmpty() && StringUtils.isNotBlank(bootstrapVersion)) {
            log.info("Model registry empty, bootstrapping version={} embedding_dim={}", bootstrapVersion, bootstrapEmbeddingDim);
            register(bootstrapVersion, bootstrapEmbeddingDim);
            activate(bootstrapVersion);
        }
        log.info("Model registry loaded: {} versions, active={}", list().size(),
                getActive().map(ModelVersion::getVersionId).orElse("none"));
    }

    @Override
    public ModelVersion register(String versionId, int embeddingDim) {
        if (StringUtils.isBlank(versionId) || versionId.length() > 128) {
            throw new BadRequestException("version_id must be 1-128 characters");
        }
        if (embeddingDim <= 0) {
            throw new BadRequestException("embedding_dim must be positive");
        }
        try (Txn<ByteBuffer> txn = lmdb.txnWrite()) {
            if (lmdb.modelsDbi().get(txn, StoreCodec.nameKey(versionId)) != null) {
                throw new ConflictException("model version already registered: " + versionId);
            }
            ModelVersion staged = ModelVersion.builder()
                    .versionId(versionId)
                    .embeddingDim(embeddingDim)
                    .status(ModelStatus.STAGED)
                    .registeredAt(clock.instant())
                    .build();
            lmdb.modelsDbi().put(txn, StoreCodec.nameKey(versionId), StoreCodec.encodeModel(staged));
            txn.commit();
            metrics.recordRegistration();
            log.info("Registered model version={} embedding_dim={}", versionId, embeddingDim);
            return staged;
        } catch (LmdbException e) {
            throw new StoreUnavailableException("Model registration failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<ModelVersion> getActive() {
        return Optional.ofNullable(active.get());
    }

    @Override
    public ModelVersion activate(String versionId) {
        ModelVersion previous = null;
        boolean swapped = false;

        try (Txn<ByteBuffer> txn = lmdb.txnWrite()) {
            previous = active.get();
            ByteBuffer raw = StringUtils.isBlank(versionId) ? null : lmdb.modelsDbi().get(txn, StoreCodec.nameKey(versionId));
            if (raw == null) {
                throw rejected(ActivationError.NOT_FOUND, "unknown model version: " + versionId);
            }
            ModelVersion candidate = StoreCodec.decodeModel(versionId, raw);
            if (candidate.getStatus() == ModelStatus.ACTIVE) {
                throw rejected(ActivationError.ALREADY_ACTIVE, versionId + " is already active");
            }
            if (candidate.getStatus() == ModelStatus.RETIRED) {
                throw rejected(ActivationError.RETIRED, versionId + " was retired and cannot be reactivated");
            }

            for (FeatureView view : populatedViews(txn)) {
                if (view.getEmbeddingDim() != candidate.getEmbeddingDim()) {
                    throw rejected(ActivationError.DIMENSION_MISMATCH,
                            "feature_view %s holds %d-dimensional vectors, %s expects %d".formatted(
                                    view.getName(), view.getEmbeddingDim(), versionId, candidate.getEmbeddingDim()));
                }
            }

            Instant now = clock.instant();
            ModelVersion activated = candidate.toBuilder().status(ModelStatus.ACTIVE).activatedAt(now).build();
            lmdb.modelsDbi().put(txn, StoreCodec.nameKey(versionId), StoreCodec.encodeModel(activated));
            if (previous != null) {
                ModelVersion retired = previous.toBuilder().status(ModelStatus.RETIRED).build();
                lmdb.modelsDbi().put(txn, StoreCodec.nameKey(previous.getVersionId()), StoreCodec.encodeModel(retired));
            }

            // visible before commit so that no write queued behind this transaction sees the old version
            active.set(activated);
            swapped = true;
            txn.commit();

            metrics.recordActivation(versionId);
            log.info("Activated model version={} (previous={})", versionId,
                    previous == null ? "none" : previous.getVersionId());
            return activated;
        } catch (LmdbException e) {
            if (swapped) active.set(previous);
            throw new StoreUnavailableException("Model activation failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (swapped) active.set(previous);
            throw e;
        }
    }

    private ModelActivationException rejected(ActivationError error, String message) {
        metrics.recordActivationRejected(error);
        log.warn("Model activation rejected: {} ({})", error, message);
        return new ModelActivationException(error, message);
    }

    private List<FeatureView> populatedViews(Txn<ByteBuffer> txn) {
        List<FeatureView> out = new ArrayList<>();
        try (CursorIterable<ByteBuffer> it = lmdb.viewsDbi().iterate(txn, KeyRange.all())) {
            for (CursorIterable.KeyVal<ByteBuffer> kv : it) {
                FeatureView view = StoreCodec.decodeView(StoreCodec.decodeName(kv.key()), kv.val());
                if (view.getRecordCount() > 0) out.add(view);
            }
        }
        return out;
    }

    @Override
    public List<ModelVersion> list() {
        try (Txn<ByteBuffer> txn = lmdb.txnRead();
             CursorIterable<ByteBuffer> it = lmdb.modelsDbi().iterate(txn, KeyRange.all())) {
            List<ModelVersion> out = new ArrayList<>();
            for (CursorIterable.KeyVal<ByteBuffer> kv : it) {
                out.add(StoreCodec.decodeModel(StoreCodec.decodeName(kv.key()), kv.val()));
            }
            return out;
        } catch (LmdbException e) {
            throw new StoreUnavailableException("Model listing failed: " + e.getMessage(), e);
        }
    }
}
