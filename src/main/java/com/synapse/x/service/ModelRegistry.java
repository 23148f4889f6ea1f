package com.synapse.x.service;

import com.synapse.x.dto.ModelVersion;

import java.util.List;
import java.util.Optional;

public interface ModelRegistry {

    ModelVersion register(String versionId, int embeddingDim);

    Optional<ModelVersion> getActive();

    /**
     * Makes {@code versionId} the active version. The previously active version is retired.
     *
     * @throws com.synapse.x.exceptions.ModelActivationException when the transition is not
     *         allowed; the active version is left unchanged
     */
    ModelVersion activate(String versionId);

    List<ModelVersion> list();
}
