package com.synapse.x.dto;

import com.synapse.x.dto.enums.ModelStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class ModelVersion {
    String versionId;
    int embeddingDim;
    ModelStatus status;
    Instant registeredAt;
    Instant activatedAt;
}
