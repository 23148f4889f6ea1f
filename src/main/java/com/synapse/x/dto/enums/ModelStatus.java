package com.synapse.x.dto.enums;

public enum ModelStatus {
    STAGED,
    ACTIVE,
    RETIRED
}
