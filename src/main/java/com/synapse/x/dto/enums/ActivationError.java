package com.synapse.x.dto.enums;

public enum ActivationError {
    NOT_FOUND,
    ALREADY_ACTIVE,
    RETIRED,
    DIMENSION_MISMATCH
}
