package com.synapse.x.dto.enums;

public enum RejectionReason {
    INVALID_COMPANY_ID,
    DIMENSION_MISMATCH,
    OUT_OF_RANGE,
    OUT_OF_ORDER
}
