package com.synapse.x.dto.enums;

public enum DegradedReason {
    STORE_UNAVAILABLE,
    STALE_QUERY_FEATURES,
    STALE_CANDIDATE_FEATURES,
    DEADLINE_EXCEEDED,
    NO_ACTIVE_MODEL
}
