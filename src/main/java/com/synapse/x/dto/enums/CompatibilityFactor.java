package com.synapse.x.dto.enums;

/**
 * Scored dimensions of a partner pair. Configuration keys are the lower-case names,
 * e.g. {@code synapse.ranking.weights.market_sentiment}.
 */
public enum CompatibilityFactor {
    CULTURE,
    FUNDING,
    COMPANY_SIZE,
    GROWTH,
    MARKET_SENTIMENT,
    REVENUE_GROWTH,
    USER_GROWTH,
    USER_OVERLAP,
    TIMING
}
