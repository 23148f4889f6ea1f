package com.synapse.x.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Business traction signals of a company at the record's point in time.
 * {@code revenueGrowth} and {@code userGrowth} are optional and may be null.
 */
@Value
@Builder(toBuilder = true)
public class TractionMetrics {
    double fundingAmount;
    int employeeCount;
    double growthRate;
    double marketSentiment;
    Double revenueGrowth;
    Double userGrowth;
}
