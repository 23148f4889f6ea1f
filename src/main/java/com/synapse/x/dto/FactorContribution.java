package com.synapse.x.dto;

import com.synapse.x.dto.enums.CompatibilityFactor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FactorContribution {
    CompatibilityFactor factor;
    double value;
    double weight;
    double contribution;
}
