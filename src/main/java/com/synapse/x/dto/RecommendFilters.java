package com.synapse.x.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendFilters {
    @PositiveOrZero
    private Double minFunding;
    @PositiveOrZero
    private Double maxFunding;
    @PositiveOrZero
    private Integer minEmployees;
    @PositiveOrZero
    private Integer maxEmployees;
    private Double minGrowthRate;
    @DecimalMin("-1.0") @DecimalMax("1.0")
    private Double minMarketSentiment;
    @DecimalMin("0.0") @DecimalMax("1.0")
    private Double minScore;
    private List<String> excludeIds;
    private List<String> candidateIds;
}
