package com.synapse.x.dto;

import com.synapse.x.validation.ValidFeatureView;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchRecommendRequest {
    @NotEmpty
    private List<String> companyIds;
    @ValidFeatureView
    private String featureView;
    private Integer topK;
    @Valid
    private RecommendFilters filters;
}
