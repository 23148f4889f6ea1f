package com.synapse.x.dto;

import com.synapse.x.validation.ValidFeatureView;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RecommendRequest {
    @NotBlank
    private String companyId;
    @ValidFeatureView
    private String featureView;
    private Integer topK;
    @Valid
    private RecommendFilters filters;
    @Positive
    private Long timeoutMs;
}
