package com.synapse.x.controller;

import com.synapse.x.dto.BatchRecommendRequest;
import com.synapse.x.dto.BatchRecommendResponse;
import com.synapse.x.dto.ExplainResponse;
import com.synapse.x.dto.RecommendRequest;
import com.synapse.x.dto.RecommendResponse;
import com.synapse.x.service.RankingEngine;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/recommendations")
@RequiredArgsConstructor
public class RecommendationController {

    private final RankingEngine rankingEngine;

    @Operation(summary = "Rank partner candidates for one company")
    @PostMapping
    public ResponseEntity<RecommendResponse> recommend(@Valid @RequestBody RecommendRequest request) {
        return ResponseEntity.ok(rankingEngine.recommend(request));
    }

    @Operation(summary = "Rank partner candidates for several companies")
    @PostMapping("/batch")
    public ResponseEntity<BatchRecommendResponse> batchRecommend(@Valid @RequestBody BatchRecommendRequest request) {
        return ResponseEntity.ok(rankingEngine.batchRecommend(request));
    }

    @Operation(summary = "Explain the compatibility score of one candidate")
    @GetMapping("/{companyId}/explain/{candidateId}")
    public ResponseEntity<ExplainResponse> explain(@PathVariable String companyId,
                                                   @PathVariable String candidateId,
                                                   @RequestParam(name = "top_features", required = false) Integer topFeatures,
                                                   @RequestParam(name = "feature_view", required = false) String featureView) {
        return ResponseEntity.ok(rankingEngine.explain(companyId, candidateId, topFeatures, featureView));
    }
}
