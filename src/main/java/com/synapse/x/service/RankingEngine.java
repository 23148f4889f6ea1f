package com.synapse.x.service;

import com.synapse.x.dto.BatchRecommendRequest;
import com.synapse.x.dto.BatchRecommendResponse;
import com.synapse.x.dto.ExplainResponse;
import com.synapse.x.dto.RecommendRequest;
import com.synapse.x.dto.RecommendResponse;

public interface RankingEngine {

    /**
     * Top-k partner candidates for the query company, best first, ties broken by candidate id.
     */
    RecommendResponse recommend(RecommendRequest request);

    BatchRecommendResponse batchRecommend(BatchRecommendRequest request);

    ExplainResponse explain(String queryCompanyId, String candidateId, Integer topFeatures, String featureView);
}
