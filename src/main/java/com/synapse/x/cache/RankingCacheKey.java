package com.synapse.x.cache;

import com.synapse.x.dto.RecommendFilters;
import lombok.Value;

/**
 * Identity of a recommendation result. The view generation changes on every write to the
 * view, so a key built after a write never matches an entry cached before it.
 */
@Value
public class RankingCacheKey {
    String view;
    String companyId;
    int topK;
    RecommendFilters filters;
    String modelVersion;
    long viewGeneration;
}
