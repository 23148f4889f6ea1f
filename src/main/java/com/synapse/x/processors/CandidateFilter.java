package com.synapse.x.processors;

import com.synapse.x.dto.FeatureRecord;
import com.synapse.x.dto.RecommendFilters;
import com.synapse.x.dto.TractionMetrics;
import lombok.experimental.UtilityClass;

/**
 * Traction filters applied to candidates before they are scored. A candidate without
 * traction metrics fails every traction filter that is set.
 */
@UtilityClass
public final class CandidateFilter {

    public static boolean passes(FeatureRecord candidate, RecommendFilters filters) {
        if (filters == null || !hasTractionFilter(filters)) return true;
        TractionMetrics t = candidate.getTractionMetrics();
        if (t == null) return false;

        if (filters.getMinFunding() != null && t.getFundingAmount() < filters.getMinFunding()) return false;
        if (filters.getMaxFunding() != null && t.getFundingAmount() > filters.getMaxFunding()) return false;
        if (filters.getMinEmployees() != null && t.getEmployeeCount() < filters.getMinEmployees()) return false;
        if (filters.getMaxEmployees() != null && t.getEmployeeCount() > filters.getMaxEmployees()) return false;
        if (filters.getMinGrowthRate() != null && t.getGrowthRate() < filters.getMinGrowthRate()) return false;
        return filters.getMinMarketSentiment() == null || t.getMarketSentiment() >= filters.getMinMarketSentiment();
    }

    private static boolean hasTractionFilter(RecommendFilters f) {
        return f.getMinFunding() != null || f.getMaxFunding() != null
                || f.getMinEmployees() != null || f.getMaxEmployees() != null
                || f.getMinGrowthRate() != null || f.getMinMarketSentiment() != null;
    }
}
