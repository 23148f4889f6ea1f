package com.synapse.x.processors;

import com.synapse.x.config.RankingProperties;
import com.synapse.x.dto.CandidateListing;
import com.synapse.x.dto.CandidatePool;
import com.synapse.x.dto.CompanyPointer;
import com.synapse.x.dto.RecommendFilters;
import com.synapse.x.dto.RequestDeadline;
import com.synapse.x.service.FeatureLookupService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves the candidates of a recommendation: either the caller's explicit list or every
 * company of the view, minus the query company and the caller's exclusions. Listed pools above
 * the cap keep the most recently updated companies, ties broken by id. Explicit lists above the
 * cap keep the lowest ids.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CandidatePoolBuilder {

    private static final Comparator<CompanyPointer> MOST_RECENT_FIRST =
            Comparator.comparing(CompanyPointer::getLatestTimestamp, Comparator.reverseOrder())
                    .thenComparing(CompanyPointer::getCompanyId);

    private final FeatureLookupService lookupService;
    private final RankingProperties properties;

    public CandidatePool build(String view, String queryCompanyId, RecommendFilters filters, RequestDeadline deadline) {
        Set<String> excluded = new HashSet<>();
        excluded.add(queryCompanyId);
        if (filters != null && filters.getExcludeIds() != null) {
            excluded.addAll(filters.getExcludeIds());
        }

        if (filters != null && filters.getCandidateIds() != null && !filters.getCandidateIds().isEmpty()) {
            return explicitPool(filters.getCandidateIds(), excluded);
        }

        CandidateListing listing = lookupService.listCandidates(view, deadline);
        List<CompanyPointer> eligible = listing.getCompanies().stream()
                .filter(p -> !excluded.contains(p.getCompanyId()))
                .toList();

        boolean truncated = eligible.size() > properties.getMaxPoolSize();
        List<String> ids = eligible.stream()
                .sorted(truncated ? MOST_RECENT_FIRST : Comparator.comparing(CompanyPointer::getCompanyId))
                .limit(properties.getMaxPoolSize())
                .map(CompanyPointer::getCompanyId)
                .toList();
        if (truncated) {
            log.info("Candidate pool for view={} truncated from {} to {} most recent companies",
                    view, eligible.size(), ids.size());
        }

        return CandidatePool.builder()
                .candidateIds(ids)
                .totalSize(eligible.size())
                .truncated(truncated)
                .fromFallback(listing.isFromFallback())
                .stalenessSeconds(listing.getStalenessSeconds())
                .build();
    }

    private CandidatePool explicitPool(List<String> candidateIds, Set<String> excluded) {
        LinkedHashSet<String> ids = new LinkedHashSet<>(candidateIds);
        ids.removeAll(excluded);
        boolean truncated = ids.size() > properties.getMaxPoolSize();
        List<String> kept = truncated
                ? ids.stream().sorted().limit(properties.getMaxPoolSize()).toList()
                : List.copyOf(ids);
        if (truncated) {
            log.info("Explicit candidate list narrowed from {} to the first {} ids", ids.size(), kept.size());
        }
        return CandidatePool.builder()
                .candidateIds(kept)
                .totalSize(ids.size())
                .truncated(truncated)
                .build();
    }
}
