package com.synapse.x.service;

import com.synapse.x.cache.FeatureCache;
import com.synapse.x.cache.RankingCacheKey;
import com.synapse.x.config.RankingProperties;
import com.synapse.x.dto.BatchRecommendEntry;
import com.synapse.x.dto.BatchRecommendRequest;
import com.synapse.x.dto.BatchRecommendResponse;
import com.synapse.x.dto.CandidateFetch;
import com.synapse.x.dto.CandidatePool;
import com.synapse.x.dto.ExplainResponse;
import com.synapse.x.dto.FactorContribution;
import com.synapse.x.dto.FeatureLookup;
import com.synapse.x.dto.FeatureRecord;
import com.synapse.x.dto.ModelVersion;
import com.synapse.x.dto.RankedResult;
import com.synapse.x.dto.RecommendFilters;
import com.synapse.x.dto.RecommendRequest;
import com.synapse.x.dto.RecommendResponse;
import com.synapse.x.dto.RequestDeadline;
import com.synapse.x.dto.ScoreBreakdown;
import com.synapse.x.dto.enums.DegradedReason;
import com.synapse.x.exceptions.BadRequestException;
import com.synapse.x.exceptions.NotFoundException;
import com.synapse.x.exceptions.RequestTimeoutException;
import com.synapse.x.exceptions.StoreUnavailableException;
import com.synapse.x.exceptions.TooLargeException;
import com.synapse.x.metrics.RankingMetrics;
import com.synapse.x.processors.CandidateFeatureFetcher;
import com.synapse.x.processors.CandidateFilter;
import com.synapse.x.processors.CandidatePoolBuilder;
import com.synapse.x.validation.FeatureViewValidator;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

@Slf4j
@Service
public class RankingEngineImpl implements RankingEngine {

    private static final int DEFAULT_TOP_FEATURES = 10;

    private static final Comparator<Candidate> BEST_FIRST =
            Comparator.comparingDouble((Candidate c) -> c.breakdown().getScore()).reversed()
                    .thenComparing(Candidate::companyId);

    private final FeatureLookupService lookupService;
    private final CandidatePoolBuilder poolBuilder;
    private final CandidateFeatureFetcher featureFetcher;
    private final CompatibilityCalculator calculator;
    private final ModelRegistry modelRegistry;
    private final FeatureCache featureCache;
    private final RankingProperties properties;
    private final RankingMetrics metrics;
    private final ExecutorService batchExecutor;
    private final Clock clock;

    public RankingEngineImpl(FeatureLookupService lookupService,
                             CandidatePoolBuilder poolBuilder,
                             CandidateFeatureFetcher featureFetcher,
                             CompatibilityCalculator calculator,
                             ModelRegistry modelRegistry,
                             FeatureCache featureCache,
                             RankingProperties properties,
                             RankingMetrics metrics,
                             @Qualifier("batchRecommendExecutor") ExecutorService batchExecutor,
                             Clock clock) {
        this.lookupService = lookupService;
        this.poolBuilder = poolBuilder;
        this.featureFetcher = featureFetcher;
        this.calculator = calculator;
        this.modelRegistry = modelRegistry;
        this.featureCache = featureCache;
        this.properties = properties;
        this.metrics = metrics;
        this.batchExecutor = batchExecutor;
        this.clock = clock;
    }

    private record Candidate(String companyId, ScoreBreakdown breakdown) {}

    @Override
    public RecommendResponse recommend(RecommendRequest request) {
        long started = System.nanoTime();
        Timer.Sample sample = metrics.startTimer();
        String outcome = "error";
        try {
            RecommendResponse response = doRecommend(request, started);
            outcome = response.isDegraded() ? "degraded" : "ok";
            return response;
        } finally {
            metrics.stopTimer(sample, outcome);
        }
    }

    private RecommendResponse doRecommend(RecommendRequest request, long started) {
        String companyId = request.getCompanyId();
        if (StringUtils.isBlank(companyId)) {
            throw new BadRequestException("company_id is required");
        }
        String view = resolveView(request.getFeatureView());
        int topK = resolveTopK(request.getTopK());
        RecommendFilters filters = request.getFilters();
        validateFilters(filters);
        RequestDeadline deadline = RequestDeadline.after(resolveTimeout(request.getTimeoutMs()));

        Set<DegradedReason> reasons = EnumSet.noneOf(DegradedReason.class);
        Optional<ModelVersion> model = modelRegistry.getActive();
        String modelVersion = model.map(ModelVersion::getVersionId).orElse(null);
        if (model.isEmpty()) {
            reasons.add(DegradedReason.NO_ACTIVE_MODEL);
        }

        RankingCacheKey cacheKey = null;
        if (model.isPresent()) {
            cacheKey = new RankingCacheKey(view, companyId, topK, filters, modelVersion, featureCache.viewGeneration(view));
            Optional<RecommendResponse> cached = featureCache.getRanking(cacheKey);
            metrics.recordResultCache(cached.isPresent());
            if (cached.isPresent()) {
                return cached.get().toBuilder().latencyMs(elapsedMs(started)).build();
            }
        }

        FeatureLookup queryLookup = lookupService.lookup(view, List.of(companyId), deadline);
        FeatureRecord query = queryLookup.getRecords().get(companyId);
        if (query == null) {
            if (queryLookup.isFromFallback()) {
                throw new StoreUnavailableException("feature store unavailable and no cached features for " + companyId);
            }
            throw new NotFoundException("No feature record for company_id=" + companyId + " in feature_view=" + view);
        }
        if (!query.hasCultureVector()) {
            throw new BadRequestException("company_id=" + companyId + " has no culture_vector");
        }

        Long staleness = null;
        if (queryLookup.isFromFallback()) {
            reasons.add(DegradedReason.STORE_UNAVAILABLE);
            staleness = maxOf(staleness, queryLookup.getStalenessSeconds());
        }
        if (queryLookup.getStale().contains(companyId)) {
            reasons.add(DegradedReason.STALE_QUERY_FEATURES);
            staleness = maxOf(staleness, Duration.between(query.getTimestamp(), clock.instant()).getSeconds());
        }

        CandidatePool pool = poolBuilder.build(view, companyId, filters, deadline);
        if (pool.isFromFallback()) {
            reasons.add(DegradedReason.STORE_UNAVAILABLE);
            staleness = maxOf(staleness, pool.getStalenessSeconds());
        }

        CandidateFetch fetch = featureFetcher.fetch(view, pool.getCandidateIds(), deadline);
        if (fetch.isFromFallback()) {
            reasons.add(DegradedReason.STORE_UNAVAILABLE);
            staleness = maxOf(staleness, fetch.getStalenessSeconds());
        }
        if (fetch.isPartial()) {
            reasons.add(DegradedReason.DEADLINE_EXCEEDED);
        }

        double minScore = Math.max(properties.getMinScore(),
                filters != null && filters.getMinScore() != null ? filters.getMinScore() : 0.0);
        int dim = query.getCultureVector().size();
        int excluded = 0;
        List<Candidate> scored = new ArrayList<>();
        for (String candidateId : pool.getCandidateIds()) {
            FeatureRecord candidate = fetch.getRecords().get(candidateId);
            if (candidate == null) continue;
            if (!candidate.hasCultureVector() || candidate.getCultureVector().size() != dim) {
                excluded++;
                continue;
            }
            if (!CandidateFilter.passes(candidate, filters)) continue;

            ScoreBreakdown breakdown = calculator.evaluate(query, candidate);
            if (breakdown.getScore() < minScore) continue;
            scored.add(new Candidate(candidateId, breakdown));
        }

        if (fetch.isPartial() && scored.isEmpty()) {
            throw new RequestTimeoutException("request deadline exceeded before any candidate was scored");
        }

        scored.sort(BEST_FIRST);
        List<RankedResult> results = new ArrayList<>(Math.min(topK, scored.size()));
        int staleServed = 0;
        for (int i = 0; i < scored.size() && i < topK; i++) {
            Candidate c = scored.get(i);
            boolean stale = fetch.getStaleCandidates().contains(c.companyId());
            if (stale) {
                staleServed++;
                FeatureRecord record = fetch.getRecords().get(c.companyId());
                staleness = maxOf(staleness, Duration.between(record.getTimestamp(), clock.instant()).getSeconds());
            }
            results.add(RankedResult.builder()
                    .candidateId(c.companyId())
                    .score(c.breakdown().getScore())
                    .confidence(c.breakdown().getConfidence())
                    .rank(i + 1)
                    .stale(stale)
                    .breakdown(c.breakdown().getFactors())
                    .build());
        }
        if (staleServed > 0) {
            reasons.add(DegradedReason.STALE_CANDIDATE_FEATURES);
        }

        RecommendResponse response = RecommendResponse.builder()
                .queryCompanyId(companyId)
                .featureView(view)
                .results(results)
                .degraded(!reasons.isEmpty())
                .degradedReasons(reasons)
                .stalenessSeconds(staleness)
                .poolSizeTotal(pool.getTotalSize())
                .poolSizeUsed(pool.getCandidateIds().size())
                .poolTruncated(pool.isTruncated())
                .timedOutCandidates(fetch.getTimedOutCandidates())
                .excludedCandidates(excluded)
                .staleCandidates(staleServed)
                .partial(fetch.isPartial())
                .modelVersion(modelVersion)
                .latencyMs(elapsedMs(started))
                .build();

        metrics.recordPoolSize(pool.getCandidateIds().size());
        metrics.recordTimedOutCandidates(fetch.getTimedOutCandidates());
        metrics.recordExcludedCandidates(excluded);
        if (!results.isEmpty()) metrics.recordTopScore(results.get(0).getScore());

        if (response.isDegraded()) {
            metrics.recordDegraded(reasons);
            log.warn("Degraded recommendation company_id={} view={} reasons={} staleness_seconds={}",
                    companyId, view, reasons, staleness);
        } else if (cacheKey != null) {
            featureCache.putRanking(cacheKey, response);
        }
        log.debug("Recommendation company_id={} view={} pool={} scored={} returned={}",
                companyId, view, pool.getCandidateIds().size(), scored.size(), results.size());
        return response;
    }

    @Override
    public BatchRecommendResponse batchRecommend(BatchRecommendRequest request) {
        long started = System.nanoTime();
        List<String> companyIds = request.getCompanyIds();
        if (companyIds == null || companyIds.isEmpty()) {
            throw new BadRequestException("company_ids must not be empty");
        }
        LinkedHashSet<String> ids = new LinkedHashSet<>(companyIds);
        if (ids.size() > properties.getMaxBatchCompanies()) {
            throw new TooLargeException("company_ids", ids.size(), properties.getMaxBatchCompanies());
        }

        Map<String, CompletableFuture<BatchRecommendEntry>> futures = new LinkedHashMap<>();
        for (String id : ids) {
            RecommendRequest single = RecommendRequest.builder()
                    .companyId(id)
                    .featureView(request.getFeatureView())
                    .topK(request.getTopK())
                    .filters(request.getFilters())
                    .build();
            futures.put(id, CompletableFuture
                    .supplyAsync(() -> BatchRecommendEntry.ok(recommend(single)), batchExecutor)
                    .exceptionally(t -> failedEntry(id, t)));
        }

        Map<String, BatchRecommendEntry> results = new LinkedHashMap<>();
        futures.forEach((id, f) -> results.put(id, f.join()));
        int failed = (int) results.values().stream().filter(e -> !e.isSuccess()).count();
        metrics.recordBatch(results.size(), failed);

        return BatchRecommendResponse.builder()
                .results(results)
                .processedCount(results.size() - failed)
                .failedCount(failed)
                .latencyMs(elapsedMs(started))
                .build();
    }

    private BatchRecommendEntry failedEntry(String companyId, Throwable t) {
        Throwable cause = t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
        String code;
        if (cause instanceof NotFoundException) {
            code = "NOT_FOUND";
        } else if (cause instanceof BadRequestException) {
            code = "INVALID_ARGUMENT";
        } else if (cause instanceof RequestTimeoutException) {
            code = "DEADLINE_EXCEEDED";
        } else if (cause instanceof StoreUnavailableException) {
            code = "UNAVAILABLE";
        } else {
            code = "INTERNAL";
            log.error("Batch recommendation failed for company_id={}", companyId, cause);
        }
        return BatchRecommendEntry.failed(code, cause.getMessage());
    }

    @Override
    public ExplainResponse explain(String queryCompanyId, String candidateId, Integer topFeatures, String featureView) {
        String view = resolveView(featureView);
        int limit = topFeatures == null ? DEFAULT_TOP_FEATURES : topFeatures;
        if (limit < 1) {
            throw new BadRequestException("top_features must be at least 1");
        }
        if (StringUtils.isBlank(queryCompanyId) || StringUtils.isBlank(candidateId)) {
            throw new BadRequestException("company_id and candidate_id are required");
        }

        RequestDeadline deadline = RequestDeadline.after(properties.getRequestTimeout());
        FeatureLookup lookup = lookupService.lookup(view, List.of(queryCompanyId, candidateId), deadline);
        FeatureRecord query = lookup.getRecords().get(queryCompanyId);
        FeatureRecord candidate = lookup.getRecords().get(candidateId);
        for (String id : List.of(queryCompanyId, candidateId)) {
            if (lookup.getRecords().containsKey(id)) continue;
            if (lookup.isFromFallback()) {
                throw new StoreUnavailableException("feature store unavailable and no cached features for " + id);
            }
            throw new NotFoundException("No feature record for company_id=" + id);
        }
        if (!query.hasCultureVector()) {
            throw new BadRequestException("company_id=" + queryCompanyId + " has no culture_vector");
        }

        String ineligible = null;
        if (!candidate.hasCultureVector()) {
            ineligible = "candidate has no culture_vector";
        } else if (candidate.getCultureVector().size() != query.getCultureVector().size()) {
            ineligible = "culture_vector dimensions differ";
        }

        Set<DegradedReason> reasons = EnumSet.noneOf(DegradedReason.class);
        Long staleness = null;
        if (lookup.isFromFallback()) {
            reasons.add(DegradedReason.STORE_UNAVAILABLE);
            staleness = lookup.getStalenessSeconds();
        }
        if (lookup.getStale().contains(queryCompanyId)) {
            reasons.add(DegradedReason.STALE_QUERY_FEATURES);
            staleness = maxOf(staleness, Duration.between(query.getTimestamp(), clock.instant()).getSeconds());
        }
        if (lookup.getStale().contains(candidateId)) {
            reasons.add(DegradedReason.STALE_CANDIDATE_FEATURES);
            staleness = maxOf(staleness, Duration.between(candidate.getTimestamp(), clock.instant()).getSeconds());
        }
        Optional<ModelVersion> model = modelRegistry.getActive();
        if (model.isEmpty()) {
            reasons.add(DegradedReason.NO_ACTIVE_MODEL);
        }
        if (!reasons.isEmpty()) {
            log.warn("Degraded explain company_id={} candidate_id={} view={} reasons={}",
                    queryCompanyId, candidateId, view, reasons);
        }

        ScoreBreakdown breakdown = calculator.evaluate(query, candidate);
        List<FactorContribution> factors = breakdown.getFactors().stream()
                .sorted(Comparator.comparingDouble(FactorContribution::getContribution).reversed()
                        .thenComparing(FactorContribution::getFactor))
                .limit(limit)
                .toList();

        return ExplainResponse.builder()
                .queryCompanyId(queryCompanyId)
                .candidateId(candidateId)
                .featureView(view)
                .score(breakdown.getScore())
                .confidence(breakdown.getConfidence())
                .eligible(ineligible == null)
                .ineligibleReason(ineligible)
                .cosineSimilarity(breakdown.getCosineSimilarity())
                .factors(factors)
                .missingFactors(breakdown.getMissingFactors())
                .degraded(!reasons.isEmpty())
                .degradedReasons(reasons)
                .stalenessSeconds(staleness)
                .modelVersion(model.map(ModelVersion::getVersionId).orElse(null))
                .build();
    }

    private String resolveView(String requested) {
        return FeatureViewValidator.requireValid(StringUtils.isBlank(requested) ? properties.getDefaultFeatureView() : requested);
    }

    private int resolveTopK(Integer requested) {
        int topK = requested == null ? properties.getDefaultTopK() : requested;
        if (topK < 1 || topK > properties.getMaxTopK()) {
            throw new BadRequestException("top_k must be between 1 and " + properties.getMaxTopK());
        }
        return topK;
    }

    private Duration resolveTimeout(Long timeoutMs) {
        if (timeoutMs == null) return properties.getRequestTimeout();
        if (timeoutMs <= 0) throw new BadRequestException("timeout_ms must be positive");
        Duration requested = Duration.ofMillis(timeoutMs);
        return requested.compareTo(properties.getMaxRequestTimeout()) > 0 ? properties.getMaxRequestTimeout() : requested;
    }

    private static void validateFilters(RecommendFilters f) {
        if (f == null) return;
        if (f.getMinFunding() != null && f.getMaxFunding() != null && f.getMinFunding() > f.getMaxFunding()) {
            throw new BadRequestException("min_funding must not exceed max_funding");
        }
        if (f.getMinEmployees() != null && f.getMaxEmployees() != null && f.getMinEmployees() > f.getMaxEmployees()) {
            throw new BadRequestException("min_employees must not exceed max_employees");
        }
    }

    private static Long maxOf(Long current, Long candidate) {
        if (candidate == null) return current;
        return current == null ? candidate : Math.max(current, candidate);
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }
}
