package com.synapse.x.processors;

import com.synapse.x.config.RankingProperties;
import com.synapse.x.dto.FactorContribution;
import com.synapse.x.dto.FeatureRecord;
import com.synapse.x.dto.ScoreBreakdown;
import com.synapse.x.dto.TractionMetrics;
import com.synapse.x.dto.enums.CompatibilityFactor;
import com.synapse.x.service.CompatibilityCalculator;
import com.synapse.x.utils.basic.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted mean of per-factor similarities in [0, 1].
 * <p>
 * Only factors whose inputs exist on both sides take part, and the score is normalised by
 * their summed weight. Confidence is the share of the total configured weight that was
 * present for the pair.
 * </p>
 */
@Slf4j
@Component
public class WeightedCompatibilityCalculator implements CompatibilityCalculator {

    private final Map<CompatibilityFactor, Double> weights;
    private final double totalWeight;
    private final double growthScale;
    private final double halfLifeMillis;
    private final Clock clock;

    public WeightedCompatibilityCalculator(RankingProperties properties, Clock clock) {
        this.weights = new EnumMap<>(CompatibilityFactor.class);
        for (CompatibilityFactor factor : CompatibilityFactor.values()) {
            double w = properties.getWeights().getOrDefault(factor, 0.0);
            if (w < 0 || !Double.isFinite(w)) {
                throw new IllegalArgumentException("weight for " + factor + " must be a finite value >= 0");
            }
            weights.put(factor, w);
        }
        this.totalWeight = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        this.growthScale = properties.getGrowthScale();
        this.halfLifeMillis = properties.getTimingHalfLife().toMillis();
        this.clock = clock;
        log.info("Compatibility weights: {}", weights);
    }

    @Override
    public ScoreBreakdown evaluate(FeatureRecord query, FeatureRecord candidate) {
        Map<CompatibilityFactor, Double> values = new EnumMap<>(CompatibilityFactor.class);
        Double cosine = null;

        if (query.hasCultureVector() && candidate.hasCultureVector()
                && query.getCultureVector().size() == candidate.getCultureVector().size()) {
            double c = VectorMath.cosine(query.cultureArray(), candidate.cultureArray());
            if (Double.isFinite(c)) {
                cosine = c;
                values.put(CompatibilityFactor.CULTURE, VectorMath.clamp01(c));
            }
        }

        TractionMetrics tq = query.getTractionMetrics();
        TractionMetrics tc = candidate.getTractionMetrics();
        if (tq != null && tc != null) {
            values.put(CompatibilityFactor.FUNDING, VectorMath.ratio(tq.getFundingAmount(), tc.getFundingAmount()));
            values.put(CompatibilityFactor.COMPANY_SIZE, VectorMath.ratio(tq.getEmployeeCount(), tc.getEmployeeCount()));
            values.put(CompatibilityFactor.GROWTH, growthSimilarity(tq.getGrowthRate(), tc.getGrowthRate()));
            values.put(CompatibilityFactor.MARKET_SENTIMENT,
                    VectorMath.clamp01(1.0 - Math.abs(tq.getMarketSentiment() - tc.getMarketSentiment()) / 2.0));
            if (tq.getRevenueGrowth() != null && tc.getRevenueGrowth() != null) {
                values.put(CompatibilityFactor.REVENUE_GROWTH, growthSimilarity(tq.getRevenueGrowth(), tc.getRevenueGrowth()));
            }
            if (tq.getUserGrowth() != null && tc.getUserGrowth() != null) {
                values.put(CompatibilityFactor.USER_GROWTH, growthSimilarity(tq.getUserGrowth(), tc.getUserGrowth()));
            }
        }

        if (query.getUserOverlapScore() != null && candidate.getUserOverlapScore() != null) {
            values.put(CompatibilityFactor.USER_OVERLAP,
                    VectorMath.clamp01((query.getUserOverlapScore() + candidate.getUserOverlapScore()) / 2.0));
        }

        if (query.getTimestamp() != null && candidate.getTimestamp() != null) {
            values.put(CompatibilityFactor.TIMING, timing(query, candidate));
        }

        return combine(values, cosine);
    }

    private ScoreBreakdown combine(Map<CompatibilityFactor, Double> values, Double cosine) {
        // a factor that did not evaluate to a number counts as missing
        values.values().removeIf(v -> v == null || !Double.isFinite(v));
        double presentWeight = 0.0;
        for (CompatibilityFactor factor : values.keySet()) {
            presentWeight += weights.get(factor);
        }

        List<FactorContribution> contributions = new ArrayList<>(values.size());
        double score = 0.0;
        for (Map.Entry<CompatibilityFactor, Double> e : values.entrySet()) {
            double w = weights.get(e.getKey());
            if (w == 0.0) continue;
            double contribution = presentWeight > 0 ? w * e.getValue() / presentWeight : 0.0;
            score += contribution;
            contributions.add(FactorContribution.builder()
                    .factor(e.getKey())
                    .value(e.getValue())
                    .weight(w)
                    .contribution(contribution)
                    .build());
        }

        List<CompatibilityFactor> missing = new ArrayList<>();
        for (Map.Entry<CompatibilityFactor, Double> e : weights.entrySet()) {
            if (e.getValue() > 0 && !values.containsKey(e.getKey())) {
                missing.add(e.getKey());
            }
        }

        return ScoreBreakdown.builder()
                .score(VectorMath.clamp01(score))
                .confidence(totalWeight > 0 ? presentWeight / totalWeight : 0.0)
                .cosineSimilarity(cosine)
                .factors(contributions)
                .missingFactors(missing)
                .build();
    }

    private double growthSimilarity(double a, double b) {
        if (growthScale <= 0) return a == b ? 1.0 : 0.0;
        return 1.0 - Math.min(1.0, Math.abs(a - b) / growthScale);
    }

    /**
     * Closeness of the two records in time multiplied by the candidate's freshness.
     */
    private double timing(FeatureRecord query, FeatureRecord candidate) {
        double apart = Math.abs(Duration.between(query.getTimestamp(), candidate.getTimestamp()).toMillis());
        double age = Duration.between(candidate.getTimestamp(), clock.instant()).toMillis();
        return VectorMath.halfLifeDecay(apart, halfLifeMillis) * VectorMath.halfLifeDecay(age, halfLifeMillis);
    }
}
