package com.synapse.x.metrics;

import com.synapse.x.dto.enums.DegradedReason;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Collection;

@Component
public class RankingMetrics {
    private final MeterRegistry meterRegistry;
    private final DistributionSummary poolSizeSummary;
    private final DistributionSummary scoreSummary;

    public RankingMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.poolSizeSummary = DistributionSummary.builder("ranking_pool_size")
                .description("Candidates considered per recommendation")
                .register(meterRegistry);
        this.scoreSummary = DistributionSummary.builder("ranking_top_score")
                .description("Best compatibility score per recommendation")
                .register(meterRegistry);
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void stopTimer(Timer.Sample sample, String outcome) {
        sample.stop(meterRegistry.timer("ranking_duration", "outcome", outcome));
    }

    public void recordPoolSize(int size) {
        poolSizeSummary.record(size);
    }

    public void recordTopScore(double score) {
        scoreSummary.record(score);
    }

    public void recordTimedOutCandidates(int count) {
        if (count > 0) meterRegistry.counter("ranking_timed_out_candidates").increment(count);
    }

    public void recordExcludedCandidates(int count) {
        if (count > 0) meterRegistry.counter("ranking_excluded_candidates").increment(count);
    }

    public void recordDegraded(Collection<DegradedReason> reasons) {
        for (DegradedReason reason : reasons) {
            meterRegistry.counter("ranking_degraded_responses", "reason", reason.name()).increment();
        }
    }

    public void recordResultCache(boolean hit) {
        meterRegistry.counter(hit ? "ranking_cache_hits" : "ranking_cache_misses").increment();
    }

    public void recordBatch(int size, int failed) {
        meterRegistry.counter("ranking_batch_companies").increment(size);
        if (failed > 0) meterRegistry.counter("ranking_batch_failures").increment(failed);
    }
}
