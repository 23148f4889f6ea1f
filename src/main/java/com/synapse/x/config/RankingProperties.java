package com.synapse.x.config;

import com.synapse.x.dto.enums.CompatibilityFactor;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tunables of the candidate retrieval and ranking path, bound from {@code synapse.ranking.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "synapse.ranking")
public class RankingProperties {

    @NotBlank
    private String defaultFeatureView = "v1";

    @Min(1)
    private int defaultTopK = 10;

    @Min(1)
    private int maxTopK = 100;

    @Min(1)
    private int maxPoolSize = 5000;

    @Min(1)
    private int lookupChunkSize = 64;

    @Min(1)
    private int maxParallelLookups = 8;

    @NotNull
    private Duration lookupTimeout = Duration.ofMillis(500);

    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(2);

    @NotNull
    private Duration maxRequestTimeout = Duration.ofSeconds(10);

    /** Candidates scoring below this are dropped. */
    private double minScore = 0.0;

    /** Absolute growth difference (percentage points) at which growth similarity reaches 0. */
    private double growthScale = 100.0;

    @NotNull
    private Duration timingHalfLife = Duration.ofDays(30);

    @Min(1)
    private int maxBatchCompanies = 100;

    @Min(1)
    private int batchConcurrency = 5;

    private Map<CompatibilityFactor, Double> weights = defaultWeights();

    public static Map<CompatibilityFactor, Double> defaultWeights() {
        Map<CompatibilityFactor, Double> w = new EnumMap<>(CompatibilityFactor.class);
        w.put(CompatibilityFactor.CULTURE, 0.40);
        w.put(CompatibilityFactor.FUNDING, 0.10);
        w.put(CompatibilityFactor.COMPANY_SIZE, 0.10);
        w.put(CompatibilityFactor.GROWTH, 0.10);
        w.put(CompatibilityFactor.MARKET_SENTIMENT, 0.05);
        w.put(CompatibilityFactor.REVENUE_GROWTH, 0.05);
        w.put(CompatibilityFactor.USER_GROWTH, 0.05);
        w.put(CompatibilityFactor.USER_OVERLAP, 0.05);
        w.put(CompatibilityFactor.TIMING, 0.10);
        return w;
    }
}
