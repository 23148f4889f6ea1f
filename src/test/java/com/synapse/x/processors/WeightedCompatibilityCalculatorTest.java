package com.synapse.x.processors;

import com.synapse.x.config.RankingProperties;
import com.synapse.x.dto.FactorContribution;
import com.synapse.x.dto.FeatureRecord;
import com.synapse.x.dto.ScoreBreakdown;
import com.synapse.x.dto.enums.CompatibilityFactor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.synapse.x.support.TestRecords.record;
import static com.synapse.x.support.TestRecords.traction;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WeightedCompatibilityCalculatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private RankingProperties properties;
    private WeightedCompatibilityCalculator calculator;

    @BeforeEach
    void setUp() {
        properties = new RankingProperties();
        calculator = new WeightedCompatibilityCalculator(properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("aligned culture vectors outscore orthogonal ones when everything else is equal")
    void cultureDominates() {
        FeatureRecord a = record("A", NOW, 1, 0, 0, 0);
        FeatureRecord b = record("B", NOW, 1, 0, 0, 0);
        FeatureRecord c = record("C", NOW, 0, 1, 0, 0);

        ScoreBreakdown ab = calculator.evaluate(a, b);
        ScoreBreakdown ac = calculator.evaluate(a, c);

        assertThat(ab.getCosineSimilarity()).isCloseTo(1.0, within(1e-9));
        assertThat(ac.getCosineSimilarity()).isCloseTo(0.0, within(1e-9));
        assertThat(ab.getScore()).isGreaterThan(ac.getScore());
        assertThat(ab.getConfidence()).isEqualTo(ac.getConfidence());
    }

    @Test
    @DisplayName("contributions add up to the score")
    void contributionsSumToScore() {
        FeatureRecord a = record("A", NOW.minus(Duration.ofDays(2)), 0.3, 0.7, 0.1, 0.2);
        FeatureRecord b = record("B", NOW.minus(Duration.ofDays(10)), 0.5, 0.1, 0.9, 0.0)
                .toBuilder().tractionMetrics(traction(250_000, 8)).build();

        ScoreBreakdown breakdown = calculator.evaluate(a, b);

        double sum = breakdown.getFactors().stream().mapToDouble(FactorContribution::getContribution).sum();
        assertThat(breakdown.getScore()).isCloseTo(sum, within(1e-9));
        assertThat(breakdown.getScore()).isBetween(0.0, 1.0);
        assertThat(breakdown.getFactors())
                .filteredOn(f -> f.getFactor() == CompatibilityFactor.FUNDING)
                .singleElement()
                .satisfies(f -> assertThat(f.getValue()).isCloseTo(0.25, within(1e-9)));
    }

    @Test
    @DisplayName("factors without inputs are reported missing and lower the confidence")
    void missingInputs() {
        FeatureRecord a = record("A", NOW, 1, 0, 0, 0);
        FeatureRecord bare = FeatureRecord.builder().companyId("B").timestamp(NOW)
                .cultureValue(1.0).cultureValue(0.0).cultureValue(0.0).cultureValue(0.0)
                .build();

        ScoreBreakdown breakdown = calculator.evaluate(a, bare);

        assertThat(breakdown.getMissingFactors()).contains(
                CompatibilityFactor.FUNDING, CompatibilityFactor.COMPANY_SIZE, CompatibilityFactor.USER_OVERLAP,
                CompatibilityFactor.REVENUE_GROWTH);
        assertThat(breakdown.getConfidence()).isCloseTo(0.5, within(1e-9));
        assertThat(breakdown.getScore()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("negative cosine similarity is clamped to zero")
    void opposedVectors() {
        ScoreBreakdown breakdown = calculator.evaluate(record("A", NOW, 1, 0, 0, 0), record("B", NOW, -1, 0, 0, 0));

        assertThat(breakdown.getCosineSimilarity()).isCloseTo(-1.0, within(1e-9));
        assertThat(breakdown.getFactors())
                .filteredOn(f -> f.getFactor() == CompatibilityFactor.CULTURE)
                .singleElement()
                .satisfies(f -> assertThat(f.getValue()).isZero());
    }

    @Test
    @DisplayName("older candidates lose timing credit")
    void timingDecays() {
        FeatureRecord query = record("A", NOW, 1, 0, 0, 0);
        ScoreBreakdown fresh = calculator.evaluate(query, record("B", NOW, 1, 0, 0, 0));
        ScoreBreakdown old = calculator.evaluate(query, record("C", NOW.minus(Duration.ofDays(60)), 1, 0, 0, 0));

        assertThat(fresh.getScore()).isGreaterThan(old.getScore());
    }

    @Test
    @DisplayName("zero-weight factors are left out and negative weights refused")
    void weightConfiguration() {
        properties.getWeights().put(CompatibilityFactor.TIMING, 0.0);
        WeightedCompatibilityCalculator noTiming = new WeightedCompatibilityCalculator(properties, Clock.fixed(NOW, ZoneOffset.UTC));

        ScoreBreakdown breakdown = noTiming.evaluate(record("A", NOW, 1, 0, 0, 0), record("B", NOW, 1, 0, 0, 0));
        assertThat(breakdown.getFactors()).extracting(FactorContribution::getFactor)
                .doesNotContain(CompatibilityFactor.TIMING);
        assertThat(breakdown.getMissingFactors()).doesNotContain(CompatibilityFactor.TIMING);

        properties.getWeights().put(CompatibilityFactor.GROWTH, -1.0);
        assertThatThrownBy(() -> new WeightedCompatibilityCalculator(properties, Clock.systemUTC()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("extreme but finite culture magnitudes still score within [0, 1]")
    void extremeMagnitudes() {
        FeatureRecord huge = record("A", NOW, 1e200, 0, 0, 0);
        FeatureRecord unit = record("B", NOW, 1, 0, 0, 0);
        FeatureRecord tiny = record("C", NOW, 1e-170, 0, 0, 0);

        ScoreBreakdown hugeToHuge = calculator.evaluate(huge, huge);
        ScoreBreakdown hugeToUnit = calculator.evaluate(huge, unit);
        ScoreBreakdown tinyToUnit = calculator.evaluate(tiny, unit);

        assertThat(hugeToHuge.getCosineSimilarity()).isCloseTo(1.0, within(1e-9));
        assertThat(hugeToUnit.getCosineSimilarity()).isCloseTo(1.0, within(1e-9));
        assertThat(tinyToUnit.getCosineSimilarity()).isCloseTo(1.0, within(1e-9));
        assertThat(List.of(hugeToHuge, hugeToUnit, tinyToUnit))
                .allSatisfy(b -> assertThat(b.getScore()).isBetween(0.0, 1.0));
    }
}
