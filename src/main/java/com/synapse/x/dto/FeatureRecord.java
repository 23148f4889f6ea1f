package com.synapse.x.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One version of a company's features inside a feature view.
 * <p>
 * Records are immutable: a write always produces a new timestamped version, and cached
 * snapshots can be handed to concurrent readers without copying. An empty
 * {@code cultureVector} means the company has no culture embedding.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class FeatureRecord {
    String companyId;
    Double userOverlapScore;
    TractionMetrics tractionMetrics;
    @Singular("cultureValue")
    List<Double> cultureVector;
    Integer matchOutcome;
    Instant timestamp;

    public boolean hasCultureVector() {
        return cultureVector != null && !cultureVector.isEmpty();
    }

    public double[] cultureArray() {
        double[] out = new double[cultureVector.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = cultureVector.get(i);
        }
        return out;
    }
}
