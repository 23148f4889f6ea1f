package com.synapse.x.service;

import com.synapse.x.dto.FeatureRecord;
import com.synapse.x.dto.ScoreBreakdown;

public interface CompatibilityCalculator {
    ScoreBreakdown evaluate(FeatureRecord query, FeatureRecord candidate);
}
