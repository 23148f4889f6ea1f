package com.synapse.x.cache;

import com.synapse.x.dto.FeatureRecord;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
public class CacheEntry {
    FeatureRecord record;
    Instant insertedAt;

    public long ageSeconds(Instant now) {
        return Math.max(0L, Duration.between(insertedAt, now).getSeconds());
    }
}
