package com.synapse.x.dto;

import com.synapse.x.dto.enums.HealthState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class HealthStatus {
    HealthState status;
    String activeModelVersion;
    Long lastWriteAgeSeconds;
    Instant timestamp;
    Map<String, Object> details;
}
