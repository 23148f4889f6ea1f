package com.synapse.x.dto;

import com.synapse.x.dto.enums.RejectionReason;
import lombok.Value;

@Value
public class RejectedRecord {
    FeatureRecord record;
    RejectionReason reason;
    String message;
}
