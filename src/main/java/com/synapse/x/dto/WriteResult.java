package com.synapse.x.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class WriteResult {
    String featureView;
    int acceptedCount;
    @Singular("acceptedCompanyId")
    List<String> acceptedCompanyIds;
    @Singular("rejected")
    List<RejectedRecord> rejected;
}
