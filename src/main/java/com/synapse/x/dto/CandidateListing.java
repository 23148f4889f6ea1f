package com.synapse.x.dto;

import lombok.Value;

import java.util.List;

@Value
public class CandidateListing {
    List<CompanyPointer> companies;
    boolean fromFallback;
    Long stalenessSeconds;
}
