package com.synapse.x.dto;

import lombok.Value;

import java.time.Instant;

@Value
public class CompanyPointer {
    String companyId;
    Instant latestTimestamp;
}
