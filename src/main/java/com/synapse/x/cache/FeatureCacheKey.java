package com.synapse.x.cache;

import lombok.Value;

@Value
public class FeatureCacheKey {
    String view;
    String companyId;
}
