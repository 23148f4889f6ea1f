package com.synapse.x.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Per-company slot of a batch: exactly one of {@code response} or the error pair is set.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchRecommendEntry {
    RecommendResponse response;
    String errorCode;
    String errorMessage;

    public static BatchRecommendEntry ok(RecommendResponse response) {
        return BatchRecommendEntry.builder().response(response).build();
    }

    public static BatchRecommendEntry failed(String code, String message) {
        return BatchRecommendEntry.builder().errorCode(code).errorMessage(message).build();
    }

    public boolean isSuccess() {
        return response != null;
    }
}
