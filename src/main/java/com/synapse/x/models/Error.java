package com.synapse.x.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatus;

import java.time.Instant;

/**
 * JSON error body of the HTTP API. {@code errorCode} is the machine-readable class of the
 * failure ({@code INVALID_ARGUMENT}, {@code TOO_LARGE}, {@code DIMENSION_MISMATCH}, ...).
 */
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class Error {
    private String uid;
    private HttpStatus status;
    private String errorCode;
    private Instant timestamp;
    private String errorMsg;
}
