package com.synapse.x.utils.basic;

import com.synapse.x.models.Error;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.UUID;

public final class ErrorUtility {

    private ErrorUtility() {
        throw new UnsupportedOperationException("Not supported");
    }

    /**
     * Builds the error body.
     *
     * @param errorCode machine-readable failure class
     * @param errorMsg  the error msg
     * @param status    the status
     * @return the error
     */
    public static Error getError(String errorCode, String errorMsg, HttpStatus status) {
        return Error.builder()
                .uid(UUID.randomUUID().toString())
                .status(status)
                .errorCode(errorCode)
                .timestamp(Instant.now())
                .errorMsg(errorMsg)
                .build();
    }

    public static ResponseEntity<Error> respond(String errorCode, String errorMsg, HttpStatus status) {
        return new ResponseEntity<>(getError(errorCode, errorMsg, status), status);
    }
}
