package com.synapse.x.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Malformed input: an invalid feature view name, a record that does not fit its view, a bad
 * time range or an out-of-range request parameter. Maps to HTTP 400 and gRPC INVALID_ARGUMENT.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }
}
