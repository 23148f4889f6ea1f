package com.synapse.x.exceptions;

/**
 * Thrown when a request carries more ids than the configured batch bound allows.
 */
public class TooLargeException extends BadRequestException {

    public TooLargeException(String what, int size, int limit) {
        super("%s size %d exceeds limit %d".formatted(what, size, limit));
    }
}
