package com.synapse.x.exceptions;

/**
 * Exception thrown when an internal server error occurs.
 * <p>
 * Used for conditions that are not caused by the client request, such as a stored record
 * that can no longer be decoded.
 * </p>
 */
public class InternalServerErrorException extends RuntimeException {

    /**
     * Constructs a new {@link InternalServerErrorException} with the specified error message.
     *
     * @param m the detail message explaining the error.
     */
    public InternalServerErrorException(String m) {
        super(m);
    }
}
