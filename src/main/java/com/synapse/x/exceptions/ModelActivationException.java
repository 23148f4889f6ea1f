package com.synapse.x.exceptions;

import com.synapse.x.dto.enums.ActivationError;
import lombok.Getter;

/**
 * Rejected model activation. The active version is unchanged when this is thrown.
 */
@Getter
public class ModelActivationException extends RuntimeException {

    private final ActivationError error;

    public ModelActivationException(ActivationError error, String message) {
        super(message);
        this.error = error;
    }
}
