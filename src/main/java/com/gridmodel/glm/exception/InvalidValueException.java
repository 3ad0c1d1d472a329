package com.gridmodel.glm.exception;

/**
 * An argument has the right shape but an unacceptable value or combination of values.
 */
public class InvalidValueException extends GlmModelException {

    private static final long serialVersionUID = 1L;

    public InvalidValueException(String message) {
        super(message);
    }
}
