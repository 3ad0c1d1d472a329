package com.gridmodel.glm.exception;

/**
 * An argument or item does not have the shape the operation expects.
 */
public class InvalidTypeException extends GlmModelException {

    private static final long serialVersionUID = 1L;

    public InvalidTypeException(String message) {
        super(message);
    }
}
