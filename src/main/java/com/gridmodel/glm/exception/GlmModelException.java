package com.gridmodel.glm.exception;

/**
 * Root of the errors raised by model operations. Callers that do not care
 * which rule was broken can catch this single type.
 */
public class GlmModelException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public GlmModelException(String message) {
        super(message);
    }
}
