package com.gridmodel.glm.exception;

/**
 * An item does not match any variant the model index knows how to classify.
 */
public class UnsupportedItemException extends GlmModelException {

    private static final long serialVersionUID = 1L;

    public UnsupportedItemException(String message) {
        super(message);
    }
}
