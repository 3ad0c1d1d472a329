package com.gridmodel.glm.exception;

/**
 * A referenced object, module, clock or field does not exist in the model.
 */
public class ItemNotFoundException extends GlmModelException {

    private static final long serialVersionUID = 1L;

    public ItemNotFoundException(String message) {
        super(message);
    }
}
