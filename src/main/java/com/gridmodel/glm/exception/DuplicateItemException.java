package com.gridmodel.glm.exception;

/**
 * An operation would create a second clock, module or (type, name) object.
 */
public class DuplicateItemException extends GlmModelException {

    private static final long serialVersionUID = 1L;

    public DuplicateItemException(String message) {
        super(message);
    }
}
