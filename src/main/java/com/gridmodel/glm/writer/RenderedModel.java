package com.gridmodel.glm.writer;

import java.util.List;

import lombok.Value;

/**
 * Model text plus the warnings raised while rendering it.
 */
@Value
public class RenderedModel {
    String text;
    List<String> warnings;

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
