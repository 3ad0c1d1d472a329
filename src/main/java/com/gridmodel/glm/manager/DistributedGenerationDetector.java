package com.gridmodel.glm.manager;

import java.util.Optional;
import java.util.Set;

import com.gridmodel.glm.index.ModelIndex;

/**
 * Decides whether a model needs the {@code generators} module: it does when
 * any object of a configured distributed-generation type (inverter, solar,
 * ...) is still in the model, named or not, at any nesting depth.
 */
public class DistributedGenerationDetector {

    private final Set<String> generationTypes;

    public DistributedGenerationDetector(Set<String> generationTypes) {
        this.generationTypes = Set.copyOf(generationTypes);
    }

    public boolean requiresGenerators(ModelIndex index) {
        return firstGenerationType(index).isPresent();
    }

    public Optional<String> firstGenerationType(ModelIndex index) {
        return index.getObjectTypes().stream()
                .filter(generationTypes::contains)
                .filter(index::hasObjects)
                .findFirst();
    }
}
