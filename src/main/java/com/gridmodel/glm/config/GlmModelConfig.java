package com.gridmodel.glm.config;

import java.util.Set;

import lombok.Builder;
import lombok.Value;

/**
 * Settings shared by the parser, serializer and model manager.
 *
 * Library callers normally use {@link #defaults()}; the command line tool
 * builds an instance from its options.
 */
@Value
@Builder(toBuilder = true)
public class GlmModelConfig {

    /**
     * Longest {@code name}/{@code parent} value the simulator accepts.
     * Longer values are truncated on output with a warning.
     */
    @Builder.Default
    int maxNameLength = 62;

    /**
     * Value given to fuses that do not declare {@code mean_replacement_time}.
     */
    @Builder.Default
    String fuseMeanReplacementTime = "3600.0";

    /**
     * Whether recorder, group_recorder and collector objects are removed
     * after parsing. Older tooling removed them; they are kept by default.
     */
    @Builder.Default
    boolean dropLegacyRecorders = false;

    /**
     * Object types whose presence means the model needs the generators module.
     */
    @Builder.Default
    Set<String> distributedGenerationTypes = Set.of(
            "inverter", "solar", "battery", "energy_storage",
            "diesel_dg", "windturb_dg", "microturbine");

    @Builder.Default
    int defaultProfiler = 0;

    @Builder.Default
    int defaultMinimumTimestep = 60;

    public static GlmModelConfig defaults() {
        return GlmModelConfig.builder().build();
    }
}
