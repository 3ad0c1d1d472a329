package com.gridmodel.glm.manager;

import java.time.LocalDateTime;

import lombok.Builder;
import lombok.Value;

/**
 * Everything needed to make a model runnable. Absent profiler and timestep
 * values fall back to the configured defaults; the clock values are handed to
 * {@link GlmModelManager#addOrModifyClock} unchanged.
 */
@Value
@Builder
public class RunComponentsRequest {
    LocalDateTime starttime;
    LocalDateTime stoptime;
    String timezone;

    /** Substation voltage, defined as {@code VSOURCE}; absent keeps the model's own. */
    Number vSource;

    /** 0 or 1. */
    Number profiler;

    /** Whole seconds. */
    Number minimumTimestep;
}
