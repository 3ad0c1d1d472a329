package com.gridmodel.glm.cli.model;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Value;

/**
 * Parsed and checked values needed by the executor. Keeps PrepareRunCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedPrepareRunOptions {
    Path inputPath;
    Path outputPath;
    LocalDateTime starttime;
    LocalDateTime stoptime;
    List<ObjectReference> removals;

    /** A {@code type:name} pair from {@code --remove-object}. */
    @Value
    public static class ObjectReference {
        String type;
        String name;
    }
}
