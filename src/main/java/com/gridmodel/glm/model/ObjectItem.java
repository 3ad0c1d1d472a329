package com.gridmodel.glm.model;

import java.util.Map;
import java.util.Set;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.Singular;

/**
 * An {@code object <type> { ... }} block describing one device.
 * The object's name, when it has one, is the {@code name} field.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class ObjectItem extends FieldedItem {
    public static final String NAME = "name";

    private static final Set<String> LEGACY_RECORDER_TYPES = Set.of("recorder", "group_recorder", "collector");

    private String type;

    @Builder
    public ObjectItem(String type, @Singular Map<String, String> fields, int sourceLine) {
        this.type = type;
        this.fields = copyFields(fields);
        this.sourceLine = sourceLine;
    }

    public String getName() {
        return fields.get(NAME);
    }

    public boolean isNamed() {
        return fields.containsKey(NAME);
    }

    /**
     * Recorder-like objects that older tooling stripped from models.
     */
    public boolean isLegacyDeletable() {
        return LEGACY_RECORDER_TYPES.contains(type);
    }

    @Override
    public void accept(GlmItemVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String describe() {
        return isNamed() ? "object " + type + " '" + getName() + "'" : "unnamed object " + type;
    }
}
