package com.gridmodel.glm.model;

import java.util.Map;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.Singular;

/**
 * A {@code module <name> { ... }} block.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class ModuleItem extends FieldedItem {
    private String name;

    @Builder
    public ModuleItem(String name, @Singular Map<String, String> fields, int sourceLine) {
        this.name = name;
        this.fields = copyFields(fields);
        this.sourceLine = sourceLine;
    }

    @Override
    public void accept(GlmItemVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String describe() {
        return "module " + name;
    }
}
