package com.gridmodel.glm.model;

import java.util.Map;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.Singular;

/**
 * Any other brace block, kept with its header text as written,
 * e.g. {@code filter ctrl(z,1s) = (1+z^-1)/2 { ... }}.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class EmbeddedConfigItem extends FieldedItem {
    private String header;

    @Builder
    public EmbeddedConfigItem(String header, @Singular Map<String, String> fields, int sourceLine) {
        this.header = header;
        this.fields = copyFields(fields);
        this.sourceLine = sourceLine;
    }

    @Override
    public void accept(GlmItemVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String describe() {
        return "block '" + header + "'";
    }
}
