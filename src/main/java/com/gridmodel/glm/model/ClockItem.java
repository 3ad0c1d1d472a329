package com.gridmodel.glm.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.Singular;

/**
 * The model's {@code clock { ... }} block.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class ClockItem extends FieldedItem {
    public static final String TIMEZONE = "timezone";
    public static final String STARTTIME = "starttime";
    public static final String STOPTIME = "stoptime";

    /** The only fields written out, in the order the simulator requires. */
    public static final List<String> RENDERED_FIELDS = List.of(TIMEZONE, STARTTIME, STOPTIME);

    @Builder
    public ClockItem(@Singular Map<String, String> fields, int sourceLine) {
        this.fields = copyFields(fields);
        this.sourceLine = sourceLine;
    }

    @Override
    public void accept(GlmItemVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String describe() {
        return "clock";
    }
}
