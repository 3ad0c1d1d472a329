package com.gridmodel.glm.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * A {@code schedule <name> { ... }} block. The cron-style body is opaque
 * text, one schedule line per text line.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class ScheduleItem extends GlmItem {
    private String name;
    private String body;

    @Builder
    public ScheduleItem(String name, String body, int sourceLine) {
        this.name = name;
        this.body = body != null ? body : "";
        this.sourceLine = sourceLine;
    }

    @Override
    public void accept(GlmItemVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String describe() {
        return "schedule " + name;
    }
}
