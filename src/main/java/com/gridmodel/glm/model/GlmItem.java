package com.gridmodel.glm.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Base class for one parsed GLM statement.
 *
 * Every item is addressed by an integer key in the {@link ModelTree}. Items
 * nested inside an object block additionally remember the key of the block
 * that encloses them.
 */
@Data
@NoArgsConstructor
public abstract class GlmItem {
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    protected Integer parentKey;
    protected int sourceLine;

    public abstract void accept(GlmItemVisitor visitor);

    /**
     * Short human readable label used in log and error messages.
     */
    public abstract String describe();

    public boolean isNested() {
        return parentKey != null;
    }
}
