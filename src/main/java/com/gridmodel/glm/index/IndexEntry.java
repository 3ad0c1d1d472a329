package com.gridmodel.glm.index;

import com.gridmodel.glm.model.GlmItem;

import lombok.Value;

/**
 * A tree key together with the very item stored under it in the tree.
 * The item is shared, not copied.
 */
@Value
public class IndexEntry<T extends GlmItem> {
    int key;
    T item;
}
