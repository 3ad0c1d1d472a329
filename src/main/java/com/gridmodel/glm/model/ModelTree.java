package com.gridmodel.glm.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * The record of truth for a model: items addressed by integer key.
 *
 * Ascending key order is the on-disk statement order. Nested items are
 * stored here under their own keys as well as being listed in their
 * parent's children.
 */
public class ModelTree {

    private final NavigableMap<Integer, GlmItem> items = new TreeMap<>();

    public GlmItem get(int key) {
        return items.get(key);
    }

    public boolean containsKey(int key) {
        return items.containsKey(key);
    }

    public void put(int key, GlmItem item) {
        items.put(key, item);
    }

    public GlmItem remove(int key) {
        return items.remove(key);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * Smallest key, or 0 for an empty tree.
     */
    public int firstKey() {
        return items.isEmpty() ? 0 : items.firstKey();
    }

    /**
     * Largest key, or -1 for an empty tree.
     */
    public int lastKey() {
        return items.isEmpty() ? -1 : items.lastKey();
    }

    /**
     * Read-only view in ascending key order.
     */
    public Map<Integer, GlmItem> entries() {
        return Collections.unmodifiableMap(items);
    }

    public List<Integer> keys() {
        return new ArrayList<>(items.keySet());
    }

    /**
     * Keys of items not nested inside another item, ascending.
     */
    public List<Integer> rootKeys() {
        List<Integer> roots = new ArrayList<>();
        for (Map.Entry<Integer, GlmItem> entry : items.entrySet()) {
            if (!entry.getValue().isNested()) {
                roots.add(entry.getKey());
            }
        }
        return roots;
    }
}
