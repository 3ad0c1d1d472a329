package com.gridmodel.glm.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * An item rendered as a brace block: it carries key/value fields in
 * insertion order and the keys of any items nested inside it.
 *
 * The field map is live. The model index hands out this same instance, so
 * it must never be replaced by a copy.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public abstract class FieldedItem extends GlmItem {
    protected Map<String, String> fields = new LinkedHashMap<>();
    protected List<Integer> children = new ArrayList<>();

    /**
     * Sets a field, coercing the value to its text form.
     */
    public void putField(String key, Object value) {
        fields.put(key, String.valueOf(value));
    }

    public String getField(String key) {
        return fields.get(key);
    }

    public boolean hasField(String key) {
        return fields.containsKey(key);
    }

    public String removeField(String key) {
        return fields.remove(key);
    }

    public void addChild(int key) {
        children.add(key);
    }

    public boolean removeChild(int key) {
        return children.remove(Integer.valueOf(key));
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    protected static Map<String, String> copyFields(Map<String, String> fields) {
        return fields != null ? new LinkedHashMap<>(fields) : new LinkedHashMap<>();
    }
}
