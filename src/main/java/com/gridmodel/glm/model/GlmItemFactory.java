package com.gridmodel.glm.model;

import java.util.Map;

import com.gridmodel.glm.exception.InvalidTypeException;

import lombok.experimental.UtilityClass;

/**
 * Builds items from loose property maps such as
 * {@code {"object": "recorder", "name": "r1", "interval": 30}}.
 *
 * The item kind is chosen by the first marker key present, checked in the
 * order object, module, clock, #include, #set, #define, omftype. The marker
 * is consumed; every other value becomes a text field.
 */
@UtilityClass
public class GlmItemFactory {

    public static final String OBJECT = "object";
    public static final String MODULE = "module";
    public static final String CLOCK = "clock";
    public static final String OMFTYPE = "omftype";
    public static final String ARGUMENT = "argument";

    public static GlmItem fromProperties(Map<String, ?> properties) {
        if (properties == null) {
            throw new InvalidTypeException("Item properties must not be null");
        }

        if (properties.containsKey(OBJECT)) {
            ObjectItem item = new ObjectItem();
            item.setType(text(properties.get(OBJECT)));
            copyFieldsExcept(properties, item, OBJECT);
            return item;
        }
        if (properties.containsKey(MODULE)) {
            ModuleItem item = new ModuleItem();
            item.setName(text(properties.get(MODULE)));
            copyFieldsExcept(properties, item, MODULE);
            return item;
        }
        if (properties.containsKey(CLOCK)) {
            ClockItem item = new ClockItem();
            copyFieldsExcept(properties, item, CLOCK);
            return item;
        }
        for (String keyword : new String[] {DirectiveItem.INCLUDE, DirectiveItem.SET, DirectiveItem.DEFINE}) {
            if (properties.containsKey(keyword)) {
                return DirectiveItem.bare(keyword, text(properties.get(keyword)));
            }
        }
        if (properties.containsKey(OMFTYPE)) {
            return DirectiveItem.builder()
                    .keyword(text(properties.get(OMFTYPE)))
                    .argument(text(properties.get(ARGUMENT)))
                    .terminated(true)
                    .build();
        }

        throw new InvalidTypeException("Unknown item type, no marker key in: " + properties.keySet());
    }

    private static void copyFieldsExcept(Map<String, ?> properties, FieldedItem item, String marker) {
        for (Map.Entry<String, ?> entry : properties.entrySet()) {
            if (entry.getKey() == null) {
                throw new InvalidTypeException("Item property names must be text");
            }
            if (!entry.getKey().equals(marker)) {
                item.putField(entry.getKey(), entry.getValue());
            }
        }
    }

    private static String text(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}
