package com.gridmodel.glm.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gridmodel.glm.config.GlmModelConfig;
import com.gridmodel.glm.diagnostics.ToolDiagnostics;
import com.gridmodel.glm.model.FieldedItem;
import com.gridmodel.glm.model.GlmItem;
import com.gridmodel.glm.model.ModelTree;
import com.gridmodel.glm.model.ObjectItem;

/**
 * Rewrites older GLM conventions on every parsed object:
 * <ul>
 *   <li>{@code object load:12} becomes type {@code load} named {@code load_12}
 *       when no explicit name is given</li>
 *   <li>colons in field values become underscores</li>
 *   <li>fuses get a default {@code mean_replacement_time}</li>
 *   <li>hyphens in name, parent, from and to become underscores</li>
 * </ul>
 * These rewrites are one-way; the original text is not kept.
 */
public class LegacySyntaxNormalizer {
    private static final Logger log = LoggerFactory.getLogger(LegacySyntaxNormalizer.class);

    static final String MEAN_REPLACEMENT_TIME = "mean_replacement_time";
    private static final List<String> LINK_FIELDS = List.of("name", "parent", "from", "to");

    private final GlmModelConfig config;

    public LegacySyntaxNormalizer(GlmModelConfig config) {
        this.config = config;
    }

    public void normalize(ModelTree tree, ToolDiagnostics diagnostics) {
        List<Integer> legacyRecorders = new ArrayList<>();

        for (Map.Entry<Integer, GlmItem> entry : tree.entries().entrySet()) {
            if (entry.getValue() instanceof ObjectItem object) {
                normalizeObject(object);
                if (object.isLegacyDeletable()) {
                    legacyRecorders.add(entry.getKey());
                }
            }
        }

        if (legacyRecorders.isEmpty()) {
            return;
        }
        if (config.isDropLegacyRecorders()) {
            for (Integer key : legacyRecorders) {
                removeWithChildren(tree, key);
            }
            diagnostics.getInfos().add("Removed " + legacyRecorders.size() + " recorder/collector object(s)");
            log.info("Removed {} recorder/collector object(s)", legacyRecorders.size());
        } else {
            diagnostics.getInfos().add("Kept " + legacyRecorders.size() + " recorder/collector object(s)");
        }
    }

    private void normalizeObject(ObjectItem object) {
        String type = object.getType();
        if (type == null) {
            return;
        }

        int colon = type.indexOf(':');
        if (colon >= 0) {
            if (!object.isNamed()) {
                object.putField(ObjectItem.NAME, type.replace(':', '_'));
            }
            object.setType(type.substring(0, colon));
        }

        object.getFields().replaceAll((key, value) -> value.replace(':', '_'));

        if ("fuse".equals(object.getType()) && !object.hasField(MEAN_REPLACEMENT_TIME)) {
            object.putField(MEAN_REPLACEMENT_TIME, config.getFuseMeanReplacementTime());
        }

        for (String field : LINK_FIELDS) {
            String value = object.getField(field);
            if (value != null) {
                object.putField(field, value.replace('-', '_'));
            }
        }
    }

    private static void removeWithChildren(ModelTree tree, int key) {
        GlmItem item = tree.remove(key);
        if (item == null) {
            return;
        }
        if (item.getParentKey() != null && tree.get(item.getParentKey()) instanceof FieldedItem parent) {
            parent.removeChild(key);
        }
        if (item instanceof FieldedItem fielded) {
            for (Integer child : new ArrayList<>(fielded.getChildren())) {
                removeWithChildren(tree, child);
            }
        }
    }
}
