package com.gridmodel.glm.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gridmodel.glm.exception.UnsupportedItemException;
import com.gridmodel.glm.model.ClassDefItem;
import com.gridmodel.glm.model.ClockItem;
import com.gridmodel.glm.model.DirectiveItem;
import com.gridmodel.glm.model.EmbeddedConfigItem;
import com.gridmodel.glm.model.FieldedItem;
import com.gridmodel.glm.model.GlmItem;
import com.gridmodel.glm.model.ModelTree;
import com.gridmodel.glm.model.ModuleItem;
import com.gridmodel.glm.model.ObjectItem;
import com.gridmodel.glm.model.ScheduleItem;

/**
 * Builds a {@link ModelIndex} from a tree by walking every top-level item
 * and, recursively, the children of each block.
 */
public class ModelIndexBuilder {
    private static final Logger log = LoggerFactory.getLogger(ModelIndexBuilder.class);

    public ModelIndex build(ModelTree tree) {
        ModelIndex index = new ModelIndex();
        for (Integer key : tree.rootKeys()) {
            indexItem(index, tree, key);
        }
        log.debug("Indexed {} object type(s), {} module(s), {} unnamed object(s)",
                index.getObjectTypes().size(), index.getModuleNames().size(), index.getUnnamedObjects().size());
        return index;
    }

    /**
     * Adds one item, and anything nested in it, to the index.
     */
    public void indexItem(ModelIndex index, ModelTree tree, int key) {
        GlmItem item = tree.get(key);
        classify(index, key, item);

        if (item instanceof FieldedItem fielded) {
            for (Integer child : fielded.getChildren()) {
                indexItem(index, tree, child);
            }
        }
    }

    private void classify(ModelIndex index, int key, GlmItem item) {
        if (item instanceof ObjectItem object) {
            index.putObject(key, object);
        } else if (item instanceof ClockItem clock) {
            index.putClock(key, clock);
        } else if (item instanceof ModuleItem module) {
            index.putModule(module.getName(), key, module);
        } else if (item instanceof DirectiveItem directive) {
            if (directive.isModuleDeclaration()) {
                index.putModule(directive.getArgument(), key, directive);
            }
        } else if (item instanceof ScheduleItem || item instanceof EmbeddedConfigItem || item instanceof ClassDefItem) {
            log.trace("Not indexed: {}", item.describe());
        } else {
            throw new UnsupportedItemException("Unimplemented item at key " + key + ": " + item);
        }
    }
}
