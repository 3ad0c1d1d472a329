package com.gridmodel.glm.writer;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gridmodel.glm.config.GlmModelConfig;
import com.gridmodel.glm.diagnostics.ToolDiagnostics;
import com.gridmodel.glm.model.ClassDefItem;
import com.gridmodel.glm.model.ClockItem;
import com.gridmodel.glm.model.DirectiveItem;
import com.gridmodel.glm.model.EmbeddedConfigItem;
import com.gridmodel.glm.model.FieldedItem;
import com.gridmodel.glm.model.GlmItemVisitor;
import com.gridmodel.glm.model.ModelTree;
import com.gridmodel.glm.model.ModuleItem;
import com.gridmodel.glm.model.ObjectItem;
import com.gridmodel.glm.model.ScheduleItem;

/**
 * Renders a {@link ModelTree} as GLM text.
 *
 * Top-level items are written in ascending key order, each followed by a
 * line break. Nested items are written inside their parent, before the
 * parent's own fields. The serializer only reads the tree.
 */
public class GlmSerializer {
    private static final Logger log = LoggerFactory.getLogger(GlmSerializer.class);

    private static final String COMMENT = "comment";

    private final GlmModelConfig config;

    public GlmSerializer(GlmModelConfig config) {
        this.config = config;
    }

    public String write(ModelTree tree, ToolDiagnostics diagnostics) {
        ItemRenderer renderer = new ItemRenderer(tree, diagnostics);
        for (Integer key : tree.rootKeys()) {
            tree.get(key).accept(renderer);
            renderer.out.append('\n');
        }
        return renderer.out.toString();
    }

    public RenderedModel render(ModelTree tree) {
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        String text = write(tree, diagnostics);
        return new RenderedModel(text, diagnostics.getWarnings());
    }

    private class ItemRenderer implements GlmItemVisitor {
        private final StringBuilder out = new StringBuilder();
        private final ModelTree tree;
        private final ToolDiagnostics diagnostics;

        ItemRenderer(ModelTree tree, ToolDiagnostics diagnostics) {
            this.tree = tree;
            this.diagnostics = diagnostics;
        }

        @Override
        public void visit(DirectiveItem directive) {
            out.append(directive.getKeyword());
            if (!directive.getArgument().isEmpty()) {
                out.append(' ').append(directive.getArgument());
            }
            if (directive.isTerminated()) {
                out.append(';');
            }
        }

        @Override
        public void visit(ClockItem clock) {
            out.append("clock {\n");
            for (String field : ClockItem.RENDERED_FIELDS) {
                if (clock.hasField(field)) {
                    out.append('\t').append(field).append(' ').append(clock.getField(field)).append(";\n");
                }
            }
            out.append("}\n");
        }

        @Override
        public void visit(ModuleItem module) {
            out.append("module ").append(module.getName()).append(" {\n");
            appendBody(module);
            out.append("}\n");
        }

        @Override
        public void visit(ObjectItem object) {
            out.append("object ").append(object.getType()).append(" {\n");
            appendBody(object);
            out.append("};\n");
        }

        @Override
        public void visit(ScheduleItem schedule) {
            out.append("schedule ").append(schedule.getName()).append(" {\n")
                    .append(schedule.getBody())
                    .append("\n};\n");
        }

        @Override
        public void visit(EmbeddedConfigItem embedded) {
            out.append(embedded.getHeader()).append(" {\n");
            appendBody(embedded);
            out.append("};\n");
        }

        @Override
        public void visit(ClassDefItem classDef) {
            out.append("class ").append(classDef.getName()).append(" {\n");
            if (classDef.hasPairedDeclarations()) {
                for (int i = 0; i < classDef.getVariableTypes().size(); i++) {
                    out.append('\t').append(classDef.getVariableTypes().get(i))
                            .append(' ').append(classDef.getVariableNames().get(i)).append(";\n");
                }
            } else {
                appendBody(classDef);
            }
            out.append("}\n");
        }

        private void appendBody(FieldedItem item) {
            for (Integer child : item.getChildren()) {
                tree.get(child).accept(this);
            }
            for (Map.Entry<String, String> field : item.getFields().entrySet()) {
                appendField(field.getKey(), field.getValue());
            }
        }

        private void appendField(String key, String value) {
            if (COMMENT.equals(key)) {
                out.append(value).append('\n');
                return;
            }

            int max = config.getMaxNameLength();
            if ((ObjectItem.NAME.equals(key) || "parent".equals(key)) && value.length() > max) {
                String warning = key + " argument is longer than " + max + " characters. Truncating " + value + ".";
                diagnostics.getWarnings().add(warning);
                log.warn(warning);
                out.append('\t').append(key).append(' ').append(value, 0, max)
                        .append("; // truncated from ").append(value).append('\n');
                return;
            }

            out.append('\t').append(key).append(' ').append(value).append(";\n");
        }
    }
}
