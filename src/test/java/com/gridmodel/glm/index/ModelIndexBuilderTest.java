package com.gridmodel.glm.index;

import com.gridmodel.glm.config.GlmModelConfig;
import com.gridmodel.glm.diagnostics.ToolDiagnostics;
import com.gridmodel.glm.exception.DuplicateItemException;
import com.gridmodel.glm.exception.UnsupportedItemException;
import com.gridmodel.glm.model.*;
import com.gridmodel.glm.parser.GlmParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ModelIndexBuilder and ModelIndex.
 */
class ModelIndexBuilderTest {

    private final ModelIndexBuilder builder = new ModelIndexBuilder();

    @Test
    void testIndexSharesItemsWithTree() {
        ModelTree tree = parse("""
                module powerflow {
                    solver_method NR;
                }
                clock {
                    timezone EST5EDT;
                }
                object meter {
                    name m1;
                }
                """);

        ModelIndex index = builder.build(tree);

        assertThat(index.getClock().get().getKey()).isEqualTo(1);
        assertThat(index.getClock().get().getItem()).isSameAs(tree.get(1));
        assertThat(index.getModule("powerflow").get().getItem()).isSameAs(tree.get(0));
        assertThat(index.getObject("meter", "m1").get().getItem()).isSameAs(tree.get(2));

        index.getObject("meter", "m1").get().getItem().putField("phases", "ABC");
        assertThat(((ObjectItem) tree.get(2)).getField("phases")).isEqualTo("ABC");
    }

    @Test
    void testModuleDeclarationIsIndexed() {
        ModelTree tree = parse("module tape;\n#set profiler=0;\n");

        ModelIndex index = builder.build(tree);

        assertThat(index.hasModule("tape")).isTrue();
        assertThat(index.getModule("tape").get().getItem()).isInstanceOf(DirectiveItem.class);
        assertThat(index.getModuleNames()).containsExactly("tape");
    }

    @Test
    void testNestedAndUnnamedObjects() {
        ModelTree tree = parse("""
                object house {
                    name h1;
                    object waterheater {
                        tank_volume 50;
                    };
                }
                """);

        ModelIndex index = builder.build(tree);

        assertThat(index.hasObjectType("waterheater")).isTrue();
        assertThat(index.getObjects("waterheater")).isEmpty();
        assertThat(index.getUnnamedObjects()).hasSize(1);
        assertThat(index.getUnnamedObjects().get(0).getKey()).isEqualTo(1);
    }

    @Test
    void testTypeStaysRegisteredAfterRemoval() {
        ModelTree tree = parse("""
                object inverter {
                    name inv_1;
                }
                object solar {
                    area 500;
                }
                """);
        ModelIndex index = builder.build(tree);

        assertThat(index.hasObjects("inverter")).isTrue();
        assertThat(index.hasObjects("solar")).isTrue();

        index.removeObject(0, (ObjectItem) tree.get(0));
        index.removeObject(1, (ObjectItem) tree.get(1));

        assertThat(index.hasObjectType("inverter")).isTrue();
        assertThat(index.hasObjects("inverter")).isFalse();
        assertThat(index.hasObjectType("solar")).isTrue();
        assertThat(index.hasObjects("solar")).isFalse();
    }

    @Test
    void testUnknownTypeGivesEmptyList() {
        ModelIndex index = builder.build(parse("object meter { name m1; }\n"));

        assertThat(index.getObjects("inverter")).isEmpty();
        assertThat(index.hasObjectType("inverter")).isFalse();
    }

    @Test
    void testDuplicateObjectNameFails() {
        ModelTree tree = parse("""
                object meter { name m1; }
                object meter { name m1; }
                """);

        assertThatThrownBy(() -> builder.build(tree))
                .isInstanceOf(DuplicateItemException.class)
                .hasMessageContaining("m1");
    }

    @Test
    void testSameNameDifferentTypesIsAllowed() {
        ModelIndex index = builder.build(parse("""
                object meter { name n1; }
                object node { name n1; }
                """));

        assertThat(index.getObject("meter", "n1")).isPresent();
        assertThat(index.getObject("node", "n1")).isPresent();
    }

    @Test
    void testSecondClockFails() {
        ModelTree tree = parse("clock { timezone A; }\nclock { timezone B; }\n");

        assertThatThrownBy(() -> builder.build(tree)).isInstanceOf(DuplicateItemException.class);
    }

    @Test
    void testDuplicateModuleFails() {
        ModelTree tree = parse("module powerflow;\nmodule powerflow { solver_method NR; }\n");

        assertThatThrownBy(() -> builder.build(tree)).isInstanceOf(DuplicateItemException.class);
    }

    @Test
    void testSchedulesAndClassesAreNotIndexed() {
        ModelIndex index = builder.build(parse("""
                class player {
                    double value;
                }
                schedule s1 {
                    * * * * * 1.0;
                }
                """));

        assertThat(index.getObjectTypes()).isEmpty();
        assertThat(index.getModuleNames()).isEmpty();
        assertThat(index.getClock()).isEmpty();
    }

    @Test
    void testUnknownItemKindFails() {
        ModelTree tree = new ModelTree();
        tree.put(0, new GlmItem() {
            @Override
            public void accept(GlmItemVisitor visitor) {
            }

            @Override
            public String describe() {
                return "mystery";
            }
        });

        assertThatThrownBy(() -> builder.build(tree)).isInstanceOf(UnsupportedItemException.class);
    }

    private ModelTree parse(String source) {
        return GlmParser.parseText(source, GlmModelConfig.defaults(), new ToolDiagnostics());
    }
}
