package com.gridmodel.glm.parser;

import com.gridmodel.glm.config.GlmModelConfig;
import com.gridmodel.glm.diagnostics.ToolDiagnostics;
import com.gridmodel.glm.model.ModelTree;
import com.gridmodel.glm.model.ObjectItem;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the legacy syntax rewrites applied after parsing.
 */
class LegacySyntaxNormalizerTest {

    @Test
    void testColonTypeBecomesName() {
        ObjectItem load = parseSingle("""
                object load:12 {
                    phases A;
                }
                """);

        assertThat(load.getType()).isEqualTo("load");
        assertThat(load.getName()).isEqualTo("load_12");
    }

    @Test
    void testColonTypeKeepsExplicitName() {
        ObjectItem load = parseSingle("""
                object load:12 {
                    name house_load;
                }
                """);

        assertThat(load.getType()).isEqualTo("load");
        assertThat(load.getName()).isEqualTo("house_load");
    }

    @Test
    void testColonsInValuesBecomeUnderscores() {
        ObjectItem line = parseSingle("""
                object overhead_line {
                    name ol_1;
                    from node:4;
                    to node:5;
                }
                """);

        assertThat(line.getField("from")).isEqualTo("node_4");
        assertThat(line.getField("to")).isEqualTo("node_5");
    }

    @Test
    void testHyphensReplacedOnlyInReferenceFields() {
        ObjectItem line = parseSingle("""
                object overhead_line {
                    name ol-1;
                    parent n-0;
                    from n-1;
                    to n-2;
                    configuration lc-1;
                }
                """);

        assertThat(line.getName()).isEqualTo("ol_1");
        assertThat(line.getField("parent")).isEqualTo("n_0");
        assertThat(line.getField("from")).isEqualTo("n_1");
        assertThat(line.getField("to")).isEqualTo("n_2");
        assertThat(line.getField("configuration")).isEqualTo("lc-1");
    }

    @Test
    void testFuseGetsMeanReplacementTime() {
        ObjectItem fuse = parseSingle("""
                object fuse { name f1; phases ABC; }
                """);

        assertThat(fuse.getField("mean_replacement_time")).isEqualTo("3600.0");
    }

    @Test
    void testFuseKeepsOwnMeanReplacementTime() {
        ObjectItem fuse = parseSingle("""
                object fuse {
                    name f1;
                    mean_replacement_time 60;
                }
                """);

        assertThat(fuse.getField("mean_replacement_time")).isEqualTo("60");
    }

    @Test
    void testRecordersKeptByDefault() {
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        ModelTree tree = GlmParser.parseText(RECORDER_MODEL, GlmModelConfig.defaults(), diagnostics);

        assertThat(tree.size()).isEqualTo(3);
        assertThat(diagnostics.getInfos()).anyMatch(i -> i.startsWith("Kept 2"));
    }

    @Test
    void testRecordersDroppedWhenConfigured() {
        GlmModelConfig config = GlmModelConfig.defaults().toBuilder().dropLegacyRecorders(true).build();
        ModelTree tree = GlmParser.parseText(RECORDER_MODEL, config, new ToolDiagnostics());

        assertThat(tree.size()).isEqualTo(1);
        ObjectItem meter = (ObjectItem) tree.get(0);
        assertThat(meter.getName()).isEqualTo("m1");
        assertThat(meter.hasChildren()).isFalse();
    }

    private static final String RECORDER_MODEL = """
            object meter {
                name m1;
                object recorder {
                    property measured_real_power;
                };
            }
            object collector {
                group class=meter;
            }
            """;

    private ObjectItem parseSingle(String source) {
        ModelTree tree = GlmParser.parseText(source, GlmModelConfig.defaults(), new ToolDiagnostics());
        assertThat(tree.size()).isEqualTo(1);
        return (ObjectItem) tree.get(0);
    }
}
