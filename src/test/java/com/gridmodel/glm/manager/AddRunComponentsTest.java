package com.gridmodel.glm.manager;

import com.gridmodel.glm.exception.InvalidTypeException;
import com.gridmodel.glm.exception.InvalidValueException;
import com.gridmodel.glm.model.DirectiveItem;
import com.gridmodel.glm.model.ModuleItem;
import com.gridmodel.glm.model.ObjectItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.LocalDateTime;

import static com.gridmodel.glm.manager.GlmModelManagerTest.resource;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for preparing a model for a simulation run.
 */
class AddRunComponentsTest {

    private static final LocalDateTime START = LocalDateTime.of(2013, 7, 1, 0, 0);
    private static final LocalDateTime STOP = LocalDateTime.of(2013, 7, 1, 12, 0);

    private CountingManager manager;

    @BeforeEach
    void setUp() throws IOException {
        manager = new CountingManager(resource("simple.glm"));
    }

    @Test
    void testPrependsRunComponentsInOrder() {
        manager.addRunComponents(request().build());

        assertThat(manager.getPrependKey()).isEqualTo(-5);
        assertThat(directive(-1).getArgument()).isEqualTo("minimum_timestep=60");
        assertThat(directive(-2).getArgument()).isEqualTo("profiler=0");
        assertThat(directive(-3).getArgument()).isEqualTo("relax_naming_rules=1");
        assertThat(((ModuleItem) manager.getTree().get(-4)).getName()).isEqualTo("powerflow");

        assertThat(manager.renderModel().getText()).startsWith("""
                module powerflow {
                \tsolver_method NR;
                \tline_capacitance TRUE;
                }

                #set relax_naming_rules=1
                #set profiler=0
                #set minimum_timestep=60
                module mysql;
                """);
    }

    @Test
    void testVoltageSourceDefinedLast() {
        manager.addRunComponents(request().vSource(7200.5).build());

        assertThat(manager.getPrependKey()).isEqualTo(-6);
        assertThat(directive(-5).getArgument()).isEqualTo("VSOURCE=7200.5");
        assertThat(manager.renderModel().getText()).startsWith("#define VSOURCE=7200.5\nmodule powerflow {\n");
    }

    @Test
    void testNoVoltageSourceWithoutValue() {
        manager.addRunComponents(request().build());

        assertThat(manager.renderModel().getText()).doesNotContain("VSOURCE");
    }

    @Test
    void testExistingSettingsAreReplaced() {
        manager.addRunComponents(request().minimumTimestep(1).build());

        assertThat(manager.getTree().containsKey(0)).isFalse();
        assertThat(manager.getTree().containsKey(3)).isFalse();
        assertThat(manager.getIndex().getModule("powerflow").get().getKey()).isEqualTo(-4);

        String text = manager.renderModel().getText();
        assertThat(text).contains("#set minimum_timestep=1\n").doesNotContain("minimum_timestep=60");
    }

    @Test
    void testRunningTwiceDoesNotDuplicate() {
        manager.addRunComponents(request().build());
        manager.addRunComponents(request().profiler(1).vSource(7200).build());

        String text = manager.renderModel().getText();
        assertThat(text.split("#set profiler=", -1)).hasSize(2);
        assertThat(text).contains("#set profiler=1\n");
        assertThat(text.split("module powerflow", -1)).hasSize(2);
        assertThat(text).contains("#define VSOURCE=7200\n");
    }

    @Test
    void testClockHandledExactlyOnce() {
        manager.addRunComponents(request().timezone("EST+5EDT").build());

        assertThat(manager.clockCalls).isEqualTo(1);
        assertThat(manager.findClock().get().getField("timezone")).isEqualTo("EST+5EDT");
        assertThat(manager.findClock().get().getField("starttime")).isEqualTo("'2013-07-01 00:00:00'");
    }

    @Test
    void testNoGeneratorsWithoutDistributedGeneration() {
        manager.addRunComponents(request().build());

        assertThat(manager.modulePresent("generators")).isFalse();
    }

    @Test
    void testGeneratorsAddedForSolarModel() throws IOException {
        GlmModelManager solar = new GlmModelManager(resource("solar.glm"));

        solar.addRunComponents(request().build());

        assertThat(solar.modulePresent("generators")).isTrue();
        assertThat(solar.findObject("solar", "pv_1")).isPresent();

        assertThat(((ModuleItem) solar.getTree().get(-5)).getName()).isEqualTo("generators");
        assertThat(((ModuleItem) solar.getTree().get(-4)).getName()).isEqualTo("powerflow");

        String text = solar.renderModel().getText();
        assertThat(text).startsWith("module generators {\n}\n\nmodule powerflow {\n");
        assertThat(text).contains("#define VSOURCE=66400\n");
        assertThat(text).contains("\tsolver_method NR;").doesNotContain("FBS");

        solar.addRunComponents(request().build());
        assertThat(solar.renderModel().getText().split("module generators", -1)).hasSize(2);
    }

    @Test
    void testExistingVoltageSourceReplacedWhenGiven() throws IOException {
        GlmModelManager solar = new GlmModelManager(resource("solar.glm"));

        solar.addRunComponents(request().vSource(7200).build());

        String text = solar.renderModel().getText();
        assertThat(text).startsWith("#define VSOURCE=7200\nmodule generators {\n}\n");
        assertThat(text).doesNotContain("VSOURCE=66400");
    }

    @Test
    void testNoGeneratorsAfterGenerationRemoved() throws IOException {
        GlmModelManager solar = new GlmModelManager(resource("solar.glm"));
        solar.removeItem(ObjectItem.builder().type("inverter").field("name", "inv_1").build());

        assertThat(solar.findObject("solar", "pv_1")).isEmpty();

        solar.addRunComponents(request().build());

        assertThat(solar.modulePresent("generators")).isFalse();
        assertThat(solar.renderModel().getText()).doesNotContain("module generators");
    }

    @Test
    void testInvalidProfilerChangesNothing() {
        int sizeBefore = manager.getTree().size();

        assertThatThrownBy(() -> manager.addRunComponents(request().profiler(2).build()))
                .isInstanceOf(InvalidValueException.class);
        assertThatThrownBy(() -> manager.addRunComponents(request().profiler(0.5).build()))
                .isInstanceOf(InvalidTypeException.class);

        assertThat(manager.clockCalls).isZero();
        assertThat(manager.getTree().size()).isEqualTo(sizeBefore);
        assertThat(manager.getPrependKey()).isEqualTo(-1);
    }

    @Test
    void testInvalidMinimumTimestepAndVoltage() {
        assertThatThrownBy(() -> manager.addRunComponents(request().minimumTimestep(1.5).build()))
                .isInstanceOf(InvalidTypeException.class);
        assertThatThrownBy(() -> manager.addRunComponents(request().minimumTimestep(0).build()))
                .isInstanceOf(InvalidValueException.class);
        assertThatThrownBy(() -> manager.addRunComponents(request().vSource(Double.NaN).build()))
                .isInstanceOf(InvalidValueException.class);
        assertThat(manager.clockCalls).isZero();
    }

    @Test
    void testInvalidClockArgumentsChangeNothing() {
        assertThatThrownBy(() -> manager.addRunComponents(request().starttime(STOP).stoptime(START).build()))
                .isInstanceOf(InvalidValueException.class);

        assertThat(manager.getPrependKey()).isEqualTo(-1);
        assertThat(manager.modulePresent("powerflow")).isTrue();
        assertThat(manager.getIndex().getModule("powerflow").get().getKey()).isEqualTo(3);
    }

    private DirectiveItem directive(int key) {
        return (DirectiveItem) manager.getTree().get(key);
    }

    private static RunComponentsRequest.RunComponentsRequestBuilder request() {
        return RunComponentsRequest.builder().starttime(START).stoptime(STOP);
    }

    /**
     * Counts calls to the clock helper.
     */
    static class CountingManager extends GlmModelManager {
        int clockCalls;

        CountingManager(String modelText) {
            super(modelText);
        }

        @Override
        public void addOrModifyClock(LocalDateTime starttime, LocalDateTime stoptime, String timezone) {
            clockCalls++;
            super.addOrModifyClock(starttime, stoptime, timezone);
        }
    }
}
