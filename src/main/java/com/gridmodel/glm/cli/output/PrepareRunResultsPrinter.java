package com.gridmodel.glm.cli.output;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gridmodel.glm.cli.model.PrepareRunOptions;
import com.gridmodel.glm.cli.model.ValidatedPrepareRunOptions;
import com.gridmodel.glm.diagnostics.ToolDiagnostics;
import com.gridmodel.glm.manager.GlmModelManager;
import com.gridmodel.glm.writer.RenderedModel;

/**
 * Responsible only for printing CLI output for the "prepare-run" command.
 * No validation, no execution.
 */
public class PrepareRunResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(PrepareRunResultsPrinter.class);

    public void printBanner(PrepareRunOptions o, ValidatedPrepareRunOptions v) {
        log.info("=================================================");
        log.info("GLM Model Tool: prepare run");
        log.info("=================================================");
        log.info("Input Model: {}", v.getInputPath());
        log.info("Output Model: {}", v.getOutputPath());
        log.info("Start Time: {}", o.getStarttime() != null ? o.getStarttime() : "unchanged");
        log.info("Stop Time: {}", o.getStoptime() != null ? o.getStoptime() : "unchanged");
        log.info("Timezone: {}", o.getTimezone() != null ? o.getTimezone() : "unchanged");
        log.info("Voltage Source: {}", o.getVSource() != null ? o.getVSource() : "unchanged");
        log.info("Profiler: {}", o.getProfiler() != null ? o.getProfiler() : "default");
        log.info("Minimum Timestep: {}", o.getMinimumTimestep() != null ? o.getMinimumTimestep() : "default");
        log.info("Drop Recorders: {}", o.isDropRecorders());

        if (!v.getRemovals().isEmpty()) {
            log.info("-------------------------------------------------");
            log.info("Objects to remove:");
            for (ValidatedPrepareRunOptions.ObjectReference ref : v.getRemovals()) {
                log.info("  {} {}", ref.getType(), ref.getName());
            }
        }

        log.info("=================================================");
    }

    public void printSuccess(ValidatedPrepareRunOptions v, GlmModelManager manager, RenderedModel rendered) {
        log.info("");
        log.info("=================================================");
        log.info("MODEL PREPARED");
        log.info("=================================================");
        log.info("Output Path: {}", v.getOutputPath());
        log.info("Items: {}", manager.getTree().size());
        log.info("Modules: {}", String.join(", ", manager.getIndex().getModuleNames()));

        log.info("");
        log.info("Objects by type:");
        for (Map.Entry<String, Integer> entry : manager.getObjectTypeCounts().entrySet()) {
            log.info("  {}: {}", entry.getKey(), entry.getValue());
        }

        printDiagnostics(manager.getLoadDiagnostics());
        if (rendered.hasWarnings()) {
            log.info("");
            log.info("Output warnings:");
            printLines(rendered.getWarnings());
        }

        log.info("=================================================");
    }

    public void printValidationErrors(List<String> errors) {
        log.error("Invalid options:");
        for (String error : errors) {
            log.error("  - {}", error);
        }
    }

    public void printFailure(String message) {
        log.error("Preparing the model failed: {}", message);
    }

    private void printDiagnostics(ToolDiagnostics diagnostics) {
        if (diagnostics.hasWarnings()) {
            log.info("");
            log.info("Parse warnings:");
            printLines(diagnostics.getWarnings());
        }
        if (!diagnostics.getInfos().isEmpty()) {
            log.info("");
            log.info("Notes:");
            printLines(diagnostics.getInfos());
        }
    }

    private void printLines(List<String> lines) {
        for (String line : lines) {
            log.info("  - {}", line);
        }
    }
}
