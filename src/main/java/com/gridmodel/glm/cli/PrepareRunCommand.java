package com.gridmodel.glm.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gridmodel.glm.cli.exception.OptionsValidationException;
import com.gridmodel.glm.cli.model.PrepareRunOptions;
import com.gridmodel.glm.cli.model.ValidatedPrepareRunOptions;
import com.gridmodel.glm.cli.model.ValidatedPrepareRunOptions.ObjectReference;
import com.gridmodel.glm.cli.output.PrepareRunResultsPrinter;
import com.gridmodel.glm.cli.validation.PrepareRunOptionsValidator;
import com.gridmodel.glm.config.GlmModelConfig;
import com.gridmodel.glm.exception.GlmModelException;
import com.gridmodel.glm.manager.GlmModelManager;
import com.gridmodel.glm.manager.RunComponentsRequest;
import com.gridmodel.glm.model.ObjectItem;
import com.gridmodel.glm.storage.FileModelStorage;
import com.gridmodel.glm.storage.ModelStorage;
import com.gridmodel.glm.writer.RenderedModel;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that makes a GLM model ready to simulate: sets the clock,
 * adds the powerflow/generators modules and run settings, and writes the
 * result.
 */
@Command(
        name = "prepare-run",
        mixinStandardHelpOptions = true,
        version = "glm-model-tool 1.0.0",
        description = "Adds the clock, solver modules and run settings a GLM model needs before simulation."
)
public class PrepareRunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PrepareRunCommand.class);

    @Mixin
    private PrepareRunOptions options = new PrepareRunOptions();

    private final PrepareRunOptionsValidator validator = new PrepareRunOptionsValidator();
    private final PrepareRunResultsPrinter printer = new PrepareRunResultsPrinter();
    private final ModelStorage storage;

    public PrepareRunCommand() {
        this(new FileModelStorage());
    }

    public PrepareRunCommand(ModelStorage storage) {
        this.storage = storage;
    }

    @Override
    public Integer call() {
        ValidatedPrepareRunOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e.getErrors());
            return 1;
        }

        printer.printBanner(options, validated);

        try {
            GlmModelConfig config = GlmModelConfig.defaults().toBuilder()
                    .dropLegacyRecorders(options.isDropRecorders())
                    .build();
            GlmModelManager manager = GlmModelManager.load(validated.getInputPath(), storage, config);

            for (ObjectReference ref : validated.getRemovals()) {
                manager.removeItem(ObjectItem.builder()
                        .type(ref.getType())
                        .field(ObjectItem.NAME, ref.getName())
                        .build());
                log.info("Removed object {} {}", ref.getType(), ref.getName());
            }

            manager.addRunComponents(RunComponentsRequest.builder()
                    .starttime(validated.getStarttime())
                    .stoptime(validated.getStoptime())
                    .timezone(options.getTimezone())
                    .vSource(options.getVSource())
                    .profiler(options.getProfiler())
                    .minimumTimestep(options.getMinimumTimestep())
                    .build());

            RenderedModel rendered = manager.writeModel(validated.getOutputPath(), storage);
            printer.printSuccess(validated, manager, rendered);
            return 0;

        } catch (GlmModelException e) {
            printer.printFailure(e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("I/O error while preparing model", e);
            printer.printFailure(e.getMessage());
            return 1;
        }
    }
}
