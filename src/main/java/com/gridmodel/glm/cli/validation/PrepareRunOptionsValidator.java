package com.gridmodel.glm.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import com.gridmodel.glm.cli.exception.OptionsValidationException;
import com.gridmodel.glm.cli.model.PrepareRunOptions;
import com.gridmodel.glm.cli.model.ValidatedPrepareRunOptions;
import com.gridmodel.glm.cli.model.ValidatedPrepareRunOptions.ObjectReference;

public class PrepareRunOptionsValidator {

	static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

	public ValidatedPrepareRunOptions validate(PrepareRunOptions o) {
		List<String> errors = new ArrayList<>();

		Path inputPath = null;
		if (o.getInput() == null) {
			errors.add("Input model is required (--input / -i).");
		} else {
			inputPath = o.getInput().toAbsolutePath().normalize();
			if (!Files.isRegularFile(inputPath)) {
				errors.add("Input model does not exist or is not a file: " + inputPath);
			}
		}

		Path outputPath = null;
		if (o.getOutput() == null) {
			errors.add("Output path is required (--output / -o).");
		} else {
			outputPath = o.getOutput().toAbsolutePath().normalize();
			if (Files.isDirectory(outputPath)) {
				errors.add("Output path is a directory: " + outputPath);
			} else if (Files.exists(outputPath) && !o.isForce()) {
				errors.add("Output file already exists: " + outputPath + ". Use --force to overwrite.");
			}
		}

		if (o.getStarttime() == null && o.getStoptime() == null && o.getTimezone() == null) {
			errors.add("At least one of --starttime, --stoptime or --timezone is required.");
		}
		if (o.getTimezone() != null && o.getTimezone().isBlank()) {
			errors.add("Timezone must not be blank.");
		}

		LocalDateTime starttime = parseTime("--starttime", o.getStarttime(), errors);
		LocalDateTime stoptime = parseTime("--stoptime", o.getStoptime(), errors);
		if (starttime != null && stoptime != null && starttime.isAfter(stoptime)) {
			errors.add("Start time " + o.getStarttime() + " is after stop time " + o.getStoptime() + ".");
		}

		if (o.getVSource() != null && !Double.isFinite(o.getVSource())) {
			errors.add("Voltage source must be a finite number. Got: " + o.getVSource());
		}
		if (o.getProfiler() != null && o.getProfiler() != 0 && o.getProfiler() != 1) {
			errors.add("Profiler must be 0 or 1. Got: " + o.getProfiler());
		}
		if (o.getMinimumTimestep() != null && o.getMinimumTimestep() <= 0) {
			errors.add("Minimum timestep must be > 0. Got: " + o.getMinimumTimestep());
		}

		List<ObjectReference> removals = parseRemovals(o.getRemoveObjects(), errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedPrepareRunOptions(inputPath, outputPath, starttime, stoptime, removals);
	}

	private static LocalDateTime parseTime(String option, String raw, List<String> errors) {
		if (raw == null) {
			return null;
		}
		try {
			return LocalDateTime.parse(raw.trim(), TIME_FORMAT);
		} catch (DateTimeParseException e) {
			errors.add(option + " must look like 2001-01-01 00:00:00. Got: " + raw);
			return null;
		}
	}

	private static List<ObjectReference> parseRemovals(List<String> raw, List<String> errors) {
		if (raw == null || raw.isEmpty()) {
			return List.of();
		}

		List<ObjectReference> result = new ArrayList<>();
		for (String value : raw) {
			int colon = value.indexOf(':');
			if (colon <= 0 || colon == value.length() - 1) {
				errors.add("--remove-object must be type:name. Got: " + value);
				continue;
			}
			result.add(new ObjectReference(value.substring(0, colon).trim(), value.substring(colon + 1).trim()));
		}
		return result;
	}
}
