package com.gridmodel.glm.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "prepare-run" command. No validation, no
 * execution logic, no printing.
 */
@Getter
public class PrepareRunOptions {

	@Option(names = { "--input", "-i" }, required = true, description = "GLM model to read")
	private Path input;

	@Option(names = { "--output", "-o" }, required = true, description = "Where to write the prepared model")
	private Path output;

	@Option(names = { "--starttime" }, description = "Simulation start, yyyy-MM-dd HH:mm:ss")
	private String starttime;

	@Option(names = { "--stoptime" }, description = "Simulation stop, yyyy-MM-dd HH:mm:ss")
	private String stoptime;

	@Option(names = { "--timezone" }, description = "Clock timezone, for example EST+5EDT")
	private String timezone;

	@Option(names = { "--v-source" }, description = "Substation voltage defined as VSOURCE (default: keep the model's own)")
	private Double vSource;

	@Option(names = { "--profiler" }, description = "0 or 1 (default: 0)")
	private Integer profiler;

	@Option(names = { "--minimum-timestep" }, description = "Minimum timestep in seconds (default: 60)")
	private Integer minimumTimestep;

	@Option(names = {
			"--remove-object" }, description = "Object to remove before preparing, as type:name (repeatable)")
	private List<String> removeObjects = new ArrayList<>();

	@Option(names = { "--drop-recorders" }, description = "Remove recorder, group_recorder and collector objects")
	private boolean dropRecorders;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;

}
