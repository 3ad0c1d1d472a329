package com.gridmodel.glm;

import com.gridmodel.glm.cli.PrepareRunCommand;
import picocli.CommandLine;

/**
 * Main entry point for the GLM model tool.
 * Reads a GridLAB-D model, prepares it for a simulation run and writes it back out.
 */
public class GlmToolApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PrepareRunCommand()).execute(args);
        System.exit(exitCode);
    }
}
