package com.gridmodel.glm.diagnostics;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Non-fatal findings (warnings and infos) accumulated while parsing or
 * rendering a model. Operations that record here still complete.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ToolDiagnostics {
  private final List<String> warnings = new ArrayList<>();
  private final List<String> infos = new ArrayList<>();

  public boolean hasWarnings() {
	  return !this.warnings.isEmpty();
  }

}
