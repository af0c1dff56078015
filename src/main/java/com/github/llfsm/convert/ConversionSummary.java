package com.github.llfsm.convert;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

import com.github.llfsm.Diagnostic;

/**
 * What a conversion run produced.
 */
public final class ConversionSummary {
  private final int machineCount;
  private final int stateCount;
  private final int transitionCount;
  private final Path output;
  private final List<Diagnostic> diagnostics;

  ConversionSummary(final int machineCount, final int stateCount, final int transitionCount,
      final Path output, final List<Diagnostic> diagnostics) {
    this.machineCount = machineCount;
    this.stateCount = stateCount;
    this.transitionCount = transitionCount;
    this.output = output;
    this.diagnostics = Collections.unmodifiableList(diagnostics);
  }

  public int getMachineCount() {
    return machineCount;
  }

  public int getStateCount() {
    return stateCount;
  }

  public int getTransitionCount() {
    return transitionCount;
  }

  public Path getOutput() {
    return output;
  }

  /**
   * @return the problems reported while reading the inputs
   */
  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  /**
   * @return e.g. {@code 2 FSMs with 4 states and 4 transitions}
   */
  public String describe() {
    return machineCount + " FSMs with " + stateCount + " states and " + transitionCount
        + " transitions";
  }

  @Override
  public String toString() {
    return "ConversionSummary [machineCount=" + machineCount + ", stateCount=" + stateCount
        + ", transitionCount=" + transitionCount + ", output=" + output + ", diagnostics="
        + diagnostics.size() + "]";
  }

}
