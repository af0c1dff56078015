package com.github.llfsm.convert;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.llfsm.LLFSMException;
import com.github.llfsm.binding.Formats;
import com.github.llfsm.binding.OutputLanguage;

/**
 * Everything one conversion run needs. Use the {@code ConversionRequestBuilder} to build it.
 *
 * Notes:<br>
 * 1. A null format keeps the language of the first input.<br>
 * 2. Machines are suspensible unless told otherwise.<br>
 * 3. An arrangement always needs an output path; a single machine without one is rewritten in
 * place.<br>
 */
public final class ConversionRequest {
  private final List<Path> inputs;
  private final String format;
  private final boolean arrangement;
  private final boolean suspensible;
  private final boolean introspectable;
  private final Path output;
  private final boolean verbose;

  public List<Path> getInputs() {
    return inputs;
  }

  public String getFormat() {
    return format;
  }

  public boolean isArrangement() {
    return arrangement;
  }

  public boolean isSuspensible() {
    return suspensible;
  }

  public boolean isIntrospectable() {
    return introspectable;
  }

  public Path getOutput() {
    return output;
  }

  public boolean isVerbose() {
    return verbose;
  }

  /**
   * @return the binding of the requested format, or null to keep each machine's own
   */
  public OutputLanguage outputLanguage() throws LLFSMException {
    return format == null ? null : Formats.forName(format, introspectable);
  }

  public final static class ConversionRequestBuilder {
    private final List<Path> inputs = new ArrayList<>();
    private String format;
    private boolean arrangement;
    private boolean suspensible = true;
    private boolean introspectable;
    private Path output;
    private boolean verbose;

    public static ConversionRequestBuilder newBuilder() {
      return new ConversionRequestBuilder();
    }

    public ConversionRequestBuilder input(final Path input) {
      this.inputs.add(input);
      return this;
    }

    public ConversionRequestBuilder inputs(final List<Path> inputs) {
      this.inputs.addAll(inputs);
      return this;
    }

    public ConversionRequestBuilder format(final String format) {
      this.format = format;
      return this;
    }

    public ConversionRequestBuilder arrangement(final boolean arrangement) {
      this.arrangement = arrangement;
      return this;
    }

    public ConversionRequestBuilder suspensible(final boolean suspensible) {
      this.suspensible = suspensible;
      return this;
    }

    public ConversionRequestBuilder introspectable(final boolean introspectable) {
      this.introspectable = introspectable;
      return this;
    }

    public ConversionRequestBuilder output(final Path output) {
      this.output = output;
      return this;
    }

    public ConversionRequestBuilder verbose(final boolean verbose) {
      this.verbose = verbose;
      return this;
    }

    public ConversionRequest build() throws LLFSMException {
      final ConversionRequest request = new ConversionRequest(inputs, format, arrangement,
          suspensible, introspectable, output, verbose);
      request.validate();
      return request;
    }

    private ConversionRequestBuilder() {}
  }

  private void validate() throws LLFSMException {
    // throws UNSUPPORTED_OUTPUT_FORMAT first, naming the format
    outputLanguage();
    final StringBuilder messages = new StringBuilder();
    if (inputs.isEmpty()) {
      messages.append("At least one input machine is required. ");
    }
    if (inputs.contains(null)) {
      messages.append("Input paths cannot be null. ");
    }
    if (arrangement && output == null) {
      messages.append("An arrangement needs an output path. ");
    }
    if (messages.length() > 0) {
      throw new LLFSMException(LLFSMException.Code.INVALID_REQUEST, messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "ConversionRequest [inputs=" + inputs + ", format=" + format + ", arrangement="
        + arrangement + ", suspensible=" + suspensible + ", introspectable=" + introspectable
        + ", output=" + output + ", verbose=" + verbose + "]";
  }

  private ConversionRequest(final List<Path> inputs, final String format,
      final boolean arrangement, final boolean suspensible, final boolean introspectable,
      final Path output, final boolean verbose) {
    this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
    this.format = format;
    this.arrangement = arrangement;
    this.suspensible = suspensible;
    this.introspectable = introspectable;
    this.output = output;
    this.verbose = verbose;
  }

}
