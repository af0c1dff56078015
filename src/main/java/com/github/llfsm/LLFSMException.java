package com.github.llfsm;

/**
 * Unified single exception that's thrown by the model, the codecs and the converter. The code enum
 * encapsulates the various error conditions; the message, where given, names the offending path or
 * identifier.
 */
public final class LLFSMException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public LLFSMException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public LLFSMException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public LLFSMException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public LLFSMException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_STATE("Null state or state name is invalid"),
    // 2.
    UNKNOWN_STATE("Referenced state is not a member of this LLFSM"),
    // 3.
    MALFORMED_MACHINE("Machine directory is malformed"),
    // 4.
    MALFORMED_TRANSITION("Transition line is malformed or references an unknown state"),
    // 5.
    MALFORMED_LAYOUT("Layout property list could not be parsed"),
    // 6.
    NOT_A_DIRECTORY("Expected a directory"),
    // 7.
    UNSUPPORTED_OUTPUT_FORMAT("No language binding is registered for the requested format"),
    // 8.
    MISSING_INPUT("Input machine could not be found"),
    // 9.
    INVALID_REQUEST("Conversion request is invalid"),
    // 10.
    IO_FAILURE("Failed to read or write the file system. Check the cause for details");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
