package com.github.llfsm.binding;

import java.util.Optional;

import com.github.llfsm.LLFSMException;
import com.github.llfsm.LLFSMException.Code;

/**
 * Registry mapping formats and persisted language names to bindings.
 */
public final class Formats {

  private Formats() {}

  /**
   * @return the binding for the format, or empty if the format has none
   */
  public static Optional<OutputLanguage> outputLanguage(final Format format,
      final boolean introspectable) {
    switch (format) {
      case C:
        return Optional.of(new CBinding(introspectable));
      case CX:
      case CPP:
      case CXX:
      case OBJC:
      case OBJCX:
      case OBJCPP:
        return Optional.of(new ObjCPPBinding());
      case VHDL:
        return Optional.of(new VHDLBinding());
      default:
        return Optional.empty();
    }
  }

  /**
   * Resolves a format name, failing for unknown names and for formats without a binding.
   */
  public static OutputLanguage forName(final String formatName, final boolean introspectable)
      throws LLFSMException {
    final Optional<Format> format = Format.parse(formatName);
    if (!format.isPresent()) {
      throw new LLFSMException(Code.UNSUPPORTED_OUTPUT_FORMAT,
          "Unknown output format '" + formatName + "'");
    }
    final Optional<OutputLanguage> language = outputLanguage(format.get(), introspectable);
    if (!language.isPresent()) {
      throw new LLFSMException(Code.UNSUPPORTED_OUTPUT_FORMAT,
          "No language binding for output format '" + formatName + "'");
    }
    return language.get();
  }

  /**
   * @return the binding for the contents of a {@code Language} file, or empty
   */
  public static Optional<OutputLanguage> forLanguageName(final String languageName) {
    final Optional<Format> format = Format.parse(languageName);
    return format.isPresent() ? outputLanguage(format.get(), false) : Optional.empty();
  }

}
