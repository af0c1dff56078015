package com.github.llfsm.binding;

import java.util.Locale;
import java.util.Optional;

/**
 * Output format names accepted on the command line.
 */
public enum Format {
  C("c"), CX("c++"), CPP("cpp"), CXX("cxx"), OBJC("objc"), OBJCX("objc++"), OBJCPP("objcpp"),
  SWIFT("swift"), VERILOG("verilog"), VHDL("vhdl");

  private final String formatName;

  private Format(final String formatName) {
    this.formatName = formatName;
  }

  public String getFormatName() {
    return formatName;
  }

  public static Optional<Format> parse(final String formatName) {
    if (formatName == null) {
      return Optional.empty();
    }
    final String wanted = formatName.trim().toLowerCase(Locale.ROOT);
    for (final Format format : values()) {
      if (format.formatName.equals(wanted)) {
        return Optional.of(format);
      }
    }
    return Optional.empty();
  }

}
