package com.github.llfsm.binding;

import java.util.Locale;

/**
 * Derives C identifiers from machine and state names.
 */
public final class Identifiers {

  private Identifiers() {}

  /**
   * @return the name in lower case with every character that cannot appear in an identifier
   *         removed, prefixed with an underscore if it would start with a digit
   */
  public static String symbol(final String name) {
    final StringBuilder builder = new StringBuilder(name.length());
    for (final char c : name.toLowerCase(Locale.ROOT).toCharArray()) {
      if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_') {
        builder.append(c);
      }
    }
    if (builder.length() == 0 || Character.isDigit(builder.charAt(0))) {
      builder.insert(0, '_');
    }
    return builder.toString();
  }

  public static String macro(final String name) {
    return symbol(name).toUpperCase(Locale.ROOT);
  }

}
