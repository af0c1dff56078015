package com.github.llfsm.binding;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Text building blocks shared by all emitters. Every method takes lines (which may themselves
 * span several lines) and returns one newline-joined block; {@link #IGNORED} lines are dropped.
 */
public final class Code {
  /** Marker for a line that should not appear in the enclosing block. */
  public static final String IGNORED = "\n%%i%%\n";
  static final String fourSpaces = "    ";

  private Code() {}

  public static String block(final String... lines) {
    return block(Arrays.asList(lines));
  }

  public static String block(final List<String> lines) {
    final StringBuilder builder = new StringBuilder();
    boolean first = true;
    for (final String line : lines) {
      if (IGNORED.equals(line)) {
        continue;
      }
      if (!first) {
        builder.append('\n');
      }
      builder.append(line);
      first = false;
    }
    return builder.toString();
  }

  /**
   * Indents every non-empty line of the block by four spaces.
   */
  public static String indentedBlock(final String... lines) {
    return indentedBlockWith(fourSpaces, lines);
  }

  public static String indentedBlockWith(final String indentation, final String... lines) {
    return indent(indentation, block(lines));
  }

  /**
   * The block, indented, between a line holding an opening and a line holding a closing brace.
   */
  public static String bracedBlock(final String... lines) {
    return bracketedBlock("{", "}", lines);
  }

  public static String bracketedBlock(final String opening, final String closing,
      final String... lines) {
    final String body = indent(fourSpaces, block(lines));
    return body.isEmpty() ? opening + "\n" + closing : opening + "\n" + body + "\n" + closing;
  }

  /**
   * Wraps the block in an include guard derived from the logical file name.
   */
  public static String includeFile(final String name, final String... lines) {
    final String token = guardToken(name);
    return block("#ifndef " + token, "#define " + token, "", block(lines), "",
        "#endif /* " + token + " */") + "\n";
  }

  /**
   * Upper cases the name, drops leading characters that are not letters and joins the remaining
   * alphanumeric runs with underscores.
   */
  public static String guardToken(final String name) {
    final String upper = name.toUpperCase(Locale.ROOT);
    int start = 0;
    while (start < upper.length() && !isAsciiLetter(upper.charAt(start))) {
      start++;
    }
    final List<String> words = new ArrayList<>();
    for (final String word : upper.substring(start).split("[^A-Z0-9]+")) {
      if (!word.isEmpty()) {
        words.add(word);
      }
    }
    return String.join("_", words);
  }

  public static <T> String forEach(final Iterable<T> items, final Function<T, String> template) {
    final List<String> lines = new ArrayList<>();
    for (final T item : items) {
      lines.add(template.apply(item));
    }
    return lines.isEmpty() ? IGNORED : block(lines);
  }

  public static <T> String enumerating(final List<T> items,
      final BiFunction<Integer, T, String> template) {
    final List<String> lines = new ArrayList<>();
    for (int i = 0; i < items.size(); i++) {
      lines.add(template.apply(i, items.get(i)));
    }
    return lines.isEmpty() ? IGNORED : block(lines);
  }

  /**
   * @return the block if the condition holds, otherwise {@link #IGNORED}
   */
  public static String when(final boolean condition, final String... lines) {
    return condition ? block(lines) : IGNORED;
  }

  public static String either(final boolean condition, final String then,
      final String otherwise) {
    return condition ? then : otherwise;
  }

  static String indent(final String indentation, final String text) {
    if (text.isEmpty()) {
      return text;
    }
    final String[] lines = text.split("\n", -1);
    final StringBuilder builder = new StringBuilder();
    for (int i = 0; i < lines.length; i++) {
      if (i > 0) {
        builder.append('\n');
      }
      if (!lines[i].isEmpty()) {
        builder.append(indentation).append(lines[i]);
      }
    }
    return builder.toString();
  }

  private static boolean isAsciiLetter(final char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
  }

}
