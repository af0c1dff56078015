package com.github.llfsm.binding;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Free-form, user editable code sections inserted into generated code. Sections are keyed by the
 * section names a binding declares; a section that was never set reads as empty.
 */
public final class Boilerplate {
  private final Map<String, String> sections = new LinkedHashMap<>();

  public String get(final String section) {
    final String code = sections.get(section);
    return code == null ? "" : code;
  }

  public Boilerplate set(final String section, final String code) {
    sections.put(section, code == null ? "" : code);
    return this;
  }

  public Map<String, String> getSections() {
    return Collections.unmodifiableMap(sections);
  }

  public boolean isEmpty() {
    for (final String code : sections.values()) {
      if (!code.isEmpty()) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    return sections.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    return obj instanceof Boilerplate && sections.equals(((Boilerplate) obj).sections);
  }

  @Override
  public String toString() {
    return "Boilerplate [sections=" + sections.keySet() + "]";
  }

}
