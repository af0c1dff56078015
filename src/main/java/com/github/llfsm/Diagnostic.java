package com.github.llfsm;

import java.util.Objects;

/**
 * A non-fatal problem found while reading persisted machines, located by file path.
 */
public final class Diagnostic {
  private final String location;
  private final String message;

  public Diagnostic(final String location, final String message) {
    this.location = Objects.requireNonNull(location);
    this.message = Objects.requireNonNull(message);
  }

  public String getLocation() {
    return location;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public int hashCode() {
    return Objects.hash(location, message);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Diagnostic)) {
      return false;
    }
    final Diagnostic other = (Diagnostic) obj;
    return location.equals(other.location) && message.equals(other.message);
  }

  @Override
  public String toString() {
    return location + ": " + message;
  }

}
