package com.github.llfsm.layout;

import java.util.Objects;

/**
 * Presentation metadata of a single transition: the bezier path it is drawn along.
 */
public final class TransitionLayout {
  private final Path path;

  public TransitionLayout(final Path path) {
    this.path = Objects.requireNonNull(path);
  }

  public Path getPath() {
    return path;
  }

  @Override
  public int hashCode() {
    return path.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    return obj instanceof TransitionLayout && path.equals(((TransitionLayout) obj).path);
  }

  @Override
  public String toString() {
    return "TransitionLayout [path=" + path + "]";
  }

}
