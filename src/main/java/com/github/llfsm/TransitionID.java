package com.github.llfsm;

import java.util.Objects;
import java.util.UUID;

/**
 * Opaque identifier of a {@link Transition}. Two ids are equal iff their underlying random values are.
 */
public final class TransitionID implements Comparable<TransitionID> {
  private final UUID uuid;

  private TransitionID(final UUID uuid) {
    this.uuid = Objects.requireNonNull(uuid);
  }

  public static TransitionID random() {
    return new TransitionID(UUID.randomUUID());
  }

  public static TransitionID of(final UUID uuid) {
    return new TransitionID(uuid);
  }

  /**
   * @throws IllegalArgumentException if the text is not a canonical UUID string
   */
  public static TransitionID parse(final String text) {
    return new TransitionID(UUID.fromString(text.trim()));
  }

  public UUID getUuid() {
    return uuid;
  }

  @Override
  public int compareTo(final TransitionID other) {
    return uuid.compareTo(other.uuid);
  }

  @Override
  public int hashCode() {
    return uuid.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof TransitionID)) {
      return false;
    }
    return uuid.equals(((TransitionID) obj).uuid);
  }

  @Override
  public String toString() {
    return uuid.toString();
  }

}
