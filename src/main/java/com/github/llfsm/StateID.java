package com.github.llfsm;

import java.util.Objects;
import java.util.UUID;

/**
 * Opaque identifier of a {@link State}. Two ids are equal iff their underlying random values are.
 */
public final class StateID implements Comparable<StateID> {
  private final UUID uuid;

  private StateID(final UUID uuid) {
    this.uuid = Objects.requireNonNull(uuid);
  }

  public static StateID random() {
    return new StateID(UUID.randomUUID());
  }

  public static StateID of(final UUID uuid) {
    return new StateID(uuid);
  }

  /**
   * @throws IllegalArgumentException if the text is not a canonical UUID string
   */
  public static StateID parse(final String text) {
    return new StateID(UUID.fromString(text.trim()));
  }

  public UUID getUuid() {
    return uuid;
  }

  @Override
  public int compareTo(final StateID other) {
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
    if (!(obj instanceof StateID)) {
      return false;
    }
    return uuid.equals(((StateID) obj).uuid);
  }

  @Override
  public String toString() {
    return uuid.toString();
  }

}
