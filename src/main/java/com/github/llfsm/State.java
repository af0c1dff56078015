package com.github.llfsm;

import java.util.Objects;

import com.github.llfsm.LLFSMException.Code;

/**
 * This object represents immutable metadata about a state: its identity and its human-readable,
 * directory-safe name.
 */
public final class State {
  private final StateID id;
  private final String name;

  public State(final StateID id, final String name) throws LLFSMException {
    if (id == null || name == null) {
      throw new LLFSMException(Code.INVALID_STATE);
    }
    this.id = id;
    this.name = name;
  }

  public State(final String name) throws LLFSMException {
    this(StateID.random(), name);
  }

  public StateID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public State withName(final String name) throws LLFSMException {
    return new State(id, name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, name);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    final State other = (State) obj;
    return id.equals(other.id) && name.equals(other.name);
  }

  @Override
  public String toString() {
    return "State [id=" + id + ", name=" + name + "]";
  }

}
