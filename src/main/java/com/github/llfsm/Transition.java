package com.github.llfsm;

import java.util.Objects;

/**
 * A directed, labelled edge between two states of one {@link LLFSM}. The label is an opaque guard
 * expression that is handed verbatim to the code emitters.
 */
public final class Transition {
  private final TransitionID id;
  private final String label;
  private final StateID source;
  private final StateID target;

  public Transition(final TransitionID id, final String label, final StateID source,
      final StateID target) {
    this.id = Objects.requireNonNull(id, "id");
    this.label = label == null ? "" : label;
    this.source = Objects.requireNonNull(source, "source");
    this.target = Objects.requireNonNull(target, "target");
  }

  public Transition(final String label, final StateID source, final StateID target) {
    this(TransitionID.random(), label, source, target);
  }

  public TransitionID getId() {
    return id;
  }

  public String getLabel() {
    return label;
  }

  public StateID getSource() {
    return source;
  }

  public StateID getTarget() {
    return target;
  }

  public Transition withLabel(final String label) {
    return new Transition(id, label, source, target);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, label, source, target);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    final Transition other = (Transition) obj;
    return id.equals(other.id) && label.equals(other.label) && source.equals(other.source)
        && target.equals(other.target);
  }

  @Override
  public String toString() {
    return "Transition [id=" + id + ", label=" + label + ", source=" + source + ", target="
        + target + "]";
  }

}
