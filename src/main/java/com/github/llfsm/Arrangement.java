package com.github.llfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An ordered collection of named machine instances that are built and run together.
 */
public final class Arrangement {
  private final List<Instance> namedInstances;

  public Arrangement(final List<Instance> namedInstances) {
    this.namedInstances = Collections.unmodifiableList(new ArrayList<>(namedInstances));
  }

  public List<Instance> getNamedInstances() {
    return namedInstances;
  }

  public int size() {
    return namedInstances.size();
  }

  /**
   * @return a copy whose clashing instance names are suffixed with {@code _1}, {@code _2}, ... in
   *         encounter order
   */
  public Arrangement uniquelyNamed() {
    final Set<String> taken = new HashSet<>();
    final List<Instance> renamed = new ArrayList<>(namedInstances.size());
    for (final Instance instance : namedInstances) {
      String name = instance.getName();
      for (int suffix = 1; taken.contains(name); suffix++) {
        name = instance.getName() + "_" + suffix;
      }
      taken.add(name);
      renamed.add(name.equals(instance.getName()) ? instance : instance.withName(name));
    }
    return new Arrangement(renamed);
  }

  /**
   * @return the number of distinct machine objects referenced by the instances
   */
  public int machineCount() {
    final Map<Machine, Boolean> distinct = new IdentityHashMap<>();
    for (final Instance instance : namedInstances) {
      distinct.put(instance.getMachine(), Boolean.TRUE);
    }
    return distinct.size();
  }

  public int stateCount() {
    int count = 0;
    for (final Instance instance : namedInstances) {
      count += instance.getMachine().getLlfsm().stateCount();
    }
    return count;
  }

  public int transitionCount() {
    int count = 0;
    for (final Instance instance : namedInstances) {
      count += instance.getMachine().getLlfsm().transitionCount();
    }
    return count;
  }

  @Override
  public int hashCode() {
    return namedInstances.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    return obj instanceof Arrangement
        && namedInstances.equals(((Arrangement) obj).namedInstances);
  }

  @Override
  public String toString() {
    return "Arrangement [namedInstances=" + namedInstances + "]";
  }

}
