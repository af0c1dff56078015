package com.github.llfsm;

import java.util.Objects;

/**
 * A named occurrence of a machine type within an {@link Arrangement}. The machine is shared by
 * reference with every other instance of the same type file.
 */
public final class Instance {
  public static final String machineExtension = ".machine";

  private final String name;
  private final String typeFile;
  private final Machine machine;

  public Instance(final String name, final String typeFile, final Machine machine) {
    this.name = Objects.requireNonNull(name, "name");
    this.typeFile = Objects.requireNonNull(typeFile, "typeFile");
    this.machine = Objects.requireNonNull(machine, "machine");
  }

  public String getName() {
    return name;
  }

  public String getTypeFile() {
    return typeFile;
  }

  public Machine getMachine() {
    return machine;
  }

  /**
   * @return the type file without its directory extension
   */
  public String typeName() {
    return stripExtension(typeFile);
  }

  public Instance withName(final String name) {
    return new Instance(name, typeFile, machine);
  }

  public Instance withTypeFile(final String typeFile) {
    return new Instance(name, typeFile, machine);
  }

  public static String stripExtension(final String file) {
    final String base = file.endsWith("/") ? file.substring(0, file.length() - 1) : file;
    final int slash = base.lastIndexOf('/');
    final String last = slash < 0 ? base : base.substring(slash + 1);
    final int dot = last.lastIndexOf('.');
    return dot > 0 ? last.substring(0, dot) : last;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, typeFile, machine.getLanguage().getName(),
        machine.getLlfsm().stateNames());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Instance)) {
      return false;
    }
    final Instance other = (Instance) obj;
    return name.equals(other.name) && typeFile.equals(other.typeFile)
        && machine.isEquivalentTo(other.machine);
  }

  @Override
  public String toString() {
    return "Instance [name=" + name + ", typeFile=" + typeFile + "]";
  }

}
