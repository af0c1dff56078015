package com.github.llfsm.fs;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A regular file: a name and an opaque byte blob.
 */
public final class RegularFileNode extends FileNode {
  private final byte[] contents;

  public RegularFileNode(final String name, final byte[] contents) {
    super(name);
    this.contents = contents == null ? new byte[0] : contents.clone();
  }

  public RegularFileNode(final String name, final String text) {
    this(name, text.getBytes(StandardCharsets.UTF_8));
  }

  public byte[] getContents() {
    return contents.clone();
  }

  public String getText() {
    return new String(contents, StandardCharsets.UTF_8);
  }

  public int size() {
    return contents.length;
  }

  @Override
  public boolean isDirectory() {
    return false;
  }

  @Override
  public int hashCode() {
    return 31 * getName().hashCode() + Arrays.hashCode(contents);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof RegularFileNode)) {
      return false;
    }
    final RegularFileNode other = (RegularFileNode) obj;
    return getName().equals(other.getName()) && Arrays.equals(contents, other.contents);
  }

  @Override
  public String toString() {
    return "RegularFileNode [name=" + getName() + ", size=" + contents.length + "]";
  }

}
