package com.github.llfsm.fs;

/**
 * A named node of an in-memory file tree: either a {@link RegularFileNode} or a
 * {@link DirectoryNode}.
 */
public abstract class FileNode {
  private String name;

  protected FileNode(final String name) {
    if (name == null || name.isEmpty() || name.contains("/")) {
      throw new IllegalArgumentException("Invalid file name: " + name);
    }
    this.name = name;
  }

  public String getName() {
    return name;
  }

  void rename(final String name) {
    this.name = name;
  }

  public abstract boolean isDirectory();

}
