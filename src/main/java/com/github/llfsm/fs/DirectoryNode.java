package com.github.llfsm.fs;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A directory of the in-memory file tree. Children are kept sorted by name so that trees
 * materialise in a deterministic order.
 */
public final class DirectoryNode extends FileNode {
  private final Map<String, FileNode> children = new TreeMap<>();

  public DirectoryNode(final String name) {
    super(name);
  }

  public DirectoryNode(final String name, final Collection<? extends FileNode> children) {
    super(name);
    for (final FileNode child : children) {
      put(child);
    }
  }

  @Override
  public boolean isDirectory() {
    return true;
  }

  /**
   * Renames this directory. Only allowed while it is not a child of another directory.
   */
  public void setName(final String name) {
    if (name == null || name.isEmpty() || name.contains("/")) {
      throw new IllegalArgumentException("Invalid directory name: " + name);
    }
    rename(name);
  }

  /**
   * Adds the node, replacing any child of the same name.
   */
  public FileNode put(final FileNode node) {
    return children.put(node.getName(), node);
  }

  public void putText(final String name, final String text) {
    put(new RegularFileNode(name, text));
  }

  public void putBytes(final String name, final byte[] contents) {
    put(new RegularFileNode(name, contents));
  }

  public FileNode remove(final String name) {
    return children.remove(name);
  }

  public boolean contains(final String name) {
    return children.containsKey(name);
  }

  public Optional<FileNode> get(final String name) {
    return Optional.ofNullable(children.get(name));
  }

  public Optional<RegularFileNode> getFile(final String name) {
    final FileNode node = children.get(name);
    return node instanceof RegularFileNode ? Optional.of((RegularFileNode) node)
        : Optional.empty();
  }

  public Optional<String> getText(final String name) {
    return getFile(name).map(RegularFileNode::getText);
  }

  public Optional<byte[]> getBytes(final String name) {
    return getFile(name).map(RegularFileNode::getContents);
  }

  public Optional<DirectoryNode> getDirectory(final String name) {
    final FileNode node = children.get(name);
    return node instanceof DirectoryNode ? Optional.of((DirectoryNode) node) : Optional.empty();
  }

  public Collection<FileNode> getChildren() {
    return Collections.unmodifiableCollection(children.values());
  }

  public List<String> getChildNames() {
    return new ArrayList<>(children.keySet());
  }

  public List<DirectoryNode> getDirectories() {
    final List<DirectoryNode> directories = new ArrayList<>();
    for (final FileNode child : children.values()) {
      if (child instanceof DirectoryNode) {
        directories.add((DirectoryNode) child);
      }
    }
    return directories;
  }

  public int size() {
    return children.size();
  }

  @Override
  public int hashCode() {
    return 31 * getName().hashCode() + children.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof DirectoryNode)) {
      return false;
    }
    final DirectoryNode other = (DirectoryNode) obj;
    return getName().equals(other.getName()) && children.equals(other.children);
  }

  @Override
  public String toString() {
    return "DirectoryNode [name=" + getName() + ", children=" + children.keySet() + "]";
  }

}
