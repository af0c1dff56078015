package com.github.llfsm.fs;

import java.nio.file.Path;
import java.util.List;

import com.github.llfsm.LLFSMException;
import com.github.llfsm.LLFSMException.Code;

/**
 * The only file system primitives the codecs rely on. Whole trees are read and written through
 * the default methods, so an adapter only has to supply byte-level access and directory listing.
 */
public interface FileSystemAdapter {

  boolean exists(Path path);

  boolean isDirectory(Path path);

  byte[] readBytes(Path path) throws LLFSMException;

  void writeBytes(Path path, byte[] contents) throws LLFSMException;

  /**
   * @return the names of the entries of the given directory
   */
  List<String> list(Path directory) throws LLFSMException;

  void createDirectories(Path directory) throws LLFSMException;

  /**
   * Reads the directory at the given path, recursively, into memory.
   */
  default DirectoryNode readTree(final Path path) throws LLFSMException {
    if (!isDirectory(path)) {
      throw new LLFSMException(Code.NOT_A_DIRECTORY, "Not a directory: " + path);
    }
    final DirectoryNode directory = new DirectoryNode(path.getFileName().toString());
    for (final String name : list(path)) {
      final Path child = path.resolve(name);
      if (isDirectory(child)) {
        directory.put(readTree(child));
      } else {
        directory.putBytes(name, readBytes(child));
      }
    }
    return directory;
  }

  /**
   * Writes the tree into the directory at the given path, replacing files one at a time. Files
   * already present but absent from the tree are left alone.
   */
  default void writeTree(final DirectoryNode directory, final Path path) throws LLFSMException {
    createDirectories(path);
    for (final FileNode child : directory.getChildren()) {
      final Path target = path.resolve(child.getName());
      if (child instanceof DirectoryNode) {
        writeTree((DirectoryNode) child, target);
      } else {
        writeBytes(target, ((RegularFileNode) child).getContents());
      }
    }
  }

}
