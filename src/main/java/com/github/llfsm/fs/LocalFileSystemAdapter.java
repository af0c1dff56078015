package com.github.llfsm.fs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.llfsm.LLFSMException;
import com.github.llfsm.LLFSMException.Code;

/**
 * {@link FileSystemAdapter} backed by the default java.nio file system. I/O failures surface
 * immediately as {@link Code#IO_FAILURE} naming the path; nothing is retried.
 */
public final class LocalFileSystemAdapter implements FileSystemAdapter {
  private static final Logger logger =
      LogManager.getLogger(LocalFileSystemAdapter.class.getSimpleName());

  @Override
  public boolean exists(final Path path) {
    return Files.exists(path);
  }

  @Override
  public boolean isDirectory(final Path path) {
    return Files.isDirectory(path);
  }

  @Override
  public byte[] readBytes(final Path path) throws LLFSMException {
    try {
      return Files.readAllBytes(path);
    } catch (IOException ioException) {
      throw new LLFSMException(Code.IO_FAILURE, "Cannot read " + path + ": " + ioException,
          ioException);
    }
  }

  @Override
  public void writeBytes(final Path path, final byte[] contents) throws LLFSMException {
    try {
      Files.write(path, contents);
      logger.debug("Wrote {} bytes to {}", contents.length, path);
    } catch (IOException ioException) {
      throw new LLFSMException(Code.IO_FAILURE, "Cannot write " + path + ": " + ioException,
          ioException);
    }
  }

  @Override
  public List<String> list(final Path directory) throws LLFSMException {
    try (Stream<Path> entries = Files.list(directory)) {
      final List<String> names = new ArrayList<>();
      entries.forEach(entry -> names.add(entry.getFileName().toString()));
      Collections.sort(names);
      return names;
    } catch (IOException ioException) {
      throw new LLFSMException(Code.IO_FAILURE, "Cannot list " + directory + ": " + ioException,
          ioException);
    }
  }

  @Override
  public void createDirectories(final Path directory) throws LLFSMException {
    try {
      Files.createDirectories(directory);
    } catch (IOException ioException) {
      throw new LLFSMException(Code.IO_FAILURE,
          "Cannot create directory " + directory + ": " + ioException, ioException);
    }
  }

}
