package com.github.llfsm.fs;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.github.llfsm.LLFSMException;
import com.github.llfsm.LLFSMException.Code;

public class LocalFileSystemAdapterTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private final FileSystemAdapter fileSystem = new LocalFileSystemAdapter();

  @Test
  public void testTreeRoundTrip() throws Exception {
    final DirectoryNode tree = new DirectoryNode("Traffic.arrangement");
    tree.putText("Machines", "north\tLights.machine\n");
    final DirectoryNode machine = new DirectoryNode("Lights.machine");
    machine.putText("States", "Red\nGreen\n");
    machine.putBytes("WindowLayout.plist", new byte[] {0, 1, 2});
    tree.put(machine);

    final Path path = folder.getRoot().toPath().resolve("Traffic.arrangement");
    fileSystem.writeTree(tree, path);
    assertEquals("Red\nGreen\n", new String(
        Files.readAllBytes(path.resolve("Lights.machine").resolve("States")),
        StandardCharsets.UTF_8));

    final DirectoryNode read = fileSystem.readTree(path);
    assertEquals(tree, read);
    assertEquals(Arrays.asList("Lights.machine", "Machines"), read.getChildNames());
    assertArrayEquals(new byte[] {0, 1, 2},
        read.getDirectory("Lights.machine").get().getBytes("WindowLayout.plist").get());
  }

  @Test
  public void testWritingKeepsUnrelatedFiles() throws Exception {
    final File existing = folder.newFolder("Lights.machine");
    Files.write(existing.toPath().resolve("README"), "notes".getBytes(StandardCharsets.UTF_8));
    Files.write(existing.toPath().resolve("States"), "Stale\n".getBytes(StandardCharsets.UTF_8));

    final DirectoryNode tree = new DirectoryNode("Lights.machine");
    tree.putText("States", "Red\n");
    fileSystem.writeTree(tree, existing.toPath());

    final DirectoryNode read = fileSystem.readTree(existing.toPath());
    assertEquals("notes", read.getText("README").get());
    assertEquals("Red\n", read.getText("States").get());
  }

  @Test
  public void testReadingAFileIsNotADirectory() throws Exception {
    final File file = folder.newFile("States");
    try {
      fileSystem.readTree(file.toPath());
      fail("expected a regular file to be rejected");
    } catch (LLFSMException expected) {
      assertEquals(Code.NOT_A_DIRECTORY, expected.getCode());
    }
    assertTrue(fileSystem.exists(file.toPath()));
  }

  @Test
  public void testReadingMissingFileFails() {
    try {
      fileSystem.readBytes(folder.getRoot().toPath().resolve("missing"));
      fail("expected an I/O failure");
    } catch (LLFSMException expected) {
      assertEquals(Code.IO_FAILURE, expected.getCode());
      assertTrue(expected.getMessage().contains("missing"));
    }
  }

}
