package com.github.llfsm.codec;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.github.llfsm.Arrangement;
import com.github.llfsm.Diagnostics;
import com.github.llfsm.Instance;
import com.github.llfsm.LLFSMException;
import com.github.llfsm.LLFSMException.Code;
import com.github.llfsm.Machine;
import com.github.llfsm.MachineFixtures;
import com.github.llfsm.binding.CBinding;
import com.github.llfsm.fs.DirectoryNode;

public class ArrangementCodecTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private final ArrangementCodec codec = new ArrangementCodec();

  @Test
  public void testSharedMachineIsEmbeddedOnce() throws LLFSMException {
    final Machine lights = MachineFixtures.redGreen(false);
    final Arrangement arrangement = new Arrangement(Arrays.asList(
        new Instance("north", "Lights.machine", lights),
        new Instance("south", "Lights.machine", lights)));
    final DirectoryNode directory = codec.encode(arrangement, "Traffic.arrangement",
        new CBinding(), false, Collections.<Machine, DirectoryNode>emptyMap());
    assertEquals("north\tLights.machine\nsouth\tLights.machine\n",
        directory.getText("Machines").get());
    assertEquals("c\n", directory.getText("Language").get());
    assertEquals(1, directory.getDirectories().size());
    assertTrue(directory.getDirectory("Lights.machine").get().contains("Machine_Lights.h"));
    assertTrue(directory.contains("Arrangement_Traffic.h"));
    assertTrue(directory.contains("static_main.c"));

    final Diagnostics diagnostics = new Diagnostics();
    final Arrangement read = codec.decode(directory, null, diagnostics);
    assertTrue(diagnostics.isEmpty());
    assertEquals(2, read.size());
    assertEquals(1, read.machineCount());
    final List<Instance> instances = read.getNamedInstances();
    assertEquals("north", instances.get(0).getName());
    assertEquals("south", instances.get(1).getName());
    assertEquals("Lights.machine", instances.get(1).getTypeFile());
    assertSame(instances.get(0).getMachine(), instances.get(1).getMachine());
    assertEquals(Arrays.asList("Red", "Green"),
        instances.get(0).getMachine().getLlfsm().stateNames());
  }

  @Test
  public void testDifferentMachinesOfOneTypeGetSuffixedDirectories() throws LLFSMException {
    final Machine first = MachineFixtures.redGreen(false);
    final Machine second = MachineFixtures.redGreen(true);
    final Arrangement arrangement = new Arrangement(Arrays.asList(
        new Instance("a", "Lights.machine", first), new Instance("b", "Lights.machine", second),
        new Instance("c", "Lights.machine", first)));
    final List<Instance> resolved = ArrangementCodec.resolveTypeFiles(arrangement);
    assertEquals("Lights.machine", resolved.get(0).getTypeFile());
    assertEquals("Lights_1.machine", resolved.get(1).getTypeFile());
    assertEquals("Lights.machine", resolved.get(2).getTypeFile());

    final DirectoryNode directory = codec.encode(arrangement, "Traffic.arrangement",
        new CBinding(), true, Collections.<Machine, DirectoryNode>emptyMap());
    assertEquals(Arrays.asList("Lights.machine", "Lights_1.machine"),
        Arrays.asList(directory.getDirectories().get(0).getName(),
            directory.getDirectories().get(1).getName()));
    final Arrangement read = codec.decode(directory, null, new Diagnostics());
    assertEquals(2, read.machineCount());
    assertTrue(read.getNamedInstances().get(1).getMachine().getLlfsm().getSuspendState()
        .isPresent());
  }

  @Test
  public void testDuplicateInstanceNamesAreSuffixed() throws LLFSMException {
    final Machine lights = MachineFixtures.redGreen(false);
    final Arrangement arrangement = new Arrangement(Arrays.asList(
        new Instance("Lights", "Lights.machine", lights),
        new Instance("Lights", "Lights.machine", lights)));
    final DirectoryNode directory = codec.encode(arrangement, "Traffic.arrangement",
        new CBinding(), false, Collections.<Machine, DirectoryNode>emptyMap());
    assertEquals("Lights\tLights.machine\nLights_1\tLights.machine\n",
        directory.getText("Machines").get());
  }

  @Test
  public void testLinesWithoutInstanceNames() throws LLFSMException {
    final DirectoryNode directory = codec.encode(
        new Arrangement(Arrays.asList(
            new Instance("Lights", "Lights.machine", MachineFixtures.redGreen(false)))),
        "Traffic.arrangement", new CBinding(), false,
        Collections.<Machine, DirectoryNode>emptyMap());
    directory.putText("Machines", "Lights\n\nLights.machine\n");
    final Arrangement read = codec.decode(directory, null, new Diagnostics());
    assertEquals(2, read.size());
    assertEquals("Lights", read.getNamedInstances().get(0).getName());
    assertEquals("Lights.machine", read.getNamedInstances().get(0).getTypeFile());
    assertEquals("Lights", read.getNamedInstances().get(1).getName());
  }

  @Test
  public void testMissingMachineIsReported() throws LLFSMException {
    final DirectoryNode directory = codec.encode(
        new Arrangement(Arrays.asList(
            new Instance("Lights", "Lights.machine", MachineFixtures.redGreen(false)))),
        "Traffic.arrangement", new CBinding(), false,
        Collections.<Machine, DirectoryNode>emptyMap());
    directory.putText("Machines", "Lights\tLights.machine\nGhost\tGhost.machine\n");
    final Diagnostics diagnostics = new Diagnostics();
    final Arrangement read = codec.decode(directory, null, diagnostics);
    assertEquals(1, read.size());
    assertEquals(1, diagnostics.size());
    assertEquals("Traffic.arrangement/Machines:2", diagnostics.getReported().get(0).getLocation());
  }

  @Test
  public void testMissingMachinesFileIsMalformed() {
    try {
      codec.decode(new DirectoryNode("Empty.arrangement"), new CBinding(), new Diagnostics());
      fail("expected a malformed arrangement");
    } catch (LLFSMException expected) {
      assertEquals(Code.MALFORMED_MACHINE, expected.getCode());
    }
  }

  @Test
  public void testExistingMachineFilesAreKept() throws LLFSMException {
    final Machine lights = MachineFixtures.redGreen(false);
    final Machine other = MachineFixtures.single("Other");
    final DirectoryNode lightsExisting = new DirectoryNode("Lights.machine");
    lightsExisting.putText("Notes.txt", "kept\n");
    final DirectoryNode otherExisting = new DirectoryNode("Lights.machine");
    otherExisting.putText("STATE_Other_Transitions", "");
    otherExisting.putText("README", "other\n");
    final Map<Machine, DirectoryNode> existing = new IdentityHashMap<>();
    existing.put(lights, lightsExisting);
    existing.put(other, otherExisting);

    // both machines were read from a directory called Lights.machine
    final DirectoryNode directory = codec.encode(
        new Arrangement(Arrays.asList(new Instance("Lights", "Lights.machine", lights),
            new Instance("Lights", "Lights.machine", other))),
        "Traffic.arrangement", new CBinding(), false, existing);
    final DirectoryNode first = directory.getDirectory("Lights.machine").get();
    assertEquals("kept\n", first.getText("Notes.txt").get());
    assertFalse(first.contains("README"));
    assertFalse(first.contains("STATE_Other_Transitions"));
    final DirectoryNode second = directory.getDirectory("Lights_1.machine").get();
    assertEquals("other\n", second.getText("README").get());
    assertFalse(second.contains("Notes.txt"));
  }

  @Test
  public void testEquivalentMachinesAreEmbeddedOnce() throws LLFSMException {
    final Machine first = MachineFixtures.redGreen(true);
    final Machine second = MachineFixtures.redGreen(true);
    final DirectoryNode directory = codec.encode(
        new Arrangement(Arrays.asList(new Instance("north", "Lights.machine", first),
            new Instance("south", "Lights.machine", second))),
        "Traffic.arrangement", new CBinding(), true,
        Collections.<Machine, DirectoryNode>emptyMap());
    assertEquals(1, directory.getDirectories().size());
    assertEquals("north\tLights.machine\nsouth\tLights.machine\n",
        directory.getText("Machines").get());
  }

  @Test
  public void testWriteAndReadThroughFileSystem() throws Exception {
    final java.nio.file.Path path = folder.getRoot().toPath().resolve("Traffic.arrangement");
    final Machine lights = MachineFixtures.redGreen(true);
    codec.write(new Arrangement(Arrays.asList(new Instance("north", "Lights.machine", lights),
        new Instance("south", "Lights.machine", lights))), path, new CBinding(), true);
    assertTrue(path.resolve("Lights.machine").resolve("Machine_Lights.c").toFile().isFile());
    assertFalse(path.resolve("Lights_1.machine").toFile().exists());
    final Arrangement read = codec.read(path, null, new Diagnostics());
    assertEquals(2, read.size());
    assertEquals(1, read.machineCount());
  }

}
