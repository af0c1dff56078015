package com.github.llfsm.codec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.llfsm.Arrangement;
import com.github.llfsm.Diagnostics;
import com.github.llfsm.Instance;
import com.github.llfsm.LLFSMException;
import com.github.llfsm.LLFSMException.Code;
import com.github.llfsm.Machine;
import com.github.llfsm.binding.Filenames;
import com.github.llfsm.binding.Formats;
import com.github.llfsm.binding.OutputLanguage;
import com.github.llfsm.fs.DirectoryNode;
import com.github.llfsm.fs.FileSystemAdapter;
import com.github.llfsm.fs.LocalFileSystemAdapter;

/**
 * Maps an {@link Arrangement} to and from its {@code .arrangement} directory. Member machines are
 * embedded once per distinct type file; the {@code Machines} file lists one
 * {@code instanceName<TAB>typeFile} line per instance.
 */
public final class ArrangementCodec {
  private static final Logger logger =
      LogManager.getLogger(ArrangementCodec.class.getSimpleName());

  private final FileSystemAdapter fileSystem;
  private final MachineCodec machineCodec;

  public ArrangementCodec() {
    this(new LocalFileSystemAdapter());
  }

  public ArrangementCodec(final FileSystemAdapter fileSystem) {
    this.fileSystem = Objects.requireNonNull(fileSystem);
    this.machineCodec = new MachineCodec(fileSystem);
  }

  public Arrangement read(final Path path, final OutputLanguage defaultLanguage,
      final Diagnostics diagnostics) throws LLFSMException {
    return decode(fileSystem.readTree(path), defaultLanguage, diagnostics);
  }

  public void write(final Arrangement arrangement, final Path path,
      final OutputLanguage language, final boolean isSuspensible) throws LLFSMException {
    fileSystem.writeTree(encode(arrangement, path.getFileName().toString(), language,
        isSuspensible, Collections.<Machine, DirectoryNode>emptyMap()), path);
  }

  /**
   * @param existingMachines already serialised machine directories keyed by the machine read from
   *        them; a directory is used as the base of the embedded directory its machine is written
   *        to
   */
  public DirectoryNode encode(final Arrangement arrangement, final String directoryName,
      final OutputLanguage language, final boolean isSuspensible,
      final Map<Machine, DirectoryNode> existingMachines) {
    final List<Instance> instances = resolveTypeFiles(arrangement.uniquelyNamed());
    final DirectoryNode directory = new DirectoryNode(directoryName);
    final String name = Filenames.baseName(directoryName);

    final List<String> lines = new ArrayList<>(instances.size());
    for (final Instance instance : instances) {
      lines.add(instance.getName() + "\t" + instance.getTypeFile());
    }
    directory.putText(Filenames.MACHINES, lines.isEmpty() ? "" : String.join("\n", lines) + "\n");
    directory.putText(Filenames.LANGUAGE, language.getName() + "\n");

    for (final Instance instance : instances) {
      if (directory.contains(instance.getTypeFile())) {
        continue;
      }
      directory.put(machineCodec.encode(instance.getMachine(), instance.getTypeFile(), language,
          isSuspensible, existingMachines.get(instance.getMachine())));
    }

    language.addArrangementInterface(instances, name, directory, isSuspensible);
    language.addArrangementCode(instances, name, directory, isSuspensible);
    language.addArrangementBuildFiles(instances, name, directory, isSuspensible);
    logger.debug(new StringBuilder().append("[a:").append(name).append("] encoded ")
        .append(instances.size()).append(" instances").toString());
    return directory;
  }

  /**
   * Assigns each instance the directory its machine is embedded in. Equivalent machines share a
   * directory, the first of them is the one written. A directory claimed by a different machine is
   * not shared: the later machine gets {@code <type>_1.machine},
   * {@code <type>_2.machine} and so on.
   */
  static List<Instance> resolveTypeFiles(final Arrangement arrangement) {
    final Map<String, Machine> claimed = new LinkedHashMap<>();
    final Map<Machine, String> assigned = new IdentityHashMap<>();
    final List<Instance> resolved = new ArrayList<>(arrangement.size());
    for (final Instance instance : arrangement.getNamedInstances()) {
      final Machine machine = instance.getMachine();
      String typeFile = assigned.get(machine);
      if (typeFile == null) {
        final String typeName = instance.typeName();
        typeFile = typeName + Filenames.MACHINE_EXTENSION;
        for (int suffix = 1; claimed.containsKey(typeFile)
            && !claimed.get(typeFile).isEquivalentTo(machine); suffix++) {
          typeFile = typeName + "_" + suffix + Filenames.MACHINE_EXTENSION;
        }
        if (!claimed.containsKey(typeFile)) {
          claimed.put(typeFile, machine);
        }
        assigned.put(machine, typeFile);
      }
      resolved.add(typeFile.equals(instance.getTypeFile()) ? instance
          : instance.withTypeFile(typeFile));
    }
    return resolved;
  }

  /**
   * Decodes an arrangement directory. Instances naming the same type file share one decoded
   * {@link Machine}.
   *
   * @throws LLFSMException with {@link Code#MALFORMED_MACHINE} if there is no {@code Machines}
   *         file
   */
  public Arrangement decode(final DirectoryNode directory, final OutputLanguage defaultLanguage,
      final Diagnostics diagnostics) throws LLFSMException {
    final Optional<String> machines = directory.getText(Filenames.MACHINES);
    if (!machines.isPresent()) {
      throw new LLFSMException(Code.MALFORMED_MACHINE,
          "Arrangement " + directory.getName() + " has no " + Filenames.MACHINES + " file");
    }
    OutputLanguage language = defaultLanguage;
    final Optional<String> languageName = directory.getText(Filenames.LANGUAGE);
    if (languageName.isPresent()) {
      language = Formats.forLanguageName(languageName.get()).orElse(defaultLanguage);
    }

    final Map<String, Machine> decoded = new LinkedHashMap<>();
    final List<Instance> instances = new ArrayList<>();
    final String[] lines = machines.get().split("\\r?\\n");
    for (int i = 0; i < lines.length; i++) {
      final String line = lines[i].trim();
      if (line.isEmpty()) {
        continue;
      }
      final int tab = line.indexOf('\t');
      final String typeFile = tab < 0 ? line : line.substring(tab + 1).trim();
      final String instanceName =
          tab < 0 ? Instance.stripExtension(typeFile) : line.substring(0, tab).trim();
      Optional<DirectoryNode> machineDirectory = directory.getDirectory(typeFile);
      if (!machineDirectory.isPresent()) {
        machineDirectory = directory.getDirectory(typeFile + Filenames.MACHINE_EXTENSION);
      }
      if (!machineDirectory.isPresent()) {
        diagnostics.report(directory.getName() + "/" + Filenames.MACHINES + ":" + (i + 1),
            "Machine " + typeFile + " of instance " + instanceName + " not found");
        continue;
      }
      final String key = machineDirectory.get().getName();
      Machine machine = decoded.get(key);
      if (machine == null) {
        machine = machineCodec.decode(machineDirectory.get(), language, diagnostics);
        decoded.put(key, machine);
      }
      instances.add(new Instance(instanceName, key, machine));
    }
    logger.debug(new StringBuilder().append("[a:").append(directory.getName())
        .append("] decoded ").append(instances.size()).append(" instances of ")
        .append(decoded.size()).append(" machines").toString());
    return new Arrangement(instances);
  }

}
