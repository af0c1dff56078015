package com.github.llfsm.convert;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.llfsm.Arrangement;
import com.github.llfsm.Diagnostics;
import com.github.llfsm.Instance;
import com.github.llfsm.LLFSMException;
import com.github.llfsm.LLFSMException.Code;
import com.github.llfsm.Machine;
import com.github.llfsm.binding.CBinding;
import com.github.llfsm.binding.Filenames;
import com.github.llfsm.binding.OutputLanguage;
import com.github.llfsm.codec.ArrangementCodec;
import com.github.llfsm.codec.MachineCodec;
import com.github.llfsm.fs.DirectoryNode;
import com.github.llfsm.fs.FileSystemAdapter;
import com.github.llfsm.fs.LocalFileSystemAdapter;

/**
 * Runs a {@link ConversionRequest}: one machine is rewritten in the requested language, several
 * machines (or one, when asked to) become an arrangement.
 *
 * Every input is resolved before anything is read or written, so a bad request leaves no partial
 * output behind.
 */
public final class Converter {
  private static final Logger logger = LogManager.getLogger(Converter.class.getSimpleName());

  private final FileSystemAdapter fileSystem;
  private final MachineCodec machineCodec;
  private final ArrangementCodec arrangementCodec;

  public Converter() {
    this(new LocalFileSystemAdapter());
  }

  public Converter(final FileSystemAdapter fileSystem) {
    this.fileSystem = Objects.requireNonNull(fileSystem);
    this.machineCodec = new MachineCodec(fileSystem);
    this.arrangementCodec = new ArrangementCodec(fileSystem);
  }

  /**
   * @return the input paths as found on disk, with {@code .machine} appended where needed
   * @throws LLFSMException with {@link Code#MISSING_INPUT} for the first input that cannot be
   *         found
   */
  public List<Path> validate(final ConversionRequest request) throws LLFSMException {
    request.outputLanguage();
    final List<Path> resolved = new ArrayList<>(request.getInputs().size());
    for (final Path input : request.getInputs()) {
      resolved.add(resolve(input));
    }
    return resolved;
  }

  private Path resolve(final Path input) throws LLFSMException {
    if (fileSystem.exists(input)) {
      return input;
    }
    final Path fileName = input.getFileName();
    if (fileName != null) {
      final Path withExtension =
          input.resolveSibling(fileName.toString() + Filenames.MACHINE_EXTENSION);
      if (fileSystem.exists(withExtension)) {
        return withExtension;
      }
    }
    throw new LLFSMException(Code.MISSING_INPUT, "Cannot find machine " + input);
  }

  public ConversionSummary convert(final ConversionRequest request) throws LLFSMException {
    final List<Path> inputs = validate(request);
    final OutputLanguage language = request.outputLanguage();
    final OutputLanguage readLanguage =
        language != null ? language : new CBinding(request.isIntrospectable());
    final Diagnostics diagnostics = new Diagnostics();

    // the same path given twice shares one machine
    final Map<Path, Machine> machines = new LinkedHashMap<>();
    final Map<Path, DirectoryNode> directories = new HashMap<>();
    for (final Path input : inputs) {
      final Path key = input.toAbsolutePath().normalize();
      if (!machines.containsKey(key)) {
        final DirectoryNode directory = fileSystem.readTree(input);
        directories.put(key, directory);
        machines.put(key, machineCodec.decode(directory, readLanguage, diagnostics));
      }
    }

    final ConversionSummary summary;
    if (inputs.size() == 1 && !request.isArrangement()) {
      final Path key = inputs.get(0).toAbsolutePath().normalize();
      final Machine machine = machines.get(key);
      final Path output = request.getOutput() != null ? request.getOutput() : inputs.get(0);
      final DirectoryNode base = output.toAbsolutePath().normalize().equals(key)
          ? directories.get(key) : null;
      fileSystem.writeTree(machineCodec.encode(machine, output.getFileName().toString(),
          language, request.isSuspensible(), base), output);
      summary = new ConversionSummary(1, machine.getLlfsm().stateCount(),
          machine.getLlfsm().transitionCount(), output, diagnostics.getReported());
    } else {
      final List<Instance> instances = new ArrayList<>(inputs.size());
      final Map<Machine, DirectoryNode> existing = new IdentityHashMap<>();
      for (final Path input : inputs) {
        final Path key = input.toAbsolutePath().normalize();
        final String typeFile = directoryName(input);
        instances.add(new Instance(Filenames.baseName(typeFile), typeFile, machines.get(key)));
        existing.put(machines.get(key), directories.get(key));
      }
      final Arrangement arrangement = new Arrangement(instances);
      final OutputLanguage arrangementLanguage =
          language != null ? language : instances.get(0).getMachine().getLanguage();
      final Path output = request.getOutput();
      fileSystem.writeTree(arrangementCodec.encode(arrangement, output.getFileName().toString(),
          arrangementLanguage, request.isSuspensible(), existing), output);
      summary = new ConversionSummary(arrangement.size(), arrangement.stateCount(),
          arrangement.transitionCount(), output, diagnostics.getReported());
    }
    logger.info("Converted " + summary.describe() + " into " + summary.getOutput());
    return summary;
  }

  private static String directoryName(final Path input) {
    final Path fileName = input.toAbsolutePath().normalize().getFileName();
    return fileName == null ? input.toString() : fileName.toString();
  }

}
