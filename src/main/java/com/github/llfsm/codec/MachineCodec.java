package com.github.llfsm.codec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.llfsm.Diagnostics;
import com.github.llfsm.LLFSM;
import com.github.llfsm.LLFSMException;
import com.github.llfsm.LLFSMException.Code;
import com.github.llfsm.Machine;
import com.github.llfsm.State;
import com.github.llfsm.StateID;
import com.github.llfsm.Transition;
import com.github.llfsm.binding.Filenames;
import com.github.llfsm.binding.Formats;
import com.github.llfsm.binding.OutputLanguage;
import com.github.llfsm.fs.DirectoryNode;
import com.github.llfsm.fs.FileSystemAdapter;
import com.github.llfsm.fs.LocalFileSystemAdapter;
import com.github.llfsm.layout.TransitionLayout;

/**
 * Maps a {@link Machine} to and from its {@code .machine} directory. The model files are written
 * first, then the language binding adds its generated interface, code and build files.
 *
 * Reading is best-effort: malformed transitions, suspend states and layouts are reported to the
 * supplied {@link Diagnostics} and skipped.
 */
public final class MachineCodec {
  private static final Logger logger = LogManager.getLogger(MachineCodec.class.getSimpleName());

  private final FileSystemAdapter fileSystem;

  public MachineCodec() {
    this(new LocalFileSystemAdapter());
  }

  public MachineCodec(final FileSystemAdapter fileSystem) {
    this.fileSystem = Objects.requireNonNull(fileSystem);
  }

  /**
   * Reads and decodes the machine directory at the given path.
   */
  public Machine read(final Path path, final OutputLanguage defaultLanguage,
      final Diagnostics diagnostics) throws LLFSMException {
    return decode(fileSystem.readTree(path), defaultLanguage, diagnostics);
  }

  /**
   * Encodes the machine and writes it into the directory at the given path. Files already in the
   * directory that are not part of the encoding are kept.
   *
   * @param language binding to write with, or null for the machine's own
   */
  public void write(final Machine machine, final Path path, final OutputLanguage language,
      final boolean isSuspensible) throws LLFSMException {
    fileSystem.writeTree(encode(machine, path.getFileName().toString(), language, isSuspensible),
        path);
  }

  public DirectoryNode encode(final Machine machine, final String directoryName,
      final OutputLanguage language, final boolean isSuspensible) {
    return encode(machine, directoryName, language, isSuspensible, null);
  }

  /**
   * @param base previously serialised directory whose files are kept unless replaced, or null
   */
  public DirectoryNode encode(final Machine machine, final String directoryName,
      final OutputLanguage language, final boolean isSuspensible, final DirectoryNode base) {
    final OutputLanguage binding = language != null ? language : machine.getLanguage();
    final DirectoryNode directory = base == null ? new DirectoryNode(directoryName)
        : new DirectoryNode(directoryName, base.getChildren());
    final String name = Filenames.baseName(directoryName);
    final LLFSM llfsm = machine.getLlfsm();

    directory.putText(Filenames.LANGUAGE, binding.getName() + "\n");
    directory.putText(Filenames.VERSION, Filenames.FILE_VERSION + "\n");
    directory.putText(Filenames.STATES, String.join("\n", llfsm.stateNames()) + "\n");
    binding.writeBoilerplate(machine.getBoilerplate(), directory, name);
    for (final StateID stateID : llfsm.getStates()) {
      binding.writeStateBoilerplate(machine.getStateBoilerplate(stateID), directory,
          llfsm.stateName(stateID));
    }
    final Optional<byte[]> windowLayout = machine.getWindowLayout();
    if (windowLayout.isPresent()) {
      directory.putBytes(Filenames.WINDOW_LAYOUT, windowLayout.get());
    }
    directory.putBytes(Filenames.LAYOUT, PropertyList.write(layout(machine)));
    binding.writeTransitions(llfsm, directory);
    binding.writeSuspendState(llfsm, directory);
    binding.writeStateIDs(llfsm, directory);

    binding.addInterface(machine, name, directory, isSuspensible);
    binding.addStateInterface(machine, name, directory, isSuspensible);
    binding.addCode(machine, name, directory, isSuspensible);
    binding.addStateCode(machine, name, directory, isSuspensible);
    binding.addTransitionCode(machine, name, directory, isSuspensible);
    binding.addBuildFiles(machine, name, directory, isSuspensible);
    logger.debug(new StringBuilder().append("[m:").append(name).append("] encoded ")
        .append(llfsm.stateCount()).append(" states for ").append(binding.getName()).toString());
    return directory;
  }

  private static Map<String, Object> layout(final Machine machine) {
    final LLFSM llfsm = machine.getLlfsm();
    final Map<String, Map<String, Object>> states = new LinkedHashMap<>();
    for (final StateID stateID : llfsm.getStates()) {
      final List<TransitionLayout> transitionLayouts = new ArrayList<>();
      for (final Transition transition : llfsm.transitionsFrom(stateID)) {
        transitionLayouts.add(machine.transitionLayout(transition.getId()));
      }
      states.put(llfsm.stateName(stateID),
          LayoutPropertyList.stateDictionary(machine.stateLayout(stateID), transitionLayouts));
    }
    return LayoutPropertyList.layoutDictionary(states);
  }

  /**
   * Decodes a machine directory.
   *
   * @param defaultLanguage binding used when the directory names none, may be null
   * @throws LLFSMException with {@link Code#UNSUPPORTED_OUTPUT_FORMAT} if no binding can be
   *         determined, or {@link Code#MALFORMED_MACHINE} if the directory has no state list
   */
  public Machine decode(final DirectoryNode directory, final OutputLanguage defaultLanguage,
      final Diagnostics diagnostics) throws LLFSMException {
    final String name = Filenames.baseName(directory.getName());
    final OutputLanguage language = language(directory, defaultLanguage);
    final Optional<String> stateList = directory.getText(Filenames.STATES);
    if (!stateList.isPresent()) {
      throw new LLFSMException(Code.MALFORMED_MACHINE,
          "Machine " + directory.getName() + " has no " + Filenames.STATES + " file");
    }
    final List<String> names = new ArrayList<>();
    for (final String line : stateList.get().split("\\r?\\n")) {
      if (!line.trim().isEmpty()) {
        names.add(line.trim());
      }
    }
    final List<StateID> ids = language.readStateIDs(directory, names, diagnostics);
    final List<State> states = new ArrayList<>(names.size());
    for (int i = 0; i < names.size(); i++) {
      states.add(new State(ids.get(i), names.get(i)));
    }

    final List<Transition> transitions = new ArrayList<>();
    for (final State state : states) {
      transitions.addAll(language.readTransitions(directory, states, state, diagnostics));
    }
    final StateID suspendState = language.readSuspendState(directory, states, diagnostics);
    final Machine machine =
        new Machine(language, new LLFSM(states, transitions, suspendState));

    readLayout(directory, machine, diagnostics);
    machine.setBoilerplate(language.readBoilerplate(directory, name));
    for (final State state : states) {
      machine.setStateBoilerplate(state.getId(),
          language.readStateBoilerplate(directory, state.getName()));
    }
    final Optional<byte[]> windowLayout = directory.getBytes(Filenames.WINDOW_LAYOUT);
    if (windowLayout.isPresent()) {
      machine.setWindowLayout(windowLayout.get());
    }
    logger.debug(new StringBuilder().append("[m:").append(name).append("] decoded ")
        .append(states.size()).append(" states, ").append(transitions.size())
        .append(" transitions").toString());
    return machine;
  }

  private static OutputLanguage language(final DirectoryNode directory,
      final OutputLanguage defaultLanguage) throws LLFSMException {
    final Optional<String> languageName = directory.getText(Filenames.LANGUAGE);
    if (languageName.isPresent()) {
      final Optional<OutputLanguage> language = Formats.forLanguageName(languageName.get());
      if (language.isPresent()) {
        return language.get();
      }
      logger.warn("Machine " + directory.getName() + " names unknown language '"
          + languageName.get().trim() + "'");
    }
    if (defaultLanguage == null) {
      throw new LLFSMException(Code.UNSUPPORTED_OUTPUT_FORMAT,
          "Cannot determine the language of machine " + directory.getName());
    }
    return defaultLanguage;
  }

  /**
   * Populates every state and transition layout, from {@code Layout.plist} where it has one.
   */
  private static void readLayout(final DirectoryNode directory, final Machine machine,
      final Diagnostics diagnostics) {
    final LLFSM llfsm = machine.getLlfsm();
    final String location = directory.getName() + "/" + Filenames.LAYOUT;
    Map<String, Object> dictionaries = new LinkedHashMap<>();
    final Optional<byte[]> contents = directory.getBytes(Filenames.LAYOUT);
    if (contents.isPresent()) {
      try {
        dictionaries = LayoutPropertyList.stateDictionaries(contents.get());
      } catch (LLFSMException malformed) {
        diagnostics.report(location, malformed.getMessage() + ", using default layout");
      }
    }
    final List<StateID> stateIDs = llfsm.getStates();
    for (int i = 0; i < stateIDs.size(); i++) {
      final StateID stateID = stateIDs.get(i);
      final String stateName = llfsm.stateName(stateID);
      final LayoutPropertyList.StateEntry entry =
          LayoutPropertyList.stateEntry(dictionaries.get(stateName), i);
      machine.getStateLayouts().put(stateID, entry.getStateLayout());
      final List<Transition> outgoing = llfsm.transitionsFrom(stateID);
      final List<TransitionLayout> layouts = entry.getTransitionLayouts();
      for (int k = 0; k < layouts.size(); k++) {
        if (k < outgoing.size()) {
          machine.getTransitionLayouts().put(outgoing.get(k).getId(), layouts.get(k));
        } else {
          diagnostics.report(location, "Layout " + k + " ignored: State " + stateName
              + " only has " + outgoing.size() + " transitions");
        }
      }
    }
  }

}
