package com.github.llfsm.binding;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.llfsm.Diagnostics;
import com.github.llfsm.Instance;
import com.github.llfsm.LLFSM;
import com.github.llfsm.Machine;
import com.github.llfsm.State;
import com.github.llfsm.StateID;
import com.github.llfsm.Transition;
import com.github.llfsm.fs.DirectoryNode;

/**
 * A language binding: how boilerplate, transitions and the suspend state are persisted in a
 * machine directory, and which code and build files are generated next to them.
 * 
 * Every emit operation defaults to doing nothing. Callers must not expect any of them to add files.
 */
public interface OutputLanguage {

  /**
   * @return the lower case identifier stored in the {@code Language} file
   */
  String getName();

  List<String> getMachineSections();

  List<String> getStateSections();

  /**
   * @return the file the given machine-level section is kept in
   */
  String machineSectionFile(String machineName, String section);

  String stateSectionFile(String stateName, String section);

  default Boilerplate readBoilerplate(final DirectoryNode directory, final String machineName) {
    final Boilerplate boilerplate = new Boilerplate();
    for (final String section : getMachineSections()) {
      boilerplate.set(section,
          directory.getText(machineSectionFile(machineName, section)).orElse(""));
    }
    return boilerplate;
  }

  default Boilerplate readStateBoilerplate(final DirectoryNode directory,
      final String stateName) {
    final Boilerplate boilerplate = new Boilerplate();
    for (final String section : getStateSections()) {
      boilerplate.set(section,
          directory.getText(stateSectionFile(stateName, section)).orElse(""));
    }
    return boilerplate;
  }

  default void writeBoilerplate(final Boilerplate boilerplate, final DirectoryNode directory,
      final String machineName) {
    for (final String section : getMachineSections()) {
      directory.putText(machineSectionFile(machineName, section), boilerplate.get(section));
    }
  }

  default void writeStateBoilerplate(final Boilerplate boilerplate,
      final DirectoryNode directory, final String stateName) {
    for (final String section : getStateSections()) {
      directory.putText(stateSectionFile(stateName, section), boilerplate.get(section));
    }
  }

  /**
   * Writes one {@code expression,targetStateName} line per outgoing transition of every state.
   */
  default void writeTransitions(final LLFSM llfsm, final DirectoryNode directory) {
    for (final StateID stateID : llfsm.getStates()) {
      final List<String> lines = new ArrayList<>();
      for (final Transition transition : llfsm.transitionsFrom(stateID)) {
        lines.add(transition.getLabel() + "," + llfsm.stateName(transition.getTarget()));
      }
      directory.putText(Filenames.stateTransitions(llfsm.stateName(stateID)),
          lines.isEmpty() ? "" : String.join("\n", lines) + "\n");
    }
  }

  /**
   * Reads the outgoing transitions of the source state. Lines without a separator or naming an
   * unknown target are reported and skipped.
   */
  default List<Transition> readTransitions(final DirectoryNode directory,
      final List<State> states, final State source, final Diagnostics diagnostics) {
    final List<Transition> transitions = new ArrayList<>();
    final String file = Filenames.stateTransitions(source.getName());
    final Optional<String> contents = directory.getText(file);
    if (!contents.isPresent()) {
      return transitions;
    }
    final String[] lines = contents.get().split("\\r?\\n");
    for (int i = 0; i < lines.length; i++) {
      final String line = lines[i];
      if (line.trim().isEmpty()) {
        continue;
      }
      final String location = directory.getName() + "/" + file + ":" + (i + 1);
      final int separator = line.lastIndexOf(',');
      if (separator < 0) {
        diagnostics.report(location, "Malformed transition '" + line + "' in state "
            + source.getName() + ": missing target");
        continue;
      }
      final String targetName = line.substring(separator + 1).trim();
      State target = null;
      for (final State state : states) {
        if (state.getName().equals(targetName)) {
          target = state;
          break;
        }
      }
      if (target == null) {
        diagnostics.report(location, "Transition from state " + source.getName()
            + " references unknown target state '" + targetName + "'");
        continue;
      }
      transitions.add(
          new Transition(line.substring(0, separator), source.getId(), target.getId()));
    }
    return transitions;
  }

  /**
   * Writes the suspend state name, or removes a stale suspend state file.
   */
  default void writeSuspendState(final LLFSM llfsm, final DirectoryNode directory) {
    if (llfsm.getSuspendState().isPresent()) {
      directory.putText(Filenames.SUSPEND_STATE,
          llfsm.stateName(llfsm.getSuspendState().get()) + "\n");
    } else {
      directory.remove(Filenames.SUSPEND_STATE);
    }
  }

  default StateID readSuspendState(final DirectoryNode directory, final List<State> states,
      final Diagnostics diagnostics) {
    final Optional<String> contents = directory.getText(Filenames.SUSPEND_STATE);
    if (!contents.isPresent() || contents.get().trim().isEmpty()) {
      return null;
    }
    final String name = contents.get().trim();
    for (final State state : states) {
      if (state.getName().equals(name)) {
        return state.getId();
      }
    }
    diagnostics.report(directory.getName() + "/" + Filenames.SUSPEND_STATE,
        "Unknown suspend state '" + name + "' ignored");
    return null;
  }

  default void writeStateIDs(final LLFSM llfsm, final DirectoryNode directory) {}

  /**
   * @return one id per state name, in order; fresh ids unless the binding persists them
   */
  default List<StateID> readStateIDs(final DirectoryNode directory, final List<String> names,
      final Diagnostics diagnostics) {
    final List<StateID> ids = new ArrayList<>(names.size());
    for (int i = 0; i < names.size(); i++) {
      ids.add(StateID.random());
    }
    return ids;
  }

  default void addInterface(final Machine machine, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {}

  default void addStateInterface(final Machine machine, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {}

  default void addCode(final Machine machine, final String name, final DirectoryNode directory,
      final boolean isSuspensible) {}

  default void addStateCode(final Machine machine, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {}

  default void addTransitionCode(final Machine machine, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {}

  default void addBuildFiles(final Machine machine, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {}

  default void addArrangementInterface(final List<Instance> instances, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {}

  default void addArrangementCode(final List<Instance> instances, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {}

  default void addArrangementBuildFiles(final List<Instance> instances, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {}

}
