package com.github.llfsm.binding;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.llfsm.Diagnostics;
import com.github.llfsm.LLFSM;
import com.github.llfsm.State;
import com.github.llfsm.StateID;
import com.github.llfsm.Transition;
import com.github.llfsm.fs.DirectoryNode;

/**
 * Binding for VHDL machines. Code is generated elsewhere from the persisted sections, so every
 * emit operation is a no-op. Transitions are kept as {@code expression,targetUUID} lines, which
 * is why the state ids are persisted alongside the state names.
 */
public final class VHDLBinding implements OutputLanguage {
  private static final Logger logger = LogManager.getLogger(VHDLBinding.class.getSimpleName());

  public static final String SUSPENDED_STATE = "SuspendedState";
  public static final String STATE_IDS = "StateIDs";
  static final String noSuspendState = "-1";

  private static final List<String> machineSections = Collections.unmodifiableList(Arrays
      .asList("includes", "externalSignals", "machineVariables", "architectureHead",
          "architectureBody"));
  private static final List<String> stateSections = Collections.unmodifiableList(
      Arrays.asList("onEntry", "onExit", "internal", "onSuspend", "onResume", "stateSignals",
          "stateVariables"));

  @Override
  public String getName() {
    return Format.VHDL.getFormatName();
  }

  @Override
  public List<String> getMachineSections() {
    return machineSections;
  }

  @Override
  public List<String> getStateSections() {
    return stateSections;
  }

  @Override
  public String machineSectionFile(final String machineName, final String section) {
    return "MACHINE_" + capitalised(section);
  }

  @Override
  public String stateSectionFile(final String stateName, final String section) {
    return "STATE_" + stateName + "_" + capitalised(section);
  }

  @Override
  public void writeTransitions(final LLFSM llfsm, final DirectoryNode directory) {
    for (final StateID stateID : llfsm.getStates()) {
      final List<String> lines = new ArrayList<>();
      for (final Transition transition : llfsm.transitionsFrom(stateID)) {
        lines.add(transition.getLabel() + "," + transition.getTarget());
      }
      directory.putText(Filenames.stateTransitions(llfsm.stateName(stateID)),
          String.join("\n", lines));
    }
  }

  @Override
  public List<Transition> readTransitions(final DirectoryNode directory,
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
      StateID target = null;
      if (separator >= 0) {
        try {
          target = StateID.parse(line.substring(separator + 1));
        } catch (IllegalArgumentException notAUuid) {
          logger.debug("Not a state id in {}: {}", location, notAUuid.getMessage());
        }
      }
      if (target == null) {
        diagnostics.report(location, "Malformed VHDL transition '" + line + "' in state "
            + source.getName());
        continue;
      }
      if (!isMember(states, target)) {
        diagnostics.report(location, "Transition from state " + source.getName()
            + " references unknown target state " + target);
        continue;
      }
      transitions.add(new Transition(line.substring(0, separator), source.getId(), target));
    }
    return transitions;
  }

  @Override
  public void writeSuspendState(final LLFSM llfsm, final DirectoryNode directory) {
    directory.putText(SUSPENDED_STATE, llfsm.getSuspendState().isPresent()
        ? llfsm.stateName(llfsm.getSuspendState().get()) : noSuspendState);
  }

  @Override
  public StateID readSuspendState(final DirectoryNode directory, final List<State> states,
      final Diagnostics diagnostics) {
    final Optional<String> contents = directory.getText(SUSPENDED_STATE);
    if (!contents.isPresent()) {
      return null;
    }
    final String name = contents.get().trim();
    if (name.isEmpty() || noSuspendState.equals(name)) {
      return null;
    }
    for (final State state : states) {
      if (state.getName().equals(name)) {
        return state.getId();
      }
    }
    diagnostics.report(directory.getName() + "/" + SUSPENDED_STATE,
        "Unknown suspended state '" + name + "' ignored");
    return null;
  }

  @Override
  public void writeStateIDs(final LLFSM llfsm, final DirectoryNode directory) {
    final List<String> lines = new ArrayList<>();
    for (final StateID stateID : llfsm.getStates()) {
      lines.add(stateID.toString());
    }
    directory.putText(STATE_IDS, String.join("\n", lines) + "\n");
  }

  /**
   * Restores the persisted ids when there is exactly one valid id per state name.
   */
  @Override
  public List<StateID> readStateIDs(final DirectoryNode directory, final List<String> names,
      final Diagnostics diagnostics) {
    final Optional<String> contents = directory.getText(STATE_IDS);
    if (contents.isPresent()) {
      final List<StateID> ids = new ArrayList<>();
      try {
        for (final String line : contents.get().split("\\r?\\n")) {
          if (!line.trim().isEmpty()) {
            ids.add(StateID.parse(line));
          }
        }
        if (ids.size() == names.size()) {
          return ids;
        }
        diagnostics.report(directory.getName() + "/" + STATE_IDS, ids.size()
            + " state ids for " + names.size() + " states, assigning fresh ids");
      } catch (IllegalArgumentException malformed) {
        diagnostics.report(directory.getName() + "/" + STATE_IDS,
            "Malformed state id, assigning fresh ids: " + malformed.getMessage());
      }
    }
    final List<StateID> fresh = new ArrayList<>(names.size());
    for (int i = 0; i < names.size(); i++) {
      fresh.add(StateID.random());
    }
    return fresh;
  }

  private static boolean isMember(final List<State> states, final StateID stateID) {
    for (final State state : states) {
      if (state.getId().equals(stateID)) {
        return true;
      }
    }
    return false;
  }

  static String capitalised(final String section) {
    return section.isEmpty() ? section
        : Character.toUpperCase(section.charAt(0)) + section.substring(1);
  }

  @Override
  public String toString() {
    return "VHDLBinding";
  }

}
