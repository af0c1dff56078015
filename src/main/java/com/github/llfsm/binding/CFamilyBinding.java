package com.github.llfsm.binding;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.github.llfsm.Instance;
import com.github.llfsm.LLFSM;
import com.github.llfsm.Machine;
import com.github.llfsm.State;
import com.github.llfsm.StateID;
import com.github.llfsm.Transition;
import com.github.llfsm.fs.DirectoryNode;

/**
 * Boilerplate layout and transition expression files shared by the C and Objective-C++ bindings.
 */
public abstract class CFamilyBinding implements OutputLanguage {
  public static final String INCLUDE_PATH = "includePath";
  public static final String INCLUDES = "includes";
  public static final String VARIABLES = "variables";
  public static final String FUNCTIONS = "functions";
  public static final String ON_ENTRY = "onEntry";
  public static final String ON_EXIT = "onExit";
  public static final String INTERNAL = "internal";
  public static final String ON_SUSPEND = "onSuspend";
  public static final String ON_RESUME = "onResume";

  static final String generatedNotice =
      "// Automatically created using fsmconvert -- do not change manually!";

  private static final List<String> machineSections =
      Collections.unmodifiableList(Arrays.asList(INCLUDE_PATH, INCLUDES, VARIABLES, FUNCTIONS));
  private static final List<String> stateSections = Collections.unmodifiableList(Arrays
      .asList(INCLUDES, VARIABLES, FUNCTIONS, ON_ENTRY, ON_EXIT, INTERNAL, ON_SUSPEND, ON_RESUME));

  /**
   * @return the prefix of the machine-level header files, e.g. {@code Machine_Name}
   */
  protected abstract String machineFilePrefix(String machineName);

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
    switch (section) {
      case INCLUDE_PATH:
        return "IncludePath";
      case INCLUDES:
        return machineFilePrefix(machineName) + "_Includes.h";
      case VARIABLES:
        return machineFilePrefix(machineName) + "_Variables.h";
      case FUNCTIONS:
        return machineFilePrefix(machineName) + "_Methods.h";
      default:
        throw new IllegalArgumentException("Unknown machine section " + section);
    }
  }

  @Override
  public String stateSectionFile(final String stateName, final String section) {
    final String prefix = "State_" + stateName;
    switch (section) {
      case INCLUDES:
        return prefix + "_Includes.h";
      case VARIABLES:
        return prefix + "_Variables.h";
      case FUNCTIONS:
        return prefix + "_Methods.h";
      case ON_ENTRY:
        return prefix + "_OnEntry.mm";
      case ON_EXIT:
        return prefix + "_OnExit.mm";
      case INTERNAL:
        return prefix + "_Internal.mm";
      case ON_SUSPEND:
        return prefix + "_OnSuspend.mm";
      case ON_RESUME:
        return prefix + "_OnResume.mm";
      default:
        throw new IllegalArgumentException("Unknown state section " + section);
    }
  }

  /**
   * One {@code State_<S>_Transition_<i>.expr} file per transition, numbered in attachment order.
   */
  @Override
  public void addTransitionCode(final Machine machine, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {
    final LLFSM llfsm = machine.getLlfsm();
    for (final StateID stateID : llfsm.getStates()) {
      final String stateName = llfsm.stateName(stateID);
      final List<Transition> transitions = llfsm.transitionsFrom(stateID);
      for (int i = 0; i < transitions.size(); i++) {
        directory.putText(transitionFile(stateName, i), transitions.get(i).getLabel() + "\n");
      }
    }
  }

  static String transitionFile(final String stateName, final int number) {
    return "State_" + stateName + "_Transition_" + number + ".expr";
  }

  static String header(final String file) {
    return Code.block("//", "// " + file, "//", generatedNotice, "//", "");
  }

  static List<State> states(final LLFSM llfsm) {
    final List<State> states = new ArrayList<>(llfsm.stateCount());
    for (final StateID stateID : llfsm.getStates()) {
      states.add(llfsm.getState(stateID));
    }
    return states;
  }

  /**
   * @return the extra include directories listed in the machine's include path section
   */
  static List<String> includePaths(final Machine machine) {
    final List<String> paths = new ArrayList<>();
    for (final String line : machine.getBoilerplate().get(INCLUDE_PATH).split("\n")) {
      if (!line.trim().isEmpty()) {
        paths.add(line.trim());
      }
    }
    return paths;
  }

  /**
   * @return the first instance of every type file, in order of first appearance
   */
  static List<Instance> distinctTypes(final List<Instance> instances) {
    final List<Instance> types = new ArrayList<>();
    final List<String> seen = new ArrayList<>();
    for (final Instance instance : instances) {
      if (!seen.contains(instance.getTypeFile())) {
        seen.add(instance.getTypeFile());
        types.add(instance);
      }
    }
    return types;
  }

  static String cmakePreamble(final String project, final String language,
      final String standardVariable) {
    return Code.block("cmake_minimum_required(VERSION 3.21)", "",
        "project(" + project + " " + language + ")", "",
        "set(" + standardVariable + " 17)", "set(" + standardVariable + "_REQUIRED ON)",
        "set(" + standardVariable.replace("STANDARD", "EXTENSIONS") + " ON)", "",
        "# Set the default build type to Debug.", "if(NOT CMAKE_BUILD_TYPE)",
        "   set(CMAKE_BUILD_TYPE Debug)", "endif()", "", "include(project.cmake)", "");
  }

}
