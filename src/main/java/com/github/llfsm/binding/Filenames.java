package com.github.llfsm.binding;

/**
 * Fixed member file names of machine and arrangement directories.
 */
public final class Filenames {
  public static final String LANGUAGE = "Language";
  public static final String VERSION = "Version";
  public static final String FILE_VERSION = "1.3";
  public static final String STATES = "States";
  public static final String LAYOUT = "Layout.plist";
  public static final String WINDOW_LAYOUT = "WindowLayout.plist";
  public static final String MACHINES = "Machines";
  public static final String SUSPEND_STATE = "SuspendState";
  public static final String MACHINE_EXTENSION = ".machine";
  public static final String ARRANGEMENT_EXTENSION = ".arrangement";

  private Filenames() {}

  public static String stateTransitions(final String stateName) {
    return "STATE_" + stateName + "_Transitions";
  }

  /**
   * @return the directory name without its extension
   */
  public static String baseName(final String directoryName) {
    final int dot = directoryName.lastIndexOf('.');
    return dot > 0 ? directoryName.substring(0, dot) : directoryName;
  }

}
