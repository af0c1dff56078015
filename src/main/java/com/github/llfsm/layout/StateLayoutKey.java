package com.github.llfsm.layout;

/**
 * Property list keys of a state layout dictionary.
 */
public enum StateLayoutKey {
  POSITION_X("x"), POSITION_Y("y"), WIDTH("w"), HEIGHT("h"), EXPANDED("expanded"),
  ON_ENTRY_HEIGHT("onEntryHeight"), ON_EXIT_HEIGHT("onExitHeight"),
  INTERNAL_HEIGHT("internalHeight"), ON_SUSPEND_HEIGHT("onSuspendHeight"),
  ON_RESUME_HEIGHT("onResumeHeight"), ZOOMED_ON_ENTRY_HEIGHT("zoomedOnEntryHeight"),
  ZOOMED_ON_EXIT_HEIGHT("zoomedOnExitHeight"), ZOOMED_INTERNAL_HEIGHT("zoomedInternalHeight"),
  ZOOMED_ON_SUSPEND_HEIGHT("zoomedOnSuspendHeight"),
  ZOOMED_ON_RESUME_HEIGHT("zoomedOnResumeHeight"), EXPANDED_WIDTH("expandedWidth"),
  EXPANDED_HEIGHT("expandedHeight");

  private final String key;

  private StateLayoutKey(final String key) {
    this.key = key;
  }

  public String getKey() {
    return key;
  }
}
