package com.github.llfsm.layout;

/**
 * Property list keys of a transition layout dictionary, plus the key of the per-state array of
 * transition layouts.
 */
public enum TransitionLayoutKey {
  TRANSITIONS("Transitions"), BEZIER_PATH("bezierPath"), SRC_POINT("srcPoint"),
  SRC_POINT_X("srcPointX"), SRC_POINT_Y("srcPointY"), DST_POINT("dstPoint"),
  DST_POINT_X("dstPointX"), DST_POINT_Y("dstPointY"), CTL_POINT_1("controlPoint1"),
  CTL_POINT_1_X("controlPoint1X"), CTL_POINT_1_Y("controlPoint1Y"),
  CTL_POINT_2("controlPoint2"), CTL_POINT_2_X("controlPoint2X"),
  CTL_POINT_2_Y("controlPoint2Y");

  private final String key;

  private TransitionLayoutKey(final String key) {
    this.key = key;
  }

  public String getKey() {
    return key;
  }
}
