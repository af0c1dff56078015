package com.github.llfsm.layout;

import java.util.Objects;

/**
 * Presentation metadata of a single state: its closed (ellipse) and open (rectangle) geometry and
 * the heights of its action sections, both normal and zoomed.
 */
public final class StateLayout {
  public static final double closedWidth = 100;
  public static final double closedHeight = 50;
  public static final double openWidth = 200;
  public static final double openHeight = 100;
  // states per row of the default grid
  static final int gridColumns = 8;

  private boolean open;
  private Rectangle openLayout;
  private Rectangle closedLayout;
  private double onEntryHeight;
  private double onExitHeight;
  private double internalHeight;
  private double onSuspendHeight;
  private double onResumeHeight;
  private double zoomedOnEntryHeight;
  private double zoomedOnExitHeight;
  private double zoomedInternalHeight;
  private double zoomedOnSuspendHeight;
  private double zoomedOnResumeHeight;

  public StateLayout(final Rectangle closedLayout, final Rectangle openLayout,
      final double sectionHeight) {
    this.closedLayout = Objects.requireNonNull(closedLayout);
    this.openLayout = Objects.requireNonNull(openLayout);
    onEntryHeight = onExitHeight = internalHeight = onSuspendHeight =
        onResumeHeight = sectionHeight;
    zoomedOnEntryHeight = zoomedOnExitHeight = zoomedInternalHeight = zoomedOnSuspendHeight =
        zoomedOnResumeHeight = sectionHeight;
  }

  /**
   * Default layout of the state at the given index: states are placed on a grid eight columns
   * wide, each grid cell the size of an open state.
   */
  public static StateLayout grid(final int index) {
    return grid(index, closedWidth, closedHeight, openWidth, openHeight);
  }

  public static StateLayout grid(final int index, final double cw, final double ch,
      final double ow, final double oh) {
    final Point2D centre = gridCentre(index, cw, ch, ow, oh);
    return new StateLayout(Rectangle.centredAt(centre, new Point2D(cw, ch)),
        Rectangle.centredAt(centre, new Point2D(ow, oh)), oh / 6);
  }

  static Point2D gridCentre(final int index, final double cw, final double ch, final double ow,
      final double oh) {
    return new Point2D(cw + ow * (index % gridColumns), ch + oh * (index / gridColumns));
  }

  /**
   * @return the layout currently shown, depending on whether the state is open
   */
  public Rectangle getLayout() {
    return open ? openLayout : closedLayout;
  }

  public boolean isOpen() {
    return open;
  }

  public void setOpen(boolean open) {
    this.open = open;
  }

  public Rectangle getOpenLayout() {
    return openLayout;
  }

  public void setOpenLayout(final Rectangle openLayout) {
    this.openLayout = Objects.requireNonNull(openLayout);
  }

  public Rectangle getClosedLayout() {
    return closedLayout;
  }

  public void setClosedLayout(final Rectangle closedLayout) {
    this.closedLayout = Objects.requireNonNull(closedLayout);
  }

  public double getOnEntryHeight() {
    return onEntryHeight;
  }

  public void setOnEntryHeight(double onEntryHeight) {
    this.onEntryHeight = onEntryHeight;
  }

  public double getOnExitHeight() {
    return onExitHeight;
  }

  public void setOnExitHeight(double onExitHeight) {
    this.onExitHeight = onExitHeight;
  }

  public double getInternalHeight() {
    return internalHeight;
  }

  public void setInternalHeight(double internalHeight) {
    this.internalHeight = internalHeight;
  }

  public double getOnSuspendHeight() {
    return onSuspendHeight;
  }

  public void setOnSuspendHeight(double onSuspendHeight) {
    this.onSuspendHeight = onSuspendHeight;
  }

  public double getOnResumeHeight() {
    return onResumeHeight;
  }

  public void setOnResumeHeight(double onResumeHeight) {
    this.onResumeHeight = onResumeHeight;
  }

  public double getZoomedOnEntryHeight() {
    return zoomedOnEntryHeight;
  }

  public void setZoomedOnEntryHeight(double zoomedOnEntryHeight) {
    this.zoomedOnEntryHeight = zoomedOnEntryHeight;
  }

  public double getZoomedOnExitHeight() {
    return zoomedOnExitHeight;
  }

  public void setZoomedOnExitHeight(double zoomedOnExitHeight) {
    this.zoomedOnExitHeight = zoomedOnExitHeight;
  }

  public double getZoomedInternalHeight() {
    return zoomedInternalHeight;
  }

  public void setZoomedInternalHeight(double zoomedInternalHeight) {
    this.zoomedInternalHeight = zoomedInternalHeight;
  }

  public double getZoomedOnSuspendHeight() {
    return zoomedOnSuspendHeight;
  }

  public void setZoomedOnSuspendHeight(double zoomedOnSuspendHeight) {
    this.zoomedOnSuspendHeight = zoomedOnSuspendHeight;
  }

  public double getZoomedOnResumeHeight() {
    return zoomedOnResumeHeight;
  }

  public void setZoomedOnResumeHeight(double zoomedOnResumeHeight) {
    this.zoomedOnResumeHeight = zoomedOnResumeHeight;
  }

  @Override
  public int hashCode() {
    return Objects.hash(open, openLayout, closedLayout, onEntryHeight, onExitHeight,
        internalHeight, onSuspendHeight, onResumeHeight, zoomedOnEntryHeight,
        zoomedOnExitHeight, zoomedInternalHeight, zoomedOnSuspendHeight, zoomedOnResumeHeight);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    final StateLayout other = (StateLayout) obj;
    return open == other.open && openLayout.equals(other.openLayout)
        && closedLayout.equals(other.closedLayout)
        && Double.compare(onEntryHeight, other.onEntryHeight) == 0
        && Double.compare(onExitHeight, other.onExitHeight) == 0
        && Double.compare(internalHeight, other.internalHeight) == 0
        && Double.compare(onSuspendHeight, other.onSuspendHeight) == 0
        && Double.compare(onResumeHeight, other.onResumeHeight) == 0
        && Double.compare(zoomedOnEntryHeight, other.zoomedOnEntryHeight) == 0
        && Double.compare(zoomedOnExitHeight, other.zoomedOnExitHeight) == 0
        && Double.compare(zoomedInternalHeight, other.zoomedInternalHeight) == 0
        && Double.compare(zoomedOnSuspendHeight, other.zoomedOnSuspendHeight) == 0
        && Double.compare(zoomedOnResumeHeight, other.zoomedOnResumeHeight) == 0;
  }

  @Override
  public String toString() {
    return "StateLayout [open=" + open + ", closedLayout=" + closedLayout + ", openLayout="
        + openLayout + "]";
  }

}
