package com.github.llfsm.layout;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable bezier path. A cubic curve has four points: begin, two control points and end.
 */
public final class Path {
  private final List<Point2D> points;

  public Path(final List<Point2D> points) {
    this.points = Collections.unmodifiableList(new ArrayList<>(points));
  }

  public Path(final Point2D... points) {
    this(Arrays.asList(points));
  }

  public List<Point2D> getPoints() {
    return points;
  }

  public int size() {
    return points.size();
  }

  public boolean isEmpty() {
    return points.isEmpty();
  }

  public Point2D getBegin() {
    return points.get(0);
  }

  public Point2D getControlPoint1() {
    return points.get(1);
  }

  public Point2D getControlPoint2() {
    return points.get(2);
  }

  public Point2D getEnd() {
    return points.get(points.size() - 1);
  }

  public Path translated(final Point2D offset) {
    final List<Point2D> moved = new ArrayList<>(points.size());
    for (final Point2D point : points) {
      moved.add(point.plus(offset));
    }
    return new Path(moved);
  }

  @Override
  public int hashCode() {
    return points.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    return obj instanceof Path && points.equals(((Path) obj).points);
  }

  @Override
  public String toString() {
    return "Path " + points;
  }

}
