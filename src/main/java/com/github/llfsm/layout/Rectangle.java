package com.github.llfsm.layout;

import java.util.Objects;

/**
 * Immutable axis-aligned rectangle given by its top left corner and its dimensions. Ellipses are
 * represented by the rectangle they are inscribed in.
 */
public final class Rectangle {
  private final Point2D topLeft;
  private final Point2D dimensions;

  public Rectangle(final Point2D topLeft, final Point2D dimensions) {
    this.topLeft = Objects.requireNonNull(topLeft);
    this.dimensions = Objects.requireNonNull(dimensions);
  }

  public static Rectangle centredAt(final Point2D centre, final Point2D dimensions) {
    return new Rectangle(new Point2D(centre.getX() - dimensions.getW() / 2,
        centre.getY() - dimensions.getH() / 2), dimensions);
  }

  public Point2D getTopLeft() {
    return topLeft;
  }

  public Point2D getDimensions() {
    return dimensions;
  }

  public double getW() {
    return dimensions.getW();
  }

  public double getH() {
    return dimensions.getH();
  }

  /**
   * @return x coordinate of the centre
   */
  public double getX() {
    return topLeft.getX() + getW() / 2;
  }

  /**
   * @return y coordinate of the centre
   */
  public double getY() {
    return topLeft.getY() + getH() / 2;
  }

  public Point2D getCentre() {
    return new Point2D(getX(), getY());
  }

  public double getLeftX() {
    return topLeft.getX();
  }

  public double getTopY() {
    return topLeft.getY();
  }

  // right and bottom are inclusive pixel coordinates
  public double getRightX() {
    return topLeft.getX() + getW() - 1;
  }

  public double getBottomY() {
    return topLeft.getY() + getH() - 1;
  }

  public Point2D getBottomRight() {
    return new Point2D(getRightX(), getBottomY());
  }

  public Point2D getTopRight() {
    return new Point2D(getRightX(), getTopY());
  }

  public Point2D getBottomLeft() {
    return new Point2D(getLeftX(), getBottomY());
  }

  public Rectangle withCentre(final Point2D centre) {
    return centredAt(centre, dimensions);
  }

  public Rectangle withDimensions(final Point2D dimensions) {
    return centredAt(getCentre(), dimensions);
  }

  @Override
  public int hashCode() {
    return Objects.hash(topLeft, dimensions);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Rectangle)) {
      return false;
    }
    final Rectangle other = (Rectangle) obj;
    return topLeft.equals(other.topLeft) && dimensions.equals(other.dimensions);
  }

  @Override
  public String toString() {
    return "Rectangle [topLeft=" + topLeft + ", dimensions=" + dimensions + "]";
  }

}
