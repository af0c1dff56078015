package com.github.llfsm.layout;

/**
 * Immutable two-dimensional vector, used both for coordinates and for width/height dimensions.
 */
public final class Point2D {
  public static final Point2D ORIGIN = new Point2D(0, 0);

  private final double x;
  private final double y;

  public Point2D(final double x, final double y) {
    this.x = x;
    this.y = y;
  }

  public static Point2D polar(final double r, final double theta) {
    return new Point2D(r * Math.cos(theta), r * Math.sin(theta));
  }

  public double getX() {
    return x;
  }

  public double getY() {
    return y;
  }

  // width and height when used as dimensions
  public double getW() {
    return x;
  }

  public double getH() {
    return y;
  }

  public Point2D plus(final Point2D other) {
    return new Point2D(x + other.x, y + other.y);
  }

  public Point2D minus(final Point2D other) {
    return new Point2D(x - other.x, y - other.y);
  }

  public double polarDistance() {
    return Math.sqrt(x * x + y * y);
  }

  /**
   * @return the angle in [0, 2pi)
   */
  public double polarAngle() {
    final double angle = Math.atan2(y, x);
    return angle < 0 ? angle + 2 * Math.PI : angle;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    long temp = Double.doubleToLongBits(x);
    result = prime * result + (int) (temp ^ (temp >>> 32));
    temp = Double.doubleToLongBits(y);
    result = prime * result + (int) (temp ^ (temp >>> 32));
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Point2D)) {
      return false;
    }
    final Point2D other = (Point2D) obj;
    return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
  }

  @Override
  public String toString() {
    return "(" + x + ", " + y + ")";
  }

}
