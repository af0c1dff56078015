package com.github.llfsm.layout;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

/**
 * Tests for the layout geometry.
 */
public class LayoutTest {
  private static final double delta = 1e-9;

  @Test
  public void testVectorArithmetic() {
    final Point2D a = new Point2D(5, 7);
    final Point2D b = new Point2D(2, 3);
    assertEquals(new Point2D(7, 10), a.plus(b));
    assertEquals(new Point2D(3, 4), a.minus(b));
    assertEquals(5, new Point2D(3, 4).polarDistance(), delta);
  }

  @Test
  public void testPolarAngleCoversAllQuadrants() {
    assertEquals(0, new Point2D(1, 0).polarAngle(), delta);
    assertEquals(Math.PI / 2, new Point2D(0, 1).polarAngle(), delta);
    assertEquals(Math.PI, new Point2D(-1, 0).polarAngle(), delta);
    assertEquals(3 * Math.PI / 2, new Point2D(0, -1).polarAngle(), delta);
    assertEquals(5 * Math.PI / 4, new Point2D(-1, -1).polarAngle(), delta);

    final Point2D polar = Point2D.polar(2, 3 * Math.PI / 4);
    assertEquals(2, polar.polarDistance(), delta);
    assertEquals(3 * Math.PI / 4, polar.polarAngle(), delta);
  }

  @Test
  public void testRectangleEdges() {
    final Rectangle rectangle = Rectangle.centredAt(new Point2D(100, 50), new Point2D(100, 50));
    assertEquals(100, rectangle.getX(), delta);
    assertEquals(50, rectangle.getY(), delta);
    assertEquals(50, rectangle.getLeftX(), delta);
    assertEquals(25, rectangle.getTopY(), delta);
    assertEquals(149, rectangle.getRightX(), delta);
    assertEquals(74, rectangle.getBottomY(), delta);
    assertEquals(new Point2D(149, 74), rectangle.getBottomRight());
    assertEquals(new Point2D(149, 25), rectangle.getTopRight());
    assertEquals(new Point2D(50, 74), rectangle.getBottomLeft());

    final Rectangle moved = rectangle.withCentre(new Point2D(0, 0));
    assertEquals(new Point2D(-50, -25), moved.getTopLeft());
    final Rectangle wider = rectangle.withDimensions(new Point2D(200, 50));
    assertEquals(rectangle.getCentre(), wider.getCentre());
    assertEquals(0, wider.getLeftX(), delta);
  }

  @Test
  public void testGridPlacesEightStatesPerRow() {
    final StateLayout first = StateLayout.grid(0);
    assertEquals(new Point2D(100, 50), first.getClosedLayout().getCentre());
    assertEquals(first.getClosedLayout().getCentre(), first.getOpenLayout().getCentre());
    assertEquals(100.0 / 6, first.getOnEntryHeight(), delta);
    assertEquals(new Point2D(100 + 200 * 7, 50), StateLayout.grid(7).getClosedLayout().getCentre());
    assertEquals(new Point2D(100, 150), StateLayout.grid(8).getClosedLayout().getCentre());
  }

  @Test
  public void testOpenStateShowsOpenLayout() {
    final StateLayout layout = StateLayout.grid(3);
    assertFalse(layout.isOpen());
    assertEquals(layout.getClosedLayout(), layout.getLayout());
    layout.setOpen(true);
    assertTrue(layout.isOpen());
    assertEquals(layout.getOpenLayout(), layout.getLayout());
    assertEquals(200, layout.getLayout().getW(), delta);
  }

  @Test
  public void testPathPoints() {
    final Path path = new Path(new Point2D(0, 0), new Point2D(1, 1), new Point2D(2, 2),
        new Point2D(3, 3));
    assertEquals(4, path.size());
    assertEquals(new Point2D(0, 0), path.getBegin());
    assertEquals(new Point2D(1, 1), path.getControlPoint1());
    assertEquals(new Point2D(2, 2), path.getControlPoint2());
    assertEquals(new Point2D(3, 3), path.getEnd());
    assertEquals(new Point2D(13, 3), path.translated(new Point2D(10, 0)).getEnd());
  }

}
