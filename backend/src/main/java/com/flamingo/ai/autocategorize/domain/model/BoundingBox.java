package com.flamingo.ai.autocategorize.domain.model;

import java.util.List;

/**
 * Axis-aligned rectangle in image pixel coordinates, {@code (x1, y1)} top-left and {@code (x2, y2)}
 * bottom-right.
 */
public record BoundingBox(double x1, double y1, double x2, double y2) {

  /**
   * Builds the enclosing box of a detection polygon.
   *
   * @param vertices polygon vertices; detectors report four
   * @return the enclosing box, or null when fewer than four vertices are present
   */
  public static BoundingBox fromVertices(List<Point> vertices) {
    if (vertices == null || vertices.size() < 4) {
      return null;
    }
    double minX = Double.MAX_VALUE;
    double minY = Double.MAX_VALUE;
    double maxX = -Double.MAX_VALUE;
    double maxY = -Double.MAX_VALUE;
    for (Point p : vertices) {
      minX = Math.min(minX, p.x());
      minY = Math.min(minY, p.y());
      maxX = Math.max(maxX, p.x());
      maxY = Math.max(maxY, p.y());
    }
    return new BoundingBox(minX, minY, maxX, maxY);
  }

  public double width() {
    return x2 - x1;
  }

  public double height() {
    return y2 - y1;
  }

  /** Area of the box; zero for degenerate or inverted boxes. */
  public double area() {
    return Math.max(0, width()) * Math.max(0, height());
  }

  /**
   * Returns true unless the boxes are fully disjoint on either axis. Touching edges count as an
   * overlap.
   */
  public boolean overlaps(BoundingBox other) {
    return !(other.x2 < x1 || other.x1 > x2 || other.y2 < y1 || other.y1 > y2);
  }
}
