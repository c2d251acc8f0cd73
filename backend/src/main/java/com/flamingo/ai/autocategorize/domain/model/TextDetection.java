package com.flamingo.ai.autocategorize.domain.model;

import java.util.List;

/**
 * One word or line reported by the OCR provider.
 *
 * @param text detected text
 * @param vertices polygon around the text, normally four vertices
 */
public record TextDetection(String text, List<Point> vertices) {

  public TextDetection {
    text = text == null ? "" : text;
    vertices = vertices == null ? List.of() : List.copyOf(vertices);
  }

  /** Enclosing box of the polygon, or null when the polygon is incomplete. */
  public BoundingBox boundingBox() {
    return BoundingBox.fromVertices(vertices);
  }
}
