package com.flamingo.ai.autocategorize.service.image;

/** Mean channel values, each in [0, 255]. */
public record RgbColor(double r, double g, double b) {

  /** Euclidean distance in RGB space; at most sqrt(3 * 255^2). */
  public double distanceTo(RgbColor other) {
    double dr = r - other.r;
    double dg = g - other.g;
    double db = b - other.b;
    return Math.sqrt(dr * dr + dg * dg + db * db);
  }
}
