package com.onthegomap.tiledmap.geo;

/**
 * Axis-aligned integer bounds of a set of points, each edge truncated toward zero.
 */
public record BoundingBox(int minX, int minY, int maxX, int maxY) {

  /** Returns true if the interiors overlap; boxes that only share an edge do not intersect. */
  public boolean intersects(BoundingBox other) {
    return minX < other.maxX && maxX > other.minX && minY < other.maxY && maxY > other.minY;
  }

  public int width() {
    return maxX - minX;
  }

  public int height() {
    return maxY - minY;
  }
}
