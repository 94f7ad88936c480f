package com.onthegomap.tiledmap.geo;

import java.util.List;

/**
 * The resolved geometry of a Tiled object in map pixel coordinates.
 * <p>
 * Ellipses are represented by a polygonal approximation in {@code points}, with the analytic form kept in
 * {@code ellipse} for exact containment tests. {@code width} and {@code height} are the extent of {@code points}, or
 * the declared size of the object when there are no points (points and text objects).
 *
 * @param kind    what the object declared itself as
 * @param points  vertices in order, already translated to the object's position
 * @param closed  whether the last vertex connects back to the first
 * @param width   horizontal extent
 * @param height  vertical extent
 * @param text    text content and style, only for {@link ShapeKind#TEXT}
 * @param ellipse center and radii, only for {@link ShapeKind#ELLIPSE}
 */
public record Shape(
  ShapeKind kind,
  List<PointXY> points,
  boolean closed,
  double width,
  double height,
  TextStyle text,
  Ellipse ellipse
) {

  public Shape {
    points = List.copyOf(points);
  }

  /** Center and radii of an ellipse. */
  public record Ellipse(PointXY center, double radiusX, double radiusY) {

    public boolean contains(PointXY point) {
      return ShapeGeometry.pointInEllipse(point, center, radiusX, radiusY);
    }
  }

  /** Creates a shape whose width and height are the extent of {@code points}, or the declared size if empty. */
  static Shape of(ShapeKind kind, List<PointXY> points, double declaredWidth, double declaredHeight, TextStyle text,
    Ellipse ellipse) {
    double width = declaredWidth;
    double height = declaredHeight;
    if (!points.isEmpty()) {
      double minX = Double.POSITIVE_INFINITY;
      double minY = Double.POSITIVE_INFINITY;
      double maxX = Double.NEGATIVE_INFINITY;
      double maxY = Double.NEGATIVE_INFINITY;
      for (PointXY point : points) {
        minX = Math.min(minX, point.x());
        minY = Math.min(minY, point.y());
        maxX = Math.max(maxX, point.x());
        maxY = Math.max(maxY, point.y());
      }
      width = maxX - minX;
      height = maxY - minY;
    }
    return new Shape(kind, points, kind.closed(), width, height, text, ellipse);
  }

  public boolean isEmpty() {
    return points.isEmpty();
  }
}
