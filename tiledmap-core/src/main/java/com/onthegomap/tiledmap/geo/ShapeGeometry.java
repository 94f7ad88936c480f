package com.onthegomap.tiledmap.geo;

import com.onthegomap.tiledmap.TmxException;
import java.util.ArrayList;
import java.util.List;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

/**
 * A collection of utilities for rotating, measuring and testing object geometries in map pixel coordinates.
 */
public class ShapeGeometry {

  public static final GeometryFactory JTS_FACTORY = new GeometryFactory();
  public static final Geometry EMPTY_GEOMETRY = JTS_FACTORY.createGeometryCollection();
  private static final double RAY_EPSILON = 1e-10;

  private ShapeGeometry() {}

  /**
   * Returns {@code points} rotated clockwise on screen (y pointing down) by {@code angleDegrees} around
   * {@code origin}.
   */
  public static List<PointXY> rotate(List<PointXY> points, PointXY origin, double angleDegrees) {
    if (angleDegrees == 0) {
      return List.copyOf(points);
    }
    double radians = Math.toRadians(angleDegrees);
    double sin = Math.sin(radians);
    double cos = Math.cos(radians);
    List<PointXY> result = new ArrayList<>(points.size());
    for (PointXY point : points) {
      double dx = point.x() - origin.x();
      double dy = point.y() - origin.y();
      result.add(new PointXY(
        origin.x() + cos * dx - sin * dy,
        origin.y() + sin * dx + cos * dy
      ));
    }
    return result;
  }

  /**
   * Returns the axis-aligned bounds of {@code points} with each edge truncated toward zero.
   *
   * @throws IllegalArgumentException if {@code points} is empty
   */
  public static BoundingBox boundingBox(List<PointXY> points) {
    if (points.isEmpty()) {
      throw new IllegalArgumentException("Cannot compute the bounding box of an empty point list");
    }
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
    return new BoundingBox((int) minX, (int) minY, (int) maxX, (int) maxY);
  }

  /**
   * Returns true if {@code point} is inside {@code polygon} by casting a horizontal ray and counting edge crossings.
   * <p>
   * Points on a left or top edge or vertex count as inside. An empty polygon contains nothing.
   */
  public static boolean pointInPolygon(PointXY point, List<PointXY> polygon) {
    double x = point.x();
    double y = point.y();
    boolean inside = false;
    int n = polygon.size();
    for (int i = 0; i < n; i++) {
      PointXY pi = polygon.get(i);
      PointXY pj = polygon.get((i + n - 1) % n);
      boolean crosses = (pi.y() > y) != (pj.y() > y) &&
        x < (pj.x() - pi.x()) * (y - pi.y()) / (pj.y() - pi.y() + RAY_EPSILON) + pi.x();
      if (crosses) {
        inside = !inside;
      }
    }
    return inside;
  }

  /** Returns true if {@code point} is inside or on the axis-aligned ellipse with the given center and radii. */
  public static boolean pointInEllipse(PointXY point, PointXY center, double radiusX, double radiusY) {
    double dx = point.x() - center.x();
    double dy = point.y() - center.y();
    return (dx * dx) / (radiusX * radiusX) + (dy * dy) / (radiusY * radiusY) <= 1;
  }

  /**
   * Returns true if every consecutive triple of vertices (wrapping around) turns the same way. Collinear triples
   * count as a right turn, and polygons with fewer than 3 vertices are convex.
   */
  public static boolean isConvex(List<PointXY> polygon) {
    int n = polygon.size();
    if (n < 3) {
      return true;
    }
    boolean anyLeft = false;
    boolean anyRight = false;
    for (int i = 0; i < n; i++) {
      if (cross(polygon.get(i), polygon.get((i + 1) % n), polygon.get((i + 2) % n)) > 0) {
        anyLeft = true;
      } else {
        anyRight = true;
      }
    }
    return !(anyLeft && anyRight);
  }

  private static double cross(PointXY p1, PointXY p2, PointXY p3) {
    return (p2.x() - p1.x()) * (p3.y() - p1.y()) - (p2.y() - p1.y()) * (p3.x() - p1.x());
  }

  /** Returns true if the interiors of two boxes overlap. */
  public static boolean intersectsRect(BoundingBox a, BoundingBox b) {
    return a.intersects(b);
  }

  /**
   * Returns true if two convex polygons overlap or touch, using the separating axis theorem over the edge normals of
   * both polygons.
   *
   * @throws TmxException of kind {@link TmxException.Kind#NON_CONVEX_POLYGON} if either polygon is concave
   */
  public static boolean intersectsPolygon(List<PointXY> a, List<PointXY> b) throws TmxException {
    if (!isConvex(a) || !isConvex(b)) {
      throw new TmxException(TmxException.Kind.NON_CONVEX_POLYGON, "separating axis test requires convex polygons");
    }
    List<PointXY> axes = new ArrayList<>(a.size() + b.size());
    addAxes(a, axes);
    addAxes(b, axes);
    for (PointXY axis : axes) {
      double[] projA = project(a, axis);
      double[] projB = project(b, axis);
      if (projA[1] < projB[0] || projB[1] < projA[0]) {
        return false;
      }
    }
    return true;
  }

  private static void addAxes(List<PointXY> polygon, List<PointXY> axes) {
    int n = polygon.size();
    for (int i = 0; i < n; i++) {
      PointXY p1 = polygon.get(i);
      PointXY p2 = polygon.get((i + 1) % n);
      double nx = -(p2.y() - p1.y());
      double ny = p2.x() - p1.x();
      double length = Math.hypot(nx, ny);
      if (length > 0) {
        axes.add(new PointXY(nx / length, ny / length));
      }
    }
  }

  private static double[] project(List<PointXY> polygon, PointXY axis) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (PointXY p : polygon) {
      double dot = p.x() * axis.x() + p.y() * axis.y();
      min = Math.min(min, dot);
      max = Math.max(max, dot);
    }
    return new double[]{min, max};
  }

  /**
   * Returns a JTS geometry for {@code shape}: a polygon for closed shapes with at least 3 points, a line string for
   * polylines, a point for single-point shapes, and an empty geometry otherwise.
   */
  public static Geometry toGeometry(Shape shape) {
    List<PointXY> points = shape.points();
    if (points.isEmpty()) {
      return EMPTY_GEOMETRY;
    } else if (points.size() == 1) {
      return JTS_FACTORY.createPoint(points.get(0).toCoordinate());
    } else if (shape.closed() && points.size() >= 3) {
      return JTS_FACTORY.createPolygon(coordinates(points, true));
    } else {
      return JTS_FACTORY.createLineString(coordinates(points, false));
    }
  }

  /** Returns a JTS polygon through {@code points}, closing the ring. */
  public static Geometry toPolygon(List<PointXY> points) {
    return JTS_FACTORY.createPolygon(coordinates(points, true));
  }

  private static Coordinate[] coordinates(List<PointXY> points, boolean close) {
    int n = points.size();
    Coordinate[] result = new Coordinate[close ? n + 1 : n];
    for (int i = 0; i < n; i++) {
      result[i] = points.get(i).toCoordinate();
    }
    if (close) {
      result[n] = result[0].copy();
    }
    return result;
  }
}
