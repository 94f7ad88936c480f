package com.onthegomap.tiledmap.geo;

import com.onthegomap.tiledmap.TmxException;
import com.onthegomap.tiledmap.config.TiledMapConfig;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves the shape child element of an object into vertices in map pixel coordinates.
 */
public class ShapeParser {

  private ShapeParser() {}

  /** Shorthand for {@link #parse(ShapeXml, double, double, double, double, int)} with 16 ellipse segments. */
  public static Shape parse(ShapeXml xml, double x, double y, double width, double height) throws TmxException {
    return parse(xml, x, y, width, height, TiledMapConfig.DEFAULT_ELLIPSE_SEGMENTS);
  }

  /**
   * Returns the shape of an object anchored at ({@code x}, {@code y}) with declared size {@code width} x
   * {@code height}.
   *
   * @param xml             the shape child element, or null for a plain rectangle
   * @param ellipseSegments number of vertices used to approximate an ellipse
   * @throws TmxException if the element is not a known shape, or its point list or text attributes are malformed
   */
  public static Shape parse(ShapeXml xml, double x, double y, double width, double height, int ellipseSegments)
    throws TmxException {
    if (xml == null) {
      return Shape.of(ShapeKind.RECTANGLE, rectanglePoints(x, y, width, height), width, height, null, null);
    }
    ShapeKind kind = ShapeKind.findByTag(xml.tag())
      .orElseThrow(() -> new TmxException(TmxException.Kind.MALFORMED_SHAPE_DATA, "unknown shape " + xml.tag()));
    return switch (kind) {
      case POLYGON, POLYLINE -> {
        List<PointXY> points = new ArrayList<>();
        for (PointXY offset : parsePoints(xml.attributes().get("points"))) {
          points.add(offset.translate(x, y));
        }
        yield Shape.of(kind, points, width, height, null, null);
      }
      case ELLIPSE -> Shape.of(kind, ellipsePoints(x, y, width, height, ellipseSegments, 0), width, height, null,
        new Shape.Ellipse(new PointXY(x + width / 2, y + height / 2), width / 2, height / 2));
      case TEXT -> Shape.of(kind, List.of(), width, height, TextStyle.parse(xml), null);
      case POINT -> Shape.of(kind, List.of(), width, height, null, null);
      case RECTANGLE -> Shape.of(kind, rectanglePoints(x, y, width, height), width, height, null, null);
    };
  }

  /** Returns the corners of a rectangle clockwise from the top-left: (x,y), (x+w,y), (x+w,y+h), (x,y+h). */
  public static List<PointXY> rectanglePoints(double x, double y, double width, double height) {
    return List.of(
      new PointXY(x, y),
      new PointXY(x + width, y),
      new PointXY(x + width, y + height),
      new PointXY(x, y + height)
    );
  }

  /**
   * Returns {@code segments} evenly spaced points around the ellipse inscribed in the given rectangle, starting at
   * angle 0 (the right-most point) and rotated by {@code rotationRadians} about its center.
   */
  public static List<PointXY> ellipsePoints(double x, double y, double width, double height, int segments,
    double rotationRadians) {
    double cx = x + width / 2;
    double cy = y + height / 2;
    double rx = width / 2;
    double ry = height / 2;
    double cosRotation = Math.cos(rotationRadians);
    double sinRotation = Math.sin(rotationRadians);
    List<PointXY> result = new ArrayList<>(Math.max(segments, 0));
    for (int i = 0; i < segments; i++) {
      double theta = 2 * Math.PI * i / segments;
      double px = rx * Math.cos(theta);
      double py = ry * Math.sin(theta);
      result.add(new PointXY(
        cx + px * cosRotation - py * sinRotation,
        cy + px * sinRotation + py * cosRotation
      ));
    }
    return result;
  }

  /**
   * Parses a whitespace-separated list of {@code "x,y"} pairs.
   *
   * @throws TmxException if a pair does not have exactly two numeric components
   */
  public static List<PointXY> parsePoints(String text) throws TmxException {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    String[] pairs = text.strip().split("\\s+");
    List<PointXY> result = new ArrayList<>(pairs.length);
    for (String pair : pairs) {
      String[] parts = pair.split(",", -1);
      if (parts.length != 2) {
        throw new TmxException(TmxException.Kind.MALFORMED_SHAPE_DATA, "invalid point '" + pair + "'");
      }
      try {
        result.add(new PointXY(Double.parseDouble(parts[0]), Double.parseDouble(parts[1])));
      } catch (NumberFormatException e) {
        throw new TmxException(TmxException.Kind.MALFORMED_SHAPE_DATA, "invalid point '" + pair + "'", e);
      }
    }
    return result;
  }
}
