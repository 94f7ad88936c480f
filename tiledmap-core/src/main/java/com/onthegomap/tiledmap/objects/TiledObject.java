package com.onthegomap.tiledmap.objects;

import com.onthegomap.tiledmap.TmxException;
import com.onthegomap.tiledmap.config.TiledMapConfig;
import com.onthegomap.tiledmap.geo.BoundingBox;
import com.onthegomap.tiledmap.geo.Orientation;
import com.onthegomap.tiledmap.geo.OrientationTransform;
import com.onthegomap.tiledmap.geo.PointXY;
import com.onthegomap.tiledmap.geo.Shape;
import com.onthegomap.tiledmap.geo.ShapeGeometry;
import com.onthegomap.tiledmap.geo.ShapeKind;
import com.onthegomap.tiledmap.geo.ShapeParser;
import com.onthegomap.tiledmap.tile.GidRegistry;
import com.onthegomap.tiledmap.util.Parse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.concurrent.Immutable;

/**
 * A parsed {@code <object>}: a rectangle, polygon, polyline, ellipse, point, text or tile object, positioned in map
 * pixels.
 * <p>
 * Objects with a non-zero {@code gid} are tile objects. Their GID is normalized through the host
 * {@link GidRegistry} and they always take the rectangle shape.
 */
@Immutable
public final class TiledObject {

  private final int id;
  private final String name;
  private final String type;
  private final double x;
  private final double y;
  private final double width;
  private final double height;
  private final double rotation;
  private final int gid;
  private final boolean visible;
  private final String template;
  private final Map<String, String> properties;
  private final Shape shape;

  private TiledObject(int id, String name, String type, double x, double y, double width, double height,
    double rotation, int gid, boolean visible, String template, Map<String, String> properties, Shape shape) {
    this.id = id;
    this.name = name;
    this.type = type;
    this.x = x;
    this.y = y;
    this.width = width;
    this.height = height;
    this.rotation = rotation;
    this.gid = gid;
    this.visible = visible;
    this.template = template;
    this.properties = properties;
    this.shape = shape;
  }

  /**
   * Parses {@code xml}, which must already have any template applied (see {@link ObjectTemplates}).
   *
   * @throws TmxException if a numeric attribute or the shape element is malformed
   */
  public static TiledObject parse(ObjectXml xml, GidRegistry registry, TiledMapConfig config) throws TmxException {
    Map<String, String> attrs = xml.attributes();
    double x = Parse.parseDouble(attrs, "x", 0, TmxException.Kind.MALFORMED_TILE_DATA);
    double y = Parse.parseDouble(attrs, "y", 0, TmxException.Kind.MALFORMED_TILE_DATA);
    double width = Parse.parseDouble(attrs, "width", 0, TmxException.Kind.MALFORMED_TILE_DATA);
    double height = Parse.parseDouble(attrs, "height", 0, TmxException.Kind.MALFORMED_TILE_DATA);
    int rawGid = Parse.parseGid(attrs, "gid");
    int gid = rawGid == 0 ? 0 : registry.registerGid(rawGid);

    Shape shape = ShapeParser.parse(gid != 0 ? null : xml.shape(), x, y, width, height, config.ellipseSegments());

    return new TiledObject(
      Parse.parseInt(attrs, "id", 0, TmxException.Kind.MALFORMED_TILE_DATA),
      attrs.get("name"),
      attrs.containsKey("type") ? attrs.get("type") : attrs.get("class"),
      x,
      y,
      shape.width(),
      shape.height(),
      Parse.parseDouble(attrs, "rotation", 0, TmxException.Kind.MALFORMED_TILE_DATA),
      gid,
      Parse.parseFlag(attrs, "visible", true),
      xml.template(),
      xml.properties(),
      shape
    );
  }

  public int id() {
    return id;
  }

  public String name() {
    return name;
  }

  public String type() {
    return type;
  }

  public double x() {
    return x;
  }

  public double y() {
    return y;
  }

  /** Extent of the shape's points, or the declared width when the shape has none. */
  public double width() {
    return width;
  }

  /** Extent of the shape's points, or the declared height when the shape has none. */
  public double height() {
    return height;
  }

  /** Clockwise rotation in degrees around ({@link #x()}, {@link #y()}). */
  public double rotation() {
    return rotation;
  }

  /** Normalized GID, or 0 if this is not a tile object. */
  public int gid() {
    return gid;
  }

  public boolean isTileObject() {
    return gid != 0;
  }

  public boolean visible() {
    return visible;
  }

  /** Path of the template this object was created from, or null. */
  public String template() {
    return template;
  }

  public Map<String, String> properties() {
    return properties;
  }

  public String getProperty(String key, String defaultValue) {
    return properties.getOrDefault(key, defaultValue);
  }

  public Shape shape() {
    return shape;
  }

  public ShapeKind kind() {
    return shape.kind();
  }

  /**
   * Returns the vertices of this object rotated about its anchor. Shapes without vertices (points and text) are
   * treated as a rectangle of the object's size.
   */
  public List<PointXY> transformedPoints() {
    List<PointXY> points = shape.points();
    if (points.isEmpty()) {
      points = List.of(
        new PointXY(x, y),
        new PointXY(x, y + height),
        new PointXY(x + width, y + height),
        new PointXY(x + width, y)
      );
    }
    return ShapeGeometry.rotate(points, new PointXY(x, y), rotation);
  }

  public BoundingBox boundingBox() {
    return ShapeGeometry.boundingBox(transformedPoints());
  }

  /**
   * Returns true if ({@code px}, {@code py}) is inside this object. Ellipses are tested analytically and ignore
   * rotation; point and text objects contain nothing.
   */
  public boolean collidesWithPoint(double px, double py) {
    PointXY point = new PointXY(px, py);
    return switch (shape.kind()) {
      case RECTANGLE -> ShapeGeometry.pointInPolygon(point, transformedPoints());
      case ELLIPSE -> shape.ellipse() != null && shape.ellipse().contains(point);
      default -> !shape.isEmpty() && ShapeGeometry.pointInPolygon(point, transformedPoints());
    };
  }

  /** Returns true if the bounding box of this object overlaps {@code rect}. */
  public boolean intersectsWithRect(BoundingBox rect) {
    return ShapeGeometry.intersectsRect(boundingBox(), rect);
  }

  /** Returns true if the bounding boxes of this object and {@code other} overlap. */
  public boolean intersectsWithObject(TiledObject other) {
    return intersectsWithRect(other.boundingBox());
  }

  /**
   * Returns true if the rotated outlines of this object and {@code other} overlap.
   *
   * @throws TmxException of kind {@link TmxException.Kind#NON_CONVEX_POLYGON} if either outline is concave
   */
  public boolean intersectsWithPolygon(TiledObject other) throws TmxException {
    return ShapeGeometry.intersectsPolygon(transformedPoints(), other.transformedPoints());
  }

  /** Returns the center and radii of an ellipse object, or empty for any other kind. */
  public Optional<Shape.Ellipse> asEllipse() {
    return shape.kind() == ShapeKind.ELLIPSE ? Optional.ofNullable(shape.ellipse()) : Optional.empty();
  }

  /**
   * Returns a copy of this object moved to the anchor a tile object should have on a map with {@code orientation},
   * see {@link OrientationTransform#adjustGidObjectPosition}. The shape's vertices move with it.
   */
  public TiledObject withAdjustedGidPosition(Orientation orientation, double tileWidth, double tileHeight,
    boolean invertY) {
    PointXY adjusted = OrientationTransform.adjustGidObjectPosition(x, y, width, height, orientation, rotation,
      tileWidth, tileHeight, invertY);
    double dx = adjusted.x() - x;
    double dy = adjusted.y() - y;
    List<PointXY> moved = new ArrayList<>(shape.points().size());
    for (PointXY point : shape.points()) {
      moved.add(point.translate(dx, dy));
    }
    Shape.Ellipse ellipse = shape.ellipse() == null ? null :
      new Shape.Ellipse(shape.ellipse().center().translate(dx, dy), shape.ellipse().radiusX(),
        shape.ellipse().radiusY());
    Shape movedShape = new Shape(shape.kind(), moved, shape.closed(), shape.width(), shape.height(), shape.text(),
      ellipse);
    return new TiledObject(id, name, type, adjusted.x(), adjusted.y(), width, height, rotation, gid, visible,
      template, properties, movedShape);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof TiledObject other &&
      id == other.id &&
      Double.compare(x, other.x) == 0 &&
      Double.compare(y, other.y) == 0 &&
      Double.compare(width, other.width) == 0 &&
      Double.compare(height, other.height) == 0 &&
      Double.compare(rotation, other.rotation) == 0 &&
      gid == other.gid &&
      visible == other.visible &&
      Objects.equals(name, other.name) &&
      Objects.equals(type, other.type) &&
      Objects.equals(template, other.template) &&
      properties.equals(other.properties) &&
      shape.equals(other.shape));
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, name, type, x, y, width, height, rotation, gid, visible, template, properties, shape);
  }

  @Override
  public String toString() {
    return "TiledObject{" +
      "id=" + id +
      ", name=" + name +
      ", kind=" + shape.kind().tag() +
      ", x=" + x +
      ", y=" + y +
      ", width=" + width +
      ", height=" + height +
      ", rotation=" + rotation +
      ", gid=" + gid +
      '}';
  }
}
