package com.onthegomap.tiledmap.geo;

import org.locationtech.jts.geom.CoordinateXY;

/**
 * An immutable 2D point, in map pixels or in tiles depending on where it came from.
 */
public record PointXY(double x, double y) {

  public CoordinateXY toCoordinate() {
    return new CoordinateXY(x, y);
  }

  public PointXY translate(double dx, double dy) {
    return new PointXY(x + dx, y + dy);
  }
}
