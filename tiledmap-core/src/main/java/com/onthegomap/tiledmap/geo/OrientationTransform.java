package com.onthegomap.tiledmap.geo;

import com.onthegomap.tiledmap.config.TiledMapConfig;

/**
 * Converts between pixel and tile coordinates for each map {@link Orientation}, and corrects the anchor of tile
 * objects so they pivot the way the editor draws them.
 * <p>
 * Staggered maps shift every other row (or column) by half a tile and step half a tile along the stagger axis;
 * hexagonal maps step three quarters of a tile along the stagger axis. A null stagger axis or index means the map
 * does not declare one, and {@link TiledMapConfig#DEFAULT_STAGGER_AXIS} or
 * {@link TiledMapConfig#DEFAULT_STAGGER_INDEX} applies.
 */
public class OrientationTransform {

  private OrientationTransform() {}

  /**
   * Returns the tile containing {@code pixel}, treating an unknown {@code orientation} as orthogonal.
   */
  public static TilePos pixelToTile(PointXY pixel, String orientation, double tileWidth, double tileHeight,
    StaggerAxis staggerAxis, StaggerIndex staggerIndex) {
    return pixelToTile(pixel, Orientation.findById(orientation).orElse(Orientation.ORTHOGONAL), tileWidth,
      tileHeight, staggerAxis, staggerIndex);
  }

  /** Returns the tile containing {@code pixel}, using the stagger axis and index defaults from {@code config}. */
  public static TilePos pixelToTile(PointXY pixel, Orientation orientation, double tileWidth, double tileHeight,
    TiledMapConfig config) {
    return pixelToTile(pixel, orientation, tileWidth, tileHeight, config.defaultStaggerAxis(),
      config.defaultStaggerIndex());
  }

  /** Returns the tile containing {@code pixel} on a map with the given projection. */
  public static TilePos pixelToTile(PointXY pixel, Orientation orientation, double tileWidth, double tileHeight,
    StaggerAxis staggerAxis, StaggerIndex staggerIndex) {
    double x = pixel.x();
    double y = pixel.y();
    return switch (orientation) {
      case ORTHOGONAL -> new TilePos(floor(x / tileWidth), floor(y / tileHeight));
      case ISOMETRIC -> new TilePos(
        floor((x / tileWidth + y / tileHeight) / 2),
        floor((y / tileHeight - x / tileWidth) / 2)
      );
      case STAGGERED -> staggeredPixelToTile(x, y, tileWidth, tileHeight, 0.5, staggerAxis, staggerIndex);
      case HEXAGONAL -> staggeredPixelToTile(x, y, tileWidth, tileHeight, 0.75, staggerAxis, staggerIndex);
    };
  }

  private static TilePos staggeredPixelToTile(double x, double y, double tileWidth, double tileHeight,
    double strideFraction, StaggerAxis staggerAxis, StaggerIndex staggerIndex) {
    StaggerIndex index = orDefault(staggerIndex);
    if (orDefault(staggerAxis) == StaggerAxis.X) {
      int col = floor(x / (tileWidth * strideFraction));
      double offset = index.isShifted(col) ? tileHeight / 2 : 0;
      return new TilePos(col, floor((y - offset) / tileHeight));
    } else {
      int row = floor(y / (tileHeight * strideFraction));
      double offset = index.isShifted(row) ? tileWidth / 2 : 0;
      return new TilePos(floor((x - offset) / tileWidth), row);
    }
  }

  /** Returns the pixel origin of {@code tile}, using the stagger axis and index defaults from {@code config}. */
  public static PointXY tileToPixel(TilePos tile, Orientation orientation, double tileWidth, double tileHeight,
    TiledMapConfig config) {
    return tileToPixel(tile, orientation, tileWidth, tileHeight, config.defaultStaggerAxis(),
      config.defaultStaggerIndex());
  }

  /**
   * Returns the pixel position of the origin of {@code tile}; the inverse of
   * {@link #pixelToTile(PointXY, Orientation, double, double, StaggerAxis, StaggerIndex)}.
   */
  public static PointXY tileToPixel(TilePos tile, Orientation orientation, double tileWidth, double tileHeight,
    StaggerAxis staggerAxis, StaggerIndex staggerIndex) {
    int tx = tile.x();
    int ty = tile.y();
    return switch (orientation) {
      case ORTHOGONAL -> new PointXY(tx * tileWidth, ty * tileHeight);
      case ISOMETRIC -> new PointXY((tx - ty) * tileWidth, (tx + ty) * tileHeight);
      case STAGGERED -> staggeredTileToPixel(tx, ty, tileWidth, tileHeight, 0.5, staggerAxis, staggerIndex);
      case HEXAGONAL -> staggeredTileToPixel(tx, ty, tileWidth, tileHeight, 0.75, staggerAxis, staggerIndex);
    };
  }

  private static PointXY staggeredTileToPixel(int tx, int ty, double tileWidth, double tileHeight,
    double strideFraction, StaggerAxis staggerAxis, StaggerIndex staggerIndex) {
    StaggerIndex index = orDefault(staggerIndex);
    if (orDefault(staggerAxis) == StaggerAxis.X) {
      double offset = index.isShifted(tx) ? tileHeight / 2 : 0;
      return new PointXY(tx * tileWidth * strideFraction, ty * tileHeight + offset);
    } else {
      double offset = index.isShifted(ty) ? tileWidth / 2 : 0;
      return new PointXY(tx * tileWidth + offset, ty * tileHeight * strideFraction);
    }
  }

  /**
   * Returns the corrected anchor of a tile object, leaving it unchanged when {@code orientation} is unknown.
   */
  public static PointXY adjustGidObjectPosition(double x, double y, double width, double height,
    String orientation, double rotation, double tileWidth, double tileHeight, boolean invertY) {
    return Orientation.findById(orientation)
      .map(o -> adjustGidObjectPosition(x, y, width, height, o, rotation, tileWidth, tileHeight, invertY))
      .orElseGet(() -> new PointXY(x, y));
  }

  /**
   * Returns the corrected anchor of a tile object of size {@code width x height} at ({@code x}, {@code y}).
   * <p>
   * Tiled anchors tile objects at their bottom-left corner and rotates them about that point, so a quarter turn moves
   * the visual top-left by the object's width or height. Rotations other than 0, 90, 180 and 270 degrees get no
   * quadrant offset. With {@code invertY} the anchor is moved to the top edge. Isometric maps are additionally
   * recentered by half a tile.
   */
  public static PointXY adjustGidObjectPosition(double x, double y, double width, double height,
    Orientation orientation, double rotation, double tileWidth, double tileHeight, boolean invertY) {
    double nx = x;
    double ny = y;
    int quadrant = quadrant(rotation);
    switch (quadrant) {
      case 90 -> nx += height;
      case 180 -> {
        nx += width;
        ny += height;
      }
      case 270 -> ny += width;
      default -> {
      }
    }
    if (invertY) {
      ny -= height;
    }
    if (orientation == Orientation.ISOMETRIC) {
      nx -= tileWidth / 2;
      ny -= tileHeight / 2;
      if (quadrant == 90 || quadrant == 270) {
        nx -= height / 2;
        ny += height / 2;
      }
    }
    return new PointXY(nx, ny);
  }

  private static int quadrant(double rotation) {
    if (rotation == 90) {
      return 90;
    } else if (rotation == 180) {
      return 180;
    } else if (rotation == 270) {
      return 270;
    }
    return 0;
  }

  private static StaggerAxis orDefault(StaggerAxis axis) {
    return axis == null ? TiledMapConfig.DEFAULT_STAGGER_AXIS : axis;
  }

  private static StaggerIndex orDefault(StaggerIndex index) {
    return index == null ? TiledMapConfig.DEFAULT_STAGGER_INDEX : index;
  }

  private static int floor(double value) {
    return (int) Math.floor(value);
  }
}
