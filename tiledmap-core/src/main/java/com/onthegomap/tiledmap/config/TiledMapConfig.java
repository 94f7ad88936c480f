package com.onthegomap.tiledmap.config;

import com.onthegomap.tiledmap.geo.StaggerAxis;
import com.onthegomap.tiledmap.geo.StaggerIndex;
import java.nio.file.Path;

/**
 * Holder for the options that change how map data is turned into tile grids and object geometry.
 *
 * @param ellipseSegments     number of vertices used to approximate an ellipse object
 * @param invertY             whether tile objects are anchored at their top edge instead of Tiled's bottom edge
 * @param defaultStaggerAxis  stagger axis assumed when a staggered or hexagonal map does not declare one
 * @param defaultStaggerIndex stagger index assumed when a staggered or hexagonal map does not declare one
 */
public record TiledMapConfig(
  int ellipseSegments,
  boolean invertY,
  StaggerAxis defaultStaggerAxis,
  StaggerIndex defaultStaggerIndex
) {

  public static final int DEFAULT_ELLIPSE_SEGMENTS = 16;
  public static final StaggerAxis DEFAULT_STAGGER_AXIS = StaggerAxis.Y;
  public static final StaggerIndex DEFAULT_STAGGER_INDEX = StaggerIndex.ODD;

  public TiledMapConfig {
    if (ellipseSegments < 0) {
      throw new IllegalArgumentException("ellipse_segments must be >= 0, got " + ellipseSegments);
    }
  }

  public static TiledMapConfig defaults() {
    return from(Arguments.of());
  }

  /**
   * Returns the config from {@code tiledmap.*} JVM properties, then {@code TILEDMAP_*} environmental variables, then
   * {@code configFile} if it is not null, in that priority order.
   */
  public static TiledMapConfig load(Path configFile) {
    Arguments arguments = Arguments.fromJvmProperties().orElse(Arguments.fromEnvironment());
    if (configFile != null) {
      arguments = arguments.orElse(Arguments.fromConfigFile(configFile));
    }
    return from(arguments);
  }

  public static TiledMapConfig from(Arguments arguments) {
    return new TiledMapConfig(
      arguments.getInteger("ellipse_segments", "number of points used to approximate ellipse objects",
        DEFAULT_ELLIPSE_SEGMENTS),
      arguments.getBoolean("invert_y", "anchor tile objects at their top edge", false),
      StaggerAxis.fromId(arguments.getString("stagger_axis", "default stagger axis (x or y)",
        DEFAULT_STAGGER_AXIS.id())),
      StaggerIndex.fromId(arguments.getString("stagger_index", "default stagger index (odd or even)",
        DEFAULT_STAGGER_INDEX.id()))
    );
  }
}
