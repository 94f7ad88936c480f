package com.onthegomap.tiledmap.geo;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.onthegomap.tiledmap.config.Arguments;
import com.onthegomap.tiledmap.config.TiledMapConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class OrientationTransformTest {

  @ParameterizedTest
  @CsvSource({
    "64, 96, orthogonal, 32, 32, y, odd, 2, 3",
    "31.9, 0, orthogonal, 32, 32, y, odd, 0, 0",
    "-1, -1, orthogonal, 32, 32, y, odd, -1, -1",
    "64, 32, isometric, 32, 32, y, odd, 1, -1",
    "0, 0, isometric, 32, 32, y, odd, 0, 0",
    "48, 32, staggered, 32, 32, y, even, 1, 2",
    "48, 32, staggered, 32, 32, y, odd, 1, 2",
    "32, 48, staggered, 32, 32, x, even, 2, 1",
    "32, 48, staggered, 32, 32, x, odd, 2, 1",
    "64, 64, hexagonal, 32, 32, y, odd, 2, 2",
    "64, 64, hexagonal, 32, 32, x, odd, 2, 2",
    "64, 64, unknown, 32, 32, y, odd, 2, 2",
  })
  void testPixelToTile(double x, double y, String orientation, double tw, double th, String axis, String index,
    int expectedX, int expectedY) {
    assertEquals(new TilePos(expectedX, expectedY), OrientationTransform.pixelToTile(new PointXY(x, y),
      orientation, tw, th, StaggerAxis.fromId(axis), StaggerIndex.fromId(index)));
  }

  @ParameterizedTest
  @CsvSource({
    "40, 16, staggered, , , 0, 1",
    "40, 16, staggered, , even, 1, 1",
    "40, 24, hexagonal, , , 0, 1",
    "40, 24, hexagonal, x, , 1, 0",
    "48, 32, staggered, y, , 1, 2",
  })
  void testPixelToTileWithUndeclaredStagger(double x, double y, String orientation, String axis, String index,
    int expectedX, int expectedY) {
    StaggerAxis staggerAxis = axis == null ? null : StaggerAxis.fromId(axis);
    StaggerIndex staggerIndex = index == null ? null : StaggerIndex.fromId(index);
    assertEquals(new TilePos(expectedX, expectedY), OrientationTransform.pixelToTile(new PointXY(x, y),
      orientation, 32, 32, staggerAxis, staggerIndex));
  }

  @Test
  void testTileToPixelWithUndeclaredStagger() {
    assertEquals(new PointXY(16, 16),
      OrientationTransform.tileToPixel(new TilePos(0, 1), Orientation.STAGGERED, 32, 32, null, null));
    assertEquals(new PointXY(16, 24),
      OrientationTransform.tileToPixel(new TilePos(0, 1), Orientation.HEXAGONAL, 32, 32, null, null));
  }

  @Test
  void testStaggerFromConfig() {
    PointXY pixel = new PointXY(40, 24);
    assertEquals(new TilePos(0, 1),
      OrientationTransform.pixelToTile(pixel, Orientation.HEXAGONAL, 32, 32, TiledMapConfig.defaults()));

    TiledMapConfig config = TiledMapConfig.from(Arguments.of("stagger_axis", "x", "stagger_index", "even"));
    assertEquals(new TilePos(1, 0), OrientationTransform.pixelToTile(pixel, Orientation.HEXAGONAL, 32, 32, config));
    assertEquals(new PointXY(24, 0),
      OrientationTransform.tileToPixel(new TilePos(1, 0), Orientation.HEXAGONAL, 32, 32, config));
  }

  @ParameterizedTest
  @CsvSource({
    "orthogonal, y, odd",
    "isometric, y, odd",
    "staggered, y, odd",
    "staggered, y, even",
    "staggered, x, odd",
    "staggered, x, even",
    "hexagonal, y, odd",
    "hexagonal, x, even",
  })
  void testTileToPixelIsInverse(String orientationId, String axis, String index) {
    Orientation orientation = Orientation.findById(orientationId).orElseThrow();
    StaggerAxis staggerAxis = StaggerAxis.fromId(axis);
    StaggerIndex staggerIndex = StaggerIndex.fromId(index);
    for (int x = -3; x <= 3; x++) {
      for (int y = -3; y <= 3; y++) {
        TilePos tile = new TilePos(x, y);
        PointXY pixel = OrientationTransform.tileToPixel(tile, orientation, 32, 16, staggerAxis, staggerIndex);
        // nudge into the tile so floating point error cannot push it across a boundary
        PointXY inside = pixel.translate(0.01, 0.01);
        assertEquals(tile, OrientationTransform.pixelToTile(inside, orientation, 32, 16, staggerAxis, staggerIndex),
          "tile " + tile + " pixel " + pixel);
      }
    }
  }

  @ParameterizedTest
  @CsvSource({
    "10, 20, 30, 40, orthogonal, 0, 32, 32, false, 10, 20",
    "0, 0, 10, 20, orthogonal, 90, 32, 32, false, 20, 0",
    "5, 5, 10, 20, orthogonal, 180, 32, 32, true, 15, 5",
    "100, 100, 32, 32, isometric, 0, 64, 64, false, 68, 68",
    "100, 100, 32, 32, isometric, 90, 64, 64, true, 84, 52",
    "0, 0, 10, 20, staggered, 270, 32, 32, false, 0, 10",
    "10, 10, 10, 20, hexagonal, 180, 32, 32, true, 20, 10",
    "1, 2, 3, 4, unknown, 0, 32, 32, false, 1, 2",
    "1, 2, 3, 4, unknown, 90, 32, 32, true, 1, 2",
    "0, 0, 10, 20, orthogonal, 45, 32, 32, false, 0, 0",
  })
  void testAdjustGidObjectPosition(double x, double y, double w, double h, String orientation, double rotation,
    double tw, double th, boolean invertY, double expectedX, double expectedY) {
    PointXY result = OrientationTransform.adjustGidObjectPosition(x, y, w, h, orientation, rotation, tw, th, invertY);
    assertEquals(expectedX, result.x(), 1e-9);
    assertEquals(expectedY, result.y(), 1e-9);
  }
}
