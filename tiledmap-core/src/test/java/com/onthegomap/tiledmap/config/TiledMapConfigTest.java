package com.onthegomap.tiledmap.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.onthegomap.tiledmap.TestUtils;
import com.onthegomap.tiledmap.geo.StaggerAxis;
import com.onthegomap.tiledmap.geo.StaggerIndex;
import org.junit.jupiter.api.Test;

class TiledMapConfigTest {

  @Test
  void testDefaults() {
    TiledMapConfig config = TiledMapConfig.defaults();
    assertEquals(16, config.ellipseSegments());
    assertFalse(config.invertY());
    assertEquals(StaggerAxis.Y, config.defaultStaggerAxis());
    assertEquals(StaggerIndex.ODD, config.defaultStaggerIndex());
  }

  @Test
  void testFromConfigFile() {
    TiledMapConfig config = TiledMapConfig.from(
      Arguments.fromConfigFile(TestUtils.pathToResource("tiledmap-test.properties")));
    assertEquals(new TiledMapConfig(8, true, StaggerAxis.X, StaggerIndex.EVEN), config);
  }

  @Test
  void testLoadFallsBackToConfigFile() {
    assertEquals(new TiledMapConfig(8, true, StaggerAxis.X, StaggerIndex.EVEN),
      TiledMapConfig.load(TestUtils.pathToResource("tiledmap-test.properties")));
    assertEquals(TiledMapConfig.DEFAULT_ELLIPSE_SEGMENTS, TiledMapConfig.load(null).ellipseSegments());
  }

  @Test
  void testInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> TiledMapConfig.from(Arguments.of("ellipse_segments", "-1")));
    assertThrows(IllegalArgumentException.class, () -> TiledMapConfig.from(Arguments.of("stagger_axis", "z")));
    assertThrows(IllegalArgumentException.class, () -> TiledMapConfig.from(Arguments.of("stagger_index", "both")));
  }

  @Test
  void testStaggerIds() {
    assertTrue(StaggerAxis.findById("X").isPresent());
    assertTrue(StaggerIndex.findById(null).isEmpty());
    assertTrue(StaggerIndex.ODD.isShifted(1));
    assertTrue(StaggerIndex.ODD.isShifted(-1));
    assertTrue(StaggerIndex.EVEN.isShifted(0));
    assertFalse(StaggerIndex.EVEN.isShifted(3));
  }
}
