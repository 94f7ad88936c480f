package com.onthegomap.tiledmap.tile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class TileFlagsTest {

  @Test
  void testNone() {
    assertTrue(TileFlags.NONE.isEmpty());
    assertEquals(TileFlags.NONE, TileFlags.of(12));
  }

  @Test
  void testDiagonalOnlyHasNoRotation() {
    TileFlags flags = TileFlags.of(Gids.FLIPPED_DIAGONALLY | 1);
    assertFalse(flags.isEmpty());
    assertEquals(0, flags.rotation());
  }

  @Test
  void testFlipsWithoutDiagonalDoNotRotate() {
    assertEquals(0, TileFlags.of(Gids.FLIPPED_HORIZONTALLY | Gids.FLIPPED_VERTICALLY).rotation());
  }

  @Test
  void testWithFlags() {
    TileFlags flags = new TileFlags(true, false, true);
    int gid = Gids.withFlags(9, flags);
    assertEquals(0xA0000009, gid);
    assertEquals(flags, TileFlags.of(gid));
    assertEquals("2684354569", Gids.toString(gid));
  }

  @Test
  void testHasFlags() {
    assertFalse(Gids.hasFlags(0x1FFFFFFF));
    assertTrue(Gids.hasFlags(0x20000000));
    assertTrue(Gids.hasFlags(0x80000000));
    assertEquals(0x1FFFFFFF, Gids.base(0xFFFFFFFF));
  }
}
