package com.onthegomap.tiledmap.layer;

import static com.onthegomap.tiledmap.TestUtils.STRIP_FLAGS;
import static com.onthegomap.tiledmap.TestUtils.base64;
import static com.onthegomap.tiledmap.TestUtils.gzip;
import static com.onthegomap.tiledmap.TestUtils.packLittleEndian;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.onthegomap.tiledmap.TmxException;
import com.onthegomap.tiledmap.tile.GidCodec;
import com.onthegomap.tiledmap.tile.Gids;
import com.onthegomap.tiledmap.tile.MapGidRegistry;
import com.onthegomap.tiledmap.tile.TileFlags;
import com.onthegomap.tiledmap.util.LogUtil;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TileLayerTest {

  private static LayerXml layer(int width, int height, LayerXml.Data data) {
    return new LayerXml(Map.of("name", "ground", "width", Integer.toString(width), "height",
      Integer.toString(height)), data);
  }

  @Test
  void testCsvLayer() throws TmxException {
    TileLayer layer = TileLayer.parse(layer(3, 2, LayerXml.Data.of("csv", null, "1,0,2,\n0,3,0")), STRIP_FLAGS);
    assertEquals("ground", layer.name());
    assertEquals(3, layer.width());
    assertEquals(2, layer.height());
    assertArrayEquals(new int[][]{{1, 0, 2}, {0, 3, 0}}, layer.data());
    assertEquals(2, layer.gidAt(2, 0));
    assertEquals(0, layer.gidAt(5, 5));
    assertEquals(0, layer.gidAt(-1, 0));
    assertEquals(List.of(
      new TileLayer.Cell(0, 0, 1),
      new TileLayer.Cell(2, 0, 2),
      new TileLayer.Cell(1, 1, 3)
    ), layer.tiles());
  }

  @Test
  void testDefaults() throws TmxException {
    TileLayer layer = TileLayer.parse(layer(1, 1, LayerXml.Data.of("csv", null, "1")), STRIP_FLAGS);
    assertEquals(1, layer.opacity());
    assertEquals(true, layer.visible());
    assertEquals(0, layer.offsetX());
    assertEquals(0, layer.offsetY());
  }

  @Test
  void testDisplayAttributes() throws TmxException {
    TileLayer layer = TileLayer.parse(new LayerXml(Map.of("name", "top", "width", "1", "height", "1",
      "opacity", "0.5", "visible", "0", "offsetx", "4", "offsety", "-8"), LayerXml.Data.of("csv", null, "1")),
      STRIP_FLAGS);
    assertEquals(0.5, layer.opacity());
    assertFalse(layer.visible());
    assertEquals(4, layer.offsetX());
    assertEquals(-8, layer.offsetY());
  }

  @Test
  void testFlagsGoThroughRegistry() throws TmxException {
    MapGidRegistry registry = new MapGidRegistry(new GidCodec());
    byte[] raw = packLittleEndian(5, 5 | Gids.FLIPPED_HORIZONTALLY | Gids.FLIPPED_DIAGONALLY, 0, 5);
    TileLayer layer = TileLayer.parse(layer(2, 2, LayerXml.Data.of("base64", "gzip", base64(gzip(raw)))), registry);
    assertArrayEquals(new int[][]{{1, 2}, {0, 1}}, layer.data());
    assertEquals(5, registry.tiledGidOf(2));
    assertEquals(new TileFlags(true, false, true), registry.flagsOf(2));
    assertEquals(90, registry.flagsOf(2).rotation());
  }

  @Test
  void testInfiniteLayer() throws TmxException {
    LayerXml.Data data = new LayerXml.Data("csv", null, null, List.of(
      new ChunkXml("0", "0", "2", "1", "1,2"),
      new ChunkXml("2", "1", "2", "1", "3,4")
    ), 0);
    TileLayer layer = TileLayer.parse(layer(4, 2, data), STRIP_FLAGS);
    assertArrayEquals(new int[][]{{1, 2, 0, 0}, {0, 0, 3, 4}}, layer.data());
  }

  @Test
  void testInfiniteLayerWithBadChunkFails() {
    LayerXml.Data data = new LayerXml.Data("csv", null, null, List.of(new ChunkXml("a", "0", "2", "1", "1,2")), 0);
    TmxException e = assertThrows(TmxException.class, () -> TileLayer.parse(layer(4, 2, data), STRIP_FLAGS));
    assertEquals(TmxException.Kind.INVALID_CHUNK_ATTRIBUTE, e.kind());
  }

  @Test
  void testInlineTilesAreRejected() {
    LayerXml.Data data = new LayerXml.Data(null, null, null, List.of(), 4);
    TmxException e = assertThrows(TmxException.class, () -> TileLayer.parse(layer(2, 2, data), STRIP_FLAGS));
    assertEquals(TmxException.Kind.UNSUPPORTED_TILE_FORMAT, e.kind());
  }

  @Test
  void testUnsupportedCompressionPropagates() {
    TmxException e = assertThrows(TmxException.class,
      () -> TileLayer.parse(layer(1, 1, LayerXml.Data.of("base64", "lz4", "AQAAAA==")), STRIP_FLAGS));
    assertEquals(TmxException.Kind.UNSUPPORTED_COMPRESSION, e.kind());
  }

  @Test
  void testMissingDataIsEmptyGrid() throws TmxException {
    TileLayer layer = TileLayer.parse(layer(2, 1, null), STRIP_FLAGS);
    assertArrayEquals(new int[][]{{0, 0}}, layer.data());
    assertEquals(List.of(), layer.tiles());
  }

  @Test
  void testStageIsClearedAfterParse() throws TmxException {
    TileLayer.parse(layer(1, 1, LayerXml.Data.of("csv", null, "1")), STRIP_FLAGS);
    assertNull(LogUtil.getStage());
  }
}
