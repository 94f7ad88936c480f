package com.onthegomap.tiledmap.layer;

import static com.onthegomap.tiledmap.TestUtils.STRIP_FLAGS;
import static com.onthegomap.tiledmap.TestUtils.base64;
import static com.onthegomap.tiledmap.TestUtils.packLittleEndian;
import static com.onthegomap.tiledmap.TestUtils.zlib;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.onthegomap.tiledmap.TmxException;
import com.onthegomap.tiledmap.tile.GidRegistry;
import com.onthegomap.tiledmap.tile.Gids;
import com.onthegomap.tiledmap.util.Try;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ChunkAssemblerTest {

  private static Chunk chunk(int x, int y, int[][] grid) {
    return new Chunk(x, y, grid.length == 0 ? 0 : grid[0].length, grid.length, grid, new byte[0]);
  }

  @Test
  void testExtractZlibChunk() {
    byte[] raw = packLittleEndian(1, 2, 3, 4);
    List<Chunk> chunks = ChunkAssembler.extract(
      List.of(new ChunkXml("0", "16", "2", "2", "\n  " + base64(zlib(raw)) + "\n")), "base64", "zlib").get();

    assertEquals(1, chunks.size());
    Chunk chunk = chunks.get(0);
    assertEquals(0, chunk.x());
    assertEquals(16, chunk.y());
    assertArrayEquals(new int[][]{{1, 2}, {3, 4}}, chunk.grid());
    assertArrayEquals(raw, chunk.raw());
  }

  @Test
  void testExtractCsvChunk() {
    List<Chunk> chunks = ChunkAssembler.extract(
      List.of(new ChunkXml("-16", "0", "3", "1", "5,6,7")), "csv", null).get();
    assertEquals(-16, chunks.get(0).x());
    assertArrayEquals(new int[][]{{5, 6, 7}}, chunks.get(0).grid());
    assertArrayEquals(new byte[0], chunks.get(0).raw());
  }

  @Test
  void testInvalidChunkAttribute() {
    Try<List<Chunk>> result = ChunkAssembler.extract(
      List.of(new ChunkXml("not-an-int", "0", "2", "2", "1,2,3,4")), "csv", null);
    assertEquals(Optional.of(TmxException.Kind.INVALID_CHUNK_ATTRIBUTE), result.errorKind());
  }

  @Test
  void testMissingChunkAttribute() {
    Try<List<Chunk>> result = ChunkAssembler.extract(
      List.of(new ChunkXml("0", null, "2", "2", "1,2,3,4")), "csv", null);
    assertEquals(Optional.of(TmxException.Kind.INVALID_CHUNK_ATTRIBUTE), result.errorKind());
  }

  @Test
  void testUndecodableChunkIsSkipped() {
    List<Chunk> chunks = ChunkAssembler.extract(List.of(
      new ChunkXml("0", "0", "2", "2", "%%% not base64 %%%"),
      new ChunkXml("2", "0", "1", "1", base64(packLittleEndian(9)))
    ), "base64", null).get();
    assertEquals(1, chunks.size());
    assertEquals(2, chunks.get(0).x());
  }

  @Test
  void testChunkWithoutTextIsSkipped() {
    List<Chunk> chunks = ChunkAssembler.extract(List.of(
      new ChunkXml("0", "0", "2", "2", null),
      new ChunkXml("0", "0", "2", "2", "  ")
    ), "csv", null).get();
    assertTrue(chunks.isEmpty());
  }

  @Test
  void testCountMismatchKeepsChunk() {
    List<Chunk> chunks = ChunkAssembler.extract(
      List.of(new ChunkXml("0", "0", "2", "2", "1,2,3")), "csv", null).get();
    Chunk chunk = chunks.get(0);
    assertEquals(2, chunk.rowCount());
    assertEquals(2, chunk.rowLength(0));
    assertEquals(1, chunk.rowLength(1));
  }

  @Test
  void testStitch() {
    List<Chunk> chunks = List.of(
      chunk(0, 0, new int[][]{{1, 2}, {3, 4 | Gids.FLIPPED_HORIZONTALLY}}),
      chunk(2, 0, new int[][]{{5, 6}, {7 | Gids.FLIPPED_VERTICALLY, 8}})
    );
    assertArrayEquals(new int[][]{{1, 2, 5, 6}, {3, 4, 7, 8}}, ChunkAssembler.stitch(chunks, 4, 2, STRIP_FLAGS));
  }

  @Test
  void testStitchDropsOutOfBoundsTiles() {
    int[][] result = ChunkAssembler.stitch(List.of(chunk(3, 1, new int[][]{{9, 10}, {11, 12}})), 4, 2, STRIP_FLAGS);
    assertArrayEquals(new int[][]{{0, 0, 0, 0}, {0, 0, 0, 9}}, result);
  }

  @Test
  void testStitchEmpty() {
    assertArrayEquals(new int[3][2], ChunkAssembler.stitch(List.of(), 2, 3, STRIP_FLAGS));
  }

  @Test
  void testLaterChunkOverwritesOverlap() {
    int[][] result = ChunkAssembler.stitch(List.of(
      chunk(0, 0, new int[][]{{1, 2}, {3, 4}}),
      chunk(1, 0, new int[][]{{100, 101}, {102, 103}})
    ), 4, 2, STRIP_FLAGS);
    assertArrayEquals(new int[]{1, 100, 101, 0}, result[0]);
    assertArrayEquals(new int[]{3, 102, 103, 0}, result[1]);
  }

  @Test
  void testNegativeChunkIsSkipped() {
    List<Integer> registered = new ArrayList<>();
    GidRegistry recording = gid -> {
      registered.add(gid);
      return gid;
    };
    int[][] result = ChunkAssembler.stitch(List.of(chunk(-2, 0, new int[][]{{1, 2}, {3, 4}})), 4, 2, recording);
    assertArrayEquals(new int[2][4], result);
    assertTrue(registered.isEmpty());
  }

  @Test
  void testShortRowLeavesCellsEmpty() {
    Chunk irregular = new Chunk(0, 0, 2, 2, new int[][]{{1}, {2, 3}}, new byte[0]);
    assertArrayEquals(new int[][]{{1, 0}, {2, 3}}, ChunkAssembler.stitch(List.of(irregular), 2, 2, STRIP_FLAGS));
  }

  @Test
  void testRegistryCalledOncePerTileInChunkOrder() {
    List<Integer> registered = new ArrayList<>();
    GidRegistry recording = gid -> {
      registered.add(gid);
      return gid * 10;
    };
    int[][] result = ChunkAssembler.stitch(List.of(
      chunk(0, 0, new int[][]{{1, 2}}),
      chunk(2, 0, new int[][]{{3, 4}})
    ), 3, 1, recording);
    assertEquals(List.of(1, 2, 3, 4), registered);
    assertArrayEquals(new int[][]{{10, 20, 30}}, result);
  }
}
