package com.onthegomap.tiledmap.layer;

import com.onthegomap.tiledmap.TmxException;
import com.onthegomap.tiledmap.tile.GidRegistry;
import com.onthegomap.tiledmap.util.Try;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes the {@code <chunk>} elements of an infinite tile layer and stitches them into one grid.
 * <p>
 * Only malformed chunk attributes abort extraction. Everything else that still leaves a usable grid (undecodable chunk
 * text, GID count mismatches, tiles outside the map, chunks at negative positions) is logged and skipped.
 */
public class ChunkAssembler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkAssembler.class);

  private ChunkAssembler() {}

  /**
   * Decodes every chunk in {@code chunks} using the encoding and compression of the enclosing {@code <data>} element.
   *
   * @return the decoded chunks in input order, or a failure of kind
   *         {@link TmxException.Kind#INVALID_CHUNK_ATTRIBUTE} if any chunk has a missing or non-numeric attribute
   */
  public static Try<List<Chunk>> extract(List<ChunkXml> chunks, String encoding, String compression) {
    return Try.apply(() -> extractOrThrow(chunks, encoding, compression));
  }

  private static List<Chunk> extractOrThrow(List<ChunkXml> nodes, String encoding, String compression)
    throws TmxException {
    List<Chunk> result = new ArrayList<>(nodes.size());
    for (int i = 0; i < nodes.size(); i++) {
      ChunkXml node = nodes.get(i);
      int x = parseAttribute(i, "x", node.x());
      int y = parseAttribute(i, "y", node.y());
      int width = parseAttribute(i, "width", node.width());
      int height = parseAttribute(i, "height", node.height());
      LOGGER.debug("[chunk {}] position: ({}, {}), size: {}x{}", i, x, y, width, height);

      if (node.text() == null || node.text().isBlank()) {
        LOGGER.error("[chunk {}] missing text content, skipping", i);
        continue;
      }

      LayerDecoder.Payload payload;
      try {
        payload = LayerDecoder.decodePayload(node.text().strip(), encoding, compression);
      } catch (TmxException e) {
        e.log("[chunk " + i + "] failed to decode GIDs, skipping");
        continue;
      }

      int[] gids = payload.gids();
      if (gids.length != width * height) {
        LOGGER.warn("[chunk {}] GID count mismatch: expected {}, got {}", i, width * height, gids.length);
      }
      result.add(new Chunk(x, y, width, height, sliceRows(gids, width, height), payload.raw()));
    }
    LOGGER.info("Total chunks extracted: {}", result.size());
    return result;
  }

  private static int parseAttribute(int index, String name, String value) throws TmxException {
    if (value == null) {
      throw new TmxException(TmxException.Kind.INVALID_CHUNK_ATTRIBUTE,
        "chunk " + index + " is missing attribute '" + name + "'");
    }
    try {
      return Integer.parseInt(value.strip());
    } catch (NumberFormatException e) {
      throw new TmxException(TmxException.Kind.INVALID_CHUNK_ATTRIBUTE,
        "chunk " + index + " has invalid " + name + "='" + value + "'", e);
    }
  }

  /** Slices into exactly {@code height} rows of {@code width}; rows past the end of {@code gids} are short or empty. */
  private static int[][] sliceRows(int[] gids, int width, int height) {
    int[][] grid = new int[Math.max(height, 0)][];
    for (int row = 0; row < grid.length; row++) {
      int from = Math.min(row * width, gids.length);
      int to = Math.min(from + width, gids.length);
      grid[row] = new int[to - from];
      System.arraycopy(gids, from, grid[row], 0, to - from);
    }
    return grid;
  }

  /**
   * Writes every chunk into a {@code height x width} grid of normalized GIDs, where {@code 0} is an empty cell.
   * <p>
   * Each raw GID is passed to {@code registry} exactly once, in chunk order. Chunks later in the list overwrite
   * earlier ones where they overlap. Chunks at a negative position are skipped entirely and cells outside the map
   * are dropped, as are cells missing from a short chunk row; each of these is logged at most once per chunk.
   */
  public static int[][] stitch(List<Chunk> chunks, int width, int height, GidRegistry registry) {
    int[][] grid = new int[height][width];

    for (int index = 0; index < chunks.size(); index++) {
      Chunk chunk = chunks.get(index);
      int cx = chunk.x();
      int cy = chunk.y();
      if (cx < 0 || cy < 0) {
        LOGGER.warn("[chunk {}] skipping chunk at negative position ({}, {})", index, cx, cy);
        continue;
      }

      boolean outOfBoundsLogged = false;
      boolean shortRowLogged = false;
      for (int row = 0; row < chunk.height(); row++) {
        for (int col = 0; col < chunk.width(); col++) {
          if (col >= chunk.rowLength(row)) {
            if (!shortRowLogged) {
              LOGGER.warn("[chunk {}] row {} has {} of {} tiles, leaving the rest empty", index, row,
                chunk.rowLength(row), chunk.width());
              shortRowLogged = true;
            }
            break;
          }
          int normalized = registry.registerGid(chunk.gid(col, row));
          int gx = cx + col;
          int gy = cy + row;
          if (gx < width && gy < height) {
            grid[gy][gx] = normalized;
          } else if (!outOfBoundsLogged) {
            LOGGER.warn("[chunk {}] contains out-of-bounds tiles (e.g., ({}, {}))", index, gx, gy);
            outOfBoundsLogged = true;
          }
        }
      }
    }

    LOGGER.debug("Stitched {} chunks into {}x{} grid", chunks.size(), width, height);
    return grid;
  }
}
