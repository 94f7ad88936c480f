package com.onthegomap.tiledmap.layer;

import com.google.common.collect.AbstractIterator;
import com.onthegomap.tiledmap.TmxException;
import com.onthegomap.tiledmap.tile.GidRegistry;
import com.onthegomap.tiledmap.util.LogUtil;
import com.onthegomap.tiledmap.util.Parse;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A tile layer whose data has been decoded into a grid of normalized GIDs.
 * <p>
 * Finite layers are decoded from the {@code <data>} text; infinite layers have their chunks stitched into a grid of
 * the layer's declared size.
 */
public class TileLayer implements Iterable<TileLayer.Cell> {

  private static final Logger LOGGER = LoggerFactory.getLogger(TileLayer.class);

  private final String name;
  private final int width;
  private final int height;
  private final double opacity;
  private final boolean visible;
  private final double offsetX;
  private final double offsetY;
  private final int[][] data;

  /** A non-empty cell of the layer. */
  public record Cell(int x, int y, int gid) {}

  private TileLayer(String name, int width, int height, double opacity, boolean visible, double offsetX,
    double offsetY, int[][] data) {
    this.name = name;
    this.width = width;
    this.height = height;
    this.opacity = opacity;
    this.visible = visible;
    this.offsetX = offsetX;
    this.offsetY = offsetY;
    this.data = data;
  }

  /**
   * Decodes {@code xml} into a layer, normalizing every GID through {@code registry}.
   *
   * @throws TmxException if the data uses legacy per-tile elements, an unsupported encoding or compression, or is
   *                      corrupt
   */
  public static TileLayer parse(LayerXml xml, GidRegistry registry) throws TmxException {
    Map<String, String> attrs = xml.attributes();
    String name = attrs.get("name");
    int width = Parse.parseInt(attrs, "width", 0, TmxException.Kind.MALFORMED_TILE_DATA);
    int height = Parse.parseInt(attrs, "height", 0, TmxException.Kind.MALFORMED_TILE_DATA);
    LayerXml.Data data = xml.data();

    LogUtil.setStage("layer:" + name);
    try {
      int[][] grid;
      if (data == null) {
        grid = new int[height][width];
      } else if (!data.chunks().isEmpty()) {
        List<Chunk> chunks = ChunkAssembler.extract(data.chunks(), data.encoding(), data.compression()).getOrThrow();
        grid = ChunkAssembler.stitch(chunks, width, height, registry);
      } else if (data.inlineTileCount() > 0) {
        throw new TmxException(TmxException.Kind.UNSUPPORTED_TILE_FORMAT,
          "XML tile elements are not supported, layer data must use base64 or csv encoding");
      } else {
        int[] gids = LayerDecoder.decode(data.text(), data.encoding(), data.compression()).getOrThrow();
        if (gids.length != width * height) {
          LOGGER.warn("Layer has {} tiles but is {}x{}", gids.length, width, height);
        }
        for (int i = 0; i < gids.length; i++) {
          gids[i] = registry.registerGid(gids[i]);
        }
        grid = width > 0 ? LayerDecoder.reshape(gids, width) : new int[0][];
      }
      return new TileLayer(
        name,
        width,
        height,
        Parse.parseDouble(attrs, "opacity", 1, TmxException.Kind.MALFORMED_TILE_DATA),
        Parse.parseFlag(attrs, "visible", true),
        Parse.parseDouble(attrs, "offsetx", 0, TmxException.Kind.MALFORMED_TILE_DATA),
        Parse.parseDouble(attrs, "offsety", 0, TmxException.Kind.MALFORMED_TILE_DATA),
        grid
      );
    } finally {
      LogUtil.clearStage();
    }
  }

  public String name() {
    return name;
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public double opacity() {
    return opacity;
  }

  public boolean visible() {
    return visible;
  }

  public double offsetX() {
    return offsetX;
  }

  public double offsetY() {
    return offsetY;
  }

  /** Returns the normalized GID at column {@code x} and row {@code y}, or {@code 0} outside the decoded data. */
  public int gidAt(int x, int y) {
    if (y < 0 || y >= data.length || x < 0 || x >= data[y].length) {
      return 0;
    }
    return data[y][x];
  }

  /** Returns a copy of the decoded grid, indexed {@code [row][column]}. */
  public int[][] data() {
    int[][] result = new int[data.length][];
    for (int i = 0; i < data.length; i++) {
      result[i] = data[i].clone();
    }
    return result;
  }

  /** Returns every non-empty cell in row-major order. */
  public List<Cell> tiles() {
    List<Cell> result = new ArrayList<>();
    for (Cell cell : this) {
      result.add(cell);
    }
    return result;
  }

  /** Iterates over non-empty cells in row-major order. */
  @Override
  public Iterator<Cell> iterator() {
    return new AbstractIterator<>() {
      private int x = 0;
      private int y = 0;

      @Override
      protected Cell computeNext() {
        while (y < data.length) {
          if (x < data[y].length) {
            int gid = data[y][x];
            Cell cell = new Cell(x++, y, gid);
            if (gid != 0) {
              return cell;
            }
          } else {
            x = 0;
            y++;
          }
        }
        return endOfData();
      }
    };
  }

  @Override
  public String toString() {
    return "TileLayer{name=" + name + " width=" + width + " height=" + height + '}';
  }
}
