package com.onthegomap.tiledmap.layer;

import com.carrotsearch.hppc.IntArrayList;
import com.onthegomap.tiledmap.TmxException;
import com.onthegomap.tiledmap.util.Try;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Base64;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes the text payload of a tile layer {@code <data>} or {@code <chunk>} element into a flat, row-major sequence of
 * raw GIDs.
 * <p>
 * Supported formats are {@code csv}, and {@code base64} with no compression, {@code zlib}, {@code gzip} or
 * {@code zstd}. Binary payloads are little-endian unsigned 32-bit integers. Failures are returned as a {@link Try}
 * holding a {@link TmxException} so callers choose whether to abort or skip.
 */
public class LayerDecoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(LayerDecoder.class);
  private static final int[] EMPTY = new int[0];
  private static final byte[] NO_BYTES = new byte[0];

  private LayerDecoder() {}

  /** Raw GIDs and the decompressed bytes they were unpacked from (empty for csv). */
  record Payload(int[] gids, byte[] raw) {}

  /** Returns the raw GIDs encoded in {@code text}. */
  public static Try<int[]> decode(String text, String encoding, String compression) {
    return Try.apply(() -> decodePayload(text, encoding, compression).gids());
  }

  /** Returns the decompressed binary payload of {@code text}, or an empty array for csv data. */
  public static Try<byte[]> decodeBytes(String text, String encoding, String compression) {
    return Try.apply(() -> decodePayload(text, encoding, compression).raw());
  }

  static Payload decodePayload(String text, String encoding, String compression) throws TmxException {
    DataEncoding dataEncoding = DataEncoding.findById(encoding)
      .orElseThrow(() -> new TmxException(TmxException.Kind.UNSUPPORTED_ENCODING,
        "layer encoding " + (encoding == null || encoding.isBlank() ? "<none>" : encoding) + " is not supported"));
    String body = text == null ? "" : text;
    return switch (dataEncoding) {
      case BASE64 -> {
        DataCompression dataCompression = DataCompression.findById(compression)
          .orElseThrow(() -> new TmxException(TmxException.Kind.UNSUPPORTED_COMPRESSION,
            "layer compression " + compression + " is not supported"));
        byte[] raw = decompress(dataCompression, base64Decode(body));
        yield new Payload(unpackLittleEndian(raw), raw);
      }
      case CSV -> new Payload(parseCsv(body), NO_BYTES);
    };
  }

  private static byte[] base64Decode(String text) throws TmxException {
    try {
      return Base64.getDecoder().decode(text.replaceAll("\\s", ""));
    } catch (IllegalArgumentException e) {
      throw new TmxException(TmxException.Kind.CORRUPT_DATA, "invalid base64 layer data: " + e.getMessage(), e)
        .addDetails(() -> "data: " + StringUtils.abbreviate(text, 64));
    }
  }

  private static byte[] decompress(DataCompression compression, byte[] data) throws TmxException {
    try {
      return compression.decompress(data);
    } catch (IOException e) {
      throw new TmxException(TmxException.Kind.CORRUPT_DATA,
        "unable to " + compression.id() + " decompress layer data: " + e.getMessage(), e);
    }
  }

  /**
   * Unpacks {@code data} as little-endian unsigned 32-bit integers.
   * <p>
   * When the length is not a multiple of 4 the trailing bytes cannot form a GID and are dropped with a warning.
   */
  public static int[] unpackLittleEndian(byte[] data) {
    int count = data.length / Integer.BYTES;
    int trailing = data.length % Integer.BYTES;
    if (trailing != 0) {
      LOGGER.warn("Layer data is {} bytes which is not a multiple of 4, ignoring {} trailing bytes", data.length,
        trailing);
    }
    int[] result = new int[count];
    ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN).asIntBuffer().get(result);
    return result;
  }

  /**
   * Parses comma-separated unsigned GIDs. Blank text is an empty layer and a single trailing comma is tolerated.
   */
  public static int[] parseCsv(String text) throws TmxException {
    if (text == null || text.isBlank()) {
      return EMPTY;
    }
    String[] parts = text.strip().split(",", -1);
    IntArrayList result = new IntArrayList(parts.length);
    for (int i = 0; i < parts.length; i++) {
      String part = parts[i].strip();
      if (part.isEmpty() && i == parts.length - 1 && i > 0) {
        break;
      }
      try {
        result.add(Integer.parseUnsignedInt(part));
      } catch (NumberFormatException e) {
        throw new TmxException(TmxException.Kind.MALFORMED_TILE_DATA,
          "invalid csv gid '" + part + "' at index " + i, e);
      }
    }
    return result.toArray();
  }

  /**
   * Slices {@code gids} into rows of {@code width}. The last row is short when the length is not a multiple of the
   * width; callers are expected to pass {@code width * height} GIDs.
   */
  public static int[][] reshape(int[] gids, int width) {
    if (width <= 0) {
      throw new IllegalArgumentException("width must be positive, got " + width);
    }
    int rows = (gids.length + width - 1) / width;
    int[][] result = new int[rows][];
    for (int row = 0; row < rows; row++) {
      int from = row * width;
      int to = Math.min(from + width, gids.length);
      result[row] = new int[to - from];
      System.arraycopy(gids, from, result[row], 0, to - from);
    }
    return result;
  }

  /** Inverse of {@link #reshape(int[], int)}: concatenates rows in order. */
  public static int[] flatten(int[][] grid) {
    IntArrayList result = new IntArrayList();
    for (int[] row : grid) {
      result.add(row, 0, row.length);
    }
    return result.toArray();
  }
}
