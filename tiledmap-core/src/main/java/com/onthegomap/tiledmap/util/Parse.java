package com.onthegomap.tiledmap.util;

import com.onthegomap.tiledmap.TmxException;
import java.util.Map;

/**
 * Utilities to read typed values out of XML attribute bags.
 * <p>
 * A missing attribute falls back to the default, but a present attribute that is not a number is a corrupt file and
 * throws {@link TmxException}.
 */
public class Parse {

  private Parse() {}

  /** Returns {@code attrs[key]} as a double, or {@code defaultValue} if absent or blank. */
  public static double parseDouble(Map<String, String> attrs, String key, double defaultValue,
    TmxException.Kind kind) throws TmxException {
    String value = attrs.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.strip());
    } catch (NumberFormatException e) {
      throw new TmxException(kind, "invalid number " + key + "='" + value + "'", e);
    }
  }

  /**
   * Returns {@code attrs[key]} as an int, or {@code defaultValue} if absent or blank. Values with a fraction are
   * truncated toward zero since Tiled writes some integer attributes as {@code "32.0"}.
   */
  public static int parseInt(Map<String, String> attrs, String key, int defaultValue, TmxException.Kind kind)
    throws TmxException {
    String value = attrs.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.strip());
    } catch (NumberFormatException e) {
      return (int) parseDouble(attrs, key, defaultValue, kind);
    }
  }

  /** Returns {@code attrs[key]} as an unsigned 32-bit GID, or {@code 0} if absent or blank. */
  public static int parseGid(Map<String, String> attrs, String key) throws TmxException {
    String value = attrs.get(key);
    if (value == null || value.isBlank()) {
      return 0;
    }
    try {
      return Integer.parseUnsignedInt(value.strip());
    } catch (NumberFormatException e) {
      throw new TmxException(TmxException.Kind.MALFORMED_TILE_DATA, "invalid gid " + key + "='" + value + "'", e);
    }
  }

  /** Returns true if {@code attrs[key]} is {@code "1"} or {@code "true"}, or {@code defaultValue} if absent. */
  public static boolean parseFlag(Map<String, String> attrs, String key, boolean defaultValue) {
    String value = attrs.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String stripped = value.strip();
    return "1".equals(stripped) || "true".equalsIgnoreCase(stripped);
  }
}
