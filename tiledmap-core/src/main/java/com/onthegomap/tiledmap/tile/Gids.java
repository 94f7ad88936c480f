package com.onthegomap.tiledmap.tile;

/**
 * Bit layout of a Tiled global tile id.
 * <p>
 * A GID is an unsigned 32-bit value held in a Java {@code int}: the low 29 bits index a tile across all tilesets of
 * the map and the top 3 bits flip or rotate it. {@code 0} means no tile.
 */
public final class Gids {

  public static final int FLIPPED_HORIZONTALLY = 0x80000000;
  public static final int FLIPPED_VERTICALLY = 0x40000000;
  public static final int FLIPPED_DIAGONALLY = 0x20000000;
  public static final int FLAG_MASK = FLIPPED_HORIZONTALLY | FLIPPED_VERTICALLY | FLIPPED_DIAGONALLY;
  public static final int EMPTY = 0;

  private Gids() {}

  /** Returns {@code gid} without its transform flags. */
  public static int base(int gid) {
    return gid & ~FLAG_MASK;
  }

  /** Returns true if any transform flag is set, i.e. the unsigned value is at least the lowest flag bit. */
  public static boolean hasFlags(int gid) {
    return Integer.compareUnsigned(gid, FLIPPED_DIAGONALLY) >= 0;
  }

  /** Returns the raw GID with {@code flags} applied to {@code base}. */
  public static int withFlags(int base, TileFlags flags) {
    int result = base(base);
    if (flags.flippedHorizontally()) {
      result |= FLIPPED_HORIZONTALLY;
    }
    if (flags.flippedVertically()) {
      result |= FLIPPED_VERTICALLY;
    }
    if (flags.flippedDiagonally()) {
      result |= FLIPPED_DIAGONALLY;
    }
    return result;
  }

  public static String toString(int gid) {
    return Integer.toUnsignedString(gid);
  }
}
