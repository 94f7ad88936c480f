package com.onthegomap.tiledmap.tile;

/**
 * Flip and rotation flags stored in the top 3 bits of a GID.
 */
public record TileFlags(boolean flippedHorizontally, boolean flippedVertically, boolean flippedDiagonally) {

  public static final TileFlags NONE = new TileFlags(false, false, false);

  /** Decodes the flag bits of {@code gid}, ignoring its base id. */
  public static TileFlags of(int gid) {
    return new TileFlags(
      (gid & Gids.FLIPPED_HORIZONTALLY) != 0,
      (gid & Gids.FLIPPED_VERTICALLY) != 0,
      (gid & Gids.FLIPPED_DIAGONALLY) != 0
    );
  }

  public boolean isEmpty() {
    return !flippedHorizontally && !flippedVertically && !flippedDiagonally;
  }

  /**
   * Returns the clockwise rotation in degrees that these flags express.
   * <p>
   * Only diagonal flips rotate: diagonal + horizontal is 90, diagonal + horizontal + vertical is 180, diagonal +
   * vertical is 270. A diagonal flip alone is an anti-diagonal mirror with no rotation equivalent and returns 0, as do
   * all flag combinations without a diagonal flip.
   */
  public int rotation() {
    if (flippedDiagonally) {
      if (flippedHorizontally && !flippedVertically) {
        return 90;
      } else if (flippedHorizontally) {
        return 180;
      } else if (flippedVertically) {
        return 270;
      }
    }
    return 0;
  }
}
