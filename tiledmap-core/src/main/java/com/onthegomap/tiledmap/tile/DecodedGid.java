package com.onthegomap.tiledmap.tile;

/**
 * A raw GID split into its tile index and transform flags.
 *
 * @param baseGid tile index with the flag bits cleared
 * @param flags   flip/rotate flags
 */
public record DecodedGid(int baseGid, TileFlags flags) {

  public int rotation() {
    return flags.rotation();
  }
}
