package com.onthegomap.tiledmap.tile;

/**
 * Host-side capability that turns a raw GID read from layer or object data into the id the host map model uses for
 * that tile, recording the tile (and its transform) as in use.
 */
@FunctionalInterface
public interface GidRegistry {

  /**
   * Returns the normalized id for {@code rawGid}; {@code 0} must map to {@code 0}.
   */
  int registerGid(int rawGid);

  /** Returns a registry that only strips the transform flags, for callers that track flags themselves. */
  static GidRegistry stripFlags(GidCodec codec) {
    return rawGid -> codec.decode(rawGid).baseGid();
  }
}
