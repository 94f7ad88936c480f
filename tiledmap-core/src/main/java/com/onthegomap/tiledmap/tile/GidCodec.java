package com.onthegomap.tiledmap.tile;

import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Splits raw GIDs into a base tile index and {@link TileFlags}.
 * <p>
 * Unflagged GIDs, which make up almost all tiles in a typical map, are returned without any lookup. Flagged GIDs have
 * their flags decoded once and cached for the lifetime of this codec. Cache entries are a pure function of the key so
 * concurrent callers may race to insert the same entry without coordination.
 */
@ThreadSafe
public class GidCodec {

  private final ConcurrentHashMap<Integer, TileFlags> flagCache;

  public GidCodec() {
    this(new ConcurrentHashMap<>());
  }

  /** Creates a codec backed by {@code flagCache}, to share decoded flags between codecs. */
  public GidCodec(ConcurrentHashMap<Integer, TileFlags> flagCache) {
    this.flagCache = flagCache;
  }

  public DecodedGid decode(int rawGid) {
    if (!Gids.hasFlags(rawGid)) {
      return new DecodedGid(rawGid, TileFlags.NONE);
    }
    TileFlags flags = flagCache.get(rawGid);
    if (flags == null) {
      flags = flagCache.computeIfAbsent(rawGid, TileFlags::of);
    }
    return new DecodedGid(Gids.base(rawGid), flags);
  }

  /** Number of distinct flagged GIDs decoded so far. */
  public int cachedFlagCount() {
    return flagCache.size();
  }
}
