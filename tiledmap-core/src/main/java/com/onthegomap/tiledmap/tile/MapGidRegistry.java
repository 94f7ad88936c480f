package com.onthegomap.tiledmap.tile;

import com.carrotsearch.hppc.IntArrayList;
import com.carrotsearch.hppc.IntHashSet;
import com.carrotsearch.hppc.IntSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Default {@link GidRegistry} that assigns a dense internal id to every distinct tile + transform combination found
 * in a map.
 * <p>
 * Internal ids start at {@code 1}; {@code 0} stays "no tile". The same tile used with two different flips gets two
 * internal ids so a renderer can prepare one transformed image per id.
 */
@ThreadSafe
public class MapGidRegistry implements GidRegistry {

  private final GidCodec codec;
  private final Map<DecodedGid, Integer> internalIds = new HashMap<>();
  private final IntArrayList tiledGids = new IntArrayList();
  private final List<TileFlags> flags = new ArrayList<>();

  public MapGidRegistry(GidCodec codec) {
    this.codec = codec;
    // slot 0 is the empty tile
    tiledGids.add(Gids.EMPTY);
    flags.add(TileFlags.NONE);
  }

  @Override
  public synchronized int registerGid(int rawGid) {
    if (rawGid == Gids.EMPTY) {
      return Gids.EMPTY;
    }
    DecodedGid decoded = codec.decode(rawGid);
    if (decoded.baseGid() == Gids.EMPTY) {
      return Gids.EMPTY;
    }
    Integer existing = internalIds.get(decoded);
    if (existing != null) {
      return existing;
    }
    int internal = tiledGids.size();
    internalIds.put(decoded, internal);
    tiledGids.add(decoded.baseGid());
    flags.add(decoded.flags());
    return internal;
  }

  /** Returns the GID from the map file (without flags) that {@code internalGid} was assigned to. */
  public synchronized int tiledGidOf(int internalGid) {
    checkRange(internalGid);
    return tiledGids.get(internalGid);
  }

  /** Returns the transform flags {@code internalGid} was registered with. */
  public synchronized TileFlags flagsOf(int internalGid) {
    checkRange(internalGid);
    return flags.get(internalGid);
  }

  /** Returns the internal ids that were registered for {@code tiledGid} under any transform. */
  public synchronized IntSet internalGidsFor(int tiledGid) {
    IntSet result = new IntHashSet();
    for (int i = 1; i < tiledGids.size(); i++) {
      if (tiledGids.get(i) == Gids.base(tiledGid)) {
        result.add(i);
      }
    }
    return result;
  }

  /** Number of internal ids handed out, not counting the empty tile. */
  public synchronized int size() {
    return tiledGids.size() - 1;
  }

  private void checkRange(int internalGid) {
    if (internalGid < 0 || internalGid >= tiledGids.size()) {
      throw new IllegalArgumentException("Unknown internal gid " + internalGid);
    }
  }
}
