package com.onthegomap.tiledmap.geo;

import java.util.Optional;
import java.util.stream.Stream;

/** Whether the odd or the even rows (or columns) of a staggered or hexagonal map are shifted. */
public enum StaggerIndex {

  ODD("odd"),
  EVEN("even");

  private final String id;

  StaggerIndex(String id) {
    this.id = id;
  }

  public static Optional<StaggerIndex> findById(String id) {
    return Stream.of(values())
      .filter(e -> e.id.equalsIgnoreCase(id))
      .findFirst();
  }

  /** Like {@link #findById(String)} but fails when {@code id} is not {@code odd} or {@code even}. */
  public static StaggerIndex fromId(String id) {
    return findById(id).orElseThrow(() -> new IllegalArgumentException("Unknown stagger index: " + id));
  }

  public String id() {
    return id;
  }

  /** Returns true if row or column {@code index} is one of the shifted ones. */
  public boolean isShifted(int index) {
    boolean even = (index & 1) == 0;
    return this == EVEN ? even : !even;
  }
}
