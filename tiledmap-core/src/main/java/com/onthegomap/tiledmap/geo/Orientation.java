package com.onthegomap.tiledmap.geo;

import java.util.Optional;
import java.util.stream.Stream;

/** The {@code orientation} attribute of a map, which decides how tile coordinates map to pixels. */
public enum Orientation {

  ORTHOGONAL("orthogonal"),
  ISOMETRIC("isometric"),
  STAGGERED("staggered"),
  HEXAGONAL("hexagonal");

  private final String id;

  Orientation(String id) {
    this.id = id;
  }

  public static Optional<Orientation> findById(String id) {
    return Stream.of(values())
      .filter(e -> e.id.equals(id))
      .findFirst();
  }

  public String id() {
    return id;
  }
}
