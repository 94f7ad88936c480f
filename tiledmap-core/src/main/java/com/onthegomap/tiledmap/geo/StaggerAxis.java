package com.onthegomap.tiledmap.geo;

import java.util.Optional;
import java.util.stream.Stream;

/** The axis along which alternate rows or columns of a staggered or hexagonal map are shifted. */
public enum StaggerAxis {

  X("x"),
  Y("y");

  private final String id;

  StaggerAxis(String id) {
    this.id = id;
  }

  public static Optional<StaggerAxis> findById(String id) {
    return Stream.of(values())
      .filter(e -> e.id.equalsIgnoreCase(id))
      .findFirst();
  }

  /** Like {@link #findById(String)} but fails when {@code id} is not {@code x} or {@code y}. */
  public static StaggerAxis fromId(String id) {
    return findById(id).orElseThrow(() -> new IllegalArgumentException("Unknown stagger axis: " + id));
  }

  public String id() {
    return id;
  }
}
