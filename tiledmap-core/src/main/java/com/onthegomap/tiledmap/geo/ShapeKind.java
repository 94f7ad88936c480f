package com.onthegomap.tiledmap.geo;

import java.util.Optional;
import java.util.stream.Stream;

/** The shape of a Tiled object, named after the child element that declares it. */
public enum ShapeKind {

  RECTANGLE("rectangle", true),
  POLYGON("polygon", true),
  POLYLINE("polyline", false),
  ELLIPSE("ellipse", true),
  POINT("point", true),
  TEXT("text", true);

  private final String tag;
  private final boolean closed;

  ShapeKind(String tag, boolean closed) {
    this.tag = tag;
    this.closed = closed;
  }

  /** Returns the kind declared by a child element named {@code tag}. */
  public static Optional<ShapeKind> findByTag(String tag) {
    return Stream.of(values())
      .filter(kind -> kind != RECTANGLE && kind.tag.equals(tag))
      .findFirst();
  }

  public String tag() {
    return tag;
  }

  /** True if the last vertex connects back to the first. */
  public boolean closed() {
    return closed;
  }
}
