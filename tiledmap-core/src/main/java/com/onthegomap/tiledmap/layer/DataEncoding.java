package com.onthegomap.tiledmap.layer;

import java.util.Optional;
import java.util.stream.Stream;

/** Text encodings Tiled uses for the contents of a {@code <data>} or {@code <chunk>} element. */
public enum DataEncoding {

  BASE64("base64"),
  CSV("csv");

  private final String id;

  DataEncoding(String id) {
    this.id = id;
  }

  public static Optional<DataEncoding> findById(String id) {
    return Stream.of(values())
      .filter(e -> e.id.equals(id))
      .findFirst();
  }

  public String id() {
    return id;
  }
}
