package com.onthegomap.tiledmap.layer;

import java.util.List;
import java.util.Map;

/**
 * Attributes and {@code <data>} contents of a {@code <layer>} element, before any parsing.
 *
 * @param attributes layer attributes such as {@code name}, {@code width} and {@code height}
 * @param data       the layer's {@code <data>} element
 */
public record LayerXml(Map<String, String> attributes, Data data) {

  public LayerXml {
    attributes = Map.copyOf(attributes);
  }

  /**
   * Contents of a {@code <data>} element.
   *
   * @param encoding        {@code encoding} attribute, or null
   * @param compression     {@code compression} attribute, or null
   * @param text            text content, ignored when {@code chunks} is not empty
   * @param chunks          {@code <chunk>} children of an infinite layer
   * @param inlineTileCount number of legacy {@code <tile>} children
   */
  public record Data(String encoding, String compression, String text, List<ChunkXml> chunks, int inlineTileCount) {

    public Data {
      chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }

    public static Data of(String encoding, String compression, String text) {
      return new Data(encoding, compression, text, List.of(), 0);
    }
  }
}
