package com.onthegomap.tiledmap.geo;

import java.util.Map;

/**
 * The shape child element of an {@code <object>} ({@code <polygon>}, {@code <polyline>}, {@code <ellipse>},
 * {@code <point>} or {@code <text>}), before any parsing.
 *
 * @param tag        element name
 * @param attributes element attributes, for example {@code points} of a polygon
 * @param text       text content, only meaningful for {@code <text>}
 */
public record ShapeXml(String tag, Map<String, String> attributes, String text) {

  public ShapeXml {
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  public static ShapeXml of(String tag) {
    return new ShapeXml(tag, Map.of(), null);
  }

  public static ShapeXml of(String tag, Map<String, String> attributes) {
    return new ShapeXml(tag, attributes, null);
  }
}
