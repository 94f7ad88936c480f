package com.onthegomap.tiledmap.objects;

import com.onthegomap.tiledmap.geo.ShapeXml;
import java.util.Map;

/**
 * Attributes, custom properties and shape child of an {@code <object>} element, before any parsing.
 *
 * @param attributes object attributes such as {@code id}, {@code x}, {@code width} and {@code gid}
 * @param properties {@code <property>} name/value pairs
 * @param shape      the shape child element, or null for a rectangle or tile object
 */
public record ObjectXml(Map<String, String> attributes, Map<String, String> properties, ShapeXml shape) {

  public ObjectXml {
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    properties = properties == null ? Map.of() : Map.copyOf(properties);
  }

  public static ObjectXml of(Map<String, String> attributes) {
    return new ObjectXml(attributes, Map.of(), null);
  }

  public static ObjectXml of(Map<String, String> attributes, ShapeXml shape) {
    return new ObjectXml(attributes, Map.of(), shape);
  }

  /** Returns the {@code template} attribute, or null if this object does not reference a template. */
  public String template() {
    return attributes.get("template");
  }
}
