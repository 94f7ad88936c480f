package com.onthegomap.tiledmap.objects;

import java.util.List;
import java.util.Map;

/**
 * Attributes and {@code <object>} children of an {@code <objectgroup>} element, before any parsing.
 */
public record ObjectGroupXml(Map<String, String> attributes, List<ObjectXml> objects) {

  public ObjectGroupXml {
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    objects = objects == null ? List.of() : List.copyOf(objects);
  }
}
