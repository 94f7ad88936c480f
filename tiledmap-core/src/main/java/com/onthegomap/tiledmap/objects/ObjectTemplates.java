package com.onthegomap.tiledmap.objects;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Object templates ({@code .tx} files) keyed by the path objects use to reference them, and the rules for applying a
 * template to an object that references it.
 */
@ThreadSafe
public class ObjectTemplates {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectTemplates.class);

  private final Map<String, ObjectXml> templates = new ConcurrentHashMap<>();

  /** Makes the template object {@code template} available to objects that reference {@code source}. */
  public ObjectTemplates register(String source, ObjectXml template) {
    templates.put(source, template);
    return this;
  }

  public boolean contains(String source) {
    return templates.containsKey(source);
  }

  /**
   * Returns {@code node} with its template applied, or {@code node} unchanged if it does not reference a template or
   * the template has not been registered.
   */
  public ObjectXml resolve(ObjectXml node) {
    String source = node.template();
    if (source == null) {
      return node;
    }
    ObjectXml template = templates.get(source);
    if (template == null) {
      LOGGER.warn("Object {} references unknown template {}", node.attributes().get("id"), source);
      return node;
    }
    return merge(node, template);
  }

  /**
   * Returns an object that takes every attribute, property and the shape from {@code node} where present, and from
   * {@code template} otherwise.
   */
  public static ObjectXml merge(ObjectXml node, ObjectXml template) {
    Map<String, String> attributes = new HashMap<>(template.attributes());
    attributes.putAll(node.attributes());
    Map<String, String> properties = new HashMap<>(template.properties());
    properties.putAll(node.properties());
    return new ObjectXml(attributes, properties, node.shape() != null ? node.shape() : template.shape());
  }
}
