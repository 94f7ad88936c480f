package com.onthegomap.tiledmap.objects;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.onthegomap.tiledmap.geo.ShapeXml;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ObjectTemplatesTest {

  private static final ObjectXml TEMPLATE = new ObjectXml(
    Map.of("name", "chest", "type", "loot", "width", "16", "height", "16"),
    Map.of("gold", "10", "locked", "true"),
    ShapeXml.of("ellipse")
  );

  @Test
  void testNodeOverridesTemplate() {
    ObjectXml node = new ObjectXml(
      Map.of("id", "3", "template", "chest.tx", "x", "5", "y", "6", "name", "big chest"),
      Map.of("gold", "99"),
      null
    );
    ObjectXml merged = ObjectTemplates.merge(node, TEMPLATE);
    assertEquals(Map.of(
      "id", "3", "template", "chest.tx", "x", "5", "y", "6", "name", "big chest", "type", "loot", "width", "16",
      "height", "16"
    ), merged.attributes());
    assertEquals(Map.of("gold", "99", "locked", "true"), merged.properties());
    assertEquals(ShapeXml.of("ellipse"), merged.shape());
  }

  @Test
  void testNodeShapeWins() {
    ObjectXml node = ObjectXml.of(Map.of("template", "chest.tx"), ShapeXml.of("point"));
    assertEquals(ShapeXml.of("point"), ObjectTemplates.merge(node, TEMPLATE).shape());
  }

  @Test
  void testResolve() {
    ObjectTemplates templates = new ObjectTemplates().register("chest.tx", TEMPLATE);
    assertTrue(templates.contains("chest.tx"));
    ObjectXml resolved = templates.resolve(ObjectXml.of(Map.of("template", "chest.tx", "x", "1")));
    assertEquals("chest", resolved.attributes().get("name"));
    assertEquals("1", resolved.attributes().get("x"));
  }

  @Test
  void testResolveWithoutTemplate() {
    ObjectTemplates templates = new ObjectTemplates().register("chest.tx", TEMPLATE);
    ObjectXml plain = ObjectXml.of(Map.of("x", "1"));
    assertSame(plain, templates.resolve(plain));
    ObjectXml missing = ObjectXml.of(Map.of("template", "other.tx"));
    assertSame(missing, templates.resolve(missing));
  }
}
