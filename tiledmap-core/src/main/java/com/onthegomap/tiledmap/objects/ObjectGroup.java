package com.onthegomap.tiledmap.objects;

import com.onthegomap.tiledmap.TmxException;
import com.onthegomap.tiledmap.config.TiledMapConfig;
import com.onthegomap.tiledmap.geo.Orientation;
import com.onthegomap.tiledmap.tile.GidRegistry;
import com.onthegomap.tiledmap.util.LogUtil;
import com.onthegomap.tiledmap.util.Parse;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An object layer: its display attributes and the objects it holds in document order.
 */
public record ObjectGroup(
  String name,
  String color,
  double opacity,
  boolean visible,
  double offsetX,
  double offsetY,
  String drawOrder,
  List<TiledObject> objects
) implements Iterable<TiledObject> {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectGroup.class);

  public ObjectGroup {
    objects = List.copyOf(objects);
  }

  /**
   * Parses every object in {@code xml}, applying templates from {@code templates} first.
   *
   * @throws TmxException if an object or a group attribute is malformed
   */
  public static ObjectGroup parse(ObjectGroupXml xml, ObjectTemplates templates, GidRegistry registry,
    TiledMapConfig config) throws TmxException {
    Map<String, String> attrs = xml.attributes();
    String name = attrs.get("name");
    LogUtil.setStage("objectgroup:" + name);
    try {
      List<TiledObject> objects = new ArrayList<>(xml.objects().size());
      for (ObjectXml object : xml.objects()) {
        objects.add(TiledObject.parse(templates.resolve(object), registry, config));
      }
      LOGGER.debug("Parsed {} objects", objects.size());
      return new ObjectGroup(
        name,
        attrs.get("color"),
        Parse.parseDouble(attrs, "opacity", 1, TmxException.Kind.MALFORMED_TILE_DATA),
        Parse.parseFlag(attrs, "visible", true),
        Parse.parseDouble(attrs, "offsetx", 0, TmxException.Kind.MALFORMED_TILE_DATA),
        Parse.parseDouble(attrs, "offsety", 0, TmxException.Kind.MALFORMED_TILE_DATA),
        attrs.getOrDefault("draworder", "topdown"),
        objects
      );
    } finally {
      LogUtil.clearStage();
    }
  }

  /** Returns the first object named {@code name}. */
  public Optional<TiledObject> findByName(String name) {
    return objects.stream().filter(o -> name.equals(o.name())).findFirst();
  }

  /**
   * Returns a copy of this group with every tile object moved to its corrected anchor for a map with
   * {@code orientation}. Other objects are kept as they are.
   */
  public ObjectGroup withAdjustedGidPositions(Orientation orientation, double tileWidth, double tileHeight,
    TiledMapConfig config) {
    List<TiledObject> adjusted = new ArrayList<>(objects.size());
    for (TiledObject object : objects) {
      adjusted.add(object.isTileObject() ?
        object.withAdjustedGidPosition(orientation, tileWidth, tileHeight, config.invertY()) : object);
    }
    return new ObjectGroup(name, color, opacity, visible, offsetX, offsetY, drawOrder, adjusted);
  }

  public int size() {
    return objects.size();
  }

  public TiledObject get(int index) {
    return objects.get(index);
  }

  @Override
  public Iterator<TiledObject> iterator() {
    return objects.iterator();
  }
}
