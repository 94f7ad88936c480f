package com.onthegomap.tiledmap.reader;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.onthegomap.tiledmap.geo.ShapeXml;
import com.onthegomap.tiledmap.layer.ChunkXml;
import com.onthegomap.tiledmap.layer.LayerXml;
import com.onthegomap.tiledmap.objects.ObjectGroupXml;
import com.onthegomap.tiledmap.objects.ObjectXml;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds {@code <layer>}, {@code <objectgroup>}, {@code <object>} and {@code <template>} XML fragments to the raw
 * element records the parsers consume. Unknown elements and attributes are ignored.
 */
public class TmxFragmentReader {

  private static final ObjectMapper mapper = new XmlMapper().registerModule(new Jdk8Module());

  private TmxFragmentReader() {}

  public static LayerXml readLayer(String xml) throws IOException {
    return mapper.readValue(xml, LayerNode.class).toLayerXml();
  }

  public static LayerXml readLayer(InputStream xml) throws IOException {
    return mapper.readValue(xml, LayerNode.class).toLayerXml();
  }

  public static ObjectGroupXml readObjectGroup(String xml) throws IOException {
    return mapper.readValue(xml, ObjectGroupNode.class).toObjectGroupXml();
  }

  public static ObjectGroupXml readObjectGroup(InputStream xml) throws IOException {
    return mapper.readValue(xml, ObjectGroupNode.class).toObjectGroupXml();
  }

  public static ObjectXml readObject(String xml) throws IOException {
    return mapper.readValue(xml, ObjectNode.class).toObjectXml();
  }

  /**
   * Reads the {@code <object>} of a {@code .tx} template file.
   *
   * @throws IOException if the XML is malformed or the template has no object
   */
  public static ObjectXml readTemplate(String xml) throws IOException {
    TemplateNode template = mapper.readValue(xml, TemplateNode.class);
    if (template.object == null) {
      throw new IOException("template has no <object> element");
    }
    return template.object.toObjectXml();
  }

  private static void putIfPresent(Map<String, String> map, String key, String value) {
    if (value != null) {
      map.put(key, value);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static class LayerNode {
    @JacksonXmlProperty(isAttribute = true)
    public String id;
    @JacksonXmlProperty(isAttribute = true)
    public String name;
    @JacksonXmlProperty(isAttribute = true)
    public String width;
    @JacksonXmlProperty(isAttribute = true)
    public String height;
    @JacksonXmlProperty(isAttribute = true)
    public String opacity;
    @JacksonXmlProperty(isAttribute = true)
    public String visible;
    @JacksonXmlProperty(isAttribute = true)
    public String offsetx;
    @JacksonXmlProperty(isAttribute = true)
    public String offsety;
    public DataNode data;

    LayerXml toLayerXml() {
      Map<String, String> attrs = new HashMap<>();
      putIfPresent(attrs, "id", id);
      putIfPresent(attrs, "name", name);
      putIfPresent(attrs, "width", width);
      putIfPresent(attrs, "height", height);
      putIfPresent(attrs, "opacity", opacity);
      putIfPresent(attrs, "visible", visible);
      putIfPresent(attrs, "offsetx", offsetx);
      putIfPresent(attrs, "offsety", offsety);
      return new LayerXml(attrs, data == null ? null : data.toData());
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static class DataNode {
    @JacksonXmlProperty(isAttribute = true)
    public String encoding;
    @JacksonXmlProperty(isAttribute = true)
    public String compression;
    @JacksonXmlText
    public String text;
    @JacksonXmlProperty(localName = "chunk")
    @JacksonXmlElementWrapper(useWrapping = false)
    public List<ChunkNode> chunks;
    @JacksonXmlProperty(localName = "tile")
    @JacksonXmlElementWrapper(useWrapping = false)
    public List<Object> tiles;

    LayerXml.Data toData() {
      List<ChunkXml> chunkXmls = new ArrayList<>();
      if (chunks != null) {
        for (ChunkNode chunk : chunks) {
          chunkXmls.add(new ChunkXml(chunk.x, chunk.y, chunk.width, chunk.height, chunk.text));
        }
      }
      return new LayerXml.Data(encoding, compression, text, chunkXmls, tiles == null ? 0 : tiles.size());
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static class ChunkNode {
    @JacksonXmlProperty(isAttribute = true)
    public String x;
    @JacksonXmlProperty(isAttribute = true)
    public String y;
    @JacksonXmlProperty(isAttribute = true)
    public String width;
    @JacksonXmlProperty(isAttribute = true)
    public String height;
    @JacksonXmlText
    public String text;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static class ObjectGroupNode {
    @JacksonXmlProperty(isAttribute = true)
    public String id;
    @JacksonXmlProperty(isAttribute = true)
    public String name;
    @JacksonXmlProperty(isAttribute = true)
    public String color;
    @JacksonXmlProperty(isAttribute = true)
    public String opacity;
    @JacksonXmlProperty(isAttribute = true)
    public String visible;
    @JacksonXmlProperty(isAttribute = true)
    public String offsetx;
    @JacksonXmlProperty(isAttribute = true)
    public String offsety;
    @JacksonXmlProperty(isAttribute = true)
    public String draworder;
    @JacksonXmlProperty(localName = "object")
    @JacksonXmlElementWrapper(useWrapping = false)
    public List<ObjectNode> objects;

    ObjectGroupXml toObjectGroupXml() {
      Map<String, String> attrs = new HashMap<>();
      putIfPresent(attrs, "id", id);
      putIfPresent(attrs, "name", name);
      putIfPresent(attrs, "color", color);
      putIfPresent(attrs, "opacity", opacity);
      putIfPresent(attrs, "visible", visible);
      putIfPresent(attrs, "offsetx", offsetx);
      putIfPresent(attrs, "offsety", offsety);
      putIfPresent(attrs, "draworder", draworder);
      List<ObjectXml> result = new ArrayList<>();
      if (objects != null) {
        for (ObjectNode object : objects) {
          result.add(object.toObjectXml());
        }
      }
      return new ObjectGroupXml(attrs, result);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static class ObjectNode {
    @JacksonXmlProperty(isAttribute = true)
    public String id;
    @JacksonXmlProperty(isAttribute = true)
    public String name;
    @JacksonXmlProperty(isAttribute = true)
    public String type;
    @JacksonXmlProperty(isAttribute = true, localName = "class")
    public String clazz;
    @JacksonXmlProperty(isAttribute = true)
    public String x;
    @JacksonXmlProperty(isAttribute = true)
    public String y;
    @JacksonXmlProperty(isAttribute = true)
    public String width;
    @JacksonXmlProperty(isAttribute = true)
    public String height;
    @JacksonXmlProperty(isAttribute = true)
    public String rotation;
    @JacksonXmlProperty(isAttribute = true)
    public String gid;
    @JacksonXmlProperty(isAttribute = true)
    public String visible;
    @JacksonXmlProperty(isAttribute = true)
    public String template;
    @JacksonXmlElementWrapper(localName = "properties")
    @JacksonXmlProperty(localName = "property")
    public List<PropertyNode> properties;
    public PointsNode polygon;
    public PointsNode polyline;
    // empty elements, only their presence matters
    public String ellipse;
    public String point;
    public TextNode text;

    ObjectXml toObjectXml() {
      Map<String, String> attrs = new HashMap<>();
      putIfPresent(attrs, "id", id);
      putIfPresent(attrs, "name", name);
      putIfPresent(attrs, "type", type);
      putIfPresent(attrs, "class", clazz);
      putIfPresent(attrs, "x", x);
      putIfPresent(attrs, "y", y);
      putIfPresent(attrs, "width", width);
      putIfPresent(attrs, "height", height);
      putIfPresent(attrs, "rotation", rotation);
      putIfPresent(attrs, "gid", gid);
      putIfPresent(attrs, "visible", visible);
      putIfPresent(attrs, "template", template);

      Map<String, String> props = new LinkedHashMap<>();
      if (properties != null) {
        for (PropertyNode property : properties) {
          if (property.name != null) {
            String value = property.value != null ? property.value : property.text;
            props.put(property.name, value == null ? "" : value);
          }
        }
      }
      return new ObjectXml(attrs, props, shape());
    }

    private ShapeXml shape() {
      if (polygon != null) {
        return polygon.toShapeXml("polygon");
      } else if (polyline != null) {
        return polyline.toShapeXml("polyline");
      } else if (ellipse != null) {
        return ShapeXml.of("ellipse");
      } else if (point != null) {
        return ShapeXml.of("point");
      } else if (text != null) {
        return text.toShapeXml();
      }
      return null;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static class PropertyNode {
    @JacksonXmlProperty(isAttribute = true)
    public String name;
    @JacksonXmlProperty(isAttribute = true)
    public String type;
    @JacksonXmlProperty(isAttribute = true)
    public String value;
    @JacksonXmlText
    public String text;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static class PointsNode {
    @JacksonXmlProperty(isAttribute = true)
    public String points;

    ShapeXml toShapeXml(String tag) {
      Map<String, String> attrs = new HashMap<>();
      putIfPresent(attrs, "points", points);
      return ShapeXml.of(tag, attrs);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static class TextNode {
    @JacksonXmlProperty(isAttribute = true)
    public String fontfamily;
    @JacksonXmlProperty(isAttribute = true)
    public String pixelsize;
    @JacksonXmlProperty(isAttribute = true)
    public String wrap;
    @JacksonXmlProperty(isAttribute = true)
    public String color;
    @JacksonXmlProperty(isAttribute = true)
    public String bold;
    @JacksonXmlProperty(isAttribute = true)
    public String italic;
    @JacksonXmlProperty(isAttribute = true)
    public String underline;
    @JacksonXmlProperty(isAttribute = true)
    public String strikeout;
    @JacksonXmlProperty(isAttribute = true)
    public String kerning;
    @JacksonXmlProperty(isAttribute = true)
    public String halign;
    @JacksonXmlProperty(isAttribute = true)
    public String valign;
    @JacksonXmlText
    public String value;

    ShapeXml toShapeXml() {
      Map<String, String> attrs = new HashMap<>();
      putIfPresent(attrs, "fontfamily", fontfamily);
      putIfPresent(attrs, "pixelsize", pixelsize);
      putIfPresent(attrs, "wrap", wrap);
      putIfPresent(attrs, "color", color);
      putIfPresent(attrs, "bold", bold);
      putIfPresent(attrs, "italic", italic);
      putIfPresent(attrs, "underline", underline);
      putIfPresent(attrs, "strikeout", strikeout);
      putIfPresent(attrs, "kerning", kerning);
      putIfPresent(attrs, "halign", halign);
      putIfPresent(attrs, "valign", valign);
      return new ShapeXml("text", attrs, value);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static class TemplateNode {
    public ObjectNode object;
  }
}
