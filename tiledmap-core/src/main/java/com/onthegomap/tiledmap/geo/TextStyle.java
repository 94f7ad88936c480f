package com.onthegomap.tiledmap.geo;

import com.onthegomap.tiledmap.TmxException;
import com.onthegomap.tiledmap.util.Parse;
import java.util.Map;

/**
 * Content and rich-text attributes of a text object, with Tiled's defaults for anything not declared.
 */
public record TextStyle(
  String text,
  String fontFamily,
  int pixelSize,
  boolean wrap,
  boolean bold,
  boolean italic,
  boolean underline,
  boolean strikeout,
  boolean kerning,
  String horizontalAlign,
  String verticalAlign,
  String color
) {

  public static final String DEFAULT_FONT_FAMILY = "Sans Serif";
  public static final int DEFAULT_PIXEL_SIZE = 16;
  public static final String DEFAULT_COLOR = "#000000FF";

  public static final TextStyle DEFAULT = new TextStyle("", DEFAULT_FONT_FAMILY, DEFAULT_PIXEL_SIZE, false, false,
    false, false, false, true, "left", "top", DEFAULT_COLOR);

  /**
   * Reads the attributes of a {@code <text>} element.
   *
   * @throws TmxException if {@code pixelsize} is not a number
   */
  public static TextStyle parse(ShapeXml xml) throws TmxException {
    Map<String, String> attrs = xml.attributes();
    return new TextStyle(
      xml.text() == null ? "" : xml.text(),
      attrs.getOrDefault("fontfamily", DEFAULT_FONT_FAMILY),
      Parse.parseInt(attrs, "pixelsize", DEFAULT_PIXEL_SIZE, TmxException.Kind.MALFORMED_SHAPE_DATA),
      Parse.parseFlag(attrs, "wrap", false),
      Parse.parseFlag(attrs, "bold", false),
      Parse.parseFlag(attrs, "italic", false),
      Parse.parseFlag(attrs, "underline", false),
      Parse.parseFlag(attrs, "strikeout", false),
      Parse.parseFlag(attrs, "kerning", true),
      attrs.getOrDefault("halign", "left"),
      attrs.getOrDefault("valign", "top"),
      attrs.getOrDefault("color", DEFAULT_COLOR)
    );
  }
}
