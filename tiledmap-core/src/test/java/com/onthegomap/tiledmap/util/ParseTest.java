package com.onthegomap.tiledmap.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.onthegomap.tiledmap.TmxException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ParseTest {

  private static final Map<String, String> ATTRS = Map.of(
    "width", "32",
    "x", "12.75",
    "bad", "wide",
    "gid", "2147483650",
    "flag", "1",
    "off", "0"
  );

  @Test
  void testParseDouble() throws TmxException {
    assertEquals(12.75, Parse.parseDouble(ATTRS, "x", 0, TmxException.Kind.MALFORMED_TILE_DATA));
    assertEquals(3, Parse.parseDouble(ATTRS, "missing", 3, TmxException.Kind.MALFORMED_TILE_DATA));
    TmxException e = assertThrows(TmxException.class,
      () -> Parse.parseDouble(ATTRS, "bad", 0, TmxException.Kind.MALFORMED_SHAPE_DATA));
    assertEquals(TmxException.Kind.MALFORMED_SHAPE_DATA, e.kind());
  }

  @Test
  void testParseIntTruncatesFraction() throws TmxException {
    assertEquals(32, Parse.parseInt(ATTRS, "width", 0, TmxException.Kind.MALFORMED_TILE_DATA));
    assertEquals(12, Parse.parseInt(ATTRS, "x", 0, TmxException.Kind.MALFORMED_TILE_DATA));
    assertEquals(-1, Parse.parseInt(ATTRS, "missing", -1, TmxException.Kind.MALFORMED_TILE_DATA));
  }

  @Test
  void testParseGid() throws TmxException {
    assertEquals(0x80000002, Parse.parseGid(ATTRS, "gid"));
    assertEquals(0, Parse.parseGid(ATTRS, "missing"));
    assertEquals(TmxException.Kind.MALFORMED_TILE_DATA,
      assertThrows(TmxException.class, () -> Parse.parseGid(ATTRS, "bad")).kind());
  }

  @Test
  void testParseFlag() {
    assertTrue(Parse.parseFlag(ATTRS, "flag", false));
    assertFalse(Parse.parseFlag(ATTRS, "off", true));
    assertTrue(Parse.parseFlag(ATTRS, "missing", true));
  }
}
