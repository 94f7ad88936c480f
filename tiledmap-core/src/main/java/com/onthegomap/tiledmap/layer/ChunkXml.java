package com.onthegomap.tiledmap.layer;

/**
 * Attributes and text of a {@code <chunk>} element of an infinite tile layer, before any parsing.
 *
 * @param x      tile column of the chunk's top-left corner
 * @param y      tile row of the chunk's top-left corner
 * @param width  chunk width in tiles
 * @param height chunk height in tiles
 * @param text   encoded GIDs, in the encoding and compression of the enclosing {@code <data>}
 */
public record ChunkXml(String x, String y, String width, String height, String text) {}
