package com.onthegomap.tiledmap.geo;

/** Column and row of a tile in a map. */
public record TilePos(int x, int y) {}
