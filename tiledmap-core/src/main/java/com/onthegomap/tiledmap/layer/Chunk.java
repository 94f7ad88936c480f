package com.onthegomap.tiledmap.layer;

import java.util.Arrays;
import javax.annotation.concurrent.Immutable;

/**
 * A decoded rectangular piece of an infinite tile layer, holding raw (unnormalized) GIDs.
 * <p>
 * Rows are as decoded: when the payload held fewer GIDs than {@code width * height}, trailing rows are short or empty.
 */
@Immutable
public final class Chunk {

  private final int x;
  private final int y;
  private final int width;
  private final int height;
  private final int[][] grid;
  private final byte[] raw;

  public Chunk(int x, int y, int width, int height, int[][] grid, byte[] raw) {
    this.x = x;
    this.y = y;
    this.width = width;
    this.height = height;
    this.grid = copy(grid);
    this.raw = raw.clone();
  }

  private static int[][] copy(int[][] grid) {
    int[][] result = new int[grid.length][];
    for (int i = 0; i < grid.length; i++) {
      result[i] = grid[i].clone();
    }
    return result;
  }

  /** Tile column of the top-left corner. */
  public int x() {
    return x;
  }

  /** Tile row of the top-left corner. */
  public int y() {
    return y;
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  /** Number of rows actually decoded, at most {@link #height()}. */
  public int rowCount() {
    return grid.length;
  }

  /** Number of GIDs decoded for {@code row}, which may be less than {@link #width()}. */
  public int rowLength(int row) {
    return row < grid.length ? grid[row].length : 0;
  }

  /** Returns the raw GID at local column {@code col} and row {@code row}. */
  public int gid(int col, int row) {
    return grid[row][col];
  }

  public int[][] grid() {
    return copy(grid);
  }

  /** The decompressed binary payload, empty for csv chunks. */
  public byte[] raw() {
    return raw.clone();
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Chunk other &&
      x == other.x && y == other.y && width == other.width && height == other.height &&
      Arrays.deepEquals(grid, other.grid) && Arrays.equals(raw, other.raw));
  }

  @Override
  public int hashCode() {
    int result = 31 * x + y;
    result = 31 * result + width;
    result = 31 * result + height;
    return 31 * result + Arrays.deepHashCode(grid);
  }

  @Override
  public String toString() {
    return "Chunk{x=" + x + " y=" + y + " width=" + width + " height=" + height + '}';
  }
}
