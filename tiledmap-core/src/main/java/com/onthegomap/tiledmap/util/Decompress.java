package com.onthegomap.tiledmap.util;

import com.github.luben.zstd.ZstdInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;

/**
 * Decompressors for the binary layer payloads Tiled writes.
 */
public final class Decompress {

  private Decompress() {}

  public static byte[] gunzip(byte[] zipped) throws IOException {
    try (var is = new GZIPInputStream(new ByteArrayInputStream(zipped))) {
      return is.readAllBytes();
    }
  }

  /** Inflates a zlib stream (deflate with the 2-byte zlib header and adler32 trailer). */
  public static byte[] inflate(byte[] deflated) throws IOException {
    try (InputStream is = new InflaterInputStream(new ByteArrayInputStream(deflated))) {
      return is.readAllBytes();
    }
  }

  public static byte[] unzstd(byte[] compressed) throws IOException {
    try (InputStream is = new ZstdInputStream(new ByteArrayInputStream(compressed))) {
      return is.readAllBytes();
    }
  }
}
