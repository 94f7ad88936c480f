package com.onthegomap.tiledmap.layer;

import com.onthegomap.tiledmap.util.Decompress;
import java.io.IOException;
import java.util.Optional;
import java.util.stream.Stream;

/** Compression applied to base64-encoded layer data before encoding. */
public enum DataCompression {

  NONE("") {
    @Override
    public byte[] decompress(byte[] data) {
      return data;
    }
  },
  ZLIB("zlib") {
    @Override
    public byte[] decompress(byte[] data) throws IOException {
      return Decompress.inflate(data);
    }
  },
  GZIP("gzip") {
    @Override
    public byte[] decompress(byte[] data) throws IOException {
      return Decompress.gunzip(data);
    }
  },
  ZSTD("zstd") {
    @Override
    public byte[] decompress(byte[] data) throws IOException {
      return Decompress.unzstd(data);
    }
  };

  private final String id;

  DataCompression(String id) {
    this.id = id;
  }

  /** Returns the compression named by a {@code compression} attribute, where a missing attribute means none. */
  public static Optional<DataCompression> findById(String id) {
    String normalized = id == null ? "" : id.strip();
    return Stream.of(values())
      .filter(c -> c.id.equals(normalized))
      .findFirst();
  }

  public String id() {
    return id;
  }

  /**
   * Returns the uncompressed form of {@code data}.
   *
   * @throws IOException if {@code data} is not a valid stream for this compression
   */
  public abstract byte[] decompress(byte[] data) throws IOException;
}
