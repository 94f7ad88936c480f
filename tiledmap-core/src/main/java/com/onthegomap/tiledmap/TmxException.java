package com.onthegomap.tiledmap;

import java.util.ArrayList;
import java.util.Locale;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An error caused by map data this loader cannot turn into a tile grid or object geometry.
 * <p>
 * Every kind is fatal for the element being parsed: the caller either aborts the whole element or, where a partial
 * result still makes sense (a single chunk of an infinite layer), skips it and logs the failure.
 */
public class TmxException extends Exception {

  private static final Logger LOGGER = LoggerFactory.getLogger(TmxException.class);

  /** The category of problem, used to decide how a caller recovers and to group log output. */
  public enum Kind {
    /** {@code encoding} attribute is missing or not one of {@code base64} or {@code csv}. */
    UNSUPPORTED_ENCODING,
    /** {@code compression} attribute is not one of {@code zlib}, {@code gzip} or {@code zstd}. */
    UNSUPPORTED_COMPRESSION,
    /** Legacy per-tile {@code <tile gid=".."/>} layer data. */
    UNSUPPORTED_TILE_FORMAT,
    /** Missing or non-numeric {@code x}, {@code y}, {@code width} or {@code height} on a {@code <chunk>}. */
    INVALID_CHUNK_ATTRIBUTE,
    /** Point list or text attributes of an object shape that cannot be parsed. */
    MALFORMED_SHAPE_DATA,
    /** Separating axis test requested on a concave polygon. */
    NON_CONVEX_POLYGON,
    /** Payload that is not valid base64, or a compressed stream that cannot be inflated. */
    CORRUPT_DATA,
    /** Non-numeric value in csv layer data, or a non-numeric layer or object attribute. */
    MALFORMED_TILE_DATA;

    /** Lower-case name used as a prefix in log output. */
    public String id() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  private final Kind kind;
  private final ArrayList<Supplier<String>> detailsSuppliers = new ArrayList<>();

  public TmxException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public TmxException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }

  /** Attaches lazily-computed detail (for example a slice of the offending payload) that is printed by {@link #log}. */
  public TmxException addDetails(Supplier<String> detailsSupplier) {
    this.detailsSuppliers.add(detailsSupplier);
    return this;
  }

  /** Logs the error with {@code logContext} prepended, plus any details that were attached. */
  public void log(String logContext) {
    StringBuilder log = new StringBuilder(logContext + ": [" + kind.id() + "] " + getMessage());
    for (var details : detailsSuppliers) {
      log.append("\n").append(details.get());
    }
    if (getCause() != null) {
      LOGGER.error(log.toString(), getCause());
    } else {
      LOGGER.error(log.toString());
    }
  }
}
