package com.onthegomap.tiledmap.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key/value options for the map loader, read from a map, a {@code .properties} file, JVM properties or environmental
 * variables.
 * <p>
 * Keys are matched ignoring case and separators, so {@code "ELLIPSE_SEGMENTS"}, {@code "ellipse-segments"} and
 * {@code "ellipse.segments"} all name the same option.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);
  private static final String JVM_PREFIX = "tiledmap.";
  private static final String ENV_PREFIX = "TILEDMAP_";

  /** Looks up a value by canonical key, see {@link #canonical(String)}. */
  private final UnaryOperator<String> lookup;

  private Arguments(UnaryOperator<String> lookup) {
    this.lookup = lookup;
  }

  /** Returns {@code key} lower-cased with every {@code .}, {@code -} or {@code _} replaced by {@code _}. */
  static String canonical(String key) {
    return key.replaceAll("[._-]", "_").toLowerCase(Locale.ROOT);
  }

  public static Arguments of(Map<String, String> map) {
    Map<String, String> byKey = new LinkedHashMap<>();
    map.forEach((key, value) -> byKey.put(canonical(key), value));
    return new Arguments(byKey::get);
  }

  /** Shorthand for {@link #of(Map)} with alternating keys and values. */
  public static Arguments of(Object... keysAndValues) {
    if (keysAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected key/value pairs, got " + keysAndValues.length + " items");
    }
    Map<String, String> map = new LinkedHashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      map.put(keysAndValues[i].toString(), keysAndValues[i + 1].toString());
    }
    return of(map);
  }

  public static Arguments from(Properties properties) {
    Map<String, String> map = new LinkedHashMap<>();
    for (String name : properties.stringPropertyNames()) {
      map.put(name, properties.getProperty(name));
    }
    return of(map);
  }

  /**
   * Returns options loaded from a {@code .properties} file.
   *
   * @throws IllegalArgumentException if the file cannot be read
   */
  public static Arguments fromConfigFile(Path path) {
    Properties properties = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      properties.load(reader);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to load config file: " + path, e);
    }
    return from(properties);
  }

  /** Returns options from JVM properties such as {@code -Dtiledmap.invert.y=true}. */
  public static Arguments fromJvmProperties() {
    return fromJvmProperties(System::getProperty);
  }

  static Arguments fromJvmProperties(UnaryOperator<String> properties) {
    return new Arguments(key -> properties.apply(JVM_PREFIX + key.replace('_', '.')));
  }

  /** Returns options from environmental variables such as {@code TILEDMAP_ELLIPSE_SEGMENTS=8}. */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System::getenv);
  }

  static Arguments fromEnvironment(UnaryOperator<String> env) {
    return new Arguments(key -> env.apply(ENV_PREFIX + key.toUpperCase(Locale.ROOT)));
  }

  /** Returns options that check {@code this} first and fall back to {@code other} for keys it does not set. */
  public Arguments orElse(Arguments other) {
    return new Arguments(key -> {
      String value = lookup.apply(key);
      return value != null ? value : other.lookup.apply(key);
    });
  }

  private String get(String key, String description, Object defaultValue) {
    String value = lookup.apply(canonical(key));
    String result = value != null ? value.strip() : defaultValue != null ? defaultValue.toString() : null;
    LOGGER.debug("argument: {}={} ({})", key, result, description);
    return result;
  }

  public String getString(String key, String description, String defaultValue) {
    return get(key, description, defaultValue);
  }

  /** Returns true when the value of {@code key} is {@code "true"}, ignoring case. */
  public boolean getBoolean(String key, String description, boolean defaultValue) {
    return "true".equalsIgnoreCase(get(key, description, defaultValue));
  }

  /**
   * Returns the value of {@code key} as an integer.
   *
   * @throws NumberFormatException if the value is not an integer
   */
  public int getInteger(String key, String description, int defaultValue) {
    return Integer.parseInt(get(key, description, defaultValue));
  }
}
