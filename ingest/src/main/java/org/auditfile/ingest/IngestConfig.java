package org.auditfile.ingest;

import io.vertx.core.json.JsonObject;
import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Run settings. Each is looked up as a system property, then in the supplied
 * configuration object, then as an environment variable, falling back to its default.
 */
public final class IngestConfig {
  public static final String PROGRESS_EVENTS = "saft.progress.events";
  public static final String WRITE_RAW = "saft.write.raw";
  public static final String RAW_TEXT_MAX = "saft.raw.text.max";
  public static final String RESOLVE_DEPTH = "saft.resolve.depth";

  static final int DEFAULT_PROGRESS_EVENTS = 50000;
  static final int DEFAULT_RAW_TEXT_MAX = 2000;
  static final int DEFAULT_RESOLVE_DEPTH = 4;

  private final int progressEvents;
  private final boolean writeRaw;
  private final int rawTextMax;
  private final int resolveDepth;

  /**
   * Create configuration from explicit values.
   * @param progressEvents elements between progress ticks
   * @param writeRaw whether to write the raw element table
   * @param rawTextMax maximum characters of text per raw element row
   * @param resolveDepth depth bound of field resolution
   */
  public IngestConfig(int progressEvents, boolean writeRaw, int rawTextMax, int resolveDepth) {
    if (progressEvents <= 0) {
      throw new IllegalArgumentException(PROGRESS_EVENTS + " must be positive");
    }
    if (rawTextMax < 0) {
      throw new IllegalArgumentException(RAW_TEXT_MAX + " must not be negative");
    }
    if (resolveDepth < 1) {
      throw new IllegalArgumentException(RESOLVE_DEPTH + " must be at least 1");
    }
    this.progressEvents = progressEvents;
    this.writeRaw = writeRaw;
    this.rawTextMax = rawTextMax;
    this.resolveDepth = resolveDepth;
  }

  /**
   * Defaults, overridden by system properties and environment.
   * @return configuration
   */
  public static IngestConfig load() {
    return load(new JsonObject());
  }

  public static IngestConfig load(JsonObject config) {
    return load(config, System::getenv);
  }

  /**
   * Resolve configuration.
   * @param config configuration object keyed like the system properties
   * @param env environment lookup
   * @return configuration
   */
  static IngestConfig load(JsonObject config, UnaryOperator<String> env) {
    return new IngestConfig(
        getInteger(PROGRESS_EVENTS, DEFAULT_PROGRESS_EVENTS, config, env),
        getBoolean(WRITE_RAW, false, config, env),
        getInteger(RAW_TEXT_MAX, DEFAULT_RAW_TEXT_MAX, config, env),
        getInteger(RESOLVE_DEPTH, DEFAULT_RESOLVE_DEPTH, config, env));
  }

  /**
   * Environment variable name of a key: upper case, dots as underscores.
   * @param key property key
   * @return variable name
   */
  static String envName(String key) {
    return key.toUpperCase(Locale.ROOT).replace('.', '_');
  }

  static String getSysConf(String key, String def, JsonObject config,
      UnaryOperator<String> env) {
    String value = System.getProperty(key);
    if (value == null) {
      Object o = config.getValue(key);
      value = o == null ? null : o.toString();
    }
    if (value == null) {
      value = env.apply(envName(key));
    }
    return value == null ? def : value;
  }

  static int getInteger(String key, int def, JsonObject config, UnaryOperator<String> env) {
    String value = getSysConf(key, null, config, env);
    if (value == null) {
      return def;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Bad value for " + key + ": " + value, e);
    }
  }

  static boolean getBoolean(String key, boolean def, JsonObject config,
      UnaryOperator<String> env) {
    String value = getSysConf(key, null, config, env);
    if (value == null) {
      return def;
    }
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "0":
      case "false":
      case "no":
      case "off":
        return false;
      default:
        return true;
    }
  }

  public int getProgressEvents() {
    return progressEvents;
  }

  public boolean isWriteRaw() {
    return writeRaw;
  }

  public int getRawTextMax() {
    return rawTextMax;
  }

  public int getResolveDepth() {
    return resolveDepth;
  }

  /**
   * Return JSON representation.
   * @return json representation
   */
  public JsonObject toJson() {
    return new JsonObject()
        .put(PROGRESS_EVENTS, progressEvents)
        .put(WRITE_RAW, writeRaw)
        .put(RAW_TEXT_MAX, rawTextMax)
        .put(RESOLVE_DEPTH, resolveDepth);
  }
}
