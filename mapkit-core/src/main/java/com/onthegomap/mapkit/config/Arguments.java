package com.onthegomap.mapkit.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key/value pair arguments read from the command line, jvm properties, environmental variables, or a config file.
 * <p>
 * Keys are case-and-separator-insensitive, so {@code "SINGLE_POINT_PADDING"} matches {@code "single-point-padding"}
 * and {@code "single.point.padding"}. Use {@code "new_key|old_key"} to read a renamed option and fall back to the old
 * name.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);

  private final UnaryOperator<String> provider;
  private boolean silent = false;

  private Arguments(UnaryOperator<String> provider) {
    this.provider = provider;
  }

  /**
   * Returns arguments from JVM system properties prefixed with {@code mapkit.}
   * <p>
   * For example to set {@code key=value}: {@code java -Dmapkit.key=value ...}
   */
  public static Arguments fromJvmProperties() {
    return fromJvmProperties(System::getProperty);
  }

  static Arguments fromJvmProperties(UnaryOperator<String> getter) {
    return new Arguments(key -> getter.apply("mapkit." + normalize(key, ".", false)));
  }

  /**
   * Returns arguments from environmental variables prefixed with {@code MAPKIT_}
   * <p>
   * For example to set {@code key=value}: {@code MAPKIT_KEY=value java ...}
   */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System::getenv);
  }

  static Arguments fromEnvironment(UnaryOperator<String> getter) {
    return new Arguments(key -> getter.apply("MAPKIT_" + normalize(key, "_", true)));
  }

  /** Returns arguments from a {@link Properties} object. */
  public static Arguments from(Properties properties) {
    Map<String, String> map = new HashMap<>();
    for (String key : properties.stringPropertyNames()) {
      map.put(key, properties.getProperty(key));
    }
    return of(map);
  }

  /**
   * Returns arguments from command-line arguments like {@code key=value}, {@code --key value} or {@code --key} for
   * {@code key=true}.
   */
  public static Arguments fromArgs(String... args) {
    Map<String, String> parsed = new HashMap<>();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i].strip();
      String[] kv = arg.split("=", 2);
      String key = kv[0].replaceAll("^[\\s-]+", "");
      if (kv.length == 2) {
        parsed.put(key, kv[1]);
      } else if (arg.startsWith("-") && i < args.length - 1 && !args[i + 1].strip().startsWith("-")) {
        parsed.put(key, args[++i].strip());
      } else {
        parsed.put(key, "true");
      }
    }
    return of(parsed);
  }

  /** Returns arguments from a {@code .properties} file. */
  public static Arguments fromConfigFile(Path path) {
    Properties properties = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      properties.load(reader);
      return from(properties);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to load config file: " + path, e);
    }
  }

  /**
   * Returns arguments from the command line, then jvm properties, then environmental variables, in that priority
   * order.
   */
  public static Arguments fromEnvOrArgs(String... args) {
    return fromArgs(args)
      .orElse(fromJvmProperties())
      .orElse(fromEnvironment());
  }

  public static Arguments of(Map<String, String> map) {
    Map<String, String> updated = new LinkedHashMap<>();
    for (var entry : map.entrySet()) {
      updated.put(normalize(entry.getKey()), entry.getValue());
    }
    return new Arguments(updated::get);
  }

  /** Shorthand for {@link #of(Map)} which constructs the map from a list of key/value pairs. */
  public static Arguments of(Object... args) {
    Map<String, String> map = new TreeMap<>();
    for (int i = 0; i < args.length; i += 2) {
      map.put(args[i].toString(), args[i + 1].toString());
    }
    return of(map);
  }

  private static String normalize(String key, String separator, boolean upperCase) {
    String result = key.replaceAll("[._-]", separator);
    return upperCase ? result.toUpperCase(Locale.ROOT) : result.toLowerCase(Locale.ROOT);
  }

  private static String normalize(String key) {
    return normalize(key, "_", false);
  }

  private String get(String key) {
    String[] options = key.split("\\|");
    for (int i = 0; i < options.length; i++) {
      String option = options[i].strip();
      String value = provider.apply(normalize(option));
      if (value != null) {
        if (i != 0) {
          LOGGER.warn("Argument '{}' is deprecated", option);
        }
        return value.strip();
      }
    }
    return null;
  }

  /** Returns arguments that check {@code this} first and fall back to {@code other}. */
  public Arguments orElse(Arguments other) {
    var result = new Arguments(key -> {
      String ourResult = get(key);
      return ourResult != null ? ourResult : other.get(key);
    });
    result.silent = silent;
    return result;
  }

  /** Stop logging argument values when they are read and return this instance. */
  public Arguments silence() {
    this.silent = true;
    return this;
  }

  private void logArgValue(String key, String description, Object result) {
    if (!silent && LOGGER.isDebugEnabled()) {
      LOGGER.debug("argument: {}={} ({})", key.replaceFirst("\\|.*$", ""), result, description);
    }
  }

  public String getString(String key, String description, String defaultValue) {
    String value = get(key);
    value = value == null ? defaultValue : value;
    logArgValue(key, description, value);
    return value;
  }

  public boolean getBoolean(String key, String description, boolean defaultValue) {
    return getObject(key, description, defaultValue, "true"::equalsIgnoreCase);
  }

  public int getInteger(String key, String description, int defaultValue) {
    return getObject(key, description, defaultValue, Integer::parseInt);
  }

  public double getDouble(String key, String description, double defaultValue) {
    return getObject(key, description, defaultValue, Double::parseDouble);
  }

  /**
   * Returns the value of {@code key} parsed with {@code converter}, or {@code defaultValue} if missing.
   *
   * @throws IllegalArgumentException if {@code converter} rejects the value
   */
  public <T> T getObject(String key, String description, T defaultValue, Function<String, T> converter) {
    String value = get(key);
    T result;
    try {
      result = value == null ? defaultValue : converter.apply(value);
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
    }
    logArgValue(key, description, result);
    return result;
  }
}
