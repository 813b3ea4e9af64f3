package com.tileshard.config;

import com.tileshard.stats.Stats;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Options for a tiling run, looked up by key from the command line, JVM properties, environment variables or a
 * properties file.
 * <p>
 * Keys ignore case and treat {@code -}, {@code .} and {@code _} alike, so {@code --tile-width=10} sets
 * {@code tile_width}. A key written {@code "tile_width|patch_width"} reads {@code tile_width} and falls back to the
 * deprecated {@code patch_width}.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);
  private static final String JVM_PREFIX = "tileshard.";
  private static final String ENV_PREFIX = "TILESHARD_";

  /** One place to look up values, receiving keys already normalized. */
  private record Source(String name, UnaryOperator<String> lookup) {}

  private final List<Source> sources;

  private Arguments(List<Source> sources) {
    this.sources = List.copyOf(sources);
  }

  static String normalize(String key) {
    return key.strip().replaceAll("[.-]", "_").toLowerCase(Locale.ROOT);
  }

  private static Arguments fromMap(String name, Map<?, ?> values) {
    Map<String, String> normalized = new HashMap<>();
    values.forEach((key, value) -> normalized.put(normalize(key.toString()), value.toString()));
    return new Arguments(List.of(new Source(name, normalized::get)));
  }

  /** Returns arguments from alternating keys and values, for example {@code of("tile_width", 100)}. */
  public static Arguments of(Object... keysAndValues) {
    if (keysAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected keys and values in pairs, got " + keysAndValues.length + " items");
    }
    Map<Object, Object> values = new HashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      values.put(keysAndValues[i], keysAndValues[i + 1]);
    }
    return fromMap("provided", values);
  }

  /**
   * Returns arguments parsed from {@code key=value}, {@code --key value} and bare {@code --flag} command-line
   * arguments, where a flag means {@code true}.
   */
  public static Arguments fromArgs(String... args) {
    Map<String, String> parsed = new HashMap<>();
    int i = 0;
    while (i < args.length) {
      String arg = args[i++].strip();
      int equals = arg.indexOf('=');
      if (equals >= 0) {
        parsed.put(withoutDashes(arg.substring(0, equals)), arg.substring(equals + 1));
      } else if (arg.startsWith("-") && i < args.length && !args[i].strip().startsWith("-")) {
        parsed.put(withoutDashes(arg), args[i++].strip());
      } else {
        parsed.put(withoutDashes(arg), "true");
      }
    }
    return fromMap("command line", parsed);
  }

  private static String withoutDashes(String arg) {
    return arg.replaceFirst("^-+", "");
  }

  /** Returns arguments from JVM properties, where {@code -Dtileshard.tile_width=10} sets {@code tile_width}. */
  public static Arguments fromJvmProperties() {
    return fromJvmProperties(System.getProperties());
  }

  static Arguments fromJvmProperties(Properties properties) {
    return new Arguments(List.of(new Source("jvm properties", key -> properties.getProperty(JVM_PREFIX + key))));
  }

  /** Returns arguments from environment variables, where {@code TILESHARD_TILE_WIDTH=10} sets {@code tile_width}. */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  static Arguments fromEnvironment(Map<String, String> environment) {
    return new Arguments(List.of(
      new Source("environment", key -> environment.get(ENV_PREFIX + key.toUpperCase(Locale.ROOT)))
    ));
  }

  /**
   * Returns arguments from a {@code .properties} file.
   *
   * @throws IllegalArgumentException if the file can't be read
   */
  public static Arguments fromConfigFile(Path path) {
    Properties properties = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      properties.load(reader);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to load config file: " + path, e);
    }
    return fromMap(path.toString(), properties);
  }

  /** Returns arguments from the command line, then JVM properties, then environment variables. */
  public static Arguments fromEnvOrArgs(String... args) {
    return fromArgs(args)
      .orElse(fromJvmProperties())
      .orElse(fromEnvironment());
  }

  /**
   * Returns the arguments of {@link #fromEnvOrArgs(String...)}, falling back to the properties file named by their
   * {@code config} argument when there is one.
   */
  public static Arguments fromArgsOrConfigFile(String... args) {
    Arguments arguments = fromEnvOrArgs(args);
    Path configFile = arguments.file("config", "path to a properties file with more arguments", null);
    return configFile == null ? arguments : arguments.orElse(fromConfigFile(configFile));
  }

  /** Returns arguments that read from {@code this} first and from {@code other} for keys {@code this} lacks. */
  public Arguments orElse(Arguments other) {
    List<Source> combined = new ArrayList<>(sources);
    combined.addAll(other.sources);
    return new Arguments(combined);
  }

  private String get(String key) {
    String[] names = key.split("\\|");
    for (Source source : sources) {
      for (int i = 0; i < names.length; i++) {
        String value = source.lookup.apply(normalize(names[i]));
        if (value != null) {
          if (i > 0) {
            LOGGER.warn("Argument '{}' from {} is deprecated, use '{}'", names[i].strip(), source.name,
              names[0].strip());
          }
          return value.strip();
        }
      }
    }
    return null;
  }

  private <T> T read(String key, String description, T defaultValue, Function<String, T> parser) {
    String value = get(key);
    T result;
    try {
      result = value == null ? defaultValue : parser.apply(value);
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("Invalid value for " + key + " (" + description + "): " + value, e);
    }
    LOGGER.debug("argument: {}={} ({})", key.replaceFirst("\\|.*$", ""), result, description);
    return result;
  }

  private static Duration duration(String value) {
    return Duration.parse("PT" + value);
  }

  public String getString(String key, String description, String defaultValue) {
    return read(key, description, defaultValue, Function.identity());
  }

  public double getDouble(String key, String description, double defaultValue) {
    return read(key, description, defaultValue, Double::parseDouble);
  }

  /** Returns true only for a value of {@code true}, ignoring case. */
  public boolean getBoolean(String key, String description, boolean defaultValue) {
    return read(key, description, defaultValue, "true"::equalsIgnoreCase);
  }

  /** Returns a duration written like {@code 10s}, {@code 90m} or {@code 1h30m}. */
  public Duration getDuration(String key, String description, String defaultValue) {
    return read(key, description, duration(defaultValue), Arguments::duration);
  }

  /** Returns the {@code threads} argument, or the number of available processors. */
  public int threads() {
    return read("threads", "number of shard worker threads", Runtime.getRuntime().availableProcessors(),
      Integer::parseInt);
  }

  /** Returns a path that does not need to exist yet, or {@code defaultValue}. */
  public Path file(String key, String description, Path defaultValue) {
    return read(key, description, defaultValue, Path::of);
  }

  /**
   * Returns a required path that does not need to exist yet.
   *
   * @throws IllegalArgumentException if the argument is missing
   */
  public Path file(String key, String description) {
    Path path = file(key, description, null);
    if (path == null) {
      throw new IllegalArgumentException("Missing required argument: " + key + " (" + description + ")");
    }
    return path;
  }

  /**
   * Returns a required path that must exist.
   *
   * @throws IllegalArgumentException if the argument is missing or the path does not exist
   */
  public Path inputFile(String key, String description) {
    Path path = file(key, description);
    if (!Files.exists(path)) {
      throw new IllegalArgumentException(path + " does not exist");
    }
    return path;
  }

  /** Returns an envelope written as {@code minX,minY,maxX,maxY}, or null if missing. */
  public Envelope envelope(String key, String description) {
    return read(key, description, null, value -> {
      double[] bounds = Stream.of(value.split("[\\s,]+")).mapToDouble(Double::parseDouble).toArray();
      if (bounds.length != 4) {
        throw new IllegalArgumentException("expected 4 coordinates");
      }
      return new Envelope(bounds[0], bounds[2], bounds[1], bounds[3]);
    });
  }

  /** Returns the {@link Stats} to collect timings and counts with. */
  public Stats getStats() {
    LOGGER.debug("argument: stats=in-memory");
    return Stats.inMemory();
  }
}
