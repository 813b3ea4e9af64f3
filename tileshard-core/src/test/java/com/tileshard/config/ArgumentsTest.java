package com.tileshard.config;

import static org.junit.jupiter.api.Assertions.*;

import com.tileshard.TestUtils;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

class ArgumentsTest {

  @Test
  void testEmpty() {
    assertEquals("fallback", Arguments.of().getString("key", "key", "fallback"));
  }

  @Test
  void testOrElse() {
    Arguments args = Arguments.of("key1", "value1a", "key2", "value2a")
      .orElse(Arguments.of("key2", "value2b", "key3", "value3b"));

    assertEquals("value1a", args.getString("key1", "key", "fallback"));
    assertEquals("value2a", args.getString("key2", "key", "fallback"));
    assertEquals("value3b", args.getString("key3", "key", "fallback"));
    assertEquals("fallback", args.getString("key4", "key", "fallback"));
  }

  @Test
  void testOddNumberOfValues() {
    assertThrows(IllegalArgumentException.class, () -> Arguments.of("key"));
  }

  @Test
  void testConfigFileParsing() {
    Arguments args = Arguments.fromConfigFile(TestUtils.pathToResource("test.properties"));

    assertEquals("value1fromfile", args.getString("key1", "key", "fallback"));
    assertEquals("fallback", args.getString("key3", "key", "fallback"));
  }

  @Test
  void testMissingConfigFile() {
    Path missing = TestUtils.pathToResource("missing.properties");
    assertThrows(IllegalArgumentException.class, () -> Arguments.fromConfigFile(missing));
  }

  @Test
  void testGetConfigFileFromArgs() {
    Arguments args = Arguments.fromArgsOrConfigFile(
      "config=" + TestUtils.pathToResource("test.properties"),
      "key2=value2fromargs"
    );

    assertEquals("value1fromfile", args.getString("key1", "key", "fallback"));
    assertEquals("value2fromargs", args.getString("key2", "key", "fallback"));
  }

  @Test
  void testNumbers() {
    Arguments args = Arguments.of("double", "2.5", "duration", "1h30m");

    assertEquals(2.5, args.getDouble("double", "key", 1));
    assertEquals(1, args.getDouble("double2", "key", 1));
    assertEquals(Duration.ofMinutes(90), args.getDuration("duration", "key", "10m"));
    assertEquals(Duration.ofSeconds(10), args.getDuration("duration2", "key", "10s"));
  }

  @Test
  void testInvalidNumberNamesTheArgument() {
    var exception = assertThrows(IllegalArgumentException.class,
      () -> Arguments.of("tile_width", "wide").getDouble("tile_width", "width", 1));
    assertTrue(exception.getMessage().contains("tile_width"), exception.getMessage());
    assertThrows(IllegalArgumentException.class,
      () -> Arguments.of("loginterval", "soon").getDuration("loginterval", "logs", "10s"));
  }

  @Test
  void testThreads() {
    assertEquals(3, Arguments.of("threads", "3").threads());
    assertEquals(1, Arguments.of("threads", "1").threads());
    assertEquals(Runtime.getRuntime().availableProcessors(), Arguments.of().threads());
  }

  @Test
  void testBoolean() {
    assertTrue(Arguments.of("boolean", "true").getBoolean("boolean", "bool", false));
    assertTrue(Arguments.of("boolean", "TRUE").getBoolean("boolean", "bool", false));
    assertFalse(Arguments.of("boolean", "false").getBoolean("boolean", "bool", true));
    assertFalse(Arguments.of("boolean", "yes").getBoolean("boolean", "bool", true));
    assertTrue(Arguments.of().getBoolean("boolean", "bool", true));
  }

  @Test
  void testFile() {
    Path exists = TestUtils.pathToResource("test.properties");
    Path missing = TestUtils.pathToResource("missing.properties");
    assertEquals(exists, Arguments.of("file", exists).inputFile("file", "file"));
    assertThrows(IllegalArgumentException.class, () -> Arguments.of("file", missing).inputFile("file", "file"));
    assertThrows(IllegalArgumentException.class, () -> Arguments.of().inputFile("file", "file"));
    assertEquals(missing, Arguments.of("file", missing).file("file", "file"));
    assertThrows(IllegalArgumentException.class, () -> Arguments.of().file("file", "file"));
    assertNull(Arguments.of().file("file", "file", null));
  }

  @Test
  void testEnvelope() {
    assertEquals(new Envelope(1, 3, 2, 4), Arguments.of("roi", "1,2,3,4").envelope("roi", "roi"));
    assertEquals(new Envelope(1, 3, 2, 4), Arguments.of("roi", "1 2 3 4").envelope("roi", "roi"));
    assertNull(Arguments.of().envelope("roi", "roi"));
    assertThrows(IllegalArgumentException.class, () -> Arguments.of("roi", "1,2,3").envelope("roi", "roi"));
  }

  @Test
  void testSpaceBetweenArgs() {
    Arguments args = Arguments.fromArgs("input=a.csv --key value --key2 value2 --force1".split("\\s+"));

    assertEquals("a.csv", args.getString("input", "input", null));
    assertEquals("value", args.getString("key", "key", null));
    assertEquals("value2", args.getString("key2", "key", null));
    assertTrue(args.getBoolean("force1", "force", false));
  }

  @Test
  void testFlagFollowedByFlag() {
    Arguments args = Arguments.fromArgs("--use-prior", "--overwrite", "false");

    assertTrue(args.getBoolean("use_prior", "prior", false));
    assertFalse(args.getBoolean("overwrite", "overwrite", true));
  }

  @Test
  void testUnderscoreDashSame() {
    assertEquals(100, Arguments.fromArgs("--tile-width=100").getDouble("tile_width", "width", 1));
    assertEquals(100, Arguments.fromArgs("--tile_width=100").getDouble("tile-width", "width", 1));
    assertEquals(100, Arguments.fromArgs("--TILE.WIDTH=100").getDouble("tile_width", "width", 1));
  }

  @Test
  void testEnvironment() {
    Map<String, String> env = Map.of(
      "THREADS", "8",
      "TILESHARD_TILE_WIDTH", "100",
      "TILESHARD_THREADS", "4"
    );
    Arguments args = Arguments.fromEnvironment(env);
    assertEquals(100, args.getDouble("tile_width", "width", 1));
    assertEquals(4, args.threads());
    assertEquals("fallback", args.getString("other", "other", "fallback"));
  }

  @Test
  void testJvmProperties() {
    Properties properties = new Properties();
    properties.setProperty("threads", "8");
    properties.setProperty("tileshard.threads", "3");
    properties.setProperty("tileshard.tile_overlap", "25");
    Arguments args = Arguments.fromJvmProperties(properties);
    assertEquals(3, args.threads());
    assertEquals(25, args.getDouble("tile-overlap", "overlap", 1));
  }

  @Test
  void testCommandLineWinsOverEnvironment() {
    Arguments args = Arguments.fromArgs("threads=2")
      .orElse(Arguments.fromEnvironment(Map.of("TILESHARD_THREADS", "4", "TILESHARD_TILE_WIDTH", "10")));
    assertEquals(2, args.threads());
    assertEquals(10, args.getDouble("tile_width", "width", 1));
  }

  @Test
  void testDeprecatedArgs() {
    assertEquals(10, Arguments.of("patch_width", "10").getDouble("tile_width|patch_width", "width", 1));
    assertEquals(20, Arguments.of("patch_width", "10", "tile_width", "20")
      .getDouble("tile_width|patch_width", "width", 1));
  }

  @Test
  void testDeprecatedNameOnCommandLineWinsOverEnvironment() {
    Arguments args = Arguments.fromArgs("patch_width=10")
      .orElse(Arguments.fromEnvironment(Map.of("TILESHARD_TILE_WIDTH", "20")));
    assertEquals(10, args.getDouble("tile_width|patch_width", "width", 1));
  }
}
