package com.walstream.client.cli;

import static org.junit.jupiter.api.Assertions.*;

import com.walstream.client.ClientConfigurationOptions;
import com.walstream.client.UnrecognizedEventPolicy;
import com.walstream.client.retry.ExponentialBackoffRetryPolicy;
import com.walstream.client.retry.FixedDelayRetryPolicy;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for the start command. */
class StartClientTest {

  private static final Map<String, String> NO_ENV = Collections.emptyMap();

  // ==================== parseArgs Tests ====================

  @Test
  void testParseArgsComplete() {
    String[] args = {
      "--host", "cdc.internal",
      "--port", "6000",
      "--plaintext",
      "--retry-delay-ms", "500",
      "--max-retry-delay-ms", "30000",
      "--connect-timeout-ms", "2500",
      "--unrecognized", "warn"
    };

    StartClient.Args parsed = StartClient.parseArgs(args, NO_ENV);

    assertEquals("cdc.internal", parsed.host);
    assertEquals(6000, parsed.port);
    assertTrue(parsed.plaintext);
    assertEquals(500L, parsed.retryDelayMs);
    assertEquals(30000L, parsed.maxRetryDelayMs);
    assertEquals(2500, parsed.connectTimeoutMs);
    assertEquals(UnrecognizedEventPolicy.WARN, parsed.unrecognized);
    assertFalse(parsed.help);
  }

  @Test
  void testParseArgsEmpty() {
    StartClient.Args parsed = StartClient.parseArgs(new String[0], NO_ENV);

    assertNull(parsed.host);
    assertNull(parsed.port);
    assertFalse(parsed.plaintext);
  }

  @Test
  void testEnvironmentFallback() {
    Map<String, String> env = new HashMap<>();
    env.put(StartClient.HOST_ENV, "env-host");
    env.put(StartClient.PORT_ENV, "7000");

    StartClient.Args fromEnv = StartClient.parseArgs(new String[0], env);
    assertEquals("env-host", fromEnv.host);
    assertEquals(7000, fromEnv.port);

    StartClient.Args fromArgs =
        StartClient.parseArgs(new String[] {"--host", "arg-host", "--port", "8000"}, env);
    assertEquals("arg-host", fromArgs.host);
    assertEquals(8000, fromArgs.port);
  }

  @Test
  void testHelpFlag() {
    assertTrue(StartClient.parseArgs(new String[] {"--help"}, NO_ENV).help);
    assertTrue(StartClient.parseArgs(new String[] {"-h"}, NO_ENV).help);
  }

  @Test
  void testParseArgsErrors() {
    IllegalArgumentException missing =
        assertThrows(
            IllegalArgumentException.class,
            () -> StartClient.parseArgs(new String[] {"--host"}, NO_ENV));
    assertTrue(missing.getMessage().contains("--host"));

    assertThrows(
        IllegalArgumentException.class,
        () -> StartClient.parseArgs(new String[] {"--bogus", "1"}, NO_ENV));
    assertThrows(
        IllegalArgumentException.class,
        () -> StartClient.parseArgs(new String[] {"--port", "abc"}, NO_ENV));
    assertThrows(
        IllegalArgumentException.class,
        () -> StartClient.parseArgs(new String[] {"--unrecognized", "fail"}, NO_ENV));
    assertThrows(
        IllegalArgumentException.class,
        () -> StartClient.parseArgs(new String[] {"stray"}, NO_ENV));

    Map<String, String> badEnv = Collections.singletonMap(StartClient.PORT_ENV, "nope");
    assertThrows(
        IllegalArgumentException.class, () -> StartClient.parseArgs(new String[0], badEnv));
  }

  // ==================== toOptions Tests ====================

  @Test
  void testDefaultOptions() {
    ClientConfigurationOptions options =
        StartClient.toOptions(StartClient.parseArgs(new String[0], NO_ENV));

    assertEquals("127.0.0.1:50051", options.target());
    assertTrue(options.tlsConfig().isSecure());
    assertTrue(options.retryPolicy() instanceof FixedDelayRetryPolicy);
    assertEquals(Duration.ofSeconds(2), options.retryPolicy().nextDelay(1));
    assertEquals(UnrecognizedEventPolicy.SKIP, options.unrecognizedEventPolicy());
  }

  @Test
  void testFixedRetryDelay() {
    ClientConfigurationOptions options =
        StartClient.toOptions(
            StartClient.parseArgs(new String[] {"--retry-delay-ms", "750"}, NO_ENV));

    assertEquals(Duration.ofMillis(750), options.retryPolicy().nextDelay(10));
  }

  @Test
  void testMaxRetryDelaySelectsExponentialBackoff() {
    ClientConfigurationOptions options =
        StartClient.toOptions(
            StartClient.parseArgs(
                new String[] {"--retry-delay-ms", "100", "--max-retry-delay-ms", "1000"}, NO_ENV));

    assertTrue(options.retryPolicy() instanceof ExponentialBackoffRetryPolicy);
    assertEquals(Duration.ofMillis(100), options.retryPolicy().nextDelay(1));
    assertEquals(Duration.ofMillis(400), options.retryPolicy().nextDelay(3));
    assertEquals(Duration.ofMillis(1000), options.retryPolicy().nextDelay(20));
  }

  @Test
  void testPlaintextAndTimeout() {
    ClientConfigurationOptions options =
        StartClient.toOptions(
            StartClient.parseArgs(
                new String[] {"--plaintext", "--connect-timeout-ms", "1000", "--port", "6000"},
                NO_ENV));

    assertFalse(options.tlsConfig().isSecure());
    assertEquals(1000, options.connectTimeoutMs());
    assertEquals(6000, options.port());
  }

  @Test
  void testOutOfRangeValuesAreRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> StartClient.toOptions(StartClient.parseArgs(new String[] {"--port", "0"}, NO_ENV)));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            StartClient.toOptions(
                StartClient.parseArgs(new String[] {"--retry-delay-ms", "-5"}, NO_ENV)));
  }
}
