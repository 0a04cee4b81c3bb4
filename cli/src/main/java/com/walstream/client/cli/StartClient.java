package com.walstream.client.cli;

import com.walstream.client.ClientConfigurationOptions;
import com.walstream.client.UnrecognizedEventPolicy;
import com.walstream.client.WalstreamClient;
import com.walstream.client.retry.ExponentialBackoffRetryPolicy;
import com.walstream.client.retry.FixedDelayRetryPolicy;
import com.walstream.client.tls.InsecureTlsConfig;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Connects to the CDC service and prints every change event to standard output.
 *
 * <p>Runs until the process is interrupted. Connection failures are logged and retried; they
 * never stop the command.
 *
 * <p>Usage: java -jar walstream-client-cli.jar start [--host &lt;host&gt;] [--port &lt;port&gt;]
 * [--plaintext] [--retry-delay-ms &lt;ms&gt;] [--max-retry-delay-ms &lt;ms&gt;]
 * [--connect-timeout-ms &lt;ms&gt;] [--unrecognized skip|warn]
 */
public class StartClient {

  static final String HOST_ENV = "WALSTREAM_HOST";
  static final String PORT_ENV = "WALSTREAM_PORT";

  private static final String USAGE =
      "Usage: java -jar walstream-client-cli.jar start [options]\n"
          + "  --host <host>                 CDC service host (env "
          + HOST_ENV
          + ", default "
          + ClientConfigurationOptions.DEFAULT_HOST
          + ")\n"
          + "  --port <port>                 CDC service port (env "
          + PORT_ENV
          + ", default "
          + ClientConfigurationOptions.DEFAULT_PORT
          + ")\n"
          + "  --plaintext                   Connect without TLS\n"
          + "  --retry-delay-ms <ms>         Delay between reconnect attempts (default 2000)\n"
          + "  --max-retry-delay-ms <ms>     Back off exponentially up to this delay\n"
          + "  --connect-timeout-ms <ms>     How long a connection attempt may take\n"
          + "  --unrecognized <skip|warn>    Logging of unknown event variants (default skip)\n"
          + "\n"
          + "Examples:\n"
          + "  java -jar walstream-client-cli.jar start --plaintext\n"
          + "  java -jar walstream-client-cli.jar start \\\n"
          + "    --host cdc.internal --port 50051 \\\n"
          + "    --retry-delay-ms 500 --max-retry-delay-ms 30000\n";

  public static void main(String[] args) {
    Args parsedArgs;
    try {
      parsedArgs = parseArgs(args, System.getenv());
    } catch (IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      System.err.println();
      System.err.println(USAGE);
      System.exit(1);
      return;
    }
    if (parsedArgs.help) {
      System.out.println(USAGE);
      System.exit(0);
    }

    ClientConfigurationOptions options;
    try {
      options = toOptions(parsedArgs);
    } catch (IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      System.exit(1);
      return;
    }

    WalstreamClient client =
        WalstreamClient.builder(new ConsoleEventPrinter(System.out)).options(options).build();
    Runtime.getRuntime()
        .addShutdownHook(new Thread(client::close, "WalstreamClient-shutdown"));
    client.run();
  }

  /**
   * Parses command line arguments.
   *
   * @param args the command line arguments, without the command name
   * @param env environment variables consulted for values not given on the command line
   * @return the parsed arguments
   * @throws IllegalArgumentException if an argument is unknown, lacks a value or is malformed
   */
  static Args parseArgs(String[] args, Map<String, String> env) {
    Args result = new Args();

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg.equals("--help") || arg.equals("-h")) {
        result.help = true;
        continue;
      }
      if (arg.equals("--plaintext")) {
        result.plaintext = true;
        continue;
      }
      if (!arg.startsWith("--")) {
        throw new IllegalArgumentException("Unexpected argument: " + arg);
      }
      if (i + 1 >= args.length) {
        throw new IllegalArgumentException("Missing value for argument: " + arg);
      }
      String value = args[++i];

      switch (arg.substring(2)) {
        case "host":
          result.host = value;
          break;
        case "port":
          result.port = parseInt(arg, value);
          break;
        case "retry-delay-ms":
          result.retryDelayMs = parseLong(arg, value);
          break;
        case "max-retry-delay-ms":
          result.maxRetryDelayMs = parseLong(arg, value);
          break;
        case "connect-timeout-ms":
          result.connectTimeoutMs = parseInt(arg, value);
          break;
        case "unrecognized":
          result.unrecognized = parsePolicy(value);
          break;
        default:
          throw new IllegalArgumentException("Unknown argument: " + arg);
      }
    }

    if (result.host == null) {
      String envHost = env.get(HOST_ENV);
      if (envHost != null && !envHost.trim().isEmpty()) {
        result.host = envHost.trim();
      }
    }
    if (result.port == null) {
      String envPort = env.get(PORT_ENV);
      if (envPort != null && !envPort.trim().isEmpty()) {
        result.port = parseInt(PORT_ENV, envPort.trim());
      }
    }
    return result;
  }

  /**
   * Converts parsed arguments to client options.
   *
   * <p>A {@code --max-retry-delay-ms} switches from a fixed delay to exponential backoff starting
   * at the retry delay.
   */
  static ClientConfigurationOptions toOptions(Args args) {
    ClientConfigurationOptions.ClientConfigurationOptionsBuilder builder =
        ClientConfigurationOptions.builder();
    if (args.host != null) {
      builder.setHost(args.host);
    }
    if (args.port != null) {
      builder.setPort(args.port);
    }
    if (args.plaintext) {
      builder.setTlsConfig(new InsecureTlsConfig());
    }
    if (args.connectTimeoutMs != null) {
      builder.setConnectTimeoutMs(args.connectTimeoutMs);
    }
    if (args.unrecognized != null) {
      builder.setUnrecognizedEventPolicy(args.unrecognized);
    }

    Duration retryDelay =
        args.retryDelayMs != null
            ? Duration.ofMillis(args.retryDelayMs)
            : FixedDelayRetryPolicy.DEFAULT_DELAY;
    if (args.maxRetryDelayMs != null) {
      builder.setRetryPolicy(
          ExponentialBackoffRetryPolicy.builder()
              .initialDelay(retryDelay)
              .maxDelay(Duration.ofMillis(args.maxRetryDelayMs))
              .build());
    } else {
      builder.setRetryPolicy(new FixedDelayRetryPolicy(retryDelay));
    }
    return builder.build();
  }

  private static int parseInt(String name, String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid number for " + name + ": " + value);
    }
  }

  private static long parseLong(String name, String value) {
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid number for " + name + ": " + value);
    }
  }

  private static UnrecognizedEventPolicy parsePolicy(String value) {
    try {
      return UnrecognizedEventPolicy.valueOf(value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Invalid value for --unrecognized: " + value + " (expected skip or warn)");
    }
  }

  static class Args {
    String host;
    Integer port;
    boolean plaintext;
    Long retryDelayMs;
    Long maxRetryDelayMs;
    Integer connectTimeoutMs;
    UnrecognizedEventPolicy unrecognized;
    boolean help;
  }
}
