package com.walstream.client.cli;

import com.walstream.client.WalstreamClient;

/**
 * Main entry point for the Walstream CLI.
 *
 * <p>Usage:
 *
 * <pre>{@code
 * # Stream change events from a local CDC service without TLS
 * java -jar walstream-client-cli-0.1.0.jar start --plaintext
 * }</pre>
 */
public class Main {

  private static final String VERSION = "0.1.0";

  private static final String USAGE =
      "Walstream CLI - Console client for the Walstream CDC service\n"
          + "\n"
          + "Usage: java -jar walstream-client-cli.jar <command> [options]\n"
          + "\n"
          + "Commands:\n"
          + "  start             Connect and print change events until interrupted\n"
          + "  version           Show version information\n"
          + "  help              Show this help message\n"
          + "\n"
          + "Examples:\n"
          + "  java -jar walstream-client-cli.jar start --plaintext\n"
          + "  WALSTREAM_HOST=cdc.internal java -jar walstream-client-cli.jar start\n"
          + "\n"
          + "For command-specific help:\n"
          + "  java -jar walstream-client-cli.jar start --help\n";

  public static void main(String[] args) {
    if (args.length == 0) {
      System.out.println(USAGE);
      System.exit(0);
    }

    String command = args[0];

    switch (command) {
      case "start":
        String[] startArgs = new String[args.length - 1];
        System.arraycopy(args, 1, startArgs, 0, args.length - 1);
        StartClient.main(startArgs);
        break;

      case "version":
      case "--version":
      case "-v":
        System.out.println(
            "walstream-cli " + VERSION + " (client " + WalstreamClient.getVersion() + ")");
        break;

      case "help":
      case "--help":
      case "-h":
        System.out.println(USAGE);
        break;

      default:
        System.err.println("Unknown command: " + command);
        System.err.println();
        System.err.println(USAGE);
        System.exit(1);
    }
  }
}
