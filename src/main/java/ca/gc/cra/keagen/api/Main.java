package ca.gc.cra.keagen.api;

import ca.gc.cra.keagen.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * keagen CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: keagen <generate|example> [options]";
  private static final String HELP_TEXT = """
      keagen command dispatcher

      Usage:
        keagen <command> [options]

      Commands:
        generate    Build a Kea DHCPv4 configuration (generate --help for details)
        example     Print a sample configuration

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * <p>Help is only handled here when no subcommand is given, so {@code generate --help} reaches the
   * subcommand.</p>
   *
   * @param args dispatcher arguments (first non-flag token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] remainder = input.keyValueArgs();
    if (input.help() && remainder.length == 0) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    if (remainder.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = delegateArgs(args, remainder[0]);

    return switch (command) {
      case "generate" -> GenerateCli.run(delegateArgs);
      case "example" -> ExampleCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  /** Drops the first occurrence of the command token, keeping flags in place for the subcommand. */
  private static String[] delegateArgs(String[] args, String command) {
    String[] copy = Arrays.stream(args).filter(arg -> arg != null).toArray(String[]::new);
    for (int i = 0; i < copy.length; i++) {
      if (command.equals(copy[i].trim())) {
        String[] rest = new String[copy.length - 1];
        System.arraycopy(copy, 0, rest, 0, i);
        System.arraycopy(copy, i + 1, rest, i, copy.length - i - 1);
        return rest;
      }
    }
    return copy;
  }
}
