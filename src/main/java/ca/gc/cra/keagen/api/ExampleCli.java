package ca.gc.cra.keagen.api;

import ca.gc.cra.keagen.application.pipeline.GenerateUseCase;
import ca.gc.cra.keagen.config.ExampleConfigs;
import ca.gc.cra.keagen.config.GeneratorConfig;
import ca.gc.cra.keagen.domain.render.RenderResult;
import ca.gc.cra.keagen.infrastructure.json.KeaJsonWriter;
import ca.gc.cra.keagen.logging.LoggingConfigurator;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the built-in sample configuration from {@link ExampleConfigs#demo()} to stdout.
 */
public final class ExampleCli {
  private static final Logger log = LoggerFactory.getLogger(ExampleCli.class);
  private static final String HELP_TEXT = """
      Print a sample Kea DHCPv4 configuration

      Usage:
        example [--compact] [--verbose]

      The sample serves 192.168.50.10 - 192.168.50.20 on enp0s1 with a memfile lease store.
      """;

  private ExampleCli() {}

  /**
   * Renders the sample configuration.
   *
   * @param args {@code --compact}, {@code --verbose} or {@code --help}
   * @return {@link ExitCode#SUCCESS} once the document is printed
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    if (input.keyValueArgs().length > 0) {
      log.error("example takes no key=value arguments");
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.INVALID_ARGS;
    }

    GeneratorConfig demo = ExampleConfigs.demo();
    KeaJsonWriter writer = new KeaJsonWriter(!input.hasFlag("--compact"));
    GenerateUseCase useCase = new GenerateUseCase(CliPrinter.documentSink(writer));
    try {
      RenderResult result = useCase.run(demo);
      return result.isComplete() ? ExitCode.SUCCESS : ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to print sample configuration", ex);
      return ExitCode.IO_ERROR;
    }
  }
}
