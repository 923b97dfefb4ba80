package ca.gc.cra.keagen.api;

import ca.gc.cra.keagen.application.pipeline.GenerateUseCase;
import ca.gc.cra.keagen.application.port.DocumentSink;
import ca.gc.cra.keagen.config.ConfigMerger;
import ca.gc.cra.keagen.config.GeneratorConfig;
import ca.gc.cra.keagen.config.GeneratorDefaults;
import ca.gc.cra.keagen.config.YamlConfigLoader;
import ca.gc.cra.keagen.domain.render.RenderResult;
import ca.gc.cra.keagen.infrastructure.json.KeaJsonWriter;
import ca.gc.cra.keagen.infrastructure.output.FileDocumentSink;
import ca.gc.cra.keagen.logging.LoggingConfigurator;
import ca.gc.cra.keagen.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for generating a Kea DHCPv4 configuration from defaults, YAML and {@code key=value} arguments.
 *
 * @since 0.1.0
 */
public final class GenerateCli {
  private static final Logger log = LoggerFactory.getLogger(GenerateCli.class);
  private static final String SUMMARY_USAGE =
      "usage: generate interfaces=IF[,IF...] subnets.<label>.cidr=CIDR [subnets.<label>.pools=LOW-HIGH,...] "
          + "[options.<name>.data=VALUE] [options.<name>.alwaysSend=true|false] [lifetime=SECONDS] "
          + "[lease.type=TYPE] [lease.persist=true|false] [lease.name=NAME] [out=PATH] [config=PATH] "
          + "[--compact] [--dry-run] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      Kea DHCPv4 configuration generator

      Usage:
        generate interfaces=eth0 subnets.lan.cidr=10.0.0.0/24 subnets.lan.pools=10.0.0.10-10.0.0.99 [options]

      Service:
        lifetime=SECONDS               Lease valid-lifetime (default 4000)
        interfaces=IF[,IF...]          Listening interfaces; required for a complete document
        lease.type=TYPE                Lease store kind (default memfile)
        lease.persist=true|false       Persist leases (default true)
        lease.name=NAME                Lease store location (default /var/lib/kea/dhcp4.leases)

      Subnets and options (repeatable, <label>/<name> constrained to [A-Za-z0-9._-]):
        subnets.<label>.cidr=CIDR      Subnet block; ids are assigned in declaration order from 1
        subnets.<label>.pools=L-H,...  Address pools for the subnet
        options.<name>.data=VALUE      Option value; the first declaration of a name wins
        options.<name>.alwaysSend=B    Send the option even when the client does not ask (default false)

      Output:
        out=PATH                       Destination file; stdout when omitted
        config=PATH                    YAML file with common/generate sections
        --compact                      Single-line JSON instead of two-space indentation
        --allow-overwrite              Replace an existing out=PATH
        --dry-run                      Render and print a summary without writing
        --verbose                      Enable DEBUG logging
        --help                         Show this message

      Notes:
        Precedence is CLI > YAML > defaults.
        Nothing is written when interfaces, a valid lease database or at least one subnet is missing.
      """;

  private GenerateCli() {}

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
   * Executes the generate command and maps failures onto exit codes.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for generate CLI");
    }

    boolean dryRun = input.hasFlag("--dry-run");

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    ConfigCliUtils.applyFlag(kv, input.hasFlag("--allow-overwrite"), "allowOverwrite", true);
    ConfigCliUtils.applyFlag(kv, input.hasFlag("--compact"), "pretty", false);

    String configPath = ConfigCliUtils.extractConfigPath(kv);

    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, "generate");
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    GeneratorConfig config;
    try {
      Map<String, String> effective =
          ConfigMerger.buildEffectiveConfig(yamlConfig, kv, GeneratorDefaults.asFlatMap(), log::warn);
      config = GeneratorConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid generate arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (!dryRun && config.output().isPresent()) {
      try {
        Paths.validateOutputFile(config.output().get(), config.allowOverwrite());
      } catch (IllegalArgumentException ex) {
        log.error("Invalid output path: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
    }

    KeaJsonWriter writer = new KeaJsonWriter(config.pretty());
    DocumentSink sink = config.output()
        .<DocumentSink>map(path -> new FileDocumentSink(path, writer, config.allowOverwrite()))
        .orElseGet(() -> CliPrinter.documentSink(writer));
    GenerateUseCase useCase = new GenerateUseCase(sink);

    try {
      log.debug("Configured generate: lifetime={}, interfaces={}, subnets={}, options={}, output={}",
          config.validLifetime(), config.interfaces(), config.subnets().size(), config.options().size(),
          sink.describe());
      if (dryRun) {
        RenderResult result = useCase.render(config);
        printDryRunPlan(config, sink, result);
        return result.isComplete() ? ExitCode.SUCCESS : ExitCode.CONFIG_ERROR;
      }
      RenderResult result = useCase.run(config);
      return result.isComplete() ? ExitCode.SUCCESS : ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Generate configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to write Kea configuration to {}", sink.describe(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while generating Kea configuration", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(GeneratorConfig config, DocumentSink sink, RenderResult result) {
    String subnets = config.subnets().stream()
        .map(subnet -> subnet.label() + "=" + subnet.cidr() + " (" + subnet.pools().size() + " pools)")
        .collect(Collectors.joining(", "));
    String options = config.options().stream()
        .map(GeneratorConfig.OptionSpec::name)
        .collect(Collectors.joining(", "));
    String status = result.diagnostic()
        .map(diagnostic -> "incomplete at " + diagnostic.section() + " (" + diagnostic.message() + ")")
        .orElse("complete");
    CliPrinter.printLines(
        "Generate dry-run: no configuration will be written.",
        " Valid lifetime    : " + config.validLifetime(),
        " Interfaces        : " + (config.interfaces().isEmpty() ? "<none>" : String.join(", ", config.interfaces())),
        " Lease database    : " + config.leaseDatabase().type() + " " + config.leaseDatabase().name()
            + " (persist=" + config.leaseDatabase().persist() + ")",
        " Subnets           : " + (subnets.isEmpty() ? "<none>" : subnets),
        " Options           : " + (options.isEmpty() ? "<none>" : options),
        " Output            : " + sink.describe(),
        " Pretty            : " + config.pretty(),
        " Allow overwrite   : " + config.allowOverwrite(),
        " Render status     : " + status,
        " Re-run without --dry-run to write the configuration.");
  }
}
