package ca.gc.cra.keagen.application.pipeline;

import ca.gc.cra.keagen.application.port.DocumentSink;
import ca.gc.cra.keagen.config.GeneratorConfig;
import ca.gc.cra.keagen.config.GeneratorConfig.OptionSpec;
import ca.gc.cra.keagen.config.GeneratorConfig.PoolSpec;
import ca.gc.cra.keagen.config.GeneratorConfig.SubnetSpec;
import ca.gc.cra.keagen.domain.dhcp4.Dhcp4Config;
import ca.gc.cra.keagen.domain.dhcp4.InterfacesConfig;
import ca.gc.cra.keagen.domain.dhcp4.KeaConfig;
import ca.gc.cra.keagen.domain.dhcp4.OptionData;
import ca.gc.cra.keagen.domain.dhcp4.Subnet4;
import ca.gc.cra.keagen.domain.render.RenderDiagnostic;
import ca.gc.cra.keagen.domain.render.RenderResult;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds the DHCPv4 model from configuration, renders it, and hands complete documents to a
 * {@link DocumentSink}.
 * <p><strong>Why:</strong> Kea must never be fed a partial document, so the write is gated on
 * {@link RenderResult#isComplete()}.</p>
 * <p><strong>Role:</strong> Application-layer use case behind the {@code generate} and {@code example}
 * commands.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the sink; one instance per CLI invocation.</p>
 * <p><strong>Observability:</strong> Logs ignored duplicates, rejected pools and render diagnostics.</p>
 *
 * @since 0.1.0
 */
public final class GenerateUseCase {
  private static final Logger log = LoggerFactory.getLogger(GenerateUseCase.class);

  private final DocumentSink sink;

  /**
   * Creates the use case.
   *
   * @param sink destination for complete documents
   */
  public GenerateUseCase(DocumentSink sink) {
    this.sink = Objects.requireNonNull(sink, "sink");
  }

  /**
   * Builds, renders and, when complete, writes the configuration.
   *
   * @param config validated generator configuration
   * @return render outcome; the document was written only if {@link RenderResult#isComplete()}
   * @throws IOException if the sink fails
   */
  public RenderResult run(GeneratorConfig config) throws IOException {
    RenderResult result = render(config);
    if (!result.isComplete()) {
      RenderDiagnostic diagnostic = result.diagnostic().orElseThrow();
      log.warn("Kea configuration incomplete ({}): {}; nothing written to {}",
          diagnostic, diagnostic.message(), sink.describe());
      return result;
    }
    sink.write(result.document());
    log.debug("Kea configuration written to {}", sink.describe());
    return result;
  }

  /**
   * Builds and renders the configuration without writing it.
   *
   * @param config validated generator configuration
   * @return render outcome
   */
  public RenderResult render(GeneratorConfig config) {
    return buildModel(config).render();
  }

  /**
   * Translates configuration into the domain model through its public mutation operations.
   *
   * @param config validated generator configuration
   * @return populated document root
   */
  public static KeaConfig buildModel(GeneratorConfig config) {
    Objects.requireNonNull(config, "config");
    Dhcp4Config dhcp4 = new Dhcp4Config(
        config.validLifetime(), new InterfacesConfig(config.interfaces()), config.leaseDatabase());

    Subnet4 subnets = dhcp4.subnets();
    for (SubnetSpec spec : config.subnets()) {
      long id = subnets.addSubnet(spec.cidr());
      log.debug("Subnet {} ({}) registered with id {}", spec.label(), spec.cidr(), id);
      for (PoolSpec pool : spec.pools()) {
        if (!subnets.addPool(id, pool.low(), pool.high())) {
          log.warn("Pool {}-{} rejected: subnet id {} not found", pool.low(), pool.high(), id);
        }
      }
    }

    // fromMap yields unique names; a hand-built GeneratorConfig may still repeat one.
    OptionData options = dhcp4.options();
    for (OptionSpec spec : config.options()) {
      if (!options.add(spec.name(), spec.data(), spec.alwaysSend())) {
        log.info("Option {} already defined; keeping first value", spec.name());
      }
    }
    return new KeaConfig(dhcp4);
  }
}
