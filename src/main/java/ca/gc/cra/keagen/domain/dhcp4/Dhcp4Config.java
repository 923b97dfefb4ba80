package ca.gc.cra.keagen.domain.dhcp4;

import ca.gc.cra.keagen.domain.render.RenderDiagnostic;
import ca.gc.cra.keagen.domain.render.RenderResult;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> The Kea DHCPv4 service definition: lease lifetime, interfaces, lease store,
 * subnets and options.
 * <p><strong>Why:</strong> Kea only accepts a {@code Dhcp4} block whose mandatory sections are present, so
 * rendering validates as it goes and stops at the first missing section.</p>
 * <p><strong>Role:</strong> Aggregate root of the domain model; exclusively owns its five parts.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose the owned {@link Subnet4} and {@link OptionData} for mutation.</li>
 *   <li>Allow wholesale replacement of interfaces and lease database.</li>
 *   <li>Render the {@code Dhcp4} body through the ordered checks of {@link #render()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Hold one exclusive lock per instance across a
 * mutate-then-render sequence when sharing between threads.</p>
 * <p><strong>Observability:</strong> Logs a warning when built or updated without interfaces; rendering
 * itself reports through {@link RenderResult} only.</p>
 *
 * @since 0.1.0
 * @see KeaConfig
 */
public final class Dhcp4Config {
  private static final Logger log = LoggerFactory.getLogger(Dhcp4Config.class);

  private final long validLifetime;
  private InterfacesConfig interfaces;
  private LeaseDatabase leaseDatabase;
  private final Subnet4 subnets = new Subnet4();
  private final OptionData options = new OptionData();

  /**
   * Creates a service definition using {@link LeaseDatabase#defaults()}.
   *
   * @param validLifetime lease lifetime in seconds; must not be negative
   * @param interfaces listening interfaces
   */
  public Dhcp4Config(long validLifetime, InterfacesConfig interfaces) {
    this(validLifetime, interfaces, LeaseDatabase.defaults());
  }

  /**
   * Creates a service definition.
   *
   * @param validLifetime lease lifetime in seconds; must not be negative
   * @param interfaces listening interfaces; an empty list is accepted but blocks rendering
   * @param leaseDatabase lease store descriptor
   * @throws IllegalArgumentException if {@code validLifetime} is negative
   */
  public Dhcp4Config(long validLifetime, InterfacesConfig interfaces, LeaseDatabase leaseDatabase) {
    if (validLifetime < 0) {
      throw new IllegalArgumentException("validLifetime must not be negative (was " + validLifetime + ")");
    }
    this.validLifetime = validLifetime;
    this.interfaces = Objects.requireNonNull(interfaces, "interfaces");
    this.leaseDatabase = Objects.requireNonNull(leaseDatabase, "leaseDatabase");
    if (interfaces.isEmpty()) {
      log.warn("Dhcp4 configuration created with empty interfaces-config");
    }
  }

  /**
   * Replaces the listening interfaces.
   *
   * <p>An empty replacement is accepted and logged at WARN, as in the constructor.</p>
   *
   * @param replacement new interface list
   */
  public void replaceInterfaces(InterfacesConfig replacement) {
    this.interfaces = Objects.requireNonNull(replacement, "interfaces");
    if (replacement.isEmpty()) {
      log.warn("Dhcp4 interfaces-config replaced with an empty list");
    }
  }

  public long validLifetime() {
    return validLifetime;
  }

  public InterfacesConfig interfaces() {
    return interfaces;
  }

  public LeaseDatabase leaseDatabase() {
    return leaseDatabase;
  }

  public Subnet4 subnets() {
    return subnets;
  }

  public OptionData options() {
    return options;
  }

  /**
   * Replaces the lease store descriptor.
   *
   * @param replacement new descriptor
   */
  public void replaceLeaseDatabase(LeaseDatabase replacement) {
    this.leaseDatabase = Objects.requireNonNull(replacement, "leaseDatabase");
  }

  /**
   * Renders the {@code Dhcp4} body.
   *
   * <p>Sections are emitted in order {@code valid-lifetime}, {@code interfaces-config},
   * {@code lease-database}, {@code subnet4}, {@code option-data}. Missing interfaces, an invalid lease
   * database or an empty subnet registry stop rendering and return the sections emitted so far with the
   * matching {@link RenderDiagnostic}. Empty options only omit {@code option-data}; the document is still
   * complete.</p>
   *
   * @return rendered body and optional diagnostic
   */
  public RenderResult render() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("valid-lifetime", validLifetime);

    if (interfaces.isEmpty()) {
      return stop(body, RenderDiagnostic.MISSING_INTERFACES);
    }
    body.put("interfaces-config", interfaces.render());

    if (!leaseDatabase.isValid()) {
      return stop(body, RenderDiagnostic.INVALID_LEASE_DATABASE);
    }
    body.put("lease-database", leaseDatabase.render());

    if (subnets.isEmpty()) {
      return stop(body, RenderDiagnostic.MISSING_SUBNETS);
    }
    body.put("subnet4", subnets.render());

    if (!options.isEmpty()) {
      body.put("option-data", options.render());
    }
    return RenderResult.complete(Collections.unmodifiableMap(body));
  }

  private static RenderResult stop(Map<String, Object> body, RenderDiagnostic diagnostic) {
    log.debug("Dhcp4 rendering stopped at {}: {}", diagnostic.section(), diagnostic.message());
    return RenderResult.partial(Collections.unmodifiableMap(body), diagnostic);
  }
}
