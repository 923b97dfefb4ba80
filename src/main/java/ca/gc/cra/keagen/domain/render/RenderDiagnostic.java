package ca.gc.cra.keagen.domain.render;

/**
 * <strong>What:</strong> Reasons a DHCPv4 document stopped rendering before it was complete.
 * <p><strong>Why:</strong> Kea rejects a configuration without interfaces, a usable lease store or at least one
 * subnet; the renderer reports the first missing section instead of emitting an unusable document.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum RenderDiagnostic {
  /** No listening interface configured. */
  MISSING_INTERFACES("interfaces-config", "interfaces-config is empty"),
  /** Lease database type or name is empty. */
  INVALID_LEASE_DATABASE("lease-database", "lease-database requires a type and a name"),
  /** No subnet registered. */
  MISSING_SUBNETS("subnet4", "subnet4 is empty");

  private final String section;
  private final String message;

  RenderDiagnostic(String section, String message) {
    this.section = section;
    this.message = message;
  }

  /**
   * Returns the document key whose check failed.
   *
   * @return section name such as {@code subnet4}
   */
  public String section() {
    return section;
  }

  /**
   * Returns an operator-facing description.
   *
   * @return human readable message
   */
  public String message() {
    return message;
  }
}
