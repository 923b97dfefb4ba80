package ca.gc.cra.keagen.domain.dhcp4;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Describes where and how Kea persists DHCPv4 leases.
 * <p><strong>Role:</strong> Domain value object rendered as the {@code lease-database} section.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; replace the whole descriptor to change it.</p>
 *
 * @param type storage backend identifier such as {@code memfile} or {@code mysql}
 * @param persist whether leases survive server restarts; does not affect validity
 * @param name file path or connection string of the backend
 * @since 0.1.0
 */
public record LeaseDatabase(String type, boolean persist, String name) {
  /** Backend used when the caller does not choose one. */
  public static final String DEFAULT_TYPE = "memfile";
  /** Lease file used by the default backend. */
  public static final String DEFAULT_NAME = "/var/lib/kea/dhcp4.leases";

  private static final LeaseDatabase DEFAULTS = new LeaseDatabase(DEFAULT_TYPE, true, DEFAULT_NAME);

  /**
   * Normalizes {@code null} strings to empty so validity stays a pure emptiness check.
   */
  public LeaseDatabase {
    type = Objects.requireNonNullElse(type, "");
    name = Objects.requireNonNullElse(name, "");
  }

  /**
   * Returns the memfile descriptor Kea ships with.
   *
   * @return {@code memfile}, persisted, at {@value #DEFAULT_NAME}
   */
  public static LeaseDatabase defaults() {
    return DEFAULTS;
  }

  /**
   * Reports whether Kea could open this lease store.
   *
   * @return {@code true} when both {@code type} and {@code name} are non-empty
   */
  public boolean isValid() {
    return !type.isEmpty() && !name.isEmpty();
  }

  /**
   * Renders the {@code lease-database} fragment.
   *
   * @return map with {@code type}, {@code persist} and {@code name} in that order
   */
  public Map<String, Object> render() {
    Map<String, Object> fragment = new LinkedHashMap<>();
    fragment.put("type", type);
    fragment.put("persist", persist);
    fragment.put("name", name);
    return Collections.unmodifiableMap(fragment);
  }
}
