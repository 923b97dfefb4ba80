package ca.gc.cra.keagen.domain.dhcp4;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Ordered list of network interfaces the Kea DHCPv4 server listens on.
 * <p><strong>Why:</strong> Kea refuses to serve without at least one interface, so emptiness is the
 * first gate of {@link Dhcp4Config#render()}.</p>
 * <p><strong>Role:</strong> Domain value object owned by {@link Dhcp4Config}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class InterfacesConfig {
  private static final InterfacesConfig EMPTY = new InterfacesConfig(List.of());

  private final List<String> interfaces;

  /**
   * Creates an interface list preserving caller order and duplicates.
   *
   * @param interfaces interface names such as {@code eth0}; must not be {@code null} nor contain {@code null}
   */
  public InterfacesConfig(List<String> interfaces) {
    this.interfaces = List.copyOf(Objects.requireNonNull(interfaces, "interfaces"));
  }

  /**
   * Convenience factory for literal interface names.
   *
   * @param interfaces interface names in listening order
   * @return immutable interface list
   */
  public static InterfacesConfig of(String... interfaces) {
    return new InterfacesConfig(List.of(interfaces));
  }

  /**
   * Returns the placeholder list with no interfaces.
   *
   * @return empty interface list
   */
  public static InterfacesConfig empty() {
    return EMPTY;
  }

  /**
   * Reports whether no interface is configured.
   *
   * @return {@code true} when the list is empty
   */
  public boolean isEmpty() {
    return interfaces.isEmpty();
  }

  /**
   * Returns the interface names in configured order.
   *
   * @return immutable list of names
   */
  public List<String> interfaces() {
    return interfaces;
  }

  /**
   * Renders the {@code interfaces-config} fragment.
   *
   * @return {@code {"interfaces": [...]}}
   */
  public Map<String, Object> render() {
    Map<String, Object> fragment = new LinkedHashMap<>();
    fragment.put("interfaces", interfaces);
    return Collections.unmodifiableMap(fragment);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof InterfacesConfig that && interfaces.equals(that.interfaces);
  }

  @Override
  public int hashCode() {
    return interfaces.hashCode();
  }

  @Override
  public String toString() {
    return "InterfacesConfig" + interfaces;
  }
}
