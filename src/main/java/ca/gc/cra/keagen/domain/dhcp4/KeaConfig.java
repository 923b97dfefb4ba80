package ca.gc.cra.keagen.domain.dhcp4;

import ca.gc.cra.keagen.domain.render.RenderResult;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Top-level Kea configuration document; currently holds only the {@code Dhcp4} service.
 *
 * @since 0.1.0
 */
public final class KeaConfig {
  /** Top-level key Kea reads the DHCPv4 service from. */
  public static final String DHCP4_KEY = "Dhcp4";

  private final Dhcp4Config dhcp4;

  public KeaConfig(Dhcp4Config dhcp4) {
    this.dhcp4 = Objects.requireNonNull(dhcp4, "dhcp4");
  }

  public Dhcp4Config dhcp4() {
    return dhcp4;
  }

  /**
   * Renders {@code {"Dhcp4": ...}}, carrying over any diagnostic from {@link Dhcp4Config#render()}.
   *
   * @return wrapped document
   */
  public RenderResult render() {
    RenderResult inner = dhcp4.render();
    Map<String, Object> root = new LinkedHashMap<>();
    root.put(DHCP4_KEY, inner.document());
    return inner.withDocument(Collections.unmodifiableMap(root));
  }
}
