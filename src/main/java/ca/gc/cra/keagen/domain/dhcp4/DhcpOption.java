package ca.gc.cra.keagen.domain.dhcp4;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Single DHCP option advertised to clients, e.g. {@code domain-name-servers}.
 *
 * @param name option name; unique within an {@link OptionData}
 * @param data option value in Kea's textual form
 * @param alwaysSend whether Kea includes the option even when the client did not request it
 * @since 0.1.0
 */
public record DhcpOption(String name, String data, boolean alwaysSend) {

  public DhcpOption {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(data, "data");
  }

  Map<String, Object> render() {
    Map<String, Object> fragment = new LinkedHashMap<>();
    fragment.put("name", name);
    fragment.put("data", data);
    fragment.put("always-send", alwaysSend);
    return Collections.unmodifiableMap(fragment);
  }
}
