package ca.gc.cra.keagen.config;

import ca.gc.cra.keagen.domain.dhcp4.LeaseDatabase;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Supplies the flattened default settings for the {@code generate} command.
 *
 * <p>The defaults are the single source of truth for optional YAML keys and CLI arguments. No interface, subnet
 * or option is defaulted: a run without them renders an incomplete document.</p>
 */
public final class GeneratorDefaults {
  /** Lease lifetime in seconds used when none is configured. */
  public static final long DEFAULT_LIFETIME = 4000L;

  private static final Map<String, String> DEFAULTS = buildDefaults();

  private GeneratorDefaults() {}

  /**
   * Returns the defaults as {@code key -> value} strings in documentation order.
   *
   * @return unmodifiable ordered map
   */
  public static Map<String, String> asFlatMap() {
    return DEFAULTS;
  }

  private static Map<String, String> buildDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("lifetime", Long.toString(DEFAULT_LIFETIME));
    map.put("interfaces", "");
    map.put("lease.type", LeaseDatabase.DEFAULT_TYPE);
    map.put("lease.persist", "true");
    map.put("lease.name", LeaseDatabase.DEFAULT_NAME);
    map.put("out", "");
    map.put("pretty", "true");
    map.put("allowOverwrite", "false");
    return Collections.unmodifiableMap(map);
  }
}
