package ca.gc.cra.keagen.config;

import ca.gc.cra.keagen.config.GeneratorConfig.OptionSpec;
import ca.gc.cra.keagen.config.GeneratorConfig.PoolSpec;
import ca.gc.cra.keagen.config.GeneratorConfig.SubnetSpec;
import ca.gc.cra.keagen.domain.dhcp4.LeaseDatabase;
import java.util.List;
import java.util.Optional;

/**
 * Built-in sample configuration printed by the {@code example} command.
 */
public final class ExampleConfigs {

  private ExampleConfigs() {}

  /**
   * Returns a small LAN setup: one interface, a memfile lease store, one /24 subnet with a single pool, a
   * router and two DNS servers sent to every client.
   *
   * @return sample configuration writing pretty JSON to stdout
   */
  public static GeneratorConfig demo() {
    return new GeneratorConfig(
        7200,
        List.of("enp0s1"),
        new LeaseDatabase("memfile", true, "kea-leases4.csv"),
        List.of(new SubnetSpec("lan", "192.168.50.0/24",
            List.of(new PoolSpec("192.168.50.10", "192.168.50.20")))),
        List.of(
            new OptionSpec("domain-name-servers", "192.168.50.1, 8.8.8.8", true),
            new OptionSpec("routers", "192.168.50.1", false)),
        Optional.empty(),
        true,
        false);
  }
}
