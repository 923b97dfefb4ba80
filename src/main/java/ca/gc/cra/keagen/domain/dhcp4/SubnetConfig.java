package ca.gc.cra.keagen.domain.dhcp4;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeSet;

/**
 * <strong>What:</strong> One IPv4 subnet entry of {@code subnet4}: registry id, CIDR block and pools.
 * <p><strong>Role:</strong> Created only by {@link Subnet4#addSubnet(String)}; pools are attached through
 * {@link Subnet4#addPool(long, String, String)}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; the pool set is mutated in place.</p>
 *
 * @since 0.1.0
 */
public final class SubnetConfig {
  private final long id;
  private final String subnet;
  private final NavigableSet<Pool> pools = new TreeSet<>();

  SubnetConfig(long id, String subnet) {
    this.id = id;
    this.subnet = Objects.requireNonNull(subnet, "subnet");
  }

  public long id() {
    return id;
  }

  /**
   * Returns the CIDR block, e.g. {@code 192.168.1.0/24}.
   *
   * @return subnet in prefix notation
   */
  public String subnet() {
    return subnet;
  }

  /**
   * Returns the pools in ascending range-text order.
   *
   * @return unmodifiable view of the pool set
   */
  public NavigableSet<Pool> pools() {
    return Collections.unmodifiableNavigableSet(pools);
  }

  boolean addPool(Pool pool) {
    return pools.add(pool);
  }

  Map<String, Object> render() {
    List<Map<String, Object>> renderedPools = new ArrayList<>(pools.size());
    for (Pool pool : pools) {
      renderedPools.add(pool.render());
    }
    Map<String, Object> fragment = new LinkedHashMap<>();
    fragment.put("id", id);
    fragment.put("subnet", subnet);
    fragment.put("pools", Collections.unmodifiableList(renderedPools));
    return Collections.unmodifiableMap(fragment);
  }

  @Override
  public String toString() {
    return "SubnetConfig{id=" + id + ", subnet=" + subnet + ", pools=" + pools.size() + '}';
  }
}
