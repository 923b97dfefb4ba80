package ca.gc.cra.keagen.domain.dhcp4;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Registry of IPv4 subnets keyed by a registry-assigned id.
 * <p><strong>Why:</strong> Kea identifies subnets by a stable numeric id; lease files and host reservations
 * refer to it, so ids are never reused.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Allocate ids from a counter starting at 1.</li>
 *   <li>Attach pools to existing subnets, reporting unknown ids as {@code false}.</li>
 *   <li>Render {@code subnet4} in ascending id order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; callers sharing a registry must lock externally.</p>
 *
 * @since 0.1.0
 */
public final class Subnet4 {
  private static final long FIRST_ID = 1L;

  private final NavigableMap<Long, SubnetConfig> subnets = new TreeMap<>();
  private long nextId = FIRST_ID;

  /**
   * Registers a new subnet with no pools.
   *
   * @param subnet CIDR block such as {@code 10.0.0.0/8}; must not be {@code null}
   * @return id allocated to the subnet
   */
  public long addSubnet(String subnet) {
    Objects.requireNonNull(subnet, "subnet");
    long id = nextId++;
    subnets.put(id, new SubnetConfig(id, subnet));
    return id;
  }

  /**
   * Adds the range {@code "low - high"} to the subnet with the given id.
   *
   * <p>Re-adding an existing range leaves a single entry.</p>
   *
   * @param id subnet id returned by {@link #addSubnet(String)}
   * @param low first address of the pool
   * @param high last address of the pool
   * @return {@code false} when no subnet has {@code id}; nothing is modified in that case
   */
  public boolean addPool(long id, String low, String high) {
    SubnetConfig target = subnets.get(id);
    if (target == null) {
      return false;
    }
    target.addPool(Pool.of(low, high));
    return true;
  }

  public boolean isEmpty() {
    return subnets.isEmpty();
  }

  public int size() {
    return subnets.size();
  }

  public Optional<SubnetConfig> find(long id) {
    return Optional.ofNullable(subnets.get(id));
  }

  /**
   * Returns the id the next {@link #addSubnet(String)} call will allocate.
   *
   * @return next id
   */
  public long nextId() {
    return nextId;
  }

  public Collection<SubnetConfig> subnets() {
    return Collections.unmodifiableCollection(subnets.values());
  }

  /**
   * Renders the {@code subnet4} array.
   *
   * @return list of {@code {id, subnet, pools}} maps ordered by id
   */
  public List<Map<String, Object>> render() {
    List<Map<String, Object>> rendered = new ArrayList<>(subnets.size());
    for (SubnetConfig subnet : subnets.values()) {
      rendered.add(subnet.render());
    }
    return Collections.unmodifiableList(rendered);
  }
}
