package ca.gc.cra.keagen.domain.dhcp4;

import java.util.Map;
import java.util.Objects;

/**
 * Address range leased out of a subnet, kept in Kea's literal {@code "low - high"} form.
 *
 * <p>Pools compare by their range text, so {@code "10.0.0.100 - ..."} sorts before
 * {@code "10.0.0.50 - ..."}.</p>
 *
 * @param range textual range
 * @since 0.1.0
 */
public record Pool(String range) implements Comparable<Pool> {
  static final String SEPARATOR = " - ";

  public Pool {
    Objects.requireNonNull(range, "range");
  }

  /**
   * Builds a pool from its bounds.
   *
   * @param low first address of the range
   * @param high last address of the range
   * @return pool whose range is {@code low + " - " + high}
   */
  public static Pool of(String low, String high) {
    Objects.requireNonNull(low, "low");
    Objects.requireNonNull(high, "high");
    return new Pool(low + SEPARATOR + high);
  }

  @Override
  public int compareTo(Pool other) {
    return range.compareTo(other.range);
  }

  Map<String, Object> render() {
    return Map.of("pool", range);
  }
}
