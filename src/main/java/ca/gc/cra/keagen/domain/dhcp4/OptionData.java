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
 * <strong>What:</strong> Name-keyed set of DHCP options rendered as {@code option-data}.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep at most one option per name; the first insertion for a name is permanent.</li>
 *   <li>Iterate and render in ascending name order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by a single {@link Dhcp4Config}.</p>
 *
 * @since 0.1.0
 */
public final class OptionData {
  private final NavigableMap<String, DhcpOption> options = new TreeMap<>();

  /**
   * Adds an option that is only sent on client request.
   *
   * @param name option name
   * @param data option value
   * @return {@code true} if inserted, {@code false} if the name was already present
   */
  public boolean add(String name, String data) {
    return add(name, data, false);
  }

  /**
   * Adds an option that Kea sends in every response.
   *
   * @param name option name
   * @param data option value
   * @return {@code true} if inserted, {@code false} if the name was already present
   */
  public boolean addAlways(String name, String data) {
    return add(name, data, true);
  }

  /**
   * Adds an option unless one with the same name already exists.
   *
   * <p>A repeated name is ignored silently: the existing value and flag are kept and no error
   * is raised.</p>
   *
   * @param name option name; must not be {@code null}
   * @param data option value; must not be {@code null}
   * @param alwaysSend whether Kea sends the option unconditionally
   * @return {@code true} if inserted, {@code false} if the name was already present
   */
  public boolean add(String name, String data, boolean alwaysSend) {
    DhcpOption option = new DhcpOption(name, data, alwaysSend);
    return options.putIfAbsent(option.name(), option) == null;
  }

  public boolean isEmpty() {
    return options.isEmpty();
  }

  public int size() {
    return options.size();
  }

  public Optional<DhcpOption> find(String name) {
    return Optional.ofNullable(options.get(Objects.requireNonNull(name, "name")));
  }

  /**
   * Returns the options in ascending name order.
   *
   * @return unmodifiable view of the options
   */
  public Collection<DhcpOption> options() {
    return Collections.unmodifiableCollection(options.values());
  }

  /**
   * Renders the {@code option-data} array.
   *
   * @return list of {@code {name, data, always-send}} maps sorted by name
   */
  public List<Map<String, Object>> render() {
    List<Map<String, Object>> rendered = new ArrayList<>(options.size());
    for (DhcpOption option : options.values()) {
      rendered.add(option.render());
    }
    return Collections.unmodifiableList(rendered);
  }
}
