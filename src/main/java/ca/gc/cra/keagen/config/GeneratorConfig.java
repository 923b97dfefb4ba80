package ca.gc.cra.keagen.config;

import ca.gc.cra.keagen.domain.dhcp4.LeaseDatabase;
import ca.gc.cra.keagen.validation.Numbers;
import ca.gc.cra.keagen.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Settings for one run of the {@code generate} command.
 * <p><strong>Why:</strong> Collects defaults, YAML and CLI values into a validated description of the DHCPv4
 * service before any domain object is built.</p>
 * <p><strong>Role:</strong> Adapter configuration aggregate consumed by
 * {@link ca.gc.cra.keagen.application.pipeline.GenerateUseCase}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * <p>Flattened keys understood by {@link #fromMap(Map)}:</p>
 * <ul>
 *   <li>{@code lifetime}, {@code interfaces} (comma separated)</li>
 *   <li>{@code lease.type}, {@code lease.persist}, {@code lease.name}</li>
 *   <li>{@code subnets.<label>.cidr}, {@code subnets.<label>.pools} ({@code low-high}, comma separated)</li>
 *   <li>{@code options.<name>.data}, {@code options.<name>.alwaysSend}</li>
 *   <li>{@code out}, {@code pretty}, {@code allowOverwrite}</li>
 * </ul>
 *
 * @param validLifetime lease lifetime in seconds
 * @param interfaces listening interfaces in order; may be empty, which blocks rendering
 * @param leaseDatabase lease store descriptor
 * @param subnets subnets in declaration order
 * @param options options in declaration order
 * @param output destination file; empty writes to stdout
 * @param pretty whether to indent the JSON output
 * @param allowOverwrite whether an existing output file may be replaced
 * @since 0.1.0
 * @see GeneratorDefaults
 */
public record GeneratorConfig(
    long validLifetime,
    List<String> interfaces,
    LeaseDatabase leaseDatabase,
    List<SubnetSpec> subnets,
    List<OptionSpec> options,
    Optional<Path> output,
    boolean pretty,
    boolean allowOverwrite) {

  private static final String SUBNETS_PREFIX = "subnets.";
  private static final String OPTIONS_PREFIX = "options.";

  public GeneratorConfig {
    Numbers.requireRange("lifetime", validLifetime, 0, Numbers.MAX_UINT32);
    interfaces = List.copyOf(Objects.requireNonNull(interfaces, "interfaces"));
    Objects.requireNonNull(leaseDatabase, "leaseDatabase");
    subnets = List.copyOf(Objects.requireNonNull(subnets, "subnets"));
    options = List.copyOf(Objects.requireNonNull(options, "options"));
    output = Objects.requireNonNullElse(output, Optional.empty());
  }

  /**
   * Subnet declared in configuration.
   *
   * @param label configuration key grouping the subnet's settings
   * @param cidr CIDR block
   * @param pools pools in declaration order
   */
  public record SubnetSpec(String label, String cidr, List<PoolSpec> pools) {
    public SubnetSpec {
      Objects.requireNonNull(label, "label");
      Objects.requireNonNull(cidr, "cidr");
      pools = List.copyOf(Objects.requireNonNull(pools, "pools"));
    }
  }

  /**
   * Pool bounds declared for a subnet.
   *
   * @param low first address
   * @param high last address
   */
  public record PoolSpec(String low, String high) {
    public PoolSpec {
      Objects.requireNonNull(low, "low");
      Objects.requireNonNull(high, "high");
    }

    /**
     * Parses {@code low-high}.
     *
     * @param raw range text; whitespace around the hyphen is ignored
     * @return parsed bounds
     * @throws IllegalArgumentException if either bound is missing
     */
    public static PoolSpec parse(String raw) {
      String trimmed = Strings.requireNonBlank("pool", raw);
      int dash = trimmed.indexOf('-');
      if (dash <= 0 || dash == trimmed.length() - 1) {
        throw new IllegalArgumentException("pool must be low-high (was '" + trimmed + "')");
      }
      return new PoolSpec(
          Strings.requireNonBlank("pool low", trimmed.substring(0, dash)),
          Strings.requireNonBlank("pool high", trimmed.substring(dash + 1)));
    }
  }

  /**
   * Option declared in configuration.
   *
   * @param name option name
   * @param data option value
   * @param alwaysSend whether Kea always sends it
   */
  public record OptionSpec(String name, String data, boolean alwaysSend) {
    public OptionSpec {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(data, "data");
    }
  }

  /**
   * Returns the configuration produced by {@link GeneratorDefaults#asFlatMap()}.
   *
   * @return defaults with no interfaces, subnets or options
   */
  public static GeneratorConfig defaults() {
    return fromMap(GeneratorDefaults.asFlatMap());
  }

  /**
   * Builds a configuration from flattened {@code key=value} settings.
   *
   * <p>Missing scalar keys fall back to {@link GeneratorDefaults}. Subnets and options keep the order in which
   * their labels first appear in {@code settings}. Unrecognized top-level keys are ignored so YAML files may
   * carry settings for other tools.</p>
   *
   * @param settings flattened settings; iteration order is significant
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or a subnet/option is incomplete
   */
  public static GeneratorConfig fromMap(Map<String, String> settings) {
    Objects.requireNonNull(settings, "settings");
    Map<String, String> defaults = GeneratorDefaults.asFlatMap();

    long lifetime = Numbers.parseLong(
        "lifetime", valueOrDefault(settings, defaults, "lifetime"), 0, Numbers.MAX_UINT32);
    List<String> interfaces = Strings.splitList("interfaces", settings.getOrDefault("interfaces", ""));

    LeaseDatabase lease = new LeaseDatabase(
        trimmed(valueOrDefault(settings, defaults, "lease.type")),
        Numbers.parseBoolean("lease.persist", valueOrDefault(settings, defaults, "lease.persist")),
        trimmed(valueOrDefault(settings, defaults, "lease.name")));

    Map<String, Map<String, String>> subnetFields = group(settings, SUBNETS_PREFIX);
    List<SubnetSpec> subnets = new ArrayList<>(subnetFields.size());
    for (Map.Entry<String, Map<String, String>> entry : subnetFields.entrySet()) {
      subnets.add(parseSubnet(entry.getKey(), entry.getValue()));
    }

    Map<String, Map<String, String>> optionFields = group(settings, OPTIONS_PREFIX);
    List<OptionSpec> options = new ArrayList<>(optionFields.size());
    for (Map.Entry<String, Map<String, String>> entry : optionFields.entrySet()) {
      options.add(parseOption(entry.getKey(), entry.getValue()));
    }

    Optional<Path> output = optionalString(settings.get("out")).map(GeneratorConfig::parsePath);
    boolean pretty = Numbers.parseBoolean("pretty", valueOrDefault(settings, defaults, "pretty"));
    boolean allowOverwrite =
        Numbers.parseBoolean("allowOverwrite", valueOrDefault(settings, defaults, "allowOverwrite"));

    return new GeneratorConfig(lifetime, interfaces, lease, subnets, options, output, pretty, allowOverwrite);
  }

  private static SubnetSpec parseSubnet(String label, Map<String, String> fields) {
    String prefix = SUBNETS_PREFIX + label;
    for (String field : fields.keySet()) {
      if (!field.equals("cidr") && !field.equals("pools")) {
        throw new IllegalArgumentException("unknown subnet setting: " + prefix + '.' + field);
      }
    }
    String cidr = fields.get("cidr");
    if (cidr == null || cidr.isBlank()) {
      throw new IllegalArgumentException(prefix + ".cidr is required");
    }
    List<PoolSpec> pools = new ArrayList<>();
    for (String range : Strings.splitList(prefix + ".pools", fields.get("pools"))) {
      pools.add(PoolSpec.parse(range));
    }
    return new SubnetSpec(label, Strings.requireNonBlank(prefix + ".cidr", cidr), pools);
  }

  private static OptionSpec parseOption(String name, Map<String, String> fields) {
    String prefix = OPTIONS_PREFIX + name;
    for (String field : fields.keySet()) {
      if (!field.equals("data") && !field.equals("alwaysSend")) {
        throw new IllegalArgumentException("unknown option setting: " + prefix + '.' + field);
      }
    }
    String data = fields.get("data");
    if (data == null) {
      throw new IllegalArgumentException(prefix + ".data is required");
    }
    String alwaysSend = fields.get("alwaysSend");
    boolean always = alwaysSend != null && !alwaysSend.isBlank()
        && Numbers.parseBoolean(prefix + ".alwaysSend", alwaysSend);
    return new OptionSpec(name, data.trim(), always);
  }

  /**
   * Groups {@code <prefix><label>.<field>} keys by label, preserving first-appearance order.
   */
  private static Map<String, Map<String, String>> group(Map<String, String> settings, String prefix) {
    Map<String, Map<String, String>> grouped = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : settings.entrySet()) {
      String key = entry.getKey();
      if (key == null || !key.startsWith(prefix)) {
        continue;
      }
      String remainder = key.substring(prefix.length());
      int dot = remainder.lastIndexOf('.');
      if (dot <= 0 || dot == remainder.length() - 1) {
        throw new IllegalArgumentException("setting must be " + prefix + "<label>.<field> (was " + key + ")");
      }
      String label = Strings.requireLabel(key, remainder.substring(0, dot));
      String field = remainder.substring(dot + 1);
      grouped.computeIfAbsent(label, ignored -> new LinkedHashMap<>())
          .put(field, entry.getValue() == null ? "" : entry.getValue());
    }
    return grouped;
  }

  private static String valueOrDefault(Map<String, String> settings, Map<String, String> defaults, String key) {
    String value = settings.get(key);
    if (value == null || value.isBlank()) {
      return defaults.get(key);
    }
    return value;
  }

  private static String trimmed(String value) {
    return value == null ? "" : value.trim();
  }

  private static Optional<String> optionalString(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  private static Path parsePath(String raw) {
    try {
      return Path.of(raw);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("out is not a valid path: " + raw, ex);
    }
  }
}
