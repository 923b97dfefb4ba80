package ca.gc.cra.keagen.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void flattensCommonAndSectionInDocumentOrder() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("keagen.yaml"), """
        common:
          lifetime: 3600
          interfaces: [enp0s1, enp0s2]
        generate:
          lifetime: 7200
          lease:
            type: memfile
            persist: true
            name: kea-leases4.csv
          subnets:
            lan:
              cidr: 192.168.50.0/24
              pools:
                - 192.168.50.10-192.168.50.20
                - 192.168.50.30-192.168.50.40
          options:
            routers:
              data: 192.168.50.1
        other:
          lifetime: 1
        """);

    Map<String, String> flat = YamlConfigLoader.load(yaml, "generate").orElseThrow();

    assertEquals("7200", flat.get("lifetime"));
    assertEquals("enp0s1,enp0s2", flat.get("interfaces"));
    assertEquals("true", flat.get("lease.persist"));
    assertEquals("192.168.50.10-192.168.50.20,192.168.50.30-192.168.50.40", flat.get("subnets.lan.pools"));
    assertEquals("192.168.50.1", flat.get("options.routers.data"));
    assertEquals(List.of("lifetime", "interfaces", "lease.type", "lease.persist", "lease.name",
        "subnets.lan.cidr", "subnets.lan.pools", "options.routers.data"), List.copyOf(flat.keySet()));
  }

  @Test
  void missingFileYieldsEmpty() throws IOException {
    assertEquals(Optional.empty(), YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "generate"));
  }

  @Test
  void emptyFileYieldsEmptyMap() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("empty.yaml"), "");

    assertTrue(YamlConfigLoader.load(yaml, "generate").orElseThrow().isEmpty());
  }

  @Test
  void rejectsNestedListsAndBadSyntax() throws IOException {
    Path nested = Files.writeString(tempDir.resolve("nested.yaml"), """
        generate:
          interfaces:
            - name: eth0
        """);
    Path broken = Files.writeString(tempDir.resolve("broken.yaml"), "generate: [unclosed");
    Path scalarRoot = Files.writeString(tempDir.resolve("scalar.yaml"), "just text");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(nested, "generate"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "generate"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(scalarRoot, "generate"));
  }

  @Test
  void parsedSettingsFeedGeneratorConfig() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("lan.yaml"), """
        generate:
          interfaces: enp0s1
          subnets:
            lan:
              cidr: 10.0.0.0/24
              pools: 10.0.0.10-10.0.0.20
        """);

    GeneratorConfig config = GeneratorConfig.fromMap(YamlConfigLoader.load(yaml, "generate").orElseThrow());

    assertEquals(List.of("enp0s1"), config.interfaces());
    assertEquals("10.0.0.0/24", config.subnets().get(0).cidr());
    assertEquals(1, config.subnets().get(0).pools().size());
  }
}
