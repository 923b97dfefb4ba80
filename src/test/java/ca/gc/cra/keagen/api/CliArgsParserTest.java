package ca.gc.cra.keagen.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void splitsOnFirstEqualsAndKeepsOrder() {
    Map<String, String> parsed = CliArgsParser.toMap(new String[] {
        "subnets.lan.cidr=10.0.0.0/24", "options.vendor.data=a=b", "interfaces=eth0"});

    assertEquals(List.of("subnets.lan.cidr", "options.vendor.data", "interfaces"), List.copyOf(parsed.keySet()));
    assertEquals("a=b", parsed.get("options.vendor.data"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"interfaces"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"interfaces="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"k=a\u0001b"}));
  }

  @Test
  void nullInputYieldsEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void cliInputSeparatesFlags() {
    CliInput input = CliInput.parse(new String[] {"--Dry-Run", "lifetime=60", "-v", "--compact"});

    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.hasFlag("--compact"));
    assertTrue(input.verbose());
    assertEquals(List.of("lifetime=60"), List.of(input.keyValueArgs()));
  }
}
