package ca.gc.cra.keagen.infrastructure.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.keagen.testutil.JsonReader;
import java.io.StringWriter;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class KeaJsonWriterTest {

  @Test
  void compactOutputPreservesKeyOrder() {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("valid-lifetime", 7200L);
    document.put("interfaces-config", Map.of("interfaces", List.of("eth0")));
    document.put("persist", true);

    String json = new KeaJsonWriter(false).toJson(document);

    assertEquals("{\"valid-lifetime\":7200,\"interfaces-config\":{\"interfaces\":[\"eth0\"]},\"persist\":true}", json);
  }

  @Test
  void prettyOutputIndentsByTwoSpaces() {
    Map<String, Object> inner = new LinkedHashMap<>();
    inner.put("interfaces", List.of("enp0s1"));
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("Dhcp4", Map.of("interfaces-config", inner));

    String json = new KeaJsonWriter(true).toJson(document);

    assertTrue(json.contains("\n  \"Dhcp4\": {"), json);
    assertTrue(json.contains("\n    \"interfaces-config\": {"), json);
    assertTrue(json.contains("\n        \"enp0s1\""), json);
    assertFalse(json.contains("\t"));
    assertFalse(json.contains(" :"), json);
    assertFalse(json.contains("\r"), json);
    assertEquals(document.toString(), JsonReader.parseObject(json).toString());
  }

  @Test
  void escapesStringsAndWritesNumbers() {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("data", "say \"hi\"");
    document.put("count", 3);
    document.put("big", BigInteger.valueOf(4_294_967_295L));
    document.put("missing", null);

    Map<String, Object> parsed = JsonReader.parseObject(new KeaJsonWriter(false).toJson(document));

    assertEquals("say \"hi\"", parsed.get("data"));
    assertEquals(3L, parsed.get("count"));
    assertEquals(4_294_967_295L, parsed.get("big"));
    assertTrue(parsed.containsKey("missing"));
  }

  @Test
  void rejectsUnsupportedValues() {
    Map<String, Object> document = Map.of("when", new Object());

    assertThrows(IllegalArgumentException.class, () -> new KeaJsonWriter(false).toJson(document));
  }

  @Test
  void writeLeavesWriterOpen() throws Exception {
    StringWriter out = new StringWriter();
    KeaJsonWriter writer = new KeaJsonWriter(false);

    writer.write(Map.<String, Object>of("a", 1L), out);
    out.write("\n");

    assertEquals("{\"a\":1}\n", out.toString());
  }
}
