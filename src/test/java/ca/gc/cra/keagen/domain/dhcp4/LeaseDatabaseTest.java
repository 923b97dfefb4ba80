package ca.gc.cra.keagen.domain.dhcp4;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LeaseDatabaseTest {

  @Test
  void defaultsMatchKeaMemfile() {
    LeaseDatabase defaults = LeaseDatabase.defaults();

    assertEquals("memfile", defaults.type());
    assertTrue(defaults.persist());
    assertEquals("/var/lib/kea/dhcp4.leases", defaults.name());
    assertTrue(defaults.isValid());
  }

  @Test
  void validityIgnoresPersist() {
    assertTrue(new LeaseDatabase("memfile", false, "leases.csv").isValid());
    assertFalse(new LeaseDatabase("", true, "leases.csv").isValid());
    assertFalse(new LeaseDatabase("memfile", true, "").isValid());
    assertFalse(new LeaseDatabase(null, true, null).isValid());
  }

  @Test
  void renderKeepsFieldOrder() {
    Map<String, Object> rendered = new LeaseDatabase("memfile", true, "kea-leases4.csv").render();

    assertEquals(List.of("type", "persist", "name"), List.copyOf(rendered.keySet()));
    assertEquals("memfile", rendered.get("type"));
    assertEquals(Boolean.TRUE, rendered.get("persist"));
    assertEquals("kea-leases4.csv", rendered.get("name"));
  }
}
