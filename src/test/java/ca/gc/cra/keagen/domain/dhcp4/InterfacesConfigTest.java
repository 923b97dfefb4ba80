package ca.gc.cra.keagen.domain.dhcp4;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InterfacesConfigTest {

  @Test
  void keepsOrderAndDuplicates() {
    InterfacesConfig config = InterfacesConfig.of("eth1", "eth0", "eth1");

    assertEquals(List.of("eth1", "eth0", "eth1"), config.interfaces());
    assertEquals(Map.of("interfaces", List.of("eth1", "eth0", "eth1")), config.render());
  }

  @Test
  void copiesInputList() {
    List<String> names = new ArrayList<>(List.of("enp0s1"));
    InterfacesConfig config = new InterfacesConfig(names);
    names.add("enp0s2");

    assertEquals(List.of("enp0s1"), config.interfaces());
    assertThrows(UnsupportedOperationException.class, () -> config.interfaces().add("eth9"));
  }

  @Test
  void emptyFactoryRendersEmptyList() {
    InterfacesConfig empty = InterfacesConfig.empty();

    assertTrue(empty.isEmpty());
    assertFalse(InterfacesConfig.of("eth0").isEmpty());
    assertEquals(Map.of("interfaces", List.of()), empty.render());
  }

  @Test
  void equalityFollowsContents() {
    assertEquals(InterfacesConfig.of("a", "b"), new InterfacesConfig(List.of("a", "b")));
    assertEquals(InterfacesConfig.of("a", "b").hashCode(), new InterfacesConfig(List.of("a", "b")).hashCode());
  }
}
