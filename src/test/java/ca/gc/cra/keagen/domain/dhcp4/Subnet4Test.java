package ca.gc.cra.keagen.domain.dhcp4;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class Subnet4Test {

  @Test
  void idsStartAtOneAndIncrease() {
    Subnet4 subnets = new Subnet4();

    assertEquals(1, subnets.nextId());
    assertEquals(1, subnets.addSubnet("10.0.0.0/24"));
    assertEquals(2, subnets.addSubnet("10.0.1.0/24"));
    assertEquals(3, subnets.addSubnet("10.0.0.0/24"));
    assertEquals(4, subnets.nextId());
    assertEquals(3, subnets.size());
  }

  @Test
  void nullSubnetDoesNotConsumeId() {
    Subnet4 subnets = new Subnet4();

    assertThrows(NullPointerException.class, () -> subnets.addSubnet(null));
    assertEquals(1, subnets.addSubnet("10.0.0.0/24"));
  }

  @Test
  void addPoolToUnknownIdChangesNothing() {
    Subnet4 subnets = new Subnet4();
    long id = subnets.addSubnet("10.0.0.0/24");

    assertFalse(subnets.addPool(id + 1, "10.0.0.10", "10.0.0.20"));
    assertFalse(subnets.addPool(0, "10.0.0.10", "10.0.0.20"));

    assertEquals(1, subnets.size());
    assertEquals(2, subnets.nextId());
    assertTrue(subnets.find(id).orElseThrow().pools().isEmpty());
  }

  @Test
  void duplicatePoolsCollapse() {
    Subnet4 subnets = new Subnet4();
    long id = subnets.addSubnet("10.0.0.0/24");

    assertTrue(subnets.addPool(id, "10.0.0.10", "10.0.0.20"));
    assertTrue(subnets.addPool(id, "10.0.0.10", "10.0.0.20"));

    assertEquals(1, subnets.find(id).orElseThrow().pools().size());
  }

  @Test
  void poolsSortLexicographically() {
    Subnet4 subnets = new Subnet4();
    long id = subnets.addSubnet("10.0.0.0/24");
    subnets.addPool(id, "100", "200");
    subnets.addPool(id, "50", "60");

    List<String> ranges = subnets.find(id).orElseThrow().pools().stream()
        .map(Pool::range)
        .collect(Collectors.toList());

    assertEquals(List.of("100 - 200", "50 - 60"), ranges);
  }

  @Test
  void renderListsSubnetsById() {
    Subnet4 subnets = new Subnet4();
    long lan = subnets.addSubnet("192.168.50.0/24");
    long dmz = subnets.addSubnet("192.168.60.0/24");
    subnets.addPool(dmz, "192.168.60.5", "192.168.60.9");
    subnets.addPool(lan, "192.168.50.10", "192.168.50.20");

    List<Map<String, Object>> rendered = subnets.render();

    assertEquals(2, rendered.size());
    assertEquals(List.of("id", "subnet", "pools"), List.copyOf(rendered.get(0).keySet()));
    assertEquals(1L, rendered.get(0).get("id"));
    assertEquals("192.168.50.0/24", rendered.get(0).get("subnet"));
    assertEquals(List.of(Map.of("pool", "192.168.50.10 - 192.168.50.20")), rendered.get(0).get("pools"));
    assertEquals(2L, rendered.get(1).get("id"));
    assertEquals(List.of(Map.of("pool", "192.168.60.5 - 192.168.60.9")), rendered.get(1).get("pools"));
  }

  @Test
  void subnetWithoutPoolsRendersEmptyPoolList() {
    Subnet4 subnets = new Subnet4();
    subnets.addSubnet("10.0.0.0/8");

    assertEquals(List.of(), subnets.render().get(0).get("pools"));
  }
}
