package ca.gc.cra.keagen.domain.dhcp4;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.keagen.domain.render.RenderDiagnostic;
import ca.gc.cra.keagen.domain.render.RenderResult;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class KeaConfigTest {

  @Test
  void wrapsBodyUnderDhcp4() {
    Dhcp4Config dhcp4 = new Dhcp4Config(7200, InterfacesConfig.of("eth0"));
    dhcp4.subnets().addSubnet("10.0.0.0/24");
    KeaConfig root = new KeaConfig(dhcp4);

    RenderResult result = root.render();

    assertTrue(result.isComplete());
    assertEquals(1, result.document().size());
    assertEquals(dhcp4.render().document(), result.document().get(KeaConfig.DHCP4_KEY));
    assertSame(dhcp4, root.dhcp4());
  }

  @Test
  void keepsInnerDiagnostic() {
    KeaConfig root = new KeaConfig(new Dhcp4Config(90, InterfacesConfig.empty()));

    RenderResult result = root.render();

    assertEquals(Optional.of(RenderDiagnostic.MISSING_INTERFACES), result.diagnostic());
    assertEquals(Map.of("Dhcp4", Map.of("valid-lifetime", 90L)), result.document());
  }
}
