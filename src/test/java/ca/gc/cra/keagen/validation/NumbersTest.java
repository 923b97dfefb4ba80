package ca.gc.cra.keagen.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void parseLongAcceptsBounds() {
    assertEquals(0, Numbers.parseLong("lifetime", "0", 0, Numbers.MAX_UINT32));
    assertEquals(4_294_967_295L, Numbers.parseLong("lifetime", " 4294967295 ", 0, Numbers.MAX_UINT32));
  }

  @Test
  void parseLongRejectsOutOfRangeAndGarbage() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseLong("lifetime", "-5", 0, 10));
    assertTrue(ex.getMessage().contains("lifetime"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseLong("lifetime", "1e3", 0, 10));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseLong("lifetime", " ", 0, 10));
  }

  @Test
  void parseBooleanIsStrict() {
    assertTrue(Numbers.parseBoolean("pretty", "TRUE"));
    assertFalse(Numbers.parseBoolean("pretty", " false "));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseBoolean("pretty", "1"));
  }
}
