package ca.gc.cra.logdrop.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void requireHostHandlesHostname() {
    assertEquals("es-1.example.com", Net.requireHost("host", " es-1.example.com "));
  }

  @Test
  void requireHostHandlesIpv4() {
    assertEquals("10.0.0.1", Net.requireHost("host", "10.0.0.1"));
  }

  @Test
  void requireHostStripsIpv6Brackets() {
    assertEquals("2001:db8::1", Net.requireHost("host", "[2001:db8::1]"));
    assertEquals("::", Net.requireHost("host", "::"));
  }

  @Test
  void requireHostRejectsMalformedHosts() {
    assertThrows(IllegalArgumentException.class, () -> Net.requireHost("host", "10.0.0.256"));
    assertThrows(IllegalArgumentException.class, () -> Net.requireHost("host", "[::1"));
    assertThrows(IllegalArgumentException.class, () -> Net.requireHost("host", "bad_host"));
    assertThrows(IllegalArgumentException.class, () -> Net.requireHost("host", "-lead.example"));
    assertThrows(IllegalArgumentException.class, () -> Net.requireHost("host", "trailing."));
    assertThrows(IllegalArgumentException.class, () -> Net.requireHost("host", "fe80::zz"));
  }

  @Test
  void requirePortHonoursEphemeralFlag() {
    assertEquals(0, Net.requirePort("port", 0, true));
    assertThrows(IllegalArgumentException.class, () -> Net.requirePort("port", 0, false));
    assertThrows(IllegalArgumentException.class, () -> Net.requirePort("port", 65536, true));
  }
}
