package ca.gc.cra.qotd.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ClientConfigTest {

  @Test
  void defaultsToUdpOnPort17() {
    ClientConfig config = ClientConfig.fromMap(Map.of("host", "quotes.example.org"));

    assertEquals("quotes.example.org", config.host());
    assertEquals(17, config.port());
    assertFalse(config.tcp());
    assertEquals(ClientConfig.DEFAULT_TIMEOUT, config.timeout());
  }

  @Test
  void parsesTransportAndTimeout() {
    ClientConfig config = ClientConfig.fromMap(
        Map.of("host", "10.0.0.5", "port", "1717", "tcp", "true", "timeoutMillis", "250"));

    assertTrue(config.tcp());
    assertEquals(1717, config.serverAddress().getPort());
    assertEquals(Duration.ofMillis(250), config.timeout());
  }

  @Test
  void hostIsRequired() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> ClientConfig.fromMap(Map.of("port", "17")));
    assertEquals("host is required", ex.getMessage());
  }

  @Test
  void rejectsNonPositiveTimeout() {
    assertThrows(IllegalArgumentException.class,
        () -> ClientConfig.fromMap(Map.of("host", "localhost", "timeoutMillis", "0")));
  }
}
