package dev.jane.mcp;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  @DisplayName("defaults to stdio with the bundled configuration")
  void defaults() {
    StartupParameters params = new StartupParameters(new String[0]);

    assertEquals("stdio", params.mode());
    assertEquals("classpath:application.yaml", params.configFile());
    assertTrue(params.servesStdio());
    assertFalse(params.servesHttp());
    assertFalse(params.isParameterPresent("root"));
  }

  @Test
  @DisplayName("both mode serves every transport")
  void bothMode() {
    StartupParameters params =
        new StartupParameters(new String[] {"--mode", "both", "--root", "/srv/kb"});

    assertTrue(params.servesStdio());
    assertTrue(params.servesHttp());
    assertEquals("/srv/kb", params.getParameter("root", String.class));
  }

  @Test
  @DisplayName("unknown modes and index settings are rejected")
  void invalidValues() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--mode", "grpc"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--index", "sometimes"}));
    assertThrows(
        IllegalArgumentException.class, () -> new StartupParameters(new String[] {"--index"}));
  }

  @Test
  @DisplayName("--root needs a value")
  void rootRequiresValue() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--root", "--mode", "http"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--root", "  "}));
  }

  @Test
  @DisplayName("usage mentions every option")
  void usage() {
    String usage = StartupParameters.usage();

    for (String option : new String[] {"--config-file", "--mode", "--index", "--root"}) {
      assertTrue(usage.contains(option), option);
    }
  }
}
