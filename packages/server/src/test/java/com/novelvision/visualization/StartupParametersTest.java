package com.novelvision.visualization;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void parsesNameValuePairs() {
    StartupParameters params =
        new StartupParameters(new String[] {"--config=/etc/nv/app.yaml", "--port=8080"});

    assertEquals("/etc/nv/app.yaml", params.configFile());
    assertEquals(8080, params.getParameter("port", Integer.class));
  }

  @Test
  void bareFlagIsTrue() {
    StartupParameters params = new StartupParameters(new String[] {"--verbose"});

    assertTrue(params.getParameter("verbose", Boolean.class));
  }

  @Test
  void valuesKeepCommasAndEquals() {
    StartupParameters params = new StartupParameters(new String[] {"--tags=a,b=c"});

    assertEquals("a,b=c", params.getParameter("tags", String.class));
  }

  @Test
  void missingParametersUseDefaults() {
    StartupParameters params = new StartupParameters(null);

    assertNull(params.configFile());
    assertEquals("fallback", params.getParameter("mode", String.class, "fallback"));
  }

  @Test
  void rejectsPositionalArguments() {
    assertThrows(
        IllegalArgumentException.class, () -> new StartupParameters(new String[] {"app.yaml"}));
  }
}
