package com.scholary.tracklist.monitoring;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class KibanaUrlGeneratorTest {

  @Test
  void generateJobUrl_shouldFilterDiscoverOnJobId() {
    KibanaUrlGenerator generator =
        new KibanaUrlGenerator("https://kibana.example.com", "tracklist-logs-*");

    String url = generator.generateJobUrl("abc-123");

    assertThat(url)
        .startsWith("https://kibana.example.com/app/discover#/?_a=(index:'tracklist-logs-*'")
        .contains("query:(language:kuery,query:'jobId%3A%22abc-123%22')");
  }
}
