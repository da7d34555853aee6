package com.flamingo.ai.chartreader.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class LangChain4jConfigTest {

  @Test
  void shouldUseUnboundedTimeout_whenNoTimeoutConfigured() {
    assertThat(LangChain4jConfig.requestTimeout(0)).isEqualTo(LangChain4jConfig.UNBOUNDED_TIMEOUT);
    assertThat(LangChain4jConfig.requestTimeout(-5))
        .isEqualTo(LangChain4jConfig.UNBOUNDED_TIMEOUT);
  }

  @Test
  void shouldHonorPositiveTimeout_whenConfigured() {
    assertThat(LangChain4jConfig.requestTimeout(90)).isEqualTo(Duration.ofSeconds(90));
  }
}
