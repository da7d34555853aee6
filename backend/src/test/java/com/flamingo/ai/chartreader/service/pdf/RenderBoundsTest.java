package com.flamingo.ai.chartreader.service.pdf;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class RenderBoundsTest {

  private static final float LETTER_WIDTH = 612f;
  private static final float LETTER_HEIGHT = 792f;

  @Test
  void shouldKeepRequestedDpi_whenWithinLimits() {
    RenderBounds bounds = new RenderBounds(300f, 4096, 12_000_000L);

    assertThat(bounds.effectiveDpi(LETTER_WIDTH, LETTER_HEIGHT)).isEqualTo(300f);
  }

  @Test
  void shouldLowerDpi_whenLongestSideTooLarge() {
    RenderBounds bounds = new RenderBounds(300f, 900, 12_000_000L);

    assertThat((double) bounds.effectiveDpi(LETTER_WIDTH, LETTER_HEIGHT))
        .isCloseTo(81.8, within(0.1));
  }

  @Test
  void shouldLowerDpi_whenPixelCountTooLarge() {
    RenderBounds bounds = new RenderBounds(300f, 100_000, 1_000_000L);

    float dpi = bounds.effectiveDpi(LETTER_WIDTH, LETTER_HEIGHT);
    double pixels = (LETTER_WIDTH * dpi / 72.0) * (LETTER_HEIGHT * dpi / 72.0);

    assertThat(pixels).isLessThanOrEqualTo(1_000_000.0 * 1.01);
  }
}
