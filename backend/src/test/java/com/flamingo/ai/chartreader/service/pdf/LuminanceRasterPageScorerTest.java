package com.flamingo.ai.chartreader.service.pdf;

import static org.assertj.core.api.Assertions.assertThat;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import org.junit.jupiter.api.Test;

class LuminanceRasterPageScorerTest {

  private final LuminanceRasterPageScorer scorer = new LuminanceRasterPageScorer();

  @Test
  void shouldScoreTextLikePage_aboveBlankAndPhoto() {
    BufferedImage text = page(Color.WHITE);
    Graphics2D g = text.createGraphics();
    g.setColor(Color.BLACK);
    for (int y = 4; y < text.getHeight(); y += 6) {
      g.fillRect(2, y, text.getWidth() - 4, 2);
    }
    g.dispose();

    double textScore = scorer.score(text);
    double blankScore = scorer.score(page(Color.WHITE));
    double photoScore = scorer.score(page(new Color(120, 120, 120)));

    assertThat(textScore).isGreaterThan(blankScore);
    assertThat(blankScore).isGreaterThan(photoScore);
  }

  private static BufferedImage page(Color background) {
    BufferedImage image = new BufferedImage(80, 120, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = image.createGraphics();
    g.setColor(background);
    g.fillRect(0, 0, image.getWidth(), image.getHeight());
    g.dispose();
    return image;
  }
}
