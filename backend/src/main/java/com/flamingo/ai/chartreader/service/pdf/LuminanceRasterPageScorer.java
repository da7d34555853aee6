package com.flamingo.ai.chartreader.service.pdf;

import java.awt.image.BufferedImage;
import org.springframework.stereotype.Component;

/**
 * Favors pages that are mostly white with many crisp black glyphs and rules, as scanned chart
 * tables are, over photo pages full of mid-tone pixels.
 */
@Component
public class LuminanceRasterPageScorer implements RasterPageScorer {

  private static final int BLACK_BELOW = 60;
  private static final int MID_BELOW = 200;
  private static final int EDGE_DELTA = 22;

  @Override
  public double score(BufferedImage page) {
    int width = page.getWidth();
    int height = page.getHeight();
    double total = Math.max(1, (double) width * height);

    long black = 0;
    long mid = 0;
    long edges = 0;
    int[] row = new int[width];

    for (int y = 0; y < height; y++) {
      page.getRGB(0, y, width, 1, row, 0, width);
      double prevLum = 255;
      for (int x = 0; x < width; x++) {
        int rgb = row[x];
        int r = (rgb >> 16) & 0xff;
        int g = (rgb >> 8) & 0xff;
        int b = rgb & 0xff;
        double lum = (r * 3 + g * 6 + b) / 10.0;
        if (lum < BLACK_BELOW) {
          black++;
        } else if (lum < MID_BELOW) {
          mid++;
        }
        if (x > 0 && Math.abs(lum - prevLum) > EDGE_DELTA) {
          edges++;
        }
        prevLum = lum;
      }
    }

    double blackDensity = black / total;
    double midDensity = mid / total;
    double edgeDensity = edges / total;
    double bimodal = blackDensity / Math.max(1e-6, (black + mid) / total);

    return blackDensity * 2.0 + edgeDensity * 1.4 + bimodal * 1.2 - midDensity * 1.0;
  }
}
