package com.flamingo.ai.chartreader.service.pdf;

import java.awt.image.BufferedImage;

/** Scores a low-resolution page bitmap for chart-like content; higher is more chart-like. */
public interface RasterPageScorer {

  double score(BufferedImage page);
}
