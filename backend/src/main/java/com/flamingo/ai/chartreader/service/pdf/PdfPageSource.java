package com.flamingo.ai.chartreader.service.pdf;

import java.awt.image.BufferedImage;
import java.io.IOException;

/** Page-level access to an open PDF. Page numbers are 1-based. */
public interface PdfPageSource extends AutoCloseable {

  int pageCount();

  /** Text layer of the page; empty for scanned pages without one. */
  String pageText(int pageNumber) throws IOException;

  BufferedImage renderPage(int pageNumber, RenderBounds bounds) throws IOException;

  @Override
  void close() throws IOException;
}
