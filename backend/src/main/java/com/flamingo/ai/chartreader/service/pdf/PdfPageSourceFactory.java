package com.flamingo.ai.chartreader.service.pdf;

import java.io.IOException;
import java.nio.file.Path;

/** Opens PDFs for page scanning and rendering. */
public interface PdfPageSourceFactory {

  PdfPageSource open(Path pdf) throws IOException;
}
