package com.flamingo.ai.chartreader.service.pdf;

import java.io.IOException;
import java.nio.file.Path;
import org.springframework.stereotype.Component;

@Component
public class PdfBoxPageSourceFactory implements PdfPageSourceFactory {

  @Override
  public PdfPageSource open(Path pdf) throws IOException {
    return PdfBoxPageSource.open(pdf.toFile());
  }
}
