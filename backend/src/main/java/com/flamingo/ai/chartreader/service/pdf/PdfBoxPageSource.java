package com.flamingo.ai.chartreader.service.pdf;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;

/** {@link PdfPageSource} backed by an open PDFBox document. */
@Slf4j
public class PdfBoxPageSource implements PdfPageSource {

  private final PDDocument document;
  private final PDFRenderer renderer;

  PdfBoxPageSource(PDDocument document) {
    this.document = document;
    this.renderer = new PDFRenderer(document);
  }

  public static PdfBoxPageSource open(File pdf) throws IOException {
    return new PdfBoxPageSource(Loader.loadPDF(pdf));
  }

  @Override
  public int pageCount() {
    return document.getNumberOfPages();
  }

  @Override
  public String pageText(int pageNumber) throws IOException {
    checkPage(pageNumber);
    PDFTextStripper stripper = new PDFTextStripper();
    stripper.setStartPage(pageNumber);
    stripper.setEndPage(pageNumber);
    String text = stripper.getText(document);
    return text == null ? "" : text;
  }

  @Override
  public BufferedImage renderPage(int pageNumber, RenderBounds bounds) throws IOException {
    checkPage(pageNumber);
    PDPage page = document.getPage(pageNumber - 1);
    PDRectangle box = page.getCropBox();
    boolean rotated = page.getRotation() % 180 != 0;
    float widthPoints = rotated ? box.getHeight() : box.getWidth();
    float heightPoints = rotated ? box.getWidth() : box.getHeight();
    float dpi = bounds.effectiveDpi(widthPoints, heightPoints);
    log.debug("Rendering page {} at {} dpi (requested {})", pageNumber, dpi, bounds.dpi());
    return renderer.renderImageWithDPI(pageNumber - 1, dpi, ImageType.RGB);
  }

  @Override
  public void close() throws IOException {
    document.close();
  }

  private void checkPage(int pageNumber) {
    if (pageNumber < 1 || pageNumber > pageCount()) {
      throw new IllegalArgumentException(
          "Page " + pageNumber + " is outside 1.." + pageCount());
    }
  }
}
