package com.flamingo.ai.chartreader.service.pdf;

import com.flamingo.ai.chartreader.config.ChartReaderConfig;
import com.flamingo.ai.chartreader.service.extraction.ModelImage;
import com.flamingo.ai.chartreader.service.storage.FileNames;
import com.flamingo.ai.chartreader.service.worker.CancellationToken;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Produces the image the extraction model sees for a job. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModelImageRenderer {

  private static final String JPEG = "image/jpeg";

  private final ChartReaderConfig config;

  /** Sends an image file as is. */
  public ModelImage fromImageFile(Path image) throws IOException {
    return new ModelImage(
        Files.readAllBytes(image), FileNames.mimeType(image.getFileName().toString()));
  }

  /** Renders one PDF page at model resolution and encodes it as JPEG. */
  public ModelImage renderPdfPage(PdfPageSource source, int pageNumber, CancellationToken token)
      throws IOException {
    token.throwIfCancelled();
    ChartReaderConfig.PageSelection settings = config.getPageSelection();
    RenderBounds bounds =
        new RenderBounds(
            settings.getModelDpi(), settings.getModelMaxDimension(), settings.getModelMaxPixels());
    BufferedImage page = source.renderPage(pageNumber, bounds);
    token.throwIfCancelled();
    byte[] jpeg = encodeJpeg(page, settings.getModelJpegQuality());
    log.debug(
        "Rendered page {} for the model: {}x{}, {} bytes",
        pageNumber,
        page.getWidth(),
        page.getHeight(),
        jpeg.length);
    return new ModelImage(jpeg, JPEG);
  }

  static byte[] encodeJpeg(BufferedImage image, float quality) throws IOException {
    Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
    if (!writers.hasNext()) {
      throw new IOException("No JPEG writer available");
    }
    ImageWriter writer = writers.next();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
      writer.setOutput(ios);
      ImageWriteParam param = writer.getDefaultWriteParam();
      param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
      param.setCompressionQuality(quality);
      writer.write(null, new IIOImage(image, null, null), param);
    } finally {
      writer.dispose();
    }
    return out.toByteArray();
  }
}
