package com.flamingo.ai.chartreader.service.pdf;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.chartreader.config.ChartReaderConfig;
import com.flamingo.ai.chartreader.exception.JobCancelledException;
import com.flamingo.ai.chartreader.exception.JobValidationException;
import com.flamingo.ai.chartreader.service.worker.CancellationToken;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PageSelector Tests")
class PageSelectorTest {

  private static final String PROSE =
      "Letters to the editor. Readers wrote in about the state of radio and the record business.";

  private PageSelector selector;

  @BeforeEach
  void setUp() {
    selector =
        new PageSelector(
            new PageScorer(), new LuminanceRasterPageScorer(), new ChartReaderConfig());
  }

  @Test
  @DisplayName("Should pick the only page with chart text")
  void shouldSelectChartPage_whenTextLayerPresent() {
    FakePdf pdf =
        new FakePdf(
            List.of(PROSE, PageScorerTest.chartPage("DISCO TOP 80", 80), PROSE), Map.of());

    int best = selector.selectBestPage(pdf, 300, CancellationToken.none());

    assertThat(best).isEqualTo(2);
  }

  @Test
  @DisplayName("Should rank a boosted chart page ahead of another chart page")
  void shouldPreferBoostedPage() {
    FakePdf pdf =
        new FakePdf(
            List.of(
                PageScorerTest.chartPage("HOT COUNTRY SINGLES", 100),
                PageScorerTest.chartPage("HOT DANCE/DISCO", 80)),
            Map.of());

    List<Integer> candidates = selector.selectCandidates(pdf, 300, 2, CancellationToken.none());

    assertThat(candidates).containsExactly(2, 1);
  }

  @Test
  @DisplayName("Should fall back to raster scoring for scanned pages")
  void shouldUseRaster_whenNoTextLayer() {
    FakePdf pdf =
        new FakePdf(List.of("", "", ""), Map.of(1, photo(), 2, blank(), 3, tableScan()));

    List<Integer> candidates = selector.selectCandidates(pdf, 300, 3, CancellationToken.none());

    assertThat(candidates).containsExactly(3, 2, 1);
    assertThat(pdf.renderedPages).isEqualTo(3);
  }

  @Test
  void shouldLimitScan_whenMaxPagesLower() {
    FakePdf pdf = new FakePdf(List.of("", "", "", ""), Map.of());

    List<Integer> candidates = selector.selectCandidates(pdf, 2, 12, CancellationToken.none());

    assertThat(candidates).containsExactlyInAnyOrder(1, 2);
  }

  @Test
  void shouldReportPageCount_whenScanning() {
    FakePdf pdf = new FakePdf(List.of(PROSE, PROSE), Map.of());

    PageCandidates candidates = selector.scan(pdf, CancellationToken.none());

    assertThat(candidates.pageCount()).isEqualTo(2);
    assertThat(candidates.pages()).hasSize(2);
  }

  @Test
  void shouldReject_whenPdfHasNoPages() {
    FakePdf pdf = new FakePdf(List.of(), Map.of());

    assertThatThrownBy(() -> selector.selectBestPage(pdf, 300, CancellationToken.none()))
        .isInstanceOf(JobValidationException.class)
        .hasMessage("PDF has no pages");
  }

  @Test
  void shouldStop_whenTokenCancelled() {
    CancellationToken token = new CancellationToken();
    token.cancel("Cancelled by user");
    FakePdf pdf = new FakePdf(List.of(PROSE), Map.of());

    assertThatThrownBy(() -> selector.selectBestPage(pdf, 300, token))
        .isInstanceOf(JobCancelledException.class);
  }

  private static BufferedImage blank() {
    return fill(Color.WHITE);
  }

  private static BufferedImage photo() {
    return fill(Color.GRAY);
  }

  private static BufferedImage tableScan() {
    BufferedImage image = fill(Color.WHITE);
    for (int x = 0; x < image.getWidth(); x += 2) {
      for (int y = 0; y < image.getHeight(); y++) {
        image.setRGB(x, y, Color.BLACK.getRGB());
      }
    }
    return image;
  }

  private static BufferedImage fill(Color color) {
    BufferedImage image = new BufferedImage(40, 60, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = image.createGraphics();
    g.setColor(color);
    g.fillRect(0, 0, image.getWidth(), image.getHeight());
    g.dispose();
    return image;
  }

  /** In-memory page source: text per page, images keyed by page number. */
  static final class FakePdf implements PdfPageSource {

    private final List<String> texts;
    private final Map<Integer, BufferedImage> images;
    int renderedPages;

    FakePdf(List<String> texts, Map<Integer, BufferedImage> images) {
      this.texts = texts;
      this.images = images;
    }

    @Override
    public int pageCount() {
      return texts.size();
    }

    @Override
    public String pageText(int pageNumber) {
      return texts.get(pageNumber - 1);
    }

    @Override
    public BufferedImage renderPage(int pageNumber, RenderBounds bounds) {
      renderedPages++;
      return images.getOrDefault(pageNumber, blank());
    }

    @Override
    public void close() throws IOException {}
  }
}
