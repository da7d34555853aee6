package com.flamingo.ai.chartreader.service.pdf;

import com.flamingo.ai.chartreader.config.ChartReaderConfig;
import com.flamingo.ai.chartreader.exception.JobValidationException;
import com.flamingo.ai.chartreader.service.worker.CancellationToken;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Ranks the pages of a PDF by how likely each holds the target chart table.
 *
 * <p>Pages whose text layer looks chart-like come first, preferred (boosted) pages ahead of the
 * rest. Remaining slots are filled by rendering every other page at low resolution and scoring the
 * bitmap, which covers scanned issues without a usable text layer.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PageSelector {

  private static final Comparator<ScoredPage> TEXT_ORDER =
      Comparator.comparing((ScoredPage p) -> !p.score().isPreferred())
          .thenComparing(p -> p.score().effectiveScore(), Comparator.reverseOrder())
          .thenComparing(p -> p.score().textLength(), Comparator.reverseOrder())
          .thenComparingInt(ScoredPage::pageNumber);

  private static final Comparator<RasterPage> RASTER_ORDER =
      Comparator.comparingDouble(RasterPage::score)
          .reversed()
          .thenComparingInt(RasterPage::pageNumber);

  private final PageScorer pageScorer;
  private final RasterPageScorer rasterPageScorer;
  private final ChartReaderConfig config;

  /** Candidate scan with the configured scan and candidate limits. */
  public PageCandidates scan(PdfPageSource source, CancellationToken token) {
    ChartReaderConfig.PageSelection settings = config.getPageSelection();
    List<Integer> pages =
        selectCandidates(
            source, settings.getMaxPagesToScan(), settings.getCandidateLimit(), token);
    return new PageCandidates(source.pageCount(), pages);
  }

  /**
   * Returns up to {@code candidateLimit} distinct page numbers, best first.
   *
   * @throws JobValidationException when the document has no pages
   */
  public List<Integer> selectCandidates(
      PdfPageSource source, int maxPagesToScan, int candidateLimit, CancellationToken token) {
    int pageCount = source.pageCount();
    if (pageCount < 1) {
      throw new JobValidationException("PDF has no pages");
    }
    int limit = Math.max(1, candidateLimit);
    int scanPages = Math.min(pageCount, Math.max(1, maxPagesToScan));

    List<ScoredPage> textCandidates = new ArrayList<>();
    for (int page = 1; page <= scanPages; page++) {
      token.throwIfCancelled();
      PageScore score = pageScorer.score(readText(source, page));
      log.debug(
          "Page {} text score: base={}, boost={}, ranks={}",
          page,
          score.baseScore(),
          score.preferenceBoost(),
          score.rankCount());
      if (pageScorer.looksLikeChartPage(score)) {
        textCandidates.add(new ScoredPage(page, score));
      }
    }
    textCandidates.sort(TEXT_ORDER);

    Set<Integer> chosen = new LinkedHashSet<>();
    int primaryLimit = Math.min(limit, config.getPageSelection().getPrimaryCandidateLimit());
    for (ScoredPage candidate : textCandidates) {
      if (chosen.size() >= primaryLimit) {
        break;
      }
      chosen.add(candidate.pageNumber());
    }

    if (chosen.size() < limit) {
      List<RasterPage> rasterScores = new ArrayList<>();
      RenderBounds bounds = rasterBounds();
      for (int page = 1; page <= scanPages; page++) {
        if (chosen.contains(page)) {
          continue;
        }
        token.throwIfCancelled();
        BufferedImage image = render(source, page, bounds);
        rasterScores.add(new RasterPage(page, rasterPageScorer.score(image)));
      }
      rasterScores.sort(RASTER_ORDER);
      for (RasterPage candidate : rasterScores) {
        if (chosen.size() >= limit) {
          break;
        }
        chosen.add(candidate.pageNumber());
      }
    }

    List<Integer> result = new ArrayList<>(chosen);
    log.info(
        "Selected {} candidate page(s) of {} ({} from text layer): {}",
        result.size(),
        pageCount,
        Math.min(textCandidates.size(), primaryLimit),
        result);
    return result;
  }

  /** Head of {@link #selectCandidates}. */
  public int selectBestPage(PdfPageSource source, int maxPagesToScan, CancellationToken token) {
    return selectCandidates(
            source, maxPagesToScan, config.getPageSelection().getCandidateLimit(), token)
        .get(0);
  }

  private RenderBounds rasterBounds() {
    ChartReaderConfig.PageSelection settings = config.getPageSelection();
    return new RenderBounds(
        settings.getRasterDpi(), settings.getRasterMaxDimension(), settings.getRasterMaxPixels());
  }

  private String readText(PdfPageSource source, int page) {
    try {
      return source.pageText(page);
    } catch (IOException e) {
      log.warn("No text layer for page {}: {}", page, e.getMessage());
      return "";
    }
  }

  private BufferedImage render(PdfPageSource source, int page, RenderBounds bounds) {
    try {
      return source.renderPage(page, bounds);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to render page " + page, e);
    }
  }

  private record ScoredPage(int pageNumber, PageScore score) {}

  private record RasterPage(int pageNumber, double score) {}
}
