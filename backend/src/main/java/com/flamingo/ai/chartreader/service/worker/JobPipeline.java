package com.flamingo.ai.chartreader.service.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.chartreader.config.ChartReaderConfig;
import com.flamingo.ai.chartreader.domain.entity.ChartRow;
import com.flamingo.ai.chartreader.domain.entity.Job;
import com.flamingo.ai.chartreader.domain.entity.Run;
import com.flamingo.ai.chartreader.domain.enums.FileLocation;
import com.flamingo.ai.chartreader.domain.enums.RunStatus;
import com.flamingo.ai.chartreader.domain.repository.JobRepository;
import com.flamingo.ai.chartreader.exception.ChartExtractionException;
import com.flamingo.ai.chartreader.exception.JobCancelledException;
import com.flamingo.ai.chartreader.exception.JobValidationException;
import com.flamingo.ai.chartreader.service.completeness.CompletenessChecker;
import com.flamingo.ai.chartreader.service.completeness.MergeResult;
import com.flamingo.ai.chartreader.service.completeness.MissingChartGroup;
import com.flamingo.ai.chartreader.service.completeness.RankRanges;
import com.flamingo.ai.chartreader.service.completeness.RowMerger;
import com.flamingo.ai.chartreader.service.export.CsvExportQueue;
import com.flamingo.ai.chartreader.service.extraction.ChartExtractionClient;
import com.flamingo.ai.chartreader.service.extraction.ChartRelevanceFilter;
import com.flamingo.ai.chartreader.service.extraction.ExtractedRow;
import com.flamingo.ai.chartreader.service.extraction.ExtractionMode;
import com.flamingo.ai.chartreader.service.extraction.ExtractionResult;
import com.flamingo.ai.chartreader.service.extraction.ModelImage;
import com.flamingo.ai.chartreader.service.extraction.Ranks;
import com.flamingo.ai.chartreader.service.pdf.ModelImageRenderer;
import com.flamingo.ai.chartreader.service.pdf.PageCandidates;
import com.flamingo.ai.chartreader.service.pdf.PageSelector;
import com.flamingo.ai.chartreader.service.pdf.PdfPageSource;
import com.flamingo.ai.chartreader.service.pdf.PdfPageSourceFactory;
import com.flamingo.ai.chartreader.service.storage.FileNames;
import com.flamingo.ai.chartreader.service.storage.FileStorageService;
import com.flamingo.ai.chartreader.service.storage.StoredFile;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one claimed job: validate the file, pick the page, extract, repair gaps, persist, move the
 * file and schedule the CSV export.
 *
 * <p>The cancellation token is checked before every remote call and every write. Any failure is
 * recorded on both the job and a run; nothing escapes {@link #process}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobPipeline {

  /** How a pipeline pass ended. */
  public enum Outcome {
    COMPLETED,
    COMPLETED_WITH_GAPS,
    AWAITING_REVIEW,
    FAILED,
    CANCELLED
  }

  private final JobRepository jobRepository;
  private final JobStateService jobState;
  private final RunPersistenceService runPersistence;
  private final WorkerSettingsService settingsService;
  private final FileStorageService storage;
  private final PdfPageSourceFactory pdfSources;
  private final PageSelector pageSelector;
  private final ModelImageRenderer imageRenderer;
  private final ChartExtractionClient extractionClient;
  private final ChartRelevanceFilter relevanceFilter;
  private final CompletenessChecker completenessChecker;
  private final RowMerger rowMerger;
  private final CsvExportQueue csvExportQueue;
  private final ChartReaderConfig config;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  /** Per-pass state the failure handlers need. */
  private final class Attempt {
    final AttemptLog log = new AttemptLog(objectMapper);
    String model;
    UUID persistedRunId;
  }

  /**
   * Processes a job already flipped to processing.
   *
   * @param token fired by a stop request
   */
  @Timed(value = "job.pipeline", description = "Time to process one claimed job")
  public Outcome process(UUID jobId, CancellationToken token) {
    Optional<Job> claimed = jobRepository.findById(jobId);
    if (claimed.isEmpty()) {
      log.warn("Claimed job {} no longer exists", jobId);
      return Outcome.FAILED;
    }

    Attempt attempt = new Attempt();
    attempt.model = config.getWorker().getDefaultModel();
    try {
      return run(claimed.get(), token, attempt);
    } catch (Exception e) {
      if (token.isCancelled() || e instanceof JobCancelledException) {
        String reason =
            token.isCancelled()
                ? token.getReason()
                : ((JobCancelledException) e).getReason();
        return recordCancellation(jobId, attempt, reason);
      }
      return recordFailure(jobId, attempt, e);
    } catch (Error e) {
      recordFailure(jobId, attempt, e);
      throw e;
    } finally {
      try {
        jobState.promotePendingFile(jobId);
      } catch (Exception e) {
        log.error("Failed to promote replacement file for job {}: {}", jobId, e.getMessage(), e);
      }
    }
  }

  private Outcome run(Job job, CancellationToken token, Attempt attempt) throws IOException {
    UUID jobId = job.getId();
    String filename = job.getFilename();
    String primaryModel = settingsService.current().getModel();
    attempt.model = primaryModel;
    log.info("Processing job {} ({}) with model {}", jobId, filename, primaryModel);

    // 1. Validate
    token.throwIfCancelled();
    jobState.progress(jobId, "validating_file");
    Optional<StoredFile> located = storage.locate(filename);
    if (located.isEmpty()) {
      jobState.fileLocated(jobId, FileLocation.MISSING);
      throw new JobValidationException("File not found in new/completed: " + filename);
    }
    StoredFile stored = located.get();
    jobState.fileLocated(jobId, stored.location());

    LocalDate entryDate = job.getEntryDate();
    if (entryDate == null) {
      entryDate =
          FileNames.parseEntryDate(filename)
              .orElseThrow(() -> new JobValidationException(FileNames.MISSING_DATE_MESSAGE));
      jobState.entryDateResolved(jobId, entryDate);
    }
    if (!FileNames.isSupported(filename)) {
      throw new JobValidationException(
          "Unsupported file type: ." + FileNames.extension(filename));
    }

    // 2-3. Page choice and model input
    ModelImage image;
    if (FileNames.isPdf(filename)) {
      try (PdfPageSource source = pdfSources.open(stored.path())) {
        if (!job.isPageConfirmed() || job.getSelectedPage() == null) {
          return suspendForReview(jobId, source, token);
        }
        int page = job.getSelectedPage();
        int pageCount = source.pageCount();
        if (page < 1 || page > pageCount) {
          throw new JobValidationException(
              "Selected page " + page + " is outside 1.." + pageCount);
        }
        token.throwIfCancelled();
        jobState.progress(jobId, "rendering_page");
        image = imageRenderer.renderPdfPage(source, page, token);
        attempt.log.page(page, pageCount);
      }
    } else {
      jobState.progress(jobId, "preparing_image");
      image = imageRenderer.fromImageFile(stored.path());
    }

    // 4. Full extraction
    token.throwIfCancelled();
    jobState.progress(jobId, "extracting");
    ExtractionResult full;
    try {
      full = extractionClient.extract(image, primaryModel, ExtractionMode.FULL, List.of(), token);
    } catch (ChartExtractionException e) {
      attempt.log.failed(ExtractionMode.FULL, primaryModel, e.getUserMessage());
      throw e;
    }
    ObjectNode fullAttempt =
        attempt.log.succeeded(
            ExtractionMode.FULL,
            primaryModel,
            full.rows().size(),
            0,
            List.of(),
            full.rawResponseJson());
    if (full.rows().isEmpty()) {
      throw new ChartExtractionException("No rows extracted");
    }
    ChartRelevanceFilter.Result relevant = relevanceFilter.filter(full.rows());
    attempt.log.filter(relevant.mode().name(), full.rows().size(), relevant.rows().size());
    attempt.log.amend(fullAttempt, relevant.rows().size(), List.of());
    if (relevant.rows().isEmpty()) {
      throw new ChartExtractionException(
          "No " + relevanceFilter.describe() + " chart rows found");
    }

    // 5. Completeness
    token.throwIfCancelled();
    jobState.progress(jobId, "checking_completeness");
    List<ExtractedRow> rows = relevant.rows();
    List<MissingChartGroup> missing = completenessChecker.findMissingGroups(rows, filename);
    attempt.log.amend(fullAttempt, rows.size(), missing);

    String runModel = primaryModel;
    int primaryPasses = Math.max(0, config.getCompleteness().getMaxPrimaryRepairPasses());
    for (int pass = 0; pass < primaryPasses && !missing.isEmpty(); pass++) {
      RepairPass repaired =
          repair(jobId, image, primaryModel, rows, missing, filename, token, attempt);
      rows = repaired.rows();
      missing = repaired.missing();
      if (repaired.rowsAdded() == 0) {
        break;
      }
    }
    String fallbackModel = config.getExtraction().getFallbackModel();
    if (!missing.isEmpty()
        && fallbackModel != null
        && !fallbackModel.isBlank()
        && !fallbackModel.equals(primaryModel)) {
      RepairPass repaired =
          repair(jobId, image, fallbackModel, rows, missing, filename, token, attempt);
      rows = repaired.rows();
      missing = repaired.missing();
      if (repaired.rowsAdded() > 0) {
        runModel = fallbackModel;
      }
    }
    attempt.model = runModel;

    // 6. Gaps left after every pass degrade the run
    String gapSummary = missing.isEmpty() ? null : summarizeGaps(missing);
    if (gapSummary != null) {
      log.warn("Job {} finished with gaps: {}", jobId, gapSummary);
    }

    // 7. Persist
    token.throwIfCancelled();
    jobState.progress(jobId, "writing_db");
    UUID runId = UUID.randomUUID();
    LocalDateTime extractedAt = LocalDateTime.now();
    attempt.log.outcome(
        gapSummary == null ? "completed" : "error", runModel, rows.size(), missing);
    Run run =
        Run.builder()
            .runId(runId)
            .jobId(jobId)
            .model(runModel)
            .extractedAt(extractedAt)
            .rowsInserted(rows.size())
            .rawResultJson(attempt.log.toJson())
            .status(gapSummary == null ? RunStatus.COMPLETED : RunStatus.ERROR)
            .error(gapSummary)
            .build();
    runPersistence.saveRunWithRows(
        run, toChartRows(rows, runId, jobId, entryDate, filename, extractedAt));
    attempt.persistedRunId = runId;

    token.throwIfCancelled();
    jobState.progress(jobId, "moving_file");
    String finalName = filename;
    if (stored.location() == FileLocation.NEW) {
      finalName =
          storage.moveToCompleted(
              filename, name -> jobRepository.existsByFilenameAndIdNot(name, jobId));
      jobState.fileMoved(jobId, finalName, FileLocation.COMPLETED);
      if (!finalName.equals(filename)) {
        runPersistence.updateSourceFile(runId, finalName);
      }
    }

    token.throwIfCancelled();
    jobState.progress(jobId, "exporting_csv");
    boolean applied =
        gapSummary == null
            ? jobState.complete(jobId, runId, rows.size(), finalName, FileLocation.COMPLETED)
            : jobState.completeWithGaps(
                jobId, runId, rows.size(), finalName, FileLocation.COMPLETED, gapSummary);
    if (!applied) {
      throw new JobCancelledException(token.getReason());
    }
    csvExportQueue.enqueue();

    if (gapSummary == null) {
      meterRegistry.counter("job.completed").increment();
      log.info("Job {} completed: {} rows with model {}", jobId, rows.size(), runModel);
      return Outcome.COMPLETED;
    }
    meterRegistry.counter("job.failed").increment();
    return Outcome.COMPLETED_WITH_GAPS;
  }

  private Outcome suspendForReview(UUID jobId, PdfPageSource source, CancellationToken token) {
    token.throwIfCancelled();
    jobState.progress(jobId, "scanning_pages");
    PageCandidates candidates = pageSelector.scan(source, token);
    token.throwIfCancelled();
    if (!jobState.suspendForReview(jobId, candidates)) {
      throw new JobCancelledException(token.getReason());
    }
    meterRegistry.counter("job.awaiting_review").increment();
    return Outcome.AWAITING_REVIEW;
  }

  private record RepairPass(
      List<ExtractedRow> rows, List<MissingChartGroup> missing, int rowsAdded) {}

  /** One missing-rows pass; a failed call is logged and leaves the rows unchanged. */
  private RepairPass repair(
      UUID jobId,
      ModelImage image,
      String model,
      List<ExtractedRow> rows,
      List<MissingChartGroup> missing,
      String filename,
      CancellationToken token,
      Attempt attempt) {
    token.throwIfCancelled();
    jobState.progress(jobId, "repairing_gaps");
    ExtractionResult result;
    try {
      result = extractionClient.extract(image, model, ExtractionMode.MISSING_ROWS, missing, token);
    } catch (ChartExtractionException e) {
      log.warn("Missing-rows pass with {} failed for job {}: {}", model, jobId, e.getMessage());
      attempt.log.failed(ExtractionMode.MISSING_ROWS, model, e.getUserMessage());
      return new RepairPass(rows, missing, 0);
    }
    MergeResult merge = rowMerger.merge(rows, result.rows(), missing);
    List<MissingChartGroup> remaining =
        completenessChecker.findMissingGroups(merge.merged(), filename);
    attempt.log.succeeded(
        ExtractionMode.MISSING_ROWS,
        model,
        result.rows().size(),
        merge.rowsAdded(),
        remaining,
        result.rawResponseJson());
    log.debug(
        "Missing-rows pass with {} added {} rows to job {}, {} group(s) still short",
        model,
        merge.rowsAdded(),
        jobId,
        remaining.size());
    return new RepairPass(merge.merged(), remaining, merge.rowsAdded());
  }

  private Outcome recordCancellation(UUID jobId, Attempt attempt, String reason) {
    log.info("Job {} cancelled: {}", jobId, reason);
    try {
      if (attempt.persistedRunId != null) {
        runPersistence.updateStatus(attempt.persistedRunId, RunStatus.CANCELLED, reason);
      } else {
        attempt.log.outcome("cancelled", attempt.model, 0, List.of());
        runPersistence.saveRun(emptyRun(jobId, attempt, RunStatus.CANCELLED, reason));
      }
      jobState.cancelProcessing(jobId, reason);
    } catch (Exception e) {
      log.error("Failed to record cancellation of job {}: {}", jobId, e.getMessage(), e);
    }
    meterRegistry.counter("job.cancelled").increment();
    return Outcome.CANCELLED;
  }

  private Outcome recordFailure(UUID jobId, Attempt attempt, Throwable failure) {
    String message = userMessage(failure);
    log.error("Job {} failed: {}", jobId, message, failure);
    try {
      if (attempt.persistedRunId != null) {
        runPersistence.updateStatus(attempt.persistedRunId, RunStatus.ERROR, message);
      } else {
        attempt.log.outcome("error", attempt.model, 0, List.of());
        runPersistence.saveRun(emptyRun(jobId, attempt, RunStatus.ERROR, message));
      }
      jobState.fail(jobId, message);
    } catch (Exception e) {
      log.error("Failed to record failure of job {}: {}", jobId, e.getMessage(), e);
    }
    meterRegistry.counter("job.failed").increment();
    return Outcome.FAILED;
  }

  private Run emptyRun(UUID jobId, Attempt attempt, RunStatus status, String error) {
    return Run.builder()
        .runId(UUID.randomUUID())
        .jobId(jobId)
        .model(attempt.model)
        .extractedAt(LocalDateTime.now())
        .rowsInserted(0)
        .rawResultJson(attempt.log.toJson())
        .status(status)
        .error(error)
        .build();
  }

  private String summarizeGaps(List<MissingChartGroup> missing) {
    int maxRanges = config.getCompleteness().getMaxPromptRanges();
    List<String> parts = new ArrayList<>();
    for (MissingChartGroup group : missing) {
      String chart =
          group.chartSection() == null || group.chartSection().isEmpty()
              ? group.chartTitle()
              : group.chartSection() + " / " + group.chartTitle();
      parts.add(chart + ": " + RankRanges.format(group.missingThisWeekRanks(), maxRanges));
    }
    return "Missing ranks after retries: " + String.join("; ", parts);
  }

  private static List<ChartRow> toChartRows(
      List<ExtractedRow> rows,
      UUID runId,
      UUID jobId,
      LocalDate entryDate,
      String sourceFile,
      LocalDateTime extractedAt) {
    List<ChartRow> chartRows = new ArrayList<>(rows.size());
    for (ExtractedRow row : rows) {
      chartRows.add(
          ChartRow.builder()
              .runId(runId)
              .jobId(jobId)
              .entryDate(entryDate)
              .chartTitle(row.chartTitle())
              .chartSection(row.chartSection())
              .thisWeekRank(Ranks.coerceRank(row.thisWeekRank()))
              .lastWeekRank(Ranks.coerceRank(row.lastWeekRank()))
              .twoWeeksAgoRank(Ranks.coerceRank(row.twoWeeksAgoRank()))
              .weeksOnChart(Ranks.coerceRank(row.weeksOnChart()))
              .title(row.title())
              .artist(row.artist())
              .label(row.label())
              .sourceFile(sourceFile)
              .extractedAt(extractedAt)
              .build());
    }
    return chartRows;
  }

  private static String userMessage(Throwable e) {
    if (e instanceof JobValidationException validation) {
      return validation.getUserMessage();
    }
    if (e instanceof ChartExtractionException extraction) {
      return extraction.getUserMessage();
    }
    return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
  }
}
