package com.flamingo.ai.chartreader.service.export;

import com.flamingo.ai.chartreader.config.ChartReaderConfig;
import com.flamingo.ai.chartreader.domain.entity.ChartRow;
import com.flamingo.ai.chartreader.domain.entity.Job;
import com.flamingo.ai.chartreader.domain.entity.Run;
import com.flamingo.ai.chartreader.domain.repository.ChartRowRepository;
import com.flamingo.ai.chartreader.domain.repository.JobRepository;
import com.flamingo.ai.chartreader.domain.repository.RunRepository;
import com.opencsv.CSVWriter;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Rewrites the CSV with the rows of each document's active run.
 *
 * <p>When several jobs share a canonical filename, the one whose active run was extracted last
 * wins, then the newest job. The file is written next to the target and swapped in, so readers
 * never see a partial file.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChartCsvExporter {

  static final String[] HEADER = {
    "entry_date",
    "chart_title",
    "chart_section",
    "this_week_rank",
    "last_week_rank",
    "two_weeks_ago_rank",
    "weeks_on_chart",
    "title",
    "artist",
    "label",
    "source_file",
    "run_id",
    "extracted_at"
  };

  private final JobRepository jobRepository;
  private final RunRepository runRepository;
  private final ChartRowRepository chartRowRepository;
  private final ChartReaderConfig config;

  @Timed(value = "csv.export", description = "Time to rewrite the CSV export")
  @Transactional(readOnly = true)
  public CsvExportResult exportLatestRunsOnly() throws IOException {
    List<UUID> runIds = selectActiveRuns();
    List<ChartRow> rows =
        runIds.isEmpty() ? List.of() : chartRowRepository.findByRunIdInOrderByIdAsc(runIds);

    Path target = config.getStorage().outputCsv();
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path tmp = target.resolveSibling(target.getFileName() + ".tmp");

    try (Writer out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
        CSVWriter writer =
            new CSVWriter(
                out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                "\n")) {
      writer.writeNext(HEADER, false);
      for (ChartRow row : rows) {
        writer.writeNext(toRecord(row), false);
      }
    }
    replace(tmp, target);

    String updatedAt = Instant.now().toString();
    log.info("Exported {} rows from {} runs to {}", rows.size(), runIds.size(), target);
    return new CsvExportResult(updatedAt, rows.size());
  }

  /** Active run per canonical filename. */
  List<UUID> selectActiveRuns() {
    List<Job> jobs = jobRepository.findByLastRunIdIsNotNull();
    if (jobs.isEmpty()) {
      return List.of();
    }
    Map<UUID, Run> runs =
        runRepository.findAllById(jobs.stream().map(Job::getLastRunId).toList()).stream()
            .collect(Collectors.toMap(Run::getRunId, Function.identity()));

    Map<String, Job> chosen = new HashMap<>();
    Comparator<Job> byRecency =
        Comparator.comparing((Job j) -> runs.get(j.getLastRunId()).getExtractedAt())
            .thenComparing(Job::getCreatedAt);
    for (Job job : jobs) {
      if (!runs.containsKey(job.getLastRunId())) {
        continue;
      }
      chosen.merge(
          job.getCanonicalFilename(),
          job,
          (current, candidate) ->
              byRecency.compare(candidate, current) > 0 ? candidate : current);
    }

    List<UUID> runIds = new ArrayList<>();
    for (Job job : chosen.values()) {
      runIds.add(job.getLastRunId());
    }
    return runIds;
  }

  private static String[] toRecord(ChartRow row) {
    return new String[] {
      str(row.getEntryDate()),
      row.getChartTitle(),
      row.getChartSection(),
      str(row.getThisWeekRank()),
      str(row.getLastWeekRank()),
      str(row.getTwoWeeksAgoRank()),
      str(row.getWeeksOnChart()),
      row.getTitle(),
      row.getArtist(),
      row.getLabel(),
      row.getSourceFile(),
      str(row.getRunId()),
      str(row.getExtractedAt())
    };
  }

  private static String str(Object value) {
    return Objects.toString(value, "");
  }

  private static void replace(Path tmp, Path target) throws IOException {
    try {
      Files.move(
          tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.warn("Atomic replace not supported for {}, replacing in place", target);
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
