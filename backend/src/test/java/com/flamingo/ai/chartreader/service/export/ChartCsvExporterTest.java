package com.flamingo.ai.chartreader.service.export;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.chartreader.config.ChartReaderConfig;
import com.flamingo.ai.chartreader.domain.entity.ChartRow;
import com.flamingo.ai.chartreader.domain.entity.Job;
import com.flamingo.ai.chartreader.domain.entity.Run;
import com.flamingo.ai.chartreader.domain.repository.ChartRowRepository;
import com.flamingo.ai.chartreader.domain.repository.JobRepository;
import com.flamingo.ai.chartreader.domain.repository.RunRepository;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ChartCsvExporter Tests")
class ChartCsvExporterTest {

  private static final LocalDateTime T0 = LocalDateTime.of(2024, 3, 1, 12, 0);

  @TempDir Path tempDir;

  @Mock private JobRepository jobRepository;
  @Mock private RunRepository runRepository;
  @Mock private ChartRowRepository chartRowRepository;

  private ChartCsvExporter exporter;
  private Path output;

  @BeforeEach
  void setUp() {
    ChartReaderConfig config = new ChartReaderConfig();
    config.getStorage().setFilesDir(tempDir.toString());
    output = tempDir.resolve("output.csv");
    exporter = new ChartCsvExporter(jobRepository, runRepository, chartRowRepository, config);
  }

  @Test
  @DisplayName("Should write only the latest active run per document")
  void shouldExportLatestRunPerCanonicalFile() throws Exception {
    Run older = run(T0);
    Run newer = run(T0.plusHours(1));
    Run other = run(T0.minusDays(1));
    Job first = job("2024-01-05_chart.png", older.getRunId(), T0.minusDays(2));
    Job reupload = job("2024-01-05_chart.png", newer.getRunId(), T0.minusDays(1));
    Job unrelated = job("2024-01-12_chart.png", other.getRunId(), T0.minusDays(3));
    when(jobRepository.findByLastRunIdIsNotNull()).thenReturn(List.of(first, reupload, unrelated));
    when(runRepository.findAllById(anyList())).thenReturn(List.of(older, newer, other));
    when(chartRowRepository.findByRunIdInOrderByIdAsc(anyList()))
        .thenReturn(List.of(row(newer.getRunId(), 1, "Hello, \"World\"", null)));

    CsvExportResult result = exporter.exportLatestRunsOnly();

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<UUID>> runIds = ArgumentCaptor.forClass(List.class);
    verify(chartRowRepository).findByRunIdInOrderByIdAsc(runIds.capture());
    assertThat(runIds.getValue()).containsExactlyInAnyOrder(newer.getRunId(), other.getRunId());
    assertThat(result.totalRowCount()).isEqualTo(1);
    assertThat(result.updatedAt()).isNotBlank();

    List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
    assertThat(lines).hasSize(2);
    assertThat(lines.get(0)).isEqualTo(String.join(",", ChartCsvExporter.HEADER));
    assertThat(lines.get(1))
        .startsWith("2024-01-05,DISCO TOP 80,,1,,,4,\"Hello, \"\"World\"\"\",Artist,Label,")
        .contains(newer.getRunId().toString());
    assertThat(tempDir.resolve("output.csv.tmp")).doesNotExist();
  }

  @Test
  void shouldWriteHeaderOnly_whenNoRuns() throws Exception {
    when(jobRepository.findByLastRunIdIsNotNull()).thenReturn(List.of());

    CsvExportResult result = exporter.exportLatestRunsOnly();

    assertThat(result.totalRowCount()).isZero();
    assertThat(Files.readAllLines(output, StandardCharsets.UTF_8))
        .containsExactly(String.join(",", ChartCsvExporter.HEADER));
  }

  @Test
  void shouldReplaceExistingFile() throws Exception {
    Files.writeString(output, "stale content\n");
    when(jobRepository.findByLastRunIdIsNotNull()).thenReturn(List.of());

    exporter.exportLatestRunsOnly();

    assertThat(Files.readString(output)).doesNotContain("stale");
  }

  private static Run run(LocalDateTime extractedAt) {
    return Run.builder()
        .runId(UUID.randomUUID())
        .jobId(UUID.randomUUID())
        .model("m")
        .extractedAt(extractedAt)
        .build();
  }

  private static Job job(String canonical, UUID lastRunId, LocalDateTime createdAt) {
    return Job.builder()
        .id(UUID.randomUUID())
        .filename(canonical + "-" + UUID.randomUUID())
        .canonicalFilename(canonical)
        .lastRunId(lastRunId)
        .createdAt(createdAt)
        .build();
  }

  private static ChartRow row(UUID runId, int rank, String title, Integer lastWeek) {
    return ChartRow.builder()
        .runId(runId)
        .jobId(UUID.randomUUID())
        .entryDate(LocalDate.of(2024, 1, 5))
        .chartTitle("DISCO TOP 80")
        .chartSection("")
        .thisWeekRank(rank)
        .lastWeekRank(lastWeek)
        .weeksOnChart(4)
        .title(title)
        .artist("Artist")
        .label("Label")
        .sourceFile("2024-01-05_chart.png")
        .extractedAt(T0)
        .build();
  }
}
