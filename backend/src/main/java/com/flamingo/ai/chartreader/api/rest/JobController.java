package com.flamingo.ai.chartreader.api.rest;

import com.flamingo.ai.chartreader.api.dto.request.ConfirmPageRequest;
import com.flamingo.ai.chartreader.api.dto.request.SettingsRequest;
import com.flamingo.ai.chartreader.api.dto.response.ChartRowResponse;
import com.flamingo.ai.chartreader.api.dto.response.JobResponse;
import com.flamingo.ai.chartreader.api.dto.response.RowsResponse;
import com.flamingo.ai.chartreader.api.dto.response.RunResponse;
import com.flamingo.ai.chartreader.api.dto.response.ScanResponse;
import com.flamingo.ai.chartreader.api.dto.response.StateResponse;
import com.flamingo.ai.chartreader.config.ChartReaderConfig;
import com.flamingo.ai.chartreader.domain.entity.ChartRow;
import com.flamingo.ai.chartreader.domain.entity.Job;
import com.flamingo.ai.chartreader.service.export.ChartCsvExporter;
import com.flamingo.ai.chartreader.service.job.JobService;
import com.flamingo.ai.chartreader.service.worker.ExtractionWorker;
import com.flamingo.ai.chartreader.service.worker.WorkerSettingsService;
import jakarta.validation.Valid;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for jobs, worker settings, rows and the CSV export. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class JobController {

  private final JobService jobService;
  private final WorkerSettingsService settingsService;
  private final ExtractionWorker worker;
  private final ChartCsvExporter csvExporter;
  private final ChartReaderConfig config;

  /** Settings and all jobs. */
  @GetMapping("/state")
  public ResponseEntity<StateResponse> getState() {
    return ResponseEntity.ok(buildState());
  }

  /** Updates the worker settings; omitted fields are kept. */
  @PostMapping("/settings")
  public ResponseEntity<StateResponse> updateSettings(@Valid @RequestBody SettingsRequest request) {
    settingsService.update(request.getConcurrency(), request.getPaused(), request.getModel());
    worker.requestTick();
    return ResponseEntity.ok(buildState());
  }

  /** Creates jobs for files dropped into the intake directory. */
  @PostMapping("/scan")
  public ResponseEntity<ScanResponse> scan() {
    List<Job> created = jobService.scan();
    return ResponseEntity.ok(
        new ScanResponse(created.size(), created.stream().map(JobResponse::fromEntity).toList()));
  }

  @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<List<JobResponse>> upload(
      @RequestParam("files") List<MultipartFile> files) {
    List<Job> jobs = jobService.upload(files);
    return ResponseEntity.ok(jobs.stream().map(JobResponse::fromEntity).toList());
  }

  @GetMapping("/jobs/{jobId}")
  public ResponseEntity<JobResponse> getJob(@PathVariable UUID jobId) {
    return ResponseEntity.ok(JobResponse.fromEntity(jobService.get(jobId)));
  }

  /** Runs of a job, newest first, with their attempt logs. */
  @GetMapping("/jobs/{jobId}/runs")
  public ResponseEntity<List<RunResponse>> getRuns(@PathVariable UUID jobId) {
    return ResponseEntity.ok(
        jobService.runs(jobId).stream().map(RunResponse::fromEntity).toList());
  }

  @PostMapping("/jobs/{jobId}/rerun")
  public ResponseEntity<JobResponse> rerun(@PathVariable UUID jobId) {
    return ResponseEntity.ok(JobResponse.fromEntity(jobService.rerun(jobId)));
  }

  @PostMapping("/jobs/{jobId}/cancel")
  public ResponseEntity<JobResponse> cancel(@PathVariable UUID jobId) {
    return ResponseEntity.ok(JobResponse.fromEntity(jobService.cancel(jobId)));
  }

  /** Confirms the PDF page to extract for a job awaiting review. */
  @PostMapping("/jobs/{jobId}/page")
  public ResponseEntity<JobResponse> confirmPage(
      @PathVariable UUID jobId, @Valid @RequestBody ConfirmPageRequest request) {
    return ResponseEntity.ok(
        JobResponse.fromEntity(jobService.confirmPage(jobId, request.getPage())));
  }

  @DeleteMapping("/jobs/{jobId}")
  public ResponseEntity<JobResponse> delete(@PathVariable UUID jobId) {
    return ResponseEntity.ok(JobResponse.fromEntity(jobService.delete(jobId)));
  }

  /** Extracted rows by insertion order, newest first unless {@code order=asc}. */
  @GetMapping("/rows")
  public ResponseEntity<RowsResponse> getRows(
      @RequestParam(defaultValue = "500") int limit,
      @RequestParam(defaultValue = "0") int offset,
      @RequestParam(defaultValue = "desc") String order) {
    Page<ChartRow> page = jobService.rows(limit, offset, "asc".equalsIgnoreCase(order));
    return ResponseEntity.ok(
        new RowsResponse(
            page.getContent().stream().map(ChartRowResponse::fromEntity).toList(),
            page.getTotalElements()));
  }

  /** Downloads the CSV export, writing it first when it does not exist yet. */
  @GetMapping("/csv")
  public ResponseEntity<Resource> downloadCsv() throws IOException {
    Path csv = config.getStorage().outputCsv();
    if (!Files.exists(csv)) {
      csvExporter.exportLatestRunsOnly();
    }
    return ResponseEntity.ok()
        .contentType(MediaType.parseMediaType("text/csv; charset=utf-8"))
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            "attachment; filename=\"" + csv.getFileName() + "\"")
        .body(new FileSystemResource(csv));
  }

  private StateResponse buildState() {
    return StateResponse.of(
        settingsService.current(), jobService.list(), worker.activeJobCount());
  }
}
