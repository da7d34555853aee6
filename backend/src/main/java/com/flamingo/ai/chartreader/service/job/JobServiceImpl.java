package com.flamingo.ai.chartreader.service.job;

import com.flamingo.ai.chartreader.domain.entity.ChartRow;
import com.flamingo.ai.chartreader.domain.entity.Job;
import com.flamingo.ai.chartreader.domain.entity.Run;
import com.flamingo.ai.chartreader.domain.enums.FileLocation;
import com.flamingo.ai.chartreader.domain.enums.JobStatus;
import com.flamingo.ai.chartreader.domain.repository.ChartRowRepository;
import com.flamingo.ai.chartreader.domain.repository.JobRepository;
import com.flamingo.ai.chartreader.domain.repository.RunRepository;
import com.flamingo.ai.chartreader.exception.JobNotFoundException;
import com.flamingo.ai.chartreader.exception.JobStateException;
import com.flamingo.ai.chartreader.exception.JobValidationException;
import com.flamingo.ai.chartreader.service.event.JobEventPublisher;
import com.flamingo.ai.chartreader.service.storage.FileNames;
import com.flamingo.ai.chartreader.service.storage.FileStorageService;
import com.flamingo.ai.chartreader.service.worker.ExtractionWorker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the JobService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobServiceImpl implements JobService {

  private static final int MAX_ROWS_PER_PAGE = 5_000;

  private final JobRepository jobRepository;
  private final RunRepository runRepository;
  private final ChartRowRepository chartRowRepository;
  private final FileStorageService storage;
  private final JobEventPublisher events;
  private final ExtractionWorker worker;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  @Timed(value = "job.upload", description = "Time to store an upload batch")
  public List<Job> upload(List<MultipartFile> files) {
    if (files == null || files.isEmpty()) {
      throw new JobValidationException("No files uploaded");
    }

    List<Job> touched = new ArrayList<>();
    for (MultipartFile file : files) {
      String original = file.getOriginalFilename();
      if (file.isEmpty() || original == null || !FileNames.isSupported(original)) {
        log.warn("Skipping unsupported upload {}", original);
        continue;
      }

      String canonical = FileNames.sanitize(original);
      String stored = FileNames.makeUnique(canonical, this::isFilenameTaken);
      try (InputStream content = file.getInputStream()) {
        storage.saveToNew(stored, content);
      } catch (IOException e) {
        throw new JobValidationException("Failed to store " + original, e);
      }

      Job job =
          jobRepository
              .findFirstByCanonicalFilenameAndStatusNotOrderByCreatedAtAsc(
                  canonical, JobStatus.DELETED)
              .map(existing -> replaceFile(existing, stored))
              .orElseGet(() -> createJob(stored, canonical));
      meterRegistry.counter("job.uploaded", "type", FileNames.extension(stored)).increment();
      events.jobChanged(job);
      touched.add(job);
    }

    worker.requestTick();
    return touched;
  }

  @Override
  @Transactional
  public List<Job> scan() {
    List<Job> created = new ArrayList<>();
    for (String filename : storage.listNewDocuments()) {
      if (jobRepository.existsByFilename(filename)) {
        continue;
      }
      Job job = createJob(filename, filename);
      events.jobChanged(job);
      created.add(job);
    }
    log.info("Scan created {} job(s)", created.size());
    if (created.stream().anyMatch(job -> job.getStatus() == JobStatus.QUEUED)) {
      worker.requestTick();
    }
    return created;
  }

  @Override
  @Transactional
  public Job rerun(UUID jobId) {
    Job job = get(jobId);
    if (job.getStatus() == JobStatus.PROCESSING) {
      throw new JobStateException(jobId, job.getStatus(), "Job is processing");
    }
    if (job.getStatus() == JobStatus.DELETED) {
      throw new JobStateException(jobId, job.getStatus(), "Job is deleted");
    }
    job.requeue();
    Job saved = jobRepository.save(job);
    log.info("Job {} queued for rerun", jobId);
    events.jobChanged(saved);
    worker.requestTick();
    return saved;
  }

  @Override
  public Job cancel(UUID jobId) {
    Job job = get(jobId);
    if (!job.getStatus().isActive() || !worker.requestCancel(jobId)) {
      Job current = get(jobId);
      throw new JobStateException(jobId, current.getStatus(), "Only active jobs can be stopped");
    }
    return get(jobId);
  }

  @Override
  @Transactional
  public Job delete(UUID jobId) {
    Job job = get(jobId);
    if (job.getStatus() == JobStatus.PROCESSING) {
      throw new JobStateException(jobId, job.getStatus(), "Job is processing");
    }

    storage.deleteEverywhere(job.getFilename());
    if (job.getPendingFilename() != null) {
      storage.deleteEverywhere(job.getPendingFilename());
      job.setPendingFilename(null);
    }
    job.setStatus(JobStatus.DELETED);
    job.setProgressStep(null);
    job.setError(null);
    job.setFinishedAt(LocalDateTime.now());
    job.setFileLocation(FileLocation.MISSING);
    Job saved = jobRepository.save(job);
    meterRegistry.counter("job.deleted").increment();
    log.info("Deleted job {} ({})", jobId, saved.getFilename());
    events.jobChanged(saved);
    return saved;
  }

  @Override
  @Transactional
  public Job confirmPage(UUID jobId, int pageNumber) {
    Job job = get(jobId);
    if (job.getStatus() != JobStatus.AWAITING_REVIEW) {
      throw new JobStateException(jobId, job.getStatus(), "Job is not awaiting page review");
    }
    Integer pageCount = job.getPageCount();
    if (pageNumber < 1 || (pageCount != null && pageNumber > pageCount)) {
      throw new JobValidationException(
          "Page must be between 1 and " + (pageCount == null ? "the page count" : pageCount));
    }
    job.setSelectedPage(pageNumber);
    job.setPageConfirmed(true);
    job.requeue();
    Job saved = jobRepository.save(job);
    log.info("Job {} page {} confirmed", jobId, pageNumber);
    events.jobChanged(saved);
    worker.requestTick();
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public List<Job> list() {
    return jobRepository.findAllByOrderByCreatedAtDesc();
  }

  @Override
  @Transactional(readOnly = true)
  public Job get(UUID jobId) {
    return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  @Override
  @Transactional(readOnly = true)
  public List<Run> runs(UUID jobId) {
    get(jobId);
    return runRepository.findByJobIdOrderByExtractedAtDesc(jobId);
  }

  @Override
  @Transactional(readOnly = true)
  public Page<ChartRow> rows(int limit, int offset, boolean ascending) {
    int size = Math.min(MAX_ROWS_PER_PAGE, Math.max(1, limit));
    int page = Math.max(0, offset) / size;
    Sort sort = ascending ? Sort.by("id").ascending() : Sort.by("id").descending();
    return chartRowRepository.findAllBy(PageRequest.of(page, size, sort));
  }

  private Job createJob(String filename, String canonical) {
    Optional<LocalDate> entryDate = FileNames.parseEntryDate(filename);
    Job job =
        Job.builder()
            .filename(filename)
            .canonicalFilename(canonical)
            .entryDate(entryDate.orElse(null))
            .fileLocation(FileLocation.NEW)
            .build();
    if (entryDate.isEmpty()) {
      job.markFailed(FileNames.MISSING_DATE_MESSAGE);
    }
    Job saved = jobRepository.save(job);
    log.info("Created job {} for {} ({})", saved.getId(), filename, saved.getStatus());
    return saved;
  }

  /** Points a live job at a newer upload of the same document. */
  private Job replaceFile(Job job, String newFilename) {
    job.setVersionCount(job.getVersionCount() + 1);
    if (job.getStatus() == JobStatus.PROCESSING) {
      if (job.getPendingFilename() != null) {
        storage.deleteEverywhere(job.getPendingFilename());
      }
      job.setPendingFilename(newFilename);
      log.info("Job {} is busy, {} will replace its file afterwards", job.getId(), newFilename);
      return jobRepository.save(job);
    }

    String previous = job.getFilename();
    job.setFilename(newFilename);
    job.setFileLocation(FileLocation.NEW);
    job.resetPageSelection();
    if (job.getEntryDate() == null) {
      job.setEntryDate(FileNames.parseEntryDate(newFilename).orElse(null));
    }
    if (job.getEntryDate() == null) {
      job.markFailed(FileNames.MISSING_DATE_MESSAGE);
    } else {
      job.requeue();
    }
    Job saved = jobRepository.saveAndFlush(job);
    storage.deleteEverywhere(previous);
    log.info("Job {} file replaced: {} -> {}", job.getId(), previous, newFilename);
    return saved;
  }

  private boolean isFilenameTaken(String name) {
    return storage.existsInNew(name)
        || storage.existsInCompleted(name)
        || jobRepository.existsByFilename(name);
  }
}
