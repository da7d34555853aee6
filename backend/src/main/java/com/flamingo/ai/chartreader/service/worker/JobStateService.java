package com.flamingo.ai.chartreader.service.worker;

import com.flamingo.ai.chartreader.domain.entity.Job;
import com.flamingo.ai.chartreader.domain.enums.FileLocation;
import com.flamingo.ai.chartreader.domain.enums.JobStatus;
import com.flamingo.ai.chartreader.domain.repository.JobRepository;
import com.flamingo.ai.chartreader.service.event.JobEventPublisher;
import com.flamingo.ai.chartreader.service.pdf.PageCandidates;
import com.flamingo.ai.chartreader.service.storage.FileStorageService;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Job field updates made while a job runs, each followed by a job notification.
 *
 * <p>Terminal transitions only apply while the job is still {@code processing}; they return false
 * when a stop request got there first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobStateService {

  private final JobRepository jobRepository;
  private final FileStorageService storage;
  private final JobEventPublisher events;

  @Transactional
  public void progress(UUID jobId, String step) {
    jobRepository.updateProgressStep(jobId, step);
    publish(jobId);
  }

  @Transactional
  public void fileLocated(UUID jobId, FileLocation location) {
    jobRepository.updateFileLocation(jobId, location);
    publish(jobId);
  }

  @Transactional
  public void entryDateResolved(UUID jobId, LocalDate entryDate) {
    jobRepository.initEntryDate(jobId, entryDate);
  }

  @Transactional
  public void fileMoved(UUID jobId, String filename, FileLocation location) {
    jobRepository.updateStoredFile(jobId, filename, location);
  }

  /** Stores the page candidates and parks the job for review, preselecting the first one. */
  @Transactional
  public boolean suspendForReview(UUID jobId, PageCandidates candidates) {
    Integer firstChoice = candidates.pages().isEmpty() ? null : candidates.pages().get(0);
    int updated =
        jobRepository.markAwaitingReview(
            jobId, firstChoice, candidates.pageCount(), LocalDateTime.now());
    if (updated == 0) {
      return false;
    }
    jobRepository
        .findById(jobId)
        .ifPresent(
            job -> {
              job.setCandidatePages(new ArrayList<>(candidates.pages()));
              jobRepository.save(job);
            });
    log.info("Job {} awaits page review, candidates {}", jobId, candidates.pages());
    publish(jobId);
    return true;
  }

  @Transactional
  public boolean complete(
      UUID jobId, UUID runId, int rowsAppended, String filename, FileLocation location) {
    int updated =
        jobRepository.completeProcessing(
            jobId, runId, rowsAppended, filename, location, LocalDateTime.now());
    publish(jobId);
    return updated == 1;
  }

  /** Keeps the run active but leaves the job in error, for runs that finished with gaps. */
  @Transactional
  public boolean completeWithGaps(
      UUID jobId,
      UUID runId,
      int rowsAppended,
      String filename,
      FileLocation location,
      String gapSummary) {
    int updated =
        jobRepository.completeProcessingWithError(
            jobId, runId, rowsAppended, filename, location, gapSummary, LocalDateTime.now());
    publish(jobId);
    return updated == 1;
  }

  @Transactional
  public boolean fail(UUID jobId, String message) {
    int updated = jobRepository.failProcessing(jobId, message, LocalDateTime.now());
    publish(jobId);
    return updated == 1;
  }

  @Transactional
  public boolean cancelProcessing(UUID jobId, String reason) {
    int updated = jobRepository.cancelProcessing(jobId, reason, LocalDateTime.now());
    publish(jobId);
    return updated == 1;
  }

  @Transactional
  public void releaseClaim(UUID jobId) {
    jobRepository.releaseClaim(jobId);
    publish(jobId);
  }

  /** Stop request: cancels a queued, running or parked job. */
  @Transactional
  public boolean cancelActive(UUID jobId, String reason) {
    int updated = jobRepository.cancelActive(jobId, reason, LocalDateTime.now());
    publish(jobId);
    return updated == 1;
  }

  /**
   * Swaps in a replacement upload that arrived while the job was busy and queues the job again.
   *
   * @return whether a replacement was promoted
   */
  @Transactional
  public boolean promotePendingFile(UUID jobId) {
    Job job = jobRepository.findById(jobId).orElse(null);
    if (job == null
        || job.getPendingFilename() == null
        || job.getStatus() == JobStatus.PROCESSING
        || job.getStatus() == JobStatus.DELETED) {
      return false;
    }
    String previous = job.getFilename();
    String replacement = job.getPendingFilename();
    job.setFilename(replacement);
    job.setPendingFilename(null);
    job.setFileLocation(FileLocation.NEW);
    job.resetPageSelection();
    job.requeue();
    jobRepository.save(job);
    if (!previous.equals(replacement)) {
      storage.deleteEverywhere(previous);
    }
    log.info("Job {} requeued with replacement file {}", jobId, replacement);
    events.jobChanged(job);
    return true;
  }

  /** Returns jobs left in processing by a previous run of the application to the queue. */
  @Transactional
  public int requeueInterrupted() {
    return jobRepository.requeueProcessing();
  }

  public void publish(UUID jobId) {
    jobRepository.findById(jobId).ifPresent(events::jobChanged);
  }
}
