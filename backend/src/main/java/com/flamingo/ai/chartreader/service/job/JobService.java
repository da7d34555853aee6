package com.flamingo.ai.chartreader.service.job;

import com.flamingo.ai.chartreader.domain.entity.ChartRow;
import com.flamingo.ai.chartreader.domain.entity.Job;
import com.flamingo.ai.chartreader.domain.entity.Run;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.web.multipart.MultipartFile;

/** Service interface for job intake and operator actions. */
public interface JobService {

  /**
   * Stores uploaded chart documents and queues them.
   *
   * <p>A re-upload of a document that already has a live job replaces that job's file instead of
   * creating a new job. Files of unsupported types are skipped.
   *
   * @param files the uploaded files
   * @return the created or updated jobs
   */
  List<Job> upload(List<MultipartFile> files);

  /**
   * Creates jobs for documents placed in the intake directory by hand.
   *
   * @return the created jobs
   */
  List<Job> scan();

  /**
   * Queues a job again.
   *
   * @throws com.flamingo.ai.chartreader.exception.JobStateException if the job is processing or
   *     deleted
   */
  Job rerun(UUID jobId);

  /**
   * Stops a queued, running or parked job.
   *
   * @throws com.flamingo.ai.chartreader.exception.JobStateException if the job is not active
   */
  Job cancel(UUID jobId);

  /**
   * Marks a job deleted and removes its files. Extracted rows are kept.
   *
   * @throws com.flamingo.ai.chartreader.exception.JobStateException if the job is processing
   */
  Job delete(UUID jobId);

  /**
   * Confirms the PDF page to extract and queues the job.
   *
   * @param pageNumber 1-based page number
   * @throws com.flamingo.ai.chartreader.exception.JobStateException if the job is not awaiting
   *     review
   * @throws com.flamingo.ai.chartreader.exception.JobValidationException if the page is out of
   *     range
   */
  Job confirmPage(UUID jobId, int pageNumber);

  /** All jobs, newest first. */
  List<Job> list();

  /**
   * @throws com.flamingo.ai.chartreader.exception.JobNotFoundException if not found
   */
  Job get(UUID jobId);

  /** Runs of a job, newest first. */
  List<Run> runs(UUID jobId);

  /**
   * A slice of all extracted rows by insertion order.
   *
   * @param limit rows per slice, clamped to 1..5000
   * @param offset rows to skip; rounded down to a multiple of {@code limit}
   * @param ascending oldest first when true
   */
  Page<ChartRow> rows(int limit, int offset, boolean ascending);
}
