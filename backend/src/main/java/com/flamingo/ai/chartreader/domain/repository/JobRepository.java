package com.flamingo.ai.chartreader.domain.repository;

import com.flamingo.ai.chartreader.domain.entity.Job;
import com.flamingo.ai.chartreader.domain.enums.FileLocation;
import com.flamingo.ai.chartreader.domain.enums.JobStatus;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * Repository for Job entities.
 *
 * <p>Status transitions that can race with a stop request are conditional updates guarded by the
 * expected current status; callers check the returned row count.
 */
@Repository
public interface JobRepository extends JpaRepository<Job, UUID> {

  String QUEUED = "com.flamingo.ai.chartreader.domain.enums.JobStatus.QUEUED";
  String PROCESSING = "com.flamingo.ai.chartreader.domain.enums.JobStatus.PROCESSING";
  String COMPLETED = "com.flamingo.ai.chartreader.domain.enums.JobStatus.COMPLETED";
  String ERROR = "com.flamingo.ai.chartreader.domain.enums.JobStatus.ERROR";
  String CANCELLED = "com.flamingo.ai.chartreader.domain.enums.JobStatus.CANCELLED";
  String AWAITING_REVIEW = "com.flamingo.ai.chartreader.domain.enums.JobStatus.AWAITING_REVIEW";

  /** Lists all jobs, newest first. */
  List<Job> findAllByOrderByCreatedAtDesc();

  /** Counts jobs by status. */
  long countByStatus(JobStatus status);

  /** Oldest job with the given canonical name that is not in the excluded status. */
  Optional<Job> findFirstByCanonicalFilenameAndStatusNotOrderByCreatedAtAsc(
      String canonicalFilename, JobStatus excluded);

  boolean existsByFilename(String filename);

  boolean existsByFilenameAndIdNot(String filename, UUID id);

  /** Jobs that point at an active run, candidates for the CSV export. */
  List<Job> findByLastRunIdIsNotNull();

  /** Ids of jobs in a status, oldest first. */
  @Query("SELECT j.id FROM Job j WHERE j.status = :status ORDER BY j.createdAt ASC, j.id ASC")
  List<UUID> findIdsByStatusOldestFirst(@Param("status") JobStatus status, Pageable pageable);

  /** Flips one queued job to processing; returns 0 when another caller got there first. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Job j SET j.status = "
          + PROCESSING
          + ", j.progressStep = 'starting', j.error = NULL, j.startedAt = :now,"
          + " j.finishedAt = NULL WHERE j.id = :id AND j.status = "
          + QUEUED)
  int claimQueued(@Param("id") UUID id, @Param("now") LocalDateTime now);

  /** Hands a claimed job back to the queue when it could not be started. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Job j SET j.status = "
          + QUEUED
          + ", j.progressStep = NULL, j.startedAt = NULL WHERE j.id = :id AND j.status = "
          + PROCESSING)
  int releaseClaim(@Param("id") UUID id);

  /** Returns jobs left in processing by a previous process to the queue. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Job j SET j.status = "
          + QUEUED
          + ", j.progressStep = NULL WHERE j.status = "
          + PROCESSING)
  int requeueProcessing();

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("UPDATE Job j SET j.progressStep = :step WHERE j.id = :id")
  int updateProgressStep(@Param("id") UUID id, @Param("step") String step);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("UPDATE Job j SET j.fileLocation = :location WHERE j.id = :id")
  int updateFileLocation(@Param("id") UUID id, @Param("location") FileLocation location);

  /** Sets the entry date only when none was recorded yet. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("UPDATE Job j SET j.entryDate = :entryDate WHERE j.id = :id AND j.entryDate IS NULL")
  int initEntryDate(@Param("id") UUID id, @Param("entryDate") LocalDate entryDate);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Job j SET j.status = "
          + COMPLETED
          + ", j.progressStep = NULL, j.error = NULL, j.finishedAt = :now,"
          + " j.runCount = j.runCount + 1, j.lastRunId = :runId, j.rowsAppendedLastRun = :rows,"
          + " j.filename = :filename, j.fileLocation = :location"
          + " WHERE j.id = :id AND j.status = "
          + PROCESSING)
  int completeProcessing(
      @Param("id") UUID id,
      @Param("runId") UUID runId,
      @Param("rows") int rowsAppended,
      @Param("filename") String filename,
      @Param("location") FileLocation location,
      @Param("now") LocalDateTime now);

  /** Ends a run whose rows were kept but which still reports an error (gaps remain). */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Job j SET j.status = "
          + ERROR
          + ", j.progressStep = 'error', j.error = :error, j.finishedAt = :now,"
          + " j.runCount = j.runCount + 1, j.lastRunId = :runId, j.rowsAppendedLastRun = :rows,"
          + " j.filename = :filename, j.fileLocation = :location"
          + " WHERE j.id = :id AND j.status = "
          + PROCESSING)
  int completeProcessingWithError(
      @Param("id") UUID id,
      @Param("runId") UUID runId,
      @Param("rows") int rowsAppended,
      @Param("filename") String filename,
      @Param("location") FileLocation location,
      @Param("error") String error,
      @Param("now") LocalDateTime now);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Job j SET j.status = "
          + ERROR
          + ", j.progressStep = 'error', j.error = :error, j.finishedAt = :now"
          + " WHERE j.id = :id AND j.status = "
          + PROCESSING)
  int failProcessing(
      @Param("id") UUID id, @Param("error") String error, @Param("now") LocalDateTime now);

  /** Cancels a job still marked processing; a job already stopped by request is left alone. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Job j SET j.status = "
          + CANCELLED
          + ", j.error = :reason, j.finishedAt = :now WHERE j.id = :id AND j.status = "
          + PROCESSING)
  int cancelProcessing(
      @Param("id") UUID id, @Param("reason") String reason, @Param("now") LocalDateTime now);

  /** Parks a processing PDF job until a human confirms which page to extract. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Job j SET j.status = "
          + AWAITING_REVIEW
          + ", j.progressStep = 'awaiting_review', j.selectedPage = :page, j.pageConfirmed = false,"
          + " j.pageCount = :pageCount, j.finishedAt = :now WHERE j.id = :id AND j.status = "
          + PROCESSING)
  int markAwaitingReview(
      @Param("id") UUID id,
      @Param("page") Integer selectedPage,
      @Param("pageCount") int pageCount,
      @Param("now") LocalDateTime now);

  /** Stop request: cancels a job that is queued, running or waiting for review. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Job j SET j.status = "
          + CANCELLED
          + ", j.error = :reason, j.finishedAt = :now WHERE j.id = :id AND j.status IN ("
          + QUEUED
          + ", "
          + PROCESSING
          + ", "
          + AWAITING_REVIEW
          + ")")
  int cancelActive(
      @Param("id") UUID id, @Param("reason") String reason, @Param("now") LocalDateTime now);

  /** Follows the source file after it moved, whatever the job's status. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("UPDATE Job j SET j.filename = :filename, j.fileLocation = :location WHERE j.id = :id")
  int updateStoredFile(
      @Param("id") UUID id,
      @Param("filename") String filename,
      @Param("location") FileLocation location);
}
