package com.flamingo.ai.chartreader.domain.repository;

import com.flamingo.ai.chartreader.domain.entity.Run;
import com.flamingo.ai.chartreader.domain.enums.RunStatus;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Run entities. */
@Repository
public interface RunRepository extends JpaRepository<Run, UUID> {

  /** Finds all runs for a job, newest first. */
  List<Run> findByJobIdOrderByExtractedAtDesc(UUID jobId);

  /** Terminal status update for a run written before the attempt ended. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("UPDATE Run r SET r.status = :status, r.error = :error WHERE r.runId = :runId")
  int updateStatus(
      @Param("runId") UUID runId, @Param("status") RunStatus status, @Param("error") String error);
}
