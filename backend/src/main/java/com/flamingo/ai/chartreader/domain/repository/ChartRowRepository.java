package com.flamingo.ai.chartreader.domain.repository;

import com.flamingo.ai.chartreader.domain.entity.ChartRow;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for extracted chart rows. */
@Repository
public interface ChartRowRepository extends JpaRepository<ChartRow, Long> {

  /** Rows of the given runs in insertion order. */
  List<ChartRow> findByRunIdInOrderByIdAsc(Collection<UUID> runIds);

  List<ChartRow> findByRunIdOrderByIdAsc(UUID runId);

  Page<ChartRow> findAllBy(Pageable pageable);

  /** Follows a collision-safe rename of the source file. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("UPDATE ChartRow r SET r.sourceFile = :sourceFile WHERE r.runId = :runId")
  int updateSourceFileByRunId(
      @Param("runId") UUID runId, @Param("sourceFile") String sourceFile);
}
