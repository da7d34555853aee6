package com.flamingo.ai.chartreader.service.worker;

import com.flamingo.ai.chartreader.domain.entity.ChartRow;
import com.flamingo.ai.chartreader.domain.entity.Run;
import com.flamingo.ai.chartreader.domain.enums.RunStatus;
import com.flamingo.ai.chartreader.domain.repository.ChartRowRepository;
import com.flamingo.ai.chartreader.domain.repository.RunRepository;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Writes runs and their rows. */
@Service
@RequiredArgsConstructor
@Slf4j
public class RunPersistenceService {

  private final RunRepository runRepository;
  private final ChartRowRepository chartRowRepository;

  /** Inserts the run and all of its rows in one transaction. */
  @Transactional
  public void saveRunWithRows(Run run, List<ChartRow> rows) {
    runRepository.save(run);
    chartRowRepository.saveAll(rows);
    log.debug("Persisted run {} with {} rows", run.getRunId(), rows.size());
  }

  /** Records an attempt that ended without rows. */
  @Transactional
  public void saveRun(Run run) {
    runRepository.save(run);
  }

  @Transactional
  public void updateStatus(UUID runId, RunStatus status, String error) {
    runRepository.updateStatus(runId, status, error);
  }

  @Transactional
  public void updateSourceFile(UUID runId, String sourceFile) {
    chartRowRepository.updateSourceFileByRunId(runId, sourceFile);
  }
}
