package com.flamingo.ai.chartreader.service.worker;

import com.flamingo.ai.chartreader.domain.entity.Job;
import com.flamingo.ai.chartreader.domain.enums.JobStatus;
import com.flamingo.ai.chartreader.domain.repository.JobRepository;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Atomically moves queued jobs to processing.
 *
 * <p>Each selected job is flipped with a conditional update, so a job already taken by another
 * claimer is skipped. Claims in this process are additionally serialized, and each commits before
 * the next one starts.
 */
@Service
@Slf4j
public class JobClaimService {

  private final JobRepository jobRepository;
  private final TransactionTemplate transactionTemplate;
  private final ReentrantLock claimLock = new ReentrantLock();

  public JobClaimService(JobRepository jobRepository, PlatformTransactionManager txManager) {
    this.jobRepository = jobRepository;
    this.transactionTemplate = new TransactionTemplate(txManager);
  }

  /** Claims up to {@code limit} queued jobs, oldest first. */
  public List<Job> claim(int limit) {
    if (limit <= 0) {
      return List.of();
    }
    claimLock.lock();
    try {
      List<Job> claimed = transactionTemplate.execute(status -> claimInTransaction(limit));
      return claimed == null ? List.of() : claimed;
    } finally {
      claimLock.unlock();
    }
  }

  private List<Job> claimInTransaction(int limit) {
    List<UUID> ids =
        jobRepository.findIdsByStatusOldestFirst(JobStatus.QUEUED, PageRequest.of(0, limit));
    if (ids.isEmpty()) {
      return List.of();
    }

    LocalDateTime now = LocalDateTime.now();
    List<UUID> won = new ArrayList<>();
    for (UUID id : ids) {
      if (jobRepository.claimQueued(id, now) == 1) {
        won.add(id);
      }
    }
    if (won.isEmpty()) {
      return List.of();
    }

    List<Job> jobs = new ArrayList<>(jobRepository.findAllById(won));
    jobs.sort(Comparator.comparing(Job::getCreatedAt).thenComparing(Job::getId));
    log.info("Claimed {} job(s): {}", jobs.size(), won);
    return jobs;
  }
}
