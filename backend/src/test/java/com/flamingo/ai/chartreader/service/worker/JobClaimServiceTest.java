package com.flamingo.ai.chartreader.service.worker;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.chartreader.domain.entity.Job;
import com.flamingo.ai.chartreader.domain.enums.JobStatus;
import com.flamingo.ai.chartreader.domain.repository.ChartRowRepository;
import com.flamingo.ai.chartreader.domain.repository.JobRepository;
import com.flamingo.ai.chartreader.domain.repository.RunRepository;
import dev.langchain4j.model.chat.ChatModel;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/** Claims against the real persistence layer. */
@SpringBootTest
class JobClaimServiceTest {

  @MockitoBean private ChatModel chatModel;

  @Autowired private JobClaimService claimService;
  @Autowired private JobRepository jobRepository;
  @Autowired private RunRepository runRepository;
  @Autowired private ChartRowRepository chartRowRepository;

  @BeforeEach
  void setUp() {
    chartRowRepository.deleteAll();
    runRepository.deleteAll();
    jobRepository.deleteAll();
  }

  @Test
  @DisplayName("Should claim the oldest queued jobs and mark them processing")
  void shouldClaimOldestFirst() {
    LocalDateTime base = LocalDateTime.now().minusHours(1);
    Job oldest = save("2024-01-01_a.png", JobStatus.QUEUED, base);
    Job middle = save("2024-01-02_b.png", JobStatus.QUEUED, base.plusMinutes(1));
    save("2024-01-03_c.png", JobStatus.QUEUED, base.plusMinutes(2));
    save("2024-01-04_d.png", JobStatus.COMPLETED, base.minusMinutes(5));

    List<Job> claimed = claimService.claim(2);

    assertThat(claimed).extracting(Job::getId).containsExactly(oldest.getId(), middle.getId());
    Job reloaded = jobRepository.findById(oldest.getId()).orElseThrow();
    assertThat(reloaded.getStatus()).isEqualTo(JobStatus.PROCESSING);
    assertThat(reloaded.getStartedAt()).isNotNull();
    assertThat(jobRepository.countByStatus(JobStatus.QUEUED)).isEqualTo(1);
  }

  @Test
  void shouldReturnEmpty_whenNothingQueued() {
    save("2024-01-01_a.png", JobStatus.AWAITING_REVIEW, LocalDateTime.now());

    assertThat(claimService.claim(3)).isEmpty();
    assertThat(claimService.claim(0)).isEmpty();
  }

  @Test
  @DisplayName("Concurrent claimers should never receive the same job")
  void shouldHandOutDisjointJobs_whenClaimedConcurrently() throws Exception {
    LocalDateTime base = LocalDateTime.now().minusHours(1);
    for (int i = 0; i < 10; i++) {
      save("2024-02-" + (10 + i) + "_chart.png", JobStatus.QUEUED, base.plusSeconds(i));
    }

    int claimers = 4;
    ExecutorService pool = Executors.newFixedThreadPool(claimers);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<List<Job>>> results = new ArrayList<>();
    try {
      for (int i = 0; i < claimers; i++) {
        results.add(
            pool.submit(
                () -> {
                  start.await();
                  return claimService.claim(3);
                }));
      }
      start.countDown();

      List<UUID> all = new ArrayList<>();
      for (Future<List<Job>> result : results) {
        result.get(30, TimeUnit.SECONDS).forEach(job -> all.add(job.getId()));
      }
      Set<UUID> distinct = new HashSet<>(all);

      assertThat(all).hasSize(10);
      assertThat(distinct).hasSize(10);
      assertThat(jobRepository.countByStatus(JobStatus.QUEUED)).isZero();
      assertThat(jobRepository.countByStatus(JobStatus.PROCESSING)).isEqualTo(10);
    } finally {
      pool.shutdownNow();
    }
  }

  private Job save(String filename, JobStatus status, LocalDateTime createdAt) {
    return jobRepository.save(
        Job.builder()
            .filename(filename)
            .canonicalFilename(filename)
            .status(status)
            .createdAt(createdAt)
            .build());
  }
}
