package com.flamingo.ai.chartreader;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.chartreader.domain.entity.WorkerSettings;
import com.flamingo.ai.chartreader.domain.repository.WorkerSettingsRepository;
import com.flamingo.ai.chartreader.service.export.CsvExportQueue;
import com.flamingo.ai.chartreader.service.job.JobService;
import com.flamingo.ai.chartreader.service.worker.ExtractionWorker;
import com.flamingo.ai.chartreader.service.worker.JobPipeline;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads with the extraction model mocked, so the test
 * runs without an API key or network access.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private ChatModel chatModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(JobService.class)).isNotNull();
    assertThat(applicationContext.getBean(JobPipeline.class)).isNotNull();
    assertThat(applicationContext.getBean(ExtractionWorker.class)).isNotNull();
    assertThat(applicationContext.getBean(CsvExportQueue.class)).isNotNull();
  }

  @Test
  @DisplayName("Startup should seed worker settings and leave the worker stopped in tests")
  void startupShouldSeedSettings() {
    WorkerSettingsRepository settings = applicationContext.getBean(WorkerSettingsRepository.class);

    assertThat(settings.findById(WorkerSettings.SINGLETON_ID)).isPresent();
    assertThat(applicationContext.getBean(ExtractionWorker.class).isRunning()).isFalse();
  }
}
