package com.flamingo.ai.chartreader;

import com.flamingo.ai.chartreader.config.StateDirectoryInitializer;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the chart reader back end. */
@SpringBootApplication
public class ChartReaderApplication {

  public static void main(String[] args) {
    SpringApplication application = new SpringApplication(ChartReaderApplication.class);
    application.addListeners(new StateDirectoryInitializer());
    application.run(args);
  }
}
