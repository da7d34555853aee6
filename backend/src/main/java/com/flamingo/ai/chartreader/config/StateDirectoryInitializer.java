package com.flamingo.ai.chartreader.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.boot.context.event.ApplicationEnvironmentPreparedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.ConfigurableEnvironment;

/** Creates the directory holding the SQLite database before the datasource opens it. */
public class StateDirectoryInitializer
    implements ApplicationListener<ApplicationEnvironmentPreparedEvent> {

  @Override
  public void onApplicationEvent(ApplicationEnvironmentPreparedEvent event) {
    ConfigurableEnvironment env = event.getEnvironment();
    Path stateDir =
        Path.of(
            env.getProperty("chart-reader.storage.files-dir", "files"),
            env.getProperty("chart-reader.storage.state-dir-name", "state"));
    try {
      Files.createDirectories(stateDir);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create state directory " + stateDir, e);
    }
  }
}
