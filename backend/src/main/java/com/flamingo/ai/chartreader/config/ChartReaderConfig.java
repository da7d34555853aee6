package com.flamingo.ai.chartreader.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the chart extraction pipeline. */
@Configuration
@ConfigurationProperties(prefix = "chart-reader")
@Getter
@Setter
public class ChartReaderConfig {

  private Storage storage = new Storage();
  private Worker worker = new Worker();
  private PageSelection pageSelection = new PageSelection();
  private Completeness completeness = new Completeness();
  private Extraction extraction = new Extraction();
  private Csv csv = new Csv();

  /** Uploads land in {@code new/}; processed files move to {@code completed/}. */
  @Getter
  @Setter
  public static class Storage {
    private String filesDir = "files";
    private String newDirName = "new";
    private String completedDirName = "completed";
    private String stateDirName = "state";
    private String outputCsvName = "output.csv";

    public Path newDir() {
      return Path.of(filesDir, newDirName);
    }

    public Path completedDir() {
      return Path.of(filesDir, completedDirName);
    }

    public Path stateDir() {
      return Path.of(filesDir, stateDirName);
    }

    public Path outputCsv() {
      return Path.of(filesDir, outputCsvName);
    }
  }

  @Getter
  @Setter
  public static class Worker {
    /** Fixed delay between poll ticks. */
    private long pollIntervalMs = 1000;

    /** Start the poll loop with the application context. Disabled in tests. */
    private boolean autoStart = true;

    /** Seed for the stored concurrency limit on first start. */
    private int defaultConcurrency = 2;

    /** Seed for the stored primary model on first start. */
    private String defaultModel = "gpt-4.1-mini";

    /** Upper bound of the operator-tunable concurrency limit; also the job pool size. */
    private int maxConcurrency = 10;
  }

  @Getter
  @Setter
  public static class PageSelection {
    private int maxPagesToScan = 300;
    private int candidateLimit = 12;

    /** At most this many text-scored pages are taken before the raster fallback fills in. */
    private int primaryCandidateLimit = 6;

    private float rasterDpi = 50f;
    private int rasterMaxDimension = 900;
    private long rasterMaxPixels = 1_200_000L;

    private float modelDpi = 300f;
    private int modelMaxDimension = 4096;
    private long modelMaxPixels = 12_000_000L;
    private float modelJpegQuality = 0.95f;
  }

  /** Expected-rank inference used to detect gaps; tuned for Billboard-style chart titles. */
  @Getter
  @Setter
  public static class Completeness {
    /** Patterns with one capture group holding the chart size, tried in order on the title. */
    private List<String> titlePatterns =
        new ArrayList<>(List.of("(?i)\\bTOP\\s*(\\d{2,3})\\b", "(?i)\\bHOT\\s*(\\d{2,3})\\b"));

    /** Patterns tried on the source filename when the title gives no size. */
    private List<String> filenamePatterns =
        new ArrayList<>(List.of("(?i)(?:^|[^a-z])top[_ -]?(\\d{2,3})(?!\\d)"));

    private int minExpectedRank = 2;
    private int maxExpectedRank = 200;

    /** Rank ranges listed per chart in a missing-rows prompt. */
    private int maxPromptRanges = 60;

    /** Missing-rows passes with the primary model; a pass that adds nothing ends the loop. */
    private int maxPrimaryRepairPasses = 2;
  }

  @Getter
  @Setter
  public static class Extraction {
    /** High-effort model used for the last completeness pass; blank disables the escalation. */
    private String fallbackModel = "gpt-4.1";

    private ChartFilter chartFilter = new ChartFilter();

    /** Restricts extracted rows to the chart family this deployment collects. */
    @Getter
    @Setter
    public static class ChartFilter {
      private boolean enabled = true;

      /** A section matching any of these keeps every chart in it. */
      private List<String> sectionPatterns =
          new ArrayList<>(List.of("(?i)\\bdisco\\b", "(?i)\\bdance\\b"));

      /** Used when no section matched: chart titles matching any of these are kept. */
      private List<String> titlePatterns =
          new ArrayList<>(
              List.of(
                  "(?i)\\bdisco\\b",
                  "(?i)\\bdance\\b",
                  "(?i)\\bclub\\s*play\\b",
                  "(?i)\\b12\\s*inch\\b",
                  "(?i)\\b12\\s*in\\."));

      /** Label used in error messages when nothing matched. */
      private String description = "dance/disco";
    }
  }

  @Getter
  @Setter
  public static class Csv {
    private boolean enabled = true;
  }
}
