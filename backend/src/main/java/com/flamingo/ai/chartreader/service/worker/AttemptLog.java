package com.flamingo.ai.chartreader.service.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.chartreader.service.completeness.MissingChartGroup;
import com.flamingo.ai.chartreader.service.extraction.ExtractionMode;
import java.util.List;

/** Audit trail of every extraction attempt of one run, stored as the run's raw payload. */
class AttemptLog {

  private final ObjectMapper objectMapper;
  private final ObjectNode root;
  private final ArrayNode attempts;

  AttemptLog(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    this.root = objectMapper.createObjectNode();
    this.attempts = root.putArray("attempts");
  }

  void page(Integer pageNumber, int pageCount) {
    ObjectNode pdf = root.putObject("pdf");
    pdf.put("page", pageNumber);
    pdf.put("pageCount", pageCount);
  }

  void filter(String mode, int rowsBefore, int rowsAfter) {
    ObjectNode filter = root.putObject("chartFilter");
    filter.put("mode", mode);
    filter.put("rowsBefore", rowsBefore);
    filter.put("rowsAfter", rowsAfter);
  }

  /** Appends a successful attempt; the returned entry can be amended once more is known. */
  ObjectNode succeeded(
      ExtractionMode mode,
      String model,
      int rowsReturned,
      int rowsAdded,
      List<MissingChartGroup> remaining,
      String response) {
    ObjectNode attempt = attempt(mode, model);
    attempt.put("rowsReturned", rowsReturned);
    attempt.put("rowsAdded", rowsAdded);
    attempt.set("remainingGaps", gaps(remaining));
    attempt.set("response", parseOrText(response));
    return attempt;
  }

  void amend(ObjectNode attempt, int rowsAdded, List<MissingChartGroup> remaining) {
    attempt.put("rowsAdded", rowsAdded);
    attempt.set("remainingGaps", gaps(remaining));
  }

  void failed(ExtractionMode mode, String model, String error) {
    attempt(mode, model).put("error", error);
  }

  void outcome(String status, String model, int rows, List<MissingChartGroup> remaining) {
    ObjectNode outcome = root.putObject("outcome");
    outcome.put("status", status);
    outcome.put("model", model);
    outcome.put("rows", rows);
    outcome.set("remainingGaps", gaps(remaining));
  }

  String toJson() {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize attempt log", e);
    }
  }

  private ObjectNode attempt(ExtractionMode mode, String model) {
    ObjectNode attempt = attempts.addObject();
    attempt.put("mode", mode.name());
    attempt.put("model", model);
    return attempt;
  }

  private ArrayNode gaps(List<MissingChartGroup> remaining) {
    ArrayNode gaps = objectMapper.createArrayNode();
    for (MissingChartGroup group : remaining) {
      ObjectNode gap = gaps.addObject();
      gap.put("chartTitle", group.chartTitle());
      gap.put("chartSection", group.chartSection());
      gap.put("expected", group.expectedRowCount());
      gap.put("actual", group.actualRowCount());
      gap.set("missingThisWeekRanks", objectMapper.valueToTree(group.missingThisWeekRanks()));
    }
    return gaps;
  }

  private JsonNode parseOrText(String response) {
    if (response == null) {
      return objectMapper.nullNode();
    }
    try {
      return objectMapper.readTree(response);
    } catch (JsonProcessingException e) {
      return objectMapper.getNodeFactory().textNode(response);
    }
  }
}
