package com.flamingo.ai.chartreader.service.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.chartreader.config.ChartReaderConfig;
import com.flamingo.ai.chartreader.exception.ChartExtractionException;
import com.flamingo.ai.chartreader.exception.JobCancelledException;
import com.flamingo.ai.chartreader.service.completeness.MissingChartGroup;
import com.flamingo.ai.chartreader.service.worker.CancellationToken;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * {@link ChartExtractionClient} backed by a LangChain4j chat model in JSON mode.
 *
 * <p>The remote call runs on a dedicated executor so a fired cancellation token can abandon it
 * right away instead of waiting for the HTTP response.
 */
@Service
@Slf4j
public class OpenAiChartExtractionClient implements ChartExtractionClient {

  private final ChatModel chatModel;
  private final ObjectMapper objectMapper;
  private final Executor llmCallExecutor;
  private final MeterRegistry meterRegistry;
  private final int maxPromptRanges;

  public OpenAiChartExtractionClient(
      ChatModel chatModel,
      ObjectMapper objectMapper,
      @Qualifier("llmCallExecutor") Executor llmCallExecutor,
      MeterRegistry meterRegistry,
      ChartReaderConfig config) {
    this.chatModel = chatModel;
    this.objectMapper = objectMapper;
    this.llmCallExecutor = llmCallExecutor;
    this.meterRegistry = meterRegistry;
    this.maxPromptRanges = config.getCompleteness().getMaxPromptRanges();
  }

  @Override
  @Timed(value = "extraction.call", description = "Time for one chart extraction model call")
  @Retry(name = "chartExtraction")
  public ExtractionResult extract(
      ModelImage image,
      String model,
      ExtractionMode mode,
      List<MissingChartGroup> missing,
      CancellationToken token) {
    token.throwIfCancelled();
    String modeTag = mode.name().toLowerCase(Locale.ROOT);
    meterRegistry.counter("extraction.attempts", "mode", modeTag, "model", model).increment();

    ChatRequest request =
        ChatRequest.builder()
            .messages(
                SystemMessage.from(ExtractionPrompts.SYSTEM),
                UserMessage.from(
                    TextContent.from(
                        ExtractionPrompts.userPrompt(
                            mode, missing == null ? List.of() : missing, maxPromptRanges)),
                    ImageContent.from(image.base64(), image.mimeType())))
            .parameters(
                ChatRequestParameters.builder()
                    .modelName(model)
                    .temperature(0.0)
                    .responseFormat(ResponseFormat.JSON)
                    .build())
            .build();

    ChatResponse response = call(request, token);
    String text = response.aiMessage() == null ? null : response.aiMessage().text();
    if (text == null || text.isBlank()) {
      throw new ChartExtractionException("Model returned an empty response");
    }

    List<ExtractedRow> rows = parseRows(text);
    log.debug("{} extraction with {} returned {} usable rows", mode, model, rows.size());
    return new ExtractionResult(rows, auditJson(rows, response.tokenUsage(), model, mode));
  }

  private ChatResponse call(ChatRequest request, CancellationToken token) {
    CompletableFuture<ChatResponse> future =
        CompletableFuture.supplyAsync(() -> chatModel.chat(request), llmCallExecutor);
    Runnable unregister = token.onCancel(() -> future.cancel(true));
    try {
      return future.get();
    } catch (CancellationException e) {
      throw new JobCancelledException(token.getReason());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new JobCancelledException(token.getReason());
    } catch (ExecutionException e) {
      throw translate(e.getCause() == null ? e : e.getCause());
    } finally {
      unregister.run();
    }
  }

  private RuntimeException translate(Throwable cause) {
    if (isTimeout(cause)) {
      log.warn("Extraction call timed out: {}", cause.getMessage());
      return new ChartExtractionException("Extraction call timed out", cause);
    }
    if (cause instanceof HttpException http) {
      boolean rateLimited = http.statusCode() == 429;
      log.warn("Extraction call failed with HTTP {}: {}", http.statusCode(), http.getMessage());
      return new ChartExtractionException(
          "Extraction call failed with HTTP " + http.statusCode(), rateLimited, http);
    }
    log.warn("Extraction call failed: {}", cause.getMessage());
    return new ChartExtractionException(
        "Extraction call failed: " + cause.getMessage(), false, cause);
  }

  private static boolean isTimeout(Throwable failure) {
    for (Throwable t = failure; t != null; t = t.getCause()) {
      if (t instanceof HttpTimeoutException
          || t instanceof SocketTimeoutException
          || t instanceof TimeoutException) {
        return true;
      }
      if (t.getCause() == t) {
        break;
      }
    }
    return false;
  }

  /** Strict parse: the reply must be an object with a {@code rows} array of row objects. */
  List<ExtractedRow> parseRows(String text) {
    JsonNode root;
    try {
      root = objectMapper.readTree(stripCodeFence(text));
    } catch (JsonProcessingException e) {
      throw new ChartExtractionException("Model response is not valid JSON", e);
    }
    JsonNode rowsNode = root == null ? null : root.get("rows");
    if (rowsNode == null || !rowsNode.isArray()) {
      throw new ChartExtractionException("Model response has no rows array");
    }

    List<ExtractedRow> rows = new ArrayList<>();
    for (JsonNode node : rowsNode) {
      if (!node.isObject()) {
        throw new ChartExtractionException("Model response row is not an object");
      }
      ExtractedRow parsed;
      try {
        parsed = objectMapper.treeToValue(node, ExtractedRow.class);
      } catch (JsonProcessingException e) {
        throw new ChartExtractionException("Model response row does not match the schema", e);
      }
      ExtractedRow normalized = parsed.normalized();
      if (normalized != null) {
        rows.add(normalized);
      }
    }
    return rows;
  }

  private String auditJson(
      List<ExtractedRow> rows, TokenUsage usage, String model, ExtractionMode mode) {
    ObjectNode audit = objectMapper.createObjectNode();
    audit.put("model", model);
    audit.put("mode", mode.name());
    audit.set("rows", objectMapper.valueToTree(rows));
    if (usage != null) {
      ObjectNode usageNode = audit.putObject("usage");
      usageNode.put("inputTokens", Objects.requireNonNullElse(usage.inputTokenCount(), 0));
      usageNode.put("outputTokens", Objects.requireNonNullElse(usage.outputTokenCount(), 0));
      usageNode.put("totalTokens", Objects.requireNonNullElse(usage.totalTokenCount(), 0));
    }
    try {
      return objectMapper.writeValueAsString(audit);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize extraction audit", e);
    }
  }

  private static String stripCodeFence(String text) {
    String trimmed = text.trim();
    if (!trimmed.startsWith("```")) {
      return trimmed;
    }
    int firstNewline = trimmed.indexOf('\n');
    int lastFence = trimmed.lastIndexOf("```");
    if (firstNewline < 0 || lastFence <= firstNewline) {
      return trimmed;
    }
    return trimmed.substring(firstNewline + 1, lastFence).trim();
  }
}
