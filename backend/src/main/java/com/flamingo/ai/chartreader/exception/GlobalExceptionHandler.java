package com.flamingo.ai.chartreader.exception;

import com.flamingo.ai.chartreader.domain.enums.JobStatus;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ApiError> handleJobNotFound(
      JobNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("job_not_found");
    String errorId = generateErrorId();
    log.warn("Job not found [{}]: {}", errorId, ex.getJobId());

    return respond(HttpStatus.NOT_FOUND, errorId, ApiError.JOB_NOT_FOUND, "Job not found", request);
  }

  @ExceptionHandler(JobStateException.class)
  public ResponseEntity<ApiError> handleJobState(
      JobStateException ex, HttpServletRequest request) {

    incrementErrorCounter("job_state_conflict");
    String errorId = generateErrorId();
    log.warn("Job state conflict [{}]: {}", errorId, ex.getMessage());

    HttpStatus status =
        ex.getStatus() == JobStatus.DELETED ? HttpStatus.BAD_REQUEST : HttpStatus.CONFLICT;
    return respond(status, errorId, ApiError.JOB_STATE_CONFLICT, ex.getUserMessage(), request);
  }

  @ExceptionHandler(JobValidationException.class)
  public ResponseEntity<ApiError> handleJobValidation(
      JobValidationException ex, HttpServletRequest request) {

    incrementErrorCounter("job_validation");
    String errorId = generateErrorId();
    log.warn("Job validation error [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.JOB_VALIDATION_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(ChartExtractionException.class)
  public ResponseEntity<ApiError> handleExtraction(
      ChartExtractionException ex, HttpServletRequest request) {

    String errorType = ex.isRateLimited() ? "extraction_rate_limited" : "extraction_error";
    incrementErrorCounter(errorType);
    String errorId = generateErrorId();
    log.error("Extraction error [{}]: {}", errorId, ex.getMessage(), ex);

    String code =
        ex.isRateLimited() ? ApiError.EXTRACTION_RATE_LIMITED : ApiError.EXTRACTION_UNAVAILABLE;
    return respond(HttpStatus.SERVICE_UNAVAILABLE, errorId, code, ex.getUserMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleUploadTooLarge(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("upload_too_large");
    String errorId = generateErrorId();
    log.warn("Upload rejected [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.PAYLOAD_TOO_LARGE,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Uploaded file is too large",
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
