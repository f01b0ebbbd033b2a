package com.scholary.subtitle.api;

import java.time.Instant;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Converts exceptions thrown at the REST boundary into error responses.
 *
 * <p>Pipeline failures never reach this class; they are reported through the job status.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleInvalidRequest(MethodArgumentNotValidException ex) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    LOGGER.warn("Invalid request: {}", message);
    return badRequest("ValidationFailed", message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
    LOGGER.warn("Unreadable request body: {}", ex.getMessage());
    return badRequest("MalformedRequest", "Request body could not be read");
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
    LOGGER.warn("Rejected request: {}", ex.getMessage());
    return badRequest("InvalidArgument", ex.getMessage());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
    LOGGER.error("Unexpected error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiError("InternalServerError", "An unexpected error occurred", Instant.now()));
  }

  private static ResponseEntity<ApiError> badRequest(String code, String message) {
    return ResponseEntity.badRequest().body(new ApiError(code, message, Instant.now()));
  }
}
