package com.scholary.jobrunner.api;

import com.scholary.jobrunner.job.InvalidJobTypeException;
import com.scholary.jobrunner.job.InvalidStateTransitionException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps job domain exceptions to HTTP responses for the job API. */
@RestControllerAdvice(basePackageClasses = JobController.class)
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidJobTypeException.class)
  public ResponseEntity<ErrorResponse> handleInvalidJobType(InvalidJobTypeException ex) {
    LOGGER.warn("Rejected job request: {}", ex.getMessage());
    return ResponseEntity.badRequest()
        .body(new ErrorResponse("INVALID_JOB_TYPE", ex.getMessage()));
  }

  @ExceptionHandler(InvalidStateTransitionException.class)
  public ResponseEntity<ErrorResponse> handleInvalidTransition(
      InvalidStateTransitionException ex) {
    LOGGER.warn("Rejected state change for job {}: {}", ex.getJobId(), ex.getMessage());
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ErrorResponse("INVALID_STATE_TRANSITION", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return ResponseEntity.badRequest().body(new ErrorResponse("VALIDATION_ERROR", message));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.badRequest()
        .body(new ErrorResponse("INVALID_REQUEST", "Request body is missing or malformed"));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_REQUEST", ex.getMessage()));
  }
}
