package com.scholary.tracklist.api;

import com.scholary.tracklist.audio.AudioSourceException;
import com.scholary.tracklist.config.ConfigurationException;
import com.scholary.tracklist.objectstore.ObjectNotFoundException;
import com.scholary.tracklist.objectstore.ObjectStoreException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions escaping the controllers to {@link ApiError} responses.
 *
 * <p>Invalid options are the client's fault (400). Unreadable audio is a storage problem (404 when
 * the object is missing, 502 otherwise). Anything else is a 500 without internal details.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ConfigurationException.class)
  public ResponseEntity<ApiError> handleConfiguration(ConfigurationException ex) {
    LOGGER.warn("Rejected request: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ApiError.of("InvalidConfiguration", "Invalid pipeline options", ex.getViolations()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
    List<String> details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .toList();
    LOGGER.warn("Rejected request: {}", details);
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ApiError.of("ValidationFailed", "Invalid request", details));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
    LOGGER.warn("Unreadable request body: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ApiError.of("MalformedRequest", "Request body could not be parsed", List.of()));
  }

  @ExceptionHandler(AudioSourceException.class)
  public ResponseEntity<ApiError> handleAudioSource(AudioSourceException ex) {
    if (ex.getCause() instanceof ObjectNotFoundException) {
      LOGGER.warn("Audio not found: {}", ex.getMessage());
      return ResponseEntity.status(HttpStatus.NOT_FOUND)
          .body(ApiError.of("AudioNotFound", ex.getMessage(), List.of()));
    }
    LOGGER.error("Audio source failure", ex);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(ApiError.of("AudioSourceUnavailable", "Could not read the mix", List.of()));
  }

  @ExceptionHandler(ObjectStoreException.class)
  public ResponseEntity<ApiError> handleObjectStore(ObjectStoreException ex) {
    LOGGER.error("Object store failure", ex);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(ApiError.of("ObjectStoreUnavailable", "Object storage unavailable", List.of()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
    if (ex instanceof ErrorResponse errorResponse) {
      // Spring MVC's own errors: unknown path, wrong method, unsupported media type.
      return ResponseEntity.status(errorResponse.getStatusCode())
          .body(ApiError.of(ex.getClass().getSimpleName(), ex.getMessage(), List.of()));
    }
    LOGGER.error("Unexpected error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ApiError.of("InternalServerError", "An unexpected error occurred", List.of()));
  }
}
