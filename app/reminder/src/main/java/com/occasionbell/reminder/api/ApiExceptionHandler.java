package com.occasionbell.reminder.api;

import com.occasionbell.reminder.client.PlatformIntegrationException;
import com.occasionbell.reminder.service.NotificationSendException;
import com.occasionbell.reminder.service.ReminderEventPermanentException;
import com.occasionbell.reminder.service.SettingsStoreException;
import com.occasionbell.reminder.service.SettingsValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(SettingsValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleSettingsValidation(
      SettingsValidationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("REMINDER_VALIDATION_ERROR", ex.getMessage()));
  }

  @ExceptionHandler(ReminderEventPermanentException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidSignal(ReminderEventPermanentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("REMINDER_VALIDATION_ERROR", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("REMINDER_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("REMINDER_VALIDATION_ERROR", "request body is malformed"));
  }

  @ExceptionHandler(NotificationSendException.class)
  public ResponseEntity<ApiErrorResponse> handleSendFailure(NotificationSendException ex) {
    logger.warn("notification send failed for admin command", ex);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(new ApiErrorResponse("REMINDER_SEND_FAILED", ex.getMessage()));
  }

  @ExceptionHandler(PlatformIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handlePlatform(PlatformIntegrationException ex) {
    final HttpStatus status =
        ex.reason() == PlatformIntegrationException.Reason.TIMEOUT
            ? HttpStatus.GATEWAY_TIMEOUT
            : HttpStatus.BAD_GATEWAY;
    return ResponseEntity.status(status)
        .body(new ApiErrorResponse("REMINDER_PLATFORM_" + ex.reason().name(), ex.getMessage()));
  }

  @ExceptionHandler(SettingsStoreException.class)
  public ResponseEntity<ApiErrorResponse> handleStore(SettingsStoreException ex) {
    logger.error("settings could not be persisted", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("REMINDER_SETTINGS_WRITE_FAILED", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unexpected admin command failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("REMINDER_INTERNAL_ERROR", ex.getMessage()));
  }
}
