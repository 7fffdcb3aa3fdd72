/*
 * Where: Alarm pipeline API
 * What: Maps domain exceptions to HTTP status codes and ApiErrorResponse bodies
 */
package com.example.alarm.api;

import com.example.alarm.incident.IncidentNotFoundException;
import com.example.alarm.incident.InvalidTransitionException;
import com.example.alarm.ingest.UplinkDecodeException;
import com.example.alarm.routing.RoutingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidTransitionException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidTransition(InvalidTransitionException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse("ALARM_INVALID_TRANSITION", ex.getMessage()));
  }

  @ExceptionHandler(IncidentNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleIncidentNotFound(IncidentNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("ALARM_INCIDENT_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(DeviceNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleDeviceNotFound(DeviceNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("ALARM_DEVICE_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(UplinkDecodeException.class)
  public ResponseEntity<ApiErrorResponse> handleDecode(UplinkDecodeException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            new ApiErrorResponse(
                "ALARM_DECODE_" + ex.getKind().name(), ex.getMessage()));
  }

  @ExceptionHandler(RoutingException.class)
  public ResponseEntity<ApiErrorResponse> handleRouting(RoutingException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(new ApiErrorResponse("ALARM_ROUTING_FAILED", ex.getMessage()));
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    MissingRequestHeaderException.class,
    MethodArgumentTypeMismatchException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("ALARM_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("ALARM_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled api error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("ALARM_INTERNAL_ERROR", ex.getMessage()));
  }
}
