package com.example.portalsync.web.rest.errors;

import com.example.portalsync.web.filter.RequestIdFilter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global Error Handler
 *
 * Request-level failures the controller never sees. Bodies follow the result shape with
 * {@code success=false} and never echo credentials.
 */
@Slf4j
@RestControllerAdvice
@RequestMapping(produces = MediaType.APPLICATION_JSON_VALUE)
public class GlobalErrorHandler {

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> handleValidationException(
      MethodArgumentNotValidException ex, WebRequest request) {

    String errors = ex.getBindingResult().getFieldErrors().stream()
        .map(FieldError::getDefaultMessage)
        .collect(Collectors.joining(", "));

    return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", errors, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadableBody(
      HttpMessageNotReadableException ex, WebRequest request) {
    log.debug("Unreadable request body: {}", ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Request body is missing or malformed", request);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<Map<String, Object>> handleMissingParams(
      MissingServletRequestParameterException ex, WebRequest request) {
    return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST",
        String.format("Missing required parameter: %s", ex.getParameterName()), request);
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<Map<String, Object>> handleMissingHeader(
      MissingRequestHeaderException ex, WebRequest request) {
    return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST",
        String.format("Missing required header: %s", ex.getHeaderName()), request);
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<Map<String, Object>> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex, WebRequest request) {
    return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST",
        String.format("Invalid value for parameter: %s", ex.getName()), request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {
    return respond(HttpStatus.METHOD_NOT_ALLOWED, "METHOD_NOT_ALLOWED",
        String.format("Method %s not supported", ex.getMethod()), request);
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMediaTypeNotSupported(
      HttpMediaTypeNotSupportedException ex, WebRequest request) {
    return respond(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "INVALID_REQUEST",
        String.format("Content type %s not supported", ex.getContentType()), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGenericException(
      Exception ex, WebRequest request) {
    log.error("Unexpected error", ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
        "An error occurred processing your request", request);
  }

  private ResponseEntity<Map<String, Object>> respond(
      HttpStatus status, String error, String message, WebRequest request) {
    return new ResponseEntity<>(createErrorBody(status, error, message, request), status);
  }

  private Map<String, Object> createErrorBody(
      HttpStatus status, String error, String message, WebRequest request) {

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", false);
    body.put("status", status.value());
    body.put("reason", error);
    body.put("message", message);
    body.put("path", extractPath(request));
    String requestId = requestId(request);
    if (requestId != null) {
      body.put("requestId", requestId);
    }
    body.put("timestamp", Instant.now());

    return body;
  }

  private String extractPath(WebRequest request) {
    String description = request.getDescription(false);
    return description.replace("uri=", "");
  }

  private String requestId(WebRequest request) {
    Object attribute = request.getAttribute(RequestIdFilter.REQUEST_ID_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
    if (attribute instanceof String requestId) {
      return requestId;
    }
    return MDC.get(RequestIdFilter.MDC_KEY);
  }
}
