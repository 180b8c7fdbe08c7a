package com.hydrowatch.detection.exception;

import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps detection failures to HTTP responses: bad input is a 400, anything raised inside the
 * detectors a 500. Stack traces are logged, never returned.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(InvalidInputException.class)
  public ResponseEntity<ErrorResponse> handleInvalidInput(InvalidInputException e, HttpServletRequest req) {
    log.debug("Rejected request {}: {}", req.getRequestURI(), e.getMessage());
    return build(HttpStatus.BAD_REQUEST, e.getMessage(), req);
  }

  @ExceptionHandler({HttpMessageNotReadableException.class,
                     MethodArgumentTypeMismatchException.class,
                     MissingServletRequestParameterException.class})
  public ResponseEntity<ErrorResponse> handleUnreadable(Exception e, HttpServletRequest req) {
    log.debug("Malformed request {}: {}", req.getRequestURI(), e.getMessage());
    return build(HttpStatus.BAD_REQUEST, "malformed request: " + rootMessage(e), req);
  }

  @ExceptionHandler(DetectionException.class)
  public ResponseEntity<ErrorResponse> handleDetection(DetectionException e, HttpServletRequest req) {
    log.error("Detection failed on {}: {}", req.getRequestURI(), e.getMessage(), e);
    return build(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), req);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception e, HttpServletRequest req) {
    log.error("Unhandled error on {}", req.getRequestURI(), e);
    return build(HttpStatus.INTERNAL_SERVER_ERROR, "internal error", req);
  }

  private static ResponseEntity<ErrorResponse> build(HttpStatus status, String message, HttpServletRequest req) {
    ErrorResponse body = new ErrorResponse(Instant.now(), status.value(), status.getReasonPhrase(),
        message, req.getRequestURI());
    return ResponseEntity.status(status).body(body);
  }

  private static String rootMessage(Throwable e) {
    Throwable t = e;
    while (t.getCause() != null && t.getCause() != t) t = t.getCause();
    String msg = t.getMessage();
    return msg == null ? t.getClass().getSimpleName() : msg.lines().findFirst().orElse(msg);
  }
}
