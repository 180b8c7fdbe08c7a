package com.hydrowatch.detection.exception;

/** Failure raised by the detection core. The REST layer maps it to an error response. */
public class DetectionException extends RuntimeException {

  public DetectionException(String message) {
    super(message);
  }

  public DetectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
