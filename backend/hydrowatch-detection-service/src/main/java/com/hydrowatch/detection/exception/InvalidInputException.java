package com.hydrowatch.detection.exception;

/** A numeric input that is not finite or is physically impossible. */
public class InvalidInputException extends DetectionException {

  public InvalidInputException(String message) {
    super(message);
  }
}
