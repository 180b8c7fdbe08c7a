package com.hydrowatch.detection.util;

import com.hydrowatch.detection.exception.InvalidInputException;

/**
 * Fail-fast checks for numbers entering the detection core. The REST layer validates first;
 * these guard the core against callers that bypass it.
 */
public final class InputChecks {

  private InputChecks() {}

  public static double finite(String name, double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new InvalidInputException(name + " must be a finite number, got " + value);
    }
    return value;
  }

  public static double nonNegative(String name, double value) {
    finite(name, value);
    if (value < 0) {
      throw new InvalidInputException(name + " must not be negative, got " + value);
    }
    return value;
  }

  public static Double optionalFinite(String name, Double value) {
    if (value != null) finite(name, value);
    return value;
  }

  public static double[] finiteSeries(String name, double[] values) {
    if (values == null) {
      throw new InvalidInputException(name + " is required");
    }
    for (int i = 0; i < values.length; i++) {
      if (Double.isNaN(values[i]) || Double.isInfinite(values[i])) {
        throw new InvalidInputException(name + "[" + i + "] must be a finite number");
      }
    }
    return values;
  }
}
