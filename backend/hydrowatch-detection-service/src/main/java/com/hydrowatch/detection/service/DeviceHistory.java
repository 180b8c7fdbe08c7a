package com.hydrowatch.detection.service;

/** Chronological per-channel series for one device, oldest first. */
public record DeviceHistory(double[] pressure, double[] flowRate, double[] turbidity, double[] temperature) {

  public static DeviceHistory empty() {
    return new DeviceHistory(new double[0], new double[0], new double[0], new double[0]);
  }

  public int size() {
    return pressure.length;
  }
}
