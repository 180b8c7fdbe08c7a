package com.hydrowatch.detection.classify;

/** Operating envelope of a healthy distribution node. */
public final class NormalRanges {

  public static final double FLOW_MIN = 5.0;
  public static final double FLOW_MAX = 50.0;
  public static final double PRESSURE_MIN = 2.0;
  public static final double PRESSURE_MAX = 8.0;
  public static final double TURBIDITY_MAX = 5.0;
  public static final double TEMPERATURE_MIN = 15.0;
  public static final double TEMPERATURE_MAX = 35.0;

  /** Expected flow per bar of pressure (L/min). */
  public static final double FLOW_PER_BAR = 5.0;
  public static final double FLOW_MISMATCH_TOLERANCE = 20.0;

  private NormalRanges() {}
}
