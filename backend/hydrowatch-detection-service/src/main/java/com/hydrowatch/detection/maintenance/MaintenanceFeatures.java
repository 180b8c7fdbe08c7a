package com.hydrowatch.detection.maintenance;

import com.hydrowatch.detection.model.HistoricalRecord;
import com.hydrowatch.detection.stats.SeriesStats;
import java.util.List;

/**
 * Aggregates a device history into the fixed feature vector the maintenance forest expects:
 * mean flow, flow std, mean pressure, pressure std, mean turbidity, pump-on fraction.
 */
public final class MaintenanceFeatures {

  public static final int COUNT = 6;
  public static final List<String> NAMES = List.of(
      "mean_flow_rate", "std_flow_rate", "mean_pressure", "std_pressure", "mean_turbidity", "pump_on_ratio");

  private MaintenanceFeatures() {}

  public static double[] extract(List<HistoricalRecord> history) {
    int n = history.size();
    double[] flow = new double[n];
    double[] pressure = new double[n];
    double[] turbidity = new double[n];
    int pumpOn = 0;
    for (int i = 0; i < n; i++) {
      HistoricalRecord r = history.get(i);
      flow[i] = r.flowRate();
      pressure[i] = r.pressure();
      turbidity[i] = r.turbidity();
      if (r.pumpOn()) pumpOn++;
    }
    return new double[] {
        SeriesStats.mean(flow),
        SeriesStats.populationStd(flow),
        SeriesStats.mean(pressure),
        SeriesStats.populationStd(pressure),
        SeriesStats.mean(turbidity),
        n == 0 ? 0.0 : (double) pumpOn / n
    };
  }
}
