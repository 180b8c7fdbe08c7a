package com.hydrowatch.detection.controller;

import com.hydrowatch.detection.controller.dto.AnalyzeRequest;
import com.hydrowatch.detection.controller.dto.MaintenanceRequest;
import com.hydrowatch.detection.exception.InvalidInputException;
import com.hydrowatch.detection.model.HistoricalRecord;
import com.hydrowatch.detection.model.TelemetrySample;
import com.hydrowatch.detection.util.InputChecks;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Turns request bodies into core inputs. Anything missing, non-finite or physically impossible
 * is rejected with {@link InvalidInputException} before it reaches a detector.
 */
@Component
public class TelemetryRequestValidator {

  private final Clock clock;

  public TelemetryRequestValidator() {
    this(Clock.systemUTC());
  }

  TelemetryRequestValidator(Clock clock) {
    this.clock = clock;
  }

  public TelemetrySample toSample(AnalyzeRequest req) {
    if (req == null) throw new InvalidInputException("request body is required");
    if (req.deviceId() == null || req.deviceId().isBlank()) {
      throw new InvalidInputException("device_id is required");
    }
    double flow = InputChecks.nonNegative("flow_rate", required("flow_rate", req.flowRate()));
    double pressure = InputChecks.nonNegative("pressure", required("pressure", req.pressure()));
    double turbidity = InputChecks.nonNegative("turbidity", required("turbidity", req.turbidity()));
    double temperature = InputChecks.finite("temperature", required("temperature", req.temperature()));

    Double ph = InputChecks.optionalFinite("ph", req.ph());
    if (ph != null && (ph < 0 || ph > 14)) {
      throw new InvalidInputException("ph must be within 0-14, got " + ph);
    }
    Double conductivity = InputChecks.optionalFinite("conductivity", req.conductivity());
    if (conductivity != null && conductivity < 0) {
      throw new InvalidInputException("conductivity must not be negative, got " + conductivity);
    }
    Double lat = InputChecks.optionalFinite("gps_lat", req.gpsLat());
    Double lon = InputChecks.optionalFinite("gps_lon", req.gpsLon());
    if (lat != null && Math.abs(lat) > 90) throw new InvalidInputException("gps_lat out of range: " + lat);
    if (lon != null && Math.abs(lon) > 180) throw new InvalidInputException("gps_lon out of range: " + lon);

    return new TelemetrySample(req.deviceId(), flow, pressure, turbidity, temperature,
        ph, conductivity, lat, lon, parseTimestamp(req.timestamp()));
  }

  /** A list of finite numbers; null elements are rejected, a null list becomes empty. */
  public double[] toSeries(String name, List<Double> values) {
    if (values == null) return new double[0];
    double[] out = new double[values.size()];
    for (int i = 0; i < out.length; i++) {
      Double v = values.get(i);
      if (v == null) throw new InvalidInputException(name + "[" + i + "] is null");
      out[i] = InputChecks.finite(name + "[" + i + "]", v);
    }
    return out;
  }

  public List<HistoricalRecord> toHistory(MaintenanceRequest req) {
    if (req == null || req.historicalData() == null) return List.of();
    List<HistoricalRecord> out = new ArrayList<>(req.historicalData().size());
    for (MaintenanceRequest.HistoricalPoint p : req.historicalData()) {
      if (p == null) continue;
      out.add(new HistoricalRecord(
          InputChecks.finite("flow_rate", orZero(p.flowRate())),
          InputChecks.finite("pressure", orZero(p.pressure())),
          InputChecks.finite("turbidity", orZero(p.turbidity())),
          InputChecks.finite("temperature", orZero(p.temperature())),
          p.pumpStatus()));
    }
    return out;
  }

  /** Nulls become NaN so that the model rejects the row set as a whole. */
  public List<double[]> toRows(List<List<Double>> rows) {
    if (rows == null) return List.of();
    List<double[]> out = new ArrayList<>(rows.size());
    for (List<Double> row : rows) {
      if (row == null) {
        out.add(new double[0]);
        continue;
      }
      double[] values = new double[row.size()];
      for (int i = 0; i < values.length; i++) {
        Double v = row.get(i);
        values[i] = v == null ? Double.NaN : v;
      }
      out.add(values);
    }
    return out;
  }

  private Instant parseTimestamp(String raw) {
    if (raw == null || raw.isBlank()) return clock.instant();
    try {
      return Instant.parse(raw);
    } catch (DateTimeParseException e) {
      throw new InvalidInputException("timestamp must be ISO-8601, got '" + raw + "'");
    }
  }

  private static double required(String name, Double value) {
    if (value == null) throw new InvalidInputException(name + " is required");
    return value;
  }

  private static double orZero(Double value) {
    return value == null ? 0.0 : value;
  }
}
