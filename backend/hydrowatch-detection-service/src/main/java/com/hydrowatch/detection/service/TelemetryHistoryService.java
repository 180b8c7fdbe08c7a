package com.hydrowatch.detection.service;

import com.hydrowatch.detection.engine.DetectionOrchestrator;
import com.hydrowatch.detection.model.AnomalyType;
import com.hydrowatch.detection.model.ContaminationPatternResult;
import com.hydrowatch.detection.model.DetectedIssue;
import com.hydrowatch.detection.model.HistoricalLeakResult;
import com.hydrowatch.detection.model.Severity;
import com.hydrowatch.detection.model.TelemetrySample;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Keeps a rolling window of readings per device in Redis and periodically runs the history
 * based detectors (pressure leak fusion, turbidity spike/trend) over every recently active
 * device. Only one instance sweeps at a time, guarded by a Redis lock.
 *
 * <p>Each list entry is {@code pressure,flow,turbidity,temperature}; index 0 is the newest.
 */
@Service
public class TelemetryHistoryService {

  private static final Logger log = LoggerFactory.getLogger(TelemetryHistoryService.class);

  static final String HISTORY_KEY_PREFIX = "telemetry:history:";
  static final String GPS_HASH = "telemetry:gps";

  private final StringRedisTemplate redis;
  private final DetectionOrchestrator orchestrator;
  private final AnomalyEventPublisher publisher;
  private final Clock clock;
  private final int historyWindow;
  private final long historyTtlSeconds;
  private final String activityZsetKey;
  private final long activityHorizonSeconds;
  private final long activityRetentionSeconds;
  private final String lockKey;
  private final long lockTtlMs;
  private final MeterRegistry metrics;
  private final Counter sweepRuns;
  private final Counter recordFailures;
  private final Timer sweepDuration;

  @Autowired
  public TelemetryHistoryService(StringRedisTemplate redis,
                                 DetectionOrchestrator orchestrator,
                                 AnomalyEventPublisher publisher,
                                 @Value("${hydrowatch.history.window:100}") int historyWindow,
                                 @Value("${hydrowatch.history.ttl-seconds:172800}") long historyTtlSeconds,
                                 @Value("${hydrowatch.history.activity-zset-key:telemetry:lastSeen}") String activityZsetKey,
                                 @Value("${hydrowatch.history.activity-horizon-seconds:3600}") long activityHorizonSeconds,
                                 @Value("${hydrowatch.history.activity-retention-seconds:86400}") long activityRetentionSeconds,
                                 @Value("${hydrowatch.scheduler.lock-key:hydrowatch:sweep:lock}") String lockKey,
                                 @Value("${hydrowatch.scheduler.lock-ttl-ms:30000}") long lockTtlMs,
                                 MeterRegistry metrics) {
    this(redis, orchestrator, publisher, Clock.systemUTC(), historyWindow, historyTtlSeconds,
        activityZsetKey, activityHorizonSeconds, activityRetentionSeconds, lockKey, lockTtlMs, metrics);
  }

  TelemetryHistoryService(StringRedisTemplate redis,
                          DetectionOrchestrator orchestrator,
                          AnomalyEventPublisher publisher,
                          Clock clock,
                          int historyWindow,
                          long historyTtlSeconds,
                          String activityZsetKey,
                          long activityHorizonSeconds,
                          long activityRetentionSeconds,
                          String lockKey,
                          long lockTtlMs,
                          MeterRegistry metrics) {
    this.redis = redis;
    this.orchestrator = orchestrator;
    this.publisher = publisher;
    this.clock = clock;
    this.historyWindow = historyWindow;
    this.historyTtlSeconds = historyTtlSeconds;
    this.activityZsetKey = activityZsetKey;
    this.activityHorizonSeconds = activityHorizonSeconds;
    this.activityRetentionSeconds = activityRetentionSeconds;
    this.lockKey = lockKey;
    this.lockTtlMs = lockTtlMs;
    this.metrics = metrics;
    this.sweepRuns = metrics.counter("hydrowatch_history_sweep_runs_total");
    this.recordFailures = metrics.counter("hydrowatch_history_record_failures_total");
    this.sweepDuration = metrics.timer("hydrowatch_history_sweep_duration_seconds");
  }

  /** Appends the sample to its device's window. Redis errors are counted and logged only. */
  public void record(TelemetrySample sample) {
    if (sample.deviceId() == null || sample.deviceId().isBlank()) return;
    String histKey = HISTORY_KEY_PREFIX + sample.deviceId();
    String entry = String.format(Locale.ROOT, "%s,%s,%s,%s",
        sample.pressure(), sample.flowRate(), sample.turbidity(), sample.temperature());
    try {
      redis.opsForList().leftPush(histKey, entry);
      redis.opsForList().trim(histKey, 0, historyWindow - 1);
      redis.expire(histKey, Duration.ofSeconds(historyTtlSeconds));
      redis.opsForZSet().add(activityZsetKey, sample.deviceId(), clock.instant().getEpochSecond());
      if (sample.gpsLat() != null && sample.gpsLon() != null) {
        redis.opsForHash().put(GPS_HASH, sample.deviceId(),
            String.format(Locale.ROOT, "%s,%s", sample.gpsLat(), sample.gpsLon()));
      }
    } catch (Exception e) {
      recordFailures.increment();
      log.warn("Failed to record history for device '{}': {}", sample.deviceId(), e.getMessage());
    }
  }

  /** Chronological history of a device; unparsable entries are skipped. */
  public DeviceHistory history(String deviceId) {
    List<String> entries = redis.opsForList().range(HISTORY_KEY_PREFIX + deviceId, 0, -1);
    if (entries == null || entries.isEmpty()) return DeviceHistory.empty();

    List<double[]> rows = new ArrayList<>(entries.size());
    for (int i = entries.size() - 1; i >= 0; i--) {
      double[] row = parseEntry(entries.get(i));
      if (row != null) rows.add(row);
    }
    int n = rows.size();
    double[] pressure = new double[n];
    double[] flow = new double[n];
    double[] turbidity = new double[n];
    double[] temperature = new double[n];
    for (int i = 0; i < n; i++) {
      double[] row = rows.get(i);
      pressure[i] = row[0];
      flow[i] = row[1];
      turbidity[i] = row[2];
      temperature[i] = row[3];
    }
    return new DeviceHistory(pressure, flow, turbidity, temperature);
  }

  @Scheduled(fixedDelayString = "${hydrowatch.scheduler.sweep-interval-ms:30000}",
      initialDelayString = "${hydrowatch.scheduler.initial-delay-ms:15000}")
  public void sweepHistory() {
    Instant start = clock.instant();
    String token = UUID.randomUUID().toString();
    Boolean acquired;
    try {
      acquired = redis.opsForValue().setIfAbsent(lockKey, token, Duration.ofMillis(lockTtlMs));
    } catch (Exception e) {
      log.warn("[sweepHistory] Skipped: lock unavailable ({})", e.getMessage());
      return;
    }
    if (Boolean.FALSE.equals(acquired)) {
      log.info("[sweepHistory] Skipped: another instance is running.");
      return;
    }

    int checked = 0;
    int published = 0;
    try {
      sweepRuns.increment();
      Timer.Sample sample = Timer.start(metrics);
      try {
        long nowSec = start.getEpochSecond();
        Set<String> recent = Optional.ofNullable(
            redis.opsForZSet().rangeByScore(activityZsetKey,
                nowSec - activityHorizonSeconds, Double.POSITIVE_INFINITY)
        ).orElseGet(Set::of);
        for (String deviceId : recent) {
          try {
            published += analyzeDevice(deviceId);
          } catch (Exception e) {
            log.warn("[sweepHistory] Device '{}' skipped: {}", deviceId, e.getMessage());
          }
          checked++;
        }
      } finally {
        sample.stop(sweepDuration);
      }
    } catch (Exception e) {
      log.error("Error in sweepHistory task: {}", e.getMessage());
    } finally {
      try {
        String cur = redis.opsForValue().get(lockKey);
        if (token.equals(cur)) redis.delete(lockKey);
      } catch (Exception e) {
        log.debug("Lock release failed: {}", e.getMessage());
      }
      long ms = Duration.between(start, clock.instant()).toMillis();
      log.info("[sweepHistory] Checked {} devices, {} issues published in {} ms", checked, published, ms);
    }
  }

  /** Runs both history detectors for one device and publishes what they find. */
  int analyzeDevice(String deviceId) {
    DeviceHistory history = history(deviceId);
    if (history.size() == 0) return 0;
    Double[] gps = lastGps(deviceId);
    Instant now = clock.instant();
    int published = 0;

    HistoricalLeakResult leak = orchestrator.evaluateLeakHistory(history.pressure(), history.flowRate());
    if (leak.detected()) {
      String where = leak.leakLocationEstimate() == null ? ""
          : String.format(Locale.ROOT, " (steepest drop %.2f bar at sample %d)",
              leak.leakLocationEstimate().pressureDrop(), leak.leakLocationEstimate().index());
      DetectedIssue issue = new DetectedIssue(deviceId, AnomalyType.LEAK.code(),
          leak.confidence() >= 0.7 ? Severity.HIGH : Severity.MEDIUM,
          leak.confidence(),
          "Pressure history indicates a leak" + where,
          DetectedIssue.SOURCE_HISTORY, gps[0], gps[1], now);
      if (publisher.publish(issue)) published++;
    }

    ContaminationPatternResult pattern =
        orchestrator.evaluateContaminationPattern(history.turbidity(), history.temperature());
    if (pattern.detected()) {
      String what = pattern.spikeDetected() ? "Turbidity spike" : "Rising turbidity trend";
      DetectedIssue issue = new DetectedIssue(deviceId, AnomalyType.CONTAMINATION.code(),
          pattern.spikeDetected() ? Severity.HIGH : Severity.MEDIUM,
          pattern.confidence(),
          String.format(Locale.ROOT, "%s: current %.2f NTU, baseline %.2f NTU",
              what, pattern.currentTurbidity(), pattern.baselineTurbidity()),
          DetectedIssue.SOURCE_HISTORY, gps[0], gps[1], now);
      if (publisher.publish(issue)) published++;
    }
    return published;
  }

  // Periodic pruning of lastSeen so it doesn't grow unbounded
  @Scheduled(fixedDelayString = "${hydrowatch.maintenance.activity-trim-interval-ms:60000}")
  public void trimActivity() {
    long cutoffSec = clock.instant().getEpochSecond() - activityRetentionSeconds;
    try {
      Long removed = redis.opsForZSet()
          .removeRangeByScore(activityZsetKey, Double.NEGATIVE_INFINITY, cutoffSec);
      if (removed != null && removed > 0) {
        log.debug("activity trim removed={}", removed);
      }
    } catch (Exception e) {
      log.warn("Activity trim failed: {}", e.getMessage());
    }
  }

  private Double[] lastGps(String deviceId) {
    try {
      Object raw = redis.opsForHash().get(GPS_HASH, deviceId);
      if (raw instanceof String s) {
        String[] parts = s.split(",");
        if (parts.length == 2) {
          return new Double[] {Double.valueOf(parts[0]), Double.valueOf(parts[1])};
        }
      }
    } catch (Exception e) {
      log.debug("No GPS for device '{}': {}", deviceId, e.getMessage());
    }
    return new Double[] {null, null};
  }

  static double[] parseEntry(String entry) {
    if (entry == null) return null;
    String[] parts = entry.split(",");
    if (parts.length != 4) return null;
    double[] row = new double[4];
    try {
      for (int i = 0; i < 4; i++) {
        row[i] = Double.parseDouble(parts[i].trim());
        if (!Double.isFinite(row[i])) return null;
      }
    } catch (NumberFormatException e) {
      return null;
    }
    return row;
  }
}
