package com.hydrowatch.detection.service;

import com.hydrowatch.detection.model.AnomalyEvent;
import com.hydrowatch.detection.model.DetectedIssue;
import com.hydrowatch.detection.repo.AnomalyEventRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.InputStream;
import java.time.Duration;
import java.util.Objects;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/**
 * Records detected issues: one row in the anomalies table and one Avro record on the
 * anomalies topic. Repeats of the same device and type inside the cooldown are dropped.
 * Storage and broker failures are logged and never reach the caller.
 */
@Service
public class AnomalyEventPublisher {

  private static final Logger log = LoggerFactory.getLogger(AnomalyEventPublisher.class);

  private final StringRedisTemplate redis;
  private final AnomalyEventRepository anomalyRepo;
  private final KafkaTemplate<String, GenericRecord> kafka;
  private final String anomalyTopic;
  private final long cooldownSeconds;
  private final Schema anomalySchema;
  private final Counter anomaliesEmitted;
  private final Counter anomaliesSuppressedCooldown;

  public AnomalyEventPublisher(StringRedisTemplate redis,
                               AnomalyEventRepository anomalyRepo,
                               KafkaTemplate<String, GenericRecord> kafka,
                               @Value("${hydrowatch.anomalies.topic:detected_anomalies}") String anomalyTopic,
                               @Value("${hydrowatch.anomalies.cooldown-seconds:300}") long cooldownSeconds,
                               MeterRegistry metrics) {
    this.redis = redis;
    this.anomalyRepo = anomalyRepo;
    this.kafka = kafka;
    this.anomalyTopic = anomalyTopic;
    this.cooldownSeconds = cooldownSeconds;
    this.anomalySchema = loadSchema("/avro/detected_anomaly.avsc");
    this.anomaliesEmitted = metrics.counter("hydrowatch_anomalies_emitted_total");
    this.anomaliesSuppressedCooldown = metrics.counter("hydrowatch_anomalies_suppressed_total", "reason", "cooldown");
  }

  static Schema loadSchema(String path) {
    try (InputStream in = Objects.requireNonNull(AnomalyEventPublisher.class.getResourceAsStream(path))) {
      return new Schema.Parser().parse(in);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to load Avro schema: " + path, e);
    }
  }

  /** @return false when the issue was suppressed by the cooldown */
  public boolean publish(DetectedIssue issue) {
    if (!acquireCooldown(issue)) {
      anomaliesSuppressedCooldown.increment();
      log.debug("Anomaly suppressed (cooldown): device='{}' type={}", issue.deviceId(), issue.type());
      return false;
    }

    AnomalyEvent ev = new AnomalyEvent();
    ev.setDeviceId(issue.deviceId());
    ev.setAnomalyType(issue.type());
    ev.setSeverity(issue.severity().code());
    ev.setConfidence(issue.confidence());
    ev.setDescription(truncate(issue.description(), 512));
    ev.setSource(issue.source());
    ev.setGpsLat(issue.gpsLat());
    ev.setGpsLon(issue.gpsLon());
    ev.setDetectedAt(issue.detectedAt());

    try {
      anomalyRepo.save(ev);
    } catch (DataAccessException e) {
      log.warn("Failed to store anomaly for device '{}': {}", issue.deviceId(), e.getMessage());
    }

    try {
      kafka.send(anomalyTopic, issue.deviceId(), toRecord(issue));
      anomaliesEmitted.increment();
      log.info("Anomaly emitted: device='{}' type={} severity={} source={}",
          issue.deviceId(), issue.type(), issue.severity().code(), issue.source());
    } catch (Exception ex) {
      log.warn("Kafka anomaly publish failed (non-fatal): {}", ex.getMessage());
    }
    return true;
  }

  GenericRecord toRecord(DetectedIssue issue) {
    GenericData.Record record = new GenericData.Record(anomalySchema);
    record.put("device_id", issue.deviceId());
    record.put("anomaly_type", issue.type());
    record.put("severity", issue.severity().code());
    record.put("confidence", issue.confidence());
    record.put("description", issue.description());
    record.put("source", issue.source());
    record.put("gps_lat", issue.gpsLat());
    record.put("gps_lon", issue.gpsLon());
    record.put("timestamp", issue.detectedAt().toEpochMilli());
    return record;
  }

  // A Redis outage must not silence alerts, so errors here let the event through.
  private boolean acquireCooldown(DetectedIssue issue) {
    if (cooldownSeconds <= 0) return true;
    String key = "anomaly:cooldown:" + issue.deviceId() + ":" + issue.type();
    try {
      Boolean acquired = redis.opsForValue().setIfAbsent(key, issue.source(), Duration.ofSeconds(cooldownSeconds));
      return !Boolean.FALSE.equals(acquired);
    } catch (Exception e) {
      log.debug("Cooldown check failed for {}: {}", key, e.getMessage());
      return true;
    }
  }

  private static String truncate(String s, int max) {
    if (s == null || s.length() <= max) return s;
    return s.substring(0, max);
  }
}
