package com.hydrowatch.detection.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.hydrowatch.detection.model.AnomalyEvent;
import com.hydrowatch.detection.model.DetectedIssue;
import com.hydrowatch.detection.model.Severity;
import com.hydrowatch.detection.repo.AnomalyEventRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import org.apache.avro.generic.GenericRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.kafka.core.KafkaTemplate;

@ExtendWith(MockitoExtension.class)
@DisplayName("AnomalyEventPublisher Tests")
class AnomalyEventPublisherTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Mock StringRedisTemplate redis;
  @Mock ValueOperations<String, String> valueOps;
  @Mock AnomalyEventRepository repo;
  @Mock KafkaTemplate<String, GenericRecord> kafka;

  private SimpleMeterRegistry metrics;
  private AnomalyEventPublisher publisher;

  private final DetectedIssue issue = new DetectedIssue("node-7", "leak", Severity.HIGH, 0.7,
      "Pressure history indicates a leak", DetectedIssue.SOURCE_HISTORY, -1.29, 36.82, NOW);

  @BeforeEach
  void setUp() {
    metrics = new SimpleMeterRegistry();
    publisher = new AnomalyEventPublisher(redis, repo, kafka, "detected_anomalies", 300, metrics);
  }

  @Test
  @DisplayName("Stores the event and publishes it keyed by device")
  void publishes() {
    when(redis.opsForValue()).thenReturn(valueOps);
    when(valueOps.setIfAbsent(eq("anomaly:cooldown:node-7:leak"), anyString(), eq(Duration.ofSeconds(300))))
        .thenReturn(true);

    assertTrue(publisher.publish(issue));

    ArgumentCaptor<AnomalyEvent> saved = ArgumentCaptor.forClass(AnomalyEvent.class);
    verify(repo).save(saved.capture());
    assertEquals("node-7", saved.getValue().getDeviceId());
    assertEquals("leak", saved.getValue().getAnomalyType());
    assertEquals("high", saved.getValue().getSeverity());
    assertEquals("history", saved.getValue().getSource());
    assertEquals(NOW, saved.getValue().getDetectedAt());

    ArgumentCaptor<GenericRecord> record = ArgumentCaptor.forClass(GenericRecord.class);
    verify(kafka).send(eq("detected_anomalies"), eq("node-7"), record.capture());
    assertEquals("leak", record.getValue().get("anomaly_type"));
    assertEquals(NOW.toEpochMilli(), record.getValue().get("timestamp"));
    assertEquals(1.0, metrics.counter("hydrowatch_anomalies_emitted_total").count());
  }

  @Test
  @DisplayName("Repeats inside the cooldown are dropped")
  void cooldown() {
    when(redis.opsForValue()).thenReturn(valueOps);
    when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false);

    assertFalse(publisher.publish(issue));
    verify(repo, never()).save(any());
    verify(kafka, never()).send(anyString(), anyString(), any());
    assertEquals(1.0, metrics.counter("hydrowatch_anomalies_suppressed_total", "reason", "cooldown").count());
  }

  @Test
  @DisplayName("A Redis outage does not suppress the event")
  void redisDown() {
    when(redis.opsForValue()).thenThrow(new RedisConnectionFailureException("down"));
    assertTrue(publisher.publish(issue));
    verify(repo).save(any());
  }

  @Test
  @DisplayName("A database failure still publishes to Kafka")
  void databaseDown() {
    when(redis.opsForValue()).thenReturn(valueOps);
    when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(true);
    when(repo.save(any())).thenThrow(new DataRetrievalFailureException("db down"));

    assertTrue(publisher.publish(issue));
    verify(kafka).send(eq("detected_anomalies"), eq("node-7"), any());
  }

  @Test
  @DisplayName("A Kafka failure is not propagated")
  void kafkaDown() {
    when(redis.opsForValue()).thenReturn(valueOps);
    when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(true);
    when(kafka.send(anyString(), anyString(), any())).thenThrow(new IllegalStateException("no broker"));

    assertTrue(publisher.publish(issue));
    assertEquals(0.0, metrics.counter("hydrowatch_anomalies_emitted_total").count());
  }

  @Test
  @DisplayName("Records leave missing coordinates null")
  void recordWithoutGps() {
    DetectedIssue noGps = new DetectedIssue("n", "low_flow", Severity.MEDIUM, 0.55, "Low flow",
        DetectedIssue.SOURCE_REALTIME, null, null, NOW);
    GenericRecord record = publisher.toRecord(noGps);
    assertNull(record.get("gps_lat"));
    assertEquals("medium", record.get("severity"));
    assertEquals(0.55, record.get("confidence"));
  }
}
