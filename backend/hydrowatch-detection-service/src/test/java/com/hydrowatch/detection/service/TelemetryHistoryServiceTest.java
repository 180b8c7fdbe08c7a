package com.hydrowatch.detection.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.hydrowatch.detection.engine.DetectionOrchestrator;
import com.hydrowatch.detection.model.ContaminationPatternResult;
import com.hydrowatch.detection.model.DetectedIssue;
import com.hydrowatch.detection.model.HistoricalLeakResult;
import com.hydrowatch.detection.model.Severity;
import com.hydrowatch.detection.model.TelemetrySample;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.ZSetOperations;

@ExtendWith(MockitoExtension.class)
@DisplayName("TelemetryHistoryService Tests")
class TelemetryHistoryServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
  private static final String HISTORY_KEY = "telemetry:history:node-7";

  @Mock StringRedisTemplate redis;
  @Mock ListOperations<String, String> listOps;
  @Mock ZSetOperations<String, String> zsetOps;
  @Mock HashOperations<String, Object, Object> hashOps;
  @Mock ValueOperations<String, String> valueOps;
  @Mock DetectionOrchestrator orchestrator;
  @Mock AnomalyEventPublisher publisher;

  private SimpleMeterRegistry metrics;
  private TelemetryHistoryService service;

  @BeforeEach
  void setUp() {
    metrics = new SimpleMeterRegistry();
    lenient().when(redis.opsForList()).thenReturn(listOps);
    lenient().when(redis.opsForZSet()).thenReturn(zsetOps);
    lenient().when(redis.opsForHash()).thenReturn(hashOps);
    lenient().when(redis.opsForValue()).thenReturn(valueOps);
    service = new TelemetryHistoryService(redis, orchestrator, publisher, Clock.fixed(NOW, ZoneOffset.UTC),
        100, 3600, "telemetry:lastSeen", 3600, 86400, "sweep:lock", 30000, metrics);
  }

  @Test
  @DisplayName("Recording pushes the reading, trims the window and marks the device active")
  void record() {
    service.record(new TelemetrySample("node-7", 22.5, 4.5, 1.5, 23.0, null, null, -1.29, 36.82, NOW));

    verify(listOps).leftPush(HISTORY_KEY, "4.5,22.5,1.5,23.0");
    verify(listOps).trim(HISTORY_KEY, 0, 99);
    verify(redis).expire(HISTORY_KEY, Duration.ofSeconds(3600));
    verify(zsetOps).add("telemetry:lastSeen", "node-7", NOW.getEpochSecond());
    verify(hashOps).put(TelemetryHistoryService.GPS_HASH, "node-7", "-1.29,36.82");
  }

  @Test
  @DisplayName("Recording failures are swallowed and counted")
  void recordFailure() {
    when(listOps.leftPush(anyString(), anyString())).thenThrow(new RedisConnectionFailureException("down"));
    service.record(new TelemetrySample("node-7", 22.5, 4.5, 1.5, 23.0, null, null, null, null, NOW));
    assertEquals(1.0, metrics.counter("hydrowatch_history_record_failures_total").count());
  }

  @Test
  @DisplayName("History is returned oldest first and skips corrupt entries")
  void history() {
    when(listOps.range(HISTORY_KEY, 0, -1)).thenReturn(List.of(
        "3.0,21.0,1.2,22.0",
        "garbage",
        "4.0,20.0,1.1,23.0",
        "5.0,19.0,1.0,24.0"));

    DeviceHistory h = service.history("node-7");
    assertEquals(3, h.size());
    assertArrayEquals(new double[] {5.0, 4.0, 3.0}, h.pressure());
    assertArrayEquals(new double[] {19.0, 20.0, 21.0}, h.flowRate());
    assertArrayEquals(new double[] {24.0, 23.0, 22.0}, h.temperature());
  }

  @Test
  @DisplayName("A leak found in history is published with the last known position")
  void analyzePublishesLeak() {
    when(listOps.range(HISTORY_KEY, 0, -1)).thenReturn(List.of("1.0,20.0,1.0,22.0", "5.0,20.0,1.0,22.0"));
    when(hashOps.get(TelemetryHistoryService.GPS_HASH, "node-7")).thenReturn("-1.29,36.82");
    when(orchestrator.evaluateLeakHistory(any(), any())).thenReturn(new HistoricalLeakResult(true, 0.7,
        "leak suspected", new HistoricalLeakResult.LeakLocationEstimate(1, -4.0, "pressure_gradient_analysis"),
        -4.0, null, new HistoricalLeakResult.PressureStats(3.0, 2.0, 3.0)));
    when(orchestrator.evaluateContaminationPattern(any(), any()))
        .thenReturn(ContaminationPatternResult.insufficientData());
    when(publisher.publish(any())).thenReturn(true);

    assertEquals(1, service.analyzeDevice("node-7"));

    ArgumentCaptor<DetectedIssue> issue = ArgumentCaptor.forClass(DetectedIssue.class);
    verify(publisher).publish(issue.capture());
    assertEquals("leak", issue.getValue().type());
    assertEquals(Severity.HIGH, issue.getValue().severity());
    assertEquals(DetectedIssue.SOURCE_HISTORY, issue.getValue().source());
    assertEquals(-1.29, issue.getValue().gpsLat());
    assertEquals(NOW, issue.getValue().detectedAt());
  }

  @Test
  @DisplayName("A turbidity spike in history is published as contamination")
  void analyzePublishesContamination() {
    when(listOps.range(HISTORY_KEY, 0, -1)).thenReturn(List.of("4.5,22.0,9.0,22.0", "4.5,22.0,1.0,22.0"));
    when(orchestrator.evaluateLeakHistory(any(), any())).thenReturn(HistoricalLeakResult.insufficientData());
    when(orchestrator.evaluateContaminationPattern(any(), any())).thenReturn(
        new ContaminationPatternResult(true, true, false, 9.0, 1.0, null, 0.7, null));
    when(publisher.publish(any())).thenReturn(true);

    assertEquals(1, service.analyzeDevice("node-7"));

    ArgumentCaptor<DetectedIssue> issue = ArgumentCaptor.forClass(DetectedIssue.class);
    verify(publisher).publish(issue.capture());
    assertEquals("contamination", issue.getValue().type());
    assertEquals(Severity.HIGH, issue.getValue().severity());
    assertNull(issue.getValue().gpsLat());
  }

  @Test
  @DisplayName("Devices without history are skipped")
  void analyzeEmpty() {
    when(listOps.range(HISTORY_KEY, 0, -1)).thenReturn(List.of());
    assertEquals(0, service.analyzeDevice("node-7"));
    verify(orchestrator, never()).evaluateLeakHistory(any(), any());
  }

  @Test
  @DisplayName("Sweep is skipped when another instance holds the lock")
  void sweepLocked() {
    when(valueOps.setIfAbsent(eq("sweep:lock"), anyString(), any(Duration.class))).thenReturn(false);
    service.sweepHistory();
    verify(zsetOps, never()).rangeByScore(anyString(), anyDouble(), anyDouble());
  }

  @Test
  @DisplayName("Sweep visits every recently active device and releases its lock")
  void sweepVisitsActiveDevices() {
    ArgumentCaptor<String> token = ArgumentCaptor.forClass(String.class);
    when(valueOps.setIfAbsent(eq("sweep:lock"), token.capture(), any(Duration.class))).thenReturn(true);
    when(zsetOps.rangeByScore("telemetry:lastSeen", NOW.getEpochSecond() - 3600, Double.POSITIVE_INFINITY))
        .thenReturn(Set.of("node-7"));
    when(listOps.range(HISTORY_KEY, 0, -1)).thenReturn(List.of());
    when(valueOps.get("sweep:lock")).thenAnswer(inv -> token.getValue());

    service.sweepHistory();

    verify(listOps).range(HISTORY_KEY, 0, -1);
    verify(redis).delete("sweep:lock");
    assertEquals(1.0, metrics.counter("hydrowatch_history_sweep_runs_total").count());
  }

  @Test
  @DisplayName("Activity older than the retention window is trimmed")
  void trimActivity() {
    service.trimActivity();
    verify(zsetOps).removeRangeByScore("telemetry:lastSeen", Double.NEGATIVE_INFINITY, NOW.getEpochSecond() - 86400);
  }

  @Test
  @DisplayName("Entry parsing rejects malformed and non-finite values")
  void parseEntry() {
    assertArrayEquals(new double[] {1, 2, 3, 4}, TelemetryHistoryService.parseEntry("1,2,3,4"));
    assertNull(TelemetryHistoryService.parseEntry("1,2,3"));
    assertNull(TelemetryHistoryService.parseEntry("1,2,x,4"));
    assertNull(TelemetryHistoryService.parseEntry("1,2,NaN,4"));
  }
}
