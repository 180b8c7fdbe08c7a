package com.hydrowatch.detection.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hydrowatch.detection.controller.TelemetryRequestValidator;
import com.hydrowatch.detection.controller.dto.AnalyzeRequest;
import com.hydrowatch.detection.exception.InvalidInputException;
import com.hydrowatch.detection.service.DetectionService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.stream.StreamMessageListenerContainer;
import org.springframework.stereotype.Component;

/**
 * Reads telemetry from a Redis Stream (field {@code payload}, same JSON as {@code POST /api/analyze})
 * and runs each record through the detection pipeline.
 */
@Component
@Profile("redis-ingest")
public class TelemetryStreamConsumer {

  private static final Logger log = LoggerFactory.getLogger(TelemetryStreamConsumer.class);

  private final RedisConnectionFactory connectionFactory;
  private final StringRedisTemplate redisTemplate;
  private final DetectionService detection;
  private final TelemetryRequestValidator validator;
  private final ObjectMapper objectMapper;
  private final Counter messagesConsumed;
  private final Counter messagesRejected;
  private final Counter messagesFailed;
  private StreamMessageListenerContainer<String, MapRecord<String, String, String>> container;

  @Value("${hydrowatch.redis.stream.name:telemetry_raw}")
  private String streamName;

  @Value("${hydrowatch.redis.stream.group:hydrowatch-detection}")
  private String group;

  @Value("${hydrowatch.redis.stream.consumer:detector-1}")
  private String consumerName;

  public TelemetryStreamConsumer(RedisConnectionFactory connectionFactory,
                                 StringRedisTemplate redisTemplate,
                                 DetectionService detection,
                                 TelemetryRequestValidator validator,
                                 ObjectMapper objectMapper,
                                 MeterRegistry meterRegistry) {
    this.connectionFactory = connectionFactory;
    this.redisTemplate = redisTemplate;
    this.detection = detection;
    this.validator = validator;
    this.objectMapper = objectMapper;
    this.messagesConsumed = meterRegistry.counter("hydrowatch_stream_messages_consumed_total");
    this.messagesRejected = meterRegistry.counter("hydrowatch_stream_messages_rejected_total");
    this.messagesFailed = meterRegistry.counter("hydrowatch_stream_messages_failed_total");
  }

  @PostConstruct
  public void start() {
    ensureGroup();

    StreamMessageListenerContainer.StreamMessageListenerContainerOptions<String, MapRecord<String, String, String>> options =
        StreamMessageListenerContainer.StreamMessageListenerContainerOptions
            .builder()
            .pollTimeout(Duration.ofSeconds(1))
            .build();

    container = StreamMessageListenerContainer.create(connectionFactory, options);
    container.receiveAutoAck(Consumer.from(group, consumerName),
        StreamOffset.create(streamName, ReadOffset.lastConsumed()),
        message -> handle(message.getId().getValue(), message.getValue().get("payload")));
    container.start();
    log.info("Redis stream consumer started: stream='{}', group='{}', consumer='{}'", streamName, group, consumerName);
  }

  @PreDestroy
  public void stop() {
    if (container != null) container.stop();
  }

  void handle(String recordId, String payload) {
    if (payload == null) return;
    try {
      AnalyzeRequest request = objectMapper.readValue(payload, AnalyzeRequest.class);
      detection.analyze(validator.toSample(request));
      messagesConsumed.increment();
    } catch (InvalidInputException e) {
      messagesRejected.increment();
      log.warn("Rejected stream record {}: {}", recordId, e.getMessage());
    } catch (Exception e) {
      messagesFailed.increment();
      log.warn("Failed to process stream record {}: {}", recordId, e.getMessage());
    }
  }

  // Equivalent to: XGROUP CREATE stream group 0-0 MKSTREAM
  private void ensureGroup() {
    try {
      var groups = redisTemplate.opsForStream().groups(streamName);
      if (groups.stream().anyMatch(g -> group.equals(g.groupName()))) {
        log.info("Redis Stream group '{}' already exists on '{}'", group, streamName);
        return;
      }
      redisTemplate.opsForStream().createGroup(streamName, ReadOffset.from("0-0"), group);
      log.info("Created Redis Stream group '{}' on '{}'", group, streamName);
    } catch (Exception e) {
      String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      if (msg.contains("BUSYGROUP")) {
        log.info("Redis Stream group '{}' already exists on '{}' (BUSYGROUP)", group, streamName);
      } else if (msg.contains("no such key") || msg.contains("ERR")) {
        createWithStream();
      } else {
        log.warn("Could not ensure Redis Stream group '{}' on '{}': {}", group, streamName, msg);
      }
    }
  }

  private void createWithStream() {
    try {
      redisTemplate.opsForStream().add(MapRecord.create(streamName, Map.of("meta", "init")));
      redisTemplate.opsForStream().createGroup(streamName, ReadOffset.from("0-0"), group);
      log.info("Created Redis Stream '{}' with group '{}'", streamName, group);
    } catch (Exception e) {
      log.warn("Could not create Redis Stream '{}': {}", streamName, e.getMessage());
    }
  }
}
