package com.hydrowatch.detection.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(
  name = "anomalies",
  indexes = {
    @Index(name = "idx_anomalies_detected_at", columnList = "detectedAt DESC"),
    @Index(name = "idx_anomalies_device_detected_at", columnList = "deviceId,detectedAt DESC")
  }
)
public class AnomalyEvent {
  @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false) private String deviceId;
  @Column(nullable = false) private String anomalyType;
  @Column(nullable = false) private String severity;
  @Column(nullable = false) private double confidence;
  @Column(length = 512) private String description;
  @Column(nullable = false) private String source;
  private Double gpsLat;
  private Double gpsLon;
  @Column(nullable = false) private Instant detectedAt;

  public Long getId() { return id; }
  public String getDeviceId() { return deviceId; }
  public void setDeviceId(String deviceId) { this.deviceId = deviceId; }
  public String getAnomalyType() { return anomalyType; }
  public void setAnomalyType(String anomalyType) { this.anomalyType = anomalyType; }
  public String getSeverity() { return severity; }
  public void setSeverity(String severity) { this.severity = severity; }
  public double getConfidence() { return confidence; }
  public void setConfidence(double confidence) { this.confidence = confidence; }
  public String getDescription() { return description; }
  public void setDescription(String description) { this.description = description; }
  public String getSource() { return source; }
  public void setSource(String source) { this.source = source; }
  public Double getGpsLat() { return gpsLat; }
  public void setGpsLat(Double gpsLat) { this.gpsLat = gpsLat; }
  public Double getGpsLon() { return gpsLon; }
  public void setGpsLon(Double gpsLon) { this.gpsLon = gpsLon; }
  public Instant getDetectedAt() { return detectedAt; }
  public void setDetectedAt(Instant detectedAt) { this.detectedAt = detectedAt; }
}
