package com.hydrowatch.detection;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class HydroWatchDetectionApplication {
  public static void main(String[] args) {
    SpringApplication.run(HydroWatchDetectionApplication.class, args);
  }
}
