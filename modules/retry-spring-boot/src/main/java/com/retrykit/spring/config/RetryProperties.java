package com.retrykit.spring.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "retry")
public class RetryProperties {
  private String name = "default";
  private String mode = "exponential";
  private long initialBackoffMs = 100L;
  private double multiplier = 2.0d;
  private long maxRetries = 3L;
  private long maxBackoffMs = 10000L;
  private long maxElapsedMs = 0L;
  private int jitterPercent = 0;
  private List<String> retryableExceptions = new ArrayList<>();
  private Telemetry telemetry = new Telemetry();

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getMode() {
    return mode;
  }

  public void setMode(String mode) {
    this.mode = mode;
  }

  public long getInitialBackoffMs() {
    return initialBackoffMs;
  }

  public void setInitialBackoffMs(long initialBackoffMs) {
    this.initialBackoffMs = initialBackoffMs;
  }

  public double getMultiplier() {
    return multiplier;
  }

  public void setMultiplier(double multiplier) {
    this.multiplier = multiplier;
  }

  public long getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(long maxRetries) {
    this.maxRetries = maxRetries;
  }

  public long getMaxBackoffMs() {
    return maxBackoffMs;
  }

  public void setMaxBackoffMs(long maxBackoffMs) {
    this.maxBackoffMs = maxBackoffMs;
  }

  public long getMaxElapsedMs() {
    return maxElapsedMs;
  }

  public void setMaxElapsedMs(long maxElapsedMs) {
    this.maxElapsedMs = maxElapsedMs;
  }

  public int getJitterPercent() {
    return jitterPercent;
  }

  public void setJitterPercent(int jitterPercent) {
    this.jitterPercent = jitterPercent;
  }

  public List<String> getRetryableExceptions() {
    return retryableExceptions;
  }

  public void setRetryableExceptions(List<String> retryableExceptions) {
    this.retryableExceptions = retryableExceptions;
  }

  public Telemetry getTelemetry() {
    return telemetry;
  }

  public void setTelemetry(Telemetry telemetry) {
    this.telemetry = telemetry;
  }

  public static class Telemetry {
    // logging | none; a MeterRegistry bean switches to Micrometer regardless
    private String mode = "logging";

    public String getMode() {
      return mode;
    }

    public void setMode(String mode) {
      this.mode = mode;
    }
  }
}
