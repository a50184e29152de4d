package com.retrykit.spring.config;

import com.retrykit.core.errors.ExceptionTypeClassifier;
import com.retrykit.core.executor.RetryExecutor;
import com.retrykit.core.observability.LoggingRetryTelemetry;
import com.retrykit.core.observability.MicrometerRetryTelemetry;
import com.retrykit.core.observability.NoOpRetryTelemetry;
import com.retrykit.core.observability.RetryTelemetry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(RetryProperties.class)
public class RetryAutoConfiguration {
  @Bean
  @ConditionalOnMissingBean
  public BackoffPolicySupplier backoffPolicySupplier(RetryProperties properties) {
    return BackoffPolicyFactory.create(properties);
  }

  @Bean
  @ConditionalOnMissingBean
  public ExceptionTypeClassifier exceptionTypeClassifier(RetryProperties properties) {
    return BackoffPolicyFactory.createClassifier(properties);
  }

  @Bean
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(RetryTelemetry.class)
  public RetryTelemetry micrometerRetryTelemetry(
      MeterRegistry meterRegistry, RetryProperties properties) {
    return new MicrometerRetryTelemetry(meterRegistry, properties.getName());
  }

  @Bean
  @ConditionalOnMissingBean(RetryTelemetry.class)
  public RetryTelemetry retryTelemetry(RetryProperties properties) {
    String mode = properties.getTelemetry() == null ? null : properties.getTelemetry().getMode();
    if ("none".equalsIgnoreCase(mode)) {
      return new NoOpRetryTelemetry();
    }
    return new LoggingRetryTelemetry(properties.getName());
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryExecutor retryExecutor(RetryTelemetry retryTelemetry) {
    return new RetryExecutor(retryTelemetry);
  }
}
