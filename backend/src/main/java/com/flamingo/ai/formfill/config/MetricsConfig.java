package com.flamingo.ai.formfill.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Metrics for fill runs. Timers and counters carry the application name as a common tag. */
@Configuration
public class MetricsConfig {

  /**
   * Enables @Timed on {@code plan} and {@code fill}.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> formFillMeterTags(
      @Value("${spring.application.name:formfill}") String applicationName) {
    return registry -> registry.config().commonTags("application", applicationName);
  }
}
