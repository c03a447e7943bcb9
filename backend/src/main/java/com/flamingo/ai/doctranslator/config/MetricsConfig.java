package com.flamingo.ai.doctranslator.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for pipeline metrics. */
@Configuration
public class MetricsConfig {

  /** Turns {@code @Timed} on extraction, translation and tracker methods into timers. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
