package com.flamingo.ai.semanticquery.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.config.MeterFilter;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for extraction metrics. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation on the query service.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Tags every meter with the application name. */
  @Bean
  public MeterFilter applicationTagFilter(
      @Value("${spring.application.name:semantic-query}") String applicationName) {
    return MeterFilter.commonTags(List.of(Tag.of("application", applicationName)));
  }
}
