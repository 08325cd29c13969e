package com.flamingo.ai.docpipeline.config;

import com.flamingo.ai.docpipeline.service.processing.DocumentLockRegistry;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation on extraction, summarization and processing methods.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> commonTags() {
    return registry -> registry.config().commonTags("application", "docpipeline");
  }

  /** Number of documents currently held by a processing attempt. */
  @Bean
  public MeterBinder inFlightDocuments(DocumentLockRegistry lockRegistry) {
    return registry ->
        Gauge.builder(
                "document.processing.in_flight", lockRegistry, DocumentLockRegistry::lockedCount)
            .description("Documents with a processing attempt in progress")
            .register(registry);
  }
}
