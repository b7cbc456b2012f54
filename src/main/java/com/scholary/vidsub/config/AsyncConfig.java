package com.scholary.vidsub.config;

import com.scholary.vidsub.service.PipelineProperties;
import java.util.Map;
import java.util.concurrent.Executor;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for subtitle block rendering.
 *
 * <p>Sets up a bounded thread pool that lays out subtitle blocks in parallel. Font measurement is
 * CPU bound, so the pool size should not exceed the number of cores. Render tasks run with the
 * submitting job's MDC so their log events keep the correlation id.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "renderExecutor")
  public Executor renderExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.renderThreads());
    executor.setMaxPoolSize(properties.renderThreads());
    executor.setQueueCapacity(properties.renderQueueSize());
    executor.setThreadNamePrefix("subtitle-render-");
    executor.setTaskDecorator(mdcPropagatingDecorator());
    executor.initialize();
    return executor;
  }

  static TaskDecorator mdcPropagatingDecorator() {
    return task -> {
      Map<String, String> context = MDC.getCopyOfContextMap();
      return () -> {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (context != null) {
          MDC.setContextMap(context);
        } else {
          MDC.clear();
        }
        try {
          task.run();
        } finally {
          if (previous != null) {
            MDC.setContextMap(previous);
          } else {
            MDC.clear();
          }
        }
      };
    };
  }
}
