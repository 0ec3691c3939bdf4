package com.flamingo.ai.factextraction.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the executor that runs chunk extraction calls. */
@Configuration
public class AsyncConfig {

  @Bean(name = "factExtractionExecutor")
  public Executor factExtractionExecutor(FactExtractionConfig config) {
    FactExtractionConfig.Executor settings = config.getExecutor();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(settings.getCorePoolSize());
    executor.setMaxPoolSize(settings.getMaxPoolSize());
    executor.setQueueCapacity(settings.getQueueCapacity());
    executor.setThreadNamePrefix("fact-extract-");
    // a full queue runs the task on the submitting thread instead of failing the batch
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }
}
