package com.flamingo.ai.formfill.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for asynchronous fill runs. Each run owns one page handle. */
@Configuration
@EnableAsync
public class AsyncConfig {

  @Bean(name = "formFillExecutor")
  public Executor formFillExecutor(FormFillConfig config) {
    FormFillConfig.Execution execution = config.getExecution();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(execution.getCorePoolSize());
    executor.setMaxPoolSize(execution.getMaxPoolSize());
    executor.setQueueCapacity(execution.getQueueCapacity());
    executor.setThreadNamePrefix("form-fill-");
    executor.initialize();
    return executor;
  }
}
